package com.khaounen.contextauth.security.context;

import java.time.Instant;
import java.util.Objects;

/**
 * The evidence observed for one login attempt.
 *
 * @param typingSpeed characters per second, or {@code null} when the client sent no typing signal
 */
public record LoginContext(
        String ip,
        String device,
        GeoPoint location,
        Double typingSpeed,
        int loginHour,
        Instant timestamp
) {
    public LoginContext {
        Objects.requireNonNull(ip, "ip");
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(timestamp, "timestamp");
        if (loginHour < 0 || loginHour > 23) {
            throw new IllegalArgumentException("loginHour must be within 0..23");
        }
    }
}
