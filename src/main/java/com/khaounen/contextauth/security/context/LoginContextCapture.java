package com.khaounen.contextauth.security.context;

import com.khaounen.contextauth.config.RequestContext;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Normalizes submitted signals into a {@link LoginContext}.
 */
public class LoginContextCapture {

    private final Clock clock;
    private final ZoneId loginZone;

    public LoginContextCapture(Clock clock, ZoneId loginZone) {
        this.clock = clock;
        this.loginZone = loginZone;
    }

    public LoginContext capture(ContextPayload payload) {
        if (payload == null) {
            throw new InvalidLoginRequestException("Login context is required!");
        }
        String ip = StringUtils.hasText(payload.getIp()) ? payload.getIp().trim() : RequestContext.getIp();
        if (!StringUtils.hasText(ip)) {
            throw new InvalidLoginRequestException("Context ip is required!");
        }
        if (!StringUtils.hasText(payload.getDevice())) {
            throw new InvalidLoginRequestException("Context device is required!");
        }
        GeoPoint location = location(payload.getLocation());

        Instant now = clock.instant();
        int hour = payload.getLoginHour() != null
                ? payload.getLoginHour()
                : now.atZone(loginZone).getHour();
        if (hour < 0 || hour > 23) {
            throw new InvalidLoginRequestException("Context loginHour must be within 0..23");
        }

        Double typingSpeed = payload.getTypingSpeed();
        if (typingSpeed != null && (typingSpeed.isNaN() || typingSpeed <= 0)) {
            typingSpeed = null;
        }
        return new LoginContext(ip.trim(), payload.getDevice().trim(), location, typingSpeed, hour, now);
    }

    private static GeoPoint location(ContextPayload.Location location) {
        if (location == null || location.getLatitude() == null || location.getLongitude() == null) {
            throw new InvalidLoginRequestException("Context location is required!");
        }
        double lat = location.getLatitude();
        double lon = location.getLongitude();
        if (Double.isNaN(lat) || lat < -90 || lat > 90 || Double.isNaN(lon) || lon < -180 || lon > 180) {
            throw new InvalidLoginRequestException("Context location is out of range");
        }
        return new GeoPoint(lat, lon);
    }
}
