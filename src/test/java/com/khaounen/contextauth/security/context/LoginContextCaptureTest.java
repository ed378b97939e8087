package com.khaounen.contextauth.security.context;

import com.khaounen.contextauth.config.RequestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LoginContextCaptureTest {

    private static final Instant NOW = Instant.parse("2026-01-15T14:30:00Z");

    private final LoginContextCapture capture =
            new LoginContextCapture(Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.UTC);

    @AfterEach
    void clearRequestContext() {
        RequestContext.clear();
    }

    @Test
    void capturesSubmittedSignals() {
        LoginContext context = capture.capture(payload(" 1.2.3.4 ", "laptop", 40.7, -74.0, 5.5, 9));

        assertEquals("1.2.3.4", context.ip());
        assertEquals("laptop", context.device());
        assertEquals(new GeoPoint(40.7, -74.0), context.location());
        assertEquals(5.5, context.typingSpeed());
        assertEquals(9, context.loginHour());
        assertEquals(NOW, context.timestamp());
    }

    @Test
    void fallsBackToRequestAddress() {
        RequestContext.setIp("9.9.9.9");

        assertEquals("9.9.9.9", capture.capture(payload(null, "laptop", 0, 0, 5.0, 9)).ip());
    }

    @Test
    void derivesHourFromClockInConfiguredZone() {
        assertEquals(14, capture.capture(payload("1.2.3.4", "laptop", 0, 0, 5.0, null)).loginHour());

        LoginContextCapture tokyo = new LoginContextCapture(Clock.fixed(NOW, ZoneOffset.UTC), ZoneId.of("Asia/Tokyo"));
        assertEquals(23, tokyo.capture(payload("1.2.3.4", "laptop", 0, 0, 5.0, null)).loginHour());
    }

    @Test
    void nonPositiveTypingSpeedIsTreatedAsMissing() {
        assertNull(capture.capture(payload("1.2.3.4", "laptop", 0, 0, 0.0, 9)).typingSpeed());
        assertNull(capture.capture(payload("1.2.3.4", "laptop", 0, 0, Double.NaN, 9)).typingSpeed());
        assertNull(capture.capture(payload("1.2.3.4", "laptop", 0, 0, null, 9)).typingSpeed());
    }

    @Test
    void rejectsIncompleteContext() {
        assertThrows(InvalidLoginRequestException.class, () -> capture.capture(null));
        assertThrows(InvalidLoginRequestException.class,
                () -> capture.capture(payload(null, "laptop", 0, 0, 5.0, 9)));
        assertThrows(InvalidLoginRequestException.class,
                () -> capture.capture(payload("1.2.3.4", " ", 0, 0, 5.0, 9)));

        ContextPayload noLocation = payload("1.2.3.4", "laptop", 0, 0, 5.0, 9);
        noLocation.setLocation(null);
        assertThrows(InvalidLoginRequestException.class, () -> capture.capture(noLocation));
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(InvalidLoginRequestException.class,
                () -> capture.capture(payload("1.2.3.4", "laptop", 91, 0, 5.0, 9)));
        assertThrows(InvalidLoginRequestException.class,
                () -> capture.capture(payload("1.2.3.4", "laptop", 0, -181, 5.0, 9)));
        assertThrows(InvalidLoginRequestException.class,
                () -> capture.capture(payload("1.2.3.4", "laptop", 0, 0, 5.0, 24)));
    }

    private static ContextPayload payload(String ip, String device, double lat, double lon, Double typing, Integer hour) {
        return new ContextPayload(ip, device, new ContextPayload.Location(lat, lon), typing, hour);
    }
}
