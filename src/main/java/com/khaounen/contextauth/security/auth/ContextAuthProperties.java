package com.khaounen.contextauth.security.auth;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

@Data
@ConfigurationProperties(prefix = "context-auth")
public class ContextAuthProperties {

    private ZoneId loginZone = ZoneOffset.UTC;
    private Risk risk = new Risk();
    private Policy policy = new Policy();
    private Tokens tokens = new Tokens();
    private Profile profile = new Profile();
    private Captcha captcha = new Captcha();
    private Geolocation geolocation = new Geolocation();
    private Alert alert = new Alert();
    private Session session = new Session();

    @Data
    public static class Risk {
        private int unknownDeviceWeight = 3;
        private int unknownIpWeight = 2;
        private int hourAnomalyWeight = 2;
        private int typingAnomalyWeight = 1;
        /** Logins within this distance of any known location carry no location weight. */
        private double locationRadiusKm = 50;
        private int regionalLocationWeight = 3;
        private double distantLocationKm = 1000;
        private int distantLocationWeight = 5;
        /** Relative deviation from the typing baseline tolerated before it counts as an anomaly. */
        private double typingTolerance = 0.3;
    }

    @Data
    public static class Policy {
        private int mfaThreshold = 5;
        private int blockThreshold = 10;
        private boolean foldBeforeSecondFactor = true;
    }

    @Data
    public static class Tokens {
        private Duration twoFactorTtl = Duration.ofMinutes(5);
        private Duration emailVerificationTtl = Duration.ofMinutes(1);
        private Duration resetTtl = Duration.ofMinutes(30);
        private int codeLength = 6;
        private int resetTokenBytes = 20;
    }

    @Data
    public static class Profile {
        private int maxKnownLocations = 50;
        private int maxContextLog = 100;
        private double typingSmoothing = 0.2;
    }

    @Data
    public static class Captcha {
        private boolean enabled = true;
        private String secret;
        private String verifyUrl = "https://www.google.com/recaptcha/api/siteverify";
        private Duration timeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Geolocation {
        private boolean enabled = true;
        private String reverseUrl = "https://nominatim.openstreetmap.org/reverse";
        private String userAgent = "context-auth-starter";
        private Duration timeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Alert {
        private String clientUrl = "http://localhost:5173";
        private Webhook webhook = new Webhook();
        private Mail mail = new Mail();
    }

    @Data
    public static class Webhook {
        private boolean enabled = false;
        private String url;
        private int connectTimeoutMs = 1000;
        private int timeoutMs = 2000;
        private boolean includeContext = true;
    }

    @Data
    public static class Mail {
        private boolean enabled = true;
        private String from;
        private String subjectPrefix = "[Security]";
    }

    @Data
    public static class Session {
        private Duration ttl = Duration.ofDays(7);
        private long maximumSize = 100_000;
    }
}
