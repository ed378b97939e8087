package com.khaounen.contextauth.security.auth;

import com.khaounen.contextauth.security.context.ContextPayload;
import com.khaounen.contextauth.security.context.LoginContextCapture;
import com.khaounen.contextauth.security.identity.InMemoryIdentityStore;
import com.khaounen.contextauth.security.risk.DefaultRiskScorer;
import com.khaounen.contextauth.security.risk.RiskChecks;
import com.khaounen.contextauth.security.session.CachedSessionCredentialIssuer;
import com.khaounen.contextauth.security.token.TokenLifecycleManager;
import com.khaounen.contextauth.security.trust.ProfileUpdater;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Wires the services the way the auto-configuration does, with in-memory and
 * recording collaborators.
 */
final class AuthFixture {

    static final String EMAIL = "ada@example.com";
    static final String PASSWORD = "correct horse";
    static final String IP = "1.2.3.4";
    static final String DEVICE = "chrome-macos-abc";
    static final double NYC_LAT = 40.7128;
    static final double NYC_LON = -74.0060;
    static final double BOSTON_LAT = 42.3601;
    static final double BOSTON_LON = -71.0589;

    final ContextAuthProperties properties = new ContextAuthProperties();
    final MutableClock clock = new MutableClock(Instant.parse("2026-01-15T14:00:00Z"));
    final InMemoryIdentityStore store = new InMemoryIdentityStore();
    final RecordingNotifier notifier = new RecordingNotifier();
    final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    final TokenLifecycleManager tokens = new TokenLifecycleManager(clock, new SecureRandom(), 6, 20);
    final CachedSessionCredentialIssuer credentials =
            new CachedSessionCredentialIssuer(clock, new SecureRandom(), Duration.ofDays(7), 1000);
    final NotificationDispatcher notifications = new NotificationDispatcher(notifier, Runnable::run);

    ContextAuthenticationService authentication() {
        return new ContextAuthenticationService(
                properties,
                store,
                new LoginContextCapture(clock, ZoneOffset.UTC),
                new DefaultRiskScorer(RiskChecks.defaults(properties.getRisk())),
                new DecisionPolicy(properties.getPolicy().getMfaThreshold(), properties.getPolicy().getBlockThreshold()),
                new ProfileUpdater(50, 100, 0.2),
                tokens,
                passwordEncoder,
                captcha -> !"bot".equals(captcha),
                (lat, lon) -> "New York",
                credentials,
                notifications
        );
    }

    AccountTokenService accountTokens() {
        return new AccountTokenService(properties, store, tokens, passwordEncoder, notifications);
    }

    SignupResult signup(ContextAuthenticationService service) {
        return service.signup(new SignupRequest(EMAIL, PASSWORD, "Ada", context(IP, DEVICE, NYC_LAT, NYC_LON, 14), "ok"));
    }

    static LoginRequest login(ContextPayload context) {
        return new LoginRequest(EMAIL, PASSWORD, context, "ok");
    }

    static ContextPayload context(String ip, String device, double lat, double lon, int hour) {
        return new ContextPayload(ip, device, new ContextPayload.Location(lat, lon), 5.0, hour);
    }
}
