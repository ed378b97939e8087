package com.khaounen.contextauth.security.trust;

import com.khaounen.contextauth.security.context.LoginContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds an observed login context into a {@link TrustStore}. Every operation
 * returns a new store and leaves its argument untouched, so a fold can be
 * replayed against a fresher copy when a concurrent update wins.
 */
public class ProfileUpdater {

    private final int maxKnownLocations;
    private final int maxContextLog;
    private final double typingSmoothing;

    public ProfileUpdater(int maxKnownLocations, int maxContextLog, double typingSmoothing) {
        this.maxKnownLocations = Math.max(1, maxKnownLocations);
        this.maxContextLog = Math.max(1, maxContextLog);
        this.typingSmoothing = Math.min(1.0, Math.max(0.0, typingSmoothing));
    }

    /**
     * The store for a brand-new account, seeded from its first context with a
     * score of zero.
     */
    public TrustStore seed(LoginContext context, String locationName) {
        return fold(TrustStore.empty(), context, locationName, 0);
    }

    public TrustStore fold(TrustStore store, LoginContext context, String locationName, int riskScore) {
        ContextLogEntry entry = new ContextLogEntry(
                context.ip(),
                context.device(),
                context.location(),
                locationName,
                context.timestamp(),
                riskScore
        );
        return store.toBuilder()
                .trustedIps(with(store.getTrustedIps(), context.ip()))
                .trustedDevices(with(store.getTrustedDevices(), context.device()))
                .knownLocations(appendBounded(store.getKnownLocations(), context.location(), maxKnownLocations))
                .baseline(incorporate(store.getBaseline(), context))
                .contextLog(appendBounded(store.getContextLog(), entry, maxContextLog))
                .riskScore(riskScore)
                .build();
    }

    private BehavioralBaseline incorporate(BehavioralBaseline baseline, LoginContext context) {
        Double typingSpeed = baseline.getTypingSpeed();
        if (context.typingSpeed() != null) {
            typingSpeed = typingSpeed == null
                    ? context.typingSpeed()
                    : typingSpeed * (1 - typingSmoothing) + context.typingSpeed() * typingSmoothing;
        }
        return baseline.toBuilder()
                .typingSpeed(typingSpeed)
                .typicalLoginHours(with(baseline.getTypicalLoginHours(), context.loginHour()))
                .build();
    }

    private static <T> Set<T> with(Set<T> values, T value) {
        if (values.contains(value)) {
            return values;
        }
        Set<T> copy = new LinkedHashSet<>(values);
        copy.add(value);
        return Collections.unmodifiableSet(copy);
    }

    // Keeps the most recent entries only.
    private static <T> List<T> appendBounded(List<T> values, T value, int max) {
        List<T> copy = new ArrayList<>(values.size() + 1);
        copy.addAll(values);
        copy.add(value);
        if (copy.size() > max) {
            copy = copy.subList(copy.size() - max, copy.size());
        }
        return List.copyOf(copy);
    }
}
