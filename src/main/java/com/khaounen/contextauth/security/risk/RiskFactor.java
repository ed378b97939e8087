package com.khaounen.contextauth.security.risk;

import java.util.Objects;

/**
 * One triggered signal and the weight it contributes.
 *
 * @param tier only set for {@link RiskSignal#LOCATION_ANOMALY}
 */
public record RiskFactor(RiskSignal signal, LocationTier tier, int weight) {

    public RiskFactor {
        Objects.requireNonNull(signal, "signal");
        weight = Math.max(0, weight);
    }

    public static RiskFactor of(RiskSignal signal, int weight) {
        return new RiskFactor(signal, null, weight);
    }

    public static RiskFactor location(LocationTier tier, int weight) {
        return new RiskFactor(RiskSignal.LOCATION_ANOMALY, Objects.requireNonNull(tier, "tier"), weight);
    }
}
