package com.khaounen.contextauth.security.risk;

import com.khaounen.contextauth.security.auth.ContextAuthProperties;
import com.khaounen.contextauth.security.context.GeoPoint;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class RiskChecks {

    private RiskChecks() {
    }

    public static List<RiskCheck> defaults(ContextAuthProperties.Risk risk) {
        return List.of(
                unknownDevice(risk.getUnknownDeviceWeight()),
                unknownIp(risk.getUnknownIpWeight()),
                location(
                        risk.getLocationRadiusKm(),
                        risk.getRegionalLocationWeight(),
                        risk.getDistantLocationKm(),
                        risk.getDistantLocationWeight()
                ),
                loginHour(risk.getHourAnomalyWeight()),
                typingSpeed(risk.getTypingTolerance(), risk.getTypingAnomalyWeight())
        );
    }

    public static RiskCheck unknownDevice(int weight) {
        return (context, store) -> {
            if (store.getTrustedDevices().isEmpty() || store.isDeviceTrusted(context.device())) {
                return Optional.empty();
            }
            return Optional.of(RiskFactor.of(RiskSignal.DEVICE_UNKNOWN, weight));
        };
    }

    public static RiskCheck unknownIp(int weight) {
        return (context, store) -> {
            if (store.getTrustedIps().isEmpty() || store.isIpTrusted(context.ip())) {
                return Optional.empty();
            }
            return Optional.of(RiskFactor.of(RiskSignal.IP_UNKNOWN, weight));
        };
    }

    /**
     * Distance to the nearest known location decides the tier. A distant login
     * never weighs less than a regional one.
     */
    public static RiskCheck location(double radiusKm, int regionalWeight, double distantKm, int distantWeight) {
        int regional = Math.max(0, regionalWeight);
        int distant = Math.max(regional, distantWeight);
        double distantThreshold = Math.max(radiusKm, distantKm);
        return (context, store) -> {
            List<GeoPoint> known = store.getKnownLocations();
            if (known.isEmpty()) {
                return Optional.empty();
            }
            double nearest = Double.MAX_VALUE;
            for (GeoPoint point : known) {
                nearest = Math.min(nearest, point.distanceKm(context.location()));
            }
            if (nearest <= radiusKm) {
                return Optional.empty();
            }
            if (nearest > distantThreshold) {
                return Optional.of(RiskFactor.location(LocationTier.DISTANT, distant));
            }
            return Optional.of(RiskFactor.location(LocationTier.REGIONAL, regional));
        };
    }

    public static RiskCheck loginHour(int weight) {
        return (context, store) -> {
            Set<Integer> hours = store.getBaseline().getTypicalLoginHours();
            if (hours.isEmpty() || hours.contains(context.loginHour())) {
                return Optional.empty();
            }
            return Optional.of(RiskFactor.of(RiskSignal.HOUR_ANOMALY, weight));
        };
    }

    /**
     * @param tolerance relative deviation allowed around the baseline, e.g. 0.3 for +/-30%
     */
    public static RiskCheck typingSpeed(double tolerance, int weight) {
        double band = Math.max(0.0, tolerance);
        return (context, store) -> {
            Double baseline = store.getBaseline().getTypingSpeed();
            Double observed = context.typingSpeed();
            if (baseline == null || baseline <= 0 || observed == null) {
                return Optional.empty();
            }
            if (Math.abs(observed - baseline) / baseline <= band) {
                return Optional.empty();
            }
            return Optional.of(RiskFactor.of(RiskSignal.TYPING_ANOMALY, weight));
        };
    }
}
