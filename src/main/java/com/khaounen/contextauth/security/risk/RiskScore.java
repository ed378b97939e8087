package com.khaounen.contextauth.security.risk;

import java.util.List;

public record RiskScore(List<RiskFactor> factors) {

    public RiskScore {
        factors = factors == null ? List.of() : List.copyOf(factors);
    }

    public int total() {
        return factors.stream().mapToInt(RiskFactor::weight).sum();
    }

    public boolean has(RiskSignal signal) {
        return factors.stream().anyMatch(f -> f.signal() == signal);
    }
}
