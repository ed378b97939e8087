package com.khaounen.contextauth.security.risk;

import com.khaounen.contextauth.security.context.LoginContext;
import com.khaounen.contextauth.security.trust.TrustStore;

import java.util.Optional;

/**
 * A single, independently evaluable anomaly check. Implementations must be
 * side-effect free and must report nothing when the store has no baseline for
 * their signal yet.
 */
@FunctionalInterface
public interface RiskCheck {
    Optional<RiskFactor> evaluate(LoginContext context, TrustStore store);
}
