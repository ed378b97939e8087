package com.khaounen.contextauth.security.risk;

import com.khaounen.contextauth.security.context.LoginContext;
import com.khaounen.contextauth.security.trust.TrustStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Sums the weights of every triggered {@link RiskCheck}.
 */
public class DefaultRiskScorer implements RiskScorer {

    private final List<RiskCheck> checks;

    public DefaultRiskScorer(List<RiskCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    @Override
    public RiskScore score(LoginContext context, TrustStore store) {
        TrustStore effective = store == null ? TrustStore.empty() : store;
        List<RiskFactor> factors = new ArrayList<>();
        for (RiskCheck check : checks) {
            check.evaluate(context, effective).ifPresent(factors::add);
        }
        return new RiskScore(factors);
    }
}
