package com.khaounen.contextauth.security.risk;

import com.khaounen.contextauth.security.context.LoginContext;
import com.khaounen.contextauth.security.trust.TrustStore;

public interface RiskScorer {
    RiskScore score(LoginContext context, TrustStore store);
}
