package com.khaounen.contextauth.security.auth;

import com.khaounen.contextauth.security.session.SessionCredential;

import java.util.Optional;

/**
 * @param session only present when {@link LoginOutcome#ALLOWED}
 */
public record LoginDecision(
        LoginOutcome outcome,
        int riskScore,
        String message,
        SessionCredential session
) {

    static final String BLOCKED_MESSAGE =
            "Suspicious activity detected, login blocked for your security. Check your email for details.";
    static final String INVALID_CODE_MESSAGE = "Invalid or expired verification code";

    public static LoginDecision allowed(int riskScore, SessionCredential session) {
        return new LoginDecision(LoginOutcome.ALLOWED, riskScore, "Logged in successfully", session);
    }

    public static LoginDecision secondFactorRequired(int riskScore) {
        return new LoginDecision(LoginOutcome.SECOND_FACTOR_REQUIRED, riskScore,
                "Two-factor authentication required", null);
    }

    public static LoginDecision blocked(int riskScore) {
        return new LoginDecision(LoginOutcome.BLOCKED, riskScore, BLOCKED_MESSAGE, null);
    }

    public static LoginDecision rejected(String message) {
        return new LoginDecision(LoginOutcome.REJECTED, 0, message, null);
    }

    public Optional<SessionCredential> sessionCredential() {
        return Optional.ofNullable(session);
    }
}
