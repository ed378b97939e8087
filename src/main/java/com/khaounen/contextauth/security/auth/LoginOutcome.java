package com.khaounen.contextauth.security.auth;

public enum LoginOutcome {
    ALLOWED,
    SECOND_FACTOR_REQUIRED,
    BLOCKED,
    REJECTED
}
