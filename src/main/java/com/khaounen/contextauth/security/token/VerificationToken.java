package com.khaounen.contextauth.security.token;

import java.time.Instant;

public record VerificationToken(String code, Instant expiresAt, TokenPurpose purpose) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
