package com.khaounen.contextauth.security.token;

import java.time.Instant;

public record ResetToken(String token, Instant expiresAt, ResetReason reason) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
