package com.khaounen.contextauth.security.session;

import java.time.Instant;

/**
 * Opaque session artifact handed back to the caller after a successful login.
 */
public record SessionCredential(String sessionId, String userId, Instant expiresAt) {
}
