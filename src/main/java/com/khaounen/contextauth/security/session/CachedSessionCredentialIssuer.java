package com.khaounen.contextauth.security.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.khaounen.contextauth.utils.Hex;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Random opaque session ids kept in a local Caffeine cache until they expire.
 */
public class CachedSessionCredentialIssuer implements CredentialIssuer {

    private static final int SESSION_ID_BYTES = 32;

    private final Clock clock;
    private final SecureRandom random;
    private final Duration ttl;
    private final Cache<String, SessionCredential> sessions;

    public CachedSessionCredentialIssuer(Clock clock, SecureRandom random, Duration ttl, long maximumSize) {
        this.clock = clock;
        this.random = random;
        this.ttl = ttl;
        this.sessions = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(Math.max(1, maximumSize))
                .build();
    }

    @Override
    public SessionCredential issueSession(String userId) {
        byte[] bytes = new byte[SESSION_ID_BYTES];
        random.nextBytes(bytes);
        SessionCredential credential = new SessionCredential(Hex.encode(bytes), userId, clock.instant().plus(ttl));
        sessions.put(credential.sessionId(), credential);
        return credential;
    }

    @Override
    public Optional<SessionCredential> resolve(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        SessionCredential credential = sessions.getIfPresent(sessionId);
        if (credential == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(credential.expiresAt())) {
            sessions.invalidate(sessionId);
            return Optional.empty();
        }
        return Optional.of(credential);
    }
}
