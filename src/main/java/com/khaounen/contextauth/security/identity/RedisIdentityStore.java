package com.khaounen.contextauth.security.identity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.contextauth.security.token.ResetToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Shared store for multi-node deployments. Records are JSON documents; updates
 * use WATCH/MULTI/EXEC and retry when another writer commits first. Reset
 * tokens are indexed under their own keys, expiring with the token.
 */
@Slf4j
public class RedisIdentityStore implements IdentityStore {

    private static final String IDENTITY_PREFIX = "context-auth:identity:";
    private static final String RESET_PREFIX = "context-auth:reset:";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxAttempts;

    public RedisIdentityStore(StringRedisTemplate redis, ObjectMapper objectMapper, Clock clock, int maxAttempts) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    @Override
    public Optional<UserIdentity> find(String email) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(identityKey(email))).map(this::read);
        } catch (DataAccessException ex) {
            throw new IdentityStoreException("identity lookup failed", ex);
        }
    }

    @Override
    public Optional<UserIdentity> findByResetToken(String token) {
        String email;
        try {
            email = redis.opsForValue().get(RESET_PREFIX + token);
        } catch (DataAccessException ex) {
            throw new IdentityStoreException("reset token lookup failed", ex);
        }
        if (email == null) {
            return Optional.empty();
        }
        return find(email).filter(identity -> identity.resetTokenMatching(token).isPresent());
    }

    @Override
    public boolean create(UserIdentity identity) {
        try {
            Boolean created = redis.opsForValue().setIfAbsent(identityKey(identity.getEmail()), write(identity));
            if (Boolean.TRUE.equals(created)) {
                indexResetTokens(redis, identity);
                return true;
            }
            return false;
        } catch (DataAccessException ex) {
            throw new IdentityStoreException("identity create failed", ex);
        }
    }

    @Override
    public Optional<UserIdentity> update(String email, UnaryOperator<UserIdentity> mutation) {
        String key = identityKey(email);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Attempt result;
            try {
                result = redis.execute(new SessionCallback<Attempt>() {
                    @Override
                    @SuppressWarnings("unchecked")
                    public <K, V> Attempt execute(RedisOperations<K, V> operations) throws DataAccessException {
                        RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                        ops.watch(key);
                        String json = ops.opsForValue().get(key);
                        if (json == null) {
                            ops.unwatch();
                            return Attempt.MISSING;
                        }
                        UserIdentity current = read(json);
                        UserIdentity next = mutation.apply(current);
                        if (next == current) {
                            ops.unwatch();
                            return new Attempt(true, current);
                        }
                        next = next.toBuilder().version(current.getVersion() + 1).build();
                        ops.multi();
                        ops.opsForValue().set(key, write(next));
                        indexResetTokens(ops, next);
                        List<Object> committed = ops.exec();
                        return committed == null || committed.isEmpty() ? Attempt.CONFLICT : new Attempt(true, next);
                    }
                });
            } catch (DataAccessException ex) {
                throw new IdentityStoreException("identity update failed", ex);
            }
            if (result == null || result == Attempt.MISSING) {
                return Optional.empty();
            }
            if (result.committed()) {
                return Optional.of(result.identity());
            }
            log.debug("optimistic update conflict for identity, attempt {}", attempt);
        }
        throw new IdentityStoreException("identity update kept conflicting after " + maxAttempts + " attempts");
    }

    private void indexResetTokens(RedisOperations<String, String> ops, UserIdentity identity) {
        for (ResetToken token : identity.getResetTokens().values()) {
            Duration ttl = Duration.between(clock.instant(), token.expiresAt());
            if (!ttl.isNegative() && !ttl.isZero()) {
                ops.opsForValue().set(RESET_PREFIX + token.token(), identity.getEmail(), ttl);
            }
        }
    }

    private UserIdentity read(String json) {
        try {
            return objectMapper.readValue(json, UserIdentity.class);
        } catch (JsonProcessingException ex) {
            throw new IdentityStoreException("identity record is not readable", ex);
        }
    }

    private String write(UserIdentity identity) {
        try {
            return objectMapper.writeValueAsString(identity);
        } catch (JsonProcessingException ex) {
            throw new IdentityStoreException("identity record is not writable", ex);
        }
    }

    private static String identityKey(String email) {
        return IDENTITY_PREFIX + email;
    }

    private record Attempt(boolean committed, UserIdentity identity) {
        private static final Attempt MISSING = new Attempt(false, null);
        private static final Attempt CONFLICT = new Attempt(false, null);
    }
}
