package com.khaounen.contextauth.security.identity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.khaounen.contextauth.security.token.ResetReason;
import com.khaounen.contextauth.security.token.ResetToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisIdentityStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-15T14:00:00Z");
    private static final String EMAIL = "ada@example.com";
    private static final String KEY = "context-auth:identity:" + EMAIL;

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private StringRedisTemplate redis;
    private RedisOperations<String, String> operations;
    private ValueOperations<String, String> values;
    private RedisIdentityStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        operations = mock(RedisOperations.class);
        values = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(values);
        when(operations.opsForValue()).thenReturn(values);
        when(redis.execute(any(SessionCallback.class)))
                .thenAnswer(invocation -> ((SessionCallback<?>) invocation.getArgument(0)).execute(operations));
        store = new RedisIdentityStore(redis, mapper, Clock.fixed(NOW, ZoneOffset.UTC), 3);
    }

    @Test
    void conflictingCommitIsRetried() throws Exception {
        when(values.get(KEY)).thenReturn(json(identity()));
        List<Object> conflict = List.of();
        List<Object> committed = List.of("OK", "OK");
        when(operations.exec()).thenReturn(conflict, committed);
        AtomicInteger applied = new AtomicInteger();

        UserIdentity updated = store.update(EMAIL, current -> {
            applied.incrementAndGet();
            return current.toBuilder().name("Ada L.").build();
        }).orElseThrow();

        assertEquals("Ada L.", updated.getName());
        assertEquals(1, updated.getVersion());
        assertEquals(2, applied.get());
        verify(operations, times(2)).watch(KEY);
        verify(operations, times(2)).multi();
    }

    @Test
    void givesUpAfterRepeatedConflicts() throws Exception {
        when(values.get(KEY)).thenReturn(json(identity()));
        when(operations.exec()).thenReturn(null);

        assertThrows(IdentityStoreException.class,
                () -> store.update(EMAIL, current -> current.toBuilder().name("Ada L.").build()));

        verify(operations, times(3)).exec();
    }

    @Test
    void missingRecordIsEmpty() {
        when(values.get(KEY)).thenReturn(null);

        Optional<UserIdentity> result = store.update(EMAIL, current -> current.toBuilder().name("x").build());

        assertTrue(result.isEmpty());
        verify(operations).unwatch();
        verify(operations, never()).multi();
    }

    @Test
    void unchangedRecordSkipsTheTransaction() throws Exception {
        when(values.get(KEY)).thenReturn(json(identity()));

        UserIdentity result = store.update(EMAIL, current -> current).orElseThrow();

        assertEquals(0, result.getVersion());
        verify(operations).unwatch();
        verify(operations, never()).exec();
    }

    @Test
    void commitIndexesLiveResetTokens() throws Exception {
        when(values.get(KEY)).thenReturn(json(identity()));
        List<Object> committed = List.of("OK", "OK");
        when(operations.exec()).thenReturn(committed);
        ResetToken token = new ResetToken("abc123", NOW.plus(Duration.ofMinutes(30)), ResetReason.FORGOT_PASSWORD);

        store.update(EMAIL, current -> current.withResetToken(token));

        verify(values).set(eq(KEY), anyString());
        verify(values).set("context-auth:reset:abc123", EMAIL, Duration.ofMinutes(30));
    }

    @Test
    void staleResetIndexDoesNotResolve() throws Exception {
        when(values.get("context-auth:reset:stale")).thenReturn(EMAIL);
        when(values.get(KEY)).thenReturn(json(identity()));

        assertTrue(store.findByResetToken("stale").isEmpty());
    }

    @Test
    void resetIndexResolvesTheOwner() throws Exception {
        ResetToken token = new ResetToken("abc123", NOW.plus(Duration.ofMinutes(30)), ResetReason.NEW_DEVICE);
        when(values.get("context-auth:reset:abc123")).thenReturn(EMAIL);
        when(values.get(KEY)).thenReturn(json(identity().withResetToken(token)));

        assertEquals(EMAIL, store.findByResetToken("abc123").orElseThrow().getEmail());
    }

    @Test
    void connectionFailureBecomesStoreException() {
        doThrow(new RedisConnectionFailureException("down")).when(redis).execute(any(SessionCallback.class));

        IdentityStoreException ex = assertThrows(IdentityStoreException.class,
                () -> store.update(EMAIL, current -> current));

        assertInstanceOf(RedisConnectionFailureException.class, ex.getCause());
    }

    private UserIdentity identity() {
        return UserIdentity.builder()
                .id("u-1")
                .email(EMAIL)
                .name("Ada")
                .passwordHash("hash")
                .createdAt(NOW)
                .build();
    }

    private String json(UserIdentity identity) throws Exception {
        return mapper.writeValueAsString(identity);
    }
}
