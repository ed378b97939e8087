package com.khaounen.contextauth.security.token;

import com.khaounen.contextauth.security.auth.MutableClock;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenLifecycleManagerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-15T14:00:00Z"));
    private final TokenLifecycleManager manager = new TokenLifecycleManager(clock, new SecureRandom(), 6, 20);

    @Test
    void verificationCodesAreSixDigitsWithAbsoluteExpiry() {
        VerificationToken token = manager.issueVerification(TokenPurpose.TWO_FACTOR, Duration.ofMinutes(5));

        assertTrue(token.code().matches("\\d{6}"));
        assertEquals(Instant.parse("2026-01-15T14:05:00Z"), token.expiresAt());
        assertEquals(TokenPurpose.TWO_FACTOR, token.purpose());
    }

    @Test
    void resetTokensAreFortyHexCharacters() {
        ResetToken token = manager.issueReset(ResetReason.FORGOT_PASSWORD, Duration.ofMinutes(30));

        assertTrue(token.token().matches("[0-9a-f]{40}"));
        assertEquals(ResetReason.FORGOT_PASSWORD, token.reason());
    }

    @Test
    void freshCodeValidatesUntilItsExpiry() {
        VerificationToken token = manager.issueVerification(TokenPurpose.TWO_FACTOR, Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(4).plusSeconds(59));
        TokenValidation<VerificationToken> fresh = manager.validate(Optional.of(token), token.code(), TokenPurpose.TWO_FACTOR);
        assertTrue(fresh.isFresh());
        assertEquals(token, fresh.payload());

        clock.advance(Duration.ofSeconds(1));
        TokenValidation<VerificationToken> expired = manager.validate(Optional.of(token), token.code(), TokenPurpose.TWO_FACTOR);
        assertEquals(TokenValidation.Status.EXPIRED, expired.status());
        assertNull(expired.payload());
    }

    @Test
    void wrongCodeOrPurposeIsNotFound() {
        VerificationToken token = new VerificationToken("123456", clock.instant().plusSeconds(60), TokenPurpose.TWO_FACTOR);

        assertEquals(TokenValidation.Status.NOT_FOUND,
                manager.validate(Optional.of(token), "654321", TokenPurpose.TWO_FACTOR).status());
        assertEquals(TokenValidation.Status.NOT_FOUND,
                manager.validate(Optional.of(token), "123456", TokenPurpose.EMAIL_VERIFY).status());
        assertEquals(TokenValidation.Status.NOT_FOUND,
                manager.validate(Optional.empty(), "123456", TokenPurpose.TWO_FACTOR).status());
    }

    @Test
    void resetTokenExpiresLazily() {
        ResetToken token = manager.issueReset(ResetReason.NEW_DEVICE, Duration.ofMinutes(30));

        assertTrue(manager.validateReset(Optional.of(token), token.token()).isFresh());
        clock.advance(Duration.ofMinutes(30));
        assertEquals(TokenValidation.Status.EXPIRED, manager.validateReset(Optional.of(token), token.token()).status());
    }

    @Test
    void codeLengthIsClamped() {
        TokenLifecycleManager tiny = new TokenLifecycleManager(clock, new SecureRandom(), 1, 4);

        assertEquals(4, tiny.issueVerification(TokenPurpose.EMAIL_VERIFY, Duration.ofMinutes(1)).code().length());
        assertEquals(32, tiny.issueReset(ResetReason.NEW_DEVICE, Duration.ofMinutes(1)).token().length());
    }
}
