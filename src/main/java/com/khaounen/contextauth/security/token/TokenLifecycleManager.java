package com.khaounen.contextauth.security.token;

import com.khaounen.contextauth.utils.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues and validates short-lived one-time codes and reset tokens.
 * <p>
 * Expiry is judged against the stored absolute timestamp whenever a token is
 * validated; nothing sweeps expired tokens, they simply stop validating.
 * Invalidation is done by the owner of the token slot dropping the value.
 */
public class TokenLifecycleManager {

    private static final int MIN_CODE_LENGTH = 4;
    private static final int MAX_CODE_LENGTH = 9;
    private static final int MIN_RESET_BYTES = 16;

    private final Clock clock;
    private final SecureRandom random;
    private final int codeLength;
    private final int resetTokenBytes;

    public TokenLifecycleManager(Clock clock, SecureRandom random, int codeLength, int resetTokenBytes) {
        this.clock = clock;
        this.random = random;
        this.codeLength = Math.min(MAX_CODE_LENGTH, Math.max(MIN_CODE_LENGTH, codeLength));
        this.resetTokenBytes = Math.max(MIN_RESET_BYTES, resetTokenBytes);
    }

    public VerificationToken issueVerification(TokenPurpose purpose, Duration ttl) {
        int bound = (int) Math.pow(10, codeLength);
        String code = String.format("%0" + codeLength + "d", random.nextInt(bound));
        return new VerificationToken(code, clock.instant().plus(ttl), purpose);
    }

    public ResetToken issueReset(ResetReason reason, Duration ttl) {
        byte[] bytes = new byte[resetTokenBytes];
        random.nextBytes(bytes);
        return new ResetToken(Hex.encode(bytes), clock.instant().plus(ttl), reason);
    }

    /**
     * A wrong code reports {@code NOT_FOUND}; the right code past its expiry
     * reports {@code EXPIRED}.
     */
    public TokenValidation<VerificationToken> validate(
            Optional<VerificationToken> stored,
            String submitted,
            TokenPurpose purpose
    ) {
        if (stored.isEmpty() || submitted == null) {
            return TokenValidation.notFound();
        }
        VerificationToken token = stored.get();
        if (token.purpose() != purpose || !matches(token.code(), submitted.trim())) {
            return TokenValidation.notFound();
        }
        if (token.isExpired(clock.instant())) {
            return TokenValidation.expired();
        }
        return TokenValidation.fresh(token);
    }

    public TokenValidation<ResetToken> validateReset(Optional<ResetToken> stored, String submitted) {
        if (stored.isEmpty() || submitted == null || !matches(stored.get().token(), submitted.trim())) {
            return TokenValidation.notFound();
        }
        if (stored.get().isExpired(clock.instant())) {
            return TokenValidation.expired();
        }
        return TokenValidation.fresh(stored.get());
    }

    public Instant now() {
        return clock.instant();
    }

    private static boolean matches(String expected, String submitted) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                submitted.getBytes(StandardCharsets.UTF_8)
        );
    }
}
