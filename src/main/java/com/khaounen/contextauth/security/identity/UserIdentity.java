package com.khaounen.contextauth.security.identity;

import com.khaounen.contextauth.security.token.ResetReason;
import com.khaounen.contextauth.security.token.ResetToken;
import com.khaounen.contextauth.security.token.TokenPurpose;
import com.khaounen.contextauth.security.token.VerificationToken;
import com.khaounen.contextauth.security.trust.PendingFold;
import com.khaounen.contextauth.security.trust.TrustStore;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One user's identity record. The trust store and every live token are kept on
 * the same record because login decisions and token checks start from the same
 * lookup.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserIdentity {

    String id;
    String email;
    String name;
    @ToString.Exclude
    String passwordHash;
    boolean verified;
    Instant createdAt;
    Instant lastLogin;
    long version;

    @Builder.Default
    TrustStore trustStore = TrustStore.empty();

    @Builder.Default
    @ToString.Exclude
    Map<TokenPurpose, VerificationToken> verificationTokens = Map.of();

    @Builder.Default
    @ToString.Exclude
    Map<ResetReason, ResetToken> resetTokens = Map.of();

    PendingFold pendingFold;

    public Optional<VerificationToken> verificationToken(TokenPurpose purpose) {
        return Optional.ofNullable(verificationTokens.get(purpose));
    }

    public Optional<ResetToken> resetToken(ResetReason reason) {
        return Optional.ofNullable(resetTokens.get(reason));
    }

    /**
     * The reset token, of any reason, whose value equals {@code token}.
     */
    public Optional<ResetToken> resetTokenMatching(String token) {
        return resetTokens.values().stream()
                .filter(t -> t.token().equals(token))
                .findFirst();
    }

    public Optional<PendingFold> pendingFold() {
        return Optional.ofNullable(pendingFold);
    }

    /** Replaces any live token of the same purpose. */
    public UserIdentity withVerificationToken(VerificationToken token) {
        Map<TokenPurpose, VerificationToken> tokens = new EnumMap<>(TokenPurpose.class);
        tokens.putAll(verificationTokens);
        tokens.put(token.purpose(), token);
        return toBuilder().verificationTokens(Map.copyOf(tokens)).build();
    }

    public UserIdentity withoutVerificationToken(TokenPurpose purpose) {
        if (!verificationTokens.containsKey(purpose)) {
            return this;
        }
        Map<TokenPurpose, VerificationToken> tokens = new EnumMap<>(TokenPurpose.class);
        tokens.putAll(verificationTokens);
        tokens.remove(purpose);
        return toBuilder().verificationTokens(Map.copyOf(tokens)).build();
    }

    /** Replaces the token of the same reason only. */
    public UserIdentity withResetToken(ResetToken token) {
        Map<ResetReason, ResetToken> tokens = new EnumMap<>(ResetReason.class);
        tokens.putAll(resetTokens);
        tokens.put(token.reason(), token);
        return toBuilder().resetTokens(Map.copyOf(tokens)).build();
    }

    public UserIdentity withoutResetTokens() {
        return toBuilder().resetTokens(Map.of()).build();
    }
}
