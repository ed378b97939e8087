package com.khaounen.contextauth.security.auth;

import com.khaounen.contextauth.security.context.InvalidLoginRequestException;
import com.khaounen.contextauth.security.identity.IdentityStore;
import com.khaounen.contextauth.security.identity.IdentityStoreException;
import com.khaounen.contextauth.security.identity.UserIdentity;
import com.khaounen.contextauth.security.token.ResetReason;
import com.khaounen.contextauth.security.token.ResetToken;
import com.khaounen.contextauth.security.token.TokenLifecycleManager;
import com.khaounen.contextauth.security.token.TokenPurpose;
import com.khaounen.contextauth.security.token.TokenValidation;
import com.khaounen.contextauth.security.token.VerificationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Out-of-band token flows: email verification, password reset and the risk
 * score reset.
 */
@Slf4j
public class AccountTokenService {

    static final String INVALID_RESET_TOKEN = "Invalid or expired reset token";
    static final String RESET_LINK_SENT = "If the account exists, a password reset link has been sent";

    private final ContextAuthProperties properties;
    private final IdentityStore identityStore;
    private final TokenLifecycleManager tokens;
    private final PasswordEncoder passwordEncoder;
    private final NotificationDispatcher notifications;

    public AccountTokenService(
            ContextAuthProperties properties,
            IdentityStore identityStore,
            TokenLifecycleManager tokens,
            PasswordEncoder passwordEncoder,
            NotificationDispatcher notifications
    ) {
        this.properties = properties;
        this.identityStore = identityStore;
        this.tokens = tokens;
        this.passwordEncoder = passwordEncoder;
        this.notifications = notifications;
    }

    public TokenOperationResult verifyEmail(String email, String code) {
        return withStore("email verification", () -> {
            if (!StringUtils.hasText(email) || !StringUtils.hasText(code)) {
                throw new InvalidLoginRequestException("Email and verification code are required!");
            }
            AtomicBoolean fresh = new AtomicBoolean();
            Optional<UserIdentity> committed = identityStore.update(Emails.normalize(email), current -> {
                TokenValidation<VerificationToken> validation = tokens.validate(
                        current.verificationToken(TokenPurpose.EMAIL_VERIFY), code, TokenPurpose.EMAIL_VERIFY);
                fresh.set(validation.isFresh());
                if (!validation.isFresh()) {
                    return current;
                }
                return current.withoutVerificationToken(TokenPurpose.EMAIL_VERIFY).toBuilder()
                        .verified(true)
                        .build();
            });
            if (committed.isEmpty() || !fresh.get()) {
                return TokenOperationResult.failed(LoginDecision.INVALID_CODE_MESSAGE);
            }
            UserIdentity user = committed.get();
            notifications.dispatch("welcome", n -> n.sendWelcome(user));
            log.info("email verified for user {}", user.getId());
            return TokenOperationResult.ok("Email verified successfully");
        });
    }

    public TokenOperationResult resendVerificationCode(String email) {
        return withStore("verification resend", () -> {
            if (!StringUtils.hasText(email)) {
                throw new InvalidLoginRequestException("Email is required!");
            }
            Optional<UserIdentity> user = identityStore.find(Emails.normalize(email));
            if (user.isEmpty()) {
                return TokenOperationResult.failed("User not found!");
            }
            if (user.get().isVerified()) {
                return TokenOperationResult.failed("User already verified!");
            }
            VerificationToken token = tokens.issueVerification(
                    TokenPurpose.EMAIL_VERIFY, properties.getTokens().getEmailVerificationTtl());
            Optional<UserIdentity> committed = identityStore.update(
                    user.get().getEmail(), current -> current.withVerificationToken(token));
            if (committed.isEmpty()) {
                return TokenOperationResult.failed("User not found!");
            }
            UserIdentity recipient = committed.get();
            notifications.dispatch("verification", n -> n.sendVerificationCode(recipient, token.code()));
            return TokenOperationResult.ok("Verification code resent successfully");
        });
    }

    /**
     * Issues a {@link ResetReason#FORGOT_PASSWORD} token. A pending new-device
     * token keeps working. The answer does not reveal whether the account exists.
     */
    public TokenOperationResult forgotPassword(String email) {
        return withStore("password reset request", () -> {
            if (!StringUtils.hasText(email)) {
                throw new InvalidLoginRequestException("Email is required!");
            }
            ResetToken token = tokens.issueReset(ResetReason.FORGOT_PASSWORD, properties.getTokens().getResetTtl());
            Optional<UserIdentity> committed = identityStore.update(
                    Emails.normalize(email), current -> current.withResetToken(token));
            committed.ifPresent(user -> {
                String link = properties.getAlert().getClientUrl() + "/reset-password/" + token.token();
                notifications.dispatch("password-reset", n -> n.sendPasswordResetLink(user, link));
                log.info("password reset requested for user {}", user.getId());
            });
            return TokenOperationResult.ok(RESET_LINK_SENT);
        });
    }

    /**
     * Accepts a live reset token of either reason. A successful reset clears
     * every reset token of the account.
     */
    public TokenOperationResult resetPassword(String token, String newPassword) {
        return withStore("password reset", () -> {
            if (!StringUtils.hasText(newPassword)) {
                throw new InvalidLoginRequestException("New password is required!");
            }
            if (!StringUtils.hasText(token)) {
                return TokenOperationResult.failed(INVALID_RESET_TOKEN);
            }
            Optional<UserIdentity> owner = identityStore.findByResetToken(token);
            if (owner.isEmpty()) {
                return TokenOperationResult.failed(INVALID_RESET_TOKEN);
            }
            String passwordHash = passwordEncoder.encode(newPassword);
            AtomicBoolean fresh = new AtomicBoolean();
            Optional<UserIdentity> committed = identityStore.update(owner.get().getEmail(), current -> {
                TokenValidation<ResetToken> validation = tokens.validateReset(current.resetTokenMatching(token), token);
                fresh.set(validation.isFresh());
                if (!validation.isFresh()) {
                    return current;
                }
                return current.withoutResetTokens().toBuilder()
                        .passwordHash(passwordHash)
                        .build();
            });
            if (committed.isEmpty() || !fresh.get()) {
                return TokenOperationResult.failed(INVALID_RESET_TOKEN);
            }
            UserIdentity user = committed.get();
            notifications.dispatch("password-reset-success", n -> n.sendPasswordResetSuccess(user));
            log.info("password reset for user {}", user.getId());
            return TokenOperationResult.ok("Password reset successfully");
        });
    }

    public TokenOperationResult resetRiskScore(String email) {
        return withStore("risk score reset", () -> {
            if (!StringUtils.hasText(email)) {
                throw new InvalidLoginRequestException("Email is required!");
            }
            AtomicBoolean reset = new AtomicBoolean();
            Optional<UserIdentity> committed = identityStore.update(Emails.normalize(email), current -> {
                reset.set(current.getTrustStore().getRiskScore() > 0);
                if (!reset.get()) {
                    return current;
                }
                return current.toBuilder()
                        .trustStore(current.getTrustStore().toBuilder().riskScore(0).build())
                        .build();
            });
            if (committed.isEmpty()) {
                return TokenOperationResult.failed("User not found");
            }
            if (!reset.get()) {
                return TokenOperationResult.failed("Risk score is already 0.");
            }
            return TokenOperationResult.ok("Risk score reset to 0.");
        });
    }

    private TokenOperationResult withStore(String operation, Supplier<TokenOperationResult> flow) {
        try {
            return flow.get();
        } catch (IdentityStoreException ex) {
            log.error("{} aborted, identity store failure: {}", operation, ex.getMessage());
            throw ex;
        }
    }
}
