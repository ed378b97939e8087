package com.khaounen.contextauth.security.auth;

import com.khaounen.contextauth.security.captcha.BotCheck;
import com.khaounen.contextauth.security.context.InvalidLoginRequestException;
import com.khaounen.contextauth.security.context.LoginContext;
import com.khaounen.contextauth.security.context.LoginContextCapture;
import com.khaounen.contextauth.security.geo.GeolocationResolver;
import com.khaounen.contextauth.security.identity.IdentityStore;
import com.khaounen.contextauth.security.identity.IdentityStoreException;
import com.khaounen.contextauth.security.identity.UserIdentity;
import com.khaounen.contextauth.security.risk.RiskScore;
import com.khaounen.contextauth.security.risk.RiskScorer;
import com.khaounen.contextauth.security.session.CredentialIssuer;
import com.khaounen.contextauth.security.session.SessionCredential;
import com.khaounen.contextauth.security.token.ResetReason;
import com.khaounen.contextauth.security.token.ResetToken;
import com.khaounen.contextauth.security.token.TokenLifecycleManager;
import com.khaounen.contextauth.security.token.TokenPurpose;
import com.khaounen.contextauth.security.token.TokenValidation;
import com.khaounen.contextauth.security.token.VerificationToken;
import com.khaounen.contextauth.security.trust.PendingFold;
import com.khaounen.contextauth.security.trust.ProfileUpdater;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Signup, risk-scored login and second-factor completion.
 * <p>
 * A login attempt is read once, scored and decided without holding anything,
 * and then committed in a single store update, so a storage failure leaves no
 * partial state behind. Notifications go out only after that commit.
 */
@Slf4j
public class ContextAuthenticationService {

    static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final ContextAuthProperties properties;
    private final IdentityStore identityStore;
    private final LoginContextCapture contextCapture;
    private final RiskScorer riskScorer;
    private final DecisionPolicy decisionPolicy;
    private final ProfileUpdater profileUpdater;
    private final TokenLifecycleManager tokens;
    private final PasswordEncoder passwordEncoder;
    private final BotCheck botCheck;
    private final GeolocationResolver geolocationResolver;
    private final CredentialIssuer credentialIssuer;
    private final NotificationDispatcher notifications;

    public ContextAuthenticationService(
            ContextAuthProperties properties,
            IdentityStore identityStore,
            LoginContextCapture contextCapture,
            RiskScorer riskScorer,
            DecisionPolicy decisionPolicy,
            ProfileUpdater profileUpdater,
            TokenLifecycleManager tokens,
            PasswordEncoder passwordEncoder,
            BotCheck botCheck,
            GeolocationResolver geolocationResolver,
            CredentialIssuer credentialIssuer,
            NotificationDispatcher notifications
    ) {
        this.properties = properties;
        this.identityStore = identityStore;
        this.contextCapture = contextCapture;
        this.riskScorer = riskScorer;
        this.decisionPolicy = decisionPolicy;
        this.profileUpdater = profileUpdater;
        this.tokens = tokens;
        this.passwordEncoder = passwordEncoder;
        this.botCheck = botCheck;
        this.geolocationResolver = geolocationResolver;
        this.credentialIssuer = credentialIssuer;
        this.notifications = notifications;
    }

    public SignupResult signup(SignupRequest request) {
        if (!StringUtils.hasText(request.email())
                || !StringUtils.hasText(request.password())
                || !StringUtils.hasText(request.name())) {
            throw new InvalidLoginRequestException("All fields are required!");
        }
        requireCaptcha(request.captcha());
        LoginContext context = contextCapture.capture(request.context());
        String email = Emails.normalize(request.email());

        try {
            if (identityStore.find(email).isPresent()) {
                throw new AccountAlreadyExistsException("User Already Exists!");
            }
            verifyHuman(request.captcha());

            String locationName = geolocationResolver.resolve(context.location().lat(), context.location().lon());
            VerificationToken verification = tokens.issueVerification(
                    TokenPurpose.EMAIL_VERIFY, properties.getTokens().getEmailVerificationTtl());
            UserIdentity identity = UserIdentity.builder()
                    .id(UUID.randomUUID().toString())
                    .email(email)
                    .name(request.name().trim())
                    .passwordHash(passwordEncoder.encode(request.password()))
                    .verified(false)
                    .createdAt(context.timestamp())
                    .trustStore(profileUpdater.seed(context, locationName))
                    .build()
                    .withVerificationToken(verification);
            if (!identityStore.create(identity)) {
                throw new AccountAlreadyExistsException("User Already Exists!");
            }

            SessionCredential session = credentialIssuer.issueSession(identity.getId());
            notifications.dispatch("verification", n -> n.sendVerificationCode(identity, verification.code()));
            log.info("signup completed for user {}", identity.getId());
            return new SignupResult(identity, session);
        } catch (IdentityStoreException ex) {
            log.error("signup aborted, identity store failure: {}", ex.getMessage());
            throw ex;
        }
    }

    public LoginDecision login(LoginRequest request) {
        if (!StringUtils.hasText(request.email()) || !StringUtils.hasText(request.password())) {
            throw new InvalidLoginRequestException("All fields are required!");
        }
        requireCaptcha(request.captcha());
        LoginContext context = contextCapture.capture(request.context());
        String email = Emails.normalize(request.email());

        try {
            UserIdentity user = identityStore.find(email)
                    .orElseThrow(() -> new BadCredentialsException(INVALID_CREDENTIALS));
            if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
                throw new BadCredentialsException(INVALID_CREDENTIALS);
            }
            verifyHuman(request.captcha());
            return decide(user, context);
        } catch (IdentityStoreException ex) {
            log.error("login aborted, identity store failure: {}", ex.getMessage());
            throw ex;
        }
    }

    private LoginDecision decide(UserIdentity user, LoginContext context) {
        ResetToken newDeviceReset = user.getTrustStore().isDeviceTrusted(context.device())
                ? null
                : tokens.issueReset(ResetReason.NEW_DEVICE, properties.getTokens().getResetTtl());

        RiskScore score = riskScorer.score(context, user.getTrustStore());
        int total = score.total();
        LoginOutcome outcome = decisionPolicy.decide(total);

        String locationName = outcome == LoginOutcome.BLOCKED
                ? GeolocationResolver.UNKNOWN
                : geolocationResolver.resolve(context.location().lat(), context.location().lon());
        VerificationToken secondFactor = outcome == LoginOutcome.SECOND_FACTOR_REQUIRED
                ? tokens.issueVerification(TokenPurpose.TWO_FACTOR, properties.getTokens().getTwoFactorTtl())
                : null;
        boolean foldNow = outcome == LoginOutcome.ALLOWED
                || (outcome == LoginOutcome.SECOND_FACTOR_REQUIRED
                && properties.getPolicy().isFoldBeforeSecondFactor());

        UserIdentity committed = user;
        if (newDeviceReset != null || outcome != LoginOutcome.BLOCKED) {
            committed = identityStore.update(user.getEmail(), current -> {
                UserIdentity next = current;
                if (newDeviceReset != null) {
                    next = next.withResetToken(newDeviceReset);
                }
                if (secondFactor != null) {
                    next = next.withVerificationToken(secondFactor);
                    if (!foldNow) {
                        next = next.toBuilder().pendingFold(new PendingFold(context, locationName, total)).build();
                    }
                }
                if (foldNow) {
                    next = next.toBuilder()
                            .trustStore(profileUpdater.fold(next.getTrustStore(), context, locationName, total))
                            .build();
                }
                if (outcome == LoginOutcome.ALLOWED) {
                    next = next.toBuilder().lastLogin(context.timestamp()).build();
                }
                return next;
            }).orElseThrow(() -> new BadCredentialsException(INVALID_CREDENTIALS));
        }

        UserIdentity recipient = committed;
        if (newDeviceReset != null) {
            String resetLink = properties.getAlert().getClientUrl() + "/reset-password/" + newDeviceReset.token();
            notifications.dispatch("new-device", n -> n.sendNewDeviceAlert(recipient, context, resetLink));
        }

        switch (outcome) {
            case BLOCKED:
                notifications.dispatch("suspicious-activity",
                        n -> n.sendSuspiciousActivityAlert(recipient, context, score));
                log.info("login blocked for user {} with risk score {} {}", user.getId(), total, score.factors());
                return LoginDecision.blocked(total);
            case SECOND_FACTOR_REQUIRED:
                notifications.dispatch("two-factor",
                        n -> n.sendTwoFactorCode(recipient, secondFactor.code(), context));
                log.info("second factor required for user {} with risk score {}", user.getId(), total);
                return LoginDecision.secondFactorRequired(total);
            default:
                log.info("login allowed for user {} with risk score {}", user.getId(), total);
                return LoginDecision.allowed(total, credentialIssuer.issueSession(user.getId()));
        }
    }

    /**
     * Completes a login parked at {@link LoginOutcome#SECOND_FACTOR_REQUIRED}.
     * Unknown email, wrong code and expired code are indistinguishable to the
     * caller.
     */
    public LoginDecision verifySecondFactor(String email, String code) {
        if (!StringUtils.hasText(email) || !StringUtils.hasText(code)) {
            throw new InvalidLoginRequestException("Email and verification code are required!");
        }
        AtomicReference<TokenValidation<VerificationToken>> validation = new AtomicReference<>(TokenValidation.notFound());
        Instant now = tokens.now();
        Optional<UserIdentity> committed;
        try {
            committed = identityStore.update(Emails.normalize(email), current -> {
                TokenValidation<VerificationToken> result = tokens.validate(
                        current.verificationToken(TokenPurpose.TWO_FACTOR), code, TokenPurpose.TWO_FACTOR);
                validation.set(result);
                if (!result.isFresh()) {
                    return current;
                }
                UserIdentity next = current.withoutVerificationToken(TokenPurpose.TWO_FACTOR);
                Optional<PendingFold> pending = next.pendingFold();
                if (pending.isPresent()) {
                    PendingFold fold = pending.get();
                    next = next.toBuilder()
                            .trustStore(profileUpdater.fold(
                                    next.getTrustStore(), fold.context(), fold.locationName(), fold.riskScore()))
                            .pendingFold(null)
                            .build();
                }
                return next.toBuilder().lastLogin(now).build();
            });
        } catch (IdentityStoreException ex) {
            log.error("second factor aborted, identity store failure: {}", ex.getMessage());
            throw ex;
        }

        if (committed.isEmpty() || !validation.get().isFresh()) {
            log.debug("second factor rejected: {}", validation.get().status());
            return LoginDecision.rejected(LoginDecision.INVALID_CODE_MESSAGE);
        }
        UserIdentity user = committed.get();
        log.info("second factor completed for user {}", user.getId());
        return LoginDecision.allowed(user.getTrustStore().getRiskScore(), credentialIssuer.issueSession(user.getId()));
    }

    private void requireCaptcha(String captcha) {
        if (properties.getCaptcha().isEnabled() && !StringUtils.hasText(captcha)) {
            throw new InvalidLoginRequestException("Captcha is required!");
        }
    }

    private void verifyHuman(String captcha) {
        if (properties.getCaptcha().isEnabled() && !botCheck.verify(captcha)) {
            throw new BotDetectedException("Bot detected");
        }
    }
}
