package com.khaounen.contextauth.security.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.khaounen.contextauth.config.RequestContextFilter;
import com.khaounen.contextauth.security.captcha.BotCheck;
import com.khaounen.contextauth.security.captcha.RecaptchaBotCheck;
import com.khaounen.contextauth.security.context.LoginContextCapture;
import com.khaounen.contextauth.security.geo.GeolocationResolver;
import com.khaounen.contextauth.security.geo.NominatimGeolocationResolver;
import com.khaounen.contextauth.security.identity.IdentityStore;
import com.khaounen.contextauth.security.identity.InMemoryIdentityStore;
import com.khaounen.contextauth.security.identity.RedisIdentityStore;
import com.khaounen.contextauth.security.notify.ContextAuthAlertDispatcher;
import com.khaounen.contextauth.security.notify.Notifier;
import com.khaounen.contextauth.security.risk.DefaultRiskScorer;
import com.khaounen.contextauth.security.risk.RiskChecks;
import com.khaounen.contextauth.security.risk.RiskScorer;
import com.khaounen.contextauth.security.session.CachedSessionCredentialIssuer;
import com.khaounen.contextauth.security.session.CredentialIssuer;
import com.khaounen.contextauth.security.token.TokenLifecycleManager;
import com.khaounen.contextauth.security.trust.ProfileUpdater;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.security.SecureRandom;
import java.time.Clock;

@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(ContextAuthProperties.class)
public class ContextAuthAutoConfiguration {

    private static final int REDIS_UPDATE_ATTEMPTS = 5;

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnBean(StringRedisTemplate.class)
    static class RedisIdentityStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public IdentityStore identityStore(
                StringRedisTemplate redisTemplate,
                ObjectProvider<ObjectMapper> objectMapperProvider,
                ObjectProvider<Clock> clockProvider
        ) {
            log.info("context-auth identities are stored in redis");
            return new RedisIdentityStore(
                    redisTemplate,
                    storageMapper(objectMapperProvider),
                    clockProvider.getIfAvailable(Clock::systemUTC),
                    REDIS_UPDATE_ATTEMPTS
            );
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class ServletConfiguration {

        @Bean(name = "contextAuthRequestContextFilter")
        @ConditionalOnMissingBean
        public RequestContextFilter requestContextFilter() {
            return new RequestContextFilter();
        }
    }

    @Bean
    @ConditionalOnMissingBean(IdentityStore.class)
    public IdentityStore inMemoryIdentityStore() {
        log.info("context-auth identities are kept in memory");
        return new InMemoryIdentityStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(10);
    }

    @Bean
    @ConditionalOnMissingBean
    public LoginContextCapture loginContextCapture(Clock clock, ContextAuthProperties properties) {
        return new LoginContextCapture(clock, properties.getLoginZone());
    }

    @Bean
    @ConditionalOnMissingBean
    public RiskScorer riskScorer(ContextAuthProperties properties) {
        return new DefaultRiskScorer(RiskChecks.defaults(properties.getRisk()));
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionPolicy decisionPolicy(ContextAuthProperties properties) {
        ContextAuthProperties.Policy policy = properties.getPolicy();
        return new DecisionPolicy(policy.getMfaThreshold(), policy.getBlockThreshold());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProfileUpdater profileUpdater(ContextAuthProperties properties) {
        ContextAuthProperties.Profile profile = properties.getProfile();
        return new ProfileUpdater(profile.getMaxKnownLocations(), profile.getMaxContextLog(), profile.getTypingSmoothing());
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenLifecycleManager tokenLifecycleManager(Clock clock, ContextAuthProperties properties) {
        ContextAuthProperties.Tokens tokens = properties.getTokens();
        return new TokenLifecycleManager(clock, new SecureRandom(), tokens.getCodeLength(), tokens.getResetTokenBytes());
    }

    @Bean
    @ConditionalOnMissingBean
    public BotCheck botCheck(ContextAuthProperties properties, ObjectProvider<ObjectMapper> objectMapperProvider) {
        if (!properties.getCaptcha().isEnabled()) {
            log.warn("context-auth captcha verification is disabled");
            return token -> true;
        }
        return new RecaptchaBotCheck(properties.getCaptcha(), objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public GeolocationResolver geolocationResolver(
            ContextAuthProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider
    ) {
        return new NominatimGeolocationResolver(
                properties.getGeolocation(), objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialIssuer credentialIssuer(Clock clock, ContextAuthProperties properties) {
        ContextAuthProperties.Session session = properties.getSession();
        return new CachedSessionCredentialIssuer(clock, new SecureRandom(), session.getTtl(), session.getMaximumSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public Notifier notifier(
            ContextAuthProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        return new ContextAuthAlertDispatcher(properties.getAlert(), objectMapperProvider, mailSenderProvider);
    }

    /**
     * The notification pool belongs to the dispatcher and is never published
     * as an {@code Executor} bean.
     */
    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(Notifier notifier) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("context-auth-notify-");
        executor.initialize();
        return new NotificationDispatcher(notifier, executor);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextAuthenticationService contextAuthenticationService(
            ContextAuthProperties properties,
            IdentityStore identityStore,
            LoginContextCapture contextCapture,
            RiskScorer riskScorer,
            DecisionPolicy decisionPolicy,
            ProfileUpdater profileUpdater,
            TokenLifecycleManager tokenLifecycleManager,
            PasswordEncoder passwordEncoder,
            BotCheck botCheck,
            GeolocationResolver geolocationResolver,
            CredentialIssuer credentialIssuer,
            NotificationDispatcher notificationDispatcher
    ) {
        return new ContextAuthenticationService(
                properties,
                identityStore,
                contextCapture,
                riskScorer,
                decisionPolicy,
                profileUpdater,
                tokenLifecycleManager,
                passwordEncoder,
                botCheck,
                geolocationResolver,
                credentialIssuer,
                notificationDispatcher
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public AccountTokenService accountTokenService(
            ContextAuthProperties properties,
            IdentityStore identityStore,
            TokenLifecycleManager tokenLifecycleManager,
            PasswordEncoder passwordEncoder,
            NotificationDispatcher notificationDispatcher
    ) {
        return new AccountTokenService(
                properties, identityStore, tokenLifecycleManager, passwordEncoder, notificationDispatcher);
    }

    private static ObjectMapper storageMapper(ObjectProvider<ObjectMapper> objectMapperProvider) {
        return objectMapperProvider.getIfAvailable(ObjectMapper::new).copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
