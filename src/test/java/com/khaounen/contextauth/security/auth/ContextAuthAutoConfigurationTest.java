package com.khaounen.contextauth.security.auth;

import com.khaounen.contextauth.security.captcha.BotCheck;
import com.khaounen.contextauth.security.captcha.RecaptchaBotCheck;
import com.khaounen.contextauth.security.identity.IdentityStore;
import com.khaounen.contextauth.security.identity.InMemoryIdentityStore;
import com.khaounen.contextauth.security.notify.Notifier;
import com.khaounen.contextauth.security.risk.RiskScorer;
import com.khaounen.contextauth.security.session.CredentialIssuer;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.task.TaskExecutionAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextAuthAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ContextAuthAutoConfiguration.class));

    @Test
    void wiresInMemoryDefaults() {
        runner.run(context -> {
            assertInstanceOf(InMemoryIdentityStore.class, context.getBean(IdentityStore.class));
            assertInstanceOf(RecaptchaBotCheck.class, context.getBean(BotCheck.class));
            assertNotNull(context.getBean(RiskScorer.class));
            assertNotNull(context.getBean(Notifier.class));
            assertNotNull(context.getBean(CredentialIssuer.class));
            assertNotNull(context.getBean(ContextAuthenticationService.class));
            assertNotNull(context.getBean(AccountTokenService.class));
            assertFalse(context.containsBean("contextAuthRequestContextFilter"));

            DecisionPolicy policy = context.getBean(DecisionPolicy.class);
            assertEquals(5, policy.getMfaThreshold());
            assertEquals(10, policy.getBlockThreshold());
        });
    }

    @Test
    void bindsProperties() {
        runner.withPropertyValues(
                "context-auth.policy.mfa-threshold=4",
                "context-auth.policy.block-threshold=8",
                "context-auth.tokens.two-factor-ttl=2m",
                "context-auth.captcha.enabled=false"
        ).run(context -> {
            DecisionPolicy policy = context.getBean(DecisionPolicy.class);
            assertEquals(LoginOutcome.SECOND_FACTOR_REQUIRED, policy.decide(4));
            assertEquals(LoginOutcome.BLOCKED, policy.decide(8));
            assertEquals(Duration.ofMinutes(2),
                    context.getBean(ContextAuthProperties.class).getTokens().getTwoFactorTtl());
            assertTrue(context.getBean(BotCheck.class).verify(null));
        });
    }

    @Test
    void rejectsInvertedThresholds() {
        runner.withPropertyValues(
                "context-auth.policy.mfa-threshold=10",
                "context-auth.policy.block-threshold=5"
        ).run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void leavesTheApplicationTaskExecutorInPlace() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        TaskExecutionAutoConfiguration.class, ContextAuthAutoConfiguration.class))
                .run(context -> {
                    assertTrue(context.containsBean("applicationTaskExecutor"));
                    assertEquals(Set.of("applicationTaskExecutor"),
                            context.getBeansOfType(Executor.class).keySet());
                    assertNotNull(context.getBean(NotificationDispatcher.class));
                });
    }

    @Test
    void backsOffForUserStore() {
        runner.withUserConfiguration(CustomStoreConfiguration.class).run(context -> {
            assertSame(CustomStoreConfiguration.STORE, context.getBean(IdentityStore.class));
            assertEquals(1, context.getBeansOfType(IdentityStore.class).size());
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomStoreConfiguration {

        static final IdentityStore STORE = new InMemoryIdentityStore();

        @Bean
        IdentityStore customIdentityStore() {
            return STORE;
        }
    }
}
