package com.khaounen.contextauth.security.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.contextauth.security.auth.ContextAuthProperties;
import com.khaounen.contextauth.security.context.LoginContext;
import com.khaounen.contextauth.security.identity.UserIdentity;
import com.khaounen.contextauth.security.risk.RiskFactor;
import com.khaounen.contextauth.security.risk.RiskScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Mails the account holder and, for security alerts, posts a JSON event to an
 * optional webhook. Without a {@link JavaMailSender} messages are only logged.
 */
@Slf4j
public class ContextAuthAlertDispatcher implements Notifier {

    private final ContextAuthProperties.Alert properties;
    private final ObjectProvider<ObjectMapper> objectMapperProvider;
    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final HttpClient httpClient;

    public ContextAuthAlertDispatcher(
            ContextAuthProperties.Alert properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        this.properties = properties;
        this.objectMapperProvider = objectMapperProvider;
        this.mailSenderProvider = mailSenderProvider;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getWebhook().getConnectTimeoutMs()))
                .build();
    }

    @Override
    public void sendVerificationCode(UserIdentity user, String code) {
        sendMail(user, "Verify your email",
                "Hello " + user.getName() + ",\n\n"
                        + "Your verification code is " + code + ".\n"
                        + "It expires shortly; request a new one if it does.\n");
    }

    @Override
    public void sendWelcome(UserIdentity user) {
        sendMail(user, "Welcome", "Hello " + user.getName() + ",\n\nYour email address is now verified.\n");
    }

    @Override
    public void sendTwoFactorCode(UserIdentity user, String code, LoginContext context) {
        sendMail(user, "Your sign-in code",
                "Hello " + user.getName() + ",\n\n"
                        + "We noticed an unusual sign-in and need to confirm it is you.\n"
                        + "Your code is " + code + ".\n\n"
                        + describe(context));
    }

    @Override
    public void sendNewDeviceAlert(UserIdentity user, LoginContext context, String resetLink) {
        sendMail(user, "New device sign-in",
                "Hello " + user.getName() + ",\n\n"
                        + "Your account was just used from a device we have not seen before.\n\n"
                        + describe(context) + "\n"
                        + "If this was not you, reset your password now:\n" + resetLink + "\n");
        sendWebhook("NEW_DEVICE", user, context, null);
    }

    @Override
    public void sendSuspiciousActivityAlert(UserIdentity user, LoginContext context, RiskScore score) {
        sendMail(user, "Sign-in blocked",
                "Hello " + user.getName() + ",\n\n"
                        + "We blocked a sign-in attempt that looked suspicious (risk score "
                        + score.total() + ").\n\n"
                        + describe(context) + "\n"
                        + "Signals: " + signals(score) + "\n");
        sendWebhook("SUSPICIOUS_ACTIVITY", user, context, score);
    }

    @Override
    public void sendPasswordResetLink(UserIdentity user, String resetLink) {
        sendMail(user, "Reset your password",
                "Hello " + user.getName() + ",\n\nFollow this link to choose a new password:\n" + resetLink + "\n");
    }

    @Override
    public void sendPasswordResetSuccess(UserIdentity user) {
        sendMail(user, "Password changed", "Hello " + user.getName() + ",\n\nYour password was reset successfully.\n");
    }

    private void sendMail(UserIdentity user, String subject, String body) {
        ContextAuthProperties.Mail mail = properties.getMail();
        JavaMailSender sender = mailSenderProvider.getIfAvailable();
        if (!mail.isEnabled() || sender == null || mail.getFrom() == null || mail.getFrom().isBlank()) {
            log.info("mail delivery unavailable, skipped '{}' for user {}", subject, user.getId());
            return;
        }
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(mail.getFrom());
            message.setTo(user.getEmail());
            message.setSubject(mail.getSubjectPrefix() + " " + subject);
            message.setText(body);
            sender.send(message);
        } catch (Exception ex) {
            log.warn("context-auth mail '{}' failed: {}", subject, ex.getMessage());
        }
    }

    private void sendWebhook(String event, UserIdentity user, LoginContext context, RiskScore score) {
        ContextAuthProperties.Webhook webhook = properties.getWebhook();
        if (!webhook.isEnabled() || webhook.getUrl() == null || webhook.getUrl().isBlank()) {
            return;
        }
        try {
            ObjectMapper mapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
            String payload = mapper.writeValueAsString(buildPayload(event, user, context, score, webhook.isIncludeContext()));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(webhook.getUrl()))
                    .timeout(Duration.ofMillis(webhook.getTimeoutMs()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload))
                    .build();
            httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        } catch (Exception ex) {
            log.warn("context-auth webhook alert failed: {}", ex.getMessage());
        }
    }

    Map<String, Object> buildPayload(
            String event,
            UserIdentity user,
            LoginContext context,
            RiskScore score,
            boolean includeContext
    ) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Instant.now().toString());
        payload.put("event", event);
        payload.put("userId", user.getId());
        if (score != null) {
            payload.put("riskScore", score.total());
            payload.put("signals", signals(score));
        }
        if (includeContext) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("ip", context.ip());
            ctx.put("device", context.device());
            ctx.put("lat", context.location().lat());
            ctx.put("lon", context.location().lon());
            ctx.put("loginHour", context.loginHour());
            payload.put("context", ctx);
        }
        return payload;
    }

    private static String describe(LoginContext context) {
        return "time: " + context.timestamp() + "\n"
                + "ip: " + context.ip() + "\n"
                + "device: " + context.device() + "\n"
                + "location: " + context.location().lat() + ", " + context.location().lon() + "\n";
    }

    private static String signals(RiskScore score) {
        return score.factors().stream()
                .map(RiskFactor::signal)
                .map(Enum::name)
                .collect(Collectors.joining(", "));
    }
}
