package com.khaounen.contextauth.security.captcha;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.contextauth.security.auth.ContextAuthProperties;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Verifies captcha responses with Google reCAPTCHA. Transport failures count as
 * a failed check.
 */
@Slf4j
public class RecaptchaBotCheck implements BotCheck {

    private final ContextAuthProperties.Captcha properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public RecaptchaBotCheck(ContextAuthProperties.Captcha properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getTimeout())
                .build();
    }

    @Override
    public boolean verify(String captchaToken) {
        if (captchaToken == null || captchaToken.isBlank()) {
            return false;
        }
        if (properties.getSecret() == null || properties.getSecret().isBlank()) {
            log.warn("captcha secret is not configured, rejecting captcha");
            return false;
        }
        String form = "secret=" + URLEncoder.encode(properties.getSecret(), StandardCharsets.UTF_8)
                + "&response=" + URLEncoder.encode(captchaToken, StandardCharsets.UTF_8);
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(properties.getVerifyUrl()))
                    .timeout(properties.getTimeout())
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(form))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            VerifyResponse result = objectMapper.readValue(response.body(), VerifyResponse.class);
            if (!result.success) {
                log.debug("captcha rejected: {}", result.errorCodes);
            }
            return result.success;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception ex) {
            log.warn("captcha verification failed: {}", ex.getMessage());
            return false;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class VerifyResponse {
        @JsonProperty
        private boolean success;

        @JsonProperty("error-codes")
        private List<String> errorCodes;
    }
}
