package com.khaounen.contextauth.security.captcha;

@FunctionalInterface
public interface BotCheck {
    boolean verify(String captchaToken);
}
