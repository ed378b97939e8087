package com.khaounen.contextauth.security.auth;

import org.springframework.security.core.AuthenticationException;

public class BotDetectedException extends AuthenticationException {

    public BotDetectedException(String msg) {
        super(msg);
    }
}
