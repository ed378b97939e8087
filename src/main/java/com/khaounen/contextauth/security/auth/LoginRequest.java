package com.khaounen.contextauth.security.auth;

import com.khaounen.contextauth.security.context.ContextPayload;

public record LoginRequest(String email, String password, ContextPayload context, String captcha) {
}
