package com.khaounen.contextauth.security.auth;

import com.khaounen.contextauth.security.context.ContextPayload;

public record SignupRequest(String email, String password, String name, ContextPayload context, String captcha) {
}
