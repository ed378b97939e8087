package com.khaounen.contextauth.security.auth;

import com.khaounen.contextauth.security.identity.UserIdentity;
import com.khaounen.contextauth.security.session.SessionCredential;

public record SignupResult(UserIdentity user, SessionCredential session) {
}
