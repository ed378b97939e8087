package com.khaounen.contextauth.security.token;

public enum TokenPurpose {
    EMAIL_VERIFY,
    TWO_FACTOR
}
