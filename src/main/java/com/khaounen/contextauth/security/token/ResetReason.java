package com.khaounen.contextauth.security.token;

/**
 * Why a password reset token was handed out. Each reason owns its own slot so
 * that one flow never silently invalidates the other.
 */
public enum ResetReason {
    NEW_DEVICE,
    FORGOT_PASSWORD
}
