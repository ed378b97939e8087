package com.khaounen.contextauth.security.auth;

public record TokenOperationResult(boolean success, String message) {

    public static TokenOperationResult ok(String message) {
        return new TokenOperationResult(true, message);
    }

    public static TokenOperationResult failed(String message) {
        return new TokenOperationResult(false, message);
    }
}
