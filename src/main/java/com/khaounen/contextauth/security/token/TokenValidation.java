package com.khaounen.contextauth.security.token;

public record TokenValidation<T>(Status status, T payload) {

    public enum Status {
        FRESH,
        EXPIRED,
        NOT_FOUND
    }

    public static <T> TokenValidation<T> fresh(T payload) {
        return new TokenValidation<>(Status.FRESH, payload);
    }

    public static <T> TokenValidation<T> expired() {
        return new TokenValidation<>(Status.EXPIRED, null);
    }

    public static <T> TokenValidation<T> notFound() {
        return new TokenValidation<>(Status.NOT_FOUND, null);
    }

    public boolean isFresh() {
        return status == Status.FRESH;
    }
}
