package com.khaounen.contextauth.security.identity;

public class IdentityStoreException extends RuntimeException {

    public IdentityStoreException(String message) {
        super(message);
    }

    public IdentityStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
