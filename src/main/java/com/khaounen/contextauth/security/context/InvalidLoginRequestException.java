package com.khaounen.contextauth.security.context;

/**
 * A request is missing required fields or carries values out of range. Raised
 * before anything is written.
 */
public class InvalidLoginRequestException extends RuntimeException {

    public InvalidLoginRequestException(String message) {
        super(message);
    }
}
