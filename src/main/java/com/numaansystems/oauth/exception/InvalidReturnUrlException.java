package com.numaansystems.oauth.exception;

public class InvalidReturnUrlException extends OAuthMiddlewareException {

    public InvalidReturnUrlException(String message) {
        super(message);
    }

    public InvalidReturnUrlException(String message, Throwable cause) {
        super(message, cause);
    }
}
