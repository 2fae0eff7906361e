package com.numaansystems.oauth.exception;

/**
 * Raised when the provider refuses or fails the authorization code exchange.
 */
public class TokenExchangeException extends OAuthMiddlewareException {

    public TokenExchangeException(String message) {
        super(message);
    }

    public TokenExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
