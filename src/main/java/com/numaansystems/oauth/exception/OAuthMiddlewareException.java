package com.numaansystems.oauth.exception;

/**
 * Base type for failures that abort an OAuth route request.
 *
 * <p>These are raised out of the middleware filter to the servlet container's
 * error handling. The middleware never writes a partial response for them.</p>
 */
public class OAuthMiddlewareException extends RuntimeException {

    public OAuthMiddlewareException(String message) {
        super(message);
    }

    public OAuthMiddlewareException(String message, Throwable cause) {
        super(message, cause);
    }
}
