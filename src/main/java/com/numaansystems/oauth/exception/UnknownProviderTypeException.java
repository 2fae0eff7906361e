package com.numaansystems.oauth.exception;

/**
 * Thrown when the provider segment of an auth route is not in the allow-list.
 */
public class UnknownProviderTypeException extends OAuthMiddlewareException {

    private final String providerType;

    public UnknownProviderTypeException(String providerType) {
        super("Unknown OAuth provider type: " + providerType);
        this.providerType = providerType;
    }

    public String getProviderType() {
        return providerType;
    }
}
