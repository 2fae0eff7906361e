package com.numaansystems.oauth.exception;

/**
 * Thrown when an allowed provider type has no credentials configured.
 */
public class UnknownProviderConfigException extends OAuthMiddlewareException {

    private final String providerType;

    public UnknownProviderConfigException(String providerType) {
        super("No OAuth configuration for provider type: " + providerType);
        this.providerType = providerType;
    }

    public String getProviderType() {
        return providerType;
    }
}
