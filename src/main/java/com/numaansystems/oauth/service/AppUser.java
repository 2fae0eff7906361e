package com.numaansystems.oauth.service;

/**
 * The user attached to each request by the middleware.
 *
 * <p>An anonymous user carries an empty token and no provider.</p>
 */
public class AppUser {

    private static final AppUser ANONYMOUS = new AppUser("", null, 0L);

    private final String token;
    private final String providerType;
    private final long expiresAt;

    public AppUser(String token, String providerType, long expiresAt) {
        this.token = token != null ? token : "";
        this.providerType = providerType;
        this.expiresAt = expiresAt;
    }

    public static AppUser anonymous() {
        return ANONYMOUS;
    }

    /** Opaque token identifying this user to the application, empty if anonymous. */
    public String getToken() {
        return token;
    }

    public boolean hasToken() {
        return !token.isEmpty();
    }

    /** Provider the user authenticated with, null if anonymous. */
    public String getProviderType() {
        return providerType;
    }

    /** Expiration timestamp (milliseconds since epoch), 0 if anonymous. */
    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(long now) {
        return hasToken() && now > expiresAt;
    }
}
