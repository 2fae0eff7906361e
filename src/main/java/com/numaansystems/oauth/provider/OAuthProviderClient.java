package com.numaansystems.oauth.provider;

import org.springframework.security.oauth2.core.OAuth2AccessToken;

/**
 * An OAuth2 client bound to one identity provider, this application's
 * credentials and its callback URL.
 */
public interface OAuthProviderClient {

    /**
     * @return the provider type this client was created for, lower case
     */
    String getProviderType();

    /**
     * @return the callback URL this client sends as {@code redirect_uri}
     */
    String getRedirectUri();

    /**
     * @return the provider URL the user is redirected to for authorization
     */
    String getAuthorizationUri();

    /**
     * Exchanges an authorization code for an access token.
     *
     * @param code the code the provider passed to the callback route
     * @return the access token issued by the provider
     * @throws com.numaansystems.oauth.exception.TokenExchangeException if the provider rejects the code
     */
    OAuth2AccessToken requestAccessToken(String code);
}
