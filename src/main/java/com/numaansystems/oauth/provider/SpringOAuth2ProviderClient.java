package com.numaansystems.oauth.provider;

import com.numaansystems.oauth.exception.TokenExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.client.endpoint.OAuth2AccessTokenResponseClient;
import org.springframework.security.oauth2.client.endpoint.OAuth2AuthorizationCodeGrantRequest;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.security.oauth2.core.OAuth2AccessToken;
import org.springframework.security.oauth2.core.OAuth2AuthorizationException;
import org.springframework.security.oauth2.core.endpoint.OAuth2AccessTokenResponse;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationExchange;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationResponse;

import java.util.Set;

/**
 * {@link OAuthProviderClient} backed by Spring Security's OAuth2 client support.
 *
 * <p>The {@link ClientRegistration} carries the provider endpoints, the
 * credentials and the callback URL; the token response client performs the
 * authorization code grant over HTTP.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class SpringOAuth2ProviderClient implements OAuthProviderClient {

    private static final Logger logger = LoggerFactory.getLogger(SpringOAuth2ProviderClient.class);

    private final ClientRegistration registration;
    private final OAuth2AccessTokenResponseClient<OAuth2AuthorizationCodeGrantRequest> tokenResponseClient;

    public SpringOAuth2ProviderClient(ClientRegistration registration,
                                      OAuth2AccessTokenResponseClient<OAuth2AuthorizationCodeGrantRequest> tokenResponseClient) {
        this.registration = registration;
        this.tokenResponseClient = tokenResponseClient;
    }

    @Override
    public String getProviderType() {
        return registration.getRegistrationId();
    }

    @Override
    public String getRedirectUri() {
        return registration.getRedirectUri();
    }

    @Override
    public String getAuthorizationUri() {
        return authorizationRequest().getAuthorizationRequestUri();
    }

    @Override
    public OAuth2AccessToken requestAccessToken(String code) {
        OAuth2AuthorizationResponse authorizationResponse = OAuth2AuthorizationResponse.success(code)
                .redirectUri(registration.getRedirectUri())
                .build();
        OAuth2AuthorizationCodeGrantRequest grantRequest = new OAuth2AuthorizationCodeGrantRequest(
                registration, new OAuth2AuthorizationExchange(authorizationRequest(), authorizationResponse));

        try {
            OAuth2AccessTokenResponse tokenResponse = tokenResponseClient.getTokenResponse(grantRequest);
            logger.info("Exchanged authorization code for {} access token", getProviderType());
            return tokenResponse.getAccessToken();
        } catch (OAuth2AuthorizationException e) {
            logger.warn("Token exchange with {} failed: {}", getProviderType(), e.getError().getErrorCode());
            throw new TokenExchangeException(
                    "Token exchange with " + getProviderType() + " failed: " + e.getError().getErrorCode(), e);
        }
    }

    public ClientRegistration getRegistration() {
        return registration;
    }

    private OAuth2AuthorizationRequest authorizationRequest() {
        Set<String> scopes = registration.getScopes() != null ? registration.getScopes() : Set.of();
        return OAuth2AuthorizationRequest.authorizationCode()
                .authorizationUri(registration.getProviderDetails().getAuthorizationUri())
                .clientId(registration.getClientId())
                .redirectUri(registration.getRedirectUri())
                .scopes(scopes)
                .build();
    }
}
