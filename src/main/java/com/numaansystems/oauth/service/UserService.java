package com.numaansystems.oauth.service;

import com.numaansystems.oauth.provider.OAuthProviderClient;
import org.springframework.security.oauth2.core.OAuth2AccessToken;

/**
 * Resolves and creates the users the middleware attaches to requests.
 *
 * <p>Applications replace the default in-memory implementation by declaring
 * their own {@code UserService} bean.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface UserService {

    /**
     * Finds the user owning a credential, or returns a new anonymous user.
     *
     * @param credential the credential parsed from the Authorization header, null if none
     * @return the matching user, or a new user without a token
     */
    AppUser findOrNew(String credential);

    /**
     * Creates (or updates) the user after a successful provider login.
     *
     * @param client the provider client the user authenticated with
     * @param accessToken the access token issued by the provider
     * @return the user, carrying the token the client will use from now on
     */
    AppUser createUser(OAuthProviderClient client, OAuth2AccessToken accessToken);
}
