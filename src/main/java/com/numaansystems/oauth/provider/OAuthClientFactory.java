package com.numaansystems.oauth.provider;

import com.numaansystems.oauth.config.OAuthMiddlewareProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.config.oauth2.client.CommonOAuth2Provider;
import org.springframework.security.oauth2.client.endpoint.OAuth2AccessTokenResponseClient;
import org.springframework.security.oauth2.client.endpoint.OAuth2AuthorizationCodeGrantRequest;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.security.oauth2.core.AuthorizationGrantType;
import org.springframework.security.oauth2.core.ClientAuthenticationMethod;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and caches {@link OAuthProviderClient} instances per provider type.
 *
 * <h2>Client creation</h2>
 * <ol>
 *   <li>Looks the provider type up (case-insensitively) in {@code oauth.providers}</li>
 *   <li>Takes the endpoints from Spring's {@link CommonOAuth2Provider} catalogue when the
 *       type is known there, overridden by any configured endpoints</li>
 *   <li>Derives the callback URL from the current request URL</li>
 *   <li>Applies the configured key, secret and scopes</li>
 * </ol>
 *
 * <p>One client is cached per provider type. It is reused only by requests
 * that derive the same callback URL; a request arriving on another host,
 * scheme or port gets a freshly built client.</p>
 *
 * <p>A provider type without configuration is reported as an empty result,
 * not an exception; callers decide how to fail.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class OAuthClientFactory {

    private static final Logger logger = LoggerFactory.getLogger(OAuthClientFactory.class);

    static final String CALLBACK_SUFFIX = "/callback";

    private final OAuthMiddlewareProperties properties;
    private final OAuth2AccessTokenResponseClient<OAuth2AuthorizationCodeGrantRequest> tokenResponseClient;
    private final Map<String, OAuthProviderClient> registeredClients = new ConcurrentHashMap<>();

    public OAuthClientFactory(OAuthMiddlewareProperties properties,
                              OAuth2AccessTokenResponseClient<OAuth2AuthorizationCodeGrantRequest> tokenResponseClient) {
        this.properties = properties;
        this.tokenResponseClient = tokenResponseClient;
    }

    /**
     * Creates a client for the provider type and registers it in the cache,
     * replacing any client previously registered for that type.
     *
     * @param providerType the provider type, e.g. "github"
     * @param request the current request, used to derive the callback URL
     * @return the created client, empty if the type has no configuration
     */
    public Optional<OAuthProviderClient> createService(String providerType, HttpServletRequest request) {
        String typeLower = providerType.toLowerCase(Locale.ROOT);

        Optional<OAuthMiddlewareProperties.Provider> providerConfig = properties.findProvider(typeLower);
        if (providerConfig.isEmpty()) {
            logger.warn("No OAuth configuration found for provider type: {}", providerType);
            return Optional.empty();
        }

        String callbackUrl = buildCallbackUrl(request);
        ClientRegistration registration = buildRegistration(typeLower, providerConfig.get(), callbackUrl);
        OAuthProviderClient client = new SpringOAuth2ProviderClient(registration, tokenResponseClient);

        registeredClients.put(typeLower, client);
        logger.info("Registered OAuth client for provider {} with callback {}", typeLower, callbackUrl);
        return Optional.of(client);
    }

    /**
     * Returns the registered client for the provider type if it was built for
     * the same callback URL as the current request. Otherwise a client is
     * created for this request and replaces the registered one.
     *
     * @param providerType the provider type
     * @param request the current request
     * @return the client, empty if the type has no configuration
     */
    public Optional<OAuthProviderClient> getOrCreateByType(String providerType, HttpServletRequest request) {
        Optional<OAuthProviderClient> registered = getService(providerType);
        if (registered.isPresent() && registered.get().getRedirectUri().equals(buildCallbackUrl(request))) {
            return registered;
        }
        return createService(providerType, request);
    }

    /**
     * @param providerType the provider type
     * @return the client most recently registered for the type, if any
     */
    public Optional<OAuthProviderClient> getService(String providerType) {
        return Optional.ofNullable(registeredClients.get(providerType.toLowerCase(Locale.ROOT)));
    }

    public OAuthMiddlewareProperties getConfig() {
        return properties;
    }

    /**
     * Current request URL without query string, with {@code /callback} appended
     * unless the request already is the callback route.
     * E.g., http://localhost:8080/auth/github?return=... -> http://localhost:8080/auth/github/callback
     */
    static String buildCallbackUrl(HttpServletRequest request) {
        String currentUrl = request.getRequestURL().toString();
        if (currentUrl.endsWith(CALLBACK_SUFFIX)) {
            return currentUrl;
        }
        return currentUrl + CALLBACK_SUFFIX;
    }

    private ClientRegistration buildRegistration(String typeLower,
                                                 OAuthMiddlewareProperties.Provider config,
                                                 String callbackUrl) {
        ClientRegistration.Builder builder = commonProvider(typeLower)
                .map(provider -> provider.getBuilder(typeLower))
                .orElseGet(() -> ClientRegistration.withRegistrationId(typeLower)
                        .clientAuthenticationMethod(ClientAuthenticationMethod.CLIENT_SECRET_BASIC)
                        .authorizationGrantType(AuthorizationGrantType.AUTHORIZATION_CODE));

        builder.clientId(config.getKey())
                .clientSecret(config.getSecret())
                .redirectUri(callbackUrl)
                .scope(config.getScopes());

        if (StringUtils.hasText(config.getAuthorizationUri())) {
            builder.authorizationUri(config.getAuthorizationUri());
        }
        if (StringUtils.hasText(config.getTokenUri())) {
            builder.tokenUri(config.getTokenUri());
        }

        return builder.build();
    }

    private static Optional<CommonOAuth2Provider> commonProvider(String typeLower) {
        for (CommonOAuth2Provider provider : CommonOAuth2Provider.values()) {
            if (provider.name().toLowerCase(Locale.ROOT).equals(typeLower)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
