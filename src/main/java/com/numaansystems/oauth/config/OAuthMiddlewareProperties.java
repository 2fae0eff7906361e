package com.numaansystems.oauth.config;

import com.numaansystems.oauth.store.ReturnUrlStorage;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration for the OAuth middleware, bound from the {@code oauth} prefix.
 *
 * <h2>Example</h2>
 * <pre>
 * oauth:
 *   allowed-providers: [github]
 *   return-url-storage: cookie
 *   token-urlparam: access_token
 *   providers:
 *     github:
 *       key: ${GITHUB_CLIENT_ID}
 *       secret: ${GITHUB_CLIENT_SECRET}
 *       scopes: [read:user]
 * </pre>
 *
 * <p>{@code token-cookie} and {@code token-urlparam} are mutually exclusive;
 * configuring both fails startup.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@ConfigurationProperties(prefix = "oauth")
public class OAuthMiddlewareProperties {

    private List<String> allowedProviders = new ArrayList<>(List.of("github"));

    private Map<String, Provider> providers = new LinkedHashMap<>();

    private ReturnUrlStorage returnUrlStorage = ReturnUrlStorage.SESSION;

    private String tokenCookie;

    private String tokenUrlparam;

    private String cookieSecret;

    private long userTokenTtlMinutes = 60;

    private Http http = new Http();

    private Cors cors = new Cors();

    @PostConstruct
    public void validate() {
        if (StringUtils.hasText(tokenCookie) && StringUtils.hasText(tokenUrlparam)) {
            throw new IllegalStateException(
                    "oauth.token-cookie and oauth.token-urlparam cannot both be configured");
        }
        if (userTokenTtlMinutes <= 0) {
            throw new IllegalStateException("oauth.user-token-ttl-minutes must be positive");
        }
    }

    /**
     * Looks up a provider's configuration, ignoring case of the type name.
     *
     * @param providerType the provider type, e.g. "github"
     * @return the provider configuration, empty if none is configured
     */
    public Optional<Provider> findProvider(String providerType) {
        if (providerType == null) {
            return Optional.empty();
        }
        String typeLower = providerType.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Provider> entry : providers.entrySet()) {
            if (entry.getKey().toLowerCase(Locale.ROOT).equals(typeLower)) {
                return Optional.ofNullable(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public boolean isAllowedProvider(String providerType) {
        return providerType != null && allowedProviders.contains(providerType);
    }

    public List<String> getAllowedProviders() {
        return allowedProviders;
    }

    public void setAllowedProviders(List<String> allowedProviders) {
        this.allowedProviders = allowedProviders;
    }

    public Map<String, Provider> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, Provider> providers) {
        this.providers = providers;
    }

    public ReturnUrlStorage getReturnUrlStorage() {
        return returnUrlStorage;
    }

    public void setReturnUrlStorage(ReturnUrlStorage returnUrlStorage) {
        this.returnUrlStorage = returnUrlStorage;
    }

    public String getTokenCookie() {
        return tokenCookie;
    }

    public void setTokenCookie(String tokenCookie) {
        this.tokenCookie = tokenCookie;
    }

    public String getTokenUrlparam() {
        return tokenUrlparam;
    }

    public void setTokenUrlparam(String tokenUrlparam) {
        this.tokenUrlparam = tokenUrlparam;
    }

    public String getCookieSecret() {
        return cookieSecret;
    }

    public void setCookieSecret(String cookieSecret) {
        this.cookieSecret = cookieSecret;
    }

    public long getUserTokenTtlMinutes() {
        return userTokenTtlMinutes;
    }

    public void setUserTokenTtlMinutes(long userTokenTtlMinutes) {
        this.userTokenTtlMinutes = userTokenTtlMinutes;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Cors getCors() {
        return cors;
    }

    public void setCors(Cors cors) {
        this.cors = cors;
    }

    /**
     * Credentials and endpoints of one identity provider.
     */
    public static class Provider {

        private String key;

        private String secret;

        private List<String> scopes = new ArrayList<>();

        /** Overrides the catalogue endpoint; required for providers Spring does not know. */
        private String authorizationUri;

        private String tokenUri;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public List<String> getScopes() {
            return scopes;
        }

        public void setScopes(List<String> scopes) {
            this.scopes = scopes;
        }

        public String getAuthorizationUri() {
            return authorizationUri;
        }

        public void setAuthorizationUri(String authorizationUri) {
            this.authorizationUri = authorizationUri;
        }

        public String getTokenUri() {
            return tokenUri;
        }

        public void setTokenUri(String tokenUri) {
            this.tokenUri = tokenUri;
        }
    }

    /**
     * Timeouts of the HTTP client used for the token exchange.
     */
    public static class Http {

        private int connectTimeoutMs = 5000;

        private int readTimeoutMs = 10000;

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }

    public static class Cors {

        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:8080"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}
