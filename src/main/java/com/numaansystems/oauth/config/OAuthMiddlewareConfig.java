package com.numaansystems.oauth.config;

import com.numaansystems.oauth.provider.OAuthClientFactory;
import com.numaansystems.oauth.store.CookieReturnUrlStore;
import com.numaansystems.oauth.store.CookieSigner;
import com.numaansystems.oauth.store.ReturnUrlStore;
import com.numaansystems.oauth.store.SessionReturnUrlStore;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.security.oauth2.client.endpoint.DefaultAuthorizationCodeTokenResponseClient;
import org.springframework.security.oauth2.client.endpoint.OAuth2AccessTokenResponseClient;
import org.springframework.security.oauth2.client.endpoint.OAuth2AuthorizationCodeGrantRequest;
import org.springframework.security.oauth2.client.http.OAuth2ErrorResponseErrorHandler;
import org.springframework.security.oauth2.core.http.converter.OAuth2AccessTokenResponseHttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;

/**
 * Wires the collaborators of {@link com.numaansystems.oauth.filter.OAuthMiddlewareFilter}.
 *
 * <ul>
 *   <li>HTTP client and token response client used for the code exchange</li>
 *   <li>{@link OAuthClientFactory} building provider clients from configuration</li>
 *   <li>{@link ReturnUrlStore} selected by {@code oauth.return-url-storage}</li>
 * </ul>
 *
 * <p>The default {@code UserService} comes from {@link UserServiceAutoConfiguration}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
@EnableConfigurationProperties(OAuthMiddlewareProperties.class)
public class OAuthMiddlewareConfig {

    private static final Logger logger = LoggerFactory.getLogger(OAuthMiddlewareConfig.class);

    /**
     * Shared HTTP client for token exchange calls, closed when the context shuts down.
     */
    @Bean(destroyMethod = "close")
    public CloseableHttpClient oauthHttpClient(OAuthMiddlewareProperties properties) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(properties.getHttp().getConnectTimeoutMs()))
                .setSocketTimeout(Timeout.ofMilliseconds(properties.getHttp().getReadTimeoutMs()))
                .build();

        logger.info("OAuth HTTP client initialized with connect timeout {}ms, read timeout {}ms",
                properties.getHttp().getConnectTimeoutMs(), properties.getHttp().getReadTimeoutMs());

        return HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig)
                        .build())
                .build();
    }

    /**
     * Performs the authorization code grant, with the converters and error
     * handler Spring Security expects on its RestTemplate.
     */
    @Bean
    public OAuth2AccessTokenResponseClient<OAuth2AuthorizationCodeGrantRequest> authorizationCodeTokenResponseClient(
            CloseableHttpClient oauthHttpClient) {
        RestTemplate restTemplate = new RestTemplate(Arrays.asList(
                new FormHttpMessageConverter(), new OAuth2AccessTokenResponseHttpMessageConverter()));
        restTemplate.setErrorHandler(new OAuth2ErrorResponseErrorHandler());
        restTemplate.setRequestFactory(new HttpComponentsClientHttpRequestFactory(oauthHttpClient));

        DefaultAuthorizationCodeTokenResponseClient tokenResponseClient = new DefaultAuthorizationCodeTokenResponseClient();
        tokenResponseClient.setRestOperations(restTemplate);
        return tokenResponseClient;
    }

    @Bean
    public OAuthClientFactory oAuthClientFactory(
            OAuthMiddlewareProperties properties,
            OAuth2AccessTokenResponseClient<OAuth2AuthorizationCodeGrantRequest> authorizationCodeTokenResponseClient) {
        return new OAuthClientFactory(properties, authorizationCodeTokenResponseClient);
    }

    @Bean
    public ReturnUrlStore returnUrlStore(OAuthMiddlewareProperties properties) {
        logger.info("Return URL storage: {}", properties.getReturnUrlStorage());
        return switch (properties.getReturnUrlStorage()) {
            case SESSION -> new SessionReturnUrlStore();
            case COOKIE -> new CookieReturnUrlStore(new CookieSigner(properties.getCookieSecret()));
        };
    }
}
