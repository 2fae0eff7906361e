package com.numaansystems.oauth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * Security configuration for the middleware application.
 *
 * <p>Authentication is performed by
 * {@link com.numaansystems.oauth.filter.OAuthMiddlewareFilter}, so Spring
 * Security only contributes CORS handling and its default response headers.
 * The {@code Authorization} and {@code Location} headers are exposed so browser
 * clients can read the token and the return URL after the callback.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final long PREFLIGHT_MAX_AGE_SECONDS = 3600L;

    private final OAuthMiddlewareProperties properties;

    public SecurityConfig(OAuthMiddlewareProperties properties) {
        this.properties = properties;
    }

    /**
     * Leaves every route open; login routes and user resolution belong to
     * {@link com.numaansystems.oauth.filter.OAuthMiddlewareFilter}. Clients
     * authenticate with a header token, and CSRF protection is off.
     *
     * @param http the HttpSecurity to configure
     * @return the middleware's SecurityFilterChain
     * @throws Exception if the chain cannot be built
     */
    @Bean
    public SecurityFilterChain middlewareSecurityFilterChain(HttpSecurity http) throws Exception {
        return http
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            .csrf(AbstractHttpConfigurer::disable)
            .authorizeHttpRequests(requests -> requests.anyRequest().permitAll())
            .build();
    }

    /**
     * CORS rules for browser clients on {@code oauth.cors.allowed-origins}.
     * The token and the return URL travel in response headers, so both are
     * exposed to scripts.
     *
     * @return CORS rules applied to every path
     */
    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration cors = new CorsConfiguration();
        cors.setAllowedOrigins(properties.getCors().getAllowedOrigins());
        cors.setAllowedMethods(List.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS"));
        cors.setAllowedHeaders(List.of("*"));
        cors.setExposedHeaders(List.of(HttpHeaders.AUTHORIZATION, HttpHeaders.LOCATION, HttpHeaders.CONTENT_TYPE));
        // token cookie and return-url cookie
        cors.setAllowCredentials(true);
        cors.setMaxAge(PREFLIGHT_MAX_AGE_SECONDS);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cors);
        return source;
    }
}
