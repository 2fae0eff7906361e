package com.numaansystems.oauth.config;

import com.numaansystems.oauth.service.InMemoryUserService;
import com.numaansystems.oauth.service.UserService;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers {@link InMemoryUserService} when the application declares no
 * {@link UserService} of its own.
 *
 * <p>Auto-configurations are processed after all application configuration,
 * so the condition sees every user-defined bean regardless of where it is
 * declared.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@AutoConfiguration
@EnableConfigurationProperties(OAuthMiddlewareProperties.class)
public class UserServiceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(UserService.class)
    public UserService userService(OAuthMiddlewareProperties properties) {
        return new InMemoryUserService(properties.getUserTokenTtlMinutes());
    }
}
