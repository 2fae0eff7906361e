package com.numaansystems.oauth.config;

import com.numaansystems.oauth.provider.OAuthProviderClient;
import com.numaansystems.oauth.service.AppUser;
import com.numaansystems.oauth.service.InMemoryUserService;
import com.numaansystems.oauth.service.UserService;
import com.numaansystems.oauth.store.CookieReturnUrlStore;
import com.numaansystems.oauth.store.ReturnUrlStore;
import com.numaansystems.oauth.store.SessionReturnUrlStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.core.OAuth2AccessToken;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests bean wiring of OAuthMiddlewareConfig for each configuration option.
 */
class OAuthMiddlewareConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(UserServiceAutoConfiguration.class))
            .withUserConfiguration(OAuthMiddlewareConfig.class);

    @Test
    @DisplayName("Should use session storage and in-memory users by default")
    void testDefaults() {
        contextRunner.run(context -> {
            assertTrue(context.getBean(ReturnUrlStore.class) instanceof SessionReturnUrlStore);
            assertTrue(context.getBean(UserService.class) instanceof InMemoryUserService);
        });
    }

    @Test
    @DisplayName("Should use signed cookie storage when configured")
    void testCookieStorage() {
        contextRunner
                .withPropertyValues("oauth.return-url-storage=cookie", "oauth.cookie-secret=secret")
                .run(context -> assertTrue(context.getBean(ReturnUrlStore.class) instanceof CookieReturnUrlStore));
    }

    @Test
    @DisplayName("Should fail startup when both token delivery options are configured")
    void testConflictingTokenDelivery() {
        contextRunner
                .withPropertyValues("oauth.token-cookie=oauth_token", "oauth.token-urlparam=access_token")
                .run(context -> assertNotNull(context.getStartupFailure(), "Startup should fail"));
    }

    @Test
    @DisplayName("Should keep an application-defined UserService declared after the middleware config")
    void testCustomUserService() {
        contextRunner
                .withUserConfiguration(CustomUserServiceConfig.class)
                .run(context -> {
                    assertEquals(1, context.getBeansOfType(UserService.class).size());
                    assertTrue(context.getBean(UserService.class) instanceof FixedUserService);
                });
    }

    @Configuration
    static class CustomUserServiceConfig {

        @Bean
        UserService userService() {
            return new FixedUserService();
        }
    }

    static class FixedUserService implements UserService {

        @Override
        public AppUser findOrNew(String credential) {
            return AppUser.anonymous();
        }

        @Override
        public AppUser createUser(OAuthProviderClient client, OAuth2AccessToken accessToken) {
            return new AppUser("fixed", client.getProviderType(), Long.MAX_VALUE);
        }
    }
}
