package com.numaansystems.oauth.service;

import com.numaansystems.oauth.provider.OAuthProviderClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.core.OAuth2AccessToken;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for InMemoryUserService.
 *
 * <p>Tests user creation, token lookup, expiration, and active user tracking.</p>
 */
class InMemoryUserServiceTest {

    private InMemoryUserService userService;
    private OAuthProviderClient client;

    @BeforeEach
    void setUp() {
        userService = new InMemoryUserService(2L);
        client = mock(OAuthProviderClient.class);
        when(client.getProviderType()).thenReturn("github");
    }

    @AfterEach
    void tearDown() {
        userService.shutdown();
    }

    @Test
    @DisplayName("Should create user with a fresh token")
    void testCreateUser() {
        // Act
        AppUser user = userService.createUser(client, accessToken());

        // Assert
        assertTrue(user.hasToken(), "User should carry a token");
        assertNotEquals("gho_provider_token", user.getToken(), "Provider token should not be handed out");
        assertEquals("github", user.getProviderType());
        assertTrue(user.getExpiresAt() > System.currentTimeMillis());
        assertEquals(1, userService.getActiveUserCount(), "Should have one active user");
    }

    @Test
    @DisplayName("Should find user by token")
    void testFindUser() {
        // Arrange
        AppUser created = userService.createUser(client, accessToken());

        // Act
        AppUser found = userService.findOrNew(created.getToken());

        // Assert
        assertSame(created, found);
    }

    @Test
    @DisplayName("Should return anonymous user for missing or unknown credential")
    void testFindAnonymous() {
        assertFalse(userService.findOrNew(null).hasToken());
        assertFalse(userService.findOrNew("").hasToken());
        assertFalse(userService.findOrNew("unknown-token").hasToken());
    }

    @Test
    @DisplayName("Should issue distinct tokens for each login")
    void testUniqueTokens() {
        AppUser first = userService.createUser(client, accessToken());
        AppUser second = userService.createUser(client, accessToken());

        assertNotEquals(first.getToken(), second.getToken());
        assertEquals(2, userService.getActiveUserCount());
    }

    @Test
    @DisplayName("Should reject expired token")
    void testExpiredToken() {
        // Arrange
        AppUser created = userService.createUser(client, accessToken());
        AppUser expired = new AppUser(created.getToken(), "github", System.currentTimeMillis() - 1000);
        @SuppressWarnings("unchecked")
        java.util.Map<String, AppUser> users =
                (java.util.Map<String, AppUser>) ReflectionTestUtils.getField(userService, "users");
        users.put(created.getToken(), expired);

        // Act
        AppUser found = userService.findOrNew(created.getToken());

        // Assert
        assertFalse(found.hasToken(), "Expired token should resolve to anonymous user");
        assertEquals(0, userService.getActiveUserCount(), "Expired user should be removed");
    }

    private static OAuth2AccessToken accessToken() {
        Instant now = Instant.now();
        return new OAuth2AccessToken(OAuth2AccessToken.TokenType.BEARER, "gho_provider_token", now, now.plusSeconds(3600));
    }
}
