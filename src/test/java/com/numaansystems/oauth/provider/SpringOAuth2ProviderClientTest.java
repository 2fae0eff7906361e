package com.numaansystems.oauth.provider;

import com.numaansystems.oauth.exception.TokenExchangeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.security.config.oauth2.client.CommonOAuth2Provider;
import org.springframework.security.oauth2.client.endpoint.DefaultAuthorizationCodeTokenResponseClient;
import org.springframework.security.oauth2.client.http.OAuth2ErrorResponseErrorHandler;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.security.oauth2.core.OAuth2AccessToken;
import org.springframework.security.oauth2.core.http.converter.OAuth2AccessTokenResponseHttpMessageConverter;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * Unit tests for SpringOAuth2ProviderClient against a mocked token endpoint.
 */
class SpringOAuth2ProviderClientTest {

    private static final String TOKEN_URI = "https://github.com/login/oauth/access_token";
    private static final String CALLBACK_URL = "http://localhost/auth/github/callback";

    private MockRestServiceServer server;
    private SpringOAuth2ProviderClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate(Arrays.asList(
                new FormHttpMessageConverter(), new OAuth2AccessTokenResponseHttpMessageConverter()));
        restTemplate.setErrorHandler(new OAuth2ErrorResponseErrorHandler());
        server = MockRestServiceServer.bindTo(restTemplate).build();

        DefaultAuthorizationCodeTokenResponseClient tokenResponseClient = new DefaultAuthorizationCodeTokenResponseClient();
        tokenResponseClient.setRestOperations(restTemplate);

        ClientRegistration registration = CommonOAuth2Provider.GITHUB.getBuilder("github")
                .clientId("test-client-id")
                .clientSecret("test-client-secret")
                .redirectUri(CALLBACK_URL)
                .build();
        client = new SpringOAuth2ProviderClient(registration, tokenResponseClient);
    }

    @Test
    @DisplayName("Should build authorization URI with client id and response type")
    void testAuthorizationUri() {
        String uri = client.getAuthorizationUri();

        assertTrue(uri.startsWith("https://github.com/login/oauth/authorize?"));
        assertTrue(uri.contains("response_type=code"));
        assertTrue(uri.contains("client_id=test-client-id"));
        assertTrue(uri.contains("redirect_uri="));
        assertEquals("github", client.getProviderType());
    }

    @Test
    @DisplayName("Should exchange authorization code for access token")
    void testRequestAccessToken() {
        // Arrange
        server.expect(requestTo(TOKEN_URI))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string(containsString("code=auth-code")))
                .andExpect(content().string(containsString("grant_type=authorization_code")))
                .andRespond(withSuccess(
                        "{\"access_token\":\"gho_abc\",\"token_type\":\"bearer\",\"scope\":\"read:user\"}",
                        MediaType.APPLICATION_JSON));

        // Act
        OAuth2AccessToken accessToken = client.requestAccessToken("auth-code");

        // Assert
        assertEquals("gho_abc", accessToken.getTokenValue());
        assertEquals(OAuth2AccessToken.TokenType.BEARER, accessToken.getTokenType());
        server.verify();
    }

    @Test
    @DisplayName("Should translate provider error response into TokenExchangeException")
    void testRequestAccessTokenRejected() {
        // Arrange
        server.expect(requestTo(TOKEN_URI))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"bad_verification_code\"}"));

        // Act
        TokenExchangeException ex = assertThrows(TokenExchangeException.class,
                () -> client.requestAccessToken("expired-code"));

        // Assert
        assertTrue(ex.getMessage().contains("github"));
        server.verify();
    }
}
