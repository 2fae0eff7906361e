package com.numaansystems.oauth;

import com.numaansystems.oauth.exception.UnknownProviderTypeException;
import com.numaansystems.oauth.filter.OAuthMiddlewareFilter;
import com.numaansystems.oauth.provider.OAuthClientFactory;
import com.numaansystems.oauth.service.UserService;
import com.numaansystems.oauth.store.ReturnUrlStore;
import com.numaansystems.oauth.store.SessionReturnUrlStore;
import io.swagger.v3.oas.models.OpenAPI;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for the OAuth middleware application.
 *
 * <p>These tests verify that the Spring application context loads correctly,
 * that the middleware beans are wired from configuration and that the filter
 * handles requests end to end.</p>
 */
@SpringBootTest
@AutoConfigureMockMvc
class OAuthMiddlewareApplicationTests {

    @Autowired
    private ApplicationContext applicationContext;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private OAuthClientFactory oAuthClientFactory;

    @Autowired
    private ReturnUrlStore returnUrlStore;

    @Autowired
    private UserService userService;

    @Autowired
    private OpenAPI openAPI;

    @Test
    @DisplayName("Should load application context")
    void contextLoads() {
        assertNotNull(applicationContext, "Application context should not be null");
        assertNotNull(applicationContext.getBean(OAuthMiddlewareFilter.class), "Filter bean should be available");
        assertNotNull(userService, "UserService bean should be available");
    }

    @Test
    @DisplayName("Should bind provider configuration and storage from properties")
    void testConfigurationBinding() {
        assertTrue(returnUrlStore instanceof SessionReturnUrlStore, "Session storage should be configured");
        assertTrue(oAuthClientFactory.getConfig().findProvider("github").isPresent());
        assertEquals("test-client-id", oAuthClientFactory.getConfig().findProvider("github").get().getKey());
    }

    @Test
    @DisplayName("Should redirect to GitHub and store the return URL in the session")
    void testInitiateLogin() throws Exception {
        mockMvc.perform(get("/auth/github").param("return", "https://app.example.com/done"))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION,
                        startsWith("https://github.com/login/oauth/authorize")))
                .andExpect(request().sessionAttribute(ReturnUrlStore.RETURN_URL_KEY, "https://app.example.com/done"));
    }

    @Test
    @DisplayName("Should reject login for a provider that is not allowed")
    void testUnknownProvider() {
        Exception ex = assertThrows(Exception.class,
                () -> mockMvc.perform(get("/auth/bogus").param("return", "https://app.example.com/done")));

        assertTrue(NestedExceptionUtils.getMostSpecificCause(ex) instanceof UnknownProviderTypeException);
    }

    @Test
    @DisplayName("Should report anonymous user without a token")
    void testAnonymousUser() throws Exception {
        mockMvc.perform(get("/user"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist(HttpHeaders.AUTHORIZATION))
                .andExpect(jsonPath("$.authenticated").value(false));
    }

    @Test
    @DisplayName("Should expose token headers to allowed CORS origins")
    void testCorsExposesHeaders() throws Exception {
        mockMvc.perform(get("/user").header(HttpHeaders.ORIGIN, "http://localhost:3000"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3000"))
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_EXPOSE_HEADERS, containsString(HttpHeaders.AUTHORIZATION)));
    }

    @Test
    @DisplayName("Should document the login routes")
    void testOpenApiPaths() {
        assertNotNull(openAPI.getPaths().get("/auth/{providerType}"));
        assertNotNull(openAPI.getPaths().get("/auth/{providerType}/callback"));
    }
}
