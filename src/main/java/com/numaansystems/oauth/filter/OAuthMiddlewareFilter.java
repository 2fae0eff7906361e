package com.numaansystems.oauth.filter;

import com.numaansystems.oauth.config.OAuthMiddlewareProperties;
import com.numaansystems.oauth.exception.InvalidReturnUrlException;
import com.numaansystems.oauth.exception.TokenExchangeException;
import com.numaansystems.oauth.exception.UnknownProviderConfigException;
import com.numaansystems.oauth.exception.UnknownProviderTypeException;
import com.numaansystems.oauth.provider.OAuthClientFactory;
import com.numaansystems.oauth.provider.OAuthProviderClient;
import com.numaansystems.oauth.service.AppUser;
import com.numaansystems.oauth.service.UserService;
import com.numaansystems.oauth.store.ReturnUrlStore;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.oauth2.core.OAuth2AccessToken;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * Servlet filter adding provider (OAuth2) login to the application.
 *
 * <h2>Routes</h2>
 * <ul>
 *   <li>{@code GET /auth/{providerType}?return=<url>} - stores the return URL and
 *       redirects (302) to the provider's authorization page</li>
 *   <li>{@code GET /auth/{providerType}/callback?code=<code>} - exchanges the code,
 *       creates the user and answers 200 with {@code Authorization} and
 *       {@code Location} pointing back to the stored return URL</li>
 * </ul>
 *
 * <h2>Every other request</h2>
 * <p>The credential from the {@code Authorization} header (schemes {@code bearer}
 * or {@code token}) is resolved to a user, which is set as request attribute
 * {@value #USER_ATTRIBUTE}. If that user carries a token it is echoed back as
 * {@code Authorization: token <value>}. The request then continues down the
 * chain.</p>
 *
 * <h2>Failures</h2>
 * <p>Unknown provider types, invalid return URLs and failed token exchanges are
 * thrown as {@link com.numaansystems.oauth.exception.OAuthMiddlewareException}
 * subclasses to the container's error handling.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class OAuthMiddlewareFilter implements Filter {

    private static final Logger logger = LoggerFactory.getLogger(OAuthMiddlewareFilter.class);

    public static final String USER_ATTRIBUTE = "user";

    static final String PARAM_RETURN = "return";
    static final String PARAM_CODE = "code";
    static final String PARAM_ERROR = "error";
    static final String TOKEN_SCHEME = "token ";
    static final int TOKEN_COOKIE_MAX_AGE_SECONDS = 60 * 60;

    private final OAuthClientFactory oAuthClientFactory;
    private final UserService userService;
    private final ReturnUrlStore returnUrlStore;
    private final OAuthMiddlewareProperties properties;
    private final AuthRouteMatcher routeMatcher = new AuthRouteMatcher();
    private final AuthHeaderParser authHeaderParser = new AuthHeaderParser();

    public OAuthMiddlewareFilter(OAuthClientFactory oAuthClientFactory,
                                 UserService userService,
                                 ReturnUrlStore returnUrlStore,
                                 OAuthMiddlewareProperties properties) {
        this.oAuthClientFactory = oAuthClientFactory;
        this.userService = userService;
        this.returnUrlStore = returnUrlStore;
        this.properties = properties;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        RouteMatch route = routeMatcher.match(requestPath(httpRequest));
        switch (route.type()) {
            case INITIATE -> initiateAuthorization(route.providerType(), httpRequest, httpResponse);
            case CALLBACK -> completeAuthorization(route.providerType(), httpRequest, httpResponse);
            case PASS_THROUGH -> passThrough(httpRequest, httpResponse, chain);
        }
    }

    /**
     * Validates the provider and return URL, stores the return URL and redirects
     * to the provider's authorization endpoint.
     */
    private void initiateAuthorization(String providerType,
                                       HttpServletRequest request,
                                       HttpServletResponse response) {
        requireAllowedProvider(providerType);

        String returnUrl = request.getParameter(PARAM_RETURN);
        if (!isValidReturnUrl(returnUrl)) {
            logger.warn("Rejected {} login with invalid return url: {}", providerType, returnUrl);
            throw new InvalidReturnUrlException("Invalid return url: " + returnUrl);
        }

        returnUrlStore.store(request, response, returnUrl);

        OAuthProviderClient client = requireClient(providerType, request);
        String authorizationUri = client.getAuthorizationUri();

        logger.info("Redirecting to {} authorization, return url: {}", providerType, returnUrl);
        response.setStatus(HttpServletResponse.SC_FOUND);
        response.setHeader(HttpHeaders.LOCATION, authorizationUri);
    }

    /**
     * Exchanges the authorization code, creates the user and points the client
     * back at the stored return URL, delivering the token as configured.
     */
    private void completeAuthorization(String providerType,
                                       HttpServletRequest request,
                                       HttpServletResponse response) {
        requireAllowedProvider(providerType);

        OAuthProviderClient client = requireClient(providerType, request);

        String error = request.getParameter(PARAM_ERROR);
        if (StringUtils.hasText(error)) {
            logger.warn("Provider {} returned error on callback: {}", providerType, error);
            throw new TokenExchangeException("Provider " + providerType + " returned error: " + error);
        }

        String code = request.getParameter(PARAM_CODE);
        if (!StringUtils.hasText(code)) {
            logger.warn("Callback from {} without authorization code", providerType);
            throw new TokenExchangeException("Missing authorization code");
        }

        OAuth2AccessToken accessToken = client.requestAccessToken(code);
        AppUser user = userService.createUser(client, accessToken);

        String returnUrl = returnUrlStore.retrieve(request)
                .orElseThrow(() -> new InvalidReturnUrlException("No return url stored for this login"));
        returnUrlStore.clear(request, response);

        if (StringUtils.hasText(properties.getTokenCookie())) {
            Cookie tokenCookie = new Cookie(properties.getTokenCookie(), user.getToken());
            tokenCookie.setMaxAge(TOKEN_COOKIE_MAX_AGE_SECONDS);
            tokenCookie.setPath("/");
            tokenCookie.setSecure(request.isSecure());
            response.addCookie(tokenCookie);
        } else if (StringUtils.hasText(properties.getTokenUrlparam())) {
            returnUrl = appendTokenParam(returnUrl, properties.getTokenUrlparam(), user.getToken());
        }

        logger.info("Completed {} login, redirecting to {}", providerType, stripQuery(returnUrl));
        response.setStatus(HttpServletResponse.SC_OK);
        response.setHeader(HttpHeaders.AUTHORIZATION, TOKEN_SCHEME + user.getToken());
        response.setHeader(HttpHeaders.LOCATION, returnUrl);
    }

    /**
     * Resolves the acting user, attaches it to the request and continues the chain.
     */
    private void passThrough(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        Enumeration<String> authHeaders = request.getHeaders(HttpHeaders.AUTHORIZATION);
        String credential = authHeaderParser
                .parse(authHeaders != null ? Collections.list(authHeaders) : List.of())
                .orElse(null);

        AppUser user = userService.findOrNew(credential);
        request.setAttribute(USER_ATTRIBUTE, user);

        if (user.hasToken()) {
            response.setHeader(HttpHeaders.AUTHORIZATION, TOKEN_SCHEME + user.getToken());
        }

        chain.doFilter(request, response);
    }

    private void requireAllowedProvider(String providerType) {
        if (!properties.isAllowedProvider(providerType)) {
            logger.warn("Rejected unknown OAuth provider type: {}", providerType);
            throw new UnknownProviderTypeException(providerType);
        }
    }

    private OAuthProviderClient requireClient(String providerType, HttpServletRequest request) {
        return oAuthClientFactory.getOrCreateByType(providerType, request)
                .orElseThrow(() -> new UnknownProviderConfigException(providerType));
    }

    private static String requestPath(HttpServletRequest request) {
        String requestUri = request.getRequestURI();
        if (requestUri == null) {
            return null;
        }
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && requestUri.startsWith(contextPath)) {
            return requestUri.substring(contextPath.length());
        }
        return requestUri;
    }

    /**
     * A return URL must parse as an absolute URI with a host.
     */
    static boolean isValidReturnUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url);
            return uri.isAbsolute() && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    static String appendTokenParam(String returnUrl, String paramName, String token) {
        String separator = returnUrl.contains("?") ? "&" : "?";
        return returnUrl + separator + paramName + "=" + token;
    }

    private static String stripQuery(String url) {
        int queryIndex = url.indexOf('?');
        return queryIndex < 0 ? url : url.substring(0, queryIndex);
    }
}
