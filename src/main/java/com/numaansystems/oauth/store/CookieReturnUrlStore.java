package com.numaansystems.oauth.store;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.WebUtils;

import java.util.Optional;

/**
 * Keeps the return URL in a short-lived, signed cookie.
 *
 * <p>The cookie lives for {@value #MAX_AGE_SECONDS} seconds on path {@code /}.
 * A cookie whose signature does not verify reads as absent.</p>
 */
public class CookieReturnUrlStore implements ReturnUrlStore {

    private static final Logger logger = LoggerFactory.getLogger(CookieReturnUrlStore.class);

    static final int MAX_AGE_SECONDS = 10 * 60;

    private final CookieSigner cookieSigner;

    public CookieReturnUrlStore(CookieSigner cookieSigner) {
        this.cookieSigner = cookieSigner;
    }

    @Override
    public void store(HttpServletRequest request, HttpServletResponse response, String url) {
        response.addCookie(newCookie(request, cookieSigner.sign(url), MAX_AGE_SECONDS));
        logger.debug("Stored return URL in cookie {}", RETURN_URL_KEY);
    }

    @Override
    public Optional<String> retrieve(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, RETURN_URL_KEY);
        if (cookie == null) {
            return Optional.empty();
        }
        String url = cookieSigner.verifyAndExtract(cookie.getValue());
        if (url == null) {
            logger.warn("Discarding return URL cookie with an invalid signature");
            return Optional.empty();
        }
        return Optional.of(url);
    }

    @Override
    public void clear(HttpServletRequest request, HttpServletResponse response) {
        response.addCookie(newCookie(request, "", 0));
    }

    private Cookie newCookie(HttpServletRequest request, String value, int maxAge) {
        Cookie cookie = new Cookie(RETURN_URL_KEY, value);
        cookie.setMaxAge(maxAge);
        cookie.setPath("/");
        cookie.setHttpOnly(true);
        cookie.setSecure(request.isSecure());
        return cookie;
    }
}
