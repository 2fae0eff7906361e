package com.numaansystems.oauth.store;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Keeps the return URL in the server-side HTTP session.
 */
public class SessionReturnUrlStore implements ReturnUrlStore {

    private static final Logger logger = LoggerFactory.getLogger(SessionReturnUrlStore.class);

    @Override
    public void store(HttpServletRequest request, HttpServletResponse response, String url) {
        HttpSession session = request.getSession(true);
        session.setAttribute(RETURN_URL_KEY, url);
        logger.debug("Stored return URL in session {}", session.getId());
    }

    @Override
    public Optional<String> retrieve(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return Optional.empty();
        }
        Object value = session.getAttribute(RETURN_URL_KEY);
        return value instanceof String url ? Optional.of(url) : Optional.empty();
    }

    @Override
    public void clear(HttpServletRequest request, HttpServletResponse response) {
        HttpSession session = request.getSession(false);
        if (session != null) {
            session.removeAttribute(RETURN_URL_KEY);
        }
    }
}
