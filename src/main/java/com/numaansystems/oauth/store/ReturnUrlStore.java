package com.numaansystems.oauth.store;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.util.Optional;

/**
 * Keeps the client-supplied return URL between the initiate and callback legs
 * of the OAuth flow.
 *
 * <p>Callers validate the URL before storing it; implementations store and
 * hand back the exact string they were given.</p>
 */
public interface ReturnUrlStore {

    /** Name of the session attribute or cookie holding the return URL. */
    String RETURN_URL_KEY = "oauth_return_url";

    /**
     * Stores the return URL, replacing any previous value.
     *
     * @param request the current request
     * @param response the current response, used by cookie-based stores
     * @param url the validated return URL
     */
    void store(HttpServletRequest request, HttpServletResponse response, String url);

    /**
     * @param request the current request
     * @return the stored return URL, empty if none was stored
     */
    Optional<String> retrieve(HttpServletRequest request);

    /**
     * Removes the stored return URL once the flow has used it.
     */
    void clear(HttpServletRequest request, HttpServletResponse response);
}
