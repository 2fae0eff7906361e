package com.numaansystems.oauth.filter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies request paths into the initiate route, the callback route or
 * pass-through.
 *
 * <ul>
 *   <li>{@code /auth/{providerType}} - start the provider login</li>
 *   <li>{@code /auth/{providerType}/callback} - provider redirect back with a code</li>
 * </ul>
 *
 * <p>Both patterns are anchored, so {@code /auth/github/callback} can only
 * match the callback route.</p>
 */
public class AuthRouteMatcher {

    private static final String PROVIDER_GROUP = "providerType";

    private static final Pattern AUTH_ROUTE =
            Pattern.compile("^/auth/(?<" + PROVIDER_GROUP + ">\\w+)$");
    private static final Pattern CALLBACK_ROUTE =
            Pattern.compile("^/auth/(?<" + PROVIDER_GROUP + ">\\w+)/callback$");

    /**
     * @param path the request path without context path, may be null
     * @return the route category and provider type
     */
    public RouteMatch match(String path) {
        if (path == null) {
            return RouteMatch.passThrough();
        }

        Matcher callback = CALLBACK_ROUTE.matcher(path);
        if (callback.matches()) {
            return RouteMatch.callback(callback.group(PROVIDER_GROUP));
        }

        Matcher auth = AUTH_ROUTE.matcher(path);
        if (auth.matches()) {
            return RouteMatch.initiate(auth.group(PROVIDER_GROUP));
        }

        return RouteMatch.passThrough();
    }
}
