package com.numaansystems.oauth.filter;

/**
 * Classification of a request path by {@link AuthRouteMatcher}.
 *
 * @param type the route category
 * @param providerType the provider path segment, null for pass-through
 */
public record RouteMatch(Type type, String providerType) {

    private static final RouteMatch PASS_THROUGH = new RouteMatch(Type.PASS_THROUGH, null);

    public enum Type {
        INITIATE,
        CALLBACK,
        PASS_THROUGH
    }

    public static RouteMatch initiate(String providerType) {
        return new RouteMatch(Type.INITIATE, providerType);
    }

    public static RouteMatch callback(String providerType) {
        return new RouteMatch(Type.CALLBACK, providerType);
    }

    public static RouteMatch passThrough() {
        return PASS_THROUGH;
    }
}
