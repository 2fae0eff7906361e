package com.numaansystems.oauth.store;

/**
 * Backends available for keeping the return URL across the provider redirect.
 */
public enum ReturnUrlStorage {
    SESSION,
    COOKIE
}
