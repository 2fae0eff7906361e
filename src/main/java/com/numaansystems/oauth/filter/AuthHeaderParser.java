package com.numaansystems.oauth.filter;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts the credential from {@code Authorization} header values.
 *
 * <p>A value must be exactly two tokens separated by a single space, the first
 * being {@code bearer} or {@code token} in any case. Values that do not fit
 * are skipped. The first matching value wins.</p>
 */
public class AuthHeaderParser {

    private static final Set<String> SCHEMES = Set.of("bearer", "token");

    /**
     * @param authHeaders the raw Authorization header values, may be empty
     * @return the credential, empty if no value carried one
     */
    public Optional<String> parse(Collection<String> authHeaders) {
        if (authHeaders == null) {
            return Optional.empty();
        }

        for (String authHeader : authHeaders) {
            if (authHeader == null) {
                continue;
            }
            String[] parts = authHeader.split(" ", -1);
            if (parts.length == 2
                    && SCHEMES.contains(parts[0].toLowerCase(Locale.ROOT))
                    && !parts[1].isEmpty()) {
                return Optional.of(parts[1]);
            }
        }
        return Optional.empty();
    }
}
