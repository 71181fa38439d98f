package io.github.reugn.route4j.runtime;

import java.util.Locale;
import java.util.Optional;

/**
 * HTTP methods a registered handler can serve.
 */
public enum HttpVerb {
    GET,
    POST,
    PUT,
    DELETE,
    PATCH;

    /**
     * Parses a method name, ignoring case.
     *
     * @param text the method name, e.g. {@code "get"} or {@code "Patch"}
     * @return the matching verb, or empty if {@code text} is null, blank or unknown
     */
    public static Optional<HttpVerb> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (HttpVerb verb : values()) {
            if (verb.name().equals(normalized)) {
                return Optional.of(verb);
            }
        }
        return Optional.empty();
    }
}
