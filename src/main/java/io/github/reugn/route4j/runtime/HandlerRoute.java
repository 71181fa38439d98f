package io.github.reugn.route4j.runtime;

import java.util.Objects;

/**
 * A handler registered by generated code: the declaring type, the handler method name,
 * and the verb and path it serves.
 * <p>
 * Hosting frameworks resolve the handler method on {@code declaringType} by name.
 *
 * @param declaringType the class declaring the handler method
 * @param handlerName   the handler method name
 * @param verb          the HTTP method
 * @param path          the path relative to the enclosing scope; empty for the scope root
 */
public record HandlerRoute(Class<?> declaringType, String handlerName, HttpVerb verb, String path) {

    public HandlerRoute {
        Objects.requireNonNull(declaringType, "declaringType");
        Objects.requireNonNull(handlerName, "handlerName");
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(path, "path");
    }

    /**
     * Creates a handler route. Used by generated registration code.
     *
     * @param declaringType the class declaring the handler method
     * @param handlerName   the handler method name
     * @param verb          the HTTP method
     * @param path          the path relative to the enclosing scope
     * @return the handler route
     */
    public static HandlerRoute of(Class<?> declaringType, String handlerName, HttpVerb verb, String path) {
        return new HandlerRoute(declaringType, handlerName, verb, path);
    }
}
