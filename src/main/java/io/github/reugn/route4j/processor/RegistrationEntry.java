package io.github.reugn.route4j.processor;

import com.squareup.javapoet.ClassName;
import io.github.reugn.route4j.runtime.HttpVerb;

import java.util.Objects;

/**
 * Validated metadata of one handler method.
 *
 * <p>Created by {@link HandlerScanner} and filed in the {@link Registry} under its scope.
 * Entries are never modified; two handlers with identical metadata stay two entries.
 *
 * @param scope         the scope the entry is filed under
 * @param handlerName   the handler method name
 * @param path          the route path; empty for the scope root
 * @param verb          the HTTP method
 * @param declaringType the class declaring the handler
 * @param ordinal       the position of the handler among the members of its declaring class
 */
record RegistrationEntry(String scope, String handlerName, String path, HttpVerb verb,
                         ClassName declaringType, int ordinal) {

    RegistrationEntry {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(handlerName, "handlerName");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(declaringType, "declaringType");
    }

    /**
     * Returns {@code DeclaringType.handlerName}, used in diagnostics.
     */
    String qualifiedHandlerName() {
        return declaringType.simpleName() + "." + handlerName;
    }
}
