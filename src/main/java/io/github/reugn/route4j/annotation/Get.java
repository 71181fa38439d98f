package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares that an {@link AutoRegister} handler serves {@code GET} requests on the given path.
 *
 * @see AutoRegister
 * @see Route
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.SOURCE)
public @interface Get {

    /**
     * The path relative to the handler scope. An empty path denotes the scope root.
     *
     * @return the route path
     */
    String value();
}
