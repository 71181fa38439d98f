package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Generic verb marker for an {@link AutoRegister} handler.
 * <p>
 * Equivalent to the dedicated markers, with the method given as text:
 * <pre>
 * {@code
 * @AutoRegister("/events")
 * @Route(method = "patch", value = "/archive")
 * public static void archive() { }
 * }
 * </pre>
 * The method name is case-insensitive and must be one of {@code GET}, {@code POST},
 * {@code PUT}, {@code DELETE} or {@code PATCH}.
 *
 * @see Get
 * @see Post
 * @see Put
 * @see Delete
 * @see Patch
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.SOURCE)
public @interface Route {

    /**
     * The HTTP method, case-insensitive.
     *
     * @return the HTTP method name
     */
    String method();

    /**
     * The path relative to the handler scope. An empty path denotes the scope root.
     *
     * @return the route path
     */
    String value();
}
