package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requests generation of a diagnostic routine that prints every registered route.
 * <p>
 * For a type {@code AppRoutes}, a class {@code AppRoutesRouteListing} is generated with
 * {@code listRoutes()} and {@code listRoutes(PrintStream)}. The output is a banner line
 * followed by a table with the columns {@code Scope}, {@code Path}, {@code Handler} and
 * {@code Verb}, one row per handler known to the compilation:
 * <pre>
 * List of automatically generated routes
 * +---------+---------+--------------+------+
 * | Scope   | Path    | Handler      | Verb |
 * +---------+---------+--------------+------+
 * | /events | /search | searchEvents | GET  |
 * +---------+---------+--------------+------+
 * </pre>
 *
 * @see AutoRegister
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface GenerateRouteListing {
}
