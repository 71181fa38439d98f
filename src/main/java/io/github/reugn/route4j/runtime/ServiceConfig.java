package io.github.reugn.route4j.runtime;

/**
 * Mutable configuration handle of a hosting framework.
 * <p>
 * Generated registration routines call {@link #service(Scope)} once per scope group.
 * Hosting frameworks implement this interface to bind the handlers to their router.
 */
@FunctionalInterface
public interface ServiceConfig {

    /**
     * Registers a scope and all handlers it contains.
     *
     * @param scope the scope to register
     */
    void service(Scope scope);
}
