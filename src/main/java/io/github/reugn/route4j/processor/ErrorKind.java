package io.github.reugn.route4j.processor;

/**
 * Categories of registration failures. Every kind is fatal to the compilation.
 */
enum ErrorKind {
    /**
     * A handler declaration omitted its scope, or declared an empty one.
     */
    MISSING_SCOPE_ARGUMENT,

    /**
     * A handler declaration has no usable verb marker: none, more than one,
     * a marker without a path string, or an unknown {@code @Route} method.
     */
    MISSING_ROUTE_METADATA,

    /**
     * {@code @GenerateRegistration} lacks a module key or carries a non-boolean {@code useScope}.
     */
    INVALID_SYNTHESIZER_ARGUMENTS,

    /**
     * The registry lock could not be acquired in time.
     */
    LOCK_ACQUISITION_FAILURE,

    /**
     * The handler method or one of its enclosing types is private.
     */
    INACCESSIBLE_HANDLER,

    /**
     * A handler appeared in a processing round after code covering its scope was generated.
     */
    LATE_REGISTRATION
}
