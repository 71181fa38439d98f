package io.github.reugn.route4j.processor;

import java.util.Objects;

/**
 * Signals an invalid handler declaration, an invalid generation request, or a registry fault.
 *
 * <p>Thrown during scanning and generation, caught by {@link AutoRegisterProcessor}
 * and reported as a compilation error on the element being processed.
 */
final class RegistrationException extends RuntimeException {

    private final ErrorKind kind;

    RegistrationException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    RegistrationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    ErrorKind kind() {
        return kind;
    }
}
