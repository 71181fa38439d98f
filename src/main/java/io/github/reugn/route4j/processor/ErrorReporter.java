package io.github.reugn.route4j.processor;

import javax.lang.model.element.Element;

/**
 * Interface for reporting compilation errors.
 */
@FunctionalInterface
interface ErrorReporter {
    /**
     * Reports an error on the given element.
     *
     * @param element the element where the error occurred
     * @param message the error message
     */
    void error(Element element, String message);

    /**
     * Reports a registration failure on the element being processed when it occurred.
     *
     * @param element   the offending handler method or annotated type
     * @param exception the failure
     */
    default void error(Element element, RegistrationException exception) {
        error(element, exception.getMessage());
    }
}
