package io.github.reugn.route4j.processor;

import io.github.reugn.route4j.annotation.GenerateRegistration;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Elements;

/**
 * A validated {@code @GenerateRegistration} request.
 *
 * @param target    the annotated type; the generated class is named after it
 * @param moduleKey the scope whose handlers are registered
 * @param useScope  whether each group is registered under its scope or under the root prefix
 */
record RegistrationRequest(TypeElement target, String moduleKey, boolean useScope) {

    /**
     * Reads and validates the {@code @GenerateRegistration} annotation of a type.
     *
     * @param target       the annotated type
     * @param elementUtils compiler element utilities
     * @return the request
     * @throws RegistrationException of kind {@link ErrorKind#INVALID_SYNTHESIZER_ARGUMENTS}
     *                               if the module key is missing or {@code useScope} is not a boolean
     */
    static RegistrationRequest from(TypeElement target, Elements elementUtils) {
        String type = target.getSimpleName().toString();
        AnnotationMirror mirror = AnnotationUtils.findAnnotation(target, GenerateRegistration.class)
                .orElseThrow(() -> invalid("Type '" + type + "' is not annotated with @GenerateRegistration."));

        Object module = AnnotationUtils.valueWithDefaults(mirror, "module", elementUtils).orElse(null);
        if (!(module instanceof String) || ((String) module).isBlank()) {
            throw invalid("@GenerateRegistration on '" + type + "' has no module key. " +
                    "Declare one, e.g. @GenerateRegistration(module = \"/events\").");
        }

        Object useScope = AnnotationUtils.valueWithDefaults(mirror, "useScope", elementUtils).orElse(null);
        if (!(useScope instanceof Boolean)) {
            throw invalid("@GenerateRegistration on '" + type + "' has a non-boolean useScope value '" +
                    useScope + "'. Use true or false.");
        }
        return new RegistrationRequest(target, (String) module, (Boolean) useScope);
    }

    private static RegistrationException invalid(String message) {
        return new RegistrationException(ErrorKind.INVALID_SYNTHESIZER_ARGUMENTS, message);
    }
}
