package io.github.reugn.route4j.processor;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Elements;
import java.util.Map;
import java.util.Optional;

/**
 * Reads annotation values through {@link AnnotationMirror}s.
 *
 * <p>Mirrors expose the raw constant of each element, which lets validation tell a
 * missing value from a value of the wrong kind instead of failing on reflection proxies.
 */
final class AnnotationUtils {

    private AnnotationUtils() {
    }

    /**
     * Returns the fully qualified name of the annotation type of a mirror.
     *
     * @param mirror the annotation mirror
     * @return the qualified name, e.g. {@code "io.github.reugn.route4j.annotation.Get"}
     */
    static String qualifiedName(AnnotationMirror mirror) {
        return ((TypeElement) mirror.getAnnotationType().asElement()).getQualifiedName().toString();
    }

    /**
     * Returns the simple name of the annotation type of a mirror.
     *
     * @param mirror the annotation mirror
     * @return the simple name, e.g. {@code "Get"}
     */
    static String simpleName(AnnotationMirror mirror) {
        return mirror.getAnnotationType().asElement().getSimpleName().toString();
    }

    /**
     * Finds an annotation on an element by its type.
     *
     * @param element        the annotated element
     * @param annotationType the annotation type to look for
     * @return the mirror, or empty if the element does not carry the annotation
     */
    static Optional<AnnotationMirror> findAnnotation(Element element, Class<?> annotationType) {
        String name = annotationType.getCanonicalName();
        for (AnnotationMirror mirror : element.getAnnotationMirrors()) {
            if (qualifiedName(mirror).equals(name)) {
                return Optional.of(mirror);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the value explicitly given for an annotation element.
     *
     * @param mirror the annotation mirror
     * @param name   the element name
     * @return the constant value, or empty if the element was not written in source
     */
    static Optional<Object> explicitValue(AnnotationMirror mirror, String name) {
        return find(mirror.getElementValues(), name);
    }

    /**
     * Returns the value of an annotation element, falling back to its declared default.
     *
     * @param mirror       the annotation mirror
     * @param name         the element name
     * @param elementUtils compiler element utilities
     * @return the constant value, or empty if neither a value nor a default exists
     */
    static Optional<Object> valueWithDefaults(AnnotationMirror mirror, String name, Elements elementUtils) {
        return find(elementUtils.getElementValuesWithDefaults(mirror), name);
    }

    private static Optional<Object> find(Map<? extends ExecutableElement, ? extends AnnotationValue> values,
                                         String name) {
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> entry : values.entrySet()) {
            if (entry.getKey().getSimpleName().contentEquals(name)) {
                return Optional.ofNullable(entry.getValue().getValue());
            }
        }
        return Optional.empty();
    }
}
