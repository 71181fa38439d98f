package io.github.reugn.route4j.processor;

import com.squareup.javapoet.ClassName;
import io.github.reugn.route4j.annotation.AutoRegister;
import io.github.reugn.route4j.annotation.Delete;
import io.github.reugn.route4j.annotation.Get;
import io.github.reugn.route4j.annotation.Patch;
import io.github.reugn.route4j.annotation.Post;
import io.github.reugn.route4j.annotation.Put;
import io.github.reugn.route4j.annotation.Route;
import io.github.reugn.route4j.runtime.HttpVerb;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Elements;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validates an {@code @AutoRegister} handler method and extracts its {@link RegistrationEntry}.
 *
 * <p><b>Checks, in order:</b>
 * <ol>
 *   <li>The method and its enclosing types are not private ({@link ErrorKind#INACCESSIBLE_HANDLER}).
 *       Types outside the package of a registration class must also be public, which is checked
 *       per request by {@link #checkVisibleFrom(RegistrationEntry, String)}</li>
 *   <li>The scope is present and not blank ({@link ErrorKind#MISSING_SCOPE_ARGUMENT})</li>
 *   <li>Exactly one verb marker is present, with a path string and, for {@code @Route},
 *       a known method ({@link ErrorKind#MISSING_ROUTE_METADATA})</li>
 * </ol>
 *
 * <p><b>Example Error Messages:</b>
 * <pre>
 * error: Handler 'EventHandlers.search' has no scope. Declare one, e.g. @AutoRegister("/events").
 * error: Handler 'EventHandlers.search' has no route metadata. Exactly one of @Get, @Post, @Put, @Delete,
 *        @Patch or @Route with a path string is required.
 * </pre>
 */
final class HandlerScanner {

    static final String VERB_MARKERS = "@Get, @Post, @Put, @Delete, @Patch or @Route";

    private static final Map<String, HttpVerb> FIXED_VERB_MARKERS = Map.of(
            Get.class.getCanonicalName(), HttpVerb.GET,
            Post.class.getCanonicalName(), HttpVerb.POST,
            Put.class.getCanonicalName(), HttpVerb.PUT,
            Delete.class.getCanonicalName(), HttpVerb.DELETE,
            Patch.class.getCanonicalName(), HttpVerb.PATCH);

    private static final String ROUTE_MARKER = Route.class.getCanonicalName();

    private final Elements elementUtils;

    HandlerScanner(Elements elementUtils) {
        this.elementUtils = elementUtils;
    }

    /**
     * Returns {@code true} if the annotation is one of the verb markers.
     *
     * @param mirror the annotation mirror
     * @return whether the annotation declares a verb and path
     */
    static boolean isVerbMarker(AnnotationMirror mirror) {
        String name = AnnotationUtils.qualifiedName(mirror);
        return FIXED_VERB_MARKERS.containsKey(name) || ROUTE_MARKER.equals(name);
    }

    /**
     * Validates a handler method and builds its entry.
     *
     * @param method the method annotated with {@code @AutoRegister}
     * @return the registration entry of the handler
     * @throws RegistrationException if the declaration is invalid
     */
    RegistrationEntry scan(ExecutableElement method) {
        TypeElement declaringType = (TypeElement) method.getEnclosingElement();
        String handler = declaringType.getSimpleName() + "." + method.getSimpleName();

        checkAccessible(method, handler);
        String scope = readScope(method, handler);
        RouteMetadata route = readRoute(method, handler);

        return new RegistrationEntry(scope, method.getSimpleName().toString(), route.path(), route.verb(),
                ClassName.get(declaringType), declaringType.getEnclosedElements().indexOf(method));
    }

    /**
     * Checks that code generated into {@code packageName} can reference the declaring type of an entry.
     *
     * <p>Every type from the declaring type outwards must be public unless it shares the package
     * of the generated class.
     *
     * @param entry       a scanned handler entry
     * @param packageName the package of the generated class referencing the handler
     * @throws RegistrationException of kind {@link ErrorKind#INACCESSIBLE_HANDLER} if a type in the
     *                               chain is not visible from {@code packageName}
     */
    void checkVisibleFrom(RegistrationEntry entry, String packageName) {
        TypeElement declaringType = declaringTypeOf(entry);
        String handlerPackage = elementUtils.getPackageOf(declaringType).getQualifiedName().toString();
        if (handlerPackage.equals(packageName)) {
            return;
        }
        for (Element owner = declaringType; owner instanceof TypeElement; owner = owner.getEnclosingElement()) {
            if (!owner.getModifiers().contains(Modifier.PUBLIC)) {
                throw new RegistrationException(ErrorKind.INACCESSIBLE_HANDLER,
                        "Handler '" + entry.qualifiedHandlerName() + "' is declared in non-public type '" +
                                owner.getSimpleName() + "' outside package '" + packageName + "'. " +
                                "Make the type public or declare the generation request in package '" +
                                handlerPackage + "'.");
            }
        }
    }

    /**
     * Returns the handler method an entry was scanned from, for error reporting.
     *
     * @param entry a scanned handler entry
     * @return the handler method, or its declaring type if the method cannot be located
     */
    Element handlerElement(RegistrationEntry entry) {
        TypeElement declaringType = declaringTypeOf(entry);
        List<? extends Element> members = declaringType.getEnclosedElements();
        return entry.ordinal() < members.size() ? members.get(entry.ordinal()) : declaringType;
    }

    private TypeElement declaringTypeOf(RegistrationEntry entry) {
        return elementUtils.getTypeElement(entry.declaringType().canonicalName());
    }

    private void checkAccessible(ExecutableElement method, String handler) {
        if (method.getModifiers().contains(Modifier.PRIVATE)) {
            throw new RegistrationException(ErrorKind.INACCESSIBLE_HANDLER,
                    "Handler '" + handler + "' is private. Generated registration code cannot reference " +
                            "private handlers.");
        }
        for (Element owner = method.getEnclosingElement(); owner instanceof TypeElement;
             owner = owner.getEnclosingElement()) {
            if (owner.getModifiers().contains(Modifier.PRIVATE)) {
                throw new RegistrationException(ErrorKind.INACCESSIBLE_HANDLER,
                        "Handler '" + handler + "' is declared in private type '" + owner.getSimpleName() +
                                "'. Generated registration code cannot reference it.");
            }
        }
    }

    private String readScope(ExecutableElement method, String handler) {
        Object value = AnnotationUtils.findAnnotation(method, AutoRegister.class)
                .flatMap(mirror -> AnnotationUtils.valueWithDefaults(mirror, "value", elementUtils))
                .orElse(null);
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new RegistrationException(ErrorKind.MISSING_SCOPE_ARGUMENT,
                    "Handler '" + handler + "' has no scope. Declare one, e.g. @AutoRegister(\"/events\").");
        }
        return (String) value;
    }

    private RouteMetadata readRoute(ExecutableElement method, String handler) {
        List<AnnotationMirror> markers = new ArrayList<>();
        for (AnnotationMirror mirror : method.getAnnotationMirrors()) {
            if (isVerbMarker(mirror)) {
                markers.add(mirror);
            }
        }

        if (markers.isEmpty()) {
            throw missingRoute("Handler '" + handler + "' has no route metadata.");
        }
        if (markers.size() > 1) {
            String found = markers.stream()
                    .map(m -> "@" + AnnotationUtils.simpleName(m))
                    .collect(Collectors.joining(", "));
            throw missingRoute("Handler '" + handler + "' has several verb markers (" + found + ").");
        }

        AnnotationMirror marker = markers.get(0);
        String markerName = "@" + AnnotationUtils.simpleName(marker);
        Object path = AnnotationUtils.explicitValue(marker, "value").orElse(null);
        if (!(path instanceof String)) {
            throw missingRoute("Handler '" + handler + "' has " + markerName + " without a path string.");
        }

        HttpVerb verb = FIXED_VERB_MARKERS.get(AnnotationUtils.qualifiedName(marker));
        if (verb == null) {
            Object methodName = AnnotationUtils.explicitValue(marker, "method").orElse(null);
            verb = HttpVerb.parse(methodName instanceof String ? (String) methodName : null)
                    .orElseThrow(() -> missingRoute("Handler '" + handler + "' declares unknown HTTP method '" +
                            methodName + "' in @Route. Use one of GET, POST, PUT, DELETE or PATCH."));
        }
        return new RouteMetadata(verb, (String) path);
    }

    private static RegistrationException missingRoute(String problem) {
        return new RegistrationException(ErrorKind.MISSING_ROUTE_METADATA,
                problem + " Exactly one of " + VERB_MARKERS + " with a path string is required.");
    }

    private record RouteMetadata(HttpVerb verb, String path) {
    }
}
