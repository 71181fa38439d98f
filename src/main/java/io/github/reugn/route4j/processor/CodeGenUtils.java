package io.github.reugn.route4j.processor;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.MethodSpec;
import io.github.reugn.route4j.runtime.HandlerRoute;
import io.github.reugn.route4j.runtime.HttpVerb;
import io.github.reugn.route4j.runtime.RouteTable;
import io.github.reugn.route4j.runtime.Scope;
import io.github.reugn.route4j.runtime.ServiceConfig;

import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Elements;

/**
 * Shared utilities for code generation in route4j.
 *
 * <p>Holds the run-time types referenced by generated code and the pieces every
 * generated class has in common: the {@code @Generated} marker, the file comment and
 * the private utility-class constructor.
 *
 * @see ServiceRegistrationGenerator
 * @see RouteListingGenerator
 */
final class CodeGenUtils {

    static final ClassName SERVICE_CONFIG = ClassName.get(ServiceConfig.class);
    static final ClassName SCOPE = ClassName.get(Scope.class);
    static final ClassName HANDLER_ROUTE = ClassName.get(HandlerRoute.class);
    static final ClassName HTTP_VERB = ClassName.get(HttpVerb.class);
    static final ClassName ROUTE_TABLE = ClassName.get(RouteTable.class);

    static final String FILE_COMMENT = "Generated by route4j annotation processor. Do not modify.";

    /**
     * Constant holding the number of routes baked into a generated class.
     */
    static final String ROUTE_COUNT_FIELD = "ROUTE_COUNT";

    private CodeGenUtils() {
    }

    /**
     * Returns the {@code @Generated} annotation naming the processor.
     */
    static AnnotationSpec generatedAnnotation() {
        return AnnotationSpec.builder(ClassName.get("javax.annotation.processing", "Generated"))
                .addMember("value", "$S", AutoRegisterProcessor.class.getCanonicalName())
                .build();
    }

    /**
     * Returns a private constructor that rejects instantiation.
     */
    static MethodSpec utilityConstructor() {
        return MethodSpec.constructorBuilder()
                .addModifiers(Modifier.PRIVATE)
                .addStatement("throw new $T($S)", UnsupportedOperationException.class, "Utility class")
                .build();
    }

    /**
     * Returns the name of the class generated for an annotated type: same package, simple names
     * of the type and its enclosing types joined by {@code '_'}, followed by {@code suffix}.
     * {@code Api.Routes} becomes {@code Api_RoutesRegistration}.
     *
     * @param target       the annotated type
     * @param suffix       the class name suffix, e.g. {@code "Registration"}
     * @param elementUtils compiler element utilities
     * @return the generated class name
     */
    static ClassName generatedClassName(TypeElement target, String suffix, Elements elementUtils) {
        String packageName = elementUtils.getPackageOf(target).getQualifiedName().toString();
        return ClassName.get(packageName, String.join("_", ClassName.get(target).simpleNames()) + suffix);
    }
}
