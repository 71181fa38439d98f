package io.github.reugn.route4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeSpec;

import javax.lang.model.element.Modifier;
import java.util.List;
import java.util.Map;

/**
 * Generates the registration routine requested by {@code @GenerateRegistration}.
 *
 * <p>The entries of the requested module are regrouped by their own scope. Every group
 * becomes one {@code cfg.service(...)} call holding all handlers of the group in order:
 * <pre>{@code
 * // @GenerateRegistration(module = "/events", useScope = true) on AppRoutes
 * public final class AppRoutesRegistration {
 *     public static final String MODULE = "/events";
 *     public static final int ROUTE_COUNT = 2;
 *
 *     public static void registerService(ServiceConfig cfg) {
 *         cfg.service(Scope.of("/events")
 *                 .service(HandlerRoute.of(EventHandlers.class, "searchEvents", HttpVerb.GET, "/search"))
 *                 .service(HandlerRoute.of(EventHandlers.class, "createEvent", HttpVerb.POST, "")));
 *     }
 * }
 * }</pre>
 *
 * <p>With {@code useScope = false} the groups are registered under {@code Scope.of("")}.
 * A module without handlers yields an empty {@code registerService} body.
 *
 * <p>Filing key and entry scope are always equal, so each module currently yields a single group.
 */
final class ServiceRegistrationGenerator {

    static final String CLASS_SUFFIX = "Registration";
    static final String METHOD_NAME = "registerService";
    static final String CONFIG_PARAM = "cfg";

    private ServiceRegistrationGenerator() {
    }

    /**
     * Generates the registration class.
     *
     * @param request       the validated request
     * @param generatedType the name of the class to generate
     * @param entries       the manifest entries filed under the requested module
     * @return the Java file to write
     */
    static JavaFile generate(RegistrationRequest request, ClassName generatedType, List<RegistrationEntry> entries) {
        MethodSpec.Builder register = MethodSpec.methodBuilder(METHOD_NAME)
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .addParameter(CodeGenUtils.SERVICE_CONFIG, CONFIG_PARAM)
                .addJavadoc("Registers all handlers of module {@code $L}.\n", request.moduleKey())
                .addJavadoc("\n@param $L the configuration to register the handlers with\n", CONFIG_PARAM);

        for (Map.Entry<String, List<RegistrationEntry>> group : RouteManifest.groupByScope(entries).entrySet()) {
            String prefix = request.useScope() ? group.getKey() : "";
            register.addCode(scopeBlock(prefix, group.getValue()));
        }

        TypeSpec generatedClass = TypeSpec.classBuilder(generatedType)
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .addAnnotation(CodeGenUtils.generatedAnnotation())
                .addJavadoc("Handler registration for module {@code $L}.\n", request.moduleKey())
                .addJavadoc("<p>Generated by route4j annotation processor.\n")
                .addField(FieldSpec.builder(String.class, "MODULE", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                        .initializer("$S", request.moduleKey())
                        .build())
                .addField(FieldSpec.builder(int.class, CodeGenUtils.ROUTE_COUNT_FIELD,
                                Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                        .initializer("$L", entries.size())
                        .build())
                .addMethod(CodeGenUtils.utilityConstructor())
                .addMethod(register.build())
                .build();

        return JavaFile.builder(generatedType.packageName(), generatedClass)
                .addFileComment(CodeGenUtils.FILE_COMMENT)
                .build();
    }

    /**
     * Builds {@code cfg.service(Scope.of(prefix).service(...)...);} for one group.
     */
    private static CodeBlock scopeBlock(String prefix, List<RegistrationEntry> group) {
        CodeBlock.Builder block = CodeBlock.builder()
                .add("$L.service($T.of($S)$>$>", CONFIG_PARAM, CodeGenUtils.SCOPE, prefix);
        for (RegistrationEntry entry : group) {
            block.add("\n.service($T.of($T.class, $S, $T.$L, $S))",
                    CodeGenUtils.HANDLER_ROUTE, entry.declaringType(), entry.handlerName(),
                    CodeGenUtils.HTTP_VERB, entry.verb().name(), entry.path());
        }
        return block.add(");\n$<$<").build();
    }
}
