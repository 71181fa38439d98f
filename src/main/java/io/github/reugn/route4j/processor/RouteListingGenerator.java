package io.github.reugn.route4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeSpec;

import javax.lang.model.element.Modifier;
import java.io.PrintStream;

/**
 * Generates the diagnostic route listing requested by {@code @GenerateRouteListing}.
 *
 * <p>Every manifest entry becomes one literal table row, in manifest order:
 * <pre>{@code
 * public final class AppRoutesRouteListing {
 *     public static final String BANNER = "List of automatically generated routes";
 *     public static final int ROUTE_COUNT = 1;
 *
 *     public static void listRoutes() {
 *         listRoutes(System.out);
 *     }
 *
 *     public static void listRoutes(PrintStream out) {
 *         out.println(BANNER);
 *         RouteTable table = RouteTable.withHeader("Scope", "Path", "Handler", "Verb");
 *         table.addRow("/events", "/search", "searchEvents", "GET");
 *         table.print(out);
 *     }
 * }
 * }</pre>
 */
final class RouteListingGenerator {

    static final String CLASS_SUFFIX = "RouteListing";
    static final String METHOD_NAME = "listRoutes";
    static final String BANNER = "List of automatically generated routes";

    private RouteListingGenerator() {
    }

    /**
     * Generates the listing class.
     *
     * @param generatedType the name of the class to generate
     * @param manifest      the routes to list
     * @return the Java file to write
     */
    static JavaFile generate(ClassName generatedType, RouteManifest manifest) {
        MethodSpec toStdout = MethodSpec.methodBuilder(METHOD_NAME)
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .addStatement("$L($T.out)", METHOD_NAME, System.class)
                .addJavadoc("Prints all registered routes to standard output.\n")
                .build();

        MethodSpec.Builder toStream = MethodSpec.methodBuilder(METHOD_NAME)
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .addParameter(PrintStream.class, "out")
                .addJavadoc("Prints all registered routes.\n")
                .addJavadoc("\n@param out the stream to print to\n")
                .addStatement("out.println(BANNER)")
                .addStatement("$T table = $T.withHeader($S, $S, $S, $S)", CodeGenUtils.ROUTE_TABLE,
                        CodeGenUtils.ROUTE_TABLE, "Scope", "Path", "Handler", "Verb");
        for (RegistrationEntry entry : manifest.allEntries()) {
            toStream.addStatement("table.addRow($S, $S, $S, $S)",
                    entry.scope(), entry.path(), entry.handlerName(), entry.verb().name());
        }
        toStream.addStatement("table.print(out)");

        TypeSpec generatedClass = TypeSpec.classBuilder(generatedType)
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .addAnnotation(CodeGenUtils.generatedAnnotation())
                .addJavadoc("Listing of all routes registered through {@code @AutoRegister}.\n")
                .addJavadoc("<p>Generated by route4j annotation processor.\n")
                .addField(FieldSpec.builder(String.class, "BANNER", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                        .initializer("$S", BANNER)
                        .build())
                .addField(FieldSpec.builder(int.class, CodeGenUtils.ROUTE_COUNT_FIELD,
                                Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                        .initializer("$L", manifest.size())
                        .build())
                .addMethod(CodeGenUtils.utilityConstructor())
                .addMethod(toStdout)
                .addMethod(toStream.build())
                .build();

        return JavaFile.builder(generatedType.packageName(), generatedClass)
                .addFileComment(CodeGenUtils.FILE_COMMENT)
                .build();
    }
}
