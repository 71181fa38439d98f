package io.github.reugn.route4j.processor;

import com.google.auto.service.AutoService;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import io.github.reugn.route4j.annotation.AutoRegister;
import io.github.reugn.route4j.annotation.Delete;
import io.github.reugn.route4j.annotation.GenerateRegistration;
import io.github.reugn.route4j.annotation.GenerateRouteListing;
import io.github.reugn.route4j.annotation.Get;
import io.github.reugn.route4j.annotation.Patch;
import io.github.reugn.route4j.annotation.Post;
import io.github.reugn.route4j.annotation.Put;
import io.github.reugn.route4j.annotation.Route;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Messager;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedSourceVersion;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Elements;
import javax.tools.Diagnostic;
import java.io.IOException;
import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Main annotation processor for route4j. Collects handler registrations and generates
 * registration and route listing classes.
 *
 * <p>This is the entry point for the route4j annotation processor, registered via
 * {@link com.google.auto.service.AutoService} for automatic discovery by the Java compiler.
 *
 * <p><b>Supported Annotations:</b>
 * <table border="1">
 *   <caption>Annotations processed by this processor</caption>
 *   <tr><th>Annotation</th><th>Target</th><th>Purpose</th></tr>
 *   <tr>
 *     <td>{@link AutoRegister}</td>
 *     <td>Method</td>
 *     <td>Declares a handler, its scope and (with a verb marker) its route</td>
 *   </tr>
 *   <tr>
 *     <td>{@link GenerateRegistration}</td>
 *     <td>Type</td>
 *     <td>Generates {@code {TypeName}Registration} for one module</td>
 *   </tr>
 *   <tr>
 *     <td>{@link GenerateRouteListing}</td>
 *     <td>Type</td>
 *     <td>Generates {@code {TypeName}RouteListing} printing every route</td>
 *   </tr>
 * </table>
 *
 * <p><b>Processing Pipeline (per round):</b>
 * <ol>
 *   <li><b>Scan</b>: Validate every {@code @AutoRegister} method and file its entry in the {@link Registry}</li>
 *   <li><b>Snapshot</b>: Freeze the registry into an ordered {@link RouteManifest}</li>
 *   <li><b>Generate</b>: Write the requested registration and listing classes from the manifest</li>
 * </ol>
 * Generation only starts after all handlers of the round are scanned, and generated classes
 * hold literal copies of the manifest data; they never consult the registry.
 *
 * <p><b>Error Handling:</b>
 * <p>Every invalid declaration is reported as a compilation error on the offending element.
 * All handlers of a round are validated so one compilation shows every problem; after the first
 * error nothing more is generated for the rest of the compilation. A handler that shows up in a
 * later round, after code covering its scope was already written, is reported instead of being
 * silently left out.
 *
 * <p><b>Options:</b> see {@link ProcessorOptions}.
 *
 * @see HandlerScanner
 * @see ServiceRegistrationGenerator
 * @see RouteListingGenerator
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes({
        "io.github.reugn.route4j.annotation.AutoRegister",
        "io.github.reugn.route4j.annotation.GenerateRegistration",
        "io.github.reugn.route4j.annotation.GenerateRouteListing",
        "io.github.reugn.route4j.annotation.Get",
        "io.github.reugn.route4j.annotation.Post",
        "io.github.reugn.route4j.annotation.Put",
        "io.github.reugn.route4j.annotation.Delete",
        "io.github.reugn.route4j.annotation.Patch",
        "io.github.reugn.route4j.annotation.Route"
})
@SupportedSourceVersion(SourceVersion.RELEASE_17)
public class AutoRegisterProcessor extends AbstractProcessor {

    private static final List<Class<? extends Annotation>> VERB_MARKER_TYPES =
            List.of(Get.class, Post.class, Put.class, Delete.class, Patch.class, Route.class);

    private ErrorReporter errorReporter;
    private Elements elementUtils;
    private ProcessorOptions options;
    private HandlerScanner scanner;
    private Registry registry;

    /**
     * Module keys whose registration classes were already written.
     */
    private final Set<String> generatedModules = new HashSet<>();

    private boolean listingGenerated;
    private boolean failed;

    /**
     * Creates a new AutoRegisterProcessor instance.
     *
     * <p>This no-arg constructor is required for annotation processor discovery via
     * {@link java.util.ServiceLoader}. The processor is not usable until
     * {@link #init(ProcessingEnvironment)} is called by the compiler.
     */
    public AutoRegisterProcessor() {
        // Required for ServiceLoader-based processor discovery
    }

    /**
     * Initializes the processor with the processing environment.
     *
     * <p>A new, empty {@link Registry} is created here: it lives exactly as long as this
     * compilation and is discarded with the processor.
     *
     * @param processingEnv the environment providing access to compiler facilities
     */
    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        Messager messager = processingEnv.getMessager();
        this.errorReporter = (element, message) -> messager.printMessage(Diagnostic.Kind.ERROR, message, element);
        this.elementUtils = processingEnv.getElementUtils();
        this.options = ProcessorOptions.from(processingEnv.getOptions(),
                warning -> messager.printMessage(Diagnostic.Kind.WARNING, warning));
        this.scanner = new HandlerScanner(elementUtils);
        this.registry = new Registry(options.lockTimeout());
    }

    @Override
    public Set<String> getSupportedOptions() {
        return ProcessorOptions.names();
    }

    /**
     * Scans the handlers of the round, then generates the requested classes.
     *
     * @param annotations the annotation types being processed in this round
     * @param roundEnv    the environment for this processing round
     * @return {@code true} to claim the annotations, preventing other processors from handling them
     */
    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        scanHandlers(roundEnv);
        warnOnUnregisteredMarkers(roundEnv);

        List<TypeElement> registrationTargets = typesAnnotatedWith(roundEnv, GenerateRegistration.class);
        List<TypeElement> listingTargets = typesAnnotatedWith(roundEnv, GenerateRouteListing.class);
        if (registrationTargets.isEmpty() && listingTargets.isEmpty()) {
            return true;
        }

        List<RegistrationRequest> requests = new ArrayList<>();
        for (TypeElement target : registrationTargets) {
            try {
                requests.add(RegistrationRequest.from(target, elementUtils));
            } catch (RegistrationException e) {
                fail(target, e);
            }
        }
        if (failed) {
            return true;
        }

        RouteManifest manifest;
        try {
            manifest = RouteManifest.of(registry.snapshotAll());
            note("Route manifest: %d scope(s), %d handler(s)", manifest.scopes().size(), registry.size());
        } catch (RegistrationException e) {
            fail(registrationTargets.isEmpty() ? listingTargets.get(0) : registrationTargets.get(0), e);
            return true;
        }

        checkVisibility(requests, manifest);
        if (failed) {
            return true;
        }

        for (RegistrationRequest request : requests) {
            ClassName generatedType = registrationClassName(request);
            List<RegistrationEntry> entries = manifest.entriesFor(request.moduleKey());
            write(request.target(), ServiceRegistrationGenerator.generate(request, generatedType, entries));
            generatedModules.add(request.moduleKey());
            note("Generated %s with %d handler(s) of module '%s'", generatedType, entries.size(),
                    request.moduleKey());
        }
        for (TypeElement target : listingTargets) {
            ClassName generatedType = CodeGenUtils.generatedClassName(target,
                    RouteListingGenerator.CLASS_SUFFIX, elementUtils);
            write(target, RouteListingGenerator.generate(generatedType, manifest));
            listingGenerated = true;
            note("Generated %s with %d route(s)", generatedType, manifest.size());
        }
        return true;
    }

    // ==================== SCAN ====================

    /**
     * Validates every {@code @AutoRegister} method of the round and files its entry.
     *
     * <p>Invalid handlers are reported and never inserted. Scanning continues past errors
     * so all invalid handlers of the round are reported together.
     */
    private void scanHandlers(RoundEnvironment roundEnv) {
        for (Element element : roundEnv.getElementsAnnotatedWith(AutoRegister.class)) {
            if (element.getKind() != ElementKind.METHOD) {
                errorReporter.error(element, "@AutoRegister can only be applied to methods");
                failed = true;
                continue;
            }
            ExecutableElement method = (ExecutableElement) element;
            try {
                RegistrationEntry entry = scanner.scan(method);
                checkNotLate(entry);
                registry.insert(entry.scope(), entry);
                note("Registered %s %s%s -> %s", entry.verb(), entry.scope(), entry.path(),
                        entry.qualifiedHandlerName());
            } catch (RegistrationException e) {
                fail(method, e);
            }
        }
    }

    private void checkNotLate(RegistrationEntry entry) {
        if (generatedModules.contains(entry.scope()) || listingGenerated) {
            throw new RegistrationException(ErrorKind.LATE_REGISTRATION,
                    "Handler '" + entry.qualifiedHandlerName() + "' in scope '" + entry.scope() +
                            "' was discovered after route code covering it had been generated. " +
                            "Declare handlers in sources compiled together with the generation request.");
        }
    }

    /**
     * Warns about verb markers on methods that are not {@code @AutoRegister} handlers; such
     * methods are never registered.
     */
    private void warnOnUnregisteredMarkers(RoundEnvironment roundEnv) {
        Set<Element> reported = new HashSet<>();
        for (Class<? extends Annotation> markerType : VERB_MARKER_TYPES) {
            for (Element element : roundEnv.getElementsAnnotatedWith(markerType)) {
                if (AnnotationUtils.findAnnotation(element, AutoRegister.class).isEmpty() && reported.add(element)) {
                    processingEnv.getMessager().printMessage(Diagnostic.Kind.WARNING,
                            "Method '" + element.getSimpleName() + "' has a verb marker but no @AutoRegister; " +
                                    "it will not be registered.", element);
                }
            }
        }
    }

    /**
     * Reports handlers whose declaring types the requested registration classes cannot reference.
     */
    private void checkVisibility(List<RegistrationRequest> requests, RouteManifest manifest) {
        Set<RegistrationEntry> reported = new HashSet<>();
        for (RegistrationRequest request : requests) {
            String packageName = registrationClassName(request).packageName();
            for (RegistrationEntry entry : manifest.entriesFor(request.moduleKey())) {
                try {
                    scanner.checkVisibleFrom(entry, packageName);
                } catch (RegistrationException e) {
                    if (reported.add(entry)) {
                        fail(scanner.handlerElement(entry), e);
                    }
                }
            }
        }
    }

    // ==================== GENERATION ====================

    private ClassName registrationClassName(RegistrationRequest request) {
        return CodeGenUtils.generatedClassName(request.target(), ServiceRegistrationGenerator.CLASS_SUFFIX,
                elementUtils);
    }

    private List<TypeElement> typesAnnotatedWith(RoundEnvironment roundEnv,
                                                 Class<? extends Annotation> annotation) {
        List<TypeElement> types = new ArrayList<>();
        for (Element element : roundEnv.getElementsAnnotatedWith(annotation)) {
            if (element instanceof TypeElement) {
                types.add((TypeElement) element);
            }
        }
        return types;
    }

    private void write(TypeElement origin, JavaFile javaFile) {
        try {
            javaFile.writeTo(processingEnv.getFiler());
        } catch (IOException e) {
            errorReporter.error(origin, "Failed to generate " + javaFile.packageName + "." +
                    javaFile.typeSpec.name + ": " + e.getMessage());
            failed = true;
        }
    }

    // ==================== DIAGNOSTICS ====================

    private void fail(Element element, RegistrationException e) {
        errorReporter.error(element, e);
        failed = true;
    }

    private void note(String format, Object... args) {
        if (options.verbose()) {
            processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE, "route4j: " + String.format(format, args));
        }
    }
}
