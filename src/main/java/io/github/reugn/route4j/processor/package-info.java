/**
 * Annotation processor implementation for route4j.
 * <p>
 * This package contains the compile-time processor that collects
 * {@link io.github.reugn.route4j.annotation.AutoRegister} handlers and generates the classes
 * requested by {@link io.github.reugn.route4j.annotation.GenerateRegistration} and
 * {@link io.github.reugn.route4j.annotation.GenerateRouteListing}.
 * <p>
 * <b>Internal implementation</b> - not part of the public API.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * AutoRegisterProcessor (entry point)
 *     ├── HandlerScanner ──► Registry ──► RouteManifest
 *     │                                      ├── ServiceRegistrationGenerator
 *     │                                      └── RouteListingGenerator
 *     └── RegistrationRequest
 *
 * Support utilities:
 *     ├── AnnotationUtils  - Annotation mirror access
 *     ├── CodeGenUtils     - Shared code generation pieces
 *     ├── ProcessorOptions - -A option parsing
 *     └── ErrorReporter    - Error reporting interface
 * </pre>
 *
 * @see io.github.reugn.route4j.annotation
 * @see io.github.reugn.route4j.runtime
 */
package io.github.reugn.route4j.processor;
