package io.github.reugn.route4j.processor;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.github.reugn.route4j.util.CompileHelper.compileWithOptions;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Processor Options Tests")
class ProcessorOptionsTest {

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Defaults when no options are given")
        void defaults() {
            List<String> warnings = new ArrayList<>();
            ProcessorOptions options = ProcessorOptions.from(Map.of(), warnings::add);

            assertThat(options.verbose()).isFalse();
            assertThat(options.lockTimeout()).isEqualTo(ProcessorOptions.DEFAULT_LOCK_TIMEOUT);
            assertThat(warnings).isEmpty();
        }

        @Test
        @DisplayName("Explicit values are used")
        void explicitValues() {
            ProcessorOptions options = ProcessorOptions.from(Map.of(
                    ProcessorOptions.VERBOSE, "true",
                    ProcessorOptions.LOCK_TIMEOUT_MILLIS, "250"), w -> {
            });

            assertThat(options.verbose()).isTrue();
            assertThat(options.lockTimeout()).isEqualTo(Duration.ofMillis(250));
        }

        @Test
        @DisplayName("Invalid timeouts fall back to the default with a warning")
        void invalidTimeout() {
            List<String> warnings = new ArrayList<>();

            ProcessorOptions notNumber = ProcessorOptions.from(
                    Map.of(ProcessorOptions.LOCK_TIMEOUT_MILLIS, "soon"), warnings::add);
            ProcessorOptions negative = ProcessorOptions.from(
                    Map.of(ProcessorOptions.LOCK_TIMEOUT_MILLIS, "-1"), warnings::add);

            assertThat(notNumber.lockTimeout()).isEqualTo(ProcessorOptions.DEFAULT_LOCK_TIMEOUT);
            assertThat(negative.lockTimeout()).isEqualTo(ProcessorOptions.DEFAULT_LOCK_TIMEOUT);
            assertThat(warnings).hasSize(2);
            assertThat(warnings.get(0)).contains("is not a number: 'soon'");
            assertThat(warnings.get(1)).contains("must be positive");
        }
    }

    @Nested
    @DisplayName("Compiler Integration")
    class CompilerIntegration {

        private final JavaFileObject source = JavaFileObjects.forSourceString("test.EventHandlers",
                """
                        package test;
                        
                        import io.github.reugn.route4j.annotation.AutoRegister;
                        import io.github.reugn.route4j.annotation.GenerateRegistration;
                        import io.github.reugn.route4j.annotation.Get;
                        
                        @GenerateRegistration(module = "/events")
                        public class EventHandlers {
                            @AutoRegister("/events")
                            @Get("/search")
                            public static void search() {
                            }
                        }
                        """);

        @Test
        @DisplayName("Verbose mode prints progress notes")
        void verboseNotes() {
            Compilation compilation = compileWithOptions(List.of("-Aroute4j.verbose=true"), source);

            com.google.testing.compile.CompilationSubject.assertThat(compilation).succeeded();
            com.google.testing.compile.CompilationSubject.assertThat(compilation)
                    .hadNoteContaining("route4j: Registered GET /events/search -> EventHandlers.search");
            com.google.testing.compile.CompilationSubject.assertThat(compilation)
                    .hadNoteContaining("with 1 handler(s) of module '/events'");
            com.google.testing.compile.CompilationSubject.assertThat(compilation)
                    .hadNoteContaining("route4j: Route manifest: 1 scope(s), 1 handler(s)");
        }

        @Test
        @DisplayName("Quiet mode prints no notes")
        void quietByDefault() {
            Compilation compilation = compileWithOptions(List.of(), source);

            com.google.testing.compile.CompilationSubject.assertThat(compilation).succeeded();
            assertThat(compilation.notes()).noneMatch(d -> d.getMessage(null).contains("route4j:"));
        }

        @Test
        @DisplayName("Invalid timeout option is reported as a warning")
        void invalidTimeoutWarning() {
            Compilation compilation = compileWithOptions(List.of("-Aroute4j.lockTimeoutMillis=abc"), source);

            com.google.testing.compile.CompilationSubject.assertThat(compilation).succeeded();
            com.google.testing.compile.CompilationSubject.assertThat(compilation)
                    .hadWarningContaining("route4j.lockTimeoutMillis is not a number: 'abc'");
        }
    }
}
