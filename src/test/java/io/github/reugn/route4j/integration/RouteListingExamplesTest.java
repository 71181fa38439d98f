package io.github.reugn.route4j.integration;

import com.google.testing.compile.JavaFileObjects;
import io.github.reugn.route4j.util.RuntimeTestHelper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * E2E tests for generated route listings.
 * These tests run {@code listRoutes} and inspect the printed table.
 */
@DisplayName("Route Listing Examples (E2E)")
class RouteListingExamplesTest {

    private static final String LISTING = "example.DiagnosticsRouteListing";

    private static final JavaFileObject DIAGNOSTICS = JavaFileObjects.forSourceString("example.Diagnostics",
            """
                    package example;
                    
                    import io.github.reugn.route4j.annotation.GenerateRouteListing;
                    
                    @GenerateRouteListing
                    public class Diagnostics {
                    }
                    """);

    /**
     * Returns the data rows of a printed table, each split into trimmed cells.
     */
    private static List<List<String>> dataRows(String output) {
        List<List<String>> rows = new ArrayList<>();
        boolean header = true;
        for (String line : output.split("\n")) {
            if (!line.startsWith("|")) {
                continue;
            }
            if (header) {
                header = false;
                continue;
            }
            String inner = line.substring(1, line.length() - 1);
            rows.add(Arrays.stream(inner.split("\\|", -1)).map(String::trim).toList());
        }
        return rows;
    }

    @Test
    @DisplayName("Prints banner and one row per handler across scopes")
    void listsAllRoutes() {
        JavaFileObject handlers = JavaFileObjects.forSourceString("example.Handlers",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.AutoRegister;
                        import io.github.reugn.route4j.annotation.Delete;
                        import io.github.reugn.route4j.annotation.Get;
                        import io.github.reugn.route4j.annotation.Post;
                        
                        public class Handlers {
                            @AutoRegister("/users")
                            @Delete("/{id}")
                            public static void removeUser() {
                            }
                        
                            @AutoRegister("/events")
                            @Get("/search")
                            public static void searchEvents() {
                            }
                        
                            @AutoRegister("/events")
                            @Post("")
                            public static void createEvent() {
                            }
                        }
                        """);
        RuntimeTestHelper helper = RuntimeTestHelper.compile(handlers, DIAGNOSTICS);

        String output = helper.capture(LISTING, "listRoutes");

        assertThat(output).startsWith("List of automatically generated routes");
        assertThat(output).contains("| Scope ", "| Path ", "| Handler ", "| Verb ");
        List<List<String>> rows = dataRows(output);
        assertThat(rows).hasSize((Integer) helper.getStaticField(LISTING, "ROUTE_COUNT"));
        assertThat(rows).containsExactly(
                List.of("/events", "/search", "searchEvents", "GET"),
                List.of("/events", "", "createEvent", "POST"),
                List.of("/users", "/{id}", "removeUser", "DELETE"));
    }

    @Test
    @DisplayName("Duplicate handler names appear twice")
    void duplicates() {
        JavaFileObject first = JavaFileObjects.forSourceString("example.First",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.AutoRegister;
                        import io.github.reugn.route4j.annotation.Get;
                        
                        public class First {
                            @AutoRegister("/events")
                            @Get("/search")
                            public static void search() {
                            }
                        }
                        """);
        JavaFileObject second = JavaFileObjects.forSourceString("example.Second",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.AutoRegister;
                        import io.github.reugn.route4j.annotation.Get;
                        
                        public class Second {
                            @AutoRegister("/events")
                            @Get("/search")
                            public static void search() {
                            }
                        }
                        """);
        RuntimeTestHelper helper = RuntimeTestHelper.compile(first, second, DIAGNOSTICS);

        List<List<String>> rows = dataRows(helper.capture(LISTING, "listRoutes"));

        assertThat(rows).containsExactly(
                List.of("/events", "/search", "search", "GET"),
                List.of("/events", "/search", "search", "GET"));
    }

    @Test
    @DisplayName("No handlers prints banner and header only")
    void noHandlers() {
        RuntimeTestHelper helper = RuntimeTestHelper.compile(DIAGNOSTICS);

        String output = helper.capture(LISTING, "listRoutes");

        assertThat(output).startsWith("List of automatically generated routes");
        assertThat(dataRows(output)).isEmpty();
        assertThat(helper.getStaticField(LISTING, "ROUTE_COUNT")).isEqualTo(0);
    }
}
