package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a request handler to be registered under a scope.
 * <p>
 * The annotated method must also carry exactly one verb marker ({@link Get}, {@link Post},
 * {@link Put}, {@link Delete}, {@link Patch} or {@link Route}) declaring its path.
 * Every handler is filed under its scope and later picked up by the code generated for
 * {@link GenerateRegistration} and {@link GenerateRouteListing}.
 *
 * <p><b>Example:</b>
 * <pre>
 * {@code
 * public class EventHandlers {
 *     @AutoRegister("/events")
 *     @Get("/search")
 *     public static String searchEvents() {
 *         return "[]";
 *     }
 *
 *     @AutoRegister("/events")
 *     @Post("")
 *     public static String createEvent() {
 *         return "created";
 *     }
 * }
 * }
 * </pre>
 * <p>
 * The handler method must not be {@code private}, and neither may its declaring class,
 * since generated code references it directly.
 *
 * @see GenerateRegistration
 * @see GenerateRouteListing
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.SOURCE)
public @interface AutoRegister {

    /**
     * The scope (routing prefix) the handler belongs to, e.g. {@code "/events"}.
     * <p>
     * The scope is mandatory and must not be empty. It is also the module key used by
     * {@link GenerateRegistration#module()} to select handlers.
     *
     * @return the scope of the handler
     */
    String value() default "";
}
