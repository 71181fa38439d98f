package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requests generation of a registration routine for all handlers of one module.
 * <p>
 * For a type {@code AppRoutes} annotated with this annotation, a class {@code AppRoutesRegistration}
 * is generated in the same package with a single entry point:
 * <pre>
 * {@code
 * @GenerateRegistration(module = "/events", useScope = true)
 * public interface AppRoutes {}
 *
 * // Generated: AppRoutesRegistration.java
 * public final class AppRoutesRegistration {
 *     public static void registerService(ServiceConfig cfg) {
 *         cfg.service(Scope.of("/events")
 *                 .service(HandlerRoute.of(EventHandlers.class, "searchEvents", HttpVerb.GET, "/search"))
 *                 .service(HandlerRoute.of(EventHandlers.class, "createEvent", HttpVerb.POST, "")));
 *     }
 * }
 * }
 * </pre>
 * <p>
 * A module without handlers produces an empty routine. The handler list is fixed when the
 * class is generated; the routine never consults any registry at run time.
 *
 * @see AutoRegister
 * @see io.github.reugn.route4j.runtime.ServiceConfig
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface GenerateRegistration {

    /**
     * The module key: the scope whose handlers are registered. Mandatory.
     *
     * @return the module key
     */
    String module() default "";

    /**
     * Whether handlers are registered under their own scope as routing prefix.
     * <p>
     * When {@code false}, every handler group is registered under the root (empty) prefix.
     *
     * @return true to prefix routes with the handler scope
     */
    boolean useScope() default false;
}
