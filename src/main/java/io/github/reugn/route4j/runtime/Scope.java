package io.github.reugn.route4j.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A group of handlers registered together under a common routing prefix.
 * <p>
 * Built fluently by generated registration code and handed to {@link ServiceConfig#service(Scope)}:
 * <pre>{@code
 * cfg.service(Scope.of("/events")
 *         .service(HandlerRoute.of(EventHandlers.class, "searchEvents", HttpVerb.GET, "/search"))
 *         .service(HandlerRoute.of(EventHandlers.class, "createEvent", HttpVerb.POST, "")));
 * }</pre>
 * Handlers keep the order in which they were added; adding the same handler twice keeps both.
 */
public final class Scope {

    private final String prefix;
    private final List<HandlerRoute> routes = new ArrayList<>();

    private Scope(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    /**
     * Creates an empty scope.
     *
     * @param prefix the routing prefix; empty for the root scope
     * @return a new scope
     */
    public static Scope of(String prefix) {
        return new Scope(prefix);
    }

    /**
     * Adds a handler to this scope.
     *
     * @param route the handler route
     * @return this scope
     */
    public Scope service(HandlerRoute route) {
        routes.add(Objects.requireNonNull(route, "route"));
        return this;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Returns the handlers of this scope in registration order.
     *
     * @return an unmodifiable view of the handlers
     */
    public List<HandlerRoute> routes() {
        return Collections.unmodifiableList(routes);
    }

    @Override
    public String toString() {
        return "Scope{prefix='" + prefix + "', routes=" + routes + '}';
    }
}
