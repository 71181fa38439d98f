/**
 * Run-time support for generated registration and listing code.
 * <p>
 * Hosting frameworks implement {@link io.github.reugn.route4j.runtime.ServiceConfig};
 * generated routines build {@link io.github.reugn.route4j.runtime.Scope} groups of
 * {@link io.github.reugn.route4j.runtime.HandlerRoute} entries and hand them over.
 * Route listings are printed with {@link io.github.reugn.route4j.runtime.RouteTable}.
 */
package io.github.reugn.route4j.runtime;
