/**
 * Annotations for compile-time handler registration.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link io.github.reugn.route4j.annotation.AutoRegister} - Marks a handler method and its scope</li>
 *   <li>{@link io.github.reugn.route4j.annotation.Get}, {@link io.github.reugn.route4j.annotation.Post},
 *       {@link io.github.reugn.route4j.annotation.Put}, {@link io.github.reugn.route4j.annotation.Delete},
 *       {@link io.github.reugn.route4j.annotation.Patch} - Verb markers carrying the route path</li>
 *   <li>{@link io.github.reugn.route4j.annotation.Route} - Generic verb marker with a textual method</li>
 *   <li>{@link io.github.reugn.route4j.annotation.GenerateRegistration} - Generates the registration routine of a module</li>
 *   <li>{@link io.github.reugn.route4j.annotation.GenerateRouteListing} - Generates the route listing routine</li>
 * </ul>
 * <p>
 * All annotations are processed by {@link io.github.reugn.route4j.processor.AutoRegisterProcessor}.
 *
 * @see io.github.reugn.route4j.processor.AutoRegisterProcessor
 */
package io.github.reugn.route4j.annotation;
