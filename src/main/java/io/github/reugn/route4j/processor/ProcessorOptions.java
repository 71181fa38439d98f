package io.github.reugn.route4j.processor;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Processor options passed with {@code -A} compiler flags.
 *
 * <ul>
 *   <li>{@code route4j.verbose}: print progress notes (default {@code false})</li>
 *   <li>{@code route4j.lockTimeoutMillis}: registry lock timeout in milliseconds (default {@code 5000})</li>
 * </ul>
 *
 * @param verbose     whether to print progress notes
 * @param lockTimeout the registry lock acquisition timeout
 */
record ProcessorOptions(boolean verbose, Duration lockTimeout) {

    static final String VERBOSE = "route4j.verbose";
    static final String LOCK_TIMEOUT_MILLIS = "route4j.lockTimeoutMillis";
    static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Option names, as reported by {@link javax.annotation.processing.Processor#getSupportedOptions()}.
     */
    static Set<String> names() {
        return Set.of(VERBOSE, LOCK_TIMEOUT_MILLIS);
    }

    /**
     * Parses processor options. Invalid values fall back to defaults.
     *
     * @param options  the raw options from the processing environment
     * @param warnings receives a message for every ignored value
     * @return the parsed options
     */
    static ProcessorOptions from(Map<String, String> options, Consumer<String> warnings) {
        boolean verbose = Boolean.parseBoolean(options.getOrDefault(VERBOSE, "false"));

        Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;
        String rawTimeout = options.get(LOCK_TIMEOUT_MILLIS);
        if (rawTimeout != null) {
            try {
                long millis = Long.parseLong(rawTimeout.trim());
                if (millis > 0) {
                    lockTimeout = Duration.ofMillis(millis);
                } else {
                    warnings.accept(LOCK_TIMEOUT_MILLIS + " must be positive, got '" + rawTimeout +
                            "'. Using " + DEFAULT_LOCK_TIMEOUT.toMillis() + " ms.");
                }
            } catch (NumberFormatException e) {
                warnings.accept(LOCK_TIMEOUT_MILLIS + " is not a number: '" + rawTimeout +
                        "'. Using " + DEFAULT_LOCK_TIMEOUT.toMillis() + " ms.");
            }
        }
        return new ProcessorOptions(verbose, lockTimeout);
    }
}
