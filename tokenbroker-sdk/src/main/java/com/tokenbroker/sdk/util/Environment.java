package com.tokenbroker.sdk.util;

import java.util.Map;
import java.util.Optional;

/**
 * Read access to process environment variables.
 *
 * <p>Components that depend on environment variables take an {@code Environment} so tests can
 * supply values without touching the real process environment.</p>
 */
@FunctionalInterface
public interface Environment {

    /**
     * @return the variable's value, or empty if unset
     */
    Optional<String> get(String name);

    /**
     * @return the variable's value, or empty if unset or blank
     */
    default Optional<String> getNonBlank(String name) {
        return get(name).filter(value -> !value.isBlank());
    }

    static Environment system() {
        return name -> Optional.ofNullable(System.getenv(name));
    }

    static Environment of(Map<String, String> variables) {
        Map<String, String> copy = Map.copyOf(variables);
        return name -> Optional.ofNullable(copy.get(name));
    }
}
