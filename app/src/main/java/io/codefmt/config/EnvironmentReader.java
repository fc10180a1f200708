package io.codefmt.config;

import java.util.Optional;

/**
 * Source of {@code CODEFMT_*} and {@code LOG_FORMAT} settings.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * The trimmed value of {@code key}; blank values count as unset.
     */
    default Optional<String> value(String key) {
        return get(key)
                .map(String::trim)
                .filter(raw -> !raw.isEmpty());
    }
}
