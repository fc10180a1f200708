package io.codefmt.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads settings from a snapshot of the process environment taken at construction.
 */
public class ProcessEnvironmentReader implements EnvironmentReader {

    private final Map<String, String> environment;

    public ProcessEnvironmentReader() {
        this(System.getenv());
    }

    ProcessEnvironmentReader(Map<String, String> environment) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(environment.get(key));
    }
}
