package io.codefmt.format;

import java.util.List;

/**
 * Summary of one processor run over the configured inputs.
 */
public record ProcessingReport(int processed, int changed, List<String> failures) {

    public ProcessingReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
