package io.codefmt.format;

import java.util.Objects;

/**
 * Outcome of formatting one source.
 */
public record FormatResult(String sourceName, String text, boolean changed, FormatStats stats) {

    public FormatResult {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(text, "text");
        stats = stats == null ? FormatStats.empty() : stats;
    }
}
