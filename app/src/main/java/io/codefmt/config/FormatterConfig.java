package io.codefmt.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record FormatterConfig(
        CallAlignConfig callAlign,
        ParenConfig parens,
        Optional<Language> language,
        int tabSize,
        LogFormat logFormat,
        boolean inPlace,
        boolean stage,
        boolean gitChanged,
        List<Path> files
) {

    public FormatterConfig {
        Objects.requireNonNull(callAlign, "callAlign");
        Objects.requireNonNull(parens, "parens");
        language = language == null ? Optional.empty() : language;
        Objects.requireNonNull(logFormat, "logFormat");
        if (tabSize < 1) {
            throw new IllegalArgumentException("tabSize must be at least 1");
        }
        files = files == null ? List.of() : List.copyOf(files);
        if (stage && !inPlace) {
            throw new IllegalArgumentException("--stage requires --in-place");
        }
        if (inPlace && files.isEmpty() && !gitChanged) {
            throw new IllegalArgumentException("--in-place requires input files");
        }
    }

    /**
     * Language for {@code fileName}: the configured one, else the one its extension implies, else C.
     */
    public Language languageFor(String fileName) {
        return language.or(() -> Language.forFileName(fileName)).orElse(Language.C);
    }

    public boolean readsStandardInput() {
        return files.isEmpty() && !gitChanged;
    }
}
