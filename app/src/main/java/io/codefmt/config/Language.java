package io.codefmt.config;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Source languages the formatter understands, with the file extensions that select them.
 */
public enum Language {
    C(Set.of("c", "h")),
    CPP(Set.of("cpp", "cc", "cxx", "hpp", "hh", "hxx", "ino")),
    CS(Set.of("cs")),
    JAVA(Set.of("java")),
    D(Set.of("d")),
    OC(Set.of("m", "mm")),
    VALA(Set.of("vala"));

    private final Set<String> extensions;

    Language(Set<String> extensions) {
        this.extensions = extensions;
    }

    public static Language from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Language must be provided");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("C++")) {
            return CPP;
        }
        if (normalized.equals("C#") || normalized.equals("CSHARP")) {
            return CS;
        }
        for (Language language : values()) {
            if (language.name().equals(normalized)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unsupported language: " + raw);
    }

    public static Optional<Language> forFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.extensions.contains(extension)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
