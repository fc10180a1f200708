package io.codefmt.format;

import io.codefmt.config.FormatterConfig;
import io.codefmt.config.Language;
import io.codefmt.git.ChangedSourceLocator;
import io.codefmt.writer.SourceWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Feeds the configured inputs through the {@link FormatService} and delivers the results, either
 * to the output stream or back into the files.
 */
public class SourceFileProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceFileProcessor.class);
    static final String STDIN_NAME = "<stdin>";
    static final String MDC_FILE = "file";

    private final FormatterConfig config;
    private final FormatService formatService;
    private final SourceWriter sourceWriter;
    private final ChangedSourceLocator changedSourceLocator;
    private final Path workingDirectory;

    public SourceFileProcessor(FormatterConfig config, Path workingDirectory) {
        this(config, new FormatService(config), new SourceWriter(), new ChangedSourceLocator(), workingDirectory);
    }

    SourceFileProcessor(FormatterConfig config,
                        FormatService formatService,
                        SourceWriter sourceWriter,
                        ChangedSourceLocator changedSourceLocator,
                        Path workingDirectory) {
        this.config = Objects.requireNonNull(config, "config");
        this.formatService = Objects.requireNonNull(formatService, "formatService");
        this.sourceWriter = Objects.requireNonNull(sourceWriter, "sourceWriter");
        this.changedSourceLocator = Objects.requireNonNull(changedSourceLocator, "changedSourceLocator");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
    }

    public ProcessingReport process(InputStream in, PrintStream out) {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(out, "out");
        if (config.readsStandardInput()) {
            return processStandardInput(in, out);
        }

        List<Path> files = new ArrayList<>(config.files());
        if (config.gitChanged()) {
            files.addAll(changedSourceLocator.changedSources(workingDirectory));
        }
        if (files.isEmpty()) {
            LOGGER.info("No source files to format");
        }

        int processed = 0;
        int changed = 0;
        List<String> failures = new ArrayList<>();
        for (Path file : files) {
            Path resolved = workingDirectory.resolve(file);
            MDC.put(MDC_FILE, file.toString());
            try {
                if (processFile(resolved, out)) {
                    changed++;
                }
                processed++;
            } catch (FormatException ex) {
                LOGGER.error("Failed to format {}: {}", file, ex.getMessage(), ex);
                failures.add(file.toString());
            } finally {
                MDC.remove(MDC_FILE);
            }
        }
        LOGGER.info("Processed {} files, {} changed, {} failed", processed, changed, failures.size());
        return new ProcessingReport(processed, changed, failures);
    }

    private ProcessingReport processStandardInput(InputStream in, PrintStream out) {
        String source;
        try {
            source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new FormatException("Failed to read standard input", ex);
        }
        Language language = config.language().orElse(Language.C);
        FormatResult result = formatService.format(source, new FormatContext(STDIN_NAME, language));
        out.print(result.text());
        out.flush();
        return new ProcessingReport(1, result.changed() ? 1 : 0, List.of());
    }

    private boolean processFile(Path file, PrintStream out) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new FormatException("Failed to read source: " + file, ex);
        }
        Language language = config.languageFor(file.getFileName().toString());
        FormatResult result = formatService.format(source, new FormatContext(file.toString(), language));

        if (!config.inPlace()) {
            out.print(result.text());
            out.flush();
            return result.changed();
        }
        if (!result.changed()) {
            LOGGER.debug("{} is already formatted", file);
            return false;
        }
        sourceWriter.write(file, result.text());
        if (config.stage()) {
            sourceWriter.stage(file);
        }
        return true;
    }
}
