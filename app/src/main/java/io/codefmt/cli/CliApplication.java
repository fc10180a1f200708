package io.codefmt.cli;

import io.codefmt.config.ConfigLoader;
import io.codefmt.config.FormatterConfig;
import io.codefmt.config.ProcessEnvironmentReader;
import io.codefmt.format.FormatException;
import io.codefmt.format.ProcessingReport;
import io.codefmt.format.SourceFileProcessor;
import io.codefmt.logging.LoggingConfigurator;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and file processor.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final InputStream in;
    private final PrintStream out;
    private final Path workingDirectory;

    public CliApplication() {
        this(new ConfigLoader(new ProcessEnvironmentReader()), System.in, System.out, Path.of("").toAbsolutePath());
    }

    CliApplication(ConfigLoader configLoader, InputStream in, PrintStream out, Path workingDirectory) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        FormatterConfig config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Formatting {} (alignCallParams={}, parens if={} assign={} return={})",
                describeInputs(config), config.callAlign().enabled(), config.parens().ifBool(),
                config.parens().assignBool(), config.parens().returnBool());

        SourceFileProcessor processor = new SourceFileProcessor(config, workingDirectory);
        ProcessingReport report;
        try {
            report = processor.process(in, out);
        } catch (FormatException ex) {
            LOGGER.error("Formatting failed: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
        if (report.hasFailures()) {
            LOGGER.warn("Formatting failed for files: {}", String.join(", ", report.failures()));
            return EXIT_FAILURE;
        }
        return 0;
    }

    private static String describeInputs(FormatterConfig config) {
        if (config.readsStandardInput()) {
            return "standard input";
        }
        String files = config.files().size() + " files";
        return config.gitChanged() ? files + " plus git changes" : files;
    }
}
