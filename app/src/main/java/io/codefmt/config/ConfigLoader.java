package io.codefmt.config;

import io.codefmt.cli.CliArguments;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link FormatterConfig} by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_ALIGN_CALL_PARAMS = "CODEFMT_ALIGN_CALL_PARAMS";
    static final String ENV_CALL_PARAMS_SPAN = "CODEFMT_CALL_PARAMS_SPAN";
    static final String ENV_CALL_PARAMS_THRESHOLD = "CODEFMT_CALL_PARAMS_THRESHOLD";
    static final String ENV_ALIGN_NUMBER_RIGHT = "CODEFMT_ALIGN_NUMBER_RIGHT";
    static final String ENV_ALIGN_ON_TABSTOP = "CODEFMT_ALIGN_ON_TABSTOP";
    static final String ENV_TAB_SIZE = "CODEFMT_TAB_SIZE";
    static final String ENV_PAREN_IF_BOOL = "CODEFMT_PAREN_IF_BOOL";
    static final String ENV_PAREN_ASSIGN_BOOL = "CODEFMT_PAREN_ASSIGN_BOOL";
    static final String ENV_PAREN_RETURN_BOOL = "CODEFMT_PAREN_RETURN_BOOL";
    static final String ENV_LANGUAGE = "CODEFMT_LANGUAGE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public FormatterConfig load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        int tabSize = resolveInt(arguments.tabSize(), ENV_TAB_SIZE, CallAlignConfig.DEFAULT_TAB_SIZE);
        if (tabSize < 1) {
            throw new IllegalArgumentException("tab size must be at least 1");
        }

        CallAlignConfig callAlign = new CallAlignConfig(
                resolveFlag(arguments.alignCallParams(), ENV_ALIGN_CALL_PARAMS),
                resolveInt(arguments.callParamsSpan(), ENV_CALL_PARAMS_SPAN, CallAlignConfig.DEFAULT_SPAN),
                resolveInt(arguments.callParamsThreshold(), ENV_CALL_PARAMS_THRESHOLD, 0),
                resolveFlag(arguments.alignNumberRight(), ENV_ALIGN_NUMBER_RIGHT),
                resolveFlag(arguments.alignOnTabstop(), ENV_ALIGN_ON_TABSTOP),
                tabSize);

        ParenConfig parens = new ParenConfig(
                resolveFlag(arguments.parenIfBool(), ENV_PAREN_IF_BOOL),
                resolveFlag(arguments.parenAssignBool(), ENV_PAREN_ASSIGN_BOOL),
                resolveFlag(arguments.parenReturnBool(), ENV_PAREN_RETURN_BOOL));

        Optional<Language> language = Optional.ofNullable(arguments.language())
                .or(() -> environmentReader.value(ENV_LANGUAGE)
                        .map(Language::from));

        LogFormat logFormat = resolveLogFormat(arguments);

        if (arguments.stage() && !arguments.inPlace()) {
            throw new IllegalArgumentException("--stage can only be used together with --in-place");
        }

        return new FormatterConfig(callAlign, parens, language, tabSize, logFormat,
                arguments.inPlace(), arguments.stage(), arguments.gitChanged(), arguments.files());
    }

    private boolean resolveFlag(boolean cliValue, String envKey) {
        if (cliValue) {
            return true;
        }
        return environmentReader.value(envKey)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private int resolveInt(Integer cliValue, String envKey, int defaultValue) {
        if (cliValue != null) {
            return requireNonNegative(cliValue, envKey);
        }
        return environmentReader.value(envKey)
                .map(raw -> parseNonNegativeInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.value(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static int parseNonNegativeInteger(String raw, String envKey) {
        try {
            return requireNonNegative(Integer.parseInt(raw), envKey);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private static int requireNonNegative(int value, String envKey) {
        if (value < 0) {
            throw new IllegalArgumentException(envKey + " must be zero or greater");
        }
        return value;
    }
}
