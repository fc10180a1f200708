package io.codefmt.cli;

import io.codefmt.config.Language;
import io.codefmt.config.LogFormat;
import java.util.function.Function;
import picocli.CommandLine;

/**
 * picocli converters for the enum-valued options. A value the enum rejects is reported as a
 * conversion error, which picocli turns into a usage failure naming the option.
 */
public final class OptionConverters {

    private OptionConverters() {
    }

    public static final class LanguageConverter implements CommandLine.ITypeConverter<Language> {
        @Override
        public Language convert(String value) {
            return parse(value, Language::from);
        }
    }

    public static final class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return parse(value, LogFormat::from);
        }
    }

    private static <T> T parse(String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
