package io.codefmt.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.codefmt.cli.CliArguments;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--align-call-params",
                "--call-params-span", "2",
                "--call-params-threshold", "12",
                "--align-number-right",
                "--tab-size", "4",
                "--paren-if-bool",
                "--paren-return-bool",
                "--language", "c++",
                "--log-format", "json",
                "--in-place",
                "--stage",
                "src/a.cpp", "src/b.cpp");

        FormatterConfig config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.callAlign()).isEqualTo(new CallAlignConfig(true, 2, 12, true, false, 4));
        assertThat(config.parens()).isEqualTo(new ParenConfig(true, false, true));
        assertThat(config.language()).contains(Language.CPP);
        assertThat(config.tabSize()).isEqualTo(4);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.inPlace()).isTrue();
        assertThat(config.stage()).isTrue();
        assertThat(config.gitChanged()).isFalse();
        assertThat(config.files()).containsExactly(Path.of("src/a.cpp"), Path.of("src/b.cpp"));
        assertThat(config.readsStandardInput()).isFalse();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_ALIGN_CALL_PARAMS, "true");
        envValues.put(ConfigLoader.ENV_CALL_PARAMS_SPAN, "5");
        envValues.put(ConfigLoader.ENV_ALIGN_ON_TABSTOP, "1");
        envValues.put(ConfigLoader.ENV_PAREN_ASSIGN_BOOL, "TRUE");
        envValues.put(ConfigLoader.ENV_LANGUAGE, "java");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        FormatterConfig config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.callAlign()).isEqualTo(new CallAlignConfig(true, 5, 0, false, true, 8));
        assertThat(config.parens()).isEqualTo(new ParenConfig(false, true, false));
        assertThat(config.language()).contains(Language.JAVA);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.readsStandardInput()).isTrue();
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_TAB_SIZE, ConfigLoader.ENV_PAREN_IF_BOOL);
    }

    @Test
    void cliValuesTakePrecedenceOverEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_CALL_PARAMS_SPAN, "5",
                ConfigLoader.ENV_LOG_FORMAT, "json"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--call-params-span", "1",
                "--log-format", "text");

        FormatterConfig config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.callAlign().span()).isEqualTo(1);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void appliesDefaults() {
        FormatterConfig config = new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments()));

        assertThat(config.callAlign()).isEqualTo(new CallAlignConfig(false, 3, 0, false, false, 8));
        assertThat(config.parens()).isEqualTo(ParenConfig.none());
        assertThat(config.language()).isEmpty();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.languageFor("main.cs")).isEqualTo(Language.CS);
        assertThat(config.languageFor("README")).isEqualTo(Language.C);
    }

    @Test
    void zeroSpanMeansTheDefaultSpan() {
        FormatterConfig config = new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "--call-params-span", "0"));

        assertThat(config.callAlign().span()).isEqualTo(CallAlignConfig.DEFAULT_SPAN);
    }

    @Test
    void negativeValuesAreRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--call-params-threshold=-1");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_CALL_PARAMS_THRESHOLD);
    }

    @Test
    void malformedEnvironmentNumbersAreRejected() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_TAB_SIZE, "wide"));

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader)
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_TAB_SIZE);
    }

    @Test
    void stagingRequiresInPlace() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--stage", "a.c");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--in-place");
    }

    @Test
    void inPlaceRequiresFiles() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--in-place");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
