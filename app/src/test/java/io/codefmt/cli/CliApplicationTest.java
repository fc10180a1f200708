package io.codefmt.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.codefmt.config.ConfigLoader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path workspace;

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    @Test
    void formatsStandardInputToStandardOutput() {
        CliApplication application = application(Map.of(), "if (a == 1 || b > 2)\n    x = 1;\n");

        int exitCode = application.run(new String[] {"--paren-if-bool"});

        assertThat(exitCode).isZero();
        assertThat(printed()).isEqualTo("if ((a == 1) || (b > 2))\n    x = 1;\n");
    }

    @Test
    void environmentEnablesRulesWithoutFlags() {
        CliApplication application = application(Map.of("CODEFMT_ALIGN_CALL_PARAMS", "true"),
                "foo(1, 2);\nfoo(10, 20);\n");

        int exitCode = application.run(new String[0]);

        assertThat(exitCode).isZero();
        assertThat(printed()).isEqualTo("foo( 1,  2);\nfoo(10, 20);\n");
    }

    @Test
    void rewritesFilesInPlace() throws IOException {
        Path source = workspace.resolve("main.c");
        Files.writeString(source, "int f(void)\n{\n    return a < b || c;\n}\n");
        CliApplication application = application(Map.of(), "");

        int exitCode = application.run(new String[] {"--paren-return-bool", "--in-place", "main.c"});

        assertThat(exitCode).isZero();
        assertThat(printed()).isEmpty();
        assertThat(Files.readString(source)).isEqualTo("int f(void)\n{\n    return (a < b) || c;\n}\n");
    }

    @Test
    void unknownOptionIsInvalidInput() {
        int exitCode = application(Map.of(), "").run(new String[] {"--no-such-option"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void inconsistentOptionsAreInvalidInput() {
        int exitCode = application(Map.of(), "").run(new String[] {"--stage", "main.c"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void unreadableFileFailsTheRun() {
        int exitCode = application(Map.of(), "").run(new String[] {"missing.c"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
    }

    @Test
    void helpExitsSuccessfully() {
        int exitCode = application(Map.of(), "").run(new String[] {"--help"});

        assertThat(exitCode).isZero();
    }

    private CliApplication application(Map<String, String> environment, String input) {
        ConfigLoader configLoader = new ConfigLoader(key -> Optional.ofNullable(environment.get(key)));
        return new CliApplication(configLoader,
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8),
                workspace);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
