package io.codefmt.format;

import static org.assertj.core.api.Assertions.assertThat;

import io.codefmt.config.CallAlignConfig;
import io.codefmt.config.FormatterConfig;
import io.codefmt.config.Language;
import io.codefmt.config.LogFormat;
import io.codefmt.config.ParenConfig;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FormatServiceTest {

    @Test
    void runsParenInsertionThenCallAlignment() {
        FormatService service = new FormatService(config(CallAlignConfig.defaults(), ParenConfig.all()));
        String source = "void f(void)\n"
                + "{\n"
                + "    if (a == 1 || b > 2)\n"
                + "        g();\n"
                + "    set(1, x);\n"
                + "    set(10, y);\n"
                + "}\n";

        FormatResult result = service.format(source, new FormatContext("f.c", Language.C));

        assertThat(result.text()).isEqualTo("void f(void)\n"
                + "{\n"
                + "    if ((a == 1) || (b > 2))\n"
                + "        g();\n"
                + "    set( 1, x);\n"
                + "    set(10, y);\n"
                + "}\n");
        assertThat(result.changed()).isTrue();
        assertThat(result.sourceName()).isEqualTo("f.c");
        assertThat(result.stats().parensInserted()).isEqualTo(2);
        assertThat(result.stats().callGroupsAligned()).isEqualTo(1);
    }

    @Test
    void reportsUnchangedSources() {
        FormatService service = new FormatService(config(CallAlignConfig.defaults(), ParenConfig.all()));
        String source = "if (!a && b)\n    run(1);\n";

        FormatResult result = service.format(source, new FormatContext("<stdin>", Language.C));

        assertThat(result.text()).isEqualTo(source);
        assertThat(result.changed()).isFalse();
        assertThat(result.stats()).isEqualTo(FormatStats.empty());
    }

    @Test
    void disabledRulesOnlyNormaliseLineEndings() {
        FormatService service = new FormatService(config(CallAlignConfig.disabled(), ParenConfig.none()));

        FormatResult result = service.format("if (a == 1 || b)\r\n    foo(1, 2);\r\n    foo(10, 20);\r\n",
                new FormatContext("w.c", Language.C));

        assertThat(result.text()).isEqualTo("if (a == 1 || b)\n    foo(1, 2);\n    foo(10, 20);\n");
        assertThat(result.changed()).isFalse();
    }

    private static FormatterConfig config(CallAlignConfig callAlign, ParenConfig parens) {
        return new FormatterConfig(callAlign, parens, Optional.empty(), 8, LogFormat.TEXT,
                false, false, false, List.of());
    }
}
