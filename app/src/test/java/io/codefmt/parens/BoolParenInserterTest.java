package io.codefmt.parens;

import static org.assertj.core.api.Assertions.assertThat;

import io.codefmt.config.Language;
import io.codefmt.config.ParenConfig;
import io.codefmt.format.FormatContext;
import io.codefmt.lex.SourceTokenizer;
import io.codefmt.render.TokenRenderer;
import io.codefmt.token.Token;
import io.codefmt.token.TokenKind;
import io.codefmt.token.TokenList;
import io.codefmt.token.TokenRole;
import org.junit.jupiter.api.Test;

class BoolParenInserterTest {

    private final SourceTokenizer tokenizer = new SourceTokenizer(8);

    @Test
    void wrapsEachComparisonOfAnIfCondition() {
        FormatContext context = context(Language.C);

        String output = apply("if (a == 1 || b > 2)\n    x = 1;\n", ParenConfig.all(), context);

        assertThat(output).isEqualTo("if ((a == 1) || (b > 2))\n    x = 1;\n");
        assertThat(context.stats().parensInserted()).isEqualTo(2);
    }

    @Test
    void leavesConditionsWithoutComparisonsAlone() {
        String source = "if (!a && b)\n    x = 1;\n";

        assertThat(apply(source, ParenConfig.all(), context(Language.C))).isEqualTo(source);
    }

    @Test
    void leavesASingleComparisonAlone() {
        String source = "if (a == 1)\n    x = a == b;\n";

        assertThat(apply(source, ParenConfig.all(), context(Language.C))).isEqualTo(source);
    }

    @Test
    void secondRunChangesNothing() {
        String once = apply("if (a == 1 || b > 2 && c != d)\n    x = 1;\n", ParenConfig.all(), context(Language.C));
        FormatContext context = context(Language.C);

        String twice = apply(once, ParenConfig.all(), context);

        assertThat(twice).isEqualTo(once);
        assertThat(context.stats().parensInserted()).isZero();
    }

    @Test
    void handlesElseIfAndSwitch() {
        assertThat(apply("if (a) {\n} else if (b == 1 && c) {\n}\n", ParenConfig.all(), context(Language.C)))
                .isEqualTo("if (a) {\n} else if ((b == 1) && c) {\n}\n");
        assertThat(apply("switch (a == b || c) {\n}\n", ParenConfig.all(), context(Language.C)))
                .isEqualTo("switch ((a == b) || c) {\n}\n");
    }

    @Test
    void wrapsComparisonsInAssignmentsAndReturns() {
        assertThat(apply("x = a == b && c;\n", new ParenConfig(false, true, false), context(Language.C)))
                .isEqualTo("x = (a == b) && c;\n");
        assertThat(apply("return a > b ? a : b;\n", new ParenConfig(false, false, true), context(Language.C)))
                .isEqualTo("return (a > b) ? a : b;\n");
    }

    @Test
    void honoursEachToggle() {
        String source = "if (a == 1 || b) {\n    x = a == b && c;\n    return a < b || c;\n}\n";

        assertThat(apply(source, ParenConfig.none(), context(Language.C))).isEqualTo(source);
        assertThat(apply(source, new ParenConfig(false, false, true), context(Language.C)))
                .isEqualTo("if (a == 1 || b) {\n    x = a == b && c;\n    return (a < b) || c;\n}\n");
    }

    @Test
    void descendsIntoNestedParentheses() {
        String output = apply("if (f(a == b, c) || d > e)\n    x = 1;\n", ParenConfig.all(), context(Language.C));

        assertThat(output).isEqualTo("if (f((a == b), c) || (d > e))\n    x = 1;\n");
    }

    @Test
    void skipsComparisonsInsideSubscripts() {
        String output = apply("x = a == b && c[i == 0];\n", new ParenConfig(false, true, false), context(Language.C));

        assertThat(output).isEqualTo("x = (a == b) && c[i == 0];\n");
    }

    @Test
    void abandonsRegionsThatCrossADirective() {
        FormatContext context = context(Language.C);
        String source = "if (a == 1\n#ifdef X\n    || b == 2\n#endif\n    )\n    x = 1;\n";

        String output = apply(source, ParenConfig.all(), context);

        assertThat(output).isEqualTo(source);
        assertThat(context.stats().regionsAbandoned()).isEqualTo(1);
        assertThat(context.stats().parensInserted()).isZero();
    }

    @Test
    void abandonsRegionsWithAnUnbalancedBracket() {
        TokenList tokens = new TokenList();
        tokens.append(new Token(TokenKind.IF, "if").setLevels(0, 0, 0));
        tokens.append(new Token(TokenKind.SPAREN_OPEN, "(").setRole(TokenRole.IF).setLevels(0, 0, 0));
        tokens.append(new Token(TokenKind.WORD, "a").setLevels(1, 0, 0));
        tokens.append(new Token(TokenKind.COMPARE, "==").setLevels(1, 0, 0));
        tokens.append(new Token(TokenKind.NUMBER, "1").setLevels(1, 0, 0));
        tokens.append(new Token(TokenKind.BOOL, "||").setLevels(1, 0, 0));
        tokens.append(new Token(TokenKind.WORD, "b").setLevels(1, 0, 0));
        tokens.append(new Token(TokenKind.SQUARE_OPEN, "[").setLevels(1, 0, 0));
        tokens.append(new Token(TokenKind.WORD, "c").setLevels(2, 0, 0));
        tokens.append(new Token(TokenKind.SPAREN_CLOSE, ")").setLevels(0, 0, 0));
        FormatContext context = context(Language.C);

        new BoolParenInserter(ParenConfig.all()).apply(tokens, context);

        assertThat(tokens.size()).isEqualTo(10);
        assertThat(context.stats().parensInserted()).isZero();
        assertThat(context.stats().regionsAbandoned()).isEqualTo(1);
    }

    @Test
    void insertsNothingForCSharp() {
        String source = "if (a == 1 || b > 2)\n    x = 1;\n";

        assertThat(apply(source, ParenConfig.all(), context(Language.CS))).isEqualTo(source);
    }

    @Test
    void recognisesAssignmentsInsideWhileConditions() {
        assertThat(BoolParenInserter.insideWhileCondition(assignment("while (x = a < b) {\n}\n"))).isTrue();
        assertThat(BoolParenInserter.insideWhileCondition(assignment("if (x = a < b) {\n}\n"))).isFalse();
        assertThat(BoolParenInserter.insideWhileCondition(assignment("y = a < b;\n"))).isFalse();
    }

    @Test
    void leavesWhileConditionAssignmentsAlone() {
        String source = "while (x = a < b && c) {\n    n = m;\n}\n";

        assertThat(apply(source, ParenConfig.all(), context(Language.C))).isEqualTo(source);
    }

    private Token assignment(String source) {
        return tokenizer.tokenize(source, Language.C).toList().stream()
                .filter(token -> token.is(TokenKind.ASSIGN))
                .findFirst()
                .orElseThrow();
    }

    private String apply(String source, ParenConfig config, FormatContext context) {
        TokenList tokens = tokenizer.tokenize(source, context.language());
        new BoolParenInserter(config).apply(tokens, context);
        return new TokenRenderer().render(tokens);
    }

    private static FormatContext context(Language language) {
        return new FormatContext("test.c", language);
    }
}
