package io.codefmt.parens;

import static org.assertj.core.api.Assertions.assertThat;

import io.codefmt.config.Language;
import io.codefmt.lex.SourceTokenizer;
import io.codefmt.render.TokenRenderer;
import io.codefmt.token.Token;
import io.codefmt.token.TokenKind;
import io.codefmt.token.TokenList;
import org.junit.jupiter.api.Test;

class ParenSplicerTest {

    private final SourceTokenizer tokenizer = new SourceTokenizer(8);

    @Test
    void adjacentBoundariesLeaveTheListUntouched() {
        TokenList tokens = tokenizer.tokenize("a b;\n", Language.C);
        Token a = tokens.head();
        int size = tokens.size();

        boolean inserted = new ParenSplicer(tokens).insertBetween(a, a.next());

        assertThat(inserted).isFalse();
        assertThat(tokens.size()).isEqualTo(size);
        assertThat(new TokenRenderer().render(tokens)).isEqualTo("a b;\n");
    }

    @Test
    void wrapsTheInnerTokensOneLevelDeeper() {
        TokenList tokens = tokenizer.tokenize("x = a == b;\n", Language.C);
        Token assign = find(tokens, "=");
        Token semicolon = find(tokens, ";");

        boolean inserted = new ParenSplicer(tokens).insertBetween(assign, semicolon);

        assertThat(inserted).isTrue();
        assertThat(new TokenRenderer().render(tokens)).isEqualTo("x = (a == b);\n");
        Token open = assign.next();
        Token close = semicolon.prev();
        assertThat(open.kind()).isEqualTo(TokenKind.PAREN_OPEN);
        assertThat(close.kind()).isEqualTo(TokenKind.PAREN_CLOSE);
        assertThat(open.nestingLevel()).isZero();
        assertThat(close.nestingLevel()).isZero();
        assertThat(open.closingBracket()).isSameAs(close);
        assertThat(find(tokens, "a").nestingLevel()).isEqualTo(1);
        assertThat(find(tokens, "b").nestingLevel()).isEqualTo(1);
        assertThat(close.renderColumn()).isEqualTo(12);
        assertThat(semicolon.renderColumn()).isEqualTo(13);
    }

    private static Token find(TokenList tokens, String text) {
        return tokens.toList().stream().filter(token -> token.text().equals(text)).findFirst().orElseThrow();
    }
}
