package io.codefmt.render;

import io.codefmt.token.Token;
import io.codefmt.token.TokenFlag;
import io.codefmt.token.TokenKind;
import io.codefmt.token.TokenList;
import java.util.Objects;

/**
 * Turns a token list back into source text, placing every token at its rendered column.
 */
public class TokenRenderer {

    public String render(TokenList tokens) {
        Objects.requireNonNull(tokens, "tokens");
        StringBuilder out = new StringBuilder();
        int column = 1;
        for (Token token : tokens) {
            if (token.is(TokenKind.NEWLINE)) {
                out.append("\n".repeat(Math.max(1, token.newlineCount())));
                column = 1;
                continue;
            }
            column = placeAt(out, token, column);
            if (token.is(TokenKind.NL_CONT)) {
                out.append(token.text()).append('\n');
                column = 1;
                continue;
            }
            out.append(token.text());
            column = columnAfter(token.text(), column);
        }
        return out.toString();
    }

    private int placeAt(StringBuilder out, Token token, int column) {
        if (token.renderColumn() > column) {
            out.append(" ".repeat(token.renderColumn() - column));
            return token.renderColumn();
        }
        if (column > 1 && token.has(TokenFlag.PRECEDED_BY_SPACE) && token.renderColumn() < column) {
            out.append(' ');
            return column + 1;
        }
        return column;
    }

    private int columnAfter(String text, int column) {
        int lastBreak = text.lastIndexOf('\n');
        if (lastBreak < 0) {
            return column + text.length();
        }
        return text.length() - lastBreak;
    }
}
