package io.codefmt.parens;

import io.codefmt.token.Scope;
import io.codefmt.token.Token;
import io.codefmt.token.TokenKind;
import io.codefmt.token.TokenList;
import java.util.Objects;

/**
 * Wraps the tokens strictly between two boundaries in a new pair of parentheses.
 */
final class ParenSplicer {

    private final TokenList tokens;

    ParenSplicer(TokenList tokens) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
    }

    /**
     * Inserts {@code (} right after {@code first} and {@code )} right before {@code last}.
     *
     * @return {@code false} when nothing lies between the boundaries and the list was left alone
     */
    boolean insertBetween(Token first, Token last) {
        Token firstNext = first.nextNcNnl();
        if (firstNext == last || firstNext.isNull()) {
            return false;
        }
        Token lastPrev = last.prevNcNnl(Scope.PREPROC);
        if (lastPrev.isNull()) {
            return false;
        }

        Token open = Token.modelledOn(firstNext, TokenKind.PAREN_OPEN, "(");
        tokens.insertBefore(firstNext, open);
        shiftRestOfLine(firstNext);

        // levels are copied before the wrapped tokens move one level deeper
        Token close = Token.modelledOn(lastPrev, TokenKind.PAREN_CLOSE, ")");
        close.setRenderColumn(lastPrev.renderColumn() + lastPrev.length());
        close.setOrigin(lastPrev.originLine(), lastPrev.originColumnEnd(), lastPrev.originColumnEnd() + 1);

        for (Token token = firstNext; token.isNotNull(); token = token.nextNcNnl()) {
            token.setNestingLevel(token.nestingLevel() + 1);
            if (token == lastPrev) {
                break;
            }
        }

        tokens.insertAfter(lastPrev, close);
        shiftRestOfLine(close.next());
        return true;
    }

    private static void shiftRestOfLine(Token from) {
        for (Token token = from; token.isNotNull(); token = token.next()) {
            token.shiftColumns(1);
            if (token.isNewline()) {
                break;
            }
        }
    }
}
