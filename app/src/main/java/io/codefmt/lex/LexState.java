package io.codefmt.lex;

import io.codefmt.token.Token;
import io.codefmt.token.TokenKind;
import io.codefmt.token.TokenRole;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Structural state the tokenizer keeps for one stream of code. Ordinary code and each
 * preprocessor directive get their own instance, so brackets inside a directive never disturb the
 * levels of the code around it.
 */
final class LexState {

    /**
     * An unclosed bracket.
     */
    record Frame(TokenKind closeKind, TokenRole role) {

        boolean isParen() {
            return closeKind == TokenKind.PAREN_CLOSE
                    || closeKind == TokenKind.SPAREN_CLOSE
                    || closeKind == TokenKind.FPAREN_CLOSE;
        }
    }

    final Deque<Frame> frames = new ArrayDeque<>();
    Token previous = Token.NULL;
    TokenRole pendingConditionRole = TokenRole.NONE;
    boolean expectStatementStart = true;
    int braceDepth;
    int openQuestions;

    int depth() {
        return frames.size();
    }

    boolean insideParens() {
        Frame top = frames.peek();
        return top != null && top.isParen();
    }

    void push(Frame frame) {
        frames.push(frame);
        if (frame.closeKind() == TokenKind.BRACE_CLOSE) {
            braceDepth++;
        }
    }

    /**
     * Pops the innermost frame when it is closed by {@code closer}'s family; otherwise leaves the
     * stack untouched and returns {@code null}.
     */
    Frame pop(char closer) {
        Frame top = frames.peek();
        if (top == null) {
            return null;
        }
        boolean matches = switch (closer) {
            case ')' -> top.isParen();
            case ']' -> top.closeKind() == TokenKind.SQUARE_CLOSE;
            case '}' -> top.closeKind() == TokenKind.BRACE_CLOSE;
            default -> false;
        };
        if (!matches) {
            return null;
        }
        frames.pop();
        if (top.closeKind() == TokenKind.BRACE_CLOSE) {
            braceDepth--;
        }
        return top;
    }
}
