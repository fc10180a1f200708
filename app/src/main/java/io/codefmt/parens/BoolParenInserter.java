package io.codefmt.parens;

import io.codefmt.config.Language;
import io.codefmt.config.ParenConfig;
import io.codefmt.format.FormatContext;
import io.codefmt.token.Scope;
import io.codefmt.token.Token;
import io.codefmt.token.TokenFlag;
import io.codefmt.token.TokenKind;
import io.codefmt.token.TokenList;
import io.codefmt.token.TokenRole;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds parentheses around bare comparisons in conditions, assignments and return expressions.
 *
 * <p>Only simple patterns are rewritten; comparisons are bounded by the region edges, boolean
 * connectives, the ternary operator and commas:
 * <pre>
 * (!a &amp;&amp; b)         =&gt; (!a &amp;&amp; b)
 * (a &amp;&amp; b == 1)     =&gt; (a &amp;&amp; (b == 1))
 * (a == 1 || b &gt; 2) =&gt; ((a == 1) || (b &gt; 2))
 * </pre>
 */
public class BoolParenInserter {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoolParenInserter.class);

    private final ParenConfig config;

    public BoolParenInserter(ParenConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void apply(TokenList tokens, FormatContext context) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(context, "context");
        if (!config.anyEnabled()) {
            return;
        }
        Pass pass = new Pass(tokens, context);
        if (config.ifBool()) {
            pass.conditions();
        }
        if (config.assignBool()) {
            pass.statements(TokenKind.ASSIGN);
        }
        if (config.returnBool()) {
            pass.statements(TokenKind.RETURN);
        }
    }

    /**
     * Walks back from an assignment or return to find out whether it sits inside a {@code while}
     * condition.
     *
     * <p>The walk stops at the start of the statement, at a condition paren, or once it climbs
     * out of the enclosing parentheses; the decision is made on the token it stopped at.
     */
    static boolean insideWhileCondition(Token start) {
        int checkLevel = start.nestingLevel();
        Token token = start.prevNc(Scope.PREPROC);
        while (token.isNotNull()) {
            if (token.has(TokenFlag.STATEMENT_START)) {
                break;
            }
            if (token.is(TokenKind.PAREN_OPEN)) {
                checkLevel--;
            }
            if (token.is(TokenKind.SPAREN_OPEN)) {
                break;
            }
            token = token.prevNc(Scope.PREPROC);
            // an exhausted level count behaves like an unsigned underflow and ends the walk
            if (checkLevel <= 0 || token.nestingLevel() < checkLevel - 1) {
                break;
            }
        }
        return token.role() == TokenRole.WHILE;
    }

    /**
     * One run over a token list.
     */
    private final class Pass {

        private final TokenList tokens;
        private final FormatContext context;
        private final ParenSplicer splicer;
        private final boolean insertionAllowed;

        private Pass(TokenList tokens, FormatContext context) {
            this.tokens = tokens;
            this.context = context;
            this.splicer = new ParenSplicer(tokens);
            this.insertionAllowed = context.language() != Language.CS;
        }

        private void conditions() {
            Token token = tokens.head();
            if (token.isComment() || token.isNewline()) {
                token = token.nextNcNnl();
            }
            while (token.isNotNull()) {
                if (token.is(TokenKind.SPAREN_OPEN) && isBranchCondition(token)) {
                    Token close = token.nextOfKind(TokenKind.SPAREN_CLOSE, token.nestingLevel(), Scope.PREPROC);
                    if (close.isNotNull()) {
                        processRegion(token, close, 0);
                        token = close;
                    }
                }
                token = token.nextNcNnl();
            }
        }

        private void statements(TokenKind trigger) {
            Token token = tokens.head();
            if (token.isComment() || token.isNewline()) {
                token = token.nextNcNnl();
            }
            while (token.isNotNull()) {
                if (token.is(trigger)) {
                    if (insideWhileCondition(token)) {
                        LOGGER.debug("Skipping '{}' on line {} inside a while condition", token.text(), token.originLine());
                    } else {
                        Token end = token.nextOfKind(TokenKind.SEMICOLON, token.nestingLevel(), Scope.PREPROC);
                        if (end.isNotNull()) {
                            processRegion(token, end, 0);
                            token = end;
                        }
                    }
                }
                token = token.nextNcNnl();
            }
        }

        private boolean isBranchCondition(Token open) {
            TokenRole role = open.role();
            return role == TokenRole.IF || role == TokenRole.ELSEIF || role == TokenRole.SWITCH;
        }

        private void processRegion(Token open, Token close, int depth) {
            if (crossesPreprocessor(open, close)) {
                LOGGER.debug("Leaving region on line {} alone: it spans a preprocessor directive", open.originLine());
                context.regionAbandoned();
                return;
            }
            if (hasUnbalancedBracket(open, close)) {
                context.regionAbandoned();
                return;
            }
            LOGGER.trace("Region '{}' line {} to '{}' line {} at depth {}",
                    open.text(), open.originLine(), close.text(), close.originLine(), depth);

            Token ref = open;
            boolean pendingComparison = false;
            Token token = open.nextNcNnl();
            while (token.isNotNull() && token != close) {
                TokenKind kind = token.kind();
                if (kind == TokenKind.BOOL || kind == TokenKind.QUESTION
                        || kind == TokenKind.COND_COLON || kind == TokenKind.COMMA) {
                    if (pendingComparison) {
                        pendingComparison = false;
                        wrap(ref, token);
                    }
                    ref = token;
                } else if (kind == TokenKind.COMPARE) {
                    pendingComparison = true;
                } else if (kind.isParenOpening()) {
                    Token inner = token.closingBracket();
                    if (inner.isNotNull()) {
                        processRegion(token, inner, depth + 1);
                        token = inner;
                    }
                } else if (kind == TokenKind.SEMICOLON) {
                    ref = token;
                } else if (kind == TokenKind.BRACE_OPEN || kind == TokenKind.SQUARE_OPEN || kind == TokenKind.ANGLE_OPEN) {
                    token = token.closingBracket();
                }
                token = token.nextNcNnl();
            }

            if (pendingComparison && ref != open) {
                wrap(ref, close);
            }
        }

        private void wrap(Token first, Token last) {
            if (!insertionAllowed) {
                return;
            }
            if (splicer.insertBetween(first, last)) {
                context.parensInserted();
                LOGGER.debug("Added parens on line {} between '{}' and '{}'",
                        first.originLine(), first.text(), last.text());
            }
        }

        private boolean hasUnbalancedBracket(Token open, Token close) {
            for (Token token = open.next(); token.isNotNull() && token != close; token = token.next()) {
                TokenKind kind = token.kind();
                boolean opener = kind == TokenKind.BRACE_OPEN || kind == TokenKind.SQUARE_OPEN
                        || kind == TokenKind.ANGLE_OPEN;
                if (opener && token.closingBracket().isNull()) {
                    LOGGER.debug("Leaving region on line {} alone: unbalanced '{}' on line {}",
                            open.originLine(), token.text(), token.originLine());
                    return true;
                }
            }
            return false;
        }

        private boolean crossesPreprocessor(Token open, Token close) {
            for (Token token = open.next(); token.isNotNull() && token != close; token = token.next()) {
                if (token.has(TokenFlag.IN_PREPROC)) {
                    return true;
                }
            }
            return false;
        }
    }
}
