package io.codefmt.align;

import io.codefmt.config.CallAlignConfig;
import io.codefmt.format.FormatContext;
import io.codefmt.token.Scope;
import io.codefmt.token.Token;
import io.codefmt.token.TokenKind;
import io.codefmt.token.TokenList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lines up the arguments of consecutive calls to the same function.
 *
 * <pre>
 * foo(1, 2);           foo( 1,  2);
 * foo(10, 20);   =>    foo(10, 20);
 * </pre>
 *
 * Only calls that start their line take part, and a group only grows while calls keep the same
 * qualified name, brace level and nesting level.
 */
public class SameCallParamAligner {

    private static final Logger LOGGER = LoggerFactory.getLogger(SameCallParamAligner.class);

    private final CallAlignConfig config;

    public SameCallParamAligner(CallAlignConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void align(TokenList tokens, FormatContext context) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(context, "context");
        if (!config.enabled()) {
            return;
        }
        LOGGER.debug("Aligning same call params in {} (span={}, threshold={})",
                context.sourceName(), config.span(), config.threshold());
        new Scan(context).run(tokens);
    }

    /**
     * Collects the first token of every top-level argument of {@code call}, stopping at a line
     * break, a statement end, or the call's closing parenthesis.
     */
    static List<Token> argumentHeads(Token call) {
        List<Token> heads = new ArrayList<>();
        int level = call.nestingLevel();
        Token open = call.nextOfKind(TokenKind.FPAREN_OPEN, level, Scope.ALL);
        boolean expectHead = true;
        for (Token token = open.next(); token.isNotNull(); token = token.next()) {
            if (token.isNewline()
                    || token.is(TokenKind.SEMICOLON)
                    || (token.is(TokenKind.FPAREN_CLOSE) && token.nestingLevel() == level)) {
                break;
            }
            if (token.nestingLevel() != level + 1) {
                continue;
            }
            if (expectHead) {
                heads.add(token);
                expectHead = false;
            } else if (token.is(TokenKind.COMMA)) {
                expectHead = true;
            }
        }
        return heads;
    }

    /**
     * Returns the token the qualified call name starts at, walking back over member connectors.
     */
    static Token nameStart(Token call) {
        Token start = call;
        Token prev = call.prev();
        while (prev.is(TokenKind.MEMBER) || prev.is(TokenKind.DC_MEMBER)) {
            Token owner = prev.prev();
            if (owner.isNull()) {
                break;
            }
            start = owner;
            // a type qualifier may itself be qualified; an object expression ends the name
            if (owner.isNot(TokenKind.TYPE)) {
                break;
            }
            prev = owner.prev();
        }
        return start;
    }

    static String qualifiedName(Token start, Token call) {
        StringBuilder name = new StringBuilder();
        for (Token token = start; token.isNotNull(); token = token.next()) {
            name.append(token.text());
            if (token == call) {
                break;
            }
        }
        return name.toString();
    }

    /**
     * State of one pass over a token list.
     */
    private final class Scan {

        private final FormatContext context;
        private final AlignStack nameStack = new AlignStack();
        private final List<AlignStack> argumentStacks = new ArrayList<>();
        private Token anchor = Token.NULL;
        private String anchorName = "";
        private int groupSize;
        private int movedTokens;
        private int blankLinesSinceCall;

        private Scan(FormatContext context) {
            this.context = context;
            nameStack.start(config.span(), config.threshold());
        }

        private void run(TokenList tokens) {
            for (Token token = tokens.head(); token.isNotNull(); token = token.next()) {
                if (token.isNewline()) {
                    int blankLines = Math.max(0, token.newlineCount() - 1);
                    nameStack.advanceBlankLines(blankLines);
                    for (AlignStack stack : argumentStacks) {
                        stack.advanceBlankLines(blankLines);
                    }
                    blankLinesSinceCall += blankLines;
                    if (anchor.isNotNull() && blankLinesSinceCall > config.span()) {
                        LOGGER.debug("Call group '{}' closed by {} blank lines after {} calls",
                                anchorName, blankLinesSinceCall, groupSize);
                        closeGroup();
                    }
                } else if (token.isNot(TokenKind.FUNC_CALL)) {
                    if (anchor.isNotNull() && token.nestingLevel() < anchor.nestingLevel()) {
                        LOGGER.debug("Call group '{}' left its scope after {} calls", anchorName, groupSize);
                        closeGroup();
                    }
                } else {
                    visitCall(token);
                }
            }
            if (groupSize > 1) {
                LOGGER.debug("Call group '{}' ended with {} calls", anchorName, groupSize);
                nameStack.end();
                for (AlignStack stack : argumentStacks) {
                    stack.end();
                }
                context.callGroupAligned();
            } else {
                nameStack.reset();
                argumentStacks.forEach(AlignStack::reset);
            }
            movedTokens += argumentMoves() + nameStack.movedTokens();
            context.columnsAligned(movedTokens);
        }

        private void visitCall(Token call) {
            Token start = nameStart(call);
            if (!start.isFirstOnLine()) {
                return;
            }
            String name = qualifiedName(start, call);
            blankLinesSinceCall = 0;
            if (anchor.isNotNull()) {
                boolean sameGroup = anchor.braceLevel() == call.braceLevel()
                        && anchor.nestingLevel() == call.nestingLevel()
                        && anchorName.equals(name);
                if (sameGroup) {
                    nameStack.add(call);
                    groupSize++;
                    LOGGER.debug("Add call '{}' on line {} to group", name, call.originLine());
                } else {
                    LOGGER.debug("Call group '{}' ended with {} calls", anchorName, groupSize);
                    closeGroup();
                }
            }
            if (anchor.isNull()) {
                startGroup(start, call, name);
            }
            addArguments(call);
        }

        private void startGroup(Token start, Token call, String name) {
            argumentStacks.clear();
            nameStack.reset();
            nameStack.add(call);
            anchor = start;
            anchorName = name;
            groupSize = 1;
            LOGGER.debug("Start call group '{}' on line {}", name, call.originLine());
        }

        private void closeGroup() {
            if (groupSize > 1) {
                context.callGroupAligned();
            }
            nameStack.flush();
            for (AlignStack stack : argumentStacks) {
                stack.flush();
            }
            movedTokens += argumentMoves();
            argumentStacks.clear();
            anchor = Token.NULL;
            anchorName = "";
            groupSize = 0;
        }

        private void addArguments(Token call) {
            List<Token> heads = argumentHeads(call);
            for (int index = 0; index < heads.size(); index++) {
                Token head = heads.get(index);
                if (index >= argumentStacks.size()) {
                    argumentStacks.add(newArgumentStack(head));
                }
                argumentStacks.get(index).add(head);
            }
        }

        private AlignStack newArgumentStack(Token firstHead) {
            AlignStack stack = new AlignStack();
            stack.start(config.span(), config.threshold());
            if (isNumericLiteral(firstHead)) {
                if (config.alignOnTabstop()) {
                    // right-justified numbers win over tab stops
                    stack.setTabStop(config.tabSize());
                    stack.setRightAlign(config.alignNumberRight());
                } else {
                    stack.setRightAlign(true);
                }
            }
            return stack;
        }

        private int argumentMoves() {
            int moved = 0;
            for (AlignStack stack : argumentStacks) {
                moved += stack.movedTokens();
            }
            return moved;
        }
    }

    private static boolean isNumericLiteral(Token token) {
        return token.kind().isNumeric()
                || token.is(TokenKind.POS)
                || token.is(TokenKind.NEG);
    }
}
