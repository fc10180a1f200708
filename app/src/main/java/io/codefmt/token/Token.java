package io.codefmt.token;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A lexical unit in a {@link TokenList}, carrying its source position, nesting metadata and role.
 *
 * <p>Tokens live in the arena of the list that owns them and refer to their neighbours by slot
 * index. {@link #NULL} stands in for "no token": every traversal from it, and every traversal that
 * finds nothing, yields {@link #NULL} again, so chained lookups never need intermediate checks.
 */
public final class Token {

    static final int NO_SLOT = -1;

    public static final Token NULL = new Token(TokenKind.NONE, "");

    private final TokenKind kind;
    private final String text;
    private final Set<TokenFlag> flags = EnumSet.noneOf(TokenFlag.class);

    private TokenRole role = TokenRole.NONE;
    private int originLine;
    private int originColumn;
    private int originColumnEnd;
    private int renderColumn;
    private int nestingLevel;
    private int braceLevel;
    private int preprocLevel;
    private int newlineCount;

    TokenList owner;
    int slot = NO_SLOT;
    int nextSlot = NO_SLOT;
    int prevSlot = NO_SLOT;

    public Token(TokenKind kind, String text) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
    }

    /**
     * Creates a detached token positioned where {@code model} is, inheriting its levels and copyable flags.
     */
    public static Token modelledOn(Token model, TokenKind kind, String text) {
        Token token = new Token(kind, text);
        token.originLine = model.originLine;
        token.originColumn = model.originColumn;
        token.originColumnEnd = model.originColumn + text.length();
        token.renderColumn = model.renderColumn;
        token.nestingLevel = model.nestingLevel;
        token.braceLevel = model.braceLevel;
        token.preprocLevel = model.preprocLevel;
        for (TokenFlag flag : model.flags) {
            if (TokenFlag.COPYABLE.contains(flag)) {
                token.flags.add(flag);
            }
        }
        return token;
    }

    public boolean isNull() {
        return this == NULL;
    }

    public boolean isNotNull() {
        return this != NULL;
    }

    public boolean is(TokenKind candidate) {
        return kind == candidate;
    }

    public boolean isNot(TokenKind candidate) {
        return kind != candidate;
    }

    public boolean isNewline() {
        return kind == TokenKind.NEWLINE || kind == TokenKind.NL_CONT;
    }

    public boolean isComment() {
        return kind == TokenKind.COMMENT;
    }

    public boolean has(TokenFlag flag) {
        return flags.contains(flag);
    }

    public TokenKind kind() {
        return kind;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public TokenRole role() {
        return role;
    }

    public int originLine() {
        return originLine;
    }

    public int originColumn() {
        return originColumn;
    }

    public int originColumnEnd() {
        return originColumnEnd;
    }

    public int renderColumn() {
        return renderColumn;
    }

    public int nestingLevel() {
        return nestingLevel;
    }

    public int braceLevel() {
        return braceLevel;
    }

    public int preprocLevel() {
        return preprocLevel;
    }

    public int newlineCount() {
        return newlineCount;
    }

    public Token setRole(TokenRole role) {
        mutable().role = Objects.requireNonNull(role, "role");
        return this;
    }

    public Token setOrigin(int line, int column, int columnEnd) {
        Token self = mutable();
        self.originLine = line;
        self.originColumn = column;
        self.originColumnEnd = columnEnd;
        return this;
    }

    public Token setRenderColumn(int column) {
        mutable().renderColumn = column;
        return this;
    }

    public Token setLevels(int nesting, int brace, int preproc) {
        Token self = mutable();
        self.nestingLevel = nesting;
        self.braceLevel = brace;
        self.preprocLevel = preproc;
        return this;
    }

    public Token setNestingLevel(int level) {
        mutable().nestingLevel = level;
        return this;
    }

    public Token setNewlineCount(int count) {
        mutable().newlineCount = count;
        return this;
    }

    public Token addFlag(TokenFlag flag) {
        mutable().flags.add(flag);
        return this;
    }

    /**
     * Moves the token right by {@code delta} columns in both rendered and source coordinates.
     */
    public void shiftColumns(int delta) {
        Token self = mutable();
        self.renderColumn += delta;
        self.originColumn += delta;
        self.originColumnEnd += delta;
    }

    public Token next() {
        return owner == null ? NULL : owner.at(nextSlot);
    }

    public Token prev() {
        return owner == null ? NULL : owner.at(prevSlot);
    }

    public Token next(Scope scope) {
        return step(true, scope);
    }

    public Token prev(Scope scope) {
        return step(false, scope);
    }

    /** Next token that is not a comment. */
    public Token nextNc() {
        return nextNc(Scope.ALL);
    }

    public Token nextNc(Scope scope) {
        Token token = next(scope);
        while (token.isComment()) {
            token = token.next(scope);
        }
        return token;
    }

    public Token prevNc(Scope scope) {
        Token token = prev(scope);
        while (token.isComment()) {
            token = token.prev(scope);
        }
        return token;
    }

    /** Next token that is neither a comment nor a newline. */
    public Token nextNcNnl() {
        return nextNcNnl(Scope.ALL);
    }

    public Token nextNcNnl(Scope scope) {
        Token token = next(scope);
        while (token.isComment() || token.isNewline()) {
            token = token.next(scope);
        }
        return token;
    }

    public Token prevNcNnl(Scope scope) {
        Token token = prev(scope);
        while (token.isComment() || token.isNewline()) {
            token = token.prev(scope);
        }
        return token;
    }

    /**
     * Finds the next token of {@code wanted} kind, at {@code level} unless {@code level} is negative.
     */
    public Token nextOfKind(TokenKind wanted, int level, Scope scope) {
        Token token = next(scope);
        while (token.isNotNull()) {
            if (token.kind == wanted && (level < 0 || token.nestingLevel == level)) {
                return token;
            }
            token = token.next(scope);
        }
        return NULL;
    }

    /**
     * Returns the bracket closing this opening bracket, or {@link #NULL} if this is not an opener or
     * the structure is unbalanced.
     */
    public Token closingBracket() {
        if (!kind.isOpening()) {
            return NULL;
        }
        TokenKind wanted = kind.closer();
        Token token = next();
        while (token.isNotNull()) {
            if (token.kind == wanted && token.nestingLevel == nestingLevel) {
                return token;
            }
            if (token.nestingLevel < nestingLevel) {
                return NULL;
            }
            token = token.next();
        }
        return NULL;
    }

    /**
     * True if nothing but the start of the file or a line break precedes this token.
     */
    public boolean isFirstOnLine() {
        if (isNull()) {
            return false;
        }
        Token before = prev();
        return before.isNull() || before.isNewline();
    }

    private Token step(boolean forward, Scope scope) {
        Token token = forward ? next() : prev();
        if (scope == Scope.ALL || token.isNull()) {
            return token;
        }
        if (has(TokenFlag.IN_PREPROC)) {
            return token.has(TokenFlag.IN_PREPROC) ? token : NULL;
        }
        while (token.has(TokenFlag.IN_PREPROC)) {
            token = forward ? token.next() : token.prev();
        }
        return token;
    }

    private Token mutable() {
        if (isNull()) {
            throw new IllegalStateException("The null token cannot be modified");
        }
        return this;
    }

    @Override
    public String toString() {
        if (isNull()) {
            return "Token[NULL]";
        }
        return "Token[" + kind + " '" + text + "' " + originLine + ":" + originColumn
                + " col=" + renderColumn + " lvl=" + nestingLevel + "]";
    }
}
