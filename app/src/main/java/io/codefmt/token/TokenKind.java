package io.codefmt.token;

/**
 * Lexical category of a token.
 */
public enum TokenKind {
    NONE,
    NEWLINE,
    NL_CONT,
    COMMENT,
    PREPROC,

    WORD,
    TYPE,
    FUNC_CALL,
    FUNC_DEF,
    NUMBER,
    NUMBER_FP,
    STRING,

    IF,
    ELSE,
    SWITCH,
    WHILE,
    FOR,
    DO,
    RETURN,
    CASE,
    DEFAULT,
    BREAK,
    CONTINUE,
    GOTO,

    PAREN_OPEN,
    PAREN_CLOSE,
    SPAREN_OPEN,
    SPAREN_CLOSE,
    FPAREN_OPEN,
    FPAREN_CLOSE,
    BRACE_OPEN,
    BRACE_CLOSE,
    SQUARE_OPEN,
    SQUARE_CLOSE,
    ANGLE_OPEN,
    ANGLE_CLOSE,

    COMPARE,
    BOOL,
    ASSIGN,
    ARITH,
    NOT,
    INV,
    POS,
    NEG,
    INCDEC,
    QUESTION,
    COND_COLON,
    COLON,
    COMMA,
    SEMICOLON,
    MEMBER,
    DC_MEMBER;

    public boolean isOpening() {
        return switch (this) {
            case PAREN_OPEN, SPAREN_OPEN, FPAREN_OPEN, BRACE_OPEN, SQUARE_OPEN, ANGLE_OPEN -> true;
            default -> false;
        };
    }

    /**
     * True for the parenthesis openers, leaving out braces, squares and angles.
     */
    public boolean isParenOpening() {
        return this == PAREN_OPEN || this == SPAREN_OPEN || this == FPAREN_OPEN;
    }

    /**
     * Returns the closing kind paired with this opening kind, or {@link #NONE}.
     */
    public TokenKind closer() {
        return switch (this) {
            case PAREN_OPEN -> PAREN_CLOSE;
            case SPAREN_OPEN -> SPAREN_CLOSE;
            case FPAREN_OPEN -> FPAREN_CLOSE;
            case BRACE_OPEN -> BRACE_CLOSE;
            case SQUARE_OPEN -> SQUARE_CLOSE;
            case ANGLE_OPEN -> ANGLE_CLOSE;
            default -> NONE;
        };
    }

    public boolean isNumeric() {
        return this == NUMBER || this == NUMBER_FP;
    }
}
