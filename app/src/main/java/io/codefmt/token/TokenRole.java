package io.codefmt.token;

/**
 * Structural tag assigned by upstream analysis, such as the statement owning a condition paren.
 */
public enum TokenRole {
    NONE,
    IF,
    ELSEIF,
    SWITCH,
    WHILE,
    FOR,
    FUNC_CALL,
    FUNC_DEF
}
