package io.codefmt.token;

/**
 * Traversal scope relative to preprocessor directives.
 */
public enum Scope {
    /** Visit every token. */
    ALL,
    /**
     * Stay inside the current directive when starting in one; otherwise skip directive tokens.
     */
    PREPROC
}
