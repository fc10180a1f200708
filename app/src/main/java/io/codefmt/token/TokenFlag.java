package io.codefmt.token;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-token markers computed during tokenization.
 */
public enum TokenFlag {
    STATEMENT_START,
    IN_PREPROC,
    PRECEDED_BY_SPACE;

    /**
     * Flags a synthesized token inherits from the neighbour it is modelled on.
     */
    public static final Set<TokenFlag> COPYABLE = EnumSet.of(IN_PREPROC);
}
