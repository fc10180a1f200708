package io.codefmt.config;

/**
 * Settings for aligning the arguments of repeated calls.
 *
 * @param enabled whether the rule runs at all
 * @param span blank lines tolerated between two calls of a group
 * @param threshold largest column deviation a member may have, {@code 0} for no limit
 * @param alignNumberRight keep right-justifying numeric argument columns when tab-stop alignment is on
 * @param alignOnTabstop round numeric argument columns up to the next tab stop instead of right-justifying them
 * @param tabSize width of a tab stop
 */
public record CallAlignConfig(
        boolean enabled,
        int span,
        int threshold,
        boolean alignNumberRight,
        boolean alignOnTabstop,
        int tabSize
) {

    public static final int DEFAULT_SPAN = 3;
    public static final int DEFAULT_TAB_SIZE = 8;

    public CallAlignConfig {
        if (span < 0) {
            throw new IllegalArgumentException("span must be zero or greater");
        }
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be zero or greater");
        }
        if (tabSize < 1) {
            throw new IllegalArgumentException("tabSize must be at least 1");
        }
        if (span == 0) {
            span = DEFAULT_SPAN;
        }
    }

    public static CallAlignConfig defaults() {
        return new CallAlignConfig(true, DEFAULT_SPAN, 0, false, false, DEFAULT_TAB_SIZE);
    }

    public static CallAlignConfig disabled() {
        return new CallAlignConfig(false, DEFAULT_SPAN, 0, false, false, DEFAULT_TAB_SIZE);
    }
}
