package io.codefmt.config;

/**
 * Toggles for the three places where bare comparisons get wrapped in parentheses.
 */
public record ParenConfig(boolean ifBool, boolean assignBool, boolean returnBool) {

    public static ParenConfig all() {
        return new ParenConfig(true, true, true);
    }

    public static ParenConfig none() {
        return new ParenConfig(false, false, false);
    }

    public boolean anyEnabled() {
        return ifBool || assignBool || returnBool;
    }
}
