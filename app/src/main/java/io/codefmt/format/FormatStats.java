package io.codefmt.format;

/**
 * Counters collected while formatting one source.
 */
public record FormatStats(int parensInserted, int regionsAbandoned, int callGroupsAligned, int columnsAligned) {

    public static FormatStats empty() {
        return new FormatStats(0, 0, 0, 0);
    }

    public boolean anyChange() {
        return parensInserted > 0 || columnsAligned > 0;
    }
}
