package io.codefmt.format;

import io.codefmt.config.Language;
import java.util.Objects;

/**
 * Per-run state handed to every rule: the source being processed, its language and the counters
 * the rules report into.
 */
public final class FormatContext {

    private final String sourceName;
    private final Language language;
    private int parensInserted;
    private int regionsAbandoned;
    private int callGroupsAligned;
    private int columnsAligned;

    public FormatContext(String sourceName, Language language) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.language = Objects.requireNonNull(language, "language");
    }

    public String sourceName() {
        return sourceName;
    }

    public Language language() {
        return language;
    }

    public void parensInserted() {
        parensInserted++;
    }

    public void regionAbandoned() {
        regionsAbandoned++;
    }

    public void callGroupAligned() {
        callGroupsAligned++;
    }

    public void columnsAligned(int count) {
        columnsAligned += count;
    }

    public FormatStats stats() {
        return new FormatStats(parensInserted, regionsAbandoned, callGroupsAligned, columnsAligned);
    }
}
