package io.codefmt.align;

import io.codefmt.token.Token;
import io.codefmt.token.TokenList;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects tokens that should share a column and moves them there when the group closes.
 *
 * <p>A group closes on an explicit {@link #flush()} or {@link #end()}, or implicitly once more
 * than {@code span} blank lines separate a new member from the previous one. Members whose column
 * deviates from the running maximum by more than {@code threshold} are held back and aligned as a
 * group of their own.
 */
public final class AlignStack {

    private final List<Token> pending = new ArrayList<>();
    private int span;
    private int threshold;
    private boolean rightAlign;
    private int tabSize;
    private int blankLines;
    private int movedTokens;
    private int alignedGroups;

    public void start(int span, int threshold) {
        if (span < 0 || threshold < 0) {
            throw new IllegalArgumentException("span and threshold must be zero or greater");
        }
        this.span = span;
        this.threshold = threshold;
        this.rightAlign = false;
        this.tabSize = 0;
        reset();
    }

    public void setRightAlign(boolean rightAlign) {
        this.rightAlign = rightAlign;
    }

    /**
     * Rounds the target column up to the next multiple of {@code tabSize}; {@code 0} disables it.
     */
    public void setTabStop(int tabSize) {
        if (tabSize < 0) {
            throw new IllegalArgumentException("tabSize must be zero or greater");
        }
        this.tabSize = tabSize;
    }

    public void add(Token token) {
        if (token.isNull()) {
            return;
        }
        pending.add(token);
        blankLines = 0;
    }

    public void advanceBlankLines(int count) {
        if (count <= 0) {
            return;
        }
        blankLines += count;
        if (blankLines > span && !pending.isEmpty()) {
            flush();
        }
    }

    public void flush() {
        List<Token> group = new ArrayList<>(pending);
        pending.clear();
        while (group.size() > 1) {
            group = alignAndReturnOutliers(group);
        }
    }

    public void end() {
        flush();
        blankLines = 0;
    }

    /**
     * Forgets the buffered tokens without moving them.
     */
    public void reset() {
        pending.clear();
        blankLines = 0;
    }

    public int size() {
        return pending.size();
    }

    /** Tokens moved by all flushes so far. */
    public int movedTokens() {
        return movedTokens;
    }

    /** Groups of two or more members aligned by all flushes so far. */
    public int alignedGroups() {
        return alignedGroups;
    }

    private List<Token> alignAndReturnOutliers(List<Token> group) {
        List<Token> included = new ArrayList<>();
        List<Token> outliers = new ArrayList<>();
        int target = 0;
        for (Token token : group) {
            int column = naturalColumn(token);
            if (included.isEmpty() || threshold == 0 || Math.abs(column - target) <= threshold) {
                included.add(token);
                target = Math.max(target, column);
            } else {
                outliers.add(token);
            }
        }
        if (included.size() > 1) {
            if (tabSize > 0 && !rightAlign) {
                target = nextTabStop(target);
            }
            for (Token token : included) {
                int delta = target - naturalColumn(token);
                if (delta > 0) {
                    TokenList.shiftLine(token, delta);
                    movedTokens++;
                }
            }
            alignedGroups++;
        }
        return outliers;
    }

    private int naturalColumn(Token token) {
        return rightAlign ? token.renderColumn() + token.length() - 1 : token.renderColumn();
    }

    private int nextTabStop(int column) {
        int zeroBased = column - 1;
        int remainder = zeroBased % tabSize;
        return remainder == 0 ? column : column + tabSize - remainder;
    }
}
