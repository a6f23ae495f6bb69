package com.allocsafe.patch;

/** Replacement of tokens {@code [start, end)}; {@code start == end} inserts. */
public final class Patch {

    private final int start;
    private final int end;
    private final String replacement;

    public Patch(int start, int end, String replacement) {
        this.start = start;
        this.end = end;
        this.replacement = replacement;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public String replacement() {
        return replacement;
    }

    public boolean isInsertion() {
        return start == end;
    }

    boolean sameEdit(Patch other) {
        return start == other.start && end == other.end && replacement.equals(other.replacement);
    }

    @Override
    public String toString() {
        return (isInsertion() ? "insert@" + start : "replace[" + start + "," + end + ")") + " \"" + replacement + "\"";
    }
}
