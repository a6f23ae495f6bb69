package com.allocsafe.cst;

/** A top-level item covering tokens {@code [start, end)}. */
public final class CstNode {

    private final CstNodeKind kind;
    private final int start;
    private final int end;

    public CstNode(CstNodeKind kind, int start, int end) {
        this.kind = kind;
        this.start = start;
        this.end = end;
    }

    public CstNodeKind kind() {
        return kind;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    @Override
    public String toString() {
        return kind.toStr() + "[" + start + "," + end + ")";
    }
}
