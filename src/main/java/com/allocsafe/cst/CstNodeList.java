package com.allocsafe.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * Index-addressed store of nodes. Nodes refer to each other and to tokens by
 * index only.
 */
public final class CstNodeList {

    private final List<CstNode> nodes = new ArrayList<>();

    /** Appends a node and returns its index. */
    public int add(CstNode node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    public CstNode get(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public List<CstNode> ofKind(CstNodeKind kind) {
        List<CstNode> out = new ArrayList<>();
        for (CstNode n : nodes) {
            if (n.kind() == kind) {
                out.add(n);
            }
        }
        return out;
    }

    public void clear() {
        nodes.clear();
    }
}
