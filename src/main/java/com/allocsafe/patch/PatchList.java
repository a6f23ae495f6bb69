package com.allocsafe.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.allocsafe.FixerException;

/** Edits collected against one token list, kept in the order they were added. */
public final class PatchList implements Iterable<Patch> {

    private final List<Patch> patches = new ArrayList<>();

    public void add(int start, int end, String replacement) {
        FixerException.requireArg(replacement, "replacement");
        if (start < 0 || end < start) {
            throw FixerException.invalidArgument("bad patch range [" + start + ", " + end + ")");
        }
        patches.add(new Patch(start, end, replacement));
    }

    public void insert(int at, String text) {
        add(at, at, text);
    }

    public void addAll(PatchList other) {
        patches.addAll(other.patches);
    }

    public int size() {
        return patches.size();
    }

    public boolean isEmpty() {
        return patches.isEmpty();
    }

    public Patch get(int index) {
        return patches.get(index);
    }

    /** True if some replacement already covers token {@code index}. */
    public boolean covers(int index) {
        for (Patch p : patches) {
            if (!p.isInsertion() && p.start() <= index && index < p.end()) {
                return true;
            }
        }
        return false;
    }

    public List<Patch> asList() {
        return Collections.unmodifiableList(patches);
    }

    public void clear() {
        patches.clear();
    }

    @Override
    public Iterator<Patch> iterator() {
        return asList().iterator();
    }
}
