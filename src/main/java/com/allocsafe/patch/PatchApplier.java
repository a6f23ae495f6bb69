package com.allocsafe.patch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.allocsafe.FixerException;
import com.allocsafe.lexer.TokenList;

/**
 * Rebuilds source text from a token list and a set of edits in one pass.
 * Untouched tokens are copied verbatim.
 */
public final class PatchApplier {

    private static final Comparator<Patch> ORDER = Comparator.comparingInt(Patch::start)
            .thenComparing(p -> p.isInsertion() ? 0 : 1);

    private PatchApplier() {
    }

    /**
     * @throws FixerException {@code PATCH_CONFLICT} when two different
     *                        replacements overlap or an insertion lands
     *                        strictly inside a replacement
     */
    public static String apply(TokenList tokens, PatchList patches) {
        FixerException.requireArg(tokens, "tokens");
        FixerException.requireArg(patches, "patches");
        List<Patch> sorted = normalize(patches);

        StringBuilder out = new StringBuilder(tokens.source().length() + 64);
        int p = 0;
        int i = 0;
        int n = tokens.size();
        while (i < n) {
            boolean replaced = false;
            while (p < sorted.size() && sorted.get(p).start() == i) {
                Patch patch = sorted.get(p++);
                out.append(patch.replacement());
                if (!patch.isInsertion()) {
                    i = patch.end();
                    replaced = true;
                    break;
                }
            }
            if (!replaced) {
                out.append(tokens.source(), tokens.get(i).start(), tokens.get(i).end());
                i++;
            }
        }
        // anything anchored at or past the last token goes at the end
        for (; p < sorted.size(); p++) {
            out.append(sorted.get(p).replacement());
        }
        return out.toString();
    }

    // Stable sort, collapse identical edits, reject overlaps.
    private static List<Patch> normalize(PatchList patches) {
        List<Patch> sorted = new ArrayList<>(patches.asList());
        sorted.sort(ORDER);

        List<Patch> result = new ArrayList<>(sorted.size());
        Patch lastReplace = null;
        for (Patch p : sorted) {
            if (lastReplace != null && p.start() < lastReplace.end()) {
                if (p.sameEdit(lastReplace)) {
                    continue;
                }
                if (!p.isInsertion() || p.start() > lastReplace.start()) {
                    throw new FixerException(FixerException.ErrorKind.PATCH_CONFLICT,
                            "conflicting patches " + lastReplace + " and " + p);
                }
            }
            result.add(p);
            if (!p.isInsertion()) {
                lastReplace = p;
            }
        }
        return result;
    }
}
