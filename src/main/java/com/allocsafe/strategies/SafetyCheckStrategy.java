package com.allocsafe.strategies;

import java.util.List;

import com.allocsafe.FixerConfig;
import com.allocsafe.FixerException;
import com.allocsafe.analysis.AllocationSite;
import com.allocsafe.analysis.CheckStyle;
import com.allocsafe.lexer.Statements;
import com.allocsafe.lexer.TokenList;
import com.allocsafe.patch.PatchList;

/**
 * Turns unchecked allocation sites into patches. Self-assigning
 * {@code realloc} calls are rewritten by {@link ReallocRewriteStrategy};
 * every other site with a known variable gets a guard inserted after its
 * statement.
 */
public final class SafetyCheckStrategy {

    private SafetyCheckStrategy() {
    }

    public static PatchList injectSafetyChecks(TokenList tokens, List<AllocationSite> sites) {
        return injectSafetyChecks(tokens, sites, FixerConfig.defaults());
    }

    public static PatchList injectSafetyChecks(TokenList tokens, List<AllocationSite> sites, FixerConfig config) {
        PatchList patches = new PatchList();
        injectSafetyChecks(tokens, sites, config, patches);
        return patches;
    }

    /** Appends the patches for {@code sites} to {@code patches}. */
    public static void injectSafetyChecks(TokenList tokens, List<AllocationSite> sites, FixerConfig config,
            PatchList patches) {
        FixerException.requireArg(tokens, "tokens");
        FixerException.requireArg(sites, "sites");
        FixerException.requireArg(config, "config");
        for (AllocationSite site : sites) {
            if (site.isChecked() || site.isReturnStatement()) {
                continue;
            }
            if (ReallocRewriteStrategy.apply(tokens, site, patches, config)) {
                continue;
            }
            if (!site.hasVariable()) {
                config.warn("result of " + site.spec().name() + " at token " + site.tokenIndex()
                        + " is not assigned; no check injected");
                continue;
            }
            int semi = Statements.end(tokens, site.tokenIndex());
            if (semi < 0) {
                config.warn("no statement end for " + site.spec().name() + " at token " + site.tokenIndex());
                continue;
            }
            String guard = guardText(site.spec().checkStyle(), site.variable(), config.errorCode());
            int head = statementHead(tokens, site.tokenIndex());
            if (Statements.isControlledBody(tokens, tokens.prevSignificant(head - 1))) {
                // the guard has to stay inside the unbraced branch or loop body
                patches.insert(head, "{ ");
                patches.insert(semi + 1, guard + " }");
            } else {
                patches.insert(semi + 1, guard);
            }
        }
    }

    /** First token of the expression statement holding the call at {@code idx}. */
    private static int statementHead(TokenList tokens, int idx) {
        int assign = Statements.assignmentBefore(tokens, idx);
        if (assign < 0) {
            return idx;
        }
        int lhs = Statements.lvalueStart(tokens, assign);
        return lhs < 0 ? idx : lhs;
    }

    /** Guard inserted after the allocating statement, with a leading space. */
    public static String guardText(CheckStyle style, String var, String errorCode) {
        switch (style) {
            case PTR_NULL:
                return " if (!" + var + ") { return " + errorCode + "; }";
            case INT_NEGATIVE:
                return " if (" + var + " < 0) { return " + errorCode + "; }";
            case INT_NONZERO:
                return " if (" + var + " != 0) { return " + errorCode + "; }";
            default:
                throw new IllegalArgumentException("unknown check style " + style);
        }
    }
}
