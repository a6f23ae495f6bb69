package com.allocsafe.strategies;

import com.allocsafe.FixerConfig;
import com.allocsafe.analysis.AllocationSite;
import com.allocsafe.lexer.Statements;
import com.allocsafe.lexer.TokenKind;
import com.allocsafe.lexer.TokenList;
import com.allocsafe.patch.PatchList;

/**
 * Rewrites {@code p = realloc(p, n);}, which loses the old block when
 * realloc fails, into a guarded temporary:
 *
 * <pre>
 * { void *_safe_tmp = realloc(p, n); if (!_safe_tmp) return ENOMEM; p = _safe_tmp; }
 * </pre>
 */
public final class ReallocRewriteStrategy {

    public static final String TEMP_NAME = "_safe_tmp";

    private ReallocRewriteStrategy() {
    }

    /** Returns true and adds one replacement patch if the site is a self-realloc. */
    public static boolean apply(TokenList tokens, AllocationSite site, PatchList patches, FixerConfig config) {
        if (!"realloc".equals(site.spec().name()) || !site.hasVariable() || site.isReturnStatement()) {
            return false;
        }
        int idx = site.tokenIndex();
        int open = tokens.nextSignificant(idx + 1);
        if (open >= tokens.size() || tokens.kind(open) != TokenKind.LPAREN) {
            return false;
        }
        int close = tokens.matchingClose(open);
        if (close < 0) {
            return false;
        }
        int firstArgEnd = Statements.argumentEnd(tokens, open + 1, close);
        if (!site.variable().equals(Statements.compact(tokens, open + 1, firstArgEnd))) {
            return false;
        }
        int semi = Statements.end(tokens, close + 1);
        if (semi < 0) {
            return false;
        }
        int assign = Statements.assignmentBefore(tokens, idx);
        int lhsStart = assign < 0 ? -1 : Statements.lvalueStart(tokens, assign);
        if (lhsStart < 0 || !site.variable().equals(Statements.compact(tokens, lhsStart, assign))) {
            return false;
        }
        int prev = tokens.prevSignificant(lhsStart - 1);
        if (!startsStatement(tokens, prev)) {
            // a declaration or anything else that is not a plain `v = realloc(v, ..)` statement
            return false;
        }
        String call = tokens.text(tokens.nextSignificant(assign + 1), semi).trim();
        String replacement = "{ void *" + TEMP_NAME + " = " + call + "; if (!" + TEMP_NAME + ") return "
                + config.errorCode() + "; " + site.variable() + " = " + TEMP_NAME + "; }";
        patches.add(lhsStart, semi + 1, replacement);
        return true;
    }

    private static boolean startsStatement(TokenList tokens, int prev) {
        return prev < 0 || Statements.isBoundary(tokens.kind(prev)) || tokens.kind(prev) == TokenKind.COLON
                || Statements.isControlledBody(tokens, prev);
    }
}
