package com.allocsafe.analysis;

import java.util.ArrayList;
import java.util.List;

import com.allocsafe.FixerException;
import com.allocsafe.lexer.Statements;
import com.allocsafe.lexer.TokenKind;
import com.allocsafe.lexer.TokenList;
import com.allocsafe.lexer.Tokenizer;

/**
 * Finds calls to known allocators and decides, heuristically, whether each
 * result is already guarded.
 *
 * <p>A site counts as checked when the call itself sits in an {@code if} or
 * {@code while} condition, or when the assigned variable shows up in such a
 * condition before the enclosing block closes. Guards phrased any other way
 * are missed, and an unrelated condition mentioning the variable is taken as
 * a guard.
 */
public final class AllocationAnalyzer {

    private AllocationAnalyzer() {
    }

    public static List<AllocationSite> findAllocations(TokenList tokens) {
        FixerException.requireArg(tokens, "tokens");
        List<AllocationSite> sites = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.kind(i) != TokenKind.IDENTIFIER) {
                continue;
            }
            AllocatorSpec spec = AllocatorTable.lookup(tokens.text(i));
            if (spec == null || !isCall(tokens, i) || isMemberAccess(tokens, i)) {
                continue;
            }
            sites.add(analyzeSite(tokens, i, spec));
        }
        return sites;
    }

    private static AllocationSite analyzeSite(TokenList tokens, int idx, AllocatorSpec spec) {
        if (isReturnOperand(tokens, idx)) {
            return new AllocationSite(idx, spec, null, false, false, true);
        }
        String var = assignedVariable(tokens, idx);
        if (var == null) {
            return new AllocationSite(idx, spec, null, isInsideCondition(tokens, idx), false, false);
        }
        boolean[] usedBefore = new boolean[1];
        boolean checked = isChecked(tokens, idx, var, spec, usedBefore);
        return new AllocationSite(idx, spec, var, checked, usedBefore[0], false);
    }

    private static boolean isCall(TokenList tokens, int idx) {
        int next = tokens.nextSignificant(idx + 1);
        return next < tokens.size() && tokens.kind(next) == TokenKind.LPAREN;
    }

    private static boolean isMemberAccess(TokenList tokens, int idx) {
        int prev = tokens.prevSignificant(idx - 1);
        return prev >= 0 && (tokens.kind(prev) == TokenKind.DOT || tokens.kind(prev) == TokenKind.ARROW);
    }

    // `return malloc(n);` or `return (char *)malloc(n);`
    private static boolean isReturnOperand(TokenList tokens, int idx) {
        int prev = tokens.prevSignificant(idx - 1);
        if (prev >= 0 && tokens.kind(prev) == TokenKind.RPAREN) {
            int open = tokens.matchingOpen(prev);
            prev = open < 0 ? -1 : tokens.prevSignificant(open - 1);
        }
        return prev >= 0 && tokens.kind(prev) == TokenKind.KW_RETURN;
    }

    /**
     * Walks back from the call, within the current statement, to an
     * {@code =} and returns the lvalue in front of it.
     */
    static String assignedVariable(TokenList tokens, int idx) {
        for (int i = tokens.prevSignificant(idx - 1); i >= 0; i = tokens.prevSignificant(i - 1)) {
            TokenKind k = tokens.kind(i);
            if (Statements.isBoundary(k)) {
                return null;
            }
            if (k == TokenKind.ASSIGN) {
                int start = Statements.lvalueStart(tokens, i);
                return start < 0 ? null : Statements.compact(tokens, start, i);
            }
        }
        return null;
    }

    static boolean isInsideCondition(TokenList tokens, int idx) {
        int depth = 0;
        for (int i = idx - 1; i >= 0; i--) {
            TokenKind k = tokens.kind(i);
            if (k == TokenKind.RPAREN) {
                depth++;
            } else if (k == TokenKind.LPAREN) {
                if (depth > 0) {
                    depth--;
                } else {
                    int prev = tokens.prevSignificant(i - 1);
                    if (prev >= 0 && (tokens.kind(prev) == TokenKind.KW_IF || tokens.kind(prev) == TokenKind.KW_WHILE)) {
                        return true;
                    }
                }
            } else if (Statements.isBoundary(k)) {
                break;
            }
        }
        return false;
    }

    private static boolean isChecked(TokenList tokens, int idx, String var, AllocatorSpec spec, boolean[] usedBefore) {
        if (isInsideCondition(tokens, idx)) {
            return true;
        }
        List<String> pieces = pieces(var);
        int i = idx;
        while (i < tokens.size() && tokens.kind(i) != TokenKind.SEMICOLON) {
            i++;
        }
        for (i++; i < tokens.size(); i++) {
            TokenKind k = tokens.kind(i);
            if (k == TokenKind.RBRACE || k == TokenKind.KW_STRUCT) {
                return false;
            }
            int last = matchEnd(tokens, i, pieces);
            if (last < 0) {
                continue;
            }
            if (isInsideCondition(tokens, i)) {
                return true;
            }
            if (spec.checkStyle() == CheckStyle.PTR_NULL && isDereference(tokens, i, last)) {
                usedBefore[0] = true;
                return false;
            }
        }
        return false;
    }

    private static boolean isDereference(TokenList tokens, int first, int last) {
        int prev = tokens.prevSignificant(first - 1);
        if (prev >= 0 && tokens.kind(prev) == TokenKind.STAR) {
            return true;
        }
        int next = tokens.nextSignificant(last + 1);
        return next < tokens.size()
                && (tokens.kind(next) == TokenKind.ARROW || tokens.kind(next) == TokenKind.LBRACKET);
    }

    /**
     * If the significant tokens starting at {@code i} spell {@code pieces},
     * returns the index of the last matched token, otherwise -1.
     */
    private static int matchEnd(TokenList tokens, int i, List<String> pieces) {
        if (tokens.kind(i).isTrivia() || !tokens.text(i).equals(pieces.get(0))) {
            return -1;
        }
        int prev = tokens.prevSignificant(i - 1);
        if (prev >= 0 && (tokens.kind(prev) == TokenKind.DOT || tokens.kind(prev) == TokenKind.ARROW)) {
            return -1;
        }
        int j = i;
        for (int p = 1; p < pieces.size(); p++) {
            j = tokens.nextSignificant(j + 1);
            if (j >= tokens.size() || !tokens.text(j).equals(pieces.get(p))) {
                return -1;
            }
        }
        return j;
    }

    private static List<String> pieces(String var) {
        TokenList vt = Tokenizer.tokenize(var);
        List<String> out = new ArrayList<>();
        for (int i = 0; i < vt.size(); i++) {
            if (!vt.kind(i).isTrivia()) {
                out.add(vt.text(i));
            }
        }
        return out;
    }
}
