package com.allocsafe.refactor;

import java.util.List;

import com.allocsafe.FixerConfig;
import com.allocsafe.FixerException;
import com.allocsafe.analysis.AllocationSite;
import com.allocsafe.lexer.Statements;
import com.allocsafe.lexer.TokenKind;
import com.allocsafe.lexer.TokenList;
import com.allocsafe.patch.PatchApplier;
import com.allocsafe.patch.PatchList;
import com.allocsafe.strategies.SafetyCheckStrategy;

/**
 * Rewrites one function body in three passes that all add to the same
 * patch list: allocation guards, call sites of refactored functions, and
 * the body's own return statements.
 */
public final class BodyRewriter {

    static final String TEMP_PREFIX = "_tmp_cdd_";
    static final String SAFE_RET = "_safe_ret";

    private final TokenList tokens;
    private final FixerConfig config;
    private final String status;
    private final PatchList patches = new PatchList();
    private int tempCounter;
    private boolean usedStatus;

    private BodyRewriter(TokenList tokens, FixerConfig config) {
        this.tokens = tokens;
        this.config = config;
        this.status = config.statusVar();
    }

    public static String rewriteBody(TokenList tokens, List<AllocationSite> sites, RefactorContext funcs,
            SignatureTransform transform) {
        return rewriteBody(tokens, sites, funcs, transform, FixerConfig.defaults());
    }

    /**
     * Returns the rewritten text of {@code tokens}. {@code sites} and
     * {@code funcs} may be {@code null} when there is nothing to guard or
     * propagate.
     */
    public static String rewriteBody(TokenList tokens, List<AllocationSite> sites, RefactorContext funcs,
            SignatureTransform transform, FixerConfig config) {
        FixerException.requireArg(tokens, "tokens");
        FixerException.requireArg(transform, "transform");
        FixerException.requireArg(config, "config");

        BodyRewriter r = new BodyRewriter(tokens, config);
        if (sites != null) {
            SafetyCheckStrategy.injectSafetyChecks(tokens, sites, config, r.patches);
        }
        if (funcs != null && !funcs.isEmpty()) {
            r.rewriteCalls(funcs);
        }
        switch (transform.type()) {
            case VOID_TO_INT:
                r.voidToInt(transform);
                break;
            case RET_PTR_TO_ARG:
                r.retPtrToArg(transform, sites);
                break;
            default:
                break;
        }
        return PatchApplier.apply(tokens, r.finish());
    }

    // -------- Call sites --------

    private void rewriteCalls(RefactorContext funcs) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.kind(i) != TokenKind.IDENTIFIER) {
                continue;
            }
            RefactoredFunction rf = funcs.find(tokens.text(i));
            if (rf == null) {
                continue;
            }
            int open = tokens.nextSignificant(i + 1);
            if (open >= tokens.size() || tokens.kind(open) != TokenKind.LPAREN
                    || isMemberAccess(i) || isDeclarator(i)) {
                continue;
            }
            int close = tokens.matchingClose(open);
            if (close < 0) {
                continue;
            }
            if (patches.covers(i)) {
                config.warn("call to " + rf.name() + " at token " + i + " is inside rewritten code; left as is");
                continue;
            }
            rewriteCall(i, open, close, rf);
        }
    }

    private void rewriteCall(int call, int open, int close, RefactoredFunction rf) {
        int prev = tokens.prevSignificant(call - 1);
        int after = tokens.nextSignificant(close + 1);
        boolean endsStatement = after < tokens.size() && tokens.kind(after) == TokenKind.SEMICOLON;

        if (prev >= 0 && tokens.kind(prev) == TokenKind.ASSIGN && endsStatement) {
            if (rf.type() == RefactorType.VOID_TO_INT) {
                config.warn("result of void function " + rf.name() + " is assigned at token " + call);
                return;
            }
            rewriteAssignment(prev, close, after);
        } else if (endsStatement && startsStatement(prev, call)) {
            rewriteStatement(call, open, close, after, rf, needsBraces(prev));
        } else if (rf.type() == RefactorType.PTR_TO_INT_OUT) {
            rewriteNested(call, open, close, rf);
        } else {
            config.warn("cannot propagate status of " + rf.name() + " at token " + call);
        }
    }

    /** {@code f(a);} becomes {@code rc = f(a); if (rc != 0) return rc;}. */
    private void rewriteStatement(int call, int open, int close, int semi, RefactoredFunction rf, boolean braces) {
        String prefix = braces ? "{ " : "";
        if (rf.type() == RefactorType.PTR_TO_INT_OUT) {
            String tmp = nextTemp();
            patches.insert(call, prefix + declare(rf.returnType(), tmp) + "; " + status + " = ");
            patches.insert(close, argSeparator(open, close) + "&" + tmp);
        } else {
            patches.insert(call, prefix + status + " = ");
        }
        patches.insert(semi + 1, statusCheck() + (braces ? " }" : ""));
        usedStatus = true;
    }

    /**
     * {@code v = f(a);} becomes {@code rc = f(a, &v); ...}; a declaration
     * {@code T *v = f(a);} keeps the declaration and assigns through it.
     */
    private void rewriteAssignment(int eq, int close, int semi) {
        int lhsStart = Statements.lvalueStart(tokens, eq);
        if (lhsStart < 0) {
            config.warn("unsupported assignment target at token " + eq);
            return;
        }
        String lhs = Statements.compact(tokens, lhsStart, eq);
        int before = tokens.prevSignificant(lhsStart - 1);
        int typeEnd = before;
        while (typeEnd >= 0 && (tokens.kind(typeEnd) == TokenKind.STAR || tokens.kind(typeEnd).isPointerQualifier())) {
            typeEnd = tokens.prevSignificant(typeEnd - 1);
        }
        boolean declaration = typeEnd >= 0 && isTypeToken(tokens.kind(typeEnd));
        boolean braces = !declaration && needsBraces(before);

        if (declaration) {
            patches.add(eq, eq + 1, "; " + status + " =");
        } else {
            patches.add(lhsStart, eq + 1, (braces ? "{ " : "") + status + " =");
        }
        int open = tokens.matchingOpen(close);
        patches.insert(close, argSeparator(open, close) + "&" + lhs);
        patches.insert(semi + 1, statusCheck() + (braces ? " }" : ""));
        usedStatus = true;
    }

    /** {@code g(f(a))} hoists {@code f} into a temporary declared before the statement. */
    private void rewriteNested(int call, int open, int close, RefactoredFunction rf) {
        int stmtStart = Statements.start(tokens, call);
        if (stmtStart >= tokens.size() || !canHoistBefore(tokens.kind(stmtStart))) {
            config.warn("cannot hoist call to " + rf.name() + " at token " + call);
            return;
        }
        String tmp = nextTemp();
        String args = tokens.text(open + 1, close).trim();
        String hoist = declare(rf.returnType(), tmp) + "; "
                + status + " = " + rf.name() + "(" + args + (args.isEmpty() ? "" : ", ") + "&" + tmp + ");"
                + statusCheck() + "\n  ";
        patches.insert(stmtStart, hoist);
        patches.add(call, close + 1, tmp);
        usedStatus = true;
    }

    // -------- Returns --------

    private void voidToInt(SignatureTransform transform) {
        String success = transform.successCode();
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.kind(i) == TokenKind.KW_RETURN) {
                int next = tokens.nextSignificant(i + 1);
                if (next < tokens.size() && tokens.kind(next) == TokenKind.SEMICOLON) {
                    patches.add(i, i + 1, "return " + success);
                }
            }
        }
        int last = lastClosingBrace();
        if (last < 0 || endsWithReturn(last)) {
            return;
        }
        boolean newline = last > 0 && tokens.kind(last - 1) == TokenKind.WHITESPACE
                && tokens.text(last - 1).indexOf('\n') >= 0;
        patches.insert(last, newline ? "  return " + success + ";\n" : "return " + success + "; ");
    }

    private void retPtrToArg(SignatureTransform transform, List<AllocationSite> sites) {
        String out = transform.argName();
        String success = transform.successCode();
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.kind(i) != TokenKind.KW_RETURN) {
                continue;
            }
            int semi = Statements.end(tokens, i);
            int exprStart = tokens.nextSignificant(i + 1);
            if (semi < 0 || exprStart >= semi) {
                continue;
            }
            if (hasAllocationBetween(sites, i, semi) && !coveredBetween(i, semi)) {
                String type = transform.returnType() == null ? "void *" : transform.returnType();
                String expr = tokens.text(exprStart, semi).trim();
                patches.add(i, semi + 1, "{ " + declare(type, SAFE_RET) + " = " + expr + "; if (!" + SAFE_RET
                        + ") return " + transform.errorCode() + "; *" + out + " = " + SAFE_RET + "; return "
                        + success + "; }");
            } else {
                boolean braces = needsBraces(tokens.prevSignificant(i - 1));
                patches.add(i, i + 1, (braces ? "{ *" : "*") + out + " =");
                patches.add(semi, semi + 1, "; return " + success + ";" + (braces ? " }" : ""));
            }
        }
    }

    private PatchList finish() {
        if (!usedStatus || declaresStatus()) {
            return patches;
        }
        int brace = -1;
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.kind(i) == TokenKind.LBRACE) {
                brace = i;
                break;
            }
        }
        if (brace < 0) {
            return patches;
        }
        // must precede any hoisted statement at the same position
        PatchList result = new PatchList();
        result.insert(brace + 1, "\n  int " + status + " = 0;");
        result.addAll(patches);
        return result;
    }

    // -------- Helpers --------

    /** {@code char *} and {@code tmp} give {@code char *tmp}; {@code long} gives {@code long tmp}. */
    static String declare(String type, String name) {
        String t = type.trim();
        return t.endsWith("*") ? t + name : t + " " + name;
    }

    private String nextTemp() {
        return TEMP_PREFIX + tempCounter++;
    }

    private String statusCheck() {
        return " if (" + status + " != 0) return " + status + ";";
    }

    private String argSeparator(int open, int close) {
        return tokens.nextSignificant(open + 1, close) < close ? ", " : "";
    }

    private boolean isMemberAccess(int idx) {
        int prev = tokens.prevSignificant(idx - 1);
        return prev >= 0 && (tokens.kind(prev) == TokenKind.DOT || tokens.kind(prev) == TokenKind.ARROW);
    }

    /**
     * True when the identifier names the function being declared rather
     * than called: {@code int f(} or {@code char *f(} at statement start.
     */
    private boolean isDeclarator(int idx) {
        int prev = tokens.prevSignificant(idx - 1);
        int p = prev;
        while (p >= 0 && (tokens.kind(p) == TokenKind.STAR || tokens.kind(p).isPointerQualifier())) {
            p = tokens.prevSignificant(p - 1);
        }
        if (p < 0 || !isTypeToken(tokens.kind(p))) {
            return false;
        }
        if (p == prev) {
            return true;
        }
        int q = p;
        while (q >= 0 && isTypeToken(tokens.kind(q))) {
            q = tokens.prevSignificant(q - 1);
        }
        return q < 0 || Statements.isBoundary(tokens.kind(q));
    }

    private static boolean isTypeToken(TokenKind k) {
        return k == TokenKind.IDENTIFIER || k.isDeclarationSpecifier();
    }

    private boolean startsStatement(int prev, int call) {
        if (prev < 0 || Statements.isBoundary(tokens.kind(prev))) {
            return true;
        }
        TokenKind k = tokens.kind(prev);
        if (k == TokenKind.KW_ELSE || k == TokenKind.KW_DO) {
            return true;
        }
        if (k == TokenKind.COLON) {
            TokenKind first = tokens.kind(Statements.start(tokens, call));
            return first == TokenKind.KW_CASE || first == TokenKind.KW_DEFAULT
                    || (first == TokenKind.IDENTIFIER && tokens.prevSignificant(prev - 1) == Statements.start(tokens, call));
        }
        if (k == TokenKind.RPAREN) {
            int open = tokens.matchingOpen(prev);
            int kw = open < 0 ? -1 : tokens.prevSignificant(open - 1);
            return kw >= 0 && (tokens.kind(kw) == TokenKind.KW_IF || tokens.kind(kw) == TokenKind.KW_WHILE
                    || tokens.kind(kw) == TokenKind.KW_FOR);
        }
        return false;
    }

    private boolean needsBraces(int prev) {
        return !(prev < 0 || Statements.isBoundary(tokens.kind(prev)) || tokens.kind(prev) == TokenKind.COLON);
    }

    private static boolean canHoistBefore(TokenKind k) {
        switch (k) {
            case KW_ELSE:
            case KW_DO:
            case KW_WHILE:
            case KW_FOR:
            case KW_CASE:
            case KW_DEFAULT:
                return false;
            default:
                return true;
        }
    }

    private int lastClosingBrace() {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.kind(i) == TokenKind.RBRACE) {
                return i;
            }
        }
        return -1;
    }

    private boolean endsWithReturn(int closingBrace) {
        int p = tokens.prevSignificant(closingBrace - 1);
        if (p < 0 || tokens.kind(p) != TokenKind.SEMICOLON) {
            return false;
        }
        int start = Statements.start(tokens, p);
        return start < tokens.size() && tokens.kind(start) == TokenKind.KW_RETURN;
    }

    private boolean hasAllocationBetween(List<AllocationSite> sites, int from, int to) {
        if (sites == null) {
            return false;
        }
        for (AllocationSite s : sites) {
            if (s.tokenIndex() > from && s.tokenIndex() < to) {
                return true;
            }
        }
        return false;
    }

    private boolean coveredBetween(int from, int to) {
        for (int i = from; i < to; i++) {
            if (patches.covers(i)) {
                return true;
            }
        }
        return false;
    }

    private boolean declaresStatus() {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.kind(i) == TokenKind.IDENTIFIER && tokens.text(i).equals(status)) {
                int prev = tokens.prevSignificant(i - 1);
                if (prev >= 0 && tokens.kind(prev) == TokenKind.KW_INT) {
                    return true;
                }
            }
        }
        return false;
    }
}
