package com.allocsafe.refactor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.allocsafe.FixerConfig;
import com.allocsafe.FixerException;
import com.allocsafe.analysis.AllocationAnalyzer;
import com.allocsafe.analysis.AllocationSite;
import com.allocsafe.cst.CstNode;
import com.allocsafe.cst.CstNodeKind;
import com.allocsafe.cst.CstNodeList;
import com.allocsafe.cst.TopLevelScanner;
import com.allocsafe.decl.DeclInfo;
import com.allocsafe.decl.DeclType;
import com.allocsafe.decl.DeclTypeKind;
import com.allocsafe.decl.DeclaratorParser;
import com.allocsafe.lexer.TokenKind;
import com.allocsafe.lexer.TokenList;
import com.allocsafe.lexer.Tokenizer;
import com.allocsafe.patch.PatchApplier;
import com.allocsafe.patch.PatchList;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.SetMultimap;

/**
 * Fixes a whole translation unit. Functions that allocate and return
 * {@code void} or a pointer are switched to int status codes, and the change
 * is pushed up the call graph to every caller so that failures propagate.
 * {@code main} is rewritten internally but keeps its signature and stops the
 * propagation.
 */
public final class FixOrchestrator {

    /** Rewritten text plus the names of every function whose code changed. */
    public static final class FixResult {
        private final String text;
        private final List<String> refactored;
        private final int allocationSites;

        FixResult(String text, List<String> refactored, int allocationSites) {
            this.text = text;
            this.refactored = Collections.unmodifiableList(refactored);
            this.allocationSites = allocationSites;
        }

        public String text() {
            return text;
        }

        public List<String> refactored() {
            return refactored;
        }

        public int allocationSites() {
            return allocationSites;
        }
    }

    static final class FunctionNode {
        String name;
        int start;
        int bodyStart;
        int end;
        String returnType;
        boolean returnsVoid;
        boolean returnsPtr;
        boolean returnsInt;
        boolean isMain;
        boolean containsAllocs;
        boolean hasUncheckedAllocs;
        boolean marked;
        boolean signatureKept;
        String newHeader;

        RefactorType refactorType() {
            return returnsVoid ? RefactorType.VOID_TO_INT : RefactorType.PTR_TO_INT_OUT;
        }

        /** True when callers must change: the signature is rewritten. */
        boolean changesSignature() {
            return marked && !isMain && !returnsInt && !signatureKept;
        }
    }

    private FixOrchestrator() {
    }

    public static FixResult fix(String source) {
        return fix(source, FixerConfig.defaults());
    }

    public static FixResult fix(String source, FixerConfig config) {
        FixerException.requireArg(source, "source");
        FixerException.requireArg(config, "config");
        TokenList tokens = Tokenizer.tokenize(source, config);
        List<AllocationSite> sites = AllocationAnalyzer.findAllocations(tokens);
        CstNodeList cst = TopLevelScanner.scan(tokens);
        Map<String, FunctionNode> functions = collectFunctions(tokens, cst, sites, config);

        SetMultimap<String, String> callers = buildCallers(tokens, functions);
        for (FunctionNode fn : functions.values()) {
            if (fn.containsAllocs && (fn.returnsVoid || fn.returnsPtr)) {
                propagate(fn, functions, callers);
            }
        }

        for (FunctionNode fn : functions.values()) {
            if (fn.changesSignature()) {
                rewriteHeader(tokens, fn, config);
            }
        }

        RefactorContext context = new RefactorContext();
        List<String> refactored = new ArrayList<>();
        for (FunctionNode fn : functions.values()) {
            if (fn.marked) {
                refactored.add(fn.name);
            }
            if (fn.changesSignature()) {
                context.addFunction(fn.name, fn.refactorType(), fn.returnType);
            }
        }

        PatchList edits = new PatchList();
        for (FunctionNode fn : functions.values()) {
            // int functions that are not on a propagation path still get their guards
            if (fn.marked || (fn.returnsInt && fn.hasUncheckedAllocs)) {
                edits.add(fn.start, fn.end, rewriteFunction(tokens, fn, sites, context, config));
            }
        }
        rewritePrototypes(tokens, cst, functions, edits, config);
        String text = PatchApplier.apply(tokens, edits);
        return new FixResult(text, refactored, sites.size());
    }

    // -------- Graph --------

    static Map<String, FunctionNode> collectFunctions(TokenList tokens, CstNodeList cst,
            List<AllocationSite> sites, FixerConfig config) {
        Map<String, FunctionNode> functions = new LinkedHashMap<>();
        for (CstNode node : cst.ofKind(CstNodeKind.FUNCTION)) {
            FunctionNode fn = describe(tokens, node, config);
            if (fn == null) {
                config.warn("skipping function definition at token " + node.start() + ": no simple name");
                continue;
            }
            if (functions.containsKey(fn.name)) {
                config.warn("duplicate definition of " + fn.name + "; only the first is rewritten");
                continue;
            }
            for (AllocationSite site : sites) {
                if (site.tokenIndex() > fn.bodyStart && site.tokenIndex() < fn.end) {
                    fn.containsAllocs = true;
                    if (!site.isChecked() && !site.isReturnStatement()) {
                        fn.hasUncheckedAllocs = true;
                    }
                }
            }
            functions.put(fn.name, fn);
        }
        return functions;
    }

    private static FunctionNode describe(TokenList tokens, CstNode node, FixerConfig config) {
        int bodyStart = tokens.matchingOpen(node.end() - 1);
        int lparen = -1;
        for (int i = node.start(); i < bodyStart; i++) {
            if (tokens.kind(i) == TokenKind.LPAREN) {
                lparen = i;
                break;
            }
        }
        if (bodyStart < 0 || lparen < 0) {
            return null;
        }
        int nameIdx = tokens.prevSignificant(lparen - 1);
        if (nameIdx < node.start() || tokens.kind(nameIdx) != TokenKind.IDENTIFIER) {
            return null;
        }
        FunctionNode fn = new FunctionNode();
        fn.name = tokens.text(nameIdx);
        fn.start = node.start();
        fn.bodyStart = bodyStart;
        fn.end = node.end();
        fn.isMain = fn.name.equals("main");

        int typeStart = SignatureRewriter.typeStart(tokens, node.start(), nameIdx);
        fn.returnType = tokens.text(typeStart, nameIdx).trim();
        fn.returnsPtr = SignatureRewriter.isPointerType(tokens, typeStart, nameIdx);
        boolean hasVoid = false;
        boolean onlyInt = true;
        for (int i = typeStart; i < nameIdx; i++) {
            TokenKind k = tokens.kind(i);
            if (k == TokenKind.KW_VOID) {
                hasVoid = true;
            }
            if (!k.isTrivia() && k != TokenKind.KW_INT) {
                onlyInt = false;
            }
        }
        int rparen = tokens.matchingClose(lparen, bodyStart);
        if (typeStart < nameIdx && rparen > 0) {
            try {
                DeclInfo decl = DeclaratorParser.parseDeclaration(tokens, typeStart, rparen + 1);
                DeclType ret = returnTypeOf(decl.type());
                if (ret != null) {
                    fn.returnType = ret.render(null);
                    fn.returnsPtr = containsPointer(ret);
                }
            } catch (FixerException e) {
                config.warn("return type of " + fn.name + " read from tokens: " + e.getMessage());
            }
        }
        fn.returnsVoid = hasVoid && !fn.returnsPtr;
        // an empty return type is implicit int
        fn.returnsInt = onlyInt;
        return fn;
    }

    /**
     * Drops the function node that binds the declared name, which is the one
     * nearest the base: {@code PTR -> FUNC -> BASE(char)} gives
     * {@code PTR -> BASE(char)}. Returns {@code null} when there is none.
     */
    static DeclType returnTypeOf(DeclType type) {
        if (type.is(DeclTypeKind.BASE)) {
            return null;
        }
        if (type.is(DeclTypeKind.FUNC)) {
            DeclType deeper = returnTypeOf(type.inner());
            return deeper == null ? type.inner() : DeclType.function(type.params(), deeper);
        }
        DeclType inner = returnTypeOf(type.inner());
        if (inner == null) {
            return null;
        }
        return type.is(DeclTypeKind.PTR)
                ? DeclType.pointer(type.qualifiers(), inner)
                : DeclType.array(type.arraySize(), inner);
    }

    private static boolean containsPointer(DeclType type) {
        for (DeclType t = type; t != null; t = t.inner()) {
            if (t.is(DeclTypeKind.PTR)) {
                return true;
            }
        }
        return false;
    }

    /** Reverse call graph: callee name to the names of the functions calling it. */
    static SetMultimap<String, String> buildCallers(TokenList tokens, Map<String, FunctionNode> functions) {
        SetMultimap<String, String> callers = MultimapBuilder.linkedHashKeys().linkedHashSetValues().build();
        for (FunctionNode caller : functions.values()) {
            for (int t = caller.bodyStart; t < caller.end; t++) {
                if (tokens.kind(t) != TokenKind.IDENTIFIER) {
                    continue;
                }
                String callee = tokens.text(t);
                if (callee.equals(caller.name) || !functions.containsKey(callee)) {
                    continue;
                }
                int next = tokens.nextSignificant(t + 1);
                if (next < tokens.size() && tokens.kind(next) == TokenKind.LPAREN) {
                    callers.put(callee, caller.name);
                }
            }
        }
        return callers;
    }

    static void propagate(FunctionNode seed, Map<String, FunctionNode> functions,
            SetMultimap<String, String> callers) {
        Deque<FunctionNode> work = new ArrayDeque<>();
        work.push(seed);
        while (!work.isEmpty()) {
            FunctionNode fn = work.pop();
            if (fn.marked) {
                continue;
            }
            fn.marked = true;
            if (fn.isMain) {
                continue;
            }
            for (String caller : callers.get(fn.name)) {
                work.push(functions.get(caller));
            }
        }
    }

    // -------- Rewriting --------

    /** Keeps forward declarations in step with the rewritten definitions. */
    private static void rewritePrototypes(TokenList tokens, CstNodeList cst, Map<String, FunctionNode> functions,
            PatchList edits, FixerConfig config) {
        for (CstNode node : cst.ofKind(CstNodeKind.FUNCTION_PROTOTYPE)) {
            String name = null;
            for (int i = node.start(); i < node.end(); i++) {
                if (tokens.kind(i) == TokenKind.LPAREN) {
                    name = tokens.text(tokens.prevSignificant(i - 1));
                    break;
                }
            }
            FunctionNode fn = name == null ? null : functions.get(name);
            if (fn == null || !fn.changesSignature()) {
                continue;
            }
            int semi = node.end() - 1;
            try {
                edits.add(node.start(), semi, SignatureRewriter.rewrite(tokens, node.start(), semi, config));
            } catch (FixerException e) {
                config.warn("keeping prototype of " + name + ": " + e.getMessage());
            }
        }
    }

    /**
     * Rewrites the header of a function whose signature changes. When that
     * fails the function keeps its signature, its returns and its callers.
     */
    static void rewriteHeader(TokenList tokens, FunctionNode fn, FixerConfig config) {
        try {
            fn.newHeader = SignatureRewriter.rewrite(tokens, fn.start, headerEnd(tokens, fn), config);
        } catch (FixerException e) {
            config.warn("keeping signature of " + fn.name + ": " + e.getMessage());
            fn.signatureKept = true;
        }
    }

    private static int headerEnd(TokenList tokens, FunctionNode fn) {
        return tokens.prevSignificant(fn.bodyStart - 1) + 1;
    }

    private static String rewriteFunction(TokenList tokens, FunctionNode fn, List<AllocationSite> sites,
            RefactorContext context, FixerConfig config) {
        int headerEnd = headerEnd(tokens, fn);
        String header = tokens.text(fn.start, headerEnd);
        String gap = tokens.text(headerEnd, fn.bodyStart);

        SignatureTransform transform;
        if (fn.changesSignature()) {
            header = fn.newHeader;
            transform = fn.returnsVoid
                    ? SignatureTransform.voidToInt(config)
                    : SignatureTransform.retPtrToArg(fn.returnType, config);
        } else {
            transform = SignatureTransform.none();
        }

        List<AllocationSite> local = new ArrayList<>();
        for (AllocationSite site : sites) {
            if (site.tokenIndex() > fn.bodyStart && site.tokenIndex() < fn.end) {
                local.add(site.rebase(-fn.bodyStart));
            }
        }
        TokenList body = tokens.slice(fn.bodyStart, fn.end);
        String newBody = BodyRewriter.rewriteBody(body, local, context, transform, config);
        return header + (gap.isEmpty() ? " " : gap) + newBody;
    }
}
