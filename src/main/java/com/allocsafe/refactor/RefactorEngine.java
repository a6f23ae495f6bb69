package com.allocsafe.refactor;

import java.util.List;

import com.allocsafe.FixerConfig;
import com.allocsafe.FixerException;
import com.allocsafe.analysis.AllocationAnalyzer;
import com.allocsafe.analysis.AllocationSite;
import com.allocsafe.lexer.TokenList;
import com.allocsafe.lexer.Tokenizer;

public final class RefactorEngine {

    private RefactorEngine() {
    }

    public static String applyRefactoringToString(RefactorContext context, String source) {
        return applyRefactoringToString(context, source, FixerConfig.defaults());
    }

    /**
     * Tokenizes {@code source}, guards its allocations and propagates status
     * codes for every call to a function in {@code context}. Return
     * statements are left alone.
     */
    public static String applyRefactoringToString(RefactorContext context, String source, FixerConfig config) {
        FixerException.requireArg(context, "context");
        FixerException.requireArg(source, "source");
        TokenList tokens = Tokenizer.tokenize(source, config);
        List<AllocationSite> sites = AllocationAnalyzer.findAllocations(tokens);
        return BodyRewriter.rewriteBody(tokens, sites, context, SignatureTransform.none(), config);
    }
}
