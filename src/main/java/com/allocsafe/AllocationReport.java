package com.allocsafe;

import java.util.ArrayList;
import java.util.List;

import com.allocsafe.analysis.AllocationAnalyzer;
import com.allocsafe.analysis.AllocationSite;
import com.allocsafe.lexer.TokenList;
import com.allocsafe.lexer.Tokenizer;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/** JSON listing of the allocation sites in one file, as printed by {@code report}. */
public class AllocationReport {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    static class SiteEntry {
        String allocator;
        int line;
        int column;
        String variable;
        String checkStyle;
        boolean checked;
        boolean usedBeforeCheck;
        boolean returnStatement;
    }

    String file;
    int total;
    int unchecked;
    List<SiteEntry> sites = new ArrayList<>();

    public static AllocationReport build(String file, String source, FixerConfig config) {
        TokenList tokens = Tokenizer.tokenize(source, config);
        AllocationReport report = new AllocationReport();
        report.file = file;
        for (AllocationSite site : AllocationAnalyzer.findAllocations(tokens)) {
            SiteEntry e = new SiteEntry();
            int offset = tokens.get(site.tokenIndex()).start();
            e.allocator = site.spec().name();
            e.line = lineOf(source, offset);
            e.column = offset - source.lastIndexOf('\n', offset - 1);
            e.variable = site.variable();
            e.checkStyle = site.spec().checkStyle().name();
            e.checked = site.isChecked();
            e.usedBeforeCheck = site.isUsedBeforeCheck();
            e.returnStatement = site.isReturnStatement();
            report.sites.add(e);
            if (!site.isChecked()) {
                report.unchecked++;
            }
        }
        report.total = report.sites.size();
        return report;
    }

    public int total() {
        return total;
    }

    public int unchecked() {
        return unchecked;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    private static int lineOf(String source, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
