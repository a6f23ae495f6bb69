package com.allocsafe.cst;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import com.allocsafe.lexer.TokenList;
import com.allocsafe.lexer.Tokenizer;

import static org.junit.jupiter.api.Assertions.*;

class TopLevelScannerTest {

    private static List<CstNodeKind> kinds(CstNodeList nodes) {
        List<CstNodeKind> out = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            out.add(nodes.get(i).kind());
        }
        return out;
    }

    @Test
    void classifiesTopLevelItems() {
        String code = String.join("\n",
                "#include <stdio.h>",
                "#define N 4",
                "#ifndef DEBUG",
                "#pragma once",
                "#else",
                "#endif",
                "typedef unsigned long ulong;",
                "struct point { int x, y; };",
                "union u { int i; float f; };",
                "enum color { RED, GREEN };",
                "static int table[N] = { 1, 2, 3, 4 };",
                "int (*handler)(int) = 0;",
                "char *name_of(int id);",
                "char *name_of(int id) { return 0; }",
                "");
        TokenList tokens = Tokenizer.tokenize(code);
        CstNodeList nodes = TopLevelScanner.scan(tokens);
        assertEquals(List.of(
                CstNodeKind.MACRO_INCLUDE,
                CstNodeKind.MACRO_DEFINE,
                CstNodeKind.MACRO_IF_DEF,
                CstNodeKind.MACRO_PRAGMA,
                CstNodeKind.MACRO_ELSE,
                CstNodeKind.EXPRESSION,
                CstNodeKind.DEFINITION,
                CstNodeKind.STRUCT,
                CstNodeKind.UNION,
                CstNodeKind.ENUM,
                CstNodeKind.DECLARATION,
                CstNodeKind.DECLARATION,
                CstNodeKind.FUNCTION_PROTOTYPE,
                CstNodeKind.FUNCTION), kinds(nodes));

        CstNode fn = nodes.ofKind(CstNodeKind.FUNCTION).get(0);
        assertEquals("char *name_of(int id) { return 0; }", tokens.text(fn.start(), fn.end()));
    }

    @Test
    void knrDefinitionIsOneFunction() {
        String code = String.join("\n",
                "int sum(a, b)",
                "int a;",
                "int b;",
                "{",
                "  return a + b;",
                "}");
        TokenList tokens = Tokenizer.tokenize(code);
        CstNodeList nodes = TopLevelScanner.scan(tokens);
        assertEquals(1, nodes.size());
        assertEquals(CstNodeKind.FUNCTION, nodes.get(0).kind());
        assertEquals(code, tokens.text(nodes.get(0).start(), nodes.get(0).end()));
    }

    @Test
    void unterminatedItemRunsToTheEnd() {
        TokenList tokens = Tokenizer.tokenize("int x = 3");
        CstNodeList nodes = TopLevelScanner.scan(tokens);
        assertEquals(1, nodes.size());
        assertEquals(CstNodeKind.EXPRESSION, nodes.get(0).kind());
        assertEquals(tokens.size(), nodes.get(0).end());
    }

    @Test
    void arenaHandsOutIndices() {
        CstNodeList list = new CstNodeList();
        assertEquals(0, list.add(new CstNode(CstNodeKind.IF, 0, 1)));
        assertEquals(1, list.add(new CstNode(CstNodeKind.ELSE, 1, 2)));
        assertEquals(CstNodeKind.ELSE, list.get(1).kind());
        assertEquals(1, list.ofKind(CstNodeKind.IF).size());
        list.clear();
        assertEquals(0, list.size());
    }
}
