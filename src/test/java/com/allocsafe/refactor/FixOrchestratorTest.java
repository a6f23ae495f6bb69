package com.allocsafe.refactor;

import org.junit.jupiter.api.Test;

import java.util.List;

import com.allocsafe.FixerConfig;
import com.allocsafe.FixerException;
import com.allocsafe.decl.DeclaratorParser;
import com.allocsafe.decl.DeclType;
import com.allocsafe.lexer.TokenList;
import com.allocsafe.lexer.Tokenizer;

import static org.junit.jupiter.api.Assertions.*;

class FixOrchestratorTest {

    @Test
    void propagatesThroughTheCallGraphUpToMain() {
        String code = String.join("\n",
                "#include <stdlib.h>",
                "#include <string.h>",
                "",
                "char *dup_str(const char *s) {",
                "  char *p = malloc(strlen(s) + 1);",
                "  strcpy(p, s);",
                "  return p;",
                "}",
                "",
                "void greet(void) {",
                "  char *g = dup_str(\"hi\");",
                "  puts(g);",
                "}",
                "",
                "int main(void) {",
                "  greet();",
                "  return 0;",
                "}",
                "");
        String expected = String.join("\n",
                "#include <stdlib.h>",
                "#include <string.h>",
                "",
                "int dup_str(const char *s, char **out) {",
                "  char *p = malloc(strlen(s) + 1); if (!p) { return ENOMEM; }",
                "  strcpy(p, s);",
                "  *out = p; return 0;",
                "}",
                "",
                "int greet(void) {",
                "  int rc = 0;",
                "  char *g ; rc = dup_str(\"hi\", &g); if (rc != 0) return rc;",
                "  puts(g);",
                "  return 0;",
                "}",
                "",
                "int main(void) {",
                "  int rc = 0;",
                "  rc = greet(); if (rc != 0) return rc;",
                "  return 0;",
                "}",
                "");
        FixOrchestrator.FixResult result = FixOrchestrator.fix(code);
        assertEquals(expected, result.text());
        assertEquals(List.of("dup_str", "greet", "main"), result.refactored());
        assertEquals(1, result.allocationSites());
    }

    @Test
    void checkedIntFunctionIsLeftAlone() {
        String code = String.join("\n",
                "int f(void) {",
                "  char *p = malloc(3);",
                "  if (!p) return -1;",
                "  free(p);",
                "  return 0;",
                "}",
                "");
        FixOrchestrator.FixResult result = FixOrchestrator.fix(code);
        assertEquals(code, result.text());
        assertTrue(result.refactored().isEmpty());
        assertEquals(1, result.allocationSites());
    }

    @Test
    void intFunctionGetsGuardsButKeepsItsSignature() {
        String code = String.join("\n",
                "int f(void) {",
                "  char *p = malloc(3);",
                "  free(p);",
                "  return 0;",
                "}");
        String expected = String.join("\n",
                "int f(void) {",
                "  char *p = malloc(3); if (!p) { return ENOMEM; }",
                "  free(p);",
                "  return 0;",
                "}");
        FixOrchestrator.FixResult result = FixOrchestrator.fix(code);
        assertEquals(expected, result.text());
        assertTrue(result.refactored().isEmpty());
    }

    @Test
    void prototypesFollowTheirDefinitions() {
        String code = String.join("\n",
                "void reset(struct st *s);",
                "void reset(struct st *s) {",
                "  s->buf = malloc(8);",
                "}");
        String expected = String.join("\n",
                "int reset(struct st *s);",
                "int reset(struct st *s) {",
                "  s->buf = malloc(8); if (!s->buf) { return ENOMEM; }",
                "  return 0;",
                "}");
        assertEquals(expected, FixOrchestrator.fix(code).text());
    }

    @Test
    void mutualRecursionTerminates() {
        String code = String.join("\n",
                "void a(int n);",
                "void b(int n) {",
                "  char *p = malloc(n);",
                "  if (n) a(n - 1);",
                "  free(p);",
                "}",
                "void a(int n) {",
                "  b(n);",
                "}");
        FixOrchestrator.FixResult result = FixOrchestrator.fix(code);
        assertEquals(List.of("b", "a"), result.refactored());
        assertTrue(result.text().startsWith("int a(int n);\nint b(int n) {"), result.text());
        assertTrue(result.text().contains("if (n) { rc = a(n - 1); if (rc != 0) return rc; }"), result.text());
        assertTrue(result.text().contains("rc = b(n); if (rc != 0) return rc;"), result.text());
    }

    @Test
    void unrelatedCodeIsCopiedVerbatim() {
        String code = String.join("\n",
                "/* header */",
                "typedef struct { int x; } point;",
                "static int counter = 0;",
                "int add(int a, int b) { return a + b; }",
                "");
        FixOrchestrator.FixResult result = FixOrchestrator.fix(code);
        assertEquals(code, result.text());
        assertEquals(0, result.allocationSites());
    }

    @Test
    void returnTypeDropsTheFunctionNode() {
        assertEquals("char *", returnTypeOf("char *f(void)").render(null));
        assertEquals("void", returnTypeOf("void g(int a)").render(null));
        assertEquals("int (*)[3]", returnTypeOf("int (*pick(int k))[3]").render(null));
        assertNull(returnTypeOf("int x"));
    }

    private static DeclType returnTypeOf(String header) {
        TokenList tokens = Tokenizer.tokenize(header);
        return FixOrchestrator.returnTypeOf(DeclaratorParser.parseDeclaration(tokens, 0, tokens.size()).type());
    }

    @Test
    void unreadableHeaderKeepsTheSignature() {
        TokenList tokens = Tokenizer.tokenize("char *make { return malloc(4); }");
        FixOrchestrator.FunctionNode fn = new FixOrchestrator.FunctionNode();
        fn.name = "make";
        fn.start = 0;
        fn.bodyStart = tokens.matchingOpen(tokens.size() - 1);
        fn.end = tokens.size();
        fn.returnsPtr = true;
        fn.marked = true;
        assertTrue(fn.changesSignature());

        FixOrchestrator.rewriteHeader(tokens, fn, FixerConfig.defaults());
        assertTrue(fn.signatureKept);
        assertNull(fn.newHeader);
        assertFalse(fn.changesSignature());
    }

    @Test
    void rewrittenHeaderIsKeptForTheBody() {
        TokenList tokens = Tokenizer.tokenize("char *make(void) { return malloc(4); }");
        FixOrchestrator.FunctionNode fn = new FixOrchestrator.FunctionNode();
        fn.name = "make";
        fn.start = 0;
        fn.bodyStart = tokens.matchingOpen(tokens.size() - 1);
        fn.end = tokens.size();
        fn.returnsPtr = true;
        fn.marked = true;

        FixOrchestrator.rewriteHeader(tokens, fn, FixerConfig.defaults());
        assertEquals("int make(char **out)", fn.newHeader);
        assertTrue(fn.changesSignature());
    }

    @Test
    void nullSourceIsRejected() {
        FixerException e = assertThrows(FixerException.class, () -> FixOrchestrator.fix(null));
        assertEquals(FixerException.ErrorKind.INVALID_ARGUMENT, e.getKind());
    }
}
