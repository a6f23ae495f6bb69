package com.allocsafe.refactor;

import org.junit.jupiter.api.Test;

import com.allocsafe.FixerConfig;
import com.allocsafe.FixerException;
import com.allocsafe.lexer.TokenList;
import com.allocsafe.lexer.Tokenizer;

import static org.junit.jupiter.api.Assertions.*;

class SignatureRewriterTest {

    private static String rewrite(String header) {
        TokenList tokens = Tokenizer.tokenize(header);
        return SignatureRewriter.rewrite(tokens, 0, tokens.size());
    }

    @Test
    void voidBecomesInt() {
        assertEquals("int init(struct ctx *c)", rewrite("void init(struct ctx *c)"));
        assertEquals("static int reset(void)", rewrite("static void reset(void)"));
    }

    @Test
    void pointerResultMovesToAnOutParameter() {
        assertEquals("int dup_str(const char *s, char **out)", rewrite("char *dup_str(const char *s)"));
        assertEquals("int make(char **out)", rewrite("char *make(void)"));
        assertEquals("int create(struct buf **out)", rewrite("struct buf *create()"));
        assertEquals("int avg(int n, double *out)", rewrite("double avg(int n)"));
    }

    @Test
    void intFunctionsAreKept() {
        assertEquals("int count(int n)", rewrite("int count(int n)"));
    }

    @Test
    void knrHeaderDeclaresTheOutParameterLast() {
        String header = String.join("\n",
                "char *knr(a, b)",
                "int a;",
                "int b;");
        String expected = String.join("\n",
                "int knr(a, b, out)",
                "int a;",
                "int b;",
                "char **out;");
        assertEquals(expected, rewrite(header));
    }

    @Test
    void leadingAttributeStaysInFront() {
        assertEquals("__attribute__((noinline)) int f(void)", rewrite("__attribute__((noinline)) void f(void)"));
    }

    @Test
    void configuredOutName() {
        TokenList tokens = Tokenizer.tokenize("char *name_of(int id)");
        FixerConfig config = FixerConfig.builder().outArgName("result").build();
        assertEquals("int name_of(int id, char **result)",
                SignatureRewriter.rewrite(tokens, 0, tokens.size(), config));
    }

    @Test
    void returnTypeSkipsStorage() {
        TokenList tokens = Tokenizer.tokenize("static inline const char *label(void)");
        int name = 0;
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.text(i).equals("label")) {
                name = i;
            }
        }
        assertEquals("const char *", SignatureRewriter.returnType(tokens, 0, name));
    }

    @Test
    void malformedHeadersAreSyntaxErrors() {
        FixerException noParams = assertThrows(FixerException.class, () -> rewrite("int x"));
        assertEquals(FixerException.ErrorKind.SYNTAX_ERROR, noParams.getKind());
        FixerException noName = assertThrows(FixerException.class, () -> rewrite("(void)"));
        assertEquals(FixerException.ErrorKind.SYNTAX_ERROR, noName.getKind());
        FixerException open = assertThrows(FixerException.class, () -> rewrite("void f(int a"));
        assertEquals(FixerException.ErrorKind.SYNTAX_ERROR, open.getKind());
    }
}
