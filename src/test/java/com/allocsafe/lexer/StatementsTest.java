package com.allocsafe.lexer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatementsTest {

    private static int indexOf(TokenList tokens, String text) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.text(i).equals(text)) {
                return i;
            }
        }
        throw new AssertionError("no token " + text);
    }

    private static int lastIndexOf(TokenList tokens, String text) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.text(i).equals(text)) {
                return i;
            }
        }
        throw new AssertionError("no token " + text);
    }

    @Test
    void statementBoundsSkipNestedSemicolons() {
        TokenList tokens = Tokenizer.tokenize("{ a = 1; p = f(g(1), h(2)); b = 2; }");
        int f = indexOf(tokens, "f");
        int semi = Statements.end(tokens, f);
        assertEquals(";", tokens.text(semi));
        assertEquals("p = f(g(1), h(2))", tokens.text(Statements.start(tokens, f), semi));
    }

    @Test
    void noStatementEndInsideForHeaderOrBeforeClosingBrace() {
        TokenList tokens = Tokenizer.tokenize("for (i = 0; i < n; i++) { x = y }");
        assertTrue(Statements.inForHeader(tokens, indexOf(tokens, "n")));
        assertEquals(-1, Statements.end(tokens, indexOf(tokens, "n")));
        assertFalse(Statements.inForHeader(tokens, indexOf(tokens, "y")));
        assertEquals(-1, Statements.end(tokens, indexOf(tokens, "y")));
    }

    @Test
    void argumentEndStopsAtTopLevelComma() {
        TokenList tokens = Tokenizer.tokenize("realloc(buf[f(a, b)], n * 2)");
        int open = indexOf(tokens, "(");
        int close = tokens.matchingClose(open);
        int comma = Statements.argumentEnd(tokens, open + 1, close);
        assertEquals("buf[f(a, b)]", tokens.text(open + 1, comma));
        assertEquals(close, Statements.argumentEnd(tokens, comma + 1, close));
    }

    @Test
    void lvalueStartHandlesMembersSubscriptsAndDereference() {
        TokenList tokens = Tokenizer.tokenize("s->buf = a; t.items[i + 1] = b; *p = c; char *q = d;");
        int eq1 = indexOf(tokens, "=");
        assertEquals("s->buf", Statements.compact(tokens, Statements.lvalueStart(tokens, eq1), eq1));

        TokenList t2 = Tokenizer.tokenize("t.items[i + 1] = b;");
        int eq2 = indexOf(t2, "=");
        assertEquals("t.items[i+1]", Statements.compact(t2, Statements.lvalueStart(t2, eq2), eq2));

        TokenList t3 = Tokenizer.tokenize("x; *p = c;");
        int eq3 = indexOf(t3, "=");
        assertEquals("*p", Statements.compact(t3, Statements.lvalueStart(t3, eq3), eq3));

        int eq4 = lastIndexOf(tokens, "=");
        assertEquals("q", Statements.compact(tokens, Statements.lvalueStart(tokens, eq4), eq4));
    }

    @Test
    void lvalueStartRejectsCalls() {
        TokenList tokens = Tokenizer.tokenize("f(x) = 3;");
        assertEquals(-1, Statements.lvalueStart(tokens, indexOf(tokens, "=")));
    }

    @Test
    void sliceRebasesOffsets() {
        TokenList tokens = Tokenizer.tokenize("int f(void) { return 1; }");
        int open = indexOf(tokens, "{");
        int close = tokens.matchingClose(open);
        TokenList body = tokens.slice(open, close + 1);
        assertEquals("{ return 1; }", body.source());
        assertEquals(0, body.get(0).start());
        assertEquals(TokenKind.KW_RETURN, body.kind(body.nextSignificant(1)));
        assertEquals(0, body.matchingOpen(body.size() - 1));
    }

    @Test
    void significantNavigationReportsMisses() {
        TokenList tokens = Tokenizer.tokenize("  /* c */  ");
        assertEquals(tokens.size(), tokens.nextSignificant(0));
        assertEquals(-1, tokens.prevSignificant(tokens.size() - 1));
    }
}
