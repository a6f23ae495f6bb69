package com.allocsafe.decl;

import org.junit.jupiter.api.Test;

import com.allocsafe.FixerException;
import com.allocsafe.lexer.TokenList;
import com.allocsafe.lexer.Tokenizer;

import static org.junit.jupiter.api.Assertions.*;

class DeclaratorParserTest {

    private static DeclInfo parse(String decl) {
        TokenList tokens = Tokenizer.tokenize(decl);
        return DeclaratorParser.parseDeclaration(tokens, 0, tokens.size());
    }

    private static FixerException.ErrorKind failure(String decl) {
        FixerException e = assertThrows(FixerException.class, () -> parse(decl));
        return e.getKind();
    }

    @Test
    void plainVariable() {
        DeclInfo d = parse("int x;");
        assertEquals("x", d.identifier());
        assertEquals(DeclTypeKind.BASE, d.type().kind());
        assertEquals("int", d.type().baseName());
        assertEquals(1, d.type().depth());
    }

    @Test
    void arrayOfPointersVersusPointerToArray() {
        DeclInfo arrayOfPtrs = parse("int *x[3]");
        assertEquals("PTR -> ARRAY(3) -> BASE(int)", arrayOfPtrs.type().toString());

        DeclInfo ptrToArray = parse("int (*x)[3]");
        assertEquals("x", ptrToArray.identifier());
        assertEquals("ARRAY(3) -> PTR -> BASE(int)", ptrToArray.type().toString());
        assertEquals("3", ptrToArray.type().arraySize());
        assertEquals("int (*x)[3]", ptrToArray.render());
        assertNotEquals(arrayOfPtrs.type(), ptrToArray.type());
    }

    @Test
    void qualifiedPointers() {
        DeclInfo d = parse("const char *const p = NULL;");
        assertEquals("p", d.identifier());
        assertEquals("PTR(const) -> BASE(const char)", d.type().toString());
        assertEquals("const char *const p", d.render());

        DeclInfo pp = parse("static const int *const *pp;");
        assertEquals("PTR(const) -> PTR -> BASE(static const int)", pp.type().toString());
        assertEquals("static const int *const *pp", pp.render());
    }

    @Test
    void functionPointers() {
        DeclInfo fp = parse("int (*fp)(void);");
        assertEquals("fp", fp.identifier());
        assertEquals("FUNC(void) -> PTR -> BASE(int)", fp.type().toString());
        assertEquals("int (*fp)(void)", fp.render());

        DeclInfo signal = parse("void (*signal(int sig, void (*func)(int)))(int);");
        assertEquals("signal", signal.identifier());
        DeclType t = signal.type();
        assertEquals(DeclTypeKind.FUNC, t.kind());
        assertEquals("int", t.params());
        assertEquals(DeclTypeKind.PTR, t.inner().kind());
        assertEquals(DeclTypeKind.FUNC, t.inner().inner().kind());
        assertEquals("int sig, void (*func)(int)", t.inner().inner().params());
        assertEquals("void", t.base().baseName());
        assertEquals(4, t.depth());
    }

    @Test
    void specifierForms() {
        assertEquals("struct node", parse("struct node *next;").type().base().baseName());
        assertEquals("struct { int a; }", parse("struct { int a; } s;").type().baseName());
        assertEquals("unsigned long long", parse("unsigned long long n;").type().baseName());
        assertEquals("size_t", parse("size_t n;").type().baseName());
        assertEquals("double _Complex", parse("double _Complex z;").type().baseName());

        DeclInfo atomic = parse("_Atomic(int) *p;");
        assertEquals("_Atomic(int)", atomic.type().base().baseName());
        assertEquals(DeclTypeKind.PTR, atomic.type().kind());
    }

    @Test
    void abstractDeclarators() {
        DeclInfo ptr = parse("char *");
        assertTrue(ptr.isAbstract());
        assertNull(ptr.identifier());
        assertEquals("char *", ptr.render());

        DeclInfo ptrToArray = parse("int (*)[4]");
        assertTrue(ptrToArray.isAbstract());
        assertEquals("ARRAY(4) -> PTR -> BASE(int)", ptrToArray.type().toString());
        assertEquals("int (*)[4]", ptrToArray.render());
    }

    @Test
    void declaratorEndsAtInitializerBitFieldOrAttribute() {
        DeclInfo open = parse("int a[]");
        assertEquals(DeclTypeKind.ARRAY, open.type().kind());
        assertNull(open.type().arraySize());

        assertEquals("x", parse("unsigned x : 3;").identifier());
        assertEquals("y", parse("int y __attribute__((unused));").identifier());
        assertEquals("z", parse("int z = 1, w = 2;").identifier());
    }

    @Test
    void parsesARangeInsideALargerList() {
        TokenList tokens = Tokenizer.tokenize("x = 1; char *buf[8]; y = 2;");
        int start = 7;
        assertEquals("char", tokens.text(start));
        DeclInfo d = DeclaratorParser.parseDeclaration(tokens, start, tokens.size());
        assertEquals("buf", d.identifier());
        assertEquals("PTR -> ARRAY(8) -> BASE(char)", d.type().toString());
    }

    @Test
    void equalDeclarationsGiveEqualTypes() {
        DeclType a = parse("char *argv[]").type();
        DeclType b = parse("char  * argv [ ]").type();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void syntaxErrors() {
        assertEquals(FixerException.ErrorKind.SYNTAX_ERROR, failure(""));
        assertEquals(FixerException.ErrorKind.SYNTAX_ERROR, failure("   "));
        assertEquals(FixerException.ErrorKind.SYNTAX_ERROR, failure("int (*x"));
        assertEquals(FixerException.ErrorKind.SYNTAX_ERROR, failure("= 3"));
        assertEquals(FixerException.ErrorKind.SYNTAX_ERROR, failure("int x y"));
        assertEquals(FixerException.ErrorKind.SYNTAX_ERROR, failure("int (*x y)"));
    }

    @Test
    void invalidArguments() {
        TokenList tokens = Tokenizer.tokenize("int x;");
        FixerException nullList = assertThrows(FixerException.class,
                () -> DeclaratorParser.parseDeclaration(null, 0, 0));
        assertEquals(FixerException.ErrorKind.INVALID_ARGUMENT, nullList.getKind());

        FixerException reversed = assertThrows(FixerException.class,
                () -> DeclaratorParser.parseDeclaration(tokens, 2, 1));
        assertEquals(FixerException.ErrorKind.INVALID_ARGUMENT, reversed.getKind());

        FixerException past = assertThrows(FixerException.class,
                () -> DeclaratorParser.parseDeclaration(tokens, 0, tokens.size() + 1));
        assertEquals(FixerException.ErrorKind.INVALID_ARGUMENT, past.getKind());
    }
}
