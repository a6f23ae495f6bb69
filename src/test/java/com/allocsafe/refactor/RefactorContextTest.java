package com.allocsafe.refactor;

import org.junit.jupiter.api.Test;

import com.allocsafe.FixerException;

import static org.junit.jupiter.api.Assertions.*;

class RefactorContextTest {

    @Test
    void registersAndFindsFunctions() {
        RefactorContext ctx = new RefactorContext();
        assertTrue(ctx.isEmpty());
        ctx.addFunction("init", RefactorType.VOID_TO_INT, null);
        ctx.addFunction("dup", RefactorType.PTR_TO_INT_OUT, "char *");
        assertEquals(2, ctx.size());
        assertTrue(ctx.contains("init"));
        assertFalse(ctx.contains("main"));
        assertNull(ctx.find("main"));
        assertEquals("char *", ctx.find("dup").returnType());
    }

    @Test
    void laterRegistrationWins() {
        RefactorContext ctx = new RefactorContext();
        ctx.addFunction("f", RefactorType.VOID_TO_INT, null);
        ctx.addFunction("f", RefactorType.PTR_TO_INT_OUT, "int *");
        assertEquals(RefactorType.PTR_TO_INT_OUT, ctx.find("f").type());
        assertEquals(2, ctx.functions().size());
    }

    @Test
    void clearEmptiesTheContext() {
        RefactorContext ctx = new RefactorContext();
        ctx.addFunction("f", RefactorType.VOID_TO_INT, null);
        ctx.clear();
        assertTrue(ctx.isEmpty());
        ctx.clear();
        assertEquals(0, ctx.size());
    }

    @Test
    void rejectsIncompleteEntries() {
        RefactorContext ctx = new RefactorContext();
        assertEquals(FixerException.ErrorKind.INVALID_ARGUMENT,
                assertThrows(FixerException.class, () -> ctx.addFunction(null, RefactorType.VOID_TO_INT, null))
                        .getKind());
        assertEquals(FixerException.ErrorKind.INVALID_ARGUMENT,
                assertThrows(FixerException.class, () -> ctx.addFunction("f", null, null)).getKind());
        assertEquals(FixerException.ErrorKind.INVALID_ARGUMENT,
                assertThrows(FixerException.class, () -> ctx.addFunction("f", RefactorType.PTR_TO_INT_OUT, null))
                        .getKind());
        assertTrue(ctx.isEmpty());
    }
}
