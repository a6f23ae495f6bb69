package com.allocsafe.cst;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CstNodeKindTest {

    @Test
    void everyKindRoundTripsThroughItsName() {
        for (CstNodeKind k : CstNodeKind.values()) {
            assertEquals(k, CstNodeKind.fromStr(k.toStr()), k.name());
        }
        assertEquals(30, CstNodeKind.values().length);
    }

    @Test
    void namesAreExact() {
        assertEquals("FunctionPrototype", CstNodeKind.FUNCTION_PROTOTYPE.toStr());
        assertEquals("MacroIfDef", CstNodeKind.MACRO_IF_DEF.toStr());
        assertEquals("GoTo", CstNodeKind.GO_TO.toStr());
    }

    @Test
    void lookupIsCaseSensitiveAndDefaultsToExpression() {
        assertEquals(CstNodeKind.WHILE, CstNodeKind.fromStr("While"));
        assertEquals(CstNodeKind.EXPRESSION, CstNodeKind.fromStr("while"));
        assertEquals(CstNodeKind.EXPRESSION, CstNodeKind.fromStr("NoSuchKind"));
        assertEquals(CstNodeKind.EXPRESSION, CstNodeKind.fromStr(""));
        assertEquals(CstNodeKind.EXPRESSION, CstNodeKind.fromStr(null));
    }
}
