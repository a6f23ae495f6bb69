package com.allocsafe;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FixerConfigTest {

    @Test
    void defaults() {
        FixerConfig c = FixerConfig.defaults();
        assertEquals("ENOMEM", c.errorCode());
        assertEquals("0", c.successCode());
        assertEquals("out", c.outArgName());
        assertEquals("rc", c.statusVar());
        assertEquals(FixerConfig.DEFAULT_TOKEN_LIMIT, c.tokenLimit());
        assertFalse(c.printWarnings());
    }

    @Test
    void toBuilderCopiesEverySetting() {
        FixerConfig c = FixerConfig.builder().errorCode("-1").statusVar("err").tokenLimit(10).printWarnings(true).build();
        FixerConfig copy = c.toBuilder().outArgName("res").build();
        assertEquals("-1", copy.errorCode());
        assertEquals("err", copy.statusVar());
        assertEquals(10, copy.tokenLimit());
        assertTrue(copy.printWarnings());
        assertEquals("res", copy.outArgName());
        assertEquals("out", c.outArgName());
    }

    @Test
    void rejectsBadValues() {
        assertThrows(IllegalArgumentException.class, () -> FixerConfig.builder().tokenLimit(0));
        FixerException e = assertThrows(FixerException.class, () -> FixerConfig.builder().errorCode(null));
        assertEquals(FixerException.ErrorKind.INVALID_ARGUMENT, e.getKind());
    }
}
