package com.afsun.transpiler.core.exceptions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConversionExceptionTest {

    @Test
    void testFormattedMessage() {
        FeatureConversionException e = new FeatureConversionException("PIVOT 括号不匹配", "SELECT * FROM t PIVOT (");

        assertEquals("[FEATURE_CONVERSION_ERROR] PIVOT 括号不匹配\nSQL片段: SELECT * FROM t PIVOT (\n建议: 请人工复核该片段",
                e.getFormattedMessage());
        assertEquals(e.getFormattedMessage(), e.toString());
    }

    @Test
    void testFormattedMessageWithoutOptionalParts() {
        ConversionException e = new ConversionException("CONVERSION_ERROR", "失败", null, new IllegalStateException("x"));

        assertEquals("[CONVERSION_ERROR] 失败", e.getFormattedMessage());
        assertNull(e.getSqlFragment());
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    void testUnsupportedDialectIsConversionException() {
        UnsupportedDialectException e = new UnsupportedDialectException("SQLSERVER");

        assertEquals("DIALECT_CONFIG_ERROR", e.getErrorCode());
        assertNotNull(e.getSuggestion());
    }
}
