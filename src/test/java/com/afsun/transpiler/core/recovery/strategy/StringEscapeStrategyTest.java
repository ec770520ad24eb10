package com.afsun.transpiler.core.recovery.strategy;

import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.recovery.RecoveryAttempt;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StringEscapeStrategyTest {

    private final StringEscapeStrategy strategy = new StringEscapeStrategy();

    @Test
    void testCloseUnterminatedLiteral() {
        String sql = "SELECT 'abc FROM t;";
        assertTrue(strategy.canHandle(sql, null));

        RecoveryAttempt attempt = strategy.recover(sql, null, Dialect.ORACLE);
        assertTrue(attempt.isSuccess());
        assertEquals("SELECT 'abc FROM t';", attempt.getRecoveredSql(), "单引号补在分号之前");
    }

    @Test
    void testBackslashEscapeRewritten() {
        RecoveryAttempt attempt = strategy.recover("SELECT 'it\\'s' FROM t", null, Dialect.ORACLE);

        assertTrue(attempt.isSuccess());
        assertEquals("SELECT 'it''s' FROM t", attempt.getRecoveredSql());
        assertTrue(attempt.getWarning().getMessage().contains("''"));
    }

    @Test
    void testBalancedLiteralUntouched() {
        RecoveryAttempt attempt = strategy.recover("SELECT 'it''s' FROM t", null, Dialect.POSTGRESQL);
        assertFalse(attempt.isSuccess());
        assertEquals("string-escape repair", attempt.getStrategyName());
    }
}
