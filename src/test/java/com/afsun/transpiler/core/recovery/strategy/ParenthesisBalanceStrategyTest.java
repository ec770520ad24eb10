package com.afsun.transpiler.core.recovery.strategy;

import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.recovery.RecoveryAttempt;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParenthesisBalanceStrategyTest {

    private final ParenthesisBalanceStrategy strategy = new ParenthesisBalanceStrategy();

    @Test
    void testAppendMissingParen() {
        assertEquals("SELECT * FROM t WHERE id IN (1,2,3)",
                ParenthesisBalanceStrategy.balance("SELECT * FROM t WHERE id IN (1,2,3"));
        assertEquals("SELECT ((1))  \n", ParenthesisBalanceStrategy.balance("SELECT ((1  \n"), "补在末尾空白之前");
    }

    @Test
    void testDropExtraParen() {
        assertEquals("SELECT 1 FROM dual", ParenthesisBalanceStrategy.balance("SELECT 1) FROM dual"));
    }

    @Test
    void testBalancePerStatement() {
        assertEquals("SELECT (1);SELECT 2", ParenthesisBalanceStrategy.balance("SELECT (1;SELECT 2)"));
    }

    @Test
    void testParenInsideLiteralIgnored() {
        assertFalse(strategy.canHandle("SELECT '(' FROM dual", null));

        RecoveryAttempt attempt = strategy.recover("SELECT '(', (1 FROM dual", null, Dialect.ORACLE);
        assertTrue(attempt.isSuccess());
        assertEquals("SELECT '(', (1 FROM dual)", attempt.getRecoveredSql());
    }
}
