package com.afsun.transpiler.core.recovery;

import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.afsun.transpiler.core.recovery.strategy.ParenthesisBalanceStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryServiceTest {

    private RecoveryService service;

    @BeforeEach
    void setUp() {
        service = RecoveryService.createDefault();
    }

    @Test
    void testStrategiesOrderedByConfidence() {
        List<RecoveryStrategy> strategies = service.getStrategies();

        assertEquals(7, strategies.size());
        assertEquals("physical-attribute removal", strategies.get(0).name());
        assertEquals("hierarchical rewrite", strategies.get(6).name());
        for (int i = 1; i < strategies.size(); i++) {
            assertTrue(strategies.get(i - 1).confidence() >= strategies.get(i).confidence(), "可信度应从高到低");
        }
    }

    @Test
    void testRecoverFirstBalancesParenthesis() {
        SqlParseException error = new SqlParseException("syntax error, expect RPAREN", 1, 35, null);

        RecoveryOutcome outcome = service.recoverFirst("SELECT * FROM t WHERE id IN (1,2,3", error, Dialect.ORACLE);

        assertTrue(outcome.isSuccess());
        assertEquals("SELECT * FROM t WHERE id IN (1,2,3)", outcome.getSql());
        assertEquals("parenthesis-balance repair", outcome.getStrategyName());
        assertEquals(0.75, outcome.getConfidence(), 1e-9);
        assertEquals(1, outcome.getWarnings().size());
    }

    @Test
    void testRecoverFirstWithoutApplicableStrategy() {
        String sql = "SELECT 1 FROM dual";
        RecoveryOutcome outcome = service.recoverFirst(sql, null, Dialect.ORACLE);

        assertFalse(outcome.isSuccess());
        assertEquals(sql, outcome.getSql(), "没有可用策略时返回原文");
        assertNull(outcome.getStrategyName());
        assertEquals(0.0, outcome.getConfidence(), 1e-9);
    }

    @Test
    void testRecoverSequentiallyAppliesEveryStrategy() {
        RecoveryOutcome outcome = service.recoverSequentially("SELECT /*+ FULL(t) */ a FROM t WHERE b IN (1,2",
                null, Dialect.ORACLE);

        assertTrue(outcome.isSuccess());
        assertEquals("SELECT   a FROM t WHERE b IN (1,2)", outcome.getSql());
        assertEquals(2, outcome.getAttempts().size());
        assertEquals("hint removal", outcome.getStrategyName(), "第一个生效的是可信度更高的提示删除");
        assertEquals(0.75, outcome.getConfidence(), 1e-9, "整体可信度取成功尝试中的最低值");
        assertEquals(2, outcome.getWarnings().size());
    }

    @Test
    void testFailingStrategyBecomesWarning() {
        RecoveryStrategy broken = new AbstractRecoveryStrategy("broken", 0.99) {
            @Override
            public boolean canHandle(String sql, SqlParseException error) {
                return true;
            }

            @Override
            public RecoveryAttempt recover(String sql, SqlParseException error, Dialect dialect) {
                throw new IllegalStateException("boom");
            }
        };
        RecoveryService custom = new RecoveryService(Arrays.asList(new ParenthesisBalanceStrategy(), broken));

        RecoveryOutcome outcome = custom.recoverFirst("SELECT (1 FROM dual", null, Dialect.ORACLE);

        assertEquals("broken", custom.getStrategies().get(0).name());
        assertTrue(outcome.isSuccess(), "异常的策略不影响后续策略");
        assertEquals("SELECT (1 FROM dual)", outcome.getSql());
        assertEquals(2, outcome.getAttempts().size());
        assertFalse(outcome.getAttempts().get(0).isSuccess());

        ConversionWarning first = outcome.getWarnings().get(0);
        assertEquals(WarningType.MANUAL_REVIEW_NEEDED, first.getType());
        assertEquals("修复策略 broken 执行失败: boom", first.getMessage());
    }
}
