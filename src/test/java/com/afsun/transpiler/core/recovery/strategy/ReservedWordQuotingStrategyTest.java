package com.afsun.transpiler.core.recovery.strategy;

import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.afsun.transpiler.core.recovery.RecoveryAttempt;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReservedWordQuotingStrategyTest {

    private final ReservedWordQuotingStrategy strategy = new ReservedWordQuotingStrategy();

    @Test
    void testQualifiedColumnQuotedPerDialect() {
        String sql = "SELECT t.user, t.date FROM t";

        assertEquals("SELECT t.\"USER\", t.\"DATE\" FROM t", ReservedWordQuotingStrategy.quote(sql, Dialect.ORACLE));
        assertEquals("SELECT t.\"user\", t.\"date\" FROM t", ReservedWordQuotingStrategy.quote(sql, Dialect.POSTGRESQL));
        assertEquals("SELECT t.`user`, t.`date` FROM t", ReservedWordQuotingStrategy.quote(sql, Dialect.MYSQL));
    }

    @Test
    void testColumnDefinitionQuoted() {
        assertEquals("CREATE TABLE t (id INT, \"date\" DATE, \"level\" INT)",
                ReservedWordQuotingStrategy.quote("CREATE TABLE t (id INT, date DATE, level INT)", Dialect.POSTGRESQL));
    }

    @Test
    void testFunctionCallNotQuoted() {
        String sql = "SELECT pkg.user(1) FROM t";
        assertEquals(sql, ReservedWordQuotingStrategy.quote(sql, Dialect.ORACLE));
        assertFalse(strategy.canHandle(sql, null));
    }

    @Test
    void testKeywordErrorMakesApplicable() {
        SqlParseException error = new SqlParseException("illegal identifier, reserved keyword", 1, 8, null);
        assertTrue(strategy.canHandle("SELECT 1 FROM dual", error));

        RecoveryAttempt attempt = strategy.recover("SELECT 1 FROM dual", error, Dialect.ORACLE);
        assertFalse(attempt.isSuccess(), "文本没有变化时不算修复成功");
    }
}
