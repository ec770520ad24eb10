package com.afsun.transpiler.core.util;

import com.afsun.transpiler.core.Dialect;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 字符串与注释屏蔽测试
 */
class MaskedSqlTest {

    @Test
    void testMaskAndRestore() {
        String sql = "SELECT 'a;b(' AS x FROM t -- NVL(c)\nWHERE y = 1";
        MaskedSql masked = MaskedSql.mask(sql, Dialect.ORACLE);

        assertFalse(masked.getText().contains("a;b("), "字面量内容应被屏蔽");
        assertFalse(masked.getText().contains("NVL"), "注释内容应被屏蔽");
        assertTrue(masked.getText().contains("FROM t"), "普通SQL应保留");
        assertEquals(sql, masked.restore(masked.getText()), "还原后应与原文一致");
    }

    @Test
    void testDoubledQuoteEscape() {
        MaskedSql masked = MaskedSql.mask("SELECT 'O''Brien' FROM t", Dialect.ORACLE);
        String token = "'\u00010\u0001'";

        assertEquals("SELECT " + token + " FROM t", masked.getText());
        assertTrue(MaskedSql.isLiteralPlaceholder(token));
        assertEquals("'O''Brien'", masked.literalText(token));
        assertEquals("O'Brien", masked.literalValue(token));
    }

    @Test
    void testMySqlBackslashEscape() {
        String sql = "SELECT 'it\\'s' FROM t";
        MaskedSql mysql = MaskedSql.mask(sql, Dialect.MYSQL);
        assertEquals("SELECT '\u00010\u0001' FROM t", mysql.getText(), "MySQL 下反斜杠转义的引号不结束字符串");

        MaskedSql oracle = MaskedSql.mask(sql, Dialect.ORACLE);
        assertEquals("SELECT '\u00010\u0001's'\u00011\u0001'", oracle.getText(), "Oracle 下反斜杠不是转义符");
    }

    @Test
    void testOracleQuoteLiteral() {
        MaskedSql masked = MaskedSql.mask("SELECT q'[it's]' FROM dual", Dialect.ORACLE);
        assertEquals("SELECT '\u00010\u0001' FROM dual", masked.getText());
    }

    @Test
    void testPostgresDollarQuote() {
        String sql = "SELECT $$a 'b' c$$, $1 FROM t";
        MaskedSql masked = MaskedSql.mask(sql, Dialect.POSTGRESQL);
        assertEquals("SELECT '\u00010\u0001', $1 FROM t", masked.getText(), "位置参数 $1 不应被当作 dollar quote");
        assertEquals(sql, masked.restore(masked.getText()));
    }

    @Test
    void testQuotedIdentifierKeepsCommentMarkers() {
        MaskedSql masked = MaskedSql.mask("SELECT \"a--b\" FROM t", Dialect.POSTGRESQL);
        assertEquals("SELECT \"a--b\" FROM t", masked.getText(), "引用标识符中的 -- 不是注释");
    }

    @Test
    void testAddLiteralAndComment() {
        MaskedSql masked = MaskedSql.mask("SELECT 1 FROM t", Dialect.ORACLE);
        String lit = masked.addLiteral("x'y");
        String comment = masked.addComment("/* note */");

        assertEquals("SELECT 'x''y', /* note */", masked.restore("SELECT " + lit + ", " + comment));
    }

    @Test
    void testHasUnclosedLiteral() {
        assertTrue(MaskedSql.hasUnclosedLiteral("SELECT * FROM t WHERE a = 'abc", Dialect.ORACLE));
        assertFalse(MaskedSql.hasUnclosedLiteral("SELECT * FROM t WHERE a = 'abc'", Dialect.ORACLE));
        assertFalse(MaskedSql.hasUnclosedLiteral("SELECT * FROM t", Dialect.ORACLE));
        assertTrue(MaskedSql.hasUnclosedLiteral("SELECT 'a\\'", Dialect.MYSQL), "MySQL 下 \\' 不闭合字符串");
        assertFalse(MaskedSql.hasUnclosedLiteral("SELECT 'a\\'", Dialect.POSTGRESQL));
    }

    @Test
    void testRestoreRewritesMySqlEscapesForOtherTargets() {
        MaskedSql masked = MaskedSql.mask("SELECT 'it\\'s', 'a\\\\', 'x\\ny' FROM t", Dialect.MYSQL);

        assertEquals("SELECT 'it''s', 'a\\', 'x\ny' FROM t", masked.restore(masked.getText(), Dialect.POSTGRESQL),
                "反斜杠转义应改写为标准写法");
        assertEquals("SELECT 'it\\'s', 'a\\\\', 'x\\ny' FROM t", masked.restore(masked.getText(), Dialect.MYSQL));
    }

    @Test
    void testRestoreDoublesBackslashForMySqlTarget() {
        MaskedSql masked = MaskedSql.mask("SELECT 'C:\\tmp' FROM dual", Dialect.ORACLE);
        assertEquals("SELECT 'C:\\\\tmp' FROM dual", masked.restore(masked.getText(), Dialect.MYSQL));
    }

    @Test
    void testRestoreRewritesOracleQuoteLiteral() {
        MaskedSql masked = MaskedSql.mask("SELECT q'[it's]', Q'{a}' FROM dual", Dialect.ORACLE);

        assertEquals("SELECT 'it''s', 'a' FROM dual", masked.restore(masked.getText(), Dialect.POSTGRESQL));
        assertEquals("SELECT q'[it's]', Q'{a}' FROM dual", masked.restore(masked.getText(), Dialect.ORACLE));
    }

    @Test
    void testUnportableLiterals() {
        MaskedSql masked = MaskedSql.mask("SELECT 'a\\0b', 'ok' FROM t", Dialect.MYSQL);

        assertEquals(1, masked.unportableLiterals(masked.getText(), Dialect.ORACLE).size());
        assertTrue(masked.unportableLiterals(masked.getText(), Dialect.MYSQL).isEmpty());
    }

    @Test
    void testStandardizeQuoteLiterals() {
        assertEquals("SELECT 'it''s', 'x' FROM dual -- q'[c]'",
                MaskedSql.standardizeQuoteLiterals("SELECT q'[it's]', 'x' FROM dual -- q'[c]'"), "注释中的内容不改");
        String plain = "SELECT 'a' FROM dual";
        assertSame(plain, MaskedSql.standardizeQuoteLiterals(plain));
    }
}
