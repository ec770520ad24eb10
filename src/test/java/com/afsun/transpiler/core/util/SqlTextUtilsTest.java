package com.afsun.transpiler.core.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlTextUtilsTest {

    @Test
    void testFindMatchingParen() {
        String s = "f(a, g(b), c) + 1";
        assertEquals(12, SqlTextUtils.findMatchingParen(s, 1));
        assertEquals(-1, SqlTextUtils.findMatchingParen("f(a, (b)", 1), "未闭合时返回 -1");
    }

    @Test
    void testSplitArguments() {
        List<String> args = SqlTextUtils.trimAll(SqlTextUtils.splitArguments("a, NVL(b, 0), 'x'"));
        assertEquals(Arrays.asList("a", "NVL(b, 0)", "'x'"), args);
        assertTrue(SqlTextUtils.splitArguments("  ").isEmpty());
    }

    @Test
    void testMapStatementsKeepsSeparators() {
        String out = SqlTextUtils.mapStatements("select 1; select (2;3);\n", String::toUpperCase);
        assertEquals("SELECT 1; SELECT (2;3);\n", out, "括号内的分号不拆分");

        String dropped = SqlTextUtils.mapStatements("a;b;c", s -> "b".equals(s) ? null : s);
        assertEquals("a;c", dropped, "返回 null 时删除语句及其分号");
    }

    @Test
    void testCountStatements() {
        assertEquals(2, SqlTextUtils.countStatements("select 1; select 2;  "));
        assertEquals(0, SqlTextUtils.countStatements(" ; "));
    }

    @Test
    void testFindTopLevelKeyword() {
        String s = "SELECT (SELECT x FROM a WHERE y) FROM t WHERE z = 1";
        assertEquals(s.lastIndexOf("WHERE"), SqlTextUtils.findTopLevelKeyword(s, "WHERE", 0), "忽略子查询中的关键字");
        assertEquals(-1, SqlTextUtils.findTopLevelKeyword(s, "GROUP BY", 0));
    }

    @Test
    void testUnqualifyAndShortSql() {
        assertEquals("emp_id", SqlTextUtils.unqualify("hr.e.emp_id"));
        assertEquals("SELECT 1 FROM t", SqlTextUtils.shortSql("  SELECT 1\n   FROM t "));
        assertEquals("line 2, column 3", SqlTextUtils.lineColumn("ab\ncd", 5));
    }
}
