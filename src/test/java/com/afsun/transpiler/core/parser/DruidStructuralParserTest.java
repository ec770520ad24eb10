package com.afsun.transpiler.core.parser;

import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.StatementComplexity;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DruidStructuralParserTest {

    private DruidStructuralParser parser;

    @BeforeEach
    void setUp() {
        parser = new DruidStructuralParser();
    }

    @Test
    void testParseJoinAndSubquery() {
        ParseOutcome outcome = parser.parse("SELECT a.id FROM t1 a JOIN t2 b ON a.id = b.id "
                + "WHERE a.type IN (SELECT type FROM t3)", Dialect.MYSQL);

        assertTrue(outcome.isSuccess());
        assertEquals(1, outcome.getStatementCount());
        StatementComplexity complexity = outcome.getComplexity();
        assertEquals(1, complexity.getStatementCount());
        assertEquals(1, complexity.getJoinCount());
        assertTrue(complexity.getSubqueryCount() >= 1);
    }

    @Test
    void testCountFunctionsAndAggregates() {
        ParseOutcome outcome = parser.parse("SELECT dept, COUNT(*), UPPER(MAX(name)), "
                + "ROW_NUMBER() OVER (ORDER BY dept) FROM emp GROUP BY dept", Dialect.POSTGRESQL);

        assertTrue(outcome.isSuccess());
        StatementComplexity complexity = outcome.getComplexity();
        assertEquals(2, complexity.getAggregateCount());
        assertEquals(1, complexity.getWindowFunctionCount());
        assertTrue(complexity.getFunctionCount() >= 1);
    }

    @Test
    void testCountCte() {
        ParseOutcome outcome = parser.parse("WITH a AS (SELECT 1 AS x FROM dual), b AS (SELECT x FROM a) "
                + "SELECT x FROM b", Dialect.ORACLE);

        assertTrue(outcome.isSuccess());
        assertEquals(2, outcome.getComplexity().getCteCount());
    }

    @Test
    void testOracleJoinAndSubqueryCounted() {
        ParseOutcome outcome = parser.parse("SELECT e.name FROM emp e JOIN dept d ON e.deptno = d.deptno "
                + "WHERE EXISTS (SELECT 1 FROM bonus b WHERE b.ename = e.name)", Dialect.ORACLE);

        assertTrue(outcome.isSuccess());
        assertNotNull(outcome.getComplexity());
        assertEquals(1, outcome.getComplexity().getJoinCount());
        assertTrue(outcome.getComplexity().getSubqueryCount() >= 1);
    }

    @Test
    void testComplexityForDialectDdl() {
        ParseOutcome oracle = parser.parse("CREATE TABLE t (a NUMBER(10), b VARCHAR2(20))", Dialect.ORACLE);
        ParseOutcome mysql = parser.parse("CREATE TABLE t (a INT AUTO_INCREMENT PRIMARY KEY) ENGINE=InnoDB", Dialect.MYSQL);
        ParseOutcome pg = parser.parse("CREATE TABLE t (a SERIAL, b JSONB)", Dialect.POSTGRESQL);

        assertNotNull(oracle.getComplexity(), "Oracle 节点需用 Oracle visitor 统计");
        assertNotNull(mysql.getComplexity());
        assertNotNull(pg.getComplexity());
        assertEquals(1, oracle.getComplexity().getStatementCount());
    }

    @Test
    void testVisitorMatchesDialect() {
        assertTrue(StatementComplexityVisitor.forDialect(Dialect.ORACLE) instanceof OracleComplexityVisitor);
        assertTrue(StatementComplexityVisitor.forDialect(Dialect.MYSQL) instanceof MySqlComplexityVisitor);
        assertTrue(StatementComplexityVisitor.forDialect(Dialect.POSTGRESQL) instanceof PGComplexityVisitor);
    }

    @Test
    void testMultipleStatements() {
        ParseOutcome outcome = parser.parse("SELECT 1 FROM dual; SELECT 2 FROM dual;", Dialect.ORACLE);
        assertEquals(2, outcome.getStatementCount());
    }

    @Test
    void testParseFailure() {
        ParseOutcome outcome = parser.parse("SELECT * FROM t WHERE id IN (1,2,3", Dialect.ORACLE);

        assertFalse(outcome.isSuccess());
        assertNotNull(outcome.getError());
        assertEquals(0, outcome.getStatementCount());
        assertNull(outcome.getComplexity());
    }

    @Test
    void testErrorPositionFromMessage() {
        SqlParseException e = DruidStructuralParser.toParseException(
                "syntax error, pos 15, line 2, column 6, token EOF", "SELECT a\nFROM (  ");

        assertEquals(2, e.getLine());
        assertEquals(6, e.getColumn());
        assertEquals("line 2, column 6", e.position());
        assertEquals("FROM (", e.getSqlFragment(), "取出错行作为片段");

        SqlParseException noPosition = DruidStructuralParser.toParseException("unexpected", "SELECT 1");
        assertFalse(noPosition.hasPosition());
        assertEquals("SELECT 1", noPosition.getSqlFragment());
    }
}
