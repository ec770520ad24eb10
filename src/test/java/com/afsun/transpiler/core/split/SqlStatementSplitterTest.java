package com.afsun.transpiler.core.split;

import com.afsun.transpiler.core.Dialect;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlStatementSplitterTest {

    @Test
    void testSplitBySemicolon() {
        List<String> statements = SqlStatementSplitter.split("SELECT 1 FROM dual;\n  SELECT 2 FROM dual;", Dialect.ORACLE);
        assertEquals(Arrays.asList("SELECT 1 FROM dual;", "SELECT 2 FROM dual;"), statements);
    }

    @Test
    void testSemicolonInLiteralAndComment() {
        List<String> statements = SqlStatementSplitter.split(
                "SELECT ';' FROM dual; -- a;b\nSELECT 2 FROM dual", Dialect.ORACLE);

        assertEquals(2, statements.size());
        assertEquals("SELECT ';' FROM dual;", statements.get(0));
        assertEquals("-- a;b\nSELECT 2 FROM dual", statements.get(1), "注释跟随下一条语句");
    }

    @Test
    void testOracleProcedureEndsAtSlash() {
        String procedure = "CREATE OR REPLACE PROCEDURE p IS\nBEGIN\n  NULL;\nEND;\n/";
        List<String> statements = SqlStatementSplitter.split(procedure + "\nSELECT 1 FROM dual;", Dialect.ORACLE);

        assertEquals(Arrays.asList(procedure, "SELECT 1 FROM dual;"), statements);
    }

    @Test
    void testBlockWithoutSlash() {
        String block = "BEGIN\n  NULL;\nEND;";

        assertEquals(1, SqlStatementSplitter.split(block, Dialect.ORACLE).size(), "Oracle 下延续到脚本末尾");
        assertEquals(Arrays.asList("BEGIN\n  NULL;", "END;"), SqlStatementSplitter.split(block, Dialect.MYSQL));
    }

    @Test
    void testBlankInput() {
        assertTrue(SqlStatementSplitter.split("  \n ", Dialect.ORACLE).isEmpty());
        assertTrue(SqlStatementSplitter.split(null, Dialect.ORACLE).isEmpty());
        assertTrue(SqlStatementSplitter.split(";;", Dialect.ORACLE).isEmpty());
    }
}
