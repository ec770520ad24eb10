package com.afsun.transpiler.core;

import com.afsun.transpiler.core.config.ConverterProperties;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.dialect.DialectConverterRegistry;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.afsun.transpiler.core.exceptions.UnsupportedDialectException;
import com.afsun.transpiler.core.feature.FeatureConverterChain;
import com.afsun.transpiler.core.parser.DruidStructuralParser;
import com.afsun.transpiler.core.parser.ParseOutcome;
import com.afsun.transpiler.core.parser.StructuralParser;
import com.afsun.transpiler.core.preprocess.SyntaxPreprocessor;
import com.afsun.transpiler.core.recovery.RecoveryService;
import com.afsun.transpiler.core.split.LargeInputSplitter;
import com.afsun.transpiler.core.validation.SqlValidationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DefaultSqlConverterTest {

    private DefaultSqlConverter converter;

    @BeforeEach
    void setUp() {
        converter = new DefaultSqlConverter();
    }

    private ConversionResult convert(String sql, Dialect source, Dialect target) {
        return converter.convert(sql, source, target, RuleConfig.defaults());
    }

    private static DefaultSqlConverter withParts(StructuralParser parser, LargeInputSplitter splitter) {
        return new DefaultSqlConverter(new SyntaxPreprocessor(), parser, RecoveryService.createDefault(),
                FeatureConverterChain.createDefault(), DialectConverterRegistry.createDefault(),
                new SqlValidationService(), splitter);
    }

    @Test
    void testNvlToMySql() {
        ConversionResult result = convert("SELECT NVL(a,0) FROM t", Dialect.ORACLE, Dialect.MYSQL);

        assertEquals("SELECT IFNULL(a,0) FROM t", result.getConvertedSql());
        assertTrue(result.getAppliedRules().stream().anyMatch(r -> r.contains("NVL")), "应记录 NVL 规则");
        assertTrue(result.isSuccess());
        assertEquals(RecoveryState.NOT_NEEDED, result.getRecoveryState());
        assertTrue(result.getValidation().isPassed());
        assertNotNull(result.getComplexity());
        assertEquals(1, result.getComplexity().getStatementCount());
    }

    @Test
    void testBitmapIndexToMySql() {
        ConversionResult result = convert("CREATE BITMAP INDEX idx ON t(c)", Dialect.ORACLE, Dialect.MYSQL);

        assertEquals("CREATE INDEX idx ON t(c)", result.getConvertedSql());
        assertTrue(result.getWarnings().stream()
                .anyMatch(w -> w.getType() == WarningType.UNSUPPORTED_FUNCTION && w.getMessage().contains("BITMAP")));
    }

    @Test
    void testOnConflictToInsertIgnore() {
        ConversionResult result = convert("INSERT INTO t VALUES(1) ON CONFLICT (id) DO NOTHING",
                Dialect.POSTGRESQL, Dialect.MYSQL);
        assertEquals("INSERT IGNORE INTO t VALUES(1)", result.getConvertedSql());
    }

    @Test
    void testMergeDeleteBranchWarns() {
        ConversionResult result = convert("MERGE INTO t USING s ON (t.id = s.id) WHEN MATCHED THEN DELETE "
                + "WHEN NOT MATCHED THEN INSERT (id) VALUES (s.id)", Dialect.ORACLE, Dialect.POSTGRESQL);

        assertTrue(result.getWarnings().stream()
                .anyMatch(w -> w.getType() == WarningType.PARTIAL_SUPPORT && w.getMessage().contains("DELETE")));
    }

    @Test
    void testUnbalancedParenthesisRecovered() {
        ConversionResult result = convert("SELECT * FROM t WHERE id IN (1,2,3", Dialect.ORACLE, Dialect.MYSQL);

        assertEquals("SELECT * FROM t WHERE id IN (1,2,3)", result.getConvertedSql());
        assertEquals(RecoveryState.RECOVERED, result.getRecoveryState());
        assertTrue(result.getAppliedRules().contains("Parse recovery: parenthesis-balance repair"));
        assertTrue(result.getValidation().isBracketsBalanced());
        assertTrue(result.isSuccess(), "修复后没有 ERROR 级告警");
    }

    @Test
    void testRoundTripNvl() {
        String mysql = convert("SELECT NVL(a,0) FROM t", Dialect.ORACLE, Dialect.MYSQL).getConvertedSql();
        assertEquals("SELECT NVL(a,0) FROM t", convert(mysql, Dialect.MYSQL, Dialect.ORACLE).getConvertedSql());
    }

    @Test
    void testUnchangedSqlRecordsNoRule() {
        String sql = "SELECT a, b FROM t WHERE a = 1";
        ConversionResult result = convert(sql, Dialect.ORACLE, Dialect.POSTGRESQL);

        assertEquals(sql, result.getConvertedSql());
        assertTrue(result.getAppliedRules().isEmpty(), "文本没有变化时不应记录规则");
    }

    @Test
    void testLiteralAndCommentUntouched() {
        String sql = "SELECT 'SYSDATE NVL(x,1)' AS s -- NVL(a,0)\nFROM t";
        ConversionResult result = convert(sql, Dialect.ORACLE, Dialect.MYSQL);

        assertEquals(sql, result.getConvertedSql());
        assertTrue(result.getAppliedRules().isEmpty());
    }

    @Test
    void testMySqlBackslashLiteralToPostgres() {
        ConversionResult result = convert("SELECT 'it\\'s' AS x FROM t", Dialect.MYSQL, Dialect.POSTGRESQL);

        assertEquals("SELECT 'it''s' AS x FROM t", result.getConvertedSql());
        assertTrue(result.getAppliedRules().contains("String literal quoting converted"));
        assertTrue(result.getValidation().isQuotesBalanced(), "转换结果引号应配对");
    }

    @Test
    void testMySqlEscapedBackslashToOracle() {
        ConversionResult result = convert("SELECT 'a\\\\' AS x FROM t", Dialect.MYSQL, Dialect.ORACLE);

        assertEquals("SELECT 'a\\' AS x FROM t", result.getConvertedSql());
        assertTrue(result.getValidation().isQuotesBalanced());
    }

    @Test
    void testOracleQuoteLiteralToPostgres() {
        ConversionResult result = convert("SELECT q'[it's]' FROM dual", Dialect.ORACLE, Dialect.POSTGRESQL);

        assertEquals("SELECT 'it''s'", result.getConvertedSql());
        assertTrue(result.getValidation().isQuotesBalanced());
        assertEquals(RecoveryState.NOT_NEEDED, result.getRecoveryState(), "改写后应能直接解析");
        assertTrue(result.getAppliedRules().contains("Oracle q-quote literal -> standard literal"));
    }

    @Test
    void testOracleOuterJoinToPostgres() {
        ConversionResult result = convert("SELECT e.name, d.dname FROM emp e, dept d WHERE e.deptno = d.deptno(+)",
                Dialect.ORACLE, Dialect.POSTGRESQL);

        assertEquals("SELECT e.name, d.dname FROM emp e LEFT JOIN dept d ON e.deptno = d.deptno",
                result.getConvertedSql());
        assertFalse(result.getConvertedSql().contains("(+)"));
    }

    @Test
    void testSameDialect() {
        String sql = "SELECT NVL(a,0) FROM t";
        ConversionResult result = convert(sql, Dialect.ORACLE, Dialect.ORACLE);

        assertEquals(sql, result.getConvertedSql());
        assertTrue(result.getAppliedRules().isEmpty());
        assertEquals(1, result.getWarnings().size());
        assertEquals(WarningSeverity.INFO, result.getWarnings().get(0).getSeverity());
    }

    @Test
    void testBlankInput() {
        ConversionResult result = convert("   ", Dialect.ORACLE, Dialect.MYSQL);

        assertEquals("", result.getConvertedSql());
        assertTrue(result.getWarnings().isEmpty());
        assertTrue(result.isSuccess());
    }

    @Test
    void testNullDialectRejected() {
        assertThrows(UnsupportedDialectException.class,
                () -> converter.convert("SELECT 1 FROM dual", null, Dialect.MYSQL, null));
        assertThrows(UnsupportedDialectException.class,
                () -> converter.convert("SELECT 1 FROM dual", Dialect.ORACLE, null, null));
    }

    @Test
    void testNullRuleConfigUsesDefaults() {
        ConversionResult result = converter.convert("SELECT NVL(a,0) FROM t", Dialect.ORACLE, Dialect.MYSQL, null);
        assertEquals("SELECT IFNULL(a,0) FROM t", result.getConvertedSql());
    }

    @Test
    void testUnparseableSqlStillConverted() {
        StructuralParser parser = mock(StructuralParser.class);
        when(parser.parse(anyString(), any(Dialect.class)))
                .thenReturn(ParseOutcome.failure(new SqlParseException("unexpected token", -1, -1, "NVL(a,0)")));
        DefaultSqlConverter broken = withParts(parser, new LargeInputSplitter(new ConverterProperties()));

        ConversionResult result = broken.convert("SELECT NVL(a,0) FROM t", Dialect.ORACLE, Dialect.MYSQL, null);

        assertEquals("SELECT IFNULL(a,0) FROM t", result.getConvertedSql(), "无法解析时仍按文本规则转换");
        assertEquals(RecoveryState.UNRECOVERED, result.getRecoveryState());
        assertNull(result.getComplexity());
        assertTrue(result.hasErrors());
        assertFalse(result.isSuccess());
    }

    @Test
    void testLargeInputConvertedInChunks() {
        LargeInputSplitter splitter = new LargeInputSplitter(20, 1, 2);
        try {
            DefaultSqlConverter chunked = withParts(new DruidStructuralParser(), splitter);

            ConversionResult result = chunked.convert("SELECT NVL(a,0) FROM t1;\nSELECT NVL(b,0) FROM t2;",
                    Dialect.ORACLE, Dialect.MYSQL, null);

            assertEquals(2, result.getChunkCount());
            assertEquals("SELECT IFNULL(a,0) FROM t1;\nSELECT IFNULL(b,0) FROM t2;", result.getConvertedSql());
            assertEquals(2, result.getComplexity().getStatementCount());
            assertTrue(result.isSuccess());
        } finally {
            splitter.shutdown();
        }
    }
}
