package com.afsun.transpiler.core.preprocess;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.config.RuleConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 预处理流水线测试：物理存储语法的移除、幂等性、目标为 Oracle 时保留原文
 */
class SyntaxPreprocessorTest {

    private SyntaxPreprocessor preprocessor;

    @BeforeEach
    void setUp() {
        preprocessor = new SyntaxPreprocessor();
    }

    @Test
    void testRemoveOracleStorageClauses() {
        String sql = "CREATE TABLE hr.emp (id NUMBER, created DATE DEFAULT SYSDATE) TABLESPACE users PCTFREE 10 NOLOGGING";
        ConversionAccumulator acc = new ConversionAccumulator();

        String out = preprocessor.preprocess(sql, Dialect.ORACLE, Dialect.MYSQL, RuleConfig.defaults(), acc);

        assertEquals("CREATE TABLE emp (id NUMBER, created DATE DEFAULT CURRENT_TIMESTAMP)", out);
        assertTrue(acc.getAppliedRules().contains("DDL TABLESPACE removed"), "应记录 TABLESPACE 规则");
        assertTrue(acc.getAppliedRules().contains("DDL LOGGING removed"), "应记录 LOGGING 规则");
        assertTrue(acc.getAppliedRules().contains("DDL schema prefix removed"), "应记录 schema 前缀规则");
    }

    @Test
    void testSchemaPrefixKeepsJoinConditionInViewBody() {
        String sql = "CREATE VIEW hr.v_emp AS SELECT e.name, d.dname FROM emp e JOIN dept d ON e.deptno = d.deptno";

        String out = preprocessor.preprocess(sql, Dialect.ORACLE, Dialect.POSTGRESQL, RuleConfig.defaults(),
                new ConversionAccumulator());

        assertEquals("CREATE VIEW v_emp AS SELECT e.name, d.dname FROM emp e JOIN dept d ON e.deptno = d.deptno", out,
                "查询体中 ON 后的 alias.column 不应被改写");
    }

    @Test
    void testSchemaPrefixKeepsJoinConditionInCtas() {
        String sql = "CREATE TABLE hr.x AS SELECT a.id FROM a JOIN b ON a.id = b.id";

        String out = preprocessor.preprocess(sql, Dialect.ORACLE, Dialect.MYSQL, RuleConfig.defaults(),
                new ConversionAccumulator());

        assertEquals("CREATE TABLE x AS SELECT a.id FROM a JOIN b ON a.id = b.id", out);
    }

    @Test
    void testSchemaPrefixStrippedFromIndexTarget() {
        String out = preprocessor.preprocess("CREATE INDEX hr.idx_emp ON hr.emp(a)", Dialect.ORACLE,
                Dialect.POSTGRESQL, RuleConfig.defaults(), new ConversionAccumulator());

        assertEquals("CREATE INDEX idx_emp ON emp(a)", out);
    }

    @Test
    void testIdempotent() {
        String sql = "CREATE TABLE t (id NUMBER) TABLESPACE users LOGGING COMPRESS;\n\n\n"
                + "CREATE INDEX idx_t ON t(id) LOCAL TABLESPACE idx_ts;";
        String once = preprocessor.preprocess(sql, Dialect.POSTGRESQL);
        String twice = preprocessor.preprocess(once, Dialect.POSTGRESQL);

        assertEquals(once, twice, "预处理应幂等");
        assertFalse(once.toUpperCase().contains("TABLESPACE"), "TABLESPACE 应被移除");
    }

    @Test
    void testOracleTargetKeepsPhysicalAttributes() {
        String sql = "CREATE TABLE t (id NUMBER) TABLESPACE users PCTFREE 10";
        String out = preprocessor.preprocess(sql, Dialect.ORACLE, Dialect.ORACLE, RuleConfig.defaults(),
                new ConversionAccumulator());

        assertEquals(sql, out, "目标为 Oracle 时物理属性应原样保留");
    }

    @Test
    void testLiteralsAreNotTouched() {
        String sql = "INSERT INTO t VALUES ('TABLESPACE users')";
        assertEquals(sql, preprocessor.preprocess(sql, Dialect.MYSQL), "字符串中的关键字不应被处理");
    }

    @Test
    void testMySqlTableOptionsToPostgres() {
        String sql = "CREATE TABLE t (id INT COMMENT 'pk') ENGINE=InnoDB DEFAULT CHARSET=utf8 COMMENT='users'";
        ConversionAccumulator acc = new ConversionAccumulator();

        String out = preprocessor.preprocess(sql, Dialect.MYSQL, Dialect.POSTGRESQL, RuleConfig.defaults(), acc);

        assertTrue(out.startsWith("CREATE TABLE t (id INT);"), "表选项和列注释应移除: " + out);
        assertTrue(out.contains("COMMENT ON TABLE t IS 'users'"), "表注释应改为 COMMENT ON TABLE");
        assertTrue(out.contains("COMMENT ON COLUMN t.id IS 'pk'"), "列注释应改为 COMMENT ON COLUMN");
        assertFalse(out.contains("ENGINE"));
    }

    @Test
    void testBlankInput() {
        assertEquals("", preprocessor.preprocess("   ", Dialect.MYSQL));
        assertNull(preprocessor.preprocess(null, Dialect.MYSQL));
    }
}
