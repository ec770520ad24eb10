package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.MaskedSql;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 递归 CTE 关键字补充与移除
 */
class CteConverterTest {

    private static final String BODY = " r (n) AS (SELECT 1 FROM dual UNION ALL SELECT n + 1 FROM r WHERE n < 5) SELECT n FROM r";

    private CteConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new CteConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect source, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, source);
        ConversionContext ctx = new ConversionContext(source, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testAddRecursiveForMySql() {
        assertEquals("WITH RECURSIVE" + BODY, convert("WITH" + BODY, Dialect.ORACLE, Dialect.MYSQL));
        assertTrue(acc.getAppliedRules().contains("CTE RECURSIVE added"));
    }

    @Test
    void testRemoveRecursiveForOracle() {
        assertEquals("WITH" + BODY, convert("WITH RECURSIVE" + BODY, Dialect.POSTGRESQL, Dialect.ORACLE));
        assertTrue(acc.getAppliedRules().contains("CTE RECURSIVE removed"));
    }

    @Test
    void testOracleRequiresColumnList() {
        convert("WITH RECURSIVE r AS (SELECT 1 AS n UNION ALL SELECT n + 1 FROM r WHERE n < 5) SELECT n FROM r",
                Dialect.MYSQL, Dialect.ORACLE);
        assertFalse(acc.getWarnings().isEmpty(), "缺少列清单时应提示");
    }

    @Test
    void testNonRecursiveUnchanged() {
        String sql = "WITH a AS (SELECT 1 AS x FROM dual) SELECT x FROM a";
        assertEquals(sql, convert(sql, Dialect.ORACLE, Dialect.POSTGRESQL));
    }

    @Test
    void testMaterializedHintRemoved() {
        assertEquals("WITH a AS (SELECT 1) SELECT * FROM a",
                convert("WITH a AS MATERIALIZED (SELECT 1) SELECT * FROM a", Dialect.POSTGRESQL, Dialect.MYSQL));
    }
}
