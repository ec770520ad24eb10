package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.MaskedSql;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 物化视图在三种库之间的转换
 */
class MaterializedViewConverterTest {

    private static final String ORACLE_MV = "CREATE MATERIALIZED VIEW mv_sales BUILD IMMEDIATE REFRESH COMPLETE ON DEMAND"
            + " AS SELECT dept, SUM(amount) total FROM sales GROUP BY dept";

    private MaterializedViewConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new MaterializedViewConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect source, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, source);
        ConversionContext ctx = new ConversionContext(source, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testMySqlEmulation() {
        String out = convert(ORACLE_MV, Dialect.ORACLE, Dialect.MYSQL);

        assertEquals("CREATE TABLE mv_sales AS SELECT dept, SUM(amount) total FROM sales GROUP BY dept;\n"
                + "CREATE PROCEDURE mv_sales_refresh() BEGIN TRUNCATE TABLE mv_sales; "
                + "INSERT INTO mv_sales SELECT dept, SUM(amount) total FROM sales GROUP BY dept; END", out);
        assertEquals(WarningType.PARTIAL_SUPPORT, acc.getWarnings().get(0).getType());
        assertTrue(acc.getWarnings().get(0).getSuggestion().contains("调度"), "需提示刷新调度由外部负责");
    }

    @Test
    void testPostgresOptions() {
        String out = convert("CREATE MATERIALIZED VIEW mv REFRESH FAST ON COMMIT AS SELECT * FROM t",
                Dialect.ORACLE, Dialect.POSTGRESQL);

        assertEquals("CREATE MATERIALIZED VIEW mv AS SELECT * FROM t WITH DATA", out);
        assertTrue(acc.getWarnings().stream().anyMatch(w -> w.getType() == WarningType.UNSUPPORTED_FUNCTION));
        assertTrue(acc.getWarnings().stream().anyMatch(w -> w.getType() == WarningType.PARTIAL_SUPPORT));
    }

    @Test
    void testPostgresToOracle() {
        assertEquals("CREATE MATERIALIZED VIEW mv BUILD DEFERRED REFRESH COMPLETE ON DEMAND AS SELECT a FROM t",
                convert("CREATE MATERIALIZED VIEW mv AS SELECT a FROM t WITH NO DATA", Dialect.POSTGRESQL, Dialect.ORACLE));
    }

    @Test
    void testRefreshAndDrop() {
        assertEquals("CALL mv_sales_refresh()",
                convert("REFRESH MATERIALIZED VIEW mv_sales", Dialect.POSTGRESQL, Dialect.MYSQL));
        assertEquals("DROP TABLE IF EXISTS mv_sales;\nDROP PROCEDURE IF EXISTS mv_sales_refresh",
                convert("DROP MATERIALIZED VIEW mv_sales", Dialect.ORACLE, Dialect.MYSQL));
    }
}
