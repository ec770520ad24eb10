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
 * PIVOT / UNPIVOT 展开
 */
class PivotUnpivotConverterTest {

    private PivotUnpivotConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new PivotUnpivotConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, Dialect.ORACLE);
        ConversionContext ctx = new ConversionContext(Dialect.ORACLE, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testPivot() {
        String out = convert("SELECT dept, q1, q2 FROM sales PIVOT (SUM(amount) FOR quarter IN ('Q1' AS q1, 'Q2' AS q2))",
                Dialect.MYSQL);

        assertEquals("SELECT dept, q1, q2 FROM (SELECT dept, SUM(CASE WHEN quarter = 'Q1' THEN amount END) AS q1, "
                + "SUM(CASE WHEN quarter = 'Q2' THEN amount END) AS q2 FROM sales GROUP BY dept) pvt", out);
        assertTrue(acc.getAppliedRules().contains("PIVOT -> CASE WHEN + GROUP BY"));
    }

    @Test
    void testUnpivot() {
        String out = convert("SELECT id, quarter, amount FROM sales UNPIVOT (amount FOR quarter IN (q1 AS 'Q1', q2 AS 'Q2'))",
                Dialect.POSTGRESQL);

        assertEquals("SELECT id, quarter, amount FROM (SELECT id, 'Q1' AS quarter, q1 AS amount FROM sales WHERE q1 IS NOT NULL"
                + " UNION ALL SELECT id, 'Q2' AS quarter, q2 AS amount FROM sales WHERE q2 IS NOT NULL) unpvt", out);
        assertTrue(acc.getWarnings().stream().anyMatch(w -> w.getType() == WarningType.PERFORMANCE));
    }

    @Test
    void testPivotWithoutGroupColumns() {
        String sql = "SELECT * FROM sales PIVOT (SUM(amount) FOR quarter IN ('Q1' AS q1))";

        assertEquals(sql, convert(sql, Dialect.MYSQL), "分组列无法确定时保留原文");
        assertEquals(WarningType.MANUAL_REVIEW_NEEDED, acc.getWarnings().get(0).getType());
    }

    @Test
    void testPivotXmlNotExpanded() {
        String sql = "SELECT * FROM sales PIVOT XML (SUM(amount) FOR quarter IN (ANY))";

        assertEquals(sql, convert(sql, Dialect.POSTGRESQL));
        assertEquals(1, acc.getWarnings().size());
    }
}
