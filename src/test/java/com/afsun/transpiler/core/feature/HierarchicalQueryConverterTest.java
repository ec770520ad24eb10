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
 * CONNECT BY 改写为 WITH RECURSIVE
 */
class HierarchicalQueryConverterTest {

    private HierarchicalQueryConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new HierarchicalQueryConverter(new HierarchicalQueryRewriter());
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, Dialect.ORACLE);
        ConversionContext ctx = new ConversionContext(Dialect.ORACLE, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testSimpleTree() {
        String out = convert("SELECT id, name, LEVEL FROM emp START WITH mgr_id IS NULL CONNECT BY PRIOR id = mgr_id",
                Dialect.POSTGRESQL);

        assertEquals("WITH RECURSIVE h_tree AS (\n"
                + "  SELECT emp.*, 1 AS lvl FROM emp WHERE mgr_id IS NULL\n"
                + "  UNION ALL\n"
                + "  SELECT c.*, p.lvl + 1 FROM emp c JOIN h_tree p ON c.mgr_id = p.id\n"
                + ")\n"
                + "SELECT id, name, lvl FROM h_tree emp", out);
        assertTrue(acc.getAppliedRules().contains("CONNECT BY -> WITH RECURSIVE"));
    }

    @Test
    void testLevelRowGenerator() {
        String out = convert("SELECT LEVEL FROM dual CONNECT BY LEVEL <= 5", Dialect.MYSQL);

        assertEquals("WITH RECURSIVE h_tree (lvl) AS (\n"
                + "  SELECT 1\n"
                + "  UNION ALL\n"
                + "  SELECT lvl + 1 FROM h_tree WHERE lvl < 5\n"
                + ")\n"
                + "SELECT lvl FROM h_tree", out);
    }

    @Test
    void testSysConnectByPathNeedsManualReview() {
        String sql = "SELECT SYS_CONNECT_BY_PATH(name, '/') FROM emp START WITH mgr_id IS NULL CONNECT BY PRIOR id = mgr_id";

        assertEquals(sql, convert(sql, Dialect.POSTGRESQL), "无法改写时保留原文");
        assertEquals(WarningType.MANUAL_REVIEW_NEEDED, acc.getWarnings().get(0).getType());
        assertTrue(acc.getWarnings().get(0).getMessage().contains("SYS_CONNECT_BY_PATH"));
    }

    @Test
    void testRewriterReportsJoinSource() {
        HierarchicalQueryRewriter.Result result = new HierarchicalQueryRewriter()
                .rewrite("SELECT e.id FROM emp e JOIN dept d ON e.dept_id = d.id CONNECT BY PRIOR e.id = e.mgr_id");

        assertFalse(result.isRewritten());
        assertNotNull(result.getReason());
    }
}
