package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.MaskedSql;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OuterJoinConverterTest {

    private OuterJoinConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new OuterJoinConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, Dialect.ORACLE);
        ConversionContext ctx = new ConversionContext(Dialect.ORACLE, target, RuleConfig.defaults(), masked);
        assertTrue(converter.isApplicable(masked.getText(), ctx));
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testTwoTableLeftJoin() {
        String out = convert("SELECT e.name, d.dname FROM emp e, dept d WHERE e.deptno = d.deptno(+)",
                Dialect.POSTGRESQL);

        assertEquals("SELECT e.name, d.dname FROM emp e LEFT JOIN dept d ON e.deptno = d.deptno", out);
        assertTrue(acc.getAppliedRules().contains("Outer join (+) -> LEFT JOIN"));
    }

    @Test
    void testMarkerOnLeftSideAndFilterKept() {
        String out = convert("SELECT e.name FROM emp e, dept d WHERE d.deptno(+) = e.deptno AND d.loc(+) = 'NY' "
                + "AND e.sal > 100 ORDER BY e.name", Dialect.MYSQL);

        assertEquals("SELECT e.name FROM emp e LEFT JOIN dept d ON d.deptno = e.deptno AND d.loc = 'NY' "
                + "WHERE e.sal > 100 ORDER BY e.name", out, "外连接表上的常量条件应放入 ON");
    }

    @Test
    void testThirdTableStaysInnerJoined() {
        String out = convert("SELECT * FROM a, b, c WHERE a.id = b.id AND a.id = c.id (+)", Dialect.POSTGRESQL);

        assertEquals("SELECT * FROM a CROSS JOIN b LEFT JOIN c ON a.id = c.id WHERE a.id = b.id", out);
    }

    @Test
    void testBetweenConditionNotSplit() {
        String out = convert("SELECT * FROM a, b WHERE a.id = b.id(+) AND a.d BETWEEN 1 AND 5", Dialect.MYSQL);

        assertEquals("SELECT * FROM a LEFT JOIN b ON a.id = b.id WHERE a.d BETWEEN 1 AND 5", out);
    }

    @Test
    void testNestedMarkerNeedsManualReview() {
        String sql = "SELECT * FROM t WHERE t.id IN (SELECT a.id FROM a, b WHERE a.id = b.id(+))";

        assertEquals(sql, convert(sql, Dialect.POSTGRESQL), "子查询中的 (+) 不自动改写");
        assertTrue(acc.getAppliedRules().isEmpty());
        assertEquals(WarningType.MANUAL_REVIEW_NEEDED, acc.getWarnings().get(0).getType());
        assertEquals(WarningSeverity.WARNING, acc.getWarnings().get(0).getSeverity());
    }

    @Test
    void testOracleTargetNotApplicable() {
        MaskedSql masked = MaskedSql.mask("SELECT * FROM a, b WHERE a.id = b.id(+)", Dialect.ORACLE);
        ConversionContext ctx = new ConversionContext(Dialect.ORACLE, Dialect.ORACLE, RuleConfig.defaults(), masked);

        assertFalse(converter.isApplicable(masked.getText(), ctx));
    }
}
