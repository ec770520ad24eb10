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
 * 日期加减、月份运算与日期截断
 */
class DateArithmeticConverterTest {

    private DateArithmeticConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new DateArithmeticConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect source, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, source);
        ConversionContext ctx = new ConversionContext(source, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testNormalize() {
        assertArrayEquals(new String[]{"1", "DAY"}, DateArithmeticConverter.normalize("1", null));
        assertArrayEquals(new String[]{"1", "HOUR"}, DateArithmeticConverter.normalize("1", "24"));
        assertArrayEquals(new String[]{"30", "MINUTE"}, DateArithmeticConverter.normalize("30", "1440"));
        assertNull(DateArithmeticConverter.normalize("1", "0"));
    }

    @Test
    void testSysdatePlusDays() {
        assertEquals("SELECT SYSDATE + INTERVAL 1 DAY FROM dual",
                convert("SELECT SYSDATE + 1 FROM dual", Dialect.ORACLE, Dialect.MYSQL));
        assertEquals("SELECT SYSDATE - INTERVAL '1 hour' FROM dual",
                convert("SELECT SYSDATE - 1/24 FROM dual", Dialect.ORACLE, Dialect.POSTGRESQL));
    }

    @Test
    void testAddMonths() {
        assertEquals("SELECT DATE_ADD(hire_date, INTERVAL 3 MONTH) FROM emp",
                convert("SELECT ADD_MONTHS(hire_date, 3) FROM emp", Dialect.ORACLE, Dialect.MYSQL));
        assertEquals("SELECT (hire_date + INTERVAL '3 month') FROM emp",
                convert("SELECT ADD_MONTHS(hire_date, 3) FROM emp", Dialect.ORACLE, Dialect.POSTGRESQL));
    }

    @Test
    void testMonthsBetweenWarns() {
        assertEquals("SELECT TIMESTAMPDIFF(MONTH, b, a) FROM t",
                convert("SELECT MONTHS_BETWEEN(a, b) FROM t", Dialect.ORACLE, Dialect.MYSQL));
        assertEquals(WarningType.PARTIAL_SUPPORT, acc.getWarnings().get(0).getType());
    }

    @Test
    void testTruncDate() {
        assertEquals("SELECT DATE_TRUNC('month', created) FROM t",
                convert("SELECT TRUNC(created, 'MM') FROM t", Dialect.ORACLE, Dialect.POSTGRESQL));
        assertEquals("SELECT DATE(SYSDATE) FROM dual",
                convert("SELECT TRUNC(SYSDATE) FROM dual", Dialect.ORACLE, Dialect.MYSQL));
    }

    @Test
    void testNumericTruncKept() {
        String sql = "SELECT TRUNC(amount) FROM t";
        assertEquals(sql, convert(sql, Dialect.ORACLE, Dialect.MYSQL), "无法确定参数是日期时不改写");
        assertTrue(acc.getAppliedRules().isEmpty());
    }

    @Test
    void testDateAddToOracle() {
        assertEquals("SELECT ADD_MONTHS(d, 2) FROM t",
                convert("SELECT DATE_ADD(d, INTERVAL 2 MONTH) FROM t", Dialect.MYSQL, Dialect.ORACLE));
        assertEquals("SELECT (d - 6 / 24) FROM t",
                convert("SELECT DATE_SUB(d, INTERVAL 6 HOUR) FROM t", Dialect.MYSQL, Dialect.ORACLE));
    }

    @Test
    void testDateSubToPostgres() {
        assertEquals("SELECT (d - INTERVAL '7 day') FROM t",
                convert("SELECT DATE_SUB(d, INTERVAL 7 DAY) FROM t", Dialect.MYSQL, Dialect.POSTGRESQL));
    }

    @Test
    void testDatediff() {
        assertEquals("SELECT (TRUNC(a) - TRUNC(b)) FROM t",
                convert("SELECT DATEDIFF(a, b) FROM t", Dialect.MYSQL, Dialect.ORACLE));
    }

    @Test
    void testPostgresIntervalToMySql() {
        assertEquals("SELECT now() - INTERVAL 1 DAY",
                convert("SELECT now() - INTERVAL '1 day'", Dialect.POSTGRESQL, Dialect.MYSQL));
    }

    @Test
    void testCompoundIntervalNeedsReview() {
        String sql = "SELECT now() - INTERVAL '1 day 2 hours'";
        assertEquals(sql, convert(sql, Dialect.POSTGRESQL, Dialect.MYSQL));
        assertEquals(WarningType.MANUAL_REVIEW_NEEDED, acc.getWarnings().get(0).getType());
    }

    @Test
    void testDateTruncToOracle() {
        assertEquals("SELECT TRUNC(created, 'MM') FROM t",
                convert("SELECT DATE_TRUNC('month', created) FROM t", Dialect.POSTGRESQL, Dialect.ORACLE));
    }
}
