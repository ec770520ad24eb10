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
 * 当前时间函数、DUAL、集合运算符、字符串拼接与伪列
 */
class PseudoColumnConverterTest {

    private PseudoColumnConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new PseudoColumnConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect source, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, source);
        ConversionContext ctx = new ConversionContext(source, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testSysdate() {
        assertEquals("SELECT NOW() FROM dual", convert("SELECT SYSDATE FROM dual", Dialect.ORACLE, Dialect.MYSQL));
        assertEquals("SELECT CURRENT_TIMESTAMP", convert("SELECT SYSDATE FROM dual", Dialect.ORACLE, Dialect.POSTGRESQL));
    }

    @Test
    void testNowToOracleAddsDual() {
        assertEquals("SELECT SYSDATE FROM DUAL", convert("SELECT NOW()", Dialect.MYSQL, Dialect.ORACLE));
        assertTrue(acc.getAppliedRules().contains("Bare SELECT -> FROM DUAL"));
    }

    @Test
    void testMinusToExcept() {
        assertEquals("SELECT a FROM t EXCEPT SELECT a FROM u",
                convert("SELECT a FROM t MINUS SELECT a FROM u", Dialect.ORACLE, Dialect.POSTGRESQL));
        assertEquals("SELECT a FROM t MINUS SELECT a FROM u",
                convert("SELECT a FROM t EXCEPT SELECT a FROM u", Dialect.POSTGRESQL, Dialect.ORACLE));
    }

    @Test
    void testPipesToConcat() {
        assertEquals("SELECT CONCAT(a, b, c) FROM t", convert("SELECT a || b || c FROM t", Dialect.ORACLE, Dialect.MYSQL));
        assertTrue(acc.getWarnings().stream().anyMatch(w -> w.getType() == WarningType.SYNTAX_DIFFERENCE),
                "NULL 拼接语义不同，应给出告警");
    }

    @Test
    void testPipesInsideLiteralKept() {
        String sql = "SELECT 'a || b' FROM t";
        assertEquals(sql, convert(sql, Dialect.ORACLE, Dialect.MYSQL));
    }

    @Test
    void testRownumOnlyWarns() {
        String sql = "SELECT * FROM t WHERE ROWNUM <= 10";
        assertEquals(sql, convert(sql, Dialect.ORACLE, Dialect.MYSQL));
        assertEquals(WarningType.MANUAL_REVIEW_NEEDED, acc.getWarnings().get(0).getType());
    }
}
