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

class SequenceConverterTest {

    private SequenceConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new SequenceConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect source, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, source);
        ConversionContext ctx = new ConversionContext(source, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testNextvalToPostgres() {
        assertEquals("INSERT INTO t (id) VALUES (nextval('seq_order'))",
                convert("INSERT INTO t (id) VALUES (seq_order.NEXTVAL)", Dialect.ORACLE, Dialect.POSTGRESQL));
    }

    @Test
    void testNextvalToOracle() {
        assertEquals("SELECT seq_order.NEXTVAL FROM dual",
                convert("SELECT nextval('seq_order') FROM dual", Dialect.POSTGRESQL, Dialect.ORACLE));
    }

    @Test
    void testNextvalToMySqlWarns() {
        String sql = "SELECT seq_order.NEXTVAL FROM dual";
        assertEquals(sql, convert(sql, Dialect.ORACLE, Dialect.MYSQL), "MySQL 没有等价写法时保留原文");
        assertEquals(WarningType.UNSUPPORTED_FUNCTION, acc.getWarnings().get(0).getType());
    }

    @Test
    void testCreateSequenceToMySql() {
        String out = convert("CREATE SEQUENCE seq_order START WITH 100 INCREMENT BY 1", Dialect.ORACLE, Dialect.MYSQL);

        assertEquals("CREATE TABLE seq_order (id BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY) AUTO_INCREMENT = 100", out);
        assertTrue(acc.getWarnings().stream().anyMatch(w -> w.getType() == WarningType.PARTIAL_SUPPORT));
    }

    @Test
    void testAutoIncrementToIdentity() {
        String out = convert("CREATE TABLE t (id INT NOT NULL AUTO_INCREMENT, name VARCHAR(10))",
                Dialect.MYSQL, Dialect.POSTGRESQL);

        assertTrue(out.contains("id INT GENERATED BY DEFAULT AS IDENTITY NOT NULL"), out);
        assertFalse(out.contains("AUTO_INCREMENT"));
    }

    @Test
    void testSerialToAutoIncrement() {
        String out = convert("CREATE TABLE t (id SERIAL PRIMARY KEY, name TEXT)", Dialect.POSTGRESQL, Dialect.MYSQL);
        assertTrue(out.contains("id INT AUTO_INCREMENT PRIMARY KEY"), out);
    }
}
