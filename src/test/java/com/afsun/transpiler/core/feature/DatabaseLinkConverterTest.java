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

class DatabaseLinkConverterTest {

    private DatabaseLinkConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new DatabaseLinkConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, Dialect.ORACLE);
        ConversionContext ctx = new ConversionContext(Dialect.ORACLE, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testCreateLinkTemplate() {
        String out = convert("CREATE DATABASE LINK hq CONNECT TO scott IDENTIFIED BY tiger USING 'hqdb'", Dialect.POSTGRESQL);

        assertTrue(out.startsWith("/* postgres_fdw 模板"), out);
        assertTrue(out.contains("CREATE SERVER hq FOREIGN DATA WRAPPER postgres_fdw OPTIONS (host 'hqdb'"));
        assertTrue(out.contains("user 'scott'"));
        assertFalse(out.contains("tiger"), "口令不能出现在输出中");
        assertEquals(WarningType.MANUAL_REVIEW_NEEDED, acc.getWarnings().get(0).getType());
    }

    @Test
    void testReferenceMarked() {
        assertEquals("SELECT * FROM employees /* @hq */", convert("SELECT * FROM employees@hq", Dialect.MYSQL));
        assertTrue(acc.getAppliedRules().contains("Database link reference marked"));
    }

    @Test
    void testDropLinkCommented() {
        assertEquals("/* DROP DATABASE LINK hq */", convert("DROP DATABASE LINK hq", Dialect.MYSQL));
    }
}
