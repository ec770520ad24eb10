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

class SynonymConverterTest {

    private SynonymConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new SynonymConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql) {
        MaskedSql masked = MaskedSql.mask(sql, Dialect.ORACLE);
        ConversionContext ctx = new ConversionContext(Dialect.ORACLE, Dialect.POSTGRESQL, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testSynonymToView() {
        assertEquals("CREATE OR REPLACE VIEW emp AS SELECT * FROM hr.employees",
                convert("CREATE PUBLIC SYNONYM emp FOR hr.employees"));
        assertTrue(acc.getAppliedRules().contains("Synonym -> VIEW"));
    }

    @Test
    void testSynonymOverDatabaseLink() {
        String out = convert("CREATE SYNONYM remote_emp FOR employees@hq");

        assertEquals("/* 需人工迁移: CREATE SYNONYM remote_emp FOR employees@hq */", out, "不能静默删除");
        assertEquals(WarningType.MANUAL_REVIEW_NEEDED, acc.getWarnings().get(0).getType());
    }

    @Test
    void testDropSynonym() {
        assertEquals("DROP VIEW IF EXISTS emp", convert("DROP PUBLIC SYNONYM emp"));
    }
}
