package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.MaskedSql;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 转换器链的顺序与异常隔离
 */
class FeatureConverterChainTest {

    private static FeatureConverter failing(int order) {
        return new AbstractFeatureConverter() {
            @Override
            public String name() {
                return "BrokenConverter";
            }

            @Override
            public int order() {
                return order;
            }

            @Override
            public boolean isEnabled(RuleConfig config) {
                return true;
            }

            @Override
            public boolean isApplicable(String maskedSql, ConversionContext ctx) {
                return true;
            }

            @Override
            public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
                acc.addRule("should be discarded");
                throw new IllegalStateException("boom");
            }
        };
    }

    @Test
    void testDefaultOrder() {
        List<FeatureConverter> converters = FeatureConverterChain.createDefault().getConverters();

        assertEquals(15, converters.size());
        assertTrue(converters.get(0) instanceof SynonymConverter);
        assertTrue(converters.get(converters.size() - 1) instanceof PseudoColumnConverter);
        for (int i = 1; i < converters.size(); i++) {
            assertTrue(converters.get(i - 1).order() <= converters.get(i).order());
        }
    }

    @Test
    void testFailingConverterIsolated() {
        FeatureConverterChain chain = new FeatureConverterChain(Arrays.asList(new PseudoColumnConverter(), failing(1)));
        String sql = "SELECT SYSDATE FROM dual";
        MaskedSql masked = MaskedSql.mask(sql, Dialect.ORACLE);
        ConversionContext ctx = new ConversionContext(Dialect.ORACLE, Dialect.MYSQL, RuleConfig.defaults(), masked);
        ConversionAccumulator acc = new ConversionAccumulator();

        String out = masked.restore(chain.apply(masked.getText(), ctx, acc));

        assertEquals("SELECT NOW() FROM dual", out, "其余转换器应照常执行");
        assertFalse(acc.getAppliedRules().contains("should be discarded"), "失败转换器的规则应丢弃");
        ConversionWarning warning = acc.getWarnings().get(0);
        assertEquals(WarningType.MANUAL_REVIEW_NEEDED, warning.getType());
        assertEquals(WarningSeverity.WARNING, warning.getSeverity());
        assertEquals("BrokenConverter 转换失败: boom", warning.getMessage());
    }

    @Test
    void testDisabledConverterSkipped() {
        FeatureConverterChain chain = new FeatureConverterChain(Arrays.asList(new PseudoColumnConverter()));
        RuleConfig config = RuleConfig.defaults().toBuilder()
                .syntaxRules(RuleConfig.defaults().getSyntaxRules().toBuilder().convertPseudoColumns(false).build())
                .build();
        String sql = "SELECT SYSDATE FROM dual";
        MaskedSql masked = MaskedSql.mask(sql, Dialect.ORACLE);
        ConversionContext ctx = new ConversionContext(Dialect.ORACLE, Dialect.MYSQL, config, masked);

        assertEquals(sql, masked.restore(chain.apply(masked.getText(), ctx, new ConversionAccumulator())));
    }

    @Test
    void testUnbalancedSpanReportedWithFragment() {
        FeatureConverterChain chain = new FeatureConverterChain(Arrays.asList(new IndexConverter()));
        String sql = "CREATE INDEX idx_t ON t (a, b";
        MaskedSql masked = MaskedSql.mask(sql, Dialect.ORACLE);
        ConversionContext ctx = new ConversionContext(Dialect.ORACLE, Dialect.MYSQL, RuleConfig.defaults(), masked);
        ConversionAccumulator acc = new ConversionAccumulator();

        assertEquals(sql, masked.restore(chain.apply(masked.getText(), ctx, acc)), "转换失败时保留原文");
        ConversionWarning warning = acc.getWarnings().get(0);
        assertEquals(WarningType.MANUAL_REVIEW_NEEDED, warning.getType());
        assertEquals("IndexConverter 转换失败: CREATE INDEX 的列清单括号不匹配", warning.getMessage());
        assertEquals(sql, warning.getLocation(), "位置应取转换器给出的片段");
    }
}
