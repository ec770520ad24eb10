package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.exceptions.FeatureConversionException;
import com.afsun.transpiler.core.util.MaskedSql;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndexConverterTest {

    private IndexConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new IndexConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect source, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, source);
        ConversionContext ctx = new ConversionContext(source, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testBitmapIndexToMySql() {
        String out = convert("CREATE BITMAP INDEX idx ON t(c)", Dialect.ORACLE, Dialect.MYSQL);

        assertEquals("CREATE INDEX idx ON t(c)", out);
        ConversionWarning w = acc.getWarnings().get(0);
        assertEquals(WarningType.UNSUPPORTED_FUNCTION, w.getType());
        assertTrue(w.getMessage().contains("BITMAP"), "告警应提到 BITMAP");
        assertTrue(acc.getAppliedRules().contains("Index BITMAP removed"));
    }

    @Test
    void testPlainIndexUnchanged() {
        String sql = "CREATE UNIQUE INDEX idx ON t (a, b DESC)";
        assertEquals(sql, convert(sql, Dialect.ORACLE, Dialect.POSTGRESQL));
        assertTrue(acc.getAppliedRules().isEmpty());
    }

    @Test
    void testIndexMethodRemovedForOracle() {
        assertEquals("CREATE INDEX idx ON t (c)", convert("CREATE INDEX idx ON t (c) USING BTREE", Dialect.MYSQL, Dialect.ORACLE));
        assertTrue(acc.getAppliedRules().contains("Index USING BTREE removed"));
    }

    @Test
    void testFunctionalIndexToMySql() {
        assertEquals("CREATE INDEX idx ON t ((lower(name)))",
                convert("CREATE INDEX idx ON t (lower(name))", Dialect.POSTGRESQL, Dialect.MYSQL));
    }

    @Test
    void testPartialIndexWhereCommentedOut() {
        String out = convert("CREATE INDEX idx ON t (c) WHERE c > 0", Dialect.POSTGRESQL, Dialect.MYSQL);

        assertEquals("CREATE INDEX idx ON t (c) /* WHERE c > 0 */", out);
        assertTrue(acc.getWarnings().stream().anyMatch(w -> w.getMessage().contains("WHERE")));
    }

    @Test
    void testFullTextIndexToPostgres() {
        String out = convert("CREATE FULLTEXT INDEX ft ON doc (title, body)", Dialect.MYSQL, Dialect.POSTGRESQL);
        assertEquals("CREATE INDEX ft ON doc USING gin (to_tsvector('simple', title || ' ' || body))", out);
    }

    @Test
    void testUnbalancedColumnListRejected() {
        FeatureConversionException e = assertThrows(FeatureConversionException.class,
                () -> convert("CREATE UNIQUE INDEX idx ON t (a, b", Dialect.ORACLE, Dialect.MYSQL));

        assertEquals("FEATURE_CONVERSION_ERROR", e.getErrorCode());
        assertEquals("CREATE UNIQUE INDEX idx ON t (a, b", e.getSqlFragment());
    }
}
