package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.MaskedSql;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MERGE 与 upsert 写法互转测试
 */
class MergeConverterTest {

    private static final String UPSERT_MERGE = "MERGE INTO t USING s ON (t.id = s.id) "
            + "WHEN MATCHED THEN UPDATE SET t.v = s.v "
            + "WHEN NOT MATCHED THEN INSERT (id, v) VALUES (s.id, s.v)";

    private MergeConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new MergeConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect source, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, source);
        ConversionContext ctx = new ConversionContext(source, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testOnConflictDoNothingToInsertIgnore() {
        String out = convert("INSERT INTO t VALUES(1) ON CONFLICT (id) DO NOTHING", Dialect.POSTGRESQL, Dialect.MYSQL);

        assertEquals("INSERT IGNORE INTO t VALUES(1)", out);
        assertTrue(acc.getAppliedRules().contains("ON CONFLICT DO NOTHING -> INSERT IGNORE"));
    }

    @Test
    void testMergeDeleteBranchWarns() {
        String sql = "MERGE INTO t USING s ON (t.id = s.id) WHEN MATCHED THEN DELETE "
                + "WHEN NOT MATCHED THEN INSERT (id) VALUES (s.id)";
        String out = convert(sql, Dialect.ORACLE, Dialect.POSTGRESQL);

        boolean warned = false;
        for (ConversionWarning w : acc.getWarnings()) {
            if (w.getType() == WarningType.PARTIAL_SUPPORT && w.getMessage().contains("DELETE")) {
                warned = true;
            }
        }
        assertTrue(warned, "DELETE 分支应产生部分支持告警");
        assertEquals("INSERT INTO t (id) SELECT s.id FROM s WHERE NOT EXISTS (SELECT 1 FROM t WHERE t.id = s.id)", out);
    }

    @Test
    void testOracleDeleteWhereWarns() {
        String sql = "MERGE INTO t USING s ON (t.id = s.id) WHEN MATCHED THEN UPDATE SET t.v = s.v DELETE WHERE t.v IS NULL";
        convert(sql, Dialect.ORACLE, Dialect.MYSQL);

        assertTrue(acc.getWarnings().stream()
                .anyMatch(w -> w.getType() == WarningType.PARTIAL_SUPPORT && w.getMessage().contains("DELETE")));
    }

    @Test
    void testMergeToDuplicateKey() {
        String out = convert(UPSERT_MERGE, Dialect.ORACLE, Dialect.MYSQL);

        assertEquals("INSERT INTO t (id, v) SELECT s.id, s.v FROM s ON DUPLICATE KEY UPDATE v = VALUES(v)", out);
        assertTrue(acc.getAppliedRules().contains("MERGE -> INSERT ... ON DUPLICATE KEY UPDATE"));
    }

    @Test
    void testMergeToOnConflict() {
        String out = convert(UPSERT_MERGE, Dialect.ORACLE, Dialect.POSTGRESQL);

        assertEquals("INSERT INTO t (id, v) SELECT s.id, s.v FROM s ON CONFLICT (id) DO UPDATE SET v = EXCLUDED.v", out);
    }

    @Test
    void testUpdateOnlyMergeToUpdateJoin() {
        String sql = "MERGE INTO t USING s ON (t.id = s.id) WHEN MATCHED THEN UPDATE SET t.v = s.v";
        assertEquals("UPDATE t JOIN s ON t.id = s.id SET t.v = s.v", convert(sql, Dialect.ORACLE, Dialect.MYSQL));
    }

    @Test
    void testInsertIgnoreToOnConflict() {
        String out = convert("INSERT IGNORE INTO t (id, v) VALUES (1, 'a')", Dialect.MYSQL, Dialect.POSTGRESQL);
        assertEquals("INSERT INTO t (id, v) VALUES (1, 'a') ON CONFLICT DO NOTHING", out);
    }

    @Test
    void testDuplicateKeyToOnConflictAssumesFirstColumn() {
        String out = convert("INSERT INTO t (id, v) VALUES (1, 'a') ON DUPLICATE KEY UPDATE v = VALUES(v)",
                Dialect.MYSQL, Dialect.POSTGRESQL);

        assertTrue(out.contains("ON CONFLICT (id) DO UPDATE SET v = EXCLUDED.v"), out);
        assertTrue(acc.getWarnings().stream().anyMatch(w -> w.getType() == WarningType.MANUAL_REVIEW_NEEDED),
                "假定冲突列时应提示人工确认");
    }

    @Test
    void testKeywordInsideLiteralIgnored() {
        String sql = "SELECT 'MERGE INTO x' FROM t";
        assertEquals(sql, convert(sql, Dialect.ORACLE, Dialect.MYSQL));
        assertTrue(acc.getWarnings().isEmpty());
    }
}
