package com.afsun.transpiler.core.dialect;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.exceptions.UnsupportedDialectException;
import com.afsun.transpiler.core.util.MaskedSql;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 方言转换策略测试：函数映射、数据类型、分页和运算符
 */
class DialectConverterTest {

    private DialectConverterRegistry registry;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        registry = DialectConverterRegistry.createDefault();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect source, Dialect target) {
        return convert(sql, source, target, RuleConfig.defaults());
    }

    private String convert(String sql, Dialect source, Dialect target, RuleConfig rules) {
        MaskedSql masked = MaskedSql.mask(sql, source);
        ConversionContext ctx = new ConversionContext(source, target, rules, masked);
        return masked.restore(registry.forTarget(target).convertFunctionsAndTypes(masked.getText(), source, ctx, acc));
    }

    @Test
    void testNvlToIfnull() {
        assertEquals("SELECT IFNULL(a,0) FROM t", convert("SELECT NVL(a,0) FROM t", Dialect.ORACLE, Dialect.MYSQL));
        assertTrue(acc.getAppliedRules().stream().anyMatch(r -> r.contains("NVL")), "应记录 NVL 规则");
    }

    @Test
    void testNestedCalls() {
        assertEquals("SELECT IFNULL(IFNULL(a,b),0) FROM t",
                convert("SELECT NVL(NVL(a,b),0) FROM t", Dialect.ORACLE, Dialect.MYSQL));
        assertEquals("SELECT COALESCE(a, 0) FROM t",
                convert("SELECT NVL(a, 0) FROM t", Dialect.ORACLE, Dialect.POSTGRESQL));
    }

    @Test
    void testIfnullToNvl() {
        assertEquals("SELECT NVL(a,0) FROM t", convert("SELECT IFNULL(a,0) FROM t", Dialect.MYSQL, Dialect.ORACLE));
    }

    @Test
    void testLiteralNotRewritten() {
        String sql = "SELECT 'NVL(a,0)' FROM t";
        assertEquals(sql, convert(sql, Dialect.ORACLE, Dialect.MYSQL), "字符串中的函数名不应改写");
        assertTrue(acc.getAppliedRules().isEmpty());
    }

    @Test
    void testDecodeToCaseWhen() {
        assertEquals("SELECT CASE WHEN s = 1 THEN 'A' WHEN s IS NULL THEN 'N' ELSE 'B' END FROM t",
                convert("SELECT DECODE(s, 1, 'A', NULL, 'N', 'B') FROM t", Dialect.ORACLE, Dialect.MYSQL));
    }

    @Test
    void testDateFormatConversion() {
        assertEquals("SELECT DATE_FORMAT(d, '%Y-%m-%d %H:%i:%s') FROM t",
                convert("SELECT TO_CHAR(d, 'YYYY-MM-DD HH24:MI:SS') FROM t", Dialect.ORACLE, Dialect.MYSQL));
        assertEquals("SELECT TO_CHAR(d, 'YYYY-MM-DD') FROM t",
                convert("SELECT DATE_FORMAT(d, '%Y-%m-%d') FROM t", Dialect.MYSQL, Dialect.ORACLE));
    }

    @Test
    void testUnsupportedFunctionWarns() {
        String sql = "SELECT INITCAP(name) FROM t";
        assertEquals(sql, convert(sql, Dialect.ORACLE, Dialect.MYSQL), "无等价函数时原样保留");
        ConversionWarning w = acc.getWarnings().get(0);
        assertEquals(WarningType.UNSUPPORTED_FUNCTION, w.getType());
        assertTrue(w.getMessage().contains("INITCAP"));
    }

    @Test
    void testFunctionCategoryDisabled() {
        RuleConfig rules = RuleConfig.defaults().toBuilder()
                .functionRules(RuleConfig.FunctionRules.builder().convertNullHandling(false).build())
                .build();
        String sql = "SELECT NVL(a,0) FROM t";
        assertEquals(sql, convert(sql, Dialect.ORACLE, Dialect.MYSQL, rules), "关闭空值函数转换后不改写");
    }

    @Test
    void testColumnTypes() {
        assertEquals("CREATE TABLE t (id DECIMAL(10), name VARCHAR(50), d DATETIME)",
                convert("CREATE TABLE t (id NUMBER(10), name VARCHAR2(50 BYTE), d DATE)", Dialect.ORACLE, Dialect.MYSQL));
    }

    @Test
    void testSameNamedTypeRecordsNoRule() {
        String sql = "CREATE TABLE t (id BIGINT, flag smallint)";

        assertEquals(sql, convert(sql, Dialect.MYSQL, Dialect.POSTGRESQL));
        assertTrue(acc.getAppliedRules().isEmpty(), "类型未变化时不应记录规则: " + acc.getAppliedRules());
    }

    @Test
    void testPaginationToMySql() {
        assertEquals("SELECT * FROM t ORDER BY id LIMIT 5 OFFSET 10",
                convert("SELECT * FROM t ORDER BY id OFFSET 10 ROWS FETCH NEXT 5 ROWS ONLY", Dialect.ORACLE, Dialect.MYSQL));
        assertEquals("SELECT * FROM t LIMIT 3",
                convert("SELECT * FROM t FETCH FIRST 3 ROWS ONLY", Dialect.POSTGRESQL, Dialect.MYSQL));
    }

    @Test
    void testPaginationToOracle() {
        assertEquals("SELECT * FROM t OFFSET 20 ROWS FETCH NEXT 10 ROWS ONLY",
                convert("SELECT * FROM t LIMIT 20, 10", Dialect.MYSQL, Dialect.ORACLE));
        assertEquals("SELECT * FROM t FETCH FIRST 5 ROWS ONLY",
                convert("SELECT * FROM t LIMIT 5", Dialect.POSTGRESQL, Dialect.ORACLE));
    }

    @Test
    void testPaginationToPostgres() {
        assertEquals("SELECT * FROM t LIMIT 10 OFFSET 20",
                convert("SELECT * FROM t LIMIT 20, 10", Dialect.MYSQL, Dialect.POSTGRESQL));
    }

    @Test
    void testIdentifierQuoting() {
        assertEquals("SELECT `Name` FROM `T`", convert("SELECT \"Name\" FROM \"T\"", Dialect.ORACLE, Dialect.MYSQL));
        assertEquals("SELECT \"Name\" FROM \"T\"", convert("SELECT `Name` FROM `T`", Dialect.MYSQL, Dialect.POSTGRESQL));
    }

    @Test
    void testPostgresOperatorsToMySql() {
        assertEquals("SELECT * FROM t WHERE name LIKE 'a%'",
                convert("SELECT * FROM t WHERE name ILIKE 'a%'", Dialect.POSTGRESQL, Dialect.MYSQL));
        assertEquals("SELECT * FROM t WHERE a REGEXP '^x'",
                convert("SELECT * FROM t WHERE a ~ '^x'", Dialect.POSTGRESQL, Dialect.MYSQL));
    }

    @Test
    void testMySqlOperatorsToPostgres() {
        assertEquals("SELECT * FROM t WHERE a IS NOT DISTINCT FROM b",
                convert("SELECT * FROM t WHERE a <=> b", Dialect.MYSQL, Dialect.POSTGRESQL));
    }

    @Test
    void testContextMismatchRejected() {
        DialectConverter mysql = registry.forTarget(Dialect.MYSQL);
        ConversionContext ctx = new ConversionContext(Dialect.ORACLE, Dialect.POSTGRESQL, RuleConfig.defaults(), null);
        assertThrows(UnsupportedDialectException.class,
                () -> mysql.convertFunctionsAndTypes("SELECT 1", Dialect.ORACLE, ctx, acc));
        assertThrows(UnsupportedDialectException.class, () -> registry.forTarget(null));
    }
}
