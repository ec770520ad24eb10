package com.afsun.transpiler.core.validation;

import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.ValidationInfo;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlValidationServiceTest {

    private SqlValidationService service;

    @BeforeEach
    void setUp() {
        service = new SqlValidationService();
    }

    private List<ConversionWarning> validate(String original, String converted) {
        return service.validate(original, converted, Dialect.ORACLE, Dialect.MYSQL, RuleConfig.defaults());
    }

    @Test
    void testBracketsBalanced() {
        assertTrue(service.isBracketsBalanced("SELECT '(' FROM t", Dialect.ORACLE), "字符串中的括号不计");
        assertTrue(service.isBracketsBalanced("SELECT a /* ( */ FROM t", Dialect.ORACLE), "注释中的括号不计");
        assertFalse(service.isBracketsBalanced("SELECT (1 FROM t", Dialect.ORACLE));
        assertFalse(service.isBracketsBalanced("SELECT 1) FROM t", Dialect.ORACLE));
    }

    @Test
    void testQuotesBalanced() {
        assertTrue(service.isQuotesBalanced("SELECT 'it''s' FROM t", Dialect.ORACLE));
        assertFalse(service.isQuotesBalanced("SELECT 'abc FROM t", Dialect.ORACLE));
        assertTrue(service.isQuotesBalanced("SELECT a -- it's\nFROM t", Dialect.ORACLE), "行注释中的引号不计");
        assertTrue(service.isQuotesBalanced("SELECT 'it\\'s' FROM t", Dialect.MYSQL), "MySQL 支持反斜杠转义");
        assertFalse(service.isQuotesBalanced("SELECT 'it\\'s' FROM t", Dialect.ORACLE));
    }

    @Test
    void testCleanConversionHasNoIssues() {
        List<ConversionWarning> issues = validate("SELECT NVL(a, 0) FROM t WHERE b = 1",
                "SELECT IFNULL(a, 0) FROM t WHERE b = 1");
        assertTrue(issues.isEmpty(), "等价转换不应产生问题: " + issues);
    }

    @Test
    void testLostWhereIsError() {
        List<ConversionWarning> issues = validate("SELECT a FROM t WHERE b = 1", "SELECT a FROM t");

        assertEquals(1, issues.size());
        assertTrue(issues.get(0).isError());
        assertEquals("转换结果丢失了关键子句 WHERE", issues.get(0).getMessage());
    }

    @Test
    void testCommentedWhereIsNotLost() {
        List<ConversionWarning> issues = validate("CREATE INDEX idx_a ON t (a) WHERE a > 0",
                "CREATE INDEX idx_a ON t (a) /* WHERE a > 0 */");
        assertTrue(issues.stream().noneMatch(ConversionWarning::isError), "注释保留的子句不算丢失");
    }

    @Test
    void testFunctionLoss() {
        List<ConversionWarning> issues = validate("SELECT NVL(a, 0), UPPER(b), LOWER(c) FROM t",
                "SELECT a, b, c FROM t");

        assertEquals(1, issues.size());
        assertEquals("函数调用数量从 3 减少到 0", issues.get(0).getMessage());
        assertFalse(issues.get(0).isError());
    }

    @Test
    void testFunctionLossCanBeDisabled() {
        RuleConfig config = RuleConfig.defaults().toBuilder()
                .warningSettings(RuleConfig.defaults().getWarningSettings().toBuilder().warnFunctionLoss(false).build())
                .build();
        List<ConversionWarning> issues = service.validate("SELECT UPPER(b) FROM t", "SELECT b FROM t", config);
        assertTrue(issues.isEmpty());
    }

    @Test
    void testCountFunctions() {
        assertEquals(2, SqlValidationService.countFunctions(
                "SELECT COUNT(*) FROM t WHERE id IN (SELECT MAX(id) FROM s)"));
        assertEquals(0, SqlValidationService.countFunctions("INSERT INTO t VALUES (1, 2)"));
        assertEquals(0, SqlValidationService.countFunctions("INSERT INTO t (a, b) VALUES (1, 2)"), "列清单不是函数");
        assertEquals(1, SqlValidationService.countFunctions("SELECT CASE WHEN a = 1 THEN 'x' END FROM t"));
        assertEquals(1, SqlValidationService.countFunctions("SELECT seq.NEXTVAL FROM dual"));
    }

    @Test
    void testRewrittenExpressionsAreNotFunctionLoss() {
        assertTrue(validate("SELECT DECODE(a, 1, 'x', 'y'), NVL2(b, 1, 0) FROM t",
                "SELECT CASE a WHEN 1 THEN 'x' ELSE 'y' END, CASE WHEN b IS NOT NULL THEN 1 ELSE 0 END FROM t")
                .isEmpty(), "DECODE/NVL2 改为 CASE 不是函数丢失");
        assertTrue(validate("SELECT nextval('seq_a') FROM t", "SELECT seq_a.NEXTVAL FROM t").isEmpty());
        assertTrue(validate("REPLACE INTO t (id, v) VALUES (1, 'a')",
                "MERGE INTO t USING (SELECT 1 AS id, 'a' AS v FROM dual) s ON (t.id = s.id) "
                        + "WHEN MATCHED THEN UPDATE SET t.v = s.v WHEN NOT MATCHED THEN INSERT (id, v) VALUES (s.id, s.v)")
                .isEmpty());
    }

    @Test
    void testOuterJoinMovedWhereIsNotClauseLoss() {
        assertTrue(validate("SELECT e.name FROM emp e, dept d WHERE e.deptno = d.deptno(+)",
                "SELECT e.name FROM emp e LEFT JOIN dept d ON e.deptno = d.deptno").isEmpty());
    }

    @Test
    void testMaxSubqueryDepth() {
        assertEquals(2, SqlValidationService.maxSubqueryDepth(
                "SELECT * FROM (SELECT * FROM (SELECT 1 FROM dual) a) b"));
        assertEquals(0, SqlValidationService.maxSubqueryDepth("SELECT (a + b) * 2 FROM t"));
    }

    @Test
    void testDeepSubqueryWarns() {
        String sql = "SELECT a FROM (SELECT a FROM (SELECT a FROM (SELECT a FROM (SELECT 1 a FROM t) x) y) z) w";
        List<ConversionWarning> issues = validate(sql, sql);
        assertTrue(issues.stream().anyMatch(w -> w.getMessage().startsWith("子查询嵌套深度为 4")));
    }

    @Test
    void testLargeInListWarns() {
        StringBuilder sb = new StringBuilder("SELECT a FROM t WHERE id IN (");
        for (int i = 1; i <= 101; i++) {
            sb.append(i == 1 ? "" : ", ").append(i);
        }
        String sql = sb.append(")").toString();

        List<ConversionWarning> issues = validate(sql, sql);

        assertEquals(1, issues.size());
        assertEquals(WarningType.PERFORMANCE, issues.get(0).getType());
        assertEquals("IN 列表包含 101 个元素，超过 100", issues.get(0).getMessage());
    }

    @Test
    void testLeadingWildcardWarns() {
        String sql = "SELECT a FROM t WHERE name LIKE '%abc'";
        List<ConversionWarning> issues = validate(sql, sql);
        assertEquals(1, issues.size());
        assertTrue(issues.get(0).getMessage().contains("以通配符开头"));
    }

    @Test
    void testSelectStarIsInfo() {
        String sql = "SELECT * FROM t";
        List<ConversionWarning> issues = validate(sql, sql);
        assertEquals(1, issues.size());
        assertEquals(WarningType.PERFORMANCE, issues.get(0).getType());
        assertFalse(issues.get(0).isError());
    }

    @Test
    void testBlankResultIsError() {
        List<ConversionWarning> issues = validate("SELECT 1 FROM dual", "  ");
        assertEquals(1, issues.size());
        assertEquals("转换结果为空", issues.get(0).getMessage());
        assertTrue(issues.get(0).isError());

        assertTrue(validate("", "").isEmpty(), "空输入空输出不算问题");
    }

    @Test
    void testUnbalancedResultIsError() {
        List<ConversionWarning> issues = validate("SELECT a FROM t", "SELECT (a FROM t");
        assertTrue(issues.stream().anyMatch(w -> w.isError() && "转换结果括号不配对".equals(w.getMessage())));
    }

    @Test
    void testSummarize() {
        List<ConversionWarning> issues = validate("SELECT a FROM t WHERE b = 1", "SELECT (a FROM t");
        ValidationInfo info = service.summarize("SELECT (a FROM t", Dialect.MYSQL, issues);

        assertFalse(info.isPassed());
        assertEquals(issues.size(), info.getIssueCount());
        assertFalse(info.isBracketsBalanced());
        assertTrue(info.isQuotesBalanced());
    }
}
