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

class PackageCallConverterTest {

    private PackageCallConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new PackageCallConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, Dialect.ORACLE);
        ConversionContext ctx = new ConversionContext(Dialect.ORACLE, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testRandomValue() {
        assertEquals("SELECT (1 + (10 - 1) * RAND()) FROM dual",
                convert("SELECT DBMS_RANDOM.VALUE(1, 10) FROM dual", Dialect.MYSQL));
        assertTrue(acc.getAppliedRules().contains("Package call DBMS_RANDOM.VALUE converted"));
    }

    @Test
    void testLobLength() {
        assertEquals("SELECT LENGTH(doc) FROM t", convert("SELECT DBMS_LOB.GETLENGTH(doc) FROM t", Dialect.POSTGRESQL));
    }

    @Test
    void testPutLineInBlock() {
        assertEquals("BEGIN\n  RAISE NOTICE '%', 'done';\nEND;",
                convert("BEGIN\n  DBMS_OUTPUT.PUT_LINE('done');\nEND;", Dialect.POSTGRESQL));
    }

    @Test
    void testUnknownPackageCommentedOut() {
        assertEquals("SELECT NULL /* DBMS_CRYPTO.HASH(x, 2) */ FROM dual",
                convert("SELECT DBMS_CRYPTO.HASH(x, 2) FROM dual", Dialect.MYSQL));
        assertEquals(WarningType.UNSUPPORTED_FUNCTION, acc.getWarnings().get(0).getType());
    }

    @Test
    void testRaiseApplicationError() {
        assertEquals("SIGNAL SQLSTATE '45000' SET MESSAGE_TEXT = 'bad'",
                convert("RAISE_APPLICATION_ERROR(-20001, 'bad')", Dialect.MYSQL));
        assertEquals("RAISE EXCEPTION '%', 'bad' USING ERRCODE = 'P0001', DETAIL = 'ORA-20001'",
                convert("RAISE_APPLICATION_ERROR(-20001, 'bad')", Dialect.POSTGRESQL));
    }

    @Test
    void testMviewRefresh() {
        assertEquals("REFRESH MATERIALIZED VIEW mv_sales",
                convert("DBMS_MVIEW.REFRESH('mv_sales', 'C')", Dialect.POSTGRESQL));
        assertEquals("CALL mv_sales_refresh()", convert("DBMS_MVIEW.REFRESH('mv_sales')", Dialect.MYSQL));
    }

    @Test
    void testPackageNameInsideLiteralIgnored() {
        String sql = "SELECT 'DBMS_OUTPUT.PUT_LINE(x)' FROM dual";
        assertEquals(sql, convert(sql, Dialect.MYSQL));
        assertTrue(acc.getWarnings().isEmpty());
    }
}
