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
 * 对象类型、集合类型与枚举类型
 */
class UserDefinedTypeConverterTest {

    private UserDefinedTypeConverter converter;
    private ConversionAccumulator acc;

    @BeforeEach
    void setUp() {
        converter = new UserDefinedTypeConverter();
        acc = new ConversionAccumulator();
    }

    private String convert(String sql, Dialect source, Dialect target) {
        MaskedSql masked = MaskedSql.mask(sql, source);
        ConversionContext ctx = new ConversionContext(source, target, RuleConfig.defaults(), masked);
        return masked.restore(converter.convert(masked.getText(), ctx, acc));
    }

    @Test
    void testObjectToComposite() {
        assertEquals("CREATE TYPE address_t AS (street VARCHAR2(100), city VARCHAR2(50))",
                convert("CREATE TYPE address_t AS OBJECT (street VARCHAR2(100), city VARCHAR2(50))",
                        Dialect.ORACLE, Dialect.POSTGRESQL));
    }

    @Test
    void testMemberMethodsRemoved() {
        String out = convert("CREATE TYPE point_t AS OBJECT (x NUMBER, y NUMBER, MEMBER FUNCTION dist RETURN NUMBER)",
                Dialect.ORACLE, Dialect.POSTGRESQL);

        assertEquals("CREATE TYPE point_t AS (x NUMBER, y NUMBER)", out);
        assertEquals(WarningType.PARTIAL_SUPPORT, acc.getWarnings().get(0).getType());
    }

    @Test
    void testObjectToJsonOnMySql() {
        String out = convert("CREATE TYPE address_t AS OBJECT (street VARCHAR2(100));\n"
                + "CREATE TABLE customer (id NUMBER, addr address_t)", Dialect.ORACLE, Dialect.MYSQL);

        assertTrue(out.startsWith("/* JSON emulation of type CREATE TYPE address_t"), out);
        assertTrue(out.contains("CREATE TABLE customer (id NUMBER, addr JSON)"), out);
    }

    @Test
    void testCollectionToArrayDomain() {
        assertEquals("CREATE DOMAIN num_list AS NUMBER[]",
                convert("CREATE TYPE num_list AS TABLE OF NUMBER", Dialect.ORACLE, Dialect.POSTGRESQL));
    }

    @Test
    void testEnumCommentedForOracle() {
        String out = convert("CREATE TYPE mood AS ENUM ('sad', 'happy')", Dialect.POSTGRESQL, Dialect.ORACLE);

        assertEquals("/* CREATE TYPE mood AS ENUM ('sad', 'happy') */", out);
        assertEquals(WarningType.UNSUPPORTED_FUNCTION, acc.getWarnings().get(0).getType());
    }
}
