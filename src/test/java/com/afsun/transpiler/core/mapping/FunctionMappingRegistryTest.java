package com.afsun.transpiler.core.mapping;

import com.afsun.transpiler.core.Dialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FunctionMappingRegistryTest {

    private FunctionMappingRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new FunctionMappingRegistry();
    }

    @Test
    void testNvlMappings() {
        FunctionMappingRule toMySql = registry.find(Dialect.ORACLE, Dialect.MYSQL, "nvl");
        assertNotNull(toMySql, "函数名查找应忽略大小写");
        assertEquals("IFNULL", toMySql.getTargetFunction());
        assertEquals(ParameterTransform.DIRECT, toMySql.getTransform());
        assertEquals("Function NVL -> IFNULL", toMySql.ruleName());

        assertEquals("COALESCE", registry.find(Dialect.ORACLE, Dialect.POSTGRESQL, "NVL").getTargetFunction());
        assertEquals("NVL", registry.find(Dialect.MYSQL, Dialect.ORACLE, "IFNULL").getTargetFunction());
    }

    @Test
    void testUnsupportedFunction() {
        FunctionMappingRule rule = registry.find(Dialect.ORACLE, Dialect.MYSQL, "INITCAP");
        assertNotNull(rule);
        assertFalse(rule.isSupported(), "INITCAP 在 MySQL 中没有等价函数");
        assertNotNull(rule.getWarningMessage());
        assertEquals("Function INITCAP -> (unsupported)", rule.ruleName());
    }

    @Test
    void testUnknownFunctionAndSameDialect() {
        assertNull(registry.find(Dialect.ORACLE, Dialect.MYSQL, "MY_UDF"));
        assertNull(registry.find(Dialect.ORACLE, Dialect.ORACLE, "NVL"), "同方言没有映射表");
        assertNull(registry.find(Dialect.ORACLE, Dialect.MYSQL, null));
        assertTrue(registry.rulesFor(Dialect.MYSQL, Dialect.MYSQL).isEmpty());
    }

    @Test
    void testArgumentLimits() {
        assertEquals(Integer.valueOf(2), registry.find(Dialect.ORACLE, Dialect.POSTGRESQL, "INSTR").getMaxArguments());
        assertNull(registry.find(Dialect.ORACLE, Dialect.MYSQL, "NVL").getMaxArguments());
    }

    @Test
    void testEveryPairHasRules() {
        for (Dialect source : Dialect.values()) {
            for (Dialect target : Dialect.values()) {
                if (source != target) {
                    assertFalse(registry.rulesFor(source, target).isEmpty(), source + " -> " + target + " 应有映射规则");
                }
            }
        }
    }
}
