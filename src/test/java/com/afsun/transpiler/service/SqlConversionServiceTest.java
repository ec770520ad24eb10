package com.afsun.transpiler.service;

import com.afsun.transpiler.core.ConversionRequest;
import com.afsun.transpiler.core.ConversionResult;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.config.ConverterProperties;
import com.afsun.transpiler.core.exceptions.UnsupportedDialectException;
import com.afsun.transpiler.core.recovery.RecoveryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 在 Spring 容器中走完整转换流程
 */
@SpringBootTest
class SqlConversionServiceTest {

    @Autowired
    private SqlConversionService sqlConversionService;

    @Autowired
    private RecoveryService recoveryService;

    @Autowired
    private ConverterProperties converterProperties;

    @Test
    void testContextWiring() {
        assertEquals(7, recoveryService.getStrategies().size(), "全部修复策略都应注册为组件");
        assertEquals(100000, converterProperties.getLargeInputThreshold());
        assertEquals(4, converterProperties.getWorkerThreads());
    }

    @Test
    void testConvertByDialectName() {
        ConversionResult result = sqlConversionService.convert("SELECT NVL(a,0) FROM t", "oracle", "mysql");

        assertEquals("SELECT IFNULL(a,0) FROM t", result.getConvertedSql());
        assertEquals(Dialect.MYSQL, result.getTargetDialect());
        assertTrue(result.isSuccess());
    }

    @Test
    void testConvertRequestWithDefaultProfile() {
        ConversionResult result = sqlConversionService.convert(
                new ConversionRequest("SELECT SYSDATE FROM dual", Dialect.ORACLE, Dialect.POSTGRESQL));

        assertEquals("SELECT CURRENT_TIMESTAMP", result.getConvertedSql());
    }

    @Test
    void testUnknownDialectName() {
        assertThrows(UnsupportedDialectException.class,
                () -> sqlConversionService.convert("SELECT 1", "sqlserver", "mysql"));
    }
}
