package com.afsun.transpiler.core.split;

import com.afsun.transpiler.core.ConversionResult;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.RecoveryState;
import com.afsun.transpiler.core.ValidationInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LargeInputSplitterTest {

    private static final String SCRIPT = "SELECT A FROM T1;\nSELECT B FROM T2;\nSELECT C FROM T3;\n"
            + "SELECT D FROM T4;\nSELECT E FROM T5;";

    private LargeInputSplitter splitter;

    @BeforeEach
    void setUp() {
        splitter = new LargeInputSplitter(10, 2, 3);
    }

    @AfterEach
    void tearDown() {
        splitter.shutdown();
    }

    private static ConversionResult lowerCase(String chunk) {
        return ConversionResult.builder()
                .convertedSql(chunk.toLowerCase(Locale.ROOT))
                .appliedRule("lower")
                .validation(new ValidationInfo(true, 0, true, true))
                .build();
    }

    @Test
    void testIsLarge() {
        assertTrue(splitter.isLarge(SCRIPT));
        assertFalse(splitter.isLarge("SELECT 1"));
        assertFalse(splitter.isLarge(null));
    }

    @Test
    void testChunkByStatementCount() {
        List<String> chunks = splitter.chunk(SCRIPT, Dialect.ORACLE);

        assertEquals(3, chunks.size());
        assertEquals("SELECT A FROM T1;\nSELECT B FROM T2;", chunks.get(0));
        assertEquals("SELECT E FROM T5;", chunks.get(2));
    }

    @Test
    void testMergeKeepsChunkOrder() {
        ConversionResult result = splitter.convert(SCRIPT, Dialect.ORACLE, Dialect.MYSQL, LargeInputSplitterTest::lowerCase);

        assertEquals(SCRIPT.toLowerCase(Locale.ROOT), result.getConvertedSql());
        assertEquals(3, result.getChunkCount());
        assertEquals(3, result.getAppliedRules().size());
        assertEquals(Dialect.ORACLE, result.getSourceDialect());
        assertEquals(Dialect.MYSQL, result.getTargetDialect());
        assertEquals(RecoveryState.NOT_NEEDED, result.getRecoveryState());
        assertTrue(result.getValidation().isPassed());
        assertTrue(result.isSuccess());
    }

    @Test
    void testMergeOrderIndependentOfCompletionOrder() {
        CountDownLatch lastChunkDone = new CountDownLatch(1);
        ConcurrentLinkedQueue<String> completed = new ConcurrentLinkedQueue<>();

        ConversionResult result = splitter.convert(SCRIPT, Dialect.ORACLE, Dialect.MYSQL, chunk -> {
            if (chunk.contains("T1")) {
                // 第一个分块等最后一个分块完成后才返回
                try {
                    assertTrue(lastChunkDone.await(5, TimeUnit.SECONDS), "最后一个分块应先完成");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            ConversionResult r = lowerCase(chunk);
            completed.add(chunk.contains("T1") ? "first" : chunk.contains("T5") ? "last" : "middle");
            if (chunk.contains("T5")) {
                lastChunkDone.countDown();
            }
            return r;
        });

        List<String> completionOrder = new ArrayList<>(completed);
        assertEquals("first", completionOrder.get(completionOrder.size() - 1), "第一个分块最后完成");
        assertEquals(SCRIPT.toLowerCase(Locale.ROOT), result.getConvertedSql(), "合并结果仍按分块序号排列");
        assertFalse(result.hasErrors());
    }

    @Test
    void testPoolCreatedOnFirstUse() {
        LargeInputSplitter lazy = new LargeInputSplitter(10, 2, 2);
        assertFalse(lazy.isPoolStarted(), "未分块转换前不创建线程池");

        lazy.chunk(SCRIPT, Dialect.ORACLE);
        assertFalse(lazy.isPoolStarted());

        lazy.convert(SCRIPT, Dialect.ORACLE, Dialect.MYSQL, LargeInputSplitterTest::lowerCase);
        assertTrue(lazy.isPoolStarted());

        lazy.shutdown();
        assertFalse(lazy.isPoolStarted());
        lazy.shutdown();
        assertThrows(IllegalStateException.class,
                () -> lazy.convert(SCRIPT, Dialect.ORACLE, Dialect.MYSQL, LargeInputSplitterTest::lowerCase));
    }

    @Test
    void testFailingChunkKeepsOriginal() {
        ConversionResult result = splitter.convert(SCRIPT, Dialect.ORACLE, Dialect.MYSQL, chunk -> {
            if (chunk.contains("T3")) {
                throw new IllegalStateException("boom");
            }
            return lowerCase(chunk);
        });

        assertEquals("select a from t1;\nselect b from t2;\nSELECT C FROM T3;\nSELECT D FROM T4;\nselect e from t5;",
                result.getConvertedSql(), "失败分块保留原文，其余分块正常转换");
        assertEquals(RecoveryState.UNRECOVERED, result.getRecoveryState());
        assertEquals(1, result.getWarnings().size());
        assertEquals("第 2 个分块转换失败，已保留原文: boom", result.getWarnings().get(0).getMessage());
        assertTrue(result.hasErrors());
        assertFalse(result.isSuccess());
    }
}
