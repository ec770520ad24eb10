package com.afsun.transpiler.core.split;

import com.afsun.transpiler.core.ConversionResult;
import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.RecoveryState;
import com.afsun.transpiler.core.StatementComplexity;
import com.afsun.transpiler.core.ValidationInfo;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.ConverterProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 大输入分块转换。
 * <p>
 * 超过阈值的脚本按语句拆分，每 chunkStatementCount 条语句为一块，在固定大小的线程池中分别走完整转换流程，
 * 结果按块序号排序后拼接。单个分块失败时保留该块原文并记录 ERROR 告警，不影响其他分块。
 * <p>
 * 线程池在第一次分块转换时创建，空闲线程超时后自动退出。
 *
 * @author afsun
 */
@Slf4j
@Component
public class LargeInputSplitter {

    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private static final long IDLE_SECONDS = 60L;

    private final int largeInputThreshold;

    private final int chunkStatementCount;

    private final int workerThreads;

    private ThreadPoolExecutor executor;

    private boolean closed;

    @Autowired
    public LargeInputSplitter(ConverterProperties properties) {
        this(properties.getLargeInputThreshold(), properties.getChunkStatementCount(), properties.getWorkerThreads());
    }

    public LargeInputSplitter(int largeInputThreshold, int chunkStatementCount, int workerThreads) {
        this.largeInputThreshold = largeInputThreshold;
        this.chunkStatementCount = Math.max(1, chunkStatementCount);
        this.workerThreads = Math.max(1, workerThreads);
    }

    private synchronized ExecutorService executor() {
        if (closed) {
            throw new IllegalStateException("分块线程池已关闭");
        }
        if (executor == null) {
            executor = new ThreadPoolExecutor(workerThreads, workerThreads, IDLE_SECONDS, TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(), r -> {
                Thread t = new Thread(r, "sql-chunk-" + THREAD_SEQ.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            executor.allowCoreThreadTimeOut(true);
            log.debug("分块线程池已创建, 线程数={}", workerThreads);
        }
        return executor;
    }

    synchronized boolean isPoolStarted() {
        return executor != null;
    }

    public boolean isLarge(String sql) {
        return sql != null && sql.length() > largeInputThreshold;
    }

    /**
     * 按语句数分块，每块为若干条语句原文按行拼接
     */
    public List<String> chunk(String sql, Dialect sourceDialect) {
        List<String> statements = SqlStatementSplitter.split(sql, sourceDialect);
        List<String> chunks = new ArrayList<>();
        for (int i = 0; i < statements.size(); i += chunkStatementCount) {
            chunks.add(String.join("\n", statements.subList(i, Math.min(statements.size(), i + chunkStatementCount))));
        }
        return chunks;
    }

    /**
     * 分块并行转换并合并结果
     *
     * @param chunkConverter 单个分块的完整转换流程
     */
    public ConversionResult convert(String sql, Dialect sourceDialect, Dialect targetDialect,
                                    Function<String, ConversionResult> chunkConverter) {
        List<String> chunks = chunk(sql, sourceDialect);
        log.info("大输入分块转换, 字符数={}, 分块数={}, 每块语句数={}", sql.length(), chunks.size(), chunkStatementCount);

        ExecutorService pool = executor();
        List<Future<ChunkResult>> futures = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            final int index = i;
            final String chunk = chunks.get(i);
            futures.add(pool.submit(() -> convertChunk(index, chunk, chunkConverter)));
        }

        List<ChunkResult> results = new ArrayList<>(chunks.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), i, chunks.get(i)));
        }
        results.sort(Comparator.comparingInt(ChunkResult::getIndex));
        return merge(results, sourceDialect, targetDialect);
    }

    private static ChunkResult convertChunk(int index, String chunk, Function<String, ConversionResult> chunkConverter) {
        try {
            return new ChunkResult(index, chunkConverter.apply(chunk));
        } catch (RuntimeException e) {
            log.error("分块 {} 转换异常", index, e);
            return failed(index, chunk, e.getMessage());
        }
    }

    private static ChunkResult await(Future<ChunkResult> future, int index, String chunk) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(index, chunk, "转换被中断");
        } catch (ExecutionException e) {
            log.error("分块 {} 执行失败", index, e.getCause());
            return failed(index, chunk, String.valueOf(e.getCause()));
        }
    }

    private static ChunkResult failed(int index, String chunk, String reason) {
        ConversionResult result = ConversionResult.builder()
                .convertedSql(chunk)
                .warning(ConversionWarning.of(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.ERROR,
                        "第 " + (index + 1) + " 个分块转换失败，已保留原文: " + reason, "请单独转换该分块并人工复核"))
                .recoveryState(RecoveryState.UNRECOVERED)
                .build();
        return new ChunkResult(index, result);
    }

    private static ConversionResult merge(List<ChunkResult> results, Dialect sourceDialect, Dialect targetDialect) {
        ConversionResult.ConversionResultBuilder builder = ConversionResult.builder()
                .sourceDialect(sourceDialect)
                .targetDialect(targetDialect)
                .chunkCount(results.size());
        List<String> parts = new ArrayList<>(results.size());
        ValidationInfo validation = null;
        StatementComplexity complexity = null;
        RecoveryState recovery = RecoveryState.NOT_NEEDED;
        for (ChunkResult chunk : results) {
            ConversionResult r = chunk.getResult();
            parts.add(r.getConvertedSql());
            builder.warnings(r.getWarnings());
            builder.appliedRules(r.getAppliedRules());
            validation = validation == null ? r.getValidation() : validation.and(r.getValidation());
            complexity = complexity == null ? r.getComplexity() : complexity.plus(r.getComplexity());
            recovery = recovery.worst(r.getRecoveryState());
        }
        return builder.convertedSql(String.join("\n", parts))
                .validation(validation)
                .complexity(complexity)
                .recoveryState(recovery)
                .build();
    }

    /**
     * 等待进行中的分块完成后关闭线程池，可重复调用
     */
    @PreDestroy
    public void shutdown() {
        ExecutorService pool;
        synchronized (this) {
            closed = true;
            pool = executor;
            executor = null;
        }
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("分块线程池 30s 内未结束，强制关闭");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 带序号的分块结果
     */
    @Getter
    @AllArgsConstructor
    static final class ChunkResult {

        private final int index;

        private final ConversionResult result;
    }
}
