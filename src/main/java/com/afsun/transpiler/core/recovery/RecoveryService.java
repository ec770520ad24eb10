package com.afsun.transpiler.core.recovery;

import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.afsun.transpiler.core.recovery.strategy.CommentRemovalStrategy;
import com.afsun.transpiler.core.recovery.strategy.HierarchicalRewriteStrategy;
import com.afsun.transpiler.core.recovery.strategy.HintRemovalStrategy;
import com.afsun.transpiler.core.recovery.strategy.ParenthesisBalanceStrategy;
import com.afsun.transpiler.core.recovery.strategy.PhysicalAttributeRemovalStrategy;
import com.afsun.transpiler.core.recovery.strategy.ReservedWordQuotingStrategy;
import com.afsun.transpiler.core.recovery.strategy.StringEscapeStrategy;
import com.afsun.transpiler.core.util.SqlTextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 解析失败后的文本修复服务。
 * <p>
 * 策略按可信度从高到低依次尝试。可信度只用于排序和报告，不会因为分值低而跳过某个策略。
 * 单条语句用 {@link #recoverFirst}，多语句脚本用 {@link #recoverSequentially}。
 *
 * @author afsun
 */
@Slf4j
@Component
public class RecoveryService {

    private final List<RecoveryStrategy> strategies;

    @Autowired
    public RecoveryService(List<RecoveryStrategy> strategies) {
        List<RecoveryStrategy> sorted = new ArrayList<>(strategies);
        sorted.sort(Comparator.comparingDouble(RecoveryStrategy::confidence).reversed());
        this.strategies = Collections.unmodifiableList(sorted);
    }

    /**
     * 默认的七个修复策略
     */
    public static RecoveryService createDefault() {
        return new RecoveryService(Arrays.<RecoveryStrategy>asList(
                new PhysicalAttributeRemovalStrategy(),
                new CommentRemovalStrategy(),
                new HintRemovalStrategy(),
                new ParenthesisBalanceStrategy(),
                new StringEscapeStrategy(),
                new ReservedWordQuotingStrategy(),
                new HierarchicalRewriteStrategy()));
    }

    public List<RecoveryStrategy> getStrategies() {
        return strategies;
    }

    /**
     * 单次修复：使用第一个适用且修复成功的策略
     */
    public RecoveryOutcome recoverFirst(String sql, SqlParseException error, Dialect dialect) {
        List<RecoveryAttempt> attempts = new ArrayList<>();
        List<ConversionWarning> warnings = new ArrayList<>();
        for (RecoveryStrategy strategy : strategies) {
            RecoveryAttempt attempt = tryStrategy(strategy, sql, error, dialect, warnings);
            if (attempt == null) {
                continue;
            }
            attempts.add(attempt);
            if (attempt.isSuccess()) {
                addIfPresent(warnings, attempt.getWarning());
                log.debug("修复策略 {} 生效, confidence={}", attempt.getStrategyName(), attempt.getConfidence());
                return new RecoveryOutcome(attempt.getRecoveredSql(), attempts, warnings, true);
            }
        }
        log.warn("没有可用的修复策略, dialect={}, sql={}", dialect, SqlTextUtils.shortSql(sql));
        return new RecoveryOutcome(sql, attempts, warnings, false);
    }

    /**
     * 顺序修复：依次应用全部适用的策略，后一个策略作用在前一个的结果上
     */
    public RecoveryOutcome recoverSequentially(String sql, SqlParseException error, Dialect dialect) {
        List<RecoveryAttempt> attempts = new ArrayList<>();
        List<ConversionWarning> warnings = new ArrayList<>();
        String current = sql;
        boolean changed = false;
        for (RecoveryStrategy strategy : strategies) {
            RecoveryAttempt attempt = tryStrategy(strategy, current, error, dialect, warnings);
            if (attempt == null) {
                continue;
            }
            attempts.add(attempt);
            if (attempt.isSuccess()) {
                log.debug("修复策略 {} 生效, confidence={}", attempt.getStrategyName(), attempt.getConfidence());
                current = attempt.getRecoveredSql();
                addIfPresent(warnings, attempt.getWarning());
                changed = true;
            }
        }
        if (!changed) {
            log.warn("顺序修复未改变SQL, dialect={}, sql={}", dialect, SqlTextUtils.shortSql(sql));
        }
        return new RecoveryOutcome(current, attempts, warnings, changed);
    }

    /**
     * 策略不适用时返回 null；策略抛出异常时记录人工复核告警并视为修复失败
     */
    private RecoveryAttempt tryStrategy(RecoveryStrategy strategy, String sql, SqlParseException error, Dialect dialect,
                                        List<ConversionWarning> warnings) {
        try {
            if (!strategy.canHandle(sql, error)) {
                return null;
            }
            return strategy.recover(sql, error, dialect);
        } catch (RuntimeException e) {
            log.warn("修复策略 {} 执行失败: {}", strategy.name(), e.getMessage());
            warnings.add(ConversionWarning.of(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.WARNING,
                    "修复策略 " + strategy.name() + " 执行失败: " + e.getMessage(), "请人工检查SQL语法",
                    SqlTextUtils.shortSql(sql)));
            return RecoveryAttempt.failure(sql, strategy.name());
        }
    }

    private static void addIfPresent(List<ConversionWarning> warnings, ConversionWarning warning) {
        if (warning != null) {
            warnings.add(warning);
        }
    }
}
