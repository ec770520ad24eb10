package com.afsun.transpiler.core.recovery;

import com.afsun.transpiler.core.ConversionWarning;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 一轮修复的汇总结果
 *
 * @author afsun
 */
@Getter
public class RecoveryOutcome {

    /**
     * 修复后的SQL，未修复时为原文
     */
    private final String sql;

    private final List<RecoveryAttempt> attempts;

    private final List<ConversionWarning> warnings;

    private final boolean success;

    public RecoveryOutcome(String sql, List<RecoveryAttempt> attempts, List<ConversionWarning> warnings, boolean success) {
        this.sql = sql;
        this.attempts = Collections.unmodifiableList(attempts);
        this.warnings = Collections.unmodifiableList(warnings);
        this.success = success;
    }

    /**
     * 成功尝试中最低的可信度，没有成功尝试时为 0
     */
    public double getConfidence() {
        double min = 1.0;
        boolean any = false;
        for (RecoveryAttempt attempt : attempts) {
            if (attempt.isSuccess()) {
                min = Math.min(min, attempt.getConfidence());
                any = true;
            }
        }
        return any ? min : 0.0;
    }

    /**
     * 第一个成功的策略名，没有时为 null
     */
    public String getStrategyName() {
        for (RecoveryAttempt attempt : attempts) {
            if (attempt.isSuccess()) {
                return attempt.getStrategyName();
            }
        }
        return null;
    }
}
