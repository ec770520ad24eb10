package com.afsun.transpiler.core.recovery;

import com.afsun.transpiler.core.ConversionWarning;
import lombok.Getter;
import lombok.ToString;

/**
 * 单个修复策略的一次尝试结果
 *
 * @author afsun
 */
@Getter
@ToString
public class RecoveryAttempt {

    private final String recoveredSql;

    private final boolean success;

    private final double confidence;

    private final String strategyName;

    /**
     * 修复说明，可能为 null
     */
    private final ConversionWarning warning;

    private RecoveryAttempt(String recoveredSql, boolean success, double confidence, String strategyName,
                            ConversionWarning warning) {
        this.recoveredSql = recoveredSql;
        this.success = success;
        this.confidence = confidence;
        this.strategyName = strategyName;
        this.warning = warning;
    }

    public static RecoveryAttempt success(String recoveredSql, double confidence, String strategyName,
                                          ConversionWarning warning) {
        return new RecoveryAttempt(recoveredSql, true, confidence, strategyName, warning);
    }

    /**
     * 未能修复，返回原文
     */
    public static RecoveryAttempt failure(String sql, String strategyName) {
        return new RecoveryAttempt(sql, false, 0.0, strategyName, null);
    }
}
