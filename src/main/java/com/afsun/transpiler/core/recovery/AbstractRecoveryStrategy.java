package com.afsun.transpiler.core.recovery;

import com.afsun.transpiler.core.ConversionWarning;

/**
 * 修复策略基类，持有名称和可信度
 *
 * @author afsun
 */
public abstract class AbstractRecoveryStrategy implements RecoveryStrategy {

    private final String name;

    private final double confidence;

    protected AbstractRecoveryStrategy(String name, double confidence) {
        this.name = name;
        this.confidence = confidence;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double confidence() {
        return confidence;
    }

    /**
     * 文本有变化且非空时视为修复成功
     */
    protected RecoveryAttempt attempt(String sql, String recovered, ConversionWarning warning) {
        if (recovered == null || recovered.trim().isEmpty() || recovered.equals(sql)) {
            return RecoveryAttempt.failure(sql, name);
        }
        return RecoveryAttempt.success(recovered, confidence, name, warning);
    }
}
