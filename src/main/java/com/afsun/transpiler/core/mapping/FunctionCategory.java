package com.afsun.transpiler.core.mapping;

import com.afsun.transpiler.core.config.RuleConfig;

/**
 * 函数分类，用于按规则配置开关整类映射
 */
public enum FunctionCategory {
    NULL_HANDLING,
    CONDITIONAL,
    DATE,
    STRING,
    NUMERIC,
    SYSTEM;

    public boolean isEnabled(RuleConfig.FunctionRules rules) {
        switch (this) {
            case NULL_HANDLING:
                return rules.isConvertNullHandling();
            case CONDITIONAL:
                return rules.isConvertConditional();
            case DATE:
                return rules.isConvertDateFunctions();
            case STRING:
                return rules.isConvertStringFunctions();
            case NUMERIC:
                return rules.isConvertNumericFunctions();
            case SYSTEM:
            default:
                return rules.isConvertSystemFunctions();
        }
    }
}
