package com.afsun.transpiler.core;

/**
 * 转换告警类别
 */
public enum WarningType {

    /**
     * 目标方言没有等价函数或对象
     */
    UNSUPPORTED_FUNCTION,

    SYNTAX_DIFFERENCE,

    MANUAL_REVIEW_NEEDED,

    PERFORMANCE,

    DATA_TYPE_MISMATCH,

    /**
     * 只转换了构造的一部分
     */
    PARTIAL_SUPPORT
}
