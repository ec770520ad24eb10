package com.afsun.transpiler.core;

import lombok.Value;

/**
 * 校验结果摘要，具体问题以告警形式进入 {@link ConversionResult#getWarnings()}
 */
@Value
public class ValidationInfo {

    /**
     * 没有 ERROR 级别的校验问题
     */
    boolean passed;

    int issueCount;

    boolean bracketsBalanced;

    boolean quotesBalanced;

    public ValidationInfo and(ValidationInfo other) {
        if (other == null) {
            return this;
        }
        return new ValidationInfo(passed && other.passed, issueCount + other.issueCount,
                bracketsBalanced && other.bracketsBalanced, quotesBalanced && other.quotesBalanced);
    }
}
