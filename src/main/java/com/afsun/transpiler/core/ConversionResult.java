package com.afsun.transpiler.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一次转换的最终结果
 *
 * @author afsun
 */
@Value
@Builder(toBuilder = true)
public class ConversionResult {

    String convertedSql;

    Dialect sourceDialect;

    Dialect targetDialect;

    @Singular
    List<ConversionWarning> warnings;

    /**
     * 按应用顺序记录的规则，不去重
     */
    @Singular
    List<String> appliedRules;

    long elapsedMillis;

    ValidationInfo validation;

    StatementComplexity complexity;

    @Builder.Default
    RecoveryState recoveryState = RecoveryState.NOT_NEEDED;

    @Builder.Default
    int chunkCount = 1;

    public boolean hasErrors() {
        return warnings.stream().anyMatch(ConversionWarning::isError);
    }

    /**
     * 转换是否成功：已产出SQL，且没有任何 ERROR 级告警
     */
    public boolean isSuccess() {
        return convertedSql != null && !hasErrors();
    }
}
