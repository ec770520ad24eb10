package com.afsun.transpiler.core.mapping;

import com.afsun.transpiler.core.Dialect;
import lombok.Builder;
import lombok.Value;

/**
 * 单条数据类型映射规则
 */
@Value
@Builder
public class DataTypeMappingRule {

    public enum PrecisionHandling {
        /**
         * 精度、标度原样保留
         */
        PRESERVE,
        /**
         * 丢弃源精度（如 MySQL 整型显示宽度），使用目标类型自带的精度
         */
        DROP
    }

    Dialect source;

    Dialect target;

    /**
     * 源类型，多个单词以单个空格分隔，如 "TIMESTAMP WITH TIME ZONE"
     */
    String sourceType;

    String targetType;

    @Builder.Default
    PrecisionHandling precision = PrecisionHandling.PRESERVE;

    DataTypeCategory category;

    String warningMessage;

    public String ruleName() {
        return "DataType " + sourceType + " -> " + targetType;
    }
}
