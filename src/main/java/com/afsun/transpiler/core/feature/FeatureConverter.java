package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.config.RuleConfig;

/**
 * 针对单一语法特性（MERGE、PIVOT、序列等）的转换器。
 * 输入输出均为屏蔽后的文本，字符串和注释不会被匹配到。
 *
 * @author afsun
 */
public interface FeatureConverter {

    String name();

    /**
     * 执行顺序，小的先执行
     */
    int order();

    boolean isEnabled(RuleConfig config);

    /**
     * 廉价的关键字预检，返回 false 时跳过 {@link #convert}
     */
    boolean isApplicable(String maskedSql, ConversionContext ctx);

    String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc);
}
