package com.afsun.transpiler.core.preprocess;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;

/**
 * 预处理步骤，作用于屏蔽后的整段SQL文本
 *
 * @author afsun
 */
public interface SyntaxProcessor {

    String name();

    /**
     * 当前目标方言与规则配置下是否执行
     */
    boolean isEnabled(ConversionContext ctx);

    /**
     * 改写屏蔽文本；只有文本发生变化时才记录规则
     */
    String process(String maskedSql, ConversionContext ctx, ConversionAccumulator acc);
}
