package com.afsun.transpiler.core.dialect;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;

/**
 * 面向某一目标方言的函数、数据类型与运算符转换策略
 *
 * @author afsun
 */
public interface DialectConverter {

    /**
     * 本策略负责的目标方言
     */
    Dialect target();

    /**
     * 在屏蔽后的文本上改写函数调用、数据类型和方言运算符
     *
     * @param maskedSql     屏蔽后的SQL
     * @param sourceDialect 源方言
     * @param ctx           转换上下文，目标方言须与 {@link #target()} 一致
     * @param acc           本步骤的告警与规则收集器
     * @return 改写后的屏蔽文本
     */
    String convertFunctionsAndTypes(String maskedSql, Dialect sourceDialect, ConversionContext ctx,
                                    ConversionAccumulator acc);
}
