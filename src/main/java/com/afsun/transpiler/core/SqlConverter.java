package com.afsun.transpiler.core;

import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.exceptions.ConversionException;
import com.afsun.transpiler.core.exceptions.UnsupportedDialectException;

public interface SqlConverter {
    /**
     * 把SQL从源方言转换为目标方言
     *
     * @param sql           SQL脚本文本
     * @param sourceDialect 源方言
     * @param targetDialect 目标方言
     * @param ruleConfig    规则配置，为空时使用默认档位
     * @return 转换结果，包含转换后的SQL、告警和已应用的规则
     * @throws UnsupportedDialectException 方言为空或不受支持
     * @throws ConversionException 未预期的内部异常
     */
    ConversionResult convert(String sql, Dialect sourceDialect, Dialect targetDialect, RuleConfig ruleConfig);
}
