package com.afsun.transpiler.core;

import com.afsun.transpiler.core.config.RuleConfig;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 转换请求
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversionRequest {

    private String sql;

    private Dialect sourceDialect;

    private Dialect targetDialect;

    /**
     * 为空时按配置的默认规则档位处理
     */
    private RuleConfig ruleConfig;

    public ConversionRequest(String sql, Dialect sourceDialect, Dialect targetDialect) {
        this(sql, sourceDialect, targetDialect, null);
    }
}
