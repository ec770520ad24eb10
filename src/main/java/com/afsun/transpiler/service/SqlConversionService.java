package com.afsun.transpiler.service;

import com.afsun.transpiler.core.ConversionRequest;
import com.afsun.transpiler.core.ConversionResult;

public interface SqlConversionService {

    /**
     * 请求未携带规则配置时使用配置的默认档位
     */
    ConversionResult convert(ConversionRequest request);

    /**
     * 按方言名称转换，名称无法识别时抛出方言配置异常
     */
    ConversionResult convert(String sql, String sourceDialect, String targetDialect);
}
