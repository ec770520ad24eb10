package com.afsun.transpiler.service.impl;

import com.afsun.transpiler.core.ConversionRequest;
import com.afsun.transpiler.core.ConversionResult;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.SqlConverter;
import com.afsun.transpiler.core.config.ConverterProperties;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.service.SqlConversionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;

/**
 * @author afsun
 */
@Service
@Slf4j
public class SqlConversionServiceImpl implements SqlConversionService {

    @Resource
    private SqlConverter sqlConverter;

    @Resource
    private ConverterProperties converterProperties;

    @Override
    public ConversionResult convert(ConversionRequest request) {
        RuleConfig ruleConfig = request.getRuleConfig();
        if (ruleConfig == null) {
            ruleConfig = RuleConfig.of(converterProperties.getDefaultProfile());
            log.debug("请求未指定规则配置，使用默认档位: {}", converterProperties.getDefaultProfile());
        }
        return sqlConverter.convert(request.getSql(), request.getSourceDialect(), request.getTargetDialect(), ruleConfig);
    }

    @Override
    public ConversionResult convert(String sql, String sourceDialect, String targetDialect) {
        return convert(new ConversionRequest(sql, Dialect.fromName(sourceDialect), Dialect.fromName(targetDialect)));
    }
}
