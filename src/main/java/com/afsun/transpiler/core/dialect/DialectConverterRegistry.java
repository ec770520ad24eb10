package com.afsun.transpiler.core.dialect;

import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.exceptions.UnsupportedDialectException;
import com.afsun.transpiler.core.mapping.DataTypeMappingRegistry;
import com.afsun.transpiler.core.mapping.FunctionMappingRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 按目标方言索引的转换策略表
 *
 * @author afsun
 */
@Component
public class DialectConverterRegistry {

    private final Map<Dialect, DialectConverter> converters;

    @Autowired
    public DialectConverterRegistry(List<DialectConverter> converters) {
        Map<Dialect, DialectConverter> map = new EnumMap<>(Dialect.class);
        for (DialectConverter c : converters) {
            if (map.put(c.target(), c) != null) {
                throw new IllegalStateException("目标方言 " + c.target() + " 存在多个转换策略");
            }
        }
        this.converters = Collections.unmodifiableMap(map);
    }

    /**
     * 使用默认映射表构建三种目标方言的策略
     */
    public static DialectConverterRegistry createDefault() {
        FunctionCallRewriter functions = new FunctionCallRewriter(new FunctionMappingRegistry());
        DataTypeRewriter types = new DataTypeRewriter(new DataTypeMappingRegistry());
        return new DialectConverterRegistry(Arrays.<DialectConverter>asList(
                new OracleDialectConverter(functions, types),
                new MySqlDialectConverter(functions, types),
                new PostgreSqlDialectConverter(functions, types)));
    }

    public DialectConverter forTarget(Dialect target) {
        DialectConverter converter = target == null ? null : converters.get(target);
        if (converter == null) {
            throw new UnsupportedDialectException("未找到目标方言 {} 的转换策略", target);
        }
        return converter;
    }
}
