package com.afsun.transpiler.core.mapping;

import com.afsun.transpiler.core.Dialect;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * 单条函数映射规则
 *
 * @author afsun
 */
@Value
@Builder(toBuilder = true)
public class FunctionMappingRule {

    Dialect source;

    Dialect target;

    String sourceFunction;

    /**
     * 为空表示目标方言没有等价函数，原样保留并告警
     */
    String targetFunction;

    @Builder.Default
    ParameterTransform transform = ParameterTransform.DIRECT;

    FunctionCategory category;

    /**
     * 非空时每次命中都产生一条告警
     */
    String warningMessage;

    String suggestion;

    /**
     * 目标函数能接受的最大参数个数，超出时告警；为空表示不限制
     */
    Integer maxArguments;

    public String key() {
        return key(source, target, sourceFunction);
    }

    public static String key(Dialect source, Dialect target, String function) {
        return source + "_" + target + "_" + function.toUpperCase(Locale.ROOT);
    }

    public boolean isSupported() {
        return targetFunction != null;
    }

    public String ruleName() {
        return "Function " + sourceFunction + " -> " + (targetFunction == null ? "(unsupported)" : targetFunction);
    }
}
