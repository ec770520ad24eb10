package com.afsun.transpiler.core.exceptions;

import org.apache.commons.lang3.ArrayUtils;
import org.slf4j.helpers.MessageFormatter;

/**
 * 方言配置错误：方言为空、无法识别或组合不受支持，请求在转换开始前即被拒绝
 *
 * @author afsun
 */
public class UnsupportedDialectException extends ConversionException {

    public UnsupportedDialectException(String message, Object... args) {
        super("DIALECT_CONFIG_ERROR",
                MessageFormatter.arrayFormat(message, trimLastThrowable(args)).getMessage(),
                "请指定 ORACLE、MYSQL、POSTGRESQL 之一作为源方言和目标方言",
                extractThrowable(args));
    }

    public UnsupportedDialectException(String message) {
        super("DIALECT_CONFIG_ERROR", message, "请指定 ORACLE、MYSQL、POSTGRESQL 之一作为源方言和目标方言");
    }

    private static Throwable extractThrowable(Object[] args) {
        if (ArrayUtils.isEmpty(args)) {
            return null;
        }
        Object last = args[args.length - 1];
        if (last instanceof Throwable) {
            return (Throwable) last;
        }
        return null;
    }

    private static Object[] trimLastThrowable(Object[] argumentArray) {
        if (ArrayUtils.isEmpty(argumentArray) || extractThrowable(argumentArray) == null) {
            return argumentArray;
        }
        return ArrayUtils.remove(argumentArray, argumentArray.length - 1);
    }
}
