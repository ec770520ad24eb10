package com.afsun.transpiler.core.mapping;

import com.afsun.transpiler.core.Dialect;
import lombok.Value;

/**
 * 源方言到目标方言的组合，用作映射表的键
 */
@Value(staticConstructor = "of")
public class DialectPair {
    Dialect source;
    Dialect target;

    @Override
    public String toString() {
        return source + "->" + target;
    }
}
