package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;

import java.util.regex.Pattern;

/**
 * 删除约束后的 ENABLE/DISABLE [VALIDATE|NOVALIDATE] 与 RELY
 */
public class ConstraintStateProcessor extends AbstractDdlProcessor {

    private static final Pattern CONSTRAINT_STATE = Pattern.compile(
            "(?i)\\s*\\b(?:ENABLE|DISABLE)\\b(?!\\s+(?:ROW\\s+MOVEMENT|TRIGGER|RULE|ROW\\s+LEVEL|KEYS|ALL\\b|CONSTRAINT\\b|PRIMARY\\b|UNIQUE\\b))"
                    + "(?:\\s+(?:VALIDATE|NOVALIDATE)\\b)?");

    private static final Pattern RELY = Pattern.compile("(?i)\\s*\\b(?:NO)?RELY\\b");

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        String out = remove(CONSTRAINT_STATE, stmt, "DDL constraint state removed", acc);
        return remove(RELY, out, "DDL RELY removed", acc);
    }
}
