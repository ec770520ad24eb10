package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;

import java.util.regex.Pattern;

/**
 * 删除 LOGGING / NOLOGGING
 */
public class LoggingProcessor extends AbstractDdlProcessor {

    private static final Pattern LOGGING = Pattern.compile("(?i)\\s*\\b(?:NO)?LOGGING\\b");

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        return removeTopLevel(LOGGING, stmt, "DDL LOGGING removed", acc);
    }
}
