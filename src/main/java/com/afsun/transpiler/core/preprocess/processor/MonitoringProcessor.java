package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;

import java.util.regex.Pattern;

public class MonitoringProcessor extends AbstractDdlProcessor {

    private static final Pattern MONITORING = Pattern.compile("(?i)\\s*\\b(?:NO)?MONITORING\\b");

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        return removeTopLevel(MONITORING, stmt, "DDL MONITORING removed", acc);
    }
}
