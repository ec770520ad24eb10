package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;

import java.util.regex.Pattern;

public class ParallelProcessor extends AbstractDdlProcessor {

    private static final Pattern PARALLEL = Pattern.compile(
            "(?i)\\s*\\b(?:NOPARALLEL\\b|PARALLEL\\b(?:\\s+\\d+|\\s*\\([^()]*\\))?)");

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        return removeTopLevel(PARALLEL, stmt, "DDL PARALLEL removed", acc);
    }
}
