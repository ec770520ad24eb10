package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;

import java.util.regex.Pattern;

public class RowDependenciesProcessor extends AbstractDdlProcessor {

    private static final Pattern ROW_DEPENDENCIES = Pattern.compile("(?i)\\s*\\b(?:NO)?ROWDEPENDENCIES\\b");

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        return removeTopLevel(ROW_DEPENDENCIES, stmt, "DDL ROWDEPENDENCIES removed", acc);
    }
}
