package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.util.SqlPatterns;

import java.util.regex.Pattern;

/**
 * 列默认值 SYSDATE / SYSTIMESTAMP 改为 CURRENT_TIMESTAMP
 */
public class DefaultSysdateProcessor extends AbstractDdlProcessor {

    private static final Pattern DEFAULT_SYSDATE = Pattern.compile("(?i)\\bDEFAULT\\s+(?:SYSDATE|SYSTIMESTAMP)\\b");

    @Override
    protected boolean appliesTo(String stmt) {
        return SqlPatterns.isDdl(stmt);
    }

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        return acc.apply("DDL DEFAULT SYSDATE -> CURRENT_TIMESTAMP", stmt,
                DEFAULT_SYSDATE.matcher(stmt).replaceAll("DEFAULT CURRENT_TIMESTAMP"));
    }
}
