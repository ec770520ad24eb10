package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.util.SqlPatterns;

import java.util.regex.Pattern;

/**
 * 删除建表语句的 CACHE / NOCACHE。序列的同名选项由序列转换处理，这里不动。
 */
public class TableCacheProcessor extends AbstractDdlProcessor {

    private static final Pattern CACHE = Pattern.compile("(?i)\\s*\\b(?:NOCACHE|CACHE)\\b(?!\\s+\\d)");

    @Override
    protected boolean appliesTo(String stmt) {
        return SqlPatterns.CREATE_TABLE.matcher(stmt).find();
    }

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        return removeTopLevel(CACHE, stmt, "DDL CACHE removed", acc);
    }
}
