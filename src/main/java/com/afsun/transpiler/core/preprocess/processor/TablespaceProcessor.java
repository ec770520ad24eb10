package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.SqlPatterns;

import java.util.regex.Pattern;

/**
 * 删除 TABLESPACE 子句
 */
public class TablespaceProcessor extends AbstractDdlProcessor {

    private static final Pattern TABLESPACE = Pattern.compile(
            "(?i)\\s*\\b(?:USING\\s+INDEX\\s+)?TABLESPACE\\s+" + SqlPatterns.IDENT);

    @Override
    protected boolean isEnabled(RuleConfig.DdlRules rules) {
        return rules.isRemoveTablespace();
    }

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        return remove(TABLESPACE, stmt, "DDL TABLESPACE removed", acc);
    }
}
