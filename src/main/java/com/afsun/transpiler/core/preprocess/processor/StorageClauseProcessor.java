package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.config.RuleConfig;

import java.util.regex.Pattern;

/**
 * 删除 STORAGE (...) 子句，括号须平衡
 */
public class StorageClauseProcessor extends AbstractDdlProcessor {

    private static final Pattern STORAGE = Pattern.compile(
            "(?i)\\s*\\bSTORAGE\\s*\\((?:[^()]|\\([^()]*\\))*\\)");

    @Override
    protected boolean isEnabled(RuleConfig.DdlRules rules) {
        return rules.isRemoveStorageClause();
    }

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        return remove(STORAGE, stmt, "DDL STORAGE removed", acc);
    }
}
