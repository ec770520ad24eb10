package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.preprocess.SyntaxProcessor;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 表结构DDL上的物理属性处理器基类。目标为 Oracle 时原样保留，不执行。
 *
 * @author afsun
 */
public abstract class AbstractDdlProcessor implements SyntaxProcessor {

    @Override
    public String name() {
        return getClass().getSimpleName();
    }

    @Override
    public boolean isEnabled(ConversionContext ctx) {
        return ctx.getTarget() != Dialect.ORACLE && isEnabled(ctx.getRuleConfig().getDdlRules());
    }

    /**
     * DdlRules 中对应的开关，默认开启
     */
    protected boolean isEnabled(RuleConfig.DdlRules rules) {
        return true;
    }

    /**
     * 是否处理该语句，默认只处理建表、改表、建索引、建物化视图
     */
    protected boolean appliesTo(String stmt) {
        return SqlPatterns.isStorageDdl(stmt);
    }

    @Override
    public String process(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        return SqlTextUtils.mapStatements(maskedSql, stmt -> appliesTo(stmt) ? processStatement(stmt, ctx, acc) : stmt);
    }

    protected abstract String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc);

    /**
     * 删除全部匹配，并在变化时记录规则
     */
    protected static String remove(Pattern pattern, String stmt, String rule, ConversionAccumulator acc) {
        return acc.apply(rule, stmt, pattern.matcher(stmt).replaceAll(""));
    }

    /**
     * 只删除括号深度为 0 的匹配，避免误删同名列
     */
    protected static String removeTopLevel(Pattern pattern, String stmt, String rule, ConversionAccumulator acc) {
        Matcher m = pattern.matcher(stmt);
        StringBuilder sb = new StringBuilder(stmt.length());
        int pos = 0;
        while (m.find()) {
            if (SqlTextUtils.depthAt(stmt, 0, m.start()) != 0) {
                continue;
            }
            sb.append(stmt, pos, m.start());
            pos = m.end();
        }
        sb.append(stmt.substring(pos));
        return acc.apply(rule, stmt, sb.toString());
    }
}
