package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.SqlPatterns;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MySQL 没有 COMMENT ON 语句：表注释改为 ALTER TABLE ... COMMENT，列注释删除并告警
 *
 * @author afsun
 */
public class CommentOnProcessor extends AbstractDdlProcessor {

    private static final Pattern COMMENT_ON = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "COMMENT\\s+ON\\s+(TABLE|COLUMN|VIEW|MATERIALIZED\\s+VIEW|INDEX|SEQUENCE)\\s+("
                    + SqlPatterns.QUALIFIED_IDENT + ")\\s+IS\\s+(" + SqlPatterns.LITERAL + "|NULL)\\s*$");

    @Override
    public boolean isEnabled(ConversionContext ctx) {
        return ctx.getTarget() == Dialect.MYSQL && isEnabled(ctx.getRuleConfig().getDdlRules());
    }

    @Override
    protected boolean isEnabled(RuleConfig.DdlRules rules) {
        return rules.isConvertComments();
    }

    @Override
    protected boolean appliesTo(String stmt) {
        return COMMENT_ON.matcher(stmt).find();
    }

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        Matcher m = COMMENT_ON.matcher(stmt);
        if (!m.find()) {
            return stmt;
        }
        String kind = m.group(1).toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        if ("TABLE".equals(kind)) {
            String lead = stmt.substring(0, stmt.length() - stmt.replaceAll("^\\s+", "").length());
            acc.addRule("DDL COMMENT ON TABLE -> ALTER TABLE COMMENT");
            return lead + "ALTER TABLE " + m.group(2) + " COMMENT = " + m.group(3);
        }
        acc.warn(WarningType.UNSUPPORTED_FUNCTION, WarningSeverity.WARNING,
                "MySQL 不支持 COMMENT ON " + kind + "，该语句已移除",
                "列注释需在 ALTER TABLE ... MODIFY COLUMN 的完整列定义中用 COMMENT 指定", ctx.snippet(stmt));
        acc.addRule("DDL COMMENT ON " + kind + " removed");
        return null;
    }
}
