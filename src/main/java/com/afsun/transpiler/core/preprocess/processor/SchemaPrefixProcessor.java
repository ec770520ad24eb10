package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 去掉DDL对象名上的 schema 前缀，须在表空间处理之后执行
 * <p>
 * 只处理语句头部。视图、物化视图、CTAS 的查询体与触发器体中的 alias.column 不动
 */
public class SchemaPrefixProcessor extends AbstractDdlProcessor {

    private static final Pattern OBJECT_NAME = Pattern.compile(
            "(?i)(\\b(?:TABLE|INDEX|VIEW|SEQUENCE|SYNONYM|TYPE|REFERENCES|EXISTS)\\s+)"
                    + SqlPatterns.IDENT + "\\s*\\.\\s*(" + SqlPatterns.IDENT + ")(?![\\w$#]|\\s*\\.)");

    /**
     * CREATE INDEX ... ON 与 CREATE TRIGGER ... ON 的目标表
     */
    private static final Pattern ON_TARGET = Pattern.compile(
            "(?i)(\\bON\\s+)" + SqlPatterns.IDENT + "\\s*\\.\\s*(" + SqlPatterns.IDENT + ")(?![\\w$#]|\\s*\\.)");

    private static final Pattern CREATE_TRIGGER = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "CREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:EDITIONABLE\\s+|NONEDITIONABLE\\s+)?TRIGGER\\b");

    /**
     * 语句体的起点：AS SELECT / AS WITH / AS (SELECT，或过程体
     */
    private static final Pattern BODY_START = Pattern.compile(
            "(?i)\\bAS\\s*(?:\\(\\s*)?(?:SELECT|WITH)\\b|\\bBEGIN\\b|\\bDECLARE\\b");

    private static final Pattern COLUMN_NAME = Pattern.compile(
            "(?i)(\\bCOLUMN\\s+)" + SqlPatterns.IDENT + "\\s*\\.\\s*(" + SqlPatterns.IDENT + "\\s*\\.\\s*"
                    + SqlPatterns.IDENT + ")");

    private static final Pattern COMMENT_ON = Pattern.compile("(?is)" + SqlPatterns.LEAD + "COMMENT\\s+ON\\b");

    @Override
    protected boolean isEnabled(RuleConfig.DdlRules rules) {
        return rules.isRemoveSchemaPrefix();
    }

    @Override
    protected boolean appliesTo(String stmt) {
        return SqlPatterns.isDdl(stmt) || COMMENT_ON.matcher(stmt).find();
    }

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        int bodyStart = bodyStart(stmt);
        String head = stmt.substring(0, bodyStart);
        String newHead = OBJECT_NAME.matcher(head).replaceAll("$1$2");
        newHead = COLUMN_NAME.matcher(newHead).replaceAll("$1$2");
        if (SqlPatterns.CREATE_INDEX.matcher(stmt).find() || CREATE_TRIGGER.matcher(stmt).find()) {
            newHead = ON_TARGET.matcher(newHead).replaceFirst("$1$2");
        }
        String out = newHead + stmt.substring(bodyStart);
        if (!out.equals(stmt)) {
            acc.warn(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.INFO,
                    "DDL 对象名的 schema 前缀已移除", "请在目标库的默认 schema 下执行", ctx.snippet(stmt));
        }
        return acc.apply("DDL schema prefix removed", stmt, out);
    }

    private static int bodyStart(String stmt) {
        Matcher m = BODY_START.matcher(stmt);
        while (m.find()) {
            if (SqlTextUtils.depthAt(stmt, 0, m.start()) == 0) {
                return m.start();
            }
        }
        return stmt.length();
    }
}
