package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 目标不是 MySQL 时去掉 ENGINE、CHARSET 等表选项，列注释和表注释改为独立的 COMMENT ON 语句
 *
 * @author afsun
 */
public class MySqlTableOptionsProcessor extends AbstractDdlProcessor {

    private static final Pattern TABLE_OPTION = Pattern.compile(
            "(?i)\\s*,?\\s*(?:\\b(?:ENGINE|TYPE|CHARSET|CHARACTER\\s+SET|COLLATE|AUTO_INCREMENT|ROW_FORMAT|AVG_ROW_LENGTH"
                    + "|KEY_BLOCK_SIZE|STATS_PERSISTENT|PACK_KEYS|CHECKSUM|DELAY_KEY_WRITE)\\s*=\\s*\\w+"
                    + "|\\bDEFAULT\\s+(?:CHARSET|CHARACTER\\s+SET|COLLATE)\\s*=?\\s*\\w+)");

    private static final Pattern TABLE_COMMENT = Pattern.compile(
            "(?i)\\s*\\bCOMMENT\\s*=?\\s*(" + SqlPatterns.LITERAL + ")");

    private static final Pattern COLUMN_COMMENT = Pattern.compile(
            "(?i)\\s*\\bCOMMENT\\s+(" + SqlPatterns.LITERAL + ")");

    private static final Pattern COLUMN_CHARSET = Pattern.compile(
            "(?i)\\s*\\b(?:CHARACTER\\s+SET|CHARSET)\\s+\\w+|\\s*\\bCOLLATE\\s+\\w+");

    private static final Pattern ON_UPDATE = Pattern.compile(
            "(?i)\\s*\\bON\\s+UPDATE\\s+CURRENT_TIMESTAMP(?:\\s*\\(\\s*\\d*\\s*\\))?");

    private static final Pattern TABLE_NAME = Pattern.compile(
            "(?is)\\bTABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?(" + SqlPatterns.QUALIFIED_IDENT + ")\\s*\\(");

    private static final Pattern COLUMN_NAME = Pattern.compile("^\\s*(" + SqlPatterns.IDENT + ")");

    @Override
    public boolean isEnabled(ConversionContext ctx) {
        return ctx.getTarget() != Dialect.MYSQL;
    }

    @Override
    protected boolean appliesTo(String stmt) {
        return SqlPatterns.CREATE_TABLE.matcher(stmt).find() || SqlPatterns.ALTER_TABLE.matcher(stmt).find();
    }

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        Matcher name = TABLE_NAME.matcher(stmt);
        if (!name.find()) {
            return removeTopLevel(TABLE_OPTION, stmt, "DDL MySQL table options removed", acc);
        }
        String table = name.group(1);
        int open = name.end() - 1;
        int close = SqlTextUtils.findMatchingParen(stmt, open);
        if (close < 0) {
            return stmt;
        }
        boolean convertComments = ctx.getRuleConfig().getDdlRules().isConvertComments();
        List<String> comments = new ArrayList<>();

        StringBuilder body = new StringBuilder();
        List<String> elements = SqlTextUtils.splitTopLevel(stmt.substring(open + 1, close), ',');
        for (int i = 0; i < elements.size(); i++) {
            String element = elements.get(i);
            Matcher cm = COLUMN_COMMENT.matcher(element);
            if (cm.find()) {
                Matcher col = COLUMN_NAME.matcher(element);
                if (convertComments && col.find()) {
                    comments.add("COMMENT ON COLUMN " + table + "." + col.group(1) + " IS " + cm.group(1));
                }
                element = element.substring(0, cm.start()) + element.substring(cm.end());
            }
            element = COLUMN_CHARSET.matcher(element).replaceAll("");
            Matcher onUpdate = ON_UPDATE.matcher(element);
            if (onUpdate.find()) {
                acc.warn(WarningType.UNSUPPORTED_FUNCTION, WarningSeverity.WARNING,
                        "ON UPDATE CURRENT_TIMESTAMP 在 " + ctx.getTarget().getDisplayName() + " 中不存在，已移除",
                        "请使用触发器维护更新时间", ctx.snippet(element));
                element = onUpdate.replaceAll("");
            }
            body.append(i == 0 ? "" : ",").append(element);
        }
        String head = stmt.substring(0, open + 1);
        String tail = stmt.substring(close);
        Matcher tc = TABLE_COMMENT.matcher(tail);
        if (tc.find()) {
            if (convertComments) {
                comments.add(0, "COMMENT ON TABLE " + table + " IS " + tc.group(1));
            }
            tail = tail.substring(0, tc.start()) + tail.substring(tc.end());
        }
        tail = TABLE_OPTION.matcher(tail).replaceAll("");
        String rebuilt = head + body + tail;
        rebuilt = acc.apply("DDL MySQL table options removed", stmt, rebuilt);
        if (comments.isEmpty()) {
            return rebuilt;
        }
        acc.addRule("DDL MySQL COMMENT -> COMMENT ON");
        StringBuilder sb = new StringBuilder(rebuilt.replaceAll("\\s+$", ""));
        for (String c : comments) {
            sb.append(";\n").append(c);
        }
        return sb.toString();
    }
}
