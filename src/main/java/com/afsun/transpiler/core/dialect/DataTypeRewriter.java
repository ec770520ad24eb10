package com.afsun.transpiler.core.dialect;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.mapping.DataTypeMappingRegistry;
import com.afsun.transpiler.core.mapping.DataTypeMappingRegistry.CompiledRule;
import com.afsun.transpiler.core.mapping.DataTypeMappingRule;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按数据类型映射表改写列定义与 CAST 中的类型
 *
 * @author afsun
 */
@Component
public class DataTypeRewriter {

    /**
     * 列定义：左括号或逗号之后、ADD/MODIFY 之后的 "列名 类型"
     */
    private static final Pattern COLUMN_DEFINITION = Pattern.compile(
            "(?i)(?:(?<=[(,])|\\bADD\\s+(?:COLUMN\\s+)?|\\bMODIFY\\s+(?:COLUMN\\s+)?)\\s*"
                    + "(?!(?:CONSTRAINT|PRIMARY|UNIQUE|FOREIGN|CHECK|KEY|INDEX|PARTITION|SUBPARTITION)\\b)"
                    + SqlPatterns.IDENT + "\\s+");

    /**
     * PostgreSQL: ALTER COLUMN c [SET DATA] TYPE t
     */
    private static final Pattern ALTER_COLUMN_TYPE = Pattern.compile(
            "(?i)\\bALTER\\s+COLUMN\\s+" + SqlPatterns.IDENT + "\\s+(?:SET\\s+DATA\\s+)?TYPE\\s+");

    private static final Pattern CAST_CALL = Pattern.compile("(?i)\\bCAST\\s*\\(");

    private static final Pattern AS_KEYWORD = Pattern.compile("(?i)\\bAS\\s+");

    private static final Pattern UNSIGNED = Pattern.compile("(?i)\\s+UNSIGNED\\b(?:\\s+ZEROFILL\\b)?");

    private static final Pattern LENGTH_SEMANTICS = Pattern.compile("(?i)\\s*\\b(?:BYTE|CHAR)\\s*$");

    private final DataTypeMappingRegistry registry;

    public DataTypeRewriter(DataTypeMappingRegistry registry) {
        this.registry = registry;
    }

    public String rewrite(String text, ConversionContext ctx, ConversionAccumulator acc) {
        return SqlTextUtils.mapStatements(text, stmt -> rewriteStatement(stmt, ctx, acc));
    }

    private String rewriteStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        List<int[]> typePositions = new ArrayList<>();
        boolean definesColumns = SqlPatterns.CREATE_TABLE.matcher(stmt).find()
                || SqlPatterns.ALTER_TABLE.matcher(stmt).find()
                || SqlPatterns.CREATE_TYPE.matcher(stmt).find();
        if (definesColumns) {
            Matcher m = COLUMN_DEFINITION.matcher(stmt);
            while (m.find()) {
                typePositions.add(new int[]{m.end()});
            }
            Matcher alter = ALTER_COLUMN_TYPE.matcher(stmt);
            while (alter.find()) {
                typePositions.add(new int[]{alter.end()});
            }
        }
        Matcher cast = CAST_CALL.matcher(stmt);
        while (cast.find()) {
            int open = cast.end() - 1;
            int close = SqlTextUtils.findMatchingParen(stmt, open);
            if (close < 0) {
                continue;
            }
            int asPos = lastTopLevelAs(stmt, open + 1, close);
            if (asPos > 0) {
                typePositions.add(new int[]{asPos});
            }
        }
        if (typePositions.isEmpty()) {
            return stmt;
        }
        typePositions.sort((a, b) -> Integer.compare(a[0], b[0]));

        StringBuilder out = new StringBuilder(stmt.length());
        int pos = 0;
        for (int[] p : typePositions) {
            int start = p[0];
            if (start < pos) {
                continue;
            }
            Replacement r = matchType(stmt, start, ctx, acc);
            if (r == null) {
                continue;
            }
            out.append(stmt, pos, start).append(r.text);
            pos = r.end;
        }
        out.append(stmt.substring(pos));
        String result = out.toString();
        if (definesColumns && ctx.getSource() == Dialect.MYSQL && ctx.getTarget() != Dialect.MYSQL) {
            String stripped = UNSIGNED.matcher(result).replaceAll("");
            if (!stripped.equals(result)) {
                acc.warn(WarningType.DATA_TYPE_MISMATCH, WarningSeverity.WARNING,
                        "UNSIGNED 修饰在 " + ctx.getTarget().getDisplayName() + " 中不存在，已移除",
                        "如需保证非负可增加 CHECK (col >= 0) 约束", ctx.snippet(stmt));
                result = acc.apply("DataType UNSIGNED removed", result, stripped);
            }
        }
        return result;
    }

    private static int lastTopLevelAs(String s, int from, int to) {
        Matcher m = AS_KEYWORD.matcher(s);
        m.region(from, to);
        int found = -1;
        while (m.find()) {
            if (SqlTextUtils.depthAt(s, from, m.start()) == 0) {
                found = m.end();
            }
        }
        return found;
    }

    private Replacement matchType(String stmt, int start, ConversionContext ctx, ConversionAccumulator acc) {
        RuleConfig.DataTypeRules rules = ctx.getRuleConfig().getDataTypeRules();
        for (CompiledRule compiled : registry.rulesFor(ctx.getSource(), ctx.getTarget())) {
            DataTypeMappingRule rule = compiled.getRule();
            Matcher tm = compiled.getPattern().matcher(stmt);
            tm.region(start, stmt.length());
            tm.useTransparentBounds(true);
            if (!tm.lookingAt()) {
                continue;
            }
            if (!rule.getCategory().isEnabled(rules)) {
                return null;
            }
            String precision = tm.group(1);
            if (precision == null && tm.groupCount() > 1) {
                precision = tm.group(2);
            }
            String original = stmt.substring(start, tm.end());
            String text = buildTargetType(rule, precision, ctx, acc, original);
            if (text.equalsIgnoreCase(original.replaceAll("\\s+", " "))) {
                // 同名映射只用于占位，原文不动
                return new Replacement(original, tm.end());
            }
            acc.addRule(rule.ruleName());
            return new Replacement(text, tm.end());
        }
        return null;
    }

    private String buildTargetType(DataTypeMappingRule rule, String precision, ConversionContext ctx,
                                   ConversionAccumulator acc, String original) {
        String target = rule.getTargetType();
        if (rule.getWarningMessage() != null) {
            acc.warn(WarningType.DATA_TYPE_MISMATCH, WarningSeverity.WARNING, rule.getWarningMessage(),
                    null, ctx.snippet(original));
        }
        if (precision == null) {
            if ("NUMBER".equalsIgnoreCase(rule.getSourceType()) && ctx.getTarget() == Dialect.MYSQL) {
                acc.warn(WarningType.DATA_TYPE_MISMATCH, WarningSeverity.INFO,
                        "NUMBER 未指定精度，MySQL DECIMAL 默认为 (10,0)，已改为 DECIMAL(38,10)",
                        "请根据实际数据范围调整精度", ctx.snippet(original));
                return "DECIMAL(38,10)";
            }
            return target;
        }
        if (rule.getPrecision() == DataTypeMappingRule.PrecisionHandling.DROP || target.contains("(")) {
            return target;
        }
        String p = precision.trim().replace("*", "38");
        if (ctx.getRuleConfig().getDataTypeRules().isRemoveByteSuffix() || ctx.getTarget() != Dialect.ORACLE) {
            p = LENGTH_SEMANTICS.matcher(p).replaceAll("");
        }
        int space = target.indexOf(' ');
        if (space > 0) {
            return target.substring(0, space) + "(" + p + ")" + target.substring(space);
        }
        return target + "(" + p + ")";
    }

    private static final class Replacement {
        private final String text;
        private final int end;

        Replacement(String text, int end) {
            this.text = text;
            this.end = end;
        }
    }
}
