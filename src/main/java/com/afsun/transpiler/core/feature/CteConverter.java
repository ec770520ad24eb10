package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.exceptions.FeatureConversionException;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 公共表表达式：自引用的 CTE 在 MySQL / PostgreSQL 中补 RECURSIVE，Oracle 中去掉 RECURSIVE 与 MATERIALIZED 提示
 *
 * @author afsun
 */
@Component
public class CteConverter extends AbstractFeatureConverter {

    private static final Pattern WITH = Pattern.compile("(?is)" + SqlPatterns.LEAD + "WITH\\s+(RECURSIVE\\s+)?");

    private static final Pattern ENTRY = Pattern.compile(
            "(?is)\\G\\s*(" + SqlPatterns.IDENT + ")\\s*(\\([^()]*\\))?\\s*AS\\s*((?:NOT\\s+)?MATERIALIZED\\s*)?\\(");

    private static final Pattern NEXT_ENTRY = Pattern.compile("\\G\\s*,");

    private static final Pattern SEARCH_CYCLE = Pattern.compile("(?i)\\)\\s*(SEARCH\\s+(?:DEPTH|BREADTH)|CYCLE)\\b");

    private static final Pattern KEYWORD = Pattern.compile("(?i)\\bWITH\\b");

    @Override
    public int order() {
        return 900;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getSyntaxRules().isConvertRecursiveCte();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return KEYWORD.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        return SqlTextUtils.mapStatements(maskedSql, stmt -> convertStatement(stmt, ctx, acc));
    }

    private String convertStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        Matcher with = WITH.matcher(stmt);
        if (!with.find()) {
            return stmt;
        }
        boolean hasRecursive = with.group(1) != null;
        boolean selfReferencing = false;
        boolean missingColumns = false;
        StringBuilder out = new StringBuilder(stmt.length() + 16);
        int copied = with.end();
        int pos = with.end();
        Matcher entry = ENTRY.matcher(stmt);
        while (entry.find(pos)) {
            int open = entry.end() - 1;
            int close = SqlTextUtils.findMatchingParen(stmt, open);
            if (close < 0) {
                throw new FeatureConversionException("CTE " + entry.group(1) + " 的查询体括号不匹配",
                        ctx.snippet(stmt.substring(entry.start())));
            }
            String name = entry.group(1);
            String body = stmt.substring(open + 1, close);
            boolean recursive = Pattern.compile("(?i)(?<![\\w$#.\"`])" + Pattern.quote(name) + "(?![\\w$#\"`])")
                    .matcher(body).find();
            if (recursive) {
                selfReferencing = true;
                missingColumns |= entry.group(2) == null;
            }
            if (entry.group(3) != null && !to(ctx, Dialect.POSTGRESQL)) {
                out.append(stmt, copied, entry.start(3));
                copied = entry.end(3);
                acc.addRule("CTE MATERIALIZED hint removed");
            }
            pos = close + 1;
            Matcher next = NEXT_ENTRY.matcher(stmt);
            if (!next.find(pos)) {
                break;
            }
            pos = next.end();
        }
        out.append(stmt.substring(copied));
        String rest = out.toString();
        String head = stmt.substring(0, with.end());

        if (to(ctx, Dialect.ORACLE)) {
            if (hasRecursive) {
                head = stmt.substring(0, with.start(1)) + stmt.substring(with.end(1), with.end());
                acc.addRule("CTE RECURSIVE removed");
            }
            if (selfReferencing && missingColumns) {
                warn(acc, WarningType.SYNTAX_DIFFERENCE, "Oracle 递归 WITH 子句必须声明列别名清单",
                        "在 CTE 名称后补充 (col1, col2, ...)", ctx, stmt);
            }
        } else if (selfReferencing && !hasRecursive) {
            head = stmt.substring(0, with.end()) + "RECURSIVE ";
            acc.addRule("CTE RECURSIVE added");
        }
        if (to(ctx, Dialect.MYSQL) && selfReferencing && SEARCH_CYCLE.matcher(rest).find()) {
            warn(acc, WarningType.UNSUPPORTED_FUNCTION, "MySQL 递归 CTE 不支持 SEARCH / CYCLE 子句",
                    "请用路径列和深度列自行控制顺序与环检测", ctx, stmt);
        }
        return head + rest;
    }
}
