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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CREATE INDEX 方言差异：去掉目标库没有的索引类别，改写索引方法与函数索引写法。
 * 索引表达式里的函数由方言转换器按函数映射表统一改写。
 *
 * @author afsun
 */
@Component
public class IndexConverter extends AbstractFeatureConverter {

    private static final Pattern CREATE_INDEX = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "CREATE\\s+(UNIQUE\\s+)?(?:(BITMAP|FULLTEXT|SPATIAL)\\s+)?INDEX\\s+"
                    + "(CONCURRENTLY\\s+)?(IF\\s+NOT\\s+EXISTS\\s+)?(" + SqlPatterns.QUALIFIED_IDENT + ")\\s+"
                    + "(?:USING\\s+(\\w+)\\s+)?ON\\s+(?:ONLY\\s+)?(" + SqlPatterns.QUALIFIED_IDENT + ")\\s*"
                    + "(?:USING\\s+(\\w+)\\s*)?\\(");

    private static final Pattern REVERSE = Pattern.compile("(?i)\\s+REVERSE\\b");

    private static final Pattern TRAILING_USING = Pattern.compile("(?i)\\s*\\bUSING\\s+(BTREE|HASH)\\b");

    private static final Pattern PARTIAL_WHERE = Pattern.compile("(?is)\\s*\\bWHERE\\b.*$");

    private static final Pattern INCLUDE = Pattern.compile("(?is)\\s*\\bINCLUDE\\s*\\([^()]*\\)");

    /**
     * MySQL 前缀索引长度：col(10)
     */
    private static final Pattern PREFIX_LENGTH = Pattern.compile("^(\\s*" + SqlPatterns.IDENT + ")\\s*\\(\\s*\\d+\\s*\\)");

    private static final Pattern PLAIN_COLUMN = Pattern.compile(
            "(?i)^\\s*" + SqlPatterns.IDENT + "(?:\\s+(?:ASC|DESC))?(?:\\s+NULLS\\s+(?:FIRST|LAST))?\\s*$");

    private static final Pattern OPERATOR_CLASS = Pattern.compile("(?i)\\s+\\w+_ops\\b");

    private static final Pattern KEYWORD = Pattern.compile("(?i)\\bINDEX\\b");

    @Override
    public int order() {
        return 600;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getDdlRules().isConvertIndexes();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return KEYWORD.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        return SqlTextUtils.mapStatements(maskedSql, stmt -> {
            Matcher m = CREATE_INDEX.matcher(stmt);
            return m.find() ? convertIndex(stmt, m, ctx, acc) : stmt;
        });
    }

    private String convertIndex(String stmt, Matcher m, ConversionContext ctx, ConversionAccumulator acc) {
        int rulesBefore = acc.getAppliedRules().size();
        int open = m.end() - 1;
        int close = SqlTextUtils.findMatchingParen(stmt, open);
        if (close < 0) {
            throw new FeatureConversionException("CREATE INDEX 的列清单括号不匹配", ctx.snippet(stmt));
        }
        boolean unique = m.group(1) != null;
        String kind = m.group(2) == null ? null : m.group(2).toUpperCase(Locale.ROOT);
        String name = m.group(5);
        String table = m.group(7);
        String method = m.group(6) != null ? m.group(6) : m.group(8);
        String tail = stmt.substring(close + 1);

        List<String> keyParts = new ArrayList<>();
        for (String part : SqlTextUtils.splitArguments(stmt.substring(open + 1, close))) {
            keyParts.add(part.trim());
        }

        if ("BITMAP".equals(kind) && !to(ctx, Dialect.ORACLE)) {
            warn(acc, WarningType.UNSUPPORTED_FUNCTION, ctx.getTarget().getDisplayName() + " 不支持 BITMAP 索引，已改为普通 B-tree 索引",
                    to(ctx, Dialect.POSTGRESQL) ? "低基数列可考虑 BRIN 或部分索引" : "低基数列可考虑组合索引或不建索引",
                    ctx, stmt);
            acc.addRule("Index BITMAP removed");
            kind = null;
        }
        if ("FULLTEXT".equals(kind) && !to(ctx, Dialect.MYSQL)) {
            return keepLead(stmt, fullText(name, table, keyParts, stmt, ctx, acc));
        }
        if ("SPATIAL".equals(kind) && !to(ctx, Dialect.MYSQL)) {
            warn(acc, WarningType.UNSUPPORTED_FUNCTION, "SPATIAL 索引需要目标库的空间扩展，已改为普通索引",
                    to(ctx, Dialect.POSTGRESQL) ? "安装 PostGIS 后使用 USING GIST" : "使用 Oracle Spatial 的 MDSYS.SPATIAL_INDEX",
                    ctx, stmt);
            acc.addRule("Index SPATIAL removed");
            kind = null;
        }

        if (REVERSE.matcher(tail).find() && !to(ctx, Dialect.ORACLE)) {
            info(acc, WarningType.UNSUPPORTED_FUNCTION, "反向键索引 (REVERSE) 已去掉", null, ctx, stmt);
            tail = REVERSE.matcher(tail).replaceAll("");
            acc.addRule("Index REVERSE removed");
        }
        Matcher trailingUsing = TRAILING_USING.matcher(tail);
        if (trailingUsing.find()) {
            method = method == null ? trailingUsing.group(1) : method;
            tail = trailingUsing.replaceAll("");
        }

        String usingClause = indexMethod(method, stmt, ctx, acc);
        if (usingClause != null && (to(ctx, Dialect.POSTGRESQL) == (m.group(8) == null))) {
            acc.addRule("Index USING clause moved");
        }
        if (m.group(4) != null && !to(ctx, Dialect.POSTGRESQL)) {
            acc.addRule("Index IF NOT EXISTS removed");
        }

        if (!to(ctx, Dialect.POSTGRESQL)) {
            if (m.group(3) != null) {
                info(acc, WarningType.SYNTAX_DIFFERENCE, "CONCURRENTLY 为 PostgreSQL 特有，已去掉", null, ctx, stmt);
                acc.addRule("Index CONCURRENTLY removed");
            }
            Matcher where = PARTIAL_WHERE.matcher(tail);
            if (where.find()) {
                warn(acc, WarningType.UNSUPPORTED_FUNCTION, "部分索引的 WHERE 条件已注释，索引将覆盖全部行",
                        to(ctx, Dialect.ORACLE) ? "可用 CASE WHEN 函数索引模拟" : "可用生成列加索引模拟", ctx, stmt);
                tail = tail.substring(0, where.start()) + " " + ctx.comment(where.group().trim());
                acc.addRule("Partial index WHERE commented out");
            }
            Matcher include = INCLUDE.matcher(tail);
            if (include.find()) {
                info(acc, WarningType.SYNTAX_DIFFERENCE, "INCLUDE 覆盖列已去掉", "可把覆盖列追加到索引列末尾", ctx, stmt);
                tail = include.replaceAll("");
                acc.addRule("Index INCLUDE removed");
            }
        }

        List<String> converted = new ArrayList<>();
        boolean keyPartsChanged = false;
        for (String part : keyParts) {
            String c = convertKeyPart(part, ctx, acc);
            keyPartsChanged |= !c.equals(part);
            converted.add(c);
        }
        if (acc.getAppliedRules().size() == rulesBefore) {
            return stmt;
        }

        StringBuilder sb = new StringBuilder("CREATE ");
        if (unique) {
            sb.append("UNIQUE ");
        }
        if (kind != null) {
            sb.append(kind).append(' ');
        }
        sb.append("INDEX ");
        if (to(ctx, Dialect.POSTGRESQL)) {
            if (m.group(3) != null) {
                sb.append("CONCURRENTLY ");
            }
            if (m.group(4) != null) {
                sb.append("IF NOT EXISTS ");
            }
        }
        sb.append(name).append(" ON ").append(table);
        if (to(ctx, Dialect.POSTGRESQL) && usingClause != null) {
            sb.append(" USING ").append(usingClause).append(' ');
        } else if (m.group(8) == null) {
            sb.append(stmt, m.end(7), open);
        } else {
            sb.append(' ');
        }
        sb.append('(');
        sb.append(keyPartsChanged ? String.join(", ", converted) : stmt.substring(open + 1, close));
        sb.append(')');
        if (to(ctx, Dialect.MYSQL) && usingClause != null) {
            sb.append(" USING ").append(usingClause);
        }
        sb.append(tail);
        return keepLead(stmt, sb.toString());
    }

    private static String indexMethod(String method, String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        if (method == null) {
            return null;
        }
        String upper = method.toUpperCase(Locale.ROOT);
        if (to(ctx, Dialect.ORACLE)) {
            if (!"BTREE".equals(upper)) {
                warn(acc, WarningType.UNSUPPORTED_FUNCTION, "Oracle 不支持 " + upper + " 索引方法，已改为普通索引", null, ctx, stmt);
            }
            acc.addRule("Index USING " + upper + " removed");
            return null;
        }
        if (to(ctx, Dialect.MYSQL)) {
            if ("BTREE".equals(upper) || "HASH".equals(upper)) {
                return upper;
            }
            warn(acc, WarningType.UNSUPPORTED_FUNCTION, "MySQL 不支持 " + upper + " 索引方法，已改为普通索引",
                    "GIN 全文检索可改用 FULLTEXT 索引", ctx, stmt);
            acc.addRule("Index USING " + upper + " removed");
            return null;
        }
        return upper.toLowerCase(Locale.ROOT);
    }

    private String convertKeyPart(String part, ConversionContext ctx, ConversionAccumulator acc) {
        String out = part;
        if (from(ctx, Dialect.MYSQL) && !to(ctx, Dialect.MYSQL)) {
            Matcher prefix = PREFIX_LENGTH.matcher(out);
            if (prefix.find()) {
                info(acc, WarningType.SYNTAX_DIFFERENCE, "前缀索引长度已去掉，将对整列建索引", null, ctx, part);
                out = prefix.group(1) + out.substring(prefix.end());
                acc.addRule("Index prefix length removed");
            }
            // MySQL 8 函数索引写成 ((expr))
            if (out.startsWith("(") && SqlTextUtils.findMatchingParen(out, 0) == out.length() - 1) {
                out = out.substring(1, out.length() - 1).trim();
            }
        }
        if (from(ctx, Dialect.POSTGRESQL) && !to(ctx, Dialect.POSTGRESQL) && OPERATOR_CLASS.matcher(out).find()) {
            out = OPERATOR_CLASS.matcher(out).replaceAll("");
            acc.addRule("Index operator class removed");
        }
        if (to(ctx, Dialect.MYSQL) && !PLAIN_COLUMN.matcher(out).matches() && !out.startsWith("(")) {
            acc.addRule("Functional index key part -> ((expr))");
            return "(" + out + ")";
        }
        return out;
    }

    private String fullText(String name, String table, List<String> columns, String stmt, ConversionContext ctx,
                            ConversionAccumulator acc) {
        if (to(ctx, Dialect.POSTGRESQL)) {
            info(acc, WarningType.SYNTAX_DIFFERENCE, "FULLTEXT 索引改为 GIN 表达式索引", "查询需改用 to_tsvector(...) @@ to_tsquery(...)",
                    ctx, stmt);
            acc.addRule("FULLTEXT index -> GIN to_tsvector");
            String document = String.join(" || " + ctx.addLiteral(" ") + " || ", columns);
            return "CREATE INDEX " + name + " ON " + table + " USING gin (to_tsvector(" + ctx.addLiteral("simple") + ", "
                    + document + "))";
        }
        warn(acc, WarningType.UNSUPPORTED_FUNCTION, "Oracle 没有 FULLTEXT 索引，已改为 Oracle Text 的 CTXSYS.CONTEXT 索引",
                "需要安装 Oracle Text，且每个索引只能包含一列", ctx, stmt);
        acc.addRule("FULLTEXT index -> CTXSYS.CONTEXT");
        return "CREATE INDEX " + name + " ON " + table + " (" + columns.get(0) + ") INDEXTYPE IS CTXSYS.CONTEXT";
    }
}
