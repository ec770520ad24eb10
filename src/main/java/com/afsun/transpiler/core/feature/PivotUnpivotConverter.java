package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Oracle PIVOT / UNPIVOT 展开。
 * <p>
 * PIVOT 改为派生表中的 AGG(CASE WHEN ...) 加 GROUP BY，UNPIVOT 改为逐列 UNION ALL。
 * 分组列（或保留列）优先取外层 SELECT 列表，外层为 * 时取子查询源的列表，都无法确定时交人工处理。
 *
 * @author afsun
 */
@Component
public class PivotUnpivotConverter extends AbstractFeatureConverter {

    private static final Pattern KEYWORD = Pattern.compile("(?i)\\b(?:UN)?PIVOT\\b");

    private static final Pattern PIVOT = Pattern.compile(
            "(?i)\\b(UN)?PIVOT\\b(\\s+XML\\b)?\\s*(?:(INCLUDE|EXCLUDE)\\s+NULLS\\s*)?\\(");

    private static final Pattern FROM = Pattern.compile("(?i)\\bFROM\\b");

    private static final Pattern SELECT = Pattern.compile("(?i)\\bSELECT\\b");

    private static final Pattern TRAILING_ALIAS = Pattern.compile(
            "(?i)\\G\\s+(?:AS\\s+)?(?!(?:WHERE|ORDER|GROUP|HAVING|UNION|MINUS|EXCEPT|INTERSECT|FETCH|OFFSET|LIMIT"
                    + "|CONNECT|START|JOIN|INNER|LEFT|RIGHT|FULL|CROSS|NATURAL|ON|FOR|WINDOW|MODEL)\\b)("
                    + SqlPatterns.IDENT + ")");

    private static final Pattern PIVOT_FOR = Pattern.compile(
            "(?is)\\G\\s*(" + SqlPatterns.QUALIFIED_IDENT + "|\\([^()]*\\))\\s+IN\\s*\\(");

    private static final Pattern AGGREGATE = Pattern.compile(
            "(?is)^\\s*(\\w+)\\s*\\((.*)\\)\\s*(?:(?:AS\\s+)?(" + SqlPatterns.IDENT + "))?\\s*$");

    private static final Pattern UNPIVOT_BODY = Pattern.compile(
            "(?is)^\\s*(" + SqlPatterns.IDENT + ")\\s+FOR\\s+(" + SqlPatterns.IDENT + ")\\s+IN\\s*\\((.*)\\)\\s*$");

    private static final Pattern ITEM_WITH_ALIAS = Pattern.compile(
            "(?is)^(.*?\\S)\\s+(?:AS\\s+)?(" + SqlPatterns.IDENT + "|" + SqlPatterns.LITERAL + "|-?\\d+(?:\\.\\d+)?)$");

    private static final Pattern EXPLICIT_ALIAS = Pattern.compile(
            "(?is)^(.*\\S)\\s+AS\\s+(" + SqlPatterns.IDENT + ")$");

    private static final Pattern SIMPLE_COLUMN = Pattern.compile(
            "(?is)^(" + SqlPatterns.QUALIFIED_IDENT + ")(?:\\s+(?:AS\\s+)?(" + SqlPatterns.IDENT + "))?$");

    private static final Pattern CALL_WITH_ALIAS = Pattern.compile("(?is)^.*\\)\\s*(" + SqlPatterns.IDENT + ")$");

    private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z_][\\w$#]*");

    private static final Pattern DERIVED_SOURCE = Pattern.compile(
            "(?is)^\\((.*)\\)\\s*(?:AS\\s+)?(" + SqlPatterns.IDENT + ")?$");

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    @Override
    public int order() {
        return 1000;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getSyntaxRules().isConvertPivot();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return from(ctx, Dialect.ORACLE) && !to(ctx, Dialect.ORACLE) && KEYWORD.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        return SqlTextUtils.mapStatements(maskedSql, stmt -> convertStatement(stmt, ctx, acc));
    }

    private String convertStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        String s = stmt;
        int searchFrom = 0;
        Matcher m = PIVOT.matcher(s);
        while (m.find(searchFrom)) {
            Span span = m.group(1) == null ? rewritePivot(s, m, ctx, acc) : rewriteUnpivot(s, m, ctx, acc);
            if (span == null) {
                searchFrom = m.end();
                continue;
            }
            s = s.substring(0, span.start) + span.text + s.substring(span.end);
            searchFrom = span.start + span.text.length();
            m = PIVOT.matcher(s);
        }
        return s;
    }

    private Span rewritePivot(String s, Matcher m, ConversionContext ctx, ConversionAccumulator acc) {
        if (m.group(2) != null) {
            return manual(acc, ctx, "PIVOT XML 无法展开", s.substring(m.start()));
        }
        Frame frame = frame(s, m);
        if (frame == null) {
            return manual(acc, ctx, "无法定位 PIVOT 的 FROM 源", s.substring(m.start()));
        }
        String body = s.substring(frame.open + 1, frame.close);
        int forIdx = SqlTextUtils.findTopLevelKeyword(body, "FOR", 0);
        if (forIdx < 0) {
            return manual(acc, ctx, "PIVOT 缺少 FOR 子句", body);
        }
        Matcher f = PIVOT_FOR.matcher(body);
        if (!f.find(forIdx + 3)) {
            return manual(acc, ctx, "无法解析 PIVOT 的 FOR ... IN 子句", body);
        }
        String pivotColumn = f.group(1).trim();
        if (pivotColumn.startsWith("(")) {
            return manual(acc, ctx, "多列 PIVOT 无法自动展开", body);
        }
        int inOpen = f.end() - 1;
        int inClose = SqlTextUtils.findMatchingParen(body, inOpen);
        if (inClose < 0) {
            return manual(acc, ctx, "PIVOT 的 IN 列表括号不匹配", body);
        }
        String inList = body.substring(inOpen + 1, inClose);
        if (SELECT.matcher(inList).find() || inList.trim().equalsIgnoreCase("ANY")) {
            return manual(acc, ctx, "PIVOT 的 IN 列表为子查询或 ANY，无法静态展开", body);
        }

        List<Aggregate> aggregates = new ArrayList<>();
        for (String part : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(body.substring(0, forIdx)))) {
            Matcher a = AGGREGATE.matcher(part);
            if (!a.matches()) {
                return manual(acc, ctx, "无法解析 PIVOT 聚合表达式 " + part, body);
            }
            aggregates.add(new Aggregate(a.group(1), a.group(2).trim(), a.group(3)));
        }
        if (aggregates.isEmpty()) {
            return manual(acc, ctx, "PIVOT 缺少聚合函数", body);
        }

        List<String> columns = new ArrayList<>();
        List<String> outputNames = new ArrayList<>();
        for (String value : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(inList))) {
            Matcher va = ITEM_WITH_ALIAS.matcher(value);
            String expr = value;
            String alias = null;
            if (va.matches() && va.group(2).matches(SqlPatterns.IDENT)) {
                expr = va.group(1).trim();
                alias = va.group(2);
            }
            String base = alias != null ? alias : valueName(expr, ctx);
            for (Aggregate agg : aggregates) {
                String name = aggregates.size() > 1 || agg.alias != null
                        ? joinName(base, agg.alias != null ? agg.alias : agg.function, ctx)
                        : base;
                outputNames.add(bare(name));
                columns.add(agg.conditional(pivotColumn + " = " + expr) + " AS " + name);
            }
        }

        List<String> groupColumns = keptColumns(frame, outputNames, ctx);
        if (groupColumns == null) {
            List<String> excluded = new ArrayList<>();
            excluded.add(bare(SqlTextUtils.unqualify(pivotColumn)));
            for (Aggregate agg : aggregates) {
                excluded.addAll(identifiers(agg.argument));
            }
            groupColumns = sourceColumns(frame.source, excluded);
        }
        if (groupColumns == null) {
            return manual(acc, ctx, "无法确定 PIVOT 的分组列", s.substring(frame.fromIdx, frame.end));
        }

        List<String> select = new ArrayList<>(groupColumns);
        select.addAll(columns);
        StringBuilder sb = new StringBuilder("FROM (SELECT ");
        sb.append(String.join(", ", select)).append(" FROM ").append(frame.source);
        if (!groupColumns.isEmpty()) {
            sb.append(" GROUP BY ").append(String.join(", ", groupColumns));
        }
        sb.append(") ").append(frame.alias != null ? frame.alias : "pvt");
        acc.addRule("PIVOT -> CASE WHEN + GROUP BY");
        return new Span(frame.fromIdx, frame.end, sb.toString());
    }

    private Span rewriteUnpivot(String s, Matcher m, ConversionContext ctx, ConversionAccumulator acc) {
        Frame frame = frame(s, m);
        if (frame == null) {
            return manual(acc, ctx, "无法定位 UNPIVOT 的 FROM 源", s.substring(m.start()));
        }
        String body = s.substring(frame.open + 1, frame.close);
        Matcher b = UNPIVOT_BODY.matcher(body);
        if (!b.matches()) {
            return manual(acc, ctx, "多列 UNPIVOT 无法自动展开", body);
        }
        String valueColumn = b.group(1);
        String nameColumn = b.group(2);
        boolean excludeNulls = !"INCLUDE".equalsIgnoreCase(m.group(3));

        List<String> unpivoted = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (String item : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(b.group(3)))) {
            Matcher a = ITEM_WITH_ALIAS.matcher(item);
            String column = item;
            String label = null;
            if (a.matches() && !a.group(2).matches(SqlPatterns.IDENT)) {
                column = a.group(1).trim();
                label = a.group(2);
            }
            if (!column.matches(SqlPatterns.IDENT)) {
                return manual(acc, ctx, "UNPIVOT 列 " + column + " 不是单列", body);
            }
            unpivoted.add(column);
            labels.add(label != null ? label : ctx.addLiteral(columnLabel(column)));
        }

        List<String> outputNames = new ArrayList<>();
        outputNames.add(bare(valueColumn));
        outputNames.add(bare(nameColumn));
        List<String> kept = keptColumns(frame, outputNames, ctx);
        if (kept == null) {
            List<String> excluded = new ArrayList<>();
            for (String c : unpivoted) {
                excluded.add(bare(c));
            }
            kept = sourceColumns(frame.source, excluded);
        }
        if (kept == null) {
            return manual(acc, ctx, "无法确定 UNPIVOT 的保留列", s.substring(frame.fromIdx, frame.end));
        }

        List<String> branches = new ArrayList<>();
        for (int i = 0; i < unpivoted.size(); i++) {
            List<String> select = new ArrayList<>(kept);
            select.add(labels.get(i) + " AS " + nameColumn);
            select.add(unpivoted.get(i) + " AS " + valueColumn);
            String branch = "SELECT " + String.join(", ", select) + " FROM " + frame.source;
            if (excludeNulls) {
                branch += " WHERE " + unpivoted.get(i) + " IS NOT NULL";
            }
            branches.add(branch);
        }
        if (unpivoted.size() > 1) {
            info(acc, WarningType.PERFORMANCE, "UNPIVOT 已展开为 " + unpivoted.size() + " 个 UNION ALL 分支，源会被扫描多次",
                    "源为复杂子查询时可考虑先物化", ctx, s.substring(frame.fromIdx, frame.end));
        }
        acc.addRule("UNPIVOT -> UNION ALL");
        String text = "FROM (" + String.join(" UNION ALL ", branches) + ") " + (frame.alias != null ? frame.alias : "unpvt");
        return new Span(frame.fromIdx, frame.end, text);
    }

    /**
     * 定位 PIVOT 所在查询块的 SELECT 列表、FROM 源和末尾别名
     */
    private static Frame frame(String s, Matcher m) {
        int open = m.end() - 1;
        int close = SqlTextUtils.findMatchingParen(s, open);
        if (close < 0) {
            return null;
        }
        int blockStart = enclosingStart(s, m.start());
        int fromIdx = -1;
        Matcher from = FROM.matcher(s);
        from.region(blockStart, m.start());
        while (from.find()) {
            if (SqlTextUtils.depthAt(s, blockStart, from.start()) == 0) {
                fromIdx = from.start();
            }
        }
        if (fromIdx < 0) {
            return null;
        }
        int selectIdx = -1;
        Matcher select = SELECT.matcher(s);
        select.region(blockStart, fromIdx);
        while (select.find()) {
            if (SqlTextUtils.depthAt(s, blockStart, select.start()) == 0) {
                selectIdx = select.end();
                break;
            }
        }
        String source = s.substring(fromIdx + 4, m.start()).trim();
        if (source.isEmpty() || selectIdx < 0) {
            return null;
        }
        Frame frame = new Frame();
        frame.fromIdx = fromIdx;
        frame.open = open;
        frame.close = close;
        frame.selectList = s.substring(selectIdx, fromIdx).trim();
        frame.source = source;
        frame.end = close + 1;
        Matcher alias = TRAILING_ALIAS.matcher(s);
        if (alias.find(close + 1)) {
            frame.alias = alias.group(1);
            frame.end = alias.end();
        }
        return frame;
    }

    private static int enclosingStart(String s, int index) {
        int depth = 0;
        for (int i = index - 1; i >= 0; i--) {
            char c = s.charAt(i);
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                if (depth == 0) {
                    return i + 1;
                }
                depth--;
            }
        }
        return 0;
    }

    /**
     * 外层 SELECT 列表中除转换产生的列以外的列；列表为 * 或含表达式时返回 null
     */
    private static List<String> keptColumns(Frame frame, List<String> outputNames, ConversionContext ctx) {
        String list = frame.selectList.replaceFirst("(?i)^DISTINCT\\s+", "");
        List<String> kept = new ArrayList<>();
        for (String item : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(list))) {
            Matcher c = SIMPLE_COLUMN.matcher(item);
            if (!c.matches()) {
                return null;
            }
            String column = SqlTextUtils.unqualify(c.group(1));
            if (!containsIgnoreCase(outputNames, bare(column))) {
                kept.add(column);
            }
        }
        return kept;
    }

    /**
     * 子查询源 SELECT 列表中的列名，排除给定列；源为表或列表含 * 时返回 null
     */
    private static List<String> sourceColumns(String source, List<String> excluded) {
        Matcher d = DERIVED_SOURCE.matcher(source);
        if (!d.matches()) {
            return null;
        }
        String inner = d.group(1).trim();
        Matcher select = SELECT.matcher(inner);
        if (!select.lookingAt()) {
            return null;
        }
        int fromIdx = SqlTextUtils.findTopLevelKeyword(inner, "FROM", 0);
        if (fromIdx < 0) {
            return null;
        }
        String list = inner.substring(select.end(), fromIdx).trim().replaceFirst("(?i)^DISTINCT\\s+", "");
        List<String> columns = new ArrayList<>();
        for (String item : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(list))) {
            String name = itemName(item);
            if (name == null) {
                return null;
            }
            if (!containsIgnoreCase(excluded, bare(name))) {
                columns.add(name);
            }
        }
        return columns;
    }

    private static String itemName(String item) {
        if (item.endsWith("*")) {
            return null;
        }
        Matcher explicit = EXPLICIT_ALIAS.matcher(item);
        if (explicit.matches()) {
            return explicit.group(2);
        }
        Matcher simple = SIMPLE_COLUMN.matcher(item);
        if (simple.matches()) {
            return simple.group(2) != null ? simple.group(2) : SqlTextUtils.unqualify(simple.group(1));
        }
        Matcher call = CALL_WITH_ALIAS.matcher(item);
        return call.matches() ? call.group(1) : null;
    }

    private static List<String> identifiers(String expr) {
        List<String> names = new ArrayList<>();
        Matcher m = Pattern.compile(SqlPatterns.IDENT).matcher(expr);
        while (m.find()) {
            names.add(bare(m.group()));
        }
        return names;
    }

    private static String valueName(String expr, ConversionContext ctx) {
        String value = ctx.literalValue(expr);
        if (value != null) {
            return PLAIN_NAME.matcher(value).matches() ? value : ctx.quote(value);
        }
        if (NUMBER.matcher(expr).matches()) {
            return ctx.quote(expr);
        }
        return PLAIN_NAME.matcher(expr).matches() ? expr : ctx.quote(bare(expr));
    }

    private static String joinName(String base, String suffix, ConversionContext ctx) {
        String joined = bare(base) + "_" + bare(suffix);
        return PLAIN_NAME.matcher(joined).matches() ? joined : ctx.quote(joined);
    }

    private static String columnLabel(String column) {
        return column.startsWith("\"") || column.startsWith("`")
                ? bare(column)
                : column.toUpperCase(Locale.ROOT);
    }

    private static String bare(String identifier) {
        String t = identifier.trim();
        if (t.length() > 1 && (t.charAt(0) == '"' || t.charAt(0) == '`')) {
            return t.substring(1, t.length() - 1);
        }
        return t;
    }

    private static boolean containsIgnoreCase(List<String> names, String name) {
        for (String n : names) {
            if (n.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    private static Span manual(ConversionAccumulator acc, ConversionContext ctx, String reason, String fragment) {
        warn(acc, WarningType.MANUAL_REVIEW_NEEDED, reason, "请手工改写为条件聚合或 UNION ALL", ctx, fragment);
        return null;
    }

    private static final class Aggregate {
        private final String function;
        private final String argument;
        private final String alias;

        Aggregate(String function, String argument, String alias) {
            this.function = function;
            this.argument = argument;
            this.alias = alias;
        }

        String conditional(String condition) {
            String arg = argument;
            String distinct = "";
            if (arg.toUpperCase(Locale.ROOT).startsWith("DISTINCT ")) {
                distinct = "DISTINCT ";
                arg = arg.substring(9).trim();
            }
            if ("*".equals(arg)) {
                arg = "1";
            }
            return function + "(" + distinct + "CASE WHEN " + condition + " THEN " + arg + " END)";
        }
    }

    private static final class Frame {
        private int fromIdx;
        private int open;
        private int close;
        private int end;
        private String selectList;
        private String source;
        private String alias;
    }

    private static final class Span {
        private final int start;
        private final int end;
        private final String text;

        Span(int start, int end, String text) {
            this.start = start;
            this.end = end;
            this.text = text;
        }
    }
}
