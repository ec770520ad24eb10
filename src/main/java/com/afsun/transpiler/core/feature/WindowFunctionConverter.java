package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 字符串聚合与分析函数扩展：
 * LISTAGG / GROUP_CONCAT / STRING_AGG 互转，KEEP (DENSE_RANK ...)，IGNORE NULLS，RATIO_TO_REPORT，MEDIAN
 *
 * @author afsun
 */
@Component
public class WindowFunctionConverter extends AbstractFeatureConverter {

    private static final Pattern KEYWORD = Pattern.compile(
            "(?i)\\b(?:LISTAGG|WM_CONCAT|GROUP_CONCAT|STRING_AGG|KEEP|IGNORE\\s+NULLS|RESPECT\\s+NULLS|RATIO_TO_REPORT|MEDIAN)\\b");

    private static final Pattern LISTAGG = callPattern("LISTAGG|WM_CONCAT");

    private static final Pattern GROUP_CONCAT = callPattern("GROUP_CONCAT");

    private static final Pattern STRING_AGG = callPattern("STRING_AGG");

    private static final Pattern KEEP_AGGREGATE = callPattern("MIN|MAX|SUM|AVG|COUNT|STDDEV|VARIANCE");

    private static final Pattern RATIO_TO_REPORT = callPattern("RATIO_TO_REPORT");

    private static final Pattern MEDIAN = callPattern("MEDIAN");

    private static final Pattern WITHIN_GROUP = Pattern.compile("(?i)\\G\\s*WITHIN\\s+GROUP\\s*\\(");

    private static final Pattern OVER = Pattern.compile("(?i)\\G\\s*OVER\\s*\\(");

    private static final Pattern KEEP = Pattern.compile(
            "(?i)\\G\\s*KEEP\\s*\\(\\s*DENSE_RANK\\s+(FIRST|LAST)\\s+ORDER\\s+BY\\s+");

    private static final Pattern ORDER_BY = Pattern.compile("(?is)^\\s*ORDER\\s+BY\\s+(.*)$");

    private static final Pattern DISTINCT = Pattern.compile("(?is)^\\s*(DISTINCT|ALL)\\s+(.*)$");

    private static final Pattern ORDER_KEY = Pattern.compile(
            "(?is)^(.*?)(?:\\s+(ASC|DESC))?(?:\\s+NULLS\\s+(FIRST|LAST))?$");

    private static final Pattern IGNORE_NULLS = Pattern.compile("(?i)\\s*\\bIGNORE\\s+NULLS\\b");

    private static final Pattern RESPECT_NULLS = Pattern.compile("(?i)\\s*\\bRESPECT\\s+NULLS\\b");

    @Override
    public int order() {
        return 1100;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getSyntaxRules().isConvertWindowFunctions();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return ctx.getSource() != ctx.getTarget() && KEYWORD.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        String text = maskedSql;
        if (from(ctx, Dialect.ORACLE)) {
            text = rewriteCalls(text, LISTAGG, (s, call) -> listagg(s, call, ctx, acc));
            text = rewriteCalls(text, KEEP_AGGREGATE, (s, call) -> keep(s, call, ctx, acc));
            text = ignoreNulls(text, ctx, acc);
            text = rewriteCalls(text, RATIO_TO_REPORT, (s, call) -> ratioToReport(s, call, acc));
            text = rewriteCalls(text, MEDIAN, (s, call) -> median(s, call, ctx, acc));
        } else if (from(ctx, Dialect.MYSQL)) {
            text = rewriteCalls(text, GROUP_CONCAT, (s, call) -> groupConcat(s, call, ctx, acc));
        } else if (from(ctx, Dialect.POSTGRESQL)) {
            text = rewriteCalls(text, STRING_AGG, (s, call) -> stringAgg(s, call, ctx, acc));
        }
        return text;
    }

    private Span listagg(String s, Call call, ConversionContext ctx, ConversionAccumulator acc) {
        String args = call.args;
        int overflow = SqlTextUtils.findTopLevelKeyword(args, "ON OVERFLOW", 0);
        if (overflow >= 0) {
            warn(acc, WarningType.PARTIAL_SUPPORT, "LISTAGG 的 ON OVERFLOW 子句已移除",
                    "目标库的字符串聚合长度限制不同，请确认结果长度", ctx, args.substring(overflow));
            args = args.substring(0, overflow);
        }
        Aggregation agg = new Aggregation();
        Matcher d = DISTINCT.matcher(args);
        if (d.matches()) {
            agg.distinct = "DISTINCT".equalsIgnoreCase(d.group(1));
            args = d.group(2);
        }
        List<String> parts = SqlTextUtils.trimAll(SqlTextUtils.splitArguments(args));
        if (parts.isEmpty()) {
            return null;
        }
        agg.expressions.add(parts.get(0));
        boolean wmConcat = "WM_CONCAT".equalsIgnoreCase(call.name);
        agg.separator = parts.size() > 1 ? parts.get(1) : ctx.addLiteral(wmConcat ? "," : "");
        int end = call.close + 1;
        Matcher within = WITHIN_GROUP.matcher(s);
        if (within.find(end)) {
            int close = SqlTextUtils.findMatchingParen(s, within.end() - 1);
            if (close < 0) {
                return null;
            }
            Matcher order = ORDER_BY.matcher(s.substring(within.end(), close));
            if (order.matches() && !"NULL".equalsIgnoreCase(order.group(1).trim())) {
                agg.orderBy = order.group(1).trim();
            }
            end = close + 1;
        }
        if (OVER.matcher(s).find(end)) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, call.name + " ... OVER 分析形式未转换",
                    "请改写为子查询聚合后再关联", ctx, s.substring(call.start, end));
            return null;
        }
        String replacement = to(ctx, Dialect.MYSQL) ? groupConcatCall(agg) : stringAggCall(agg, to(ctx, Dialect.POSTGRESQL));
        if (to(ctx, Dialect.MYSQL)) {
            info(acc, WarningType.SYNTAX_DIFFERENCE, "GROUP_CONCAT 结果长度受 group_concat_max_len 限制（默认 1024）",
                    "必要时调大 group_concat_max_len", ctx, s.substring(call.start, end));
        }
        acc.addRule(call.name.toUpperCase(Locale.ROOT) + " -> " + (to(ctx, Dialect.MYSQL) ? "GROUP_CONCAT" : "STRING_AGG"));
        return new Span(call.start, end, replacement);
    }

    private Span groupConcat(String s, Call call, ConversionContext ctx, ConversionAccumulator acc) {
        Aggregation agg = new Aggregation();
        String args = call.args;
        Matcher d = DISTINCT.matcher(args);
        if (d.matches()) {
            agg.distinct = "DISTINCT".equalsIgnoreCase(d.group(1));
            args = d.group(2);
        }
        int separator = SqlTextUtils.findTopLevelKeyword(args, "SEPARATOR", 0);
        if (separator >= 0) {
            agg.separator = args.substring(separator + "SEPARATOR".length()).trim();
            args = args.substring(0, separator);
        } else {
            agg.separator = ctx.addLiteral(",");
        }
        int order = SqlTextUtils.findTopLevelKeyword(args, "ORDER BY", 0);
        if (order >= 0) {
            Matcher o = ORDER_BY.matcher(args.substring(order));
            agg.orderBy = o.matches() ? o.group(1).trim() : null;
            args = args.substring(0, order);
        }
        agg.expressions.addAll(SqlTextUtils.trimAll(SqlTextUtils.splitArguments(args)));
        if (agg.expressions.isEmpty()) {
            return null;
        }
        if (agg.expressions.size() > 1) {
            info(acc, WarningType.SYNTAX_DIFFERENCE, "GROUP_CONCAT 的多个表达式已拼接为一个",
                    "GROUP_CONCAT 会跳过任一表达式为 NULL 的行，拼接后行为可能不同", ctx, s.substring(call.start, call.close + 1));
        }
        String replacement = stringAggCall(agg, to(ctx, Dialect.POSTGRESQL));
        if (to(ctx, Dialect.ORACLE) && agg.distinct) {
            info(acc, WarningType.SYNTAX_DIFFERENCE, "LISTAGG(DISTINCT ...) 需要 Oracle 19c 及以上版本",
                    null, ctx, s.substring(call.start, call.close + 1));
        }
        acc.addRule("GROUP_CONCAT -> " + (to(ctx, Dialect.ORACLE) ? "LISTAGG" : "STRING_AGG"));
        return new Span(call.start, call.close + 1, replacement);
    }

    private Span stringAgg(String s, Call call, ConversionContext ctx, ConversionAccumulator acc) {
        Aggregation agg = new Aggregation();
        String args = call.args;
        Matcher d = DISTINCT.matcher(args);
        if (d.matches()) {
            agg.distinct = "DISTINCT".equalsIgnoreCase(d.group(1));
            args = d.group(2);
        }
        int order = SqlTextUtils.findTopLevelKeyword(args, "ORDER BY", 0);
        if (order >= 0) {
            Matcher o = ORDER_BY.matcher(args.substring(order));
            agg.orderBy = o.matches() ? o.group(1).trim() : null;
            args = args.substring(0, order);
        }
        List<String> parts = SqlTextUtils.trimAll(SqlTextUtils.splitArguments(args));
        if (parts.size() != 2) {
            return null;
        }
        agg.expressions.add(parts.get(0));
        agg.separator = parts.get(1);
        int end = call.close + 1;
        if (OVER.matcher(s).find(end) && to(ctx, Dialect.MYSQL)) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "MySQL 的 GROUP_CONCAT 不能作为窗口函数使用",
                    "请改写为子查询聚合后再关联", ctx, s.substring(call.start, end));
            return null;
        }
        String replacement = to(ctx, Dialect.MYSQL) ? groupConcatCall(agg) : stringAggCall(agg, false);
        acc.addRule("STRING_AGG -> " + (to(ctx, Dialect.MYSQL) ? "GROUP_CONCAT" : "LISTAGG"));
        return new Span(call.start, end, replacement);
    }

    private static String groupConcatCall(Aggregation agg) {
        StringBuilder sb = new StringBuilder("GROUP_CONCAT(");
        if (agg.distinct) {
            sb.append("DISTINCT ");
        }
        sb.append(String.join(", ", agg.expressions));
        if (agg.orderBy != null) {
            sb.append(" ORDER BY ").append(agg.orderBy);
        }
        return sb.append(" SEPARATOR ").append(agg.separator).append(')').toString();
    }

    /**
     * postgres 为 true 时生成 STRING_AGG，否则生成 Oracle LISTAGG
     */
    private static String stringAggCall(Aggregation agg, boolean postgres) {
        String distinct = agg.distinct ? "DISTINCT " : "";
        if (postgres) {
            String expr = agg.expressions.size() == 1
                    ? "CAST(" + agg.expressions.get(0) + " AS TEXT)"
                    : "CONCAT(" + String.join(", ", agg.expressions) + ")";
            return "STRING_AGG(" + distinct + expr + ", " + agg.separator
                    + (agg.orderBy == null ? "" : " ORDER BY " + agg.orderBy) + ")";
        }
        return "LISTAGG(" + distinct + String.join(" || ", agg.expressions) + ", " + agg.separator
                + ") WITHIN GROUP (ORDER BY " + (agg.orderBy == null ? "NULL" : agg.orderBy) + ")";
    }

    private Span keep(String s, Call call, ConversionContext ctx, ConversionAccumulator acc) {
        Matcher k = KEEP.matcher(s);
        if (!k.find(call.close + 1)) {
            return null;
        }
        int keepOpen = s.indexOf('(', k.start());
        int keepClose = SqlTextUtils.findMatchingParen(s, keepOpen);
        if (keepClose < 0) {
            return null;
        }
        boolean last = "LAST".equalsIgnoreCase(k.group(1));
        String order = s.substring(k.end(), keepClose).trim();
        String effectiveOrder = last ? reverseOrder(order) : order;
        String function = call.name.toUpperCase(Locale.ROOT);
        String fragment = s.substring(call.start, keepClose + 1);
        Matcher over = OVER.matcher(s);
        if (over.find(keepClose + 1)) {
            int overClose = SqlTextUtils.findMatchingParen(s, over.end() - 1);
            if (overClose < 0) {
                return null;
            }
            String partition = s.substring(over.end(), overClose).trim();
            String replacement = "FIRST_VALUE(" + call.args.trim() + ") OVER ("
                    + (partition.isEmpty() ? "" : partition + " ") + "ORDER BY " + effectiveOrder + ")";
            warn(acc, WarningType.PARTIAL_SUPPORT, function + " ... KEEP (DENSE_RANK " + k.group(1).toUpperCase(Locale.ROOT)
                            + ") 已改为 FIRST_VALUE，排序键并列时取值可能不同",
                    "如排序键可能重复请追加唯一列作为排序键", ctx, fragment);
            acc.addRule("KEEP DENSE_RANK -> FIRST_VALUE OVER");
            return new Span(call.start, overClose + 1, replacement);
        }
        boolean extremum = "MIN".equals(function) || "MAX".equals(function);
        if (to(ctx, Dialect.POSTGRESQL) && extremum) {
            String replacement = "(ARRAY_AGG(" + call.args.trim() + " ORDER BY " + effectiveOrder + "))[1]";
            warn(acc, WarningType.PARTIAL_SUPPORT, "KEEP (DENSE_RANK ...) 已改为 ARRAY_AGG(...)[1]，排序键并列时取值可能不同",
                    "如排序键可能重复请追加唯一列作为排序键", ctx, fragment);
            acc.addRule("KEEP DENSE_RANK -> ARRAY_AGG[1]");
            return new Span(call.start, keepClose + 1, replacement);
        }
        String replacement = s.substring(call.start, call.close + 1) + " " + ctx.comment(s.substring(k.start(), keepClose + 1).trim());
        warn(acc, WarningType.MANUAL_REVIEW_NEEDED,
                ctx.getTarget().getDisplayName() + " 不支持 KEEP (DENSE_RANK ...)，该子句已注释，当前结果为整组聚合",
                "请改写为 ROW_NUMBER() 子查询后取第一行", ctx, fragment);
        acc.addRule("KEEP DENSE_RANK commented out");
        return new Span(call.start, keepClose + 1, replacement);
    }

    private String ignoreNulls(String text, ConversionContext ctx, ConversionAccumulator acc) {
        String out = acc.apply("RESPECT NULLS removed", text, RESPECT_NULLS.matcher(text).replaceAll(""));
        Matcher m = IGNORE_NULLS.matcher(out);
        if (!m.find()) {
            return out;
        }
        String marked = replaceAll(IGNORE_NULLS, out, x -> " " + ctx.comment("IGNORE NULLS"));
        warn(acc, WarningType.UNSUPPORTED_FUNCTION, ctx.getTarget().getDisplayName() + " 的窗口函数不支持 IGNORE NULLS，已注释",
                "可用 COALESCE 或带 IS NOT NULL 过滤的子查询改写", ctx,
                out.substring(Math.max(0, m.start() - 60), Math.min(out.length(), m.end())));
        return acc.apply("IGNORE NULLS commented out", out, marked);
    }

    private Span ratioToReport(String s, Call call, ConversionAccumulator acc) {
        Matcher over = OVER.matcher(s);
        if (!over.find(call.close + 1)) {
            return null;
        }
        int overClose = SqlTextUtils.findMatchingParen(s, over.end() - 1);
        if (overClose < 0) {
            return null;
        }
        String x = call.args.trim();
        String window = s.substring(over.end() - 1, overClose + 1);
        acc.addRule("RATIO_TO_REPORT -> x / SUM(x) OVER");
        return new Span(call.start, overClose + 1, "(" + x + " * 1.0 / NULLIF(SUM(" + x + ") OVER " + window + ", 0))");
    }

    private Span median(String s, Call call, ConversionContext ctx, ConversionAccumulator acc) {
        String fragment = s.substring(call.start, call.close + 1);
        if (to(ctx, Dialect.MYSQL)) {
            warn(acc, WarningType.UNSUPPORTED_FUNCTION, "MySQL 没有 MEDIAN 函数",
                    "可用 ROW_NUMBER() 与 COUNT() 窗口函数取中间行计算", ctx, fragment);
            return null;
        }
        if (OVER.matcher(s).find(call.close + 1)) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "PostgreSQL 的 PERCENTILE_CONT 不能作为窗口函数使用",
                    "请在子查询中按分组计算中位数后关联", ctx, fragment);
            return null;
        }
        acc.addRule("MEDIAN -> PERCENTILE_CONT(0.5)");
        return new Span(call.start, call.close + 1,
                "PERCENTILE_CONT(0.5) WITHIN GROUP (ORDER BY " + call.args.trim() + ")");
    }

    /**
     * 反转排序方向，用于把 LAST 改写为 FIRST
     */
    static String reverseOrder(String orderList) {
        List<String> keys = new ArrayList<>();
        for (String key : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(orderList))) {
            Matcher m = ORDER_KEY.matcher(key);
            if (!m.matches()) {
                keys.add(key);
                continue;
            }
            StringBuilder sb = new StringBuilder(m.group(1).trim());
            sb.append("DESC".equalsIgnoreCase(m.group(2)) ? " ASC" : " DESC");
            if (m.group(3) != null) {
                sb.append(" NULLS ").append("FIRST".equalsIgnoreCase(m.group(3)) ? "LAST" : "FIRST");
            }
            keys.add(sb.toString());
        }
        return String.join(", ", keys);
    }

    private static Pattern callPattern(String names) {
        return Pattern.compile("(?i)(?<![\\w$#.])(" + names + ")\\s*\\(");
    }

    /**
     * 从后往前改写每个函数调用，保证嵌套调用先于外层调用处理
     */
    private static String rewriteCalls(String text, Pattern pattern, CallRewrite rewrite) {
        List<int[]> found = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            found.add(new int[]{m.start(), m.end() - 1});
        }
        String s = text;
        for (int i = found.size() - 1; i >= 0; i--) {
            int start = found.get(i)[0];
            int open = found.get(i)[1];
            int close = SqlTextUtils.findMatchingParen(s, open);
            if (close < 0) {
                continue;
            }
            Call call = new Call();
            call.name = s.substring(start, open).trim();
            call.start = start;
            call.close = close;
            call.args = s.substring(open + 1, close);
            Span span = rewrite.apply(s, call);
            if (span != null) {
                s = s.substring(0, span.start) + span.text + s.substring(span.end);
            }
        }
        return s;
    }

    private interface CallRewrite {
        Span apply(String s, Call call);
    }

    private static final class Call {
        private String name;
        private int start;
        private int close;
        private String args;
    }

    private static final class Aggregation {
        private boolean distinct;
        private final List<String> expressions = new ArrayList<>();
        private String separator;
        private String orderBy;
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
