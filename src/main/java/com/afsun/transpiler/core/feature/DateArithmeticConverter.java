package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 日期运算：Oracle 的日期加减天数、ADD_MONTHS、MONTHS_BETWEEN、LAST_DAY、TRUNC(date)，
 * MySQL 的 DATE_ADD / DATE_SUB / DATEDIFF / INTERVAL n UNIT，PostgreSQL 的 INTERVAL '...' 与 DATE_TRUNC
 *
 * @author afsun
 */
@Component
public class DateArithmeticConverter extends AbstractFeatureConverter {

    private static final Pattern KEYWORD = Pattern.compile(
            "(?i)\\b(?:SYSDATE|SYSTIMESTAMP|CURRENT_DATE|CURRENT_TIMESTAMP|LOCALTIMESTAMP|ADD_MONTHS|MONTHS_BETWEEN"
                    + "|LAST_DAY|TRUNC|DATE_ADD|DATE_SUB|ADDDATE|SUBDATE|DATEDIFF|INTERVAL|DATE_TRUNC)\\b");

    private static final String NUMBER = "-?\\d+(?:\\.\\d+)?";

    /**
     * 日期关键字加减数字，数字可带 /24、/1440、/86400 之类的除数
     */
    private static final Pattern KEYWORD_ARITHMETIC = Pattern.compile(
            "(?i)\\b(SYSDATE|SYSTIMESTAMP|CURRENT_DATE|CURRENT_TIMESTAMP|LOCALTIMESTAMP)\\b(\\s*\\(\\s*\\))?"
                    + "\\s*([+-])\\s*(\\d+(?:\\.\\d+)?)(?:\\s*/\\s*(\\d+))?(?![\\w.(])(?!\\s*[*/])");

    private static final Pattern ADD_MONTHS = call("ADD_MONTHS");

    private static final Pattern MONTHS_BETWEEN = call("MONTHS_BETWEEN");

    private static final Pattern LAST_DAY = call("LAST_DAY");

    private static final Pattern TRUNC = call("TRUNC");

    private static final Pattern DATE_ADD = call("DATE_ADD|DATE_SUB|ADDDATE|SUBDATE");

    private static final Pattern DATEDIFF = call("DATEDIFF");

    private static final Pattern DATE_TRUNC = call("DATE_TRUNC");

    private static final String UNITS = "MICROSECOND|SECOND|MINUTE|HOUR|DAY|WEEK|MONTH|QUARTER|YEAR";

    private static final Pattern INTERVAL_ARGUMENT = Pattern.compile(
            "(?is)^INTERVAL\\s+(.+?)\\s+(" + UNITS + ")$");

    private static final Pattern MYSQL_INTERVAL = Pattern.compile(
            "(?i)\\bINTERVAL\\s+(" + NUMBER + "|" + SqlPatterns.QUALIFIED_IDENT + "|\\([^()]*\\))\\s+(" + UNITS + ")\\b");

    private static final Pattern PG_INTERVAL = Pattern.compile(
            "(?i)\\bINTERVAL\\s*(" + SqlPatterns.LITERAL + ")|(" + SqlPatterns.LITERAL + ")\\s*::\\s*INTERVAL\\b");

    private static final Pattern INTERVAL_TEXT = Pattern.compile(
            "(?i)^\\s*(" + NUMBER + ")\\s*(microsecond|second|minute|hour|day|week|month|year)s?\\s*$");

    private static final Pattern DATE_LIKE = Pattern.compile(
            "(?i)^\\s*(?:SYSDATE|SYSTIMESTAMP|CURRENT_DATE|CURRENT_TIMESTAMP|LOCALTIMESTAMP|TO_DATE\\s*\\(.*|"
                    + "TO_TIMESTAMP\\s*\\(.*|DATE\\s+" + SqlPatterns.LITERAL + ")\\s*$");

    private static final Pattern SIMPLE_OPERAND = Pattern.compile(
            "^(?:" + NUMBER + "|" + SqlPatterns.QUALIFIED_IDENT + ")$");

    @Override
    public int order() {
        return 1300;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getSyntaxRules().isConvertDateArithmetic();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return ctx.getSource() != ctx.getTarget() && KEYWORD.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        String text = maskedSql;
        if (from(ctx, Dialect.ORACLE)) {
            text = keywordArithmetic(text, ctx, acc);
            text = rewriteCalls(text, ADD_MONTHS, (s, c) -> addMonths(c, ctx, acc));
            text = rewriteCalls(text, MONTHS_BETWEEN, (s, c) -> monthsBetween(c, ctx, acc));
            if (to(ctx, Dialect.POSTGRESQL)) {
                text = rewriteCalls(text, LAST_DAY, (s, c) -> c.args.size() != 1 ? null
                        : rule(acc, "LAST_DAY -> DATE_TRUNC + INTERVAL", "CAST(DATE_TRUNC(" + ctx.addLiteral("month") + ", "
                        + c.args.get(0) + ") + INTERVAL " + ctx.addLiteral("1 month - 1 day") + " AS DATE)"));
            }
            text = rewriteCalls(text, TRUNC, (s, c) -> truncDate(c, ctx, acc));
        } else if (from(ctx, Dialect.MYSQL)) {
            text = rewriteCalls(text, DATE_ADD, (s, c) -> dateAdd(c, ctx, acc));
            text = rewriteCalls(text, DATEDIFF, (s, c) -> c.args.size() != 2 ? null : rule(acc, "DATEDIFF converted",
                    to(ctx, Dialect.ORACLE)
                            ? "(TRUNC(" + c.args.get(0) + ") - TRUNC(" + c.args.get(1) + "))"
                            : "(CAST(" + c.args.get(0) + " AS DATE) - CAST(" + c.args.get(1) + " AS DATE))"));
            text = mysqlIntervals(text, ctx, acc);
        } else if (from(ctx, Dialect.POSTGRESQL)) {
            if (to(ctx, Dialect.MYSQL)) {
                text = keywordArithmetic(text, ctx, acc);
            }
            text = pgIntervals(text, ctx, acc);
            text = rewriteCalls(text, DATE_TRUNC, (s, c) -> dateTrunc(c, ctx, acc));
        }
        return text;
    }

    /**
     * SYSDATE + 1、SYSDATE - 1/24 之类改为 INTERVAL 运算
     */
    private String keywordArithmetic(String text, ConversionContext ctx, ConversionAccumulator acc) {
        String out = replaceAll(KEYWORD_ARITHMETIC, text, m -> {
            if (from(ctx, Dialect.POSTGRESQL) && !"CURRENT_DATE".equalsIgnoreCase(m.group(1))) {
                return null;
            }
            String[] interval = normalize(m.group(4), m.group(5));
            if (interval == null) {
                return null;
            }
            String base = m.group(1) + (m.group(2) == null ? "" : m.group(2).trim());
            return base + " " + m.group(3) + " " + intervalLiteral(interval[0], interval[1], ctx);
        });
        return acc.apply("Date arithmetic -> INTERVAL", text, out);
    }

    /**
     * 天数（可带除数）换算为最大的整单位，返回 {数值, 单位}；除数无法整除时返回 null
     */
    static String[] normalize(String amount, String divisor) {
        BigDecimal seconds = new BigDecimal(amount).multiply(BigDecimal.valueOf(86400));
        if (divisor != null) {
            BigDecimal d = new BigDecimal(divisor);
            if (d.signum() == 0) {
                return null;
            }
            seconds = seconds.divide(d, 6, RoundingMode.HALF_UP);
        }
        String[] units = {"DAY", "HOUR", "MINUTE", "SECOND"};
        long[] sizes = {86400, 3600, 60, 1};
        for (int i = 0; i < units.length; i++) {
            BigDecimal[] qr = seconds.divideAndRemainder(BigDecimal.valueOf(sizes[i]));
            if (qr[1].signum() == 0) {
                return new String[]{qr[0].stripTrailingZeros().toPlainString(), units[i]};
            }
        }
        return new String[]{seconds.stripTrailingZeros().toPlainString(), "SECOND"};
    }

    private String intervalLiteral(String amount, String unit, ConversionContext ctx) {
        String u = unit.toUpperCase(Locale.ROOT);
        boolean literal = amount.matches(NUMBER);
        if (to(ctx, Dialect.MYSQL)) {
            return "INTERVAL " + amount + " " + u;
        }
        if (to(ctx, Dialect.POSTGRESQL)) {
            return literal
                    ? "INTERVAL " + ctx.addLiteral(amount + " " + u.toLowerCase(Locale.ROOT))
                    : "(" + amount + ") * INTERVAL " + ctx.addLiteral("1 " + u.toLowerCase(Locale.ROOT));
        }
        if ("WEEK".equals(u)) {
            return literal ? intervalLiteral(new BigDecimal(amount).multiply(BigDecimal.valueOf(7)).toPlainString(), "DAY", ctx)
                    : "NUMTODSINTERVAL((" + amount + ") * 7, " + ctx.addLiteral("DAY") + ")";
        }
        if ("QUARTER".equals(u)) {
            return literal ? intervalLiteral(new BigDecimal(amount).multiply(BigDecimal.valueOf(3)).toPlainString(), "MONTH", ctx)
                    : "NUMTOYMINTERVAL((" + amount + ") * 3, " + ctx.addLiteral("MONTH") + ")";
        }
        boolean yearMonth = "MONTH".equals(u) || "YEAR".equals(u);
        if (!literal) {
            return (yearMonth ? "NUMTOYMINTERVAL(" : "NUMTODSINTERVAL(") + amount + ", " + ctx.addLiteral(u) + ")";
        }
        String digits = amount.replace("-", "");
        int dot = digits.indexOf('.');
        int integerDigits = dot < 0 ? digits.length() : dot;
        String precision = integerDigits > 2 ? "(" + integerDigits + ")" : "";
        return "INTERVAL " + ctx.addLiteral(amount) + " " + u + precision;
    }

    private String addMonths(Call c, ConversionContext ctx, ConversionAccumulator acc) {
        if (c.args.size() != 2) {
            return null;
        }
        String date = c.args.get(0);
        String months = c.args.get(1);
        info(acc, WarningType.SYNTAX_DIFFERENCE, "ADD_MONTHS 对月末日期的处理与目标库不同",
                "Oracle 在原日期为月末时结果也取月末", ctx, c.text);
        if (to(ctx, Dialect.MYSQL)) {
            return rule(acc, "ADD_MONTHS -> DATE_ADD", "DATE_ADD(" + date + ", INTERVAL " + operand(months) + " MONTH)");
        }
        return rule(acc, "ADD_MONTHS -> + INTERVAL", "(" + date + " + " + intervalLiteral(months, "MONTH", ctx) + ")");
    }

    private String monthsBetween(Call c, ConversionContext ctx, ConversionAccumulator acc) {
        if (c.args.size() != 2) {
            return null;
        }
        String a = c.args.get(0);
        String b = c.args.get(1);
        warn(acc, WarningType.PARTIAL_SUPPORT, "MONTHS_BETWEEN 已改为整月差，Oracle 原函数会返回小数部分",
                "需要小数月份时请按天数自行折算", ctx, c.text);
        if (to(ctx, Dialect.MYSQL)) {
            return rule(acc, "MONTHS_BETWEEN -> TIMESTAMPDIFF", "TIMESTAMPDIFF(MONTH, " + b + ", " + a + ")");
        }
        String age = "AGE(" + a + ", " + b + ")";
        return rule(acc, "MONTHS_BETWEEN -> AGE", "(EXTRACT(YEAR FROM " + age + ") * 12 + EXTRACT(MONTH FROM " + age + "))");
    }

    /**
     * 只处理能确定是日期的 TRUNC：参数为日期表达式，或第二个参数为格式字符串
     */
    private String truncDate(Call c, ConversionContext ctx, ConversionAccumulator acc) {
        if (c.args.isEmpty() || c.args.size() > 2) {
            return null;
        }
        String unit;
        if (c.args.size() == 2) {
            String format = ctx.literalValue(c.args.get(1));
            if (format == null) {
                return null;
            }
            unit = oracleFormatUnit(format);
            if (unit == null) {
                warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "无法识别 TRUNC 的日期格式 " + format, null, ctx, c.text);
                return null;
            }
        } else {
            if (!DATE_LIKE.matcher(c.args.get(0)).matches()) {
                return null;
            }
            unit = "day";
        }
        return truncate(c.args.get(0), unit, c, ctx, acc);
    }

    private String dateTrunc(Call c, ConversionContext ctx, ConversionAccumulator acc) {
        if (c.args.size() != 2) {
            return null;
        }
        String unit = ctx.literalValue(c.args.get(0));
        if (unit == null) {
            return null;
        }
        return truncate(c.args.get(1), unit.toLowerCase(Locale.ROOT), c, ctx, acc);
    }

    private String truncate(String date, String unit, Call c, ConversionContext ctx, ConversionAccumulator acc) {
        if (to(ctx, Dialect.POSTGRESQL)) {
            return rule(acc, "TRUNC(date) -> DATE_TRUNC", "DATE_TRUNC(" + ctx.addLiteral(unit) + ", " + date + ")");
        }
        if (to(ctx, Dialect.ORACLE)) {
            String format = oracleFormat(unit);
            if (format == null) {
                warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "Oracle TRUNC 不支持截断单位 " + unit, null, ctx, c.text);
                return null;
            }
            return rule(acc, "DATE_TRUNC -> TRUNC", "TRUNC(" + date + ("DD".equals(format) ? "" : ", " + ctx.addLiteral(format)) + ")");
        }
        String pattern;
        switch (unit) {
            case "day":
                return rule(acc, "TRUNC(date) -> DATE()", "DATE(" + date + ")");
            case "month":
                pattern = "%Y-%m-01";
                break;
            case "year":
                pattern = "%Y-01-01";
                break;
            case "hour":
                pattern = "%Y-%m-%d %H:00:00";
                break;
            case "minute":
                pattern = "%Y-%m-%d %H:%i:00";
                break;
            default:
                warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "MySQL 没有按 " + unit + " 截断日期的函数",
                        "可用 DATE_SUB 与 WEEKDAY()/QUARTER() 组合实现", ctx, c.text);
                return null;
        }
        return rule(acc, "TRUNC(date) -> DATE_FORMAT", "CAST(DATE_FORMAT(" + date + ", " + ctx.addLiteral(pattern) + ") AS DATETIME)");
    }

    private static String oracleFormatUnit(String format) {
        switch (format.toUpperCase(Locale.ROOT)) {
            case "DD":
            case "DDD":
            case "J":
                return "day";
            case "MM":
            case "MON":
            case "MONTH":
            case "RM":
                return "month";
            case "YYYY":
            case "YYY":
            case "YY":
            case "Y":
            case "YEAR":
            case "SYYYY":
                return "year";
            case "Q":
                return "quarter";
            case "IW":
            case "WW":
            case "W":
            case "D":
            case "DY":
            case "DAY":
                return "week";
            case "HH":
            case "HH12":
            case "HH24":
                return "hour";
            case "MI":
                return "minute";
            default:
                return null;
        }
    }

    private static String oracleFormat(String unit) {
        switch (unit) {
            case "day":
                return "DD";
            case "month":
                return "MM";
            case "year":
                return "YYYY";
            case "quarter":
                return "Q";
            case "week":
                return "IW";
            case "hour":
                return "HH24";
            case "minute":
                return "MI";
            default:
                return null;
        }
    }

    private String dateAdd(Call c, ConversionContext ctx, ConversionAccumulator acc) {
        if (c.args.size() != 2) {
            return null;
        }
        boolean subtract = c.name.toUpperCase(Locale.ROOT).startsWith("DATE_SUB")
                || c.name.toUpperCase(Locale.ROOT).startsWith("SUBDATE");
        String date = c.args.get(0);
        String amount;
        String unit;
        Matcher interval = INTERVAL_ARGUMENT.matcher(c.args.get(1));
        if (interval.matches()) {
            amount = interval.group(1).trim();
            unit = interval.group(2).toUpperCase(Locale.ROOT);
        } else {
            amount = c.args.get(1);
            unit = "DAY";
        }
        if (ctx.literalValue(amount) != null || "MICROSECOND".equals(unit)) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, c.name + " 的 INTERVAL 参数无法转换", null, ctx, c.text);
            return null;
        }
        String op = subtract ? " - " : " + ";
        if (to(ctx, Dialect.ORACLE) && ("MONTH".equals(unit) || "YEAR".equals(unit) || "QUARTER".equals(unit))) {
            String months = "MONTH".equals(unit) ? operand(amount)
                    : operand(amount) + ("YEAR".equals(unit) ? " * 12" : " * 3");
            return rule(acc, c.name.toUpperCase(Locale.ROOT) + " -> ADD_MONTHS",
                    "ADD_MONTHS(" + date + ", " + (subtract ? "-" + wrap(months) : months) + ")");
        }
        if (to(ctx, Dialect.ORACLE)) {
            String days = daysExpression(amount, unit);
            return rule(acc, c.name.toUpperCase(Locale.ROOT) + " -> date arithmetic", "(" + date + op + days + ")");
        }
        return rule(acc, c.name.toUpperCase(Locale.ROOT) + " -> + INTERVAL", "(" + date + op + intervalLiteral(amount, unit, ctx) + ")");
    }

    /**
     * Oracle 日期加减以天为单位
     */
    private static String daysExpression(String amount, String unit) {
        String n = operand(amount);
        switch (unit) {
            case "WEEK":
                return n + " * 7";
            case "HOUR":
                return n + " / 24";
            case "MINUTE":
                return n + " / 1440";
            case "SECOND":
                return n + " / 86400";
            default:
                return n;
        }
    }

    private String mysqlIntervals(String text, ConversionContext ctx, ConversionAccumulator acc) {
        String out = replaceAll(MYSQL_INTERVAL, text, m -> {
            String unit = m.group(2).toUpperCase(Locale.ROOT);
            if ("MICROSECOND".equals(unit)) {
                return null;
            }
            return intervalLiteral(m.group(1).trim(), unit, ctx);
        });
        return acc.apply("INTERVAL n UNIT converted", text, out);
    }

    private String pgIntervals(String text, ConversionContext ctx, ConversionAccumulator acc) {
        if (to(ctx, Dialect.ORACLE) || to(ctx, Dialect.MYSQL)) {
            String out = replaceAll(PG_INTERVAL, text, m -> {
                String literal = m.group(1) != null ? m.group(1) : m.group(2);
                String value = ctx.literalValue(literal);
                Matcher v = value == null ? null : INTERVAL_TEXT.matcher(value);
                if (v == null || !v.matches()) {
                    warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "INTERVAL " + (value == null ? "" : "'" + value + "' ")
                            + "含多个时间分量，未转换", "请拆分为多个 INTERVAL 相加", ctx, m.group());
                    return null;
                }
                return intervalLiteral(v.group(1), v.group(2).toUpperCase(Locale.ROOT), ctx);
            });
            return acc.apply("INTERVAL literal converted", text, out);
        }
        return text;
    }

    private static String operand(String expr) {
        String t = expr.trim();
        return SIMPLE_OPERAND.matcher(t).matches() ? t : "(" + t + ")";
    }

    private static String wrap(String expr) {
        return expr.contains(" ") ? "(" + expr + ")" : expr;
    }

    private static String rule(ConversionAccumulator acc, String rule, String replacement) {
        acc.addRule(rule);
        return replacement;
    }

    private static Pattern call(String names) {
        return Pattern.compile("(?i)(?<![\\w$#.])(" + names + ")\\s*\\(");
    }

    /**
     * 从后往前改写函数调用，嵌套调用先处理。改写函数返回 null 时保留原调用
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
            call.text = s.substring(start, close + 1);
            call.args = SqlTextUtils.trimAll(SqlTextUtils.splitArguments(s.substring(open + 1, close)));
            String replacement = rewrite.apply(s, call);
            if (replacement != null) {
                s = s.substring(0, start) + replacement + s.substring(close + 1);
            }
        }
        return s;
    }

    private interface CallRewrite {
        String apply(String s, Call call);
    }

    private static final class Call {
        private String name;
        private String text;
        private List<String> args;
    }
}
