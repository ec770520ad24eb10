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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 伪列、当前时间函数、DUAL、集合运算符与字符串拼接运算符
 *
 * @author afsun
 */
@Component
public class PseudoColumnConverter extends AbstractFeatureConverter {

    private static final Pattern SYSDATE = Pattern.compile("(?i)(?<![\\w$#.])SYSDATE\\b(?!\\s*\\()");

    private static final Pattern SYSTIMESTAMP = Pattern.compile("(?i)(?<![\\w$#.])SYSTIMESTAMP\\b(?!\\s*\\()");

    private static final Pattern NOW = Pattern.compile("(?i)(?<![\\w$#.])NOW\\s*\\(\\s*\\)");

    private static final Pattern SYSDATE_CALL = Pattern.compile("(?i)(?<![\\w$#.])SYSDATE\\s*\\(\\s*\\)");

    private static final Pattern CURDATE = Pattern.compile("(?i)(?<![\\w$#.])(?:CURDATE|CURRENT_DATE)\\s*\\(\\s*\\)");

    private static final Pattern CURTIME = Pattern.compile("(?i)(?<![\\w$#.])(?:CURTIME|CURRENT_TIME)\\s*\\(\\s*\\)");

    private static final Pattern CURRENT_TIMESTAMP_CALL = Pattern.compile(
            "(?i)(?<![\\w$#.])CURRENT_TIMESTAMP\\s*\\(\\s*\\)");

    private static final Pattern UTC_TIMESTAMP = Pattern.compile("(?i)(?<![\\w$#.])UTC_TIMESTAMP\\s*\\(\\s*\\)");

    private static final Pattern CLOCK_TIMESTAMP = Pattern.compile("(?i)(?<![\\w$#.])CLOCK_TIMESTAMP\\s*\\(\\s*\\)");

    private static final Pattern FROM_DUAL = Pattern.compile("(?i)\\s+FROM\\s+(?:SYS\\s*\\.\\s*)?DUAL\\b");

    private static final Pattern MINUS = Pattern.compile("(?i)\\bMINUS\\b");

    private static final Pattern EXCEPT = Pattern.compile("(?i)\\bEXCEPT\\b(?!\\s*\\()");

    private static final Pattern ROWID = Pattern.compile("(?i)(?<![\\w$#.\"`])ROWID\\b");

    private static final Pattern ROWNUM = Pattern.compile("(?i)(?<![\\w$#.\"`])ROWNUM\\b");

    private static final Pattern CONCAT_CALL = Pattern.compile("(?i)(?<![\\w$#.])CONCAT\\s*\\(");

    private static final Pattern SELECT_START = Pattern.compile("(?is)" + SqlPatterns.LEAD + "\\(?\\s*SELECT\\b");

    private static final Pattern SET_OPERATOR = Pattern.compile("(?i)\\b(?:UNION(?:\\s+ALL)?|INTERSECT|MINUS|EXCEPT)\\b");

    private static final Pattern SIMPLE_OPERAND = Pattern.compile(
            "^(?:" + SqlPatterns.QUALIFIED_IDENT + "|" + SqlPatterns.LITERAL + "|-?\\d+(?:\\.\\d+)?|"
                    + SqlPatterns.QUALIFIED_IDENT + "\\s*\\(.*\\))$", Pattern.DOTALL);

    private static final Pattern KEYWORD = Pattern.compile(
            "(?i)\\b(?:SYSDATE|SYSTIMESTAMP|NOW|CURDATE|CURTIME|CURRENT_DATE|CURRENT_TIME|CURRENT_TIMESTAMP|UTC_TIMESTAMP"
                    + "|CLOCK_TIMESTAMP|DUAL|MINUS|EXCEPT|ROWID|ROWNUM|CONCAT|SELECT)\\b|\\|\\|");

    @Override
    public int order() {
        return 1400;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getSyntaxRules().isConvertPseudoColumns();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return ctx.getSource() != ctx.getTarget() && KEYWORD.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        String text = maskedSql;
        text = currentTime(text, ctx, acc);
        text = setOperators(text, ctx, acc);
        text = concatenation(text, ctx, acc);
        if (to(ctx, Dialect.POSTGRESQL)) {
            text = acc.apply("FROM DUAL removed", text, FROM_DUAL.matcher(text).replaceAll(""));
        }
        if (to(ctx, Dialect.ORACLE)) {
            text = SqlTextUtils.mapStatements(text, stmt -> addDual(stmt, acc));
        }
        if (from(ctx, Dialect.ORACLE)) {
            rowWarnings(text, ctx, acc);
        }
        return text;
    }

    private String currentTime(String text, ConversionContext ctx, ConversionAccumulator acc) {
        String out = text;
        if (from(ctx, Dialect.ORACLE)) {
            boolean mysql = to(ctx, Dialect.MYSQL);
            out = acc.apply("SYSDATE -> " + (mysql ? "NOW()" : "CURRENT_TIMESTAMP"), out,
                    SYSDATE.matcher(out).replaceAll(mysql ? "NOW()" : "CURRENT_TIMESTAMP"));
            out = acc.apply("SYSTIMESTAMP -> CURRENT_TIMESTAMP", out,
                    SYSTIMESTAMP.matcher(out).replaceAll(mysql ? "CURRENT_TIMESTAMP(6)" : "CURRENT_TIMESTAMP"));
        } else if (from(ctx, Dialect.MYSQL)) {
            boolean oracle = to(ctx, Dialect.ORACLE);
            out = acc.apply("CURRENT_TIMESTAMP() -> CURRENT_TIMESTAMP", out,
                    CURRENT_TIMESTAMP_CALL.matcher(out).replaceAll("CURRENT_TIMESTAMP"));
            out = acc.apply("SYSDATE() converted", out,
                    SYSDATE_CALL.matcher(out).replaceAll(oracle ? "SYSDATE" : "CLOCK_TIMESTAMP()"));
            out = acc.apply("CURDATE() converted", out,
                    CURDATE.matcher(out).replaceAll(oracle ? "TRUNC(SYSDATE)" : "CURRENT_DATE"));
            if (oracle) {
                out = acc.apply("NOW() -> SYSDATE", out, NOW.matcher(out).replaceAll("SYSDATE"));
                String time = "TO_CHAR(SYSDATE, " + ctx.addLiteral("HH24:MI:SS") + ")";
                out = acc.apply("CURTIME() -> TO_CHAR(SYSDATE)", out,
                        replaceAll(CURTIME, out, m -> time));
                out = acc.apply("UTC_TIMESTAMP() -> SYS_EXTRACT_UTC", out,
                        UTC_TIMESTAMP.matcher(out).replaceAll("SYS_EXTRACT_UTC(SYSTIMESTAMP)"));
            } else {
                out = acc.apply("CURTIME() -> CURRENT_TIME", out, CURTIME.matcher(out).replaceAll("CURRENT_TIME"));
                String utc = "(NOW() AT TIME ZONE " + ctx.addLiteral("UTC") + ")";
                out = acc.apply("UTC_TIMESTAMP() -> NOW() AT TIME ZONE", out,
                        replaceAll(UTC_TIMESTAMP, out, m -> utc));
            }
        } else if (from(ctx, Dialect.POSTGRESQL)) {
            if (to(ctx, Dialect.ORACLE)) {
                out = acc.apply("NOW() -> SYSTIMESTAMP", out, NOW.matcher(out).replaceAll("SYSTIMESTAMP"));
                out = acc.apply("CLOCK_TIMESTAMP() -> SYSTIMESTAMP", out,
                        CLOCK_TIMESTAMP.matcher(out).replaceAll("SYSTIMESTAMP"));
            } else {
                out = acc.apply("CLOCK_TIMESTAMP() -> SYSDATE()", out,
                        CLOCK_TIMESTAMP.matcher(out).replaceAll("SYSDATE()"));
            }
        }
        return out;
    }

    private String setOperators(String text, ConversionContext ctx, ConversionAccumulator acc) {
        if (from(ctx, Dialect.ORACLE) && MINUS.matcher(text).find()) {
            if (to(ctx, Dialect.MYSQL)) {
                info(acc, WarningType.SYNTAX_DIFFERENCE, "EXCEPT 需要 MySQL 8.0.31 及以上版本",
                        "低版本请改写为 NOT EXISTS 子查询", ctx, text);
            }
            return acc.apply("MINUS -> EXCEPT", text, MINUS.matcher(text).replaceAll("EXCEPT"));
        }
        if (to(ctx, Dialect.ORACLE)) {
            return acc.apply("EXCEPT -> MINUS", text, EXCEPT.matcher(text).replaceAll("MINUS"));
        }
        if (to(ctx, Dialect.MYSQL) && EXCEPT.matcher(text).find()) {
            info(acc, WarningType.SYNTAX_DIFFERENCE, "EXCEPT 需要 MySQL 8.0.31 及以上版本",
                    "低版本请改写为 NOT EXISTS 子查询", ctx, text);
        }
        return text;
    }

    private String concatenation(String text, ConversionContext ctx, ConversionAccumulator acc) {
        if (to(ctx, Dialect.MYSQL) && text.contains("||")) {
            String out = pipesToConcat(text);
            if (!out.equals(text) && from(ctx, Dialect.ORACLE)) {
                warn(acc, WarningType.SYNTAX_DIFFERENCE, "|| 已改为 CONCAT()，MySQL 中任一参数为 NULL 时结果为 NULL",
                        "Oracle 把 NULL 当作空串拼接，必要时用 IFNULL(x, '') 包裹参数", ctx, text);
            }
            return acc.apply("Operator || -> CONCAT()", text, out);
        }
        if (to(ctx, Dialect.POSTGRESQL) && from(ctx, Dialect.ORACLE) && text.contains("||")) {
            info(acc, WarningType.SYNTAX_DIFFERENCE, "PostgreSQL 中 || 遇到 NULL 时结果为 NULL，Oracle 视 NULL 为空串",
                    "必要时改用 CONCAT() 或 COALESCE(x, '')", ctx, text);
        }
        if (to(ctx, Dialect.ORACLE) && from(ctx, Dialect.MYSQL)) {
            return acc.apply("CONCAT(a, b, ...) -> ||", text, concatToPipes(text));
        }
        return text;
    }

    /**
     * a || b || c 改为 CONCAT(a, b, c)，括号内的拼接递归处理
     */
    static String pipesToConcat(String text) {
        String s = text;
        int search = 0;
        while (true) {
            int op = topPipes(s, search);
            if (op < 0) {
                return s;
            }
            int start = operandStart(s, op);
            if (start < 0) {
                search = op + 2;
                continue;
            }
            List<String> operands = new ArrayList<>();
            operands.add(s.substring(start, op).trim());
            int pos = op + 2;
            int end;
            while (true) {
                end = operandEnd(s, pos);
                if (end < 0) {
                    break;
                }
                operands.add(s.substring(pos, end).trim());
                int next = skipSpaces(s, end);
                if (s.startsWith("||", next)) {
                    pos = next + 2;
                } else {
                    break;
                }
            }
            if (end < 0) {
                search = op + 2;
                continue;
            }
            List<String> converted = new ArrayList<>();
            for (String operand : operands) {
                converted.add(pipesToConcat(operand));
            }
            String replacement = "CONCAT(" + String.join(", ", converted) + ")";
            s = s.substring(0, start) + replacement + s.substring(end);
            search = start + replacement.length();
        }
    }

    private static int topPipes(String s, int from) {
        return s.indexOf("||", from);
    }

    private static int skipSpaces(String s, int i) {
        int j = i;
        while (j < s.length() && Character.isWhitespace(s.charAt(j))) {
            j++;
        }
        return j;
    }

    private static boolean identChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#' || c == '.' || c == '"' || c == '`'
                || c == ':';
    }

    /**
     * || 左侧操作数的起点：括号组（含函数名）、字符串占位符、标识符或数字
     */
    private static int operandStart(String s, int op) {
        int i = op - 1;
        while (i >= 0 && Character.isWhitespace(s.charAt(i))) {
            i--;
        }
        if (i < 0) {
            return -1;
        }
        char c = s.charAt(i);
        if (c == ')') {
            int depth = 0;
            for (int j = i; j >= 0; j--) {
                char ch = s.charAt(j);
                if (ch == ')') {
                    depth++;
                } else if (ch == '(') {
                    depth--;
                    if (depth == 0) {
                        int k = j - 1;
                        while (k >= 0 && Character.isWhitespace(s.charAt(k))) {
                            k--;
                        }
                        int nameEnd = k;
                        while (k >= 0 && identChar(s.charAt(k))) {
                            k--;
                        }
                        return nameEnd > k ? k + 1 : j;
                    }
                }
            }
            return -1;
        }
        if (c == '\'') {
            int open = s.lastIndexOf('\'', i - 1);
            return open < 0 ? -1 : open;
        }
        int j = i;
        while (j >= 0 && identChar(s.charAt(j))) {
            j--;
        }
        return j == i ? -1 : j + 1;
    }

    /**
     * || 右侧操作数的终点（不含）
     */
    private static int operandEnd(String s, int from) {
        int i = skipSpaces(s, from);
        if (i >= s.length()) {
            return -1;
        }
        char c = s.charAt(i);
        if (c == '(') {
            int close = SqlTextUtils.findMatchingParen(s, i);
            return close < 0 ? -1 : close + 1;
        }
        if (c == '\'') {
            int close = s.indexOf('\'', i + 1);
            return close < 0 ? -1 : close + 1;
        }
        int j = i;
        while (j < s.length() && identChar(s.charAt(j))) {
            j++;
        }
        if (j == i) {
            return -1;
        }
        int k = skipSpaces(s, j);
        if (k < s.length() && s.charAt(k) == '(') {
            int close = SqlTextUtils.findMatchingParen(s, k);
            return close < 0 ? -1 : close + 1;
        }
        return j;
    }

    /**
     * 三个及以上参数的 CONCAT 改为 ||，Oracle 的 CONCAT 只接受两个参数
     */
    static String concatToPipes(String text) {
        List<int[]> found = new ArrayList<>();
        Matcher m = CONCAT_CALL.matcher(text);
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
            List<String> args = SqlTextUtils.trimAll(SqlTextUtils.splitArguments(s.substring(open + 1, close)));
            if (args.size() < 3) {
                continue;
            }
            List<String> operands = new ArrayList<>();
            for (String arg : args) {
                operands.add(SIMPLE_OPERAND.matcher(arg).matches() ? arg : "(" + arg + ")");
            }
            s = s.substring(0, start) + "(" + String.join(" || ", operands) + ")" + s.substring(close + 1);
        }
        return s;
    }

    /**
     * 没有 FROM 的 SELECT 分支补 FROM DUAL
     */
    private String addDual(String stmt, ConversionAccumulator acc) {
        if (!SELECT_START.matcher(stmt).find()) {
            return stmt;
        }
        List<Integer> cuts = new ArrayList<>();
        Matcher op = SET_OPERATOR.matcher(stmt);
        while (op.find()) {
            if (SqlTextUtils.depthAt(stmt, 0, op.start()) == 0) {
                cuts.add(op.start());
            }
        }
        cuts.add(stmt.length());
        StringBuilder out = new StringBuilder(stmt.length() + 16);
        int segmentStart = 0;
        for (int cut : cuts) {
            String segment = stmt.substring(segmentStart, cut);
            out.append(withDual(segment));
            segmentStart = cut;
        }
        return acc.apply("Bare SELECT -> FROM DUAL", stmt, out.toString());
    }

    private static String withDual(String segment) {
        Matcher select = Pattern.compile("(?i)\\bSELECT\\b").matcher(segment);
        if (!select.find() || SqlTextUtils.depthAt(segment, 0, select.start()) != 0
                || SqlTextUtils.findTopLevelKeyword(segment, "FROM", 0) >= 0) {
            return segment;
        }
        int end = segment.length();
        while (end > 0 && Character.isWhitespace(segment.charAt(end - 1))) {
            end--;
        }
        return segment.substring(0, end) + " FROM DUAL" + segment.substring(end);
    }

    private void rowWarnings(String text, ConversionContext ctx, ConversionAccumulator acc) {
        Matcher rowid = ROWID.matcher(text);
        if (rowid.find()) {
            warn(acc, WarningType.UNSUPPORTED_FUNCTION, ctx.getTarget().getDisplayName() + " 没有 ROWID 伪列",
                    to(ctx, Dialect.POSTGRESQL) ? "可用 ctid 近似，但 ctid 在 UPDATE/VACUUM 后会变化" : "请改用主键定位行",
                    ctx, text.substring(Math.max(0, rowid.start() - 40), Math.min(text.length(), rowid.end() + 40)));
        }
        Matcher rownum = ROWNUM.matcher(text);
        if (rownum.find()) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "ROWNUM 未转换",
                    "分页请改用 LIMIT，编号请改用 ROW_NUMBER() OVER ()",
                    ctx, text.substring(Math.max(0, rownum.start() - 40), Math.min(text.length(), rownum.end() + 40)));
        }
    }
}
