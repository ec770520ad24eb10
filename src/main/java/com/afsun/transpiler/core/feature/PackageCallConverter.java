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
 * Oracle 内置包调用（DBMS_* / UTL_*）与 RAISE_APPLICATION_ERROR。
 * 有对应内置函数的改写为目标写法，其余调用注释掉并告警，不直接删除。
 *
 * @author afsun
 */
@Component
public class PackageCallConverter extends AbstractFeatureConverter {

    private static final Pattern KEYWORD = Pattern.compile("(?i)\\b(?:DBMS_\\w+|UTL_\\w+|RAISE_APPLICATION_ERROR)\\b");

    private static final Pattern CALL = Pattern.compile(
            "(?i)(?<![\\w$#.])(?:SYS\\s*\\.\\s*)?(?:((?:DBMS|UTL)_\\w+)\\s*\\.\\s*(\\w+)|(RAISE_APPLICATION_ERROR))\\b(\\s*\\()?");

    /**
     * 调用前只有语句开头或过程块关键字时视为独立语句
     */
    private static final Pattern STATEMENT_PREFIX = Pattern.compile(
            "(?is)(?:^|\\b(?:BEGIN|THEN|ELSE|LOOP|DECLARE)\\b|\\u0002\\d+\\u0002)\\s*$");

    private static final Pattern LITERAL = Pattern.compile(SqlPatterns.LITERAL);

    @Override
    public int order() {
        return 1200;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getSyntaxRules().isConvertPackageCalls();
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
        List<int[]> found = new ArrayList<>();
        Matcher m = CALL.matcher(stmt);
        while (m.find()) {
            found.add(new int[]{m.start(), m.end()});
        }
        String s = stmt;
        for (int i = found.size() - 1; i >= 0; i--) {
            Matcher call = CALL.matcher(s);
            if (!call.find(found.get(i)[0])) {
                continue;
            }
            int end = call.end();
            List<String> args = new ArrayList<>();
            if (call.group(4) != null) {
                int close = SqlTextUtils.findMatchingParen(s, call.end() - 1);
                if (close < 0) {
                    continue;
                }
                args = SqlTextUtils.trimAll(SqlTextUtils.splitArguments(s.substring(call.end(), close)));
                end = close + 1;
            }
            String name = call.group(3) != null
                    ? "RAISE_APPLICATION_ERROR"
                    : (call.group(1) + "." + call.group(2)).toUpperCase(Locale.ROOT);
            boolean statement = STATEMENT_PREFIX.matcher(s.substring(0, call.start())).find()
                    && s.substring(end).trim().isEmpty();
            String original = s.substring(call.start(), end);
            String replacement = rewrite(name, args, statement, original, ctx, acc);
            if (replacement != null) {
                acc.addRule("Package call " + name + " converted");
                s = s.substring(0, call.start()) + replacement + s.substring(end);
            }
        }
        return s;
    }

    private String rewrite(String name, List<String> args, boolean statement, String original,
                           ConversionContext ctx, ConversionAccumulator acc) {
        boolean pg = to(ctx, Dialect.POSTGRESQL);
        switch (name) {
            case "DBMS_OUTPUT.PUT_LINE":
            case "DBMS_OUTPUT.PUT":
                if (!statement || args.size() != 1) {
                    return commentOut(name, original, statement, ctx, acc);
                }
                info(acc, WarningType.SYNTAX_DIFFERENCE, name + " 已改为 " + (pg ? "RAISE NOTICE" : "SELECT 输出"),
                        null, ctx, original);
                return pg ? "RAISE NOTICE " + ctx.addLiteral("%") + ", " + args.get(0) : "SELECT " + args.get(0);
            case "DBMS_RANDOM.VALUE":
                String random = pg ? "RANDOM()" : "RAND()";
                if (args.size() == 2) {
                    return "(" + args.get(0) + " + (" + args.get(1) + " - " + args.get(0) + ") * " + random + ")";
                }
                return args.isEmpty() ? random : null;
            case "DBMS_RANDOM.STRING":
                if (args.size() != 2) {
                    return null;
                }
                warn(acc, WarningType.PARTIAL_SUPPORT, "DBMS_RANDOM.STRING 已改为 MD5 截取，字符集与原函数不同",
                        "如需特定字符集请自定义函数", ctx, original);
                return pg
                        ? "SUBSTRING(MD5(CAST(RANDOM() AS TEXT)) FROM 1 FOR " + args.get(1) + ")"
                        : "SUBSTRING(MD5(RAND()), 1, " + args.get(1) + ")";
            case "DBMS_LOB.GETLENGTH":
                return args.size() == 1 ? "LENGTH(" + args.get(0) + ")" : null;
            case "DBMS_LOB.SUBSTR":
                if (args.isEmpty() || args.size() > 3) {
                    return null;
                }
                String amount = args.size() > 1 ? args.get(1) : "32767";
                String offset = args.size() > 2 ? args.get(2) : "1";
                return "SUBSTR(" + args.get(0) + ", " + offset + ", " + amount + ")";
            case "DBMS_LOB.INSTR":
                if (args.size() < 2) {
                    return null;
                }
                return "INSTR(" + String.join(", ", args) + ")";
            case "DBMS_UTILITY.GET_TIME":
                info(acc, WarningType.SYNTAX_DIFFERENCE, "DBMS_UTILITY.GET_TIME 已改为基于当前时间的百分之一秒计数",
                        "原函数返回值只适合计算差值，改写后同样只用于计算耗时", ctx, original);
                return pg
                        ? "CAST(EXTRACT(EPOCH FROM CLOCK_TIMESTAMP()) * 100 AS BIGINT)"
                        : "CAST(UNIX_TIMESTAMP(NOW(3)) * 100 AS SIGNED)";
            case "DBMS_LOCK.SLEEP":
            case "DBMS_SESSION.SLEEP":
                if (args.size() != 1) {
                    return null;
                }
                if (pg) {
                    return (statement ? "PERFORM " : "") + "pg_sleep(" + args.get(0) + ")";
                }
                return (statement ? "DO " : "") + "SLEEP(" + args.get(0) + ")";
            case "DBMS_MVIEW.REFRESH":
                return refreshMaterializedView(args, statement, original, ctx, acc);
            case "RAISE_APPLICATION_ERROR":
                return raiseError(args, statement, original, ctx, acc);
            default:
                return commentOut(name, original, statement, ctx, acc);
        }
    }

    private String refreshMaterializedView(List<String> args, boolean statement, String original,
                                           ConversionContext ctx, ConversionAccumulator acc) {
        String view = args.isEmpty() ? null : ctx.literalValue(args.get(0));
        if (!statement || view == null || view.contains(",")) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "DBMS_MVIEW.REFRESH 参数无法静态解析",
                    "请逐个物化视图改写刷新语句", ctx, original);
            return null;
        }
        if (args.size() > 1 && !"C".equalsIgnoreCase(ctx.literalValue(args.get(1)))) {
            warn(acc, WarningType.PARTIAL_SUPPORT, "目标库只支持全量刷新，刷新方式参数已忽略", null, ctx, original);
        }
        if (to(ctx, Dialect.POSTGRESQL)) {
            return "REFRESH MATERIALIZED VIEW " + view;
        }
        return "CALL " + MaterializedViewConverter.refreshProcedure(view) + "()";
    }

    private String raiseError(List<String> args, boolean statement, String original,
                              ConversionContext ctx, ConversionAccumulator acc) {
        if (!statement || args.size() < 2) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "RAISE_APPLICATION_ERROR 调用形式无法识别",
                    "请改写为目标库的异常抛出语句", ctx, original);
            return null;
        }
        String code = args.get(0);
        String message = args.get(1);
        if (to(ctx, Dialect.POSTGRESQL)) {
            info(acc, WarningType.SYNTAX_DIFFERENCE, "RAISE_APPLICATION_ERROR 已改为 RAISE EXCEPTION，错误码放入 DETAIL",
                    "调用方按 SQLSTATE P0001 捕获", ctx, original);
            return "RAISE EXCEPTION " + ctx.addLiteral("%") + ", " + message
                    + " USING ERRCODE = " + ctx.addLiteral("P0001") + ", DETAIL = " + ctx.addLiteral("ORA" + code);
        }
        if (!LITERAL.matcher(message).matches() && !message.matches(SqlPatterns.IDENT)) {
            warn(acc, WarningType.PARTIAL_SUPPORT, "MySQL SIGNAL 的 MESSAGE_TEXT 只能是字面量或变量",
                    "请先把消息表达式赋给局部变量", ctx, original);
        }
        info(acc, WarningType.SYNTAX_DIFFERENCE, "RAISE_APPLICATION_ERROR 已改为 SIGNAL SQLSTATE '45000'，原错误码 "
                + code + " 未保留", "调用方按 SQLSTATE 45000 捕获", ctx, original);
        return "SIGNAL SQLSTATE " + ctx.addLiteral("45000") + " SET MESSAGE_TEXT = " + message;
    }

    private String commentOut(String name, String original, boolean statement, ConversionContext ctx,
                              ConversionAccumulator acc) {
        warn(acc, WarningType.UNSUPPORTED_FUNCTION,
                ctx.getTarget().getDisplayName() + " 没有 " + name + "，调用已注释",
                "请按业务用途改写或删除该调用", ctx, original);
        String comment = ctx.comment(original);
        return statement ? comment : "NULL " + comment;
    }
}
