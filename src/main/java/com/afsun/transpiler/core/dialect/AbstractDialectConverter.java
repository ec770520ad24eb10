package com.afsun.transpiler.core.dialect;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.exceptions.UnsupportedDialectException;
import com.afsun.transpiler.core.util.SqlPatterns;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 方言转换的公共流程：运算符 -> 函数 -> 数据类型。
 * 运算符改写由子类提供，函数和类型改写共用映射表。
 *
 * @author afsun
 */
@Slf4j
public abstract class AbstractDialectConverter implements DialectConverter {

    /**
     * 简单操作数：限定标识符、字符串占位符或数字
     */
    protected static final String OPERAND = "(" + SqlPatterns.QUALIFIED_IDENT + "|" + SqlPatterns.LITERAL
            + "|-?\\d+(?:\\.\\d+)?)";

    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\"([^\"`]+)\"");

    private static final Pattern BACKTICK_QUOTED = Pattern.compile("`([^`\"]+)`");

    private static final Pattern CAST_OPERATOR = Pattern.compile("::\\s*");

    private static final Pattern CAST_OPERATOR_TYPE = Pattern.compile(
            "(?i)(?:DOUBLE\\s+PRECISION|CHARACTER\\s+VARYING|TIMESTAMP(?:\\s*\\(\\d+\\))?\\s+WITH(?:OUT)?\\s+TIME\\s+ZONE"
                    + "|[A-Za-z_][\\w$]*)(?:\\s*\\([^()]*\\))?(?:\\[\\])?");

    private final FunctionCallRewriter functionCallRewriter;

    private final DataTypeRewriter dataTypeRewriter;

    protected AbstractDialectConverter(FunctionCallRewriter functionCallRewriter, DataTypeRewriter dataTypeRewriter) {
        this.functionCallRewriter = functionCallRewriter;
        this.dataTypeRewriter = dataTypeRewriter;
    }

    @Override
    public final String convertFunctionsAndTypes(String maskedSql, Dialect sourceDialect, ConversionContext ctx,
                                                 ConversionAccumulator acc) {
        if (ctx.getTarget() != target() || ctx.getSource() != sourceDialect) {
            throw new UnsupportedDialectException("转换上下文 {} -> {} 与策略 {} 不匹配",
                    ctx.getSource(), ctx.getTarget(), target());
        }
        if (maskedSql == null || maskedSql.trim().isEmpty() || sourceDialect == target()) {
            return maskedSql;
        }
        String text = rewriteOperators(maskedSql, ctx, acc);
        text = functionCallRewriter.rewrite(text, ctx, acc);
        text = dataTypeRewriter.rewrite(text, ctx, acc);
        text = afterTypes(text, ctx, acc);
        log.debug("{} -> {} 方言改写完成", sourceDialect, target());
        return text;
    }

    /**
     * 目标方言特有的运算符与语法改写，先于函数和类型改写执行
     */
    protected abstract String rewriteOperators(String text, ConversionContext ctx, ConversionAccumulator acc);

    /**
     * 类型改写之后的收尾，默认不处理
     */
    protected String afterTypes(String text, ConversionContext ctx, ConversionAccumulator acc) {
        return text;
    }

    protected boolean quotingEnabled(ConversionContext ctx) {
        return ctx.getRuleConfig().getSyntaxRules().isConvertIdentifierQuoting();
    }

    protected boolean paginationEnabled(ConversionContext ctx) {
        return ctx.getRuleConfig().getSyntaxRules().isConvertPagination();
    }

    protected String backticksToDoubleQuotes(String text, ConversionAccumulator acc) {
        return acc.apply("Quoting `ident` -> \"ident\"", text, BACKTICK_QUOTED.matcher(text).replaceAll("\"$1\""));
    }

    protected String doubleQuotesToBackticks(String text, ConversionAccumulator acc) {
        return acc.apply("Quoting \"ident\" -> `ident`", text, DOUBLE_QUOTED.matcher(text).replaceAll("`$1`"));
    }

    /**
     * PostgreSQL 的 expr::type 改为 CAST(expr AS type)
     */
    protected String castOperatorToCast(String text, ConversionContext ctx, ConversionAccumulator acc) {
        if (!text.contains("::")) {
            return text;
        }
        String current = text;
        Matcher m = CAST_OPERATOR.matcher(current);
        int from = 0;
        while (m.find(from)) {
            int opStart = m.start();
            int operandStart = operandStart(current, opStart);
            Matcher tm = CAST_OPERATOR_TYPE.matcher(current);
            tm.region(m.end(), current.length());
            if (operandStart < 0 || !tm.lookingAt()) {
                acc.warn(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.WARNING,
                        "无法识别 :: 类型转换的操作数", "请改写为 CAST(expr AS type)",
                        ctx.snippet(current.substring(Math.max(0, opStart - 30), Math.min(current.length(), opStart + 30))));
                from = m.end();
                continue;
            }
            String operand = current.substring(operandStart, opStart).trim();
            String type = tm.group();
            if (type.endsWith("[]")) {
                acc.warn(WarningType.DATA_TYPE_MISMATCH, WarningSeverity.WARNING,
                        "数组类型 " + type + " 在 " + ctx.getTarget().getDisplayName() + " 中不存在",
                        "请人工调整数组相关逻辑", ctx.snippet(operand + "::" + type));
            }
            String replacement = "CAST(" + operand + " AS " + type + ")";
            current = current.substring(0, operandStart) + replacement + current.substring(tm.end());
            acc.addRule("Operator :: -> CAST");
            from = operandStart + replacement.length();
            m = CAST_OPERATOR.matcher(current);
        }
        return current;
    }

    /**
     * 向前找 :: 左侧操作数的起点：括号组、字符串占位符或标识符链
     */
    private static int operandStart(String s, int opStart) {
        int i = opStart - 1;
        while (i >= 0 && Character.isWhitespace(s.charAt(i))) {
            i--;
        }
        if (i < 0) {
            return -1;
        }
        char c = s.charAt(i);
        int start;
        if (c == ')') {
            int depth = 0;
            int j = i;
            for (; j >= 0; j--) {
                char ch = s.charAt(j);
                if (ch == ')') {
                    depth++;
                } else if (ch == '(') {
                    depth--;
                    if (depth == 0) {
                        break;
                    }
                }
            }
            if (j < 0) {
                return -1;
            }
            // 函数调用时带上函数名
            int k = j - 1;
            while (k >= 0 && (Character.isLetterOrDigit(s.charAt(k)) || s.charAt(k) == '_' || s.charAt(k) == '.')) {
                k--;
            }
            start = k + 1;
        } else if (c == '\'') {
            int open = s.lastIndexOf('\'', i - 1);
            if (open < 0) {
                return -1;
            }
            start = open;
        } else {
            int j = i;
            while (j >= 0 && (Character.isLetterOrDigit(s.charAt(j)) || s.charAt(j) == '_' || s.charAt(j) == '.'
                    || s.charAt(j) == '$' || s.charAt(j) == '"' || s.charAt(j) == ':')) {
                j--;
            }
            start = j + 1;
            if (start > i) {
                return -1;
            }
        }
        return start;
    }

    protected static String replaceAll(Pattern pattern, String text, Function<Matcher, String> fn) {
        Matcher m = pattern.matcher(text);
        StringBuffer sb = new StringBuffer(text.length());
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(fn.apply(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
