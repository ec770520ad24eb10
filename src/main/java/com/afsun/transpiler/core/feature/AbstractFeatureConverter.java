package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 特性转换器的公共工具
 *
 * @author afsun
 */
public abstract class AbstractFeatureConverter implements FeatureConverter {

    @Override
    public String name() {
        return getClass().getSimpleName();
    }

    protected static boolean from(ConversionContext ctx, Dialect dialect) {
        return ctx.getSource() == dialect;
    }

    protected static boolean to(ConversionContext ctx, Dialect dialect) {
        return ctx.getTarget() == dialect;
    }

    /**
     * 按匹配逐个替换，替换函数返回 null 时保留原文
     */
    protected static String replaceAll(Pattern pattern, String text, Function<Matcher, String> fn) {
        Matcher m = pattern.matcher(text);
        StringBuffer sb = new StringBuffer(text.length());
        while (m.find()) {
            String replacement = fn.apply(m);
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement == null ? m.group() : replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    protected static void warn(ConversionAccumulator acc, WarningType type, String message, String suggestion,
                               ConversionContext ctx, String fragment) {
        acc.warn(type, WarningSeverity.WARNING, message, suggestion, fragment == null ? null : ctx.snippet(fragment));
    }

    protected static void info(ConversionAccumulator acc, WarningType type, String message, String suggestion,
                               ConversionContext ctx, String fragment) {
        acc.warn(type, WarningSeverity.INFO, message, suggestion, fragment == null ? null : ctx.snippet(fragment));
    }

    /**
     * 保留语句前导空白（含被屏蔽的注释），替换其余部分
     */
    protected static String keepLead(String stmt, String replacement) {
        int i = 0;
        while (i < stmt.length()) {
            char c = stmt.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '\u0002') {
                int close = stmt.indexOf('\u0002', i + 1);
                if (close < 0) {
                    break;
                }
                i = close + 1;
            } else {
                break;
            }
        }
        return stmt.substring(0, i) + replacement;
    }
}
