package com.afsun.transpiler.core.dialect;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.mapping.DateFormatMapper;
import com.afsun.transpiler.core.mapping.FunctionMappingRegistry;
import com.afsun.transpiler.core.mapping.FunctionMappingRule;
import com.afsun.transpiler.core.util.SqlTextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按函数映射表改写函数调用。参数按顶层逗号切分，先改写内层调用再改写外层。
 * 未登记的函数原样保留。
 *
 * @author afsun
 */
@Slf4j
@Component
public class FunctionCallRewriter {

    /**
     * 函数名后紧跟左括号，且前面不是限定符
     */
    private static final Pattern CALL = Pattern.compile("(?<![.\\w$#\"`])([A-Za-z_][\\w$]*)\\s*\\(");

    private static final Pattern NULL_LITERAL = Pattern.compile("(?i)\\s*NULL\\s*");

    private final FunctionMappingRegistry registry;

    public FunctionCallRewriter(FunctionMappingRegistry registry) {
        this.registry = registry;
    }

    public String rewrite(String text, ConversionContext ctx, ConversionAccumulator acc) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        Matcher m = CALL.matcher(text);
        int pos = 0;
        while (pos < text.length() && m.find(pos)) {
            int open = m.end() - 1;
            int close = SqlTextUtils.findMatchingParen(text, open);
            if (close < 0) {
                break;
            }
            String name = m.group(1);
            String inner = rewrite(text.substring(open + 1, close), ctx, acc);
            String innerOnly = text.substring(m.start(), open + 1) + inner + ")";
            FunctionMappingRule rule = registry.find(ctx.getSource(), ctx.getTarget(), name);
            String replacement = innerOnly;
            if (rule != null && rule.getCategory().isEnabled(ctx.getRuleConfig().getFunctionRules())) {
                replacement = apply(rule, name, inner, innerOnly, ctx, acc);
                if (!replacement.equals(innerOnly)) {
                    acc.addRule(rule.ruleName());
                    log.debug("函数改写: {} -> {}", name, rule.getTargetFunction());
                }
            }
            out.append(text, pos, m.start()).append(replacement);
            pos = close + 1;
        }
        if (pos < text.length()) {
            out.append(text.substring(pos));
        }
        return out.toString();
    }

    private String apply(FunctionMappingRule rule, String name, String inner, String original,
                         ConversionContext ctx, ConversionAccumulator acc) {
        String location = ctx.snippet(original);
        if (!rule.isSupported()) {
            acc.warn(WarningType.UNSUPPORTED_FUNCTION, WarningSeverity.WARNING,
                    rule.getWarningMessage(), rule.getSuggestion(), location);
            return original;
        }
        List<String> args = SqlTextUtils.splitArguments(inner);
        if (rule.getMaxArguments() != null && args.size() > rule.getMaxArguments()) {
            acc.warn(WarningType.PARTIAL_SUPPORT, WarningSeverity.WARNING,
                    "函数 " + name + " 的参数个数超出 " + rule.getTargetFunction() + " 的支持范围，未做转换",
                    "请人工改写该调用", location);
            return original;
        }
        if (rule.getWarningMessage() != null) {
            acc.warn(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.INFO, rule.getWarningMessage(),
                    rule.getSuggestion(), location);
        }
        switch (rule.getTransform()) {
            case SWAP_FIRST_TWO:
                return swapFirstTwo(rule, args, original);
            case TO_CASE_WHEN:
                return toCaseWhen(name, args, original, ctx, acc);
            case DATE_FORMAT_CONVERT:
                return convertDateFormat(rule, name, args, ctx, acc, location);
            case CAST:
                return castCall(rule, name, args, ctx, acc, location);
            case DIRECT:
            default:
                return rule.getTargetFunction() + "(" + inner + ")";
        }
    }

    private String swapFirstTwo(FunctionMappingRule rule, List<String> args, String original) {
        if (args.size() < 2) {
            return original;
        }
        List<String> swapped = new ArrayList<>(SqlTextUtils.trimAll(args));
        String first = swapped.get(0);
        swapped.set(0, swapped.get(1));
        swapped.set(1, first);
        return rule.getTargetFunction() + "(" + String.join(", ", swapped) + ")";
    }

    private String toCaseWhen(String name, List<String> rawArgs, String original,
                              ConversionContext ctx, ConversionAccumulator acc) {
        List<String> args = SqlTextUtils.trimAll(rawArgs);
        String upper = name.toUpperCase(Locale.ROOT);
        if ("NVL2".equals(upper) && args.size() == 3) {
            return "CASE WHEN " + args.get(0) + " IS NOT NULL THEN " + args.get(1) + " ELSE " + args.get(2) + " END";
        }
        if ("IF".equals(upper) && args.size() == 3) {
            return "CASE WHEN " + args.get(0) + " THEN " + args.get(1) + " ELSE " + args.get(2) + " END";
        }
        if ("DECODE".equals(upper) && args.size() >= 3) {
            String subject = args.get(0);
            StringBuilder sb = new StringBuilder("CASE");
            int i = 1;
            for (; i + 1 < args.size(); i += 2) {
                String search = args.get(i);
                if (NULL_LITERAL.matcher(search).matches()) {
                    sb.append(" WHEN ").append(subject).append(" IS NULL THEN ");
                } else {
                    sb.append(" WHEN ").append(subject).append(" = ").append(search).append(" THEN ");
                }
                sb.append(args.get(i + 1));
            }
            if (i < args.size()) {
                sb.append(" ELSE ").append(args.get(i));
            }
            return sb.append(" END").toString();
        }
        acc.warn(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.WARNING,
                "函数 " + name + " 的参数个数不符合预期，未改写为 CASE WHEN", "请人工改写该调用", ctx.snippet(original));
        return original;
    }

    private String convertDateFormat(FunctionMappingRule rule, String name, List<String> rawArgs,
                                     ConversionContext ctx, ConversionAccumulator acc, String location) {
        List<String> args = SqlTextUtils.trimAll(rawArgs);
        String upper = name.toUpperCase(Locale.ROOT);
        boolean toMySql = ctx.getTarget() == Dialect.MYSQL;
        if (args.size() == 1) {
            if (toMySql) {
                return "CAST(" + args.get(0) + " AS " + ("TO_CHAR".equals(upper) ? "CHAR" : "DATETIME") + ")";
            }
            return rule.getTargetFunction() + "(" + args.get(0) + ")";
        }
        if (args.isEmpty()) {
            return rule.getTargetFunction() + "()";
        }
        String format = ctx.literalValue(args.get(1));
        if (format == null) {
            acc.warn(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.WARNING,
                    "函数 " + name + " 的格式参数不是字面量，格式串未转换", "请确认格式串符合目标方言", location);
            return rule.getTargetFunction() + "(" + String.join(", ", args) + ")";
        }
        if (toMySql && "TO_CHAR".equals(upper) && !DateFormatMapper.looksLikeDateFormat(format)) {
            acc.warn(WarningType.PARTIAL_SUPPORT, WarningSeverity.WARNING,
                    "TO_CHAR 数字格式 '" + format + "' 在 MySQL 中没有对应，已改为 CAST",
                    "可使用 FORMAT(x, d) 控制小数位", location);
            return "CAST(" + args.get(0) + " AS CHAR)";
        }
        String converted = ctx.getSource() == Dialect.MYSQL
                ? DateFormatMapper.mySqlToOracle(format)
                : toMySql ? DateFormatMapper.oracleToMySql(format) : format;
        List<String> rest = new ArrayList<>();
        rest.add(args.get(0));
        rest.add(ctx.addLiteral(converted));
        if (args.size() > 2) {
            acc.warn(WarningType.PARTIAL_SUPPORT, WarningSeverity.INFO,
                    "函数 " + name + " 的 NLS 参数已丢弃", null, location);
        }
        return rule.getTargetFunction() + "(" + String.join(", ", rest) + ")";
    }

    private String castCall(FunctionMappingRule rule, String name, List<String> rawArgs,
                            ConversionContext ctx, ConversionAccumulator acc, String location) {
        List<String> args = SqlTextUtils.trimAll(rawArgs);
        if (args.isEmpty()) {
            return name + "()";
        }
        if (args.size() > 1) {
            if (ctx.getTarget() == Dialect.POSTGRESQL) {
                return name + "(" + String.join(", ", args) + ")";
            }
            acc.warn(WarningType.PARTIAL_SUPPORT, WarningSeverity.WARNING,
                    "函数 " + name + " 的格式参数在 " + ctx.getTarget().getDisplayName() + " 中不受支持，已丢弃",
                    "请确认数值格式", location);
        }
        return "CAST(" + args.get(0) + " AS " + rule.getTargetFunction() + ")";
    }
}
