package com.afsun.transpiler.core.validation;

import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.ValidationInfo;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.MaskedSql;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 转换结果校验：括号与引号配对、关键子句丢失、函数调用大量减少以及常见性能隐患。
 * 无副作用，只返回问题列表。
 *
 * @author afsun
 */
@Slf4j
@Component
public class SqlValidationService {

    private static final String[] CRITICAL_KEYWORDS = {"WHERE", "GROUP BY", "ORDER BY", "HAVING", "DISTINCT"};

    private static final Pattern FUNCTION_CALL = Pattern.compile("(?<![\\w$#])([A-Za-z_][\\w$#]*)\\s*\\((?!\\s*\\+\\s*\\))");

    /**
     * 后面可以直接跟括号但不是函数调用的关键字
     */
    private static final Set<String> NON_FUNCTIONS = new HashSet<>(Arrays.asList(
            "IN", "VALUES", "AS", "ON", "USING", "EXISTS", "AND", "OR", "NOT", "KEY", "TABLE", "INTO", "OVER",
            "FROM", "JOIN", "WHERE", "SELECT", "CHECK", "PRIMARY", "UNIQUE", "REFERENCES", "INDEX", "PARTITION",
            "WITHIN", "GROUP", "FILTER", "DEFAULT", "PROCEDURE", "FUNCTION", "RETURNS", "RETURN", "WITH", "VIEW",
            "UNION", "ALL", "ANY", "SOME", "THEN", "ELSE", "WHEN", "CASE", "BY", "SET", "KEEP", "PIVOT", "UNPIVOT",
            "RECURSIVE", "LATERAL", "OF", "STORAGE", "INCLUDE", "CONFLICT", "DATA", "IS", "LIKE", "BETWEEN", "TYPE",
            "OBJECT", "VARRAY", "ENUM", "IF", "CONSTRAINT", "FOREIGN", "BEGIN", "DECLARE", "LOOP", "WHILE",
            "EXCEPT", "MINUS", "INTERSECT", "OPTIONS", "SERVER", "DOMAIN", "ARRAY", "ROW", "NUMBER", "VARCHAR2",
            "VARCHAR", "CHAR", "DECIMAL", "NUMERIC", "TIMESTAMP", "INTERVAL", "FLOAT", "RAW", "NVARCHAR2",
            "INT", "INTEGER", "BIGINT", "SMALLINT", "TINYINT", "DOUBLE", "DATETIME", "TIME", "BIT", "VARBINARY",
            "BINARY", "NCHAR", "ENGINE", "SEPARATOR", "ORDER", "FOR", "DO", "CALL", "PERFORM", "EXECUTE",
            "CREATE", "UPDATE", "INSERT", "DELETE", "MERGE", "OUT", "INOUT"));

    /**
     * 与函数调用互相改写的表达式：CASE 表达式、序列伪列
     */
    private static final Pattern FUNCTION_LIKE = Pattern.compile("(?i)\\bCASE\\b|\\.\\s*(?:NEXTVAL|CURRVAL)\\b");

    /**
     * 紧跟对象名的关键字，其后的 name( 是列清单而不是函数调用
     */
    private static final Pattern OBJECT_KEYWORD_BEFORE = Pattern.compile(
            "(?i)\\b(?:INTO|TABLE|REFERENCES|VIEW|EXISTS)\\s+$");

    /**
     * 原SQL中的 (+) 外连接，改写为 JOIN ... ON 后 WHERE 可能整体消失
     */
    private static final Pattern OUTER_JOIN_MARKER = Pattern.compile("\\(\\s*\\+\\s*\\)");

    private static final Pattern JOIN_ON = Pattern.compile("(?i)\\bJOIN\\b[^;]*?\\bON\\b");

    private static final Pattern IN_LIST = Pattern.compile("(?i)\\bIN\\s*\\(");

    private static final Pattern SUBQUERY_OPEN = Pattern.compile("(?i)^\\(\\s*SELECT\\b");

    private static final Pattern LIKE_LITERAL = Pattern.compile("(?i)\\bLIKE\\s+(" + SqlPatterns.LITERAL + ")");

    private static final Pattern SELECT_STAR = Pattern.compile("(?i)\\bSELECT\\s+(?:DISTINCT\\s+|ALL\\s+)?\\*");

    private static final Pattern SELECT_START = Pattern.compile("(?i)^\\s*SELECT\\b");

    public List<ConversionWarning> validate(String original, String converted, RuleConfig ruleConfig) {
        return validate(original, converted, null, null, ruleConfig);
    }

    /**
     * @param sourceDialect 原SQL方言，决定字面量的转义规则；可为 null
     * @param targetDialect 转换后SQL方言；可为 null
     */
    public List<ConversionWarning> validate(String original, String converted, Dialect sourceDialect,
                                            Dialect targetDialect, RuleConfig ruleConfig) {
        List<ConversionWarning> issues = new ArrayList<>();
        if (StringUtils.isBlank(converted)) {
            if (StringUtils.isNotBlank(original)) {
                issues.add(ConversionWarning.of(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.ERROR,
                        "转换结果为空", "请检查输入SQL或查看其余告警"));
            }
            return issues;
        }
        RuleConfig.WarningSettings settings = (ruleConfig == null ? RuleConfig.defaults() : ruleConfig).getWarningSettings();
        MaskedSql convertedMasked = MaskedSql.mask(converted, targetDialect);
        String target = convertedMasked.getText();

        if (!isBracketsBalanced(converted, targetDialect)) {
            issues.add(ConversionWarning.of(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.ERROR,
                    "转换结果括号不配对", "请检查转换结果中的括号", SqlTextUtils.shortSql(converted)));
        }
        if (!isQuotesBalanced(converted, targetDialect)) {
            issues.add(ConversionWarning.of(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.ERROR,
                    "转换结果引号不配对", "请检查字符串字面量和引用标识符", SqlTextUtils.shortSql(converted)));
        }
        if (StringUtils.isNotBlank(original)) {
            String sourceText = MaskedSql.mask(original, sourceDialect, false).getText();
            String targetText = MaskedSql.mask(converted, targetDialect, false).getText();
            checkCriticalKeywords(sourceText, targetText, issues);
            if (settings.isWarnFunctionLoss()) {
                checkFunctionLoss(MaskedSql.mask(original, sourceDialect).getText(), target,
                        settings.getFunctionLossRatio(), issues);
            }
        }
        checkInLists(target, settings.getMaxInClauseSize(), issues);
        checkSubqueryDepth(target, settings.getMaxSubqueryDepth(), issues);
        if (settings.isWarnLeadingWildcard()) {
            checkLeadingWildcard(target, convertedMasked, issues);
        }
        if (settings.isWarnSelectStar() && SELECT_STAR.matcher(target).find()) {
            issues.add(ConversionWarning.of(WarningType.PERFORMANCE, WarningSeverity.INFO,
                    "使用了 SELECT *", "建议显式列出需要的列，避免表结构变化影响结果"));
        }
        log.debug("转换结果校验完成, 问题数={}", issues.size());
        return issues;
    }

    public ValidationInfo summarize(String converted, Dialect targetDialect, List<ConversionWarning> issues) {
        boolean passed = true;
        for (ConversionWarning w : issues) {
            if (w.isError()) {
                passed = false;
                break;
            }
        }
        return new ValidationInfo(passed, issues.size(),
                converted == null || isBracketsBalanced(converted, targetDialect),
                converted == null || isQuotesBalanced(converted, targetDialect));
    }

    /**
     * 括号配对检查，忽略字符串字面量和注释中的括号
     */
    public boolean isBracketsBalanced(String sql, Dialect dialect) {
        String text = MaskedSql.mask(sql, dialect).getText();
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    /**
     * 引号配对检查，'' 视为转义，注释内的引号不计
     */
    public boolean isQuotesBalanced(String sql, Dialect dialect) {
        boolean backslash = dialect == Dialect.MYSQL;
        int len = sql.length();
        int i = 0;
        while (i < len) {
            char c = sql.charAt(i);
            if (c == '-' && i + 1 < len && sql.charAt(i + 1) == '-') {
                while (i < len && sql.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (c == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                if (close < 0) {
                    return true;
                }
                i = close + 2;
                continue;
            }
            if (c == '\'' || c == '"' || c == '`') {
                int j = i + 1;
                boolean closed = false;
                while (j < len) {
                    char ch = sql.charAt(j);
                    if (backslash && c == '\'' && ch == '\\') {
                        j += 2;
                        continue;
                    }
                    if (ch == c) {
                        if (j + 1 < len && sql.charAt(j + 1) == c) {
                            j += 2;
                            continue;
                        }
                        closed = true;
                        break;
                    }
                    j++;
                }
                if (!closed) {
                    return false;
                }
                i = j + 1;
                continue;
            }
            i++;
        }
        return true;
    }

    private static void checkCriticalKeywords(String source, String target, List<ConversionWarning> issues) {
        boolean whereMovedToJoin = OUTER_JOIN_MARKER.matcher(source).find() && JOIN_ON.matcher(target).find();
        for (String keyword : CRITICAL_KEYWORDS) {
            if ("WHERE".equals(keyword) && whereMovedToJoin) {
                continue;
            }
            Pattern p = Pattern.compile("(?i)\\b" + keyword.replace(" ", "\\s+") + "\\b");
            if (p.matcher(source).find() && !p.matcher(target).find()) {
                issues.add(ConversionWarning.of(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.ERROR,
                        "转换结果丢失了关键子句 " + keyword, "请对照原SQL检查转换结果"));
            }
        }
    }

    private static void checkFunctionLoss(String source, String target, double ratio, List<ConversionWarning> issues) {
        int before = countFunctions(source);
        int after = countFunctions(target);
        if (before > 0 && after < before * (1 - ratio)) {
            issues.add(ConversionWarning.of(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.WARNING,
                    "函数调用数量从 " + before + " 减少到 " + after, "请确认没有函数被意外删除"));
        }
    }

    static int countFunctions(String masked) {
        int count = 0;
        Matcher m = FUNCTION_CALL.matcher(masked);
        Matcher before = OBJECT_KEYWORD_BEFORE.matcher(masked);
        before.useTransparentBounds(true);
        while (m.find()) {
            if (NON_FUNCTIONS.contains(m.group(1).toUpperCase(Locale.ROOT))) {
                continue;
            }
            before.region(Math.max(0, m.start() - 32), m.start());
            if (!before.find()) {
                count++;
            }
        }
        Matcher like = FUNCTION_LIKE.matcher(masked);
        while (like.find()) {
            count++;
        }
        return count;
    }

    private static void checkInLists(String masked, int max, List<ConversionWarning> issues) {
        Matcher m = IN_LIST.matcher(masked);
        while (m.find()) {
            int open = m.end() - 1;
            int close = SqlTextUtils.findMatchingParen(masked, open);
            if (close < 0) {
                continue;
            }
            String body = masked.substring(open + 1, close);
            if (SELECT_START.matcher(body).find()) {
                continue;
            }
            int size = SqlTextUtils.splitArguments(body).size();
            if (size > max) {
                issues.add(ConversionWarning.of(WarningType.PERFORMANCE, WarningSeverity.WARNING,
                        "IN 列表包含 " + size + " 个元素，超过 " + max,
                        "建议改用临时表关联或分批查询"));
            }
        }
    }

    private static void checkSubqueryDepth(String masked, int max, List<ConversionWarning> issues) {
        int depth = maxSubqueryDepth(masked);
        if (depth > max) {
            issues.add(ConversionWarning.of(WarningType.PERFORMANCE, WarningSeverity.WARNING,
                    "子查询嵌套深度为 " + depth + "，超过 " + max, "建议用 WITH 子句或关联改写"));
        }
    }

    /**
     * 以 "( SELECT" 开头的括号计为一层子查询
     */
    static int maxSubqueryDepth(String masked) {
        Deque<Boolean> stack = new ArrayDeque<>();
        int current = 0;
        int max = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                boolean subquery = SUBQUERY_OPEN.matcher(masked.substring(i, Math.min(masked.length(), i + 64))).find();
                stack.push(subquery);
                if (subquery) {
                    current++;
                    max = Math.max(max, current);
                }
            } else if (c == ')' && !stack.isEmpty()) {
                if (stack.pop()) {
                    current--;
                }
            }
        }
        return max;
    }

    private static void checkLeadingWildcard(String masked, MaskedSql literals, List<ConversionWarning> issues) {
        Matcher m = LIKE_LITERAL.matcher(masked);
        while (m.find()) {
            String value = literals.literalValue(m.group(1));
            if (value != null && (value.startsWith("%") || value.startsWith("_"))) {
                issues.add(ConversionWarning.of(WarningType.PERFORMANCE, WarningSeverity.WARNING,
                        "LIKE '" + value + "' 以通配符开头，无法使用索引", "可考虑全文索引或反向索引"));
                return;
            }
        }
    }
}
