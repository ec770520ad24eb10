package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Oracle (+) 外连接改为 ANSI LEFT JOIN。
 * <p>
 * 只改写语句最外层查询块的逗号连接；FROM 中已有 JOIN、条件中有 OR、
 * 被连接表引用了后续外连接表等情况保留原文并提示人工处理。
 *
 * @author afsun
 */
@Component
public class OuterJoinConverter extends AbstractFeatureConverter {

    private static final Pattern MARKER = Pattern.compile("\\(\\s*\\+\\s*\\)");

    private static final Pattern MARKED_COLUMN = Pattern.compile(
            "([A-Za-z_][\\w$#]*|\"[^\"]+\")\\s*\\.\\s*(?:[A-Za-z_][\\w$#]*|\"[^\"]+\")\\s*\\(\\s*\\+\\s*\\)");

    private static final Pattern COLUMN_REF = Pattern.compile(
            "([A-Za-z_][\\w$#]*|\"[^\"]+\")\\s*\\.\\s*(?:[A-Za-z_][\\w$#]*|\"[^\"]+\")");

    private static final Pattern TRAILING_NAME = Pattern.compile("([A-Za-z_][\\w$#]*|\"[^\"]+\")\\s*$");

    private static final Pattern TOP_LEVEL_AND = Pattern.compile("(?i)\\s+AND\\s+");

    private static final Pattern OPEN_BETWEEN = Pattern.compile("(?is)\\bBETWEEN\\b(?:(?!\\bAND\\b).)*$");

    private static final String[] WHERE_END = {
            "GROUP BY", "ORDER BY", "HAVING", "UNION", "INTERSECT", "MINUS", "EXCEPT",
            "CONNECT BY", "START WITH", "FETCH", "FOR UPDATE"
    };

    @Override
    public int order() {
        return 750;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getSyntaxRules().isConvertOuterJoins();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return from(ctx, Dialect.ORACLE) && !to(ctx, Dialect.ORACLE) && MARKER.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        return SqlTextUtils.mapStatements(maskedSql, stmt -> convertStatement(stmt, ctx, acc));
    }

    private String convertStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        if (!MARKER.matcher(stmt).find()) {
            return stmt;
        }
        String out = rewriteOuterBlock(stmt);
        if (out != null) {
            acc.addRule("Outer join (+) -> LEFT JOIN");
            info(acc, WarningType.SYNTAX_DIFFERENCE, "Oracle (+) 外连接已改为 LEFT JOIN", "请核对连接条件", ctx, stmt);
        } else {
            out = stmt;
        }
        if (MARKER.matcher(out).find()) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "Oracle (+) 外连接无法自动改写，目标库不支持该语法",
                    "请手工改为 LEFT JOIN ... ON", ctx, out);
        }
        return out;
    }

    /**
     * 改写最外层查询块，无法安全改写时返回 null
     */
    private String rewriteOuterBlock(String stmt) {
        int fromIdx = SqlTextUtils.findTopLevelKeyword(stmt, "FROM", 0);
        if (fromIdx < 0) {
            return null;
        }
        int whereIdx = SqlTextUtils.findTopLevelKeyword(stmt, "WHERE", fromIdx);
        if (whereIdx < 0) {
            return null;
        }
        int whereEnd = stmt.length();
        for (String keyword : WHERE_END) {
            int idx = SqlTextUtils.findTopLevelKeyword(stmt, keyword, whereIdx);
            if (idx >= 0 && idx < whereEnd) {
                whereEnd = idx;
            }
        }
        String fromList = stmt.substring(fromIdx + "FROM".length(), whereIdx);
        String where = stmt.substring(whereIdx + "WHERE".length(), whereEnd);
        if (!MARKER.matcher(where).find() || SqlTextUtils.findTopLevelKeyword(fromList, "JOIN", 0) >= 0
                || SqlTextUtils.findTopLevelKeyword(where, "OR", 0) >= 0) {
            return null;
        }

        Map<String, String> tables = new LinkedHashMap<>();
        for (String item : SqlTextUtils.trimAll(SqlTextUtils.splitTopLevel(fromList, ','))) {
            Matcher m = TRAILING_NAME.matcher(item);
            if (item.isEmpty() || !m.find()) {
                return null;
            }
            tables.put(key(m.group(1)), item);
        }

        Map<String, List<String>> joinConditions = new LinkedHashMap<>();
        List<String> remaining = new ArrayList<>();
        for (String condition : splitConditions(where)) {
            Matcher marked = MARKED_COLUMN.matcher(condition);
            Set<String> optional = new LinkedHashSet<>();
            while (marked.find()) {
                optional.add(key(marked.group(1)));
            }
            if (optional.isEmpty()) {
                if (MARKER.matcher(condition).find()) {
                    return null;
                }
                remaining.add(condition);
                continue;
            }
            if (optional.size() > 1 || !tables.containsKey(optional.iterator().next())) {
                return null;
            }
            joinConditions.computeIfAbsent(optional.iterator().next(), k -> new ArrayList<>())
                    .add(MARKER.matcher(condition).replaceAll("").trim());
        }

        List<String> base = new ArrayList<>();
        for (Map.Entry<String, String> table : tables.entrySet()) {
            if (!joinConditions.containsKey(table.getKey())) {
                base.add(table.getValue());
            }
        }
        if (base.isEmpty()) {
            return null;
        }
        StringBuilder joined = new StringBuilder(String.join(" CROSS JOIN ", base));
        Set<String> visible = new LinkedHashSet<>(tables.keySet());
        visible.removeAll(joinConditions.keySet());
        for (Map.Entry<String, String> table : tables.entrySet()) {
            List<String> conditions = joinConditions.get(table.getKey());
            if (conditions == null) {
                continue;
            }
            visible.add(table.getKey());
            for (String condition : conditions) {
                Matcher ref = COLUMN_REF.matcher(condition);
                while (ref.find()) {
                    String alias = key(ref.group(1));
                    if (tables.containsKey(alias) && !visible.contains(alias)) {
                        // ON 条件引用了尚未连接的表
                        return null;
                    }
                }
            }
            joined.append(" LEFT JOIN ").append(table.getValue()).append(" ON ")
                    .append(String.join(" AND ", conditions));
        }

        StringBuilder sb = new StringBuilder(stmt.length() + 32);
        sb.append(stmt, 0, fromIdx).append("FROM ").append(joined);
        if (!remaining.isEmpty()) {
            sb.append(" WHERE ").append(String.join(" AND ", remaining));
        }
        int trailing = where.length();
        while (trailing > 0 && Character.isWhitespace(where.charAt(trailing - 1))) {
            trailing--;
        }
        String tail = where.substring(trailing) + stmt.substring(whereEnd);
        if (!tail.isEmpty() && !Character.isWhitespace(tail.charAt(0))) {
            sb.append(' ');
        }
        return sb.append(tail).toString();
    }

    private static List<String> splitConditions(String where) {
        List<String> parts = new ArrayList<>();
        Matcher m = TOP_LEVEL_AND.matcher(where);
        int start = 0;
        while (m.find()) {
            if (SqlTextUtils.depthAt(where, 0, m.start()) != 0 || isBetweenAnd(where, start, m.start())) {
                continue;
            }
            parts.add(where.substring(start, m.start()).trim());
            start = m.end();
        }
        parts.add(where.substring(start).trim());
        return parts;
    }

    /**
     * BETWEEN x AND y 中的 AND 不是条件分隔符
     */
    private static boolean isBetweenAnd(String where, int start, int andIdx) {
        return OPEN_BETWEEN.matcher(where.substring(start, andIdx)).find();
    }

    private static String key(String name) {
        return name.startsWith("\"") ? name : name.toUpperCase(Locale.ROOT);
    }
}
