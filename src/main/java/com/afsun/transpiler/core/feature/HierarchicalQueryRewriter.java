package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把单表的 START WITH ... CONNECT BY 查询改写为 WITH RECURSIVE。
 * <p>
 * 只处理父子列等值连接的简单层级；SYS_CONNECT_BY_PATH、CONNECT_BY_ROOT、多表连接等情况返回不可改写及原因。
 * 特性转换与解析恢复共用本类，输入为单条语句。
 *
 * @author afsun
 */
@Component
public class HierarchicalQueryRewriter {

    public static final String CTE_NAME = "h_tree";

    public static final String LEVEL_COLUMN = "lvl";

    private static final Pattern CONNECT_BY = Pattern.compile("(?i)\\bCONNECT\\s+BY\\b");

    private static final Pattern SELECT = Pattern.compile("(?is)" + SqlPatterns.LEAD + "(SELECT)\\s+");

    private static final Pattern UNSUPPORTED = Pattern.compile(
            "(?i)\\b(SYS_CONNECT_BY_PATH|CONNECT_BY_ROOT|CONNECT_BY_ISLEAF|CONNECT_BY_ISCYCLE)\\b");

    private static final Pattern SINGLE_TABLE = Pattern.compile(
            "(?is)^\\s*(" + SqlPatterns.QUALIFIED_IDENT + ")(?:\\s+(?:AS\\s+)?(?!(?:WHERE|START|CONNECT|GROUP|ORDER)\\b)("
                    + SqlPatterns.IDENT + "))?\\s*$");

    private static final Pattern PRIOR_LEFT = Pattern.compile(
            "(?is)^\\s*PRIOR\\s+(" + SqlPatterns.QUALIFIED_IDENT + ")\\s*=\\s*(" + SqlPatterns.QUALIFIED_IDENT + ")\\s*$");

    private static final Pattern PRIOR_RIGHT = Pattern.compile(
            "(?is)^\\s*(" + SqlPatterns.QUALIFIED_IDENT + ")\\s*=\\s*PRIOR\\s+(" + SqlPatterns.QUALIFIED_IDENT + ")\\s*$");

    private static final Pattern LEVEL_LIMIT = Pattern.compile("(?is)^\\s*LEVEL\\s*(<=?)\\s*(.+?)\\s*$");

    private static final Pattern NOCYCLE = Pattern.compile("(?is)^\\s*NOCYCLE\\b");

    private static final Pattern LEVEL = Pattern.compile("(?i)(?<![\\w$#.\"`])LEVEL(?![\\w$#\"`])");

    private static final Pattern DUAL = Pattern.compile("(?i)^\\s*DUAL\\s*$");

    private static final String[] CLAUSES = {"FROM", "WHERE", "START WITH", "CONNECT BY", "GROUP BY", "ORDER SIBLINGS BY",
            "ORDER BY"};

    public boolean containsHierarchy(String sql) {
        return sql != null && CONNECT_BY.matcher(sql).find();
    }

    /**
     * @param stmt 单条语句（屏蔽后或不含易混淆字面量的原文）
     */
    public Result rewrite(String stmt) {
        if (!containsHierarchy(stmt)) {
            return Result.unchanged(stmt, "没有 CONNECT BY 子句");
        }
        Matcher unsupported = UNSUPPORTED.matcher(stmt);
        if (unsupported.find()) {
            return Result.unchanged(stmt, unsupported.group(1).toUpperCase(Locale.ROOT) + " 没有直接对应的递归 CTE 写法");
        }
        Matcher select = SELECT.matcher(stmt);
        if (!select.find()) {
            return Result.unchanged(stmt, "CONNECT BY 不在顶层 SELECT 中");
        }
        int start = select.end();
        List<int[]> found = new ArrayList<>();
        for (int i = 0; i < CLAUSES.length; i++) {
            int at = SqlTextUtils.findTopLevelKeyword(stmt, CLAUSES[i], start);
            if (at >= 0) {
                found.add(new int[]{at, i});
            }
        }
        found.sort((a, b) -> Integer.compare(a[0], b[0]));
        String[] parts = new String[CLAUSES.length];
        for (int k = 0; k < found.size(); k++) {
            int at = found.get(k)[0];
            int idx = found.get(k)[1];
            int end = k + 1 < found.size() ? found.get(k + 1)[0] : stmt.length();
            Matcher kw = Pattern.compile("(?i)^" + CLAUSES[idx].replace(" ", "\\s+")).matcher(stmt.substring(at));
            int skip = kw.find() ? kw.end() : 0;
            parts[idx] = stmt.substring(at + skip, end).trim();
        }
        if (parts[0] == null || parts[3] == null) {
            return Result.unchanged(stmt, "无法识别 FROM 或 CONNECT BY 子句");
        }
        String selectList = stmt.substring(start, found.get(0)[0]).trim();
        String lead = stmt.substring(0, select.start(1));

        List<String> notes = new ArrayList<>();
        String connect = parts[3];
        Matcher nocycle = NOCYCLE.matcher(connect);
        if (nocycle.find()) {
            connect = connect.substring(nocycle.end());
            notes.add("NOCYCLE 已去掉，数据存在环时递归不会终止，需要自行加深度或路径限制");
        }

        Matcher levelLimit = LEVEL_LIMIT.matcher(connect);
        if (levelLimit.find() && DUAL.matcher(parts[0]).find()) {
            String bound = levelLimit.group(2);
            String next = "<=".equals(levelLimit.group(1)) ? LEVEL_COLUMN : LEVEL_COLUMN + " + 1";
            String sql = lead + "WITH RECURSIVE " + CTE_NAME + " (" + LEVEL_COLUMN + ") AS (\n"
                    + "  SELECT 1\n"
                    + "  UNION ALL\n"
                    + "  SELECT " + LEVEL_COLUMN + " + 1 FROM " + CTE_NAME + " WHERE " + next + " < " + bound + "\n"
                    + ")\n"
                    + "SELECT " + replaceLevel(selectList) + " FROM " + CTE_NAME + tail(parts, false);
            notes.add("CONNECT BY LEVEL 行生成器已改为递归 CTE");
            return Result.rewritten(sql, notes);
        }

        Matcher table = SINGLE_TABLE.matcher(parts[0]);
        if (!table.find()) {
            return Result.unchanged(stmt, "层级查询的 FROM 包含多表连接或子查询");
        }
        String parentColumn;
        String childColumn;
        Matcher left = PRIOR_LEFT.matcher(connect);
        Matcher right = PRIOR_RIGHT.matcher(connect);
        if (left.find()) {
            parentColumn = SqlTextUtils.unqualify(left.group(1));
            childColumn = SqlTextUtils.unqualify(left.group(2));
        } else if (right.find()) {
            childColumn = SqlTextUtils.unqualify(right.group(1));
            parentColumn = SqlTextUtils.unqualify(right.group(2));
        } else {
            return Result.unchanged(stmt, "CONNECT BY 条件不是单个 PRIOR 等值连接");
        }
        String tableName = table.group(1);
        String alias = table.group(2) != null ? table.group(2) : SqlTextUtils.unqualify(tableName);
        String from = table.group(2) != null ? tableName + " " + alias : tableName;

        StringBuilder sql = new StringBuilder(lead);
        sql.append("WITH RECURSIVE ").append(CTE_NAME).append(" AS (\n");
        sql.append("  SELECT ").append(alias).append(".*, 1 AS ").append(LEVEL_COLUMN).append(" FROM ").append(from);
        if (parts[2] != null) {
            sql.append(" WHERE ").append(parts[2]);
        }
        sql.append("\n  UNION ALL\n");
        sql.append("  SELECT c.*, p.").append(LEVEL_COLUMN).append(" + 1 FROM ").append(tableName).append(" c JOIN ")
                .append(CTE_NAME).append(" p ON c.").append(childColumn).append(" = p.").append(parentColumn).append('\n');
        sql.append(")\n");
        sql.append("SELECT ").append(replaceLevel(selectList)).append(" FROM ").append(CTE_NAME).append(' ').append(alias);
        if (parts[5] != null) {
            notes.add("ORDER SIBLINGS BY 已改为 ORDER BY，结果不再保持树形顺序");
        }
        sql.append(tail(parts, true));
        return Result.rewritten(sql.toString(), notes);
    }

    private static String tail(String[] parts, boolean withWhere) {
        StringBuilder sb = new StringBuilder();
        if (withWhere && parts[1] != null) {
            sb.append(" WHERE ").append(replaceLevel(parts[1]));
        }
        if (parts[4] != null) {
            sb.append(" GROUP BY ").append(replaceLevel(parts[4]));
        }
        String order = parts[5] != null ? parts[5] : parts[6];
        if (order != null) {
            sb.append(" ORDER BY ").append(replaceLevel(order));
        }
        return sb.toString();
    }

    private static String replaceLevel(String text) {
        return LEVEL.matcher(text).replaceAll(LEVEL_COLUMN);
    }

    /**
     * 改写结果
     */
    @Getter
    public static final class Result {

        private final boolean rewritten;

        private final String sql;

        /**
         * 不可改写的原因
         */
        private final String reason;

        private final List<String> notes;

        private Result(boolean rewritten, String sql, String reason, List<String> notes) {
            this.rewritten = rewritten;
            this.sql = sql;
            this.reason = reason;
            this.notes = Collections.unmodifiableList(notes);
        }

        static Result rewritten(String sql, List<String> notes) {
            return new Result(true, sql, null, notes);
        }

        static Result unchanged(String sql, String reason) {
            return new Result(false, sql, reason, new ArrayList<>());
        }
    }
}
