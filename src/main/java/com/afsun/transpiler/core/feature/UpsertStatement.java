package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * INSERT 类语句中与冲突处理相关的部分：ON DUPLICATE KEY UPDATE、ON CONFLICT、INSERT IGNORE、REPLACE INTO。
 * 记录各子句在原语句中的位置，便于只改动需要改的部分。
 *
 * @author afsun
 */
@Data
class UpsertStatement {

    private static final Pattern HEAD = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "(INSERT|REPLACE)\\s+(?:(IGNORE)\\s+)?(?:INTO\\s+)?(" + SqlPatterns.QUALIFIED_IDENT + ")"
                    + "(?:\\s+AS\\s+(" + SqlPatterns.IDENT + "))?\\s*");

    private static final Pattern QUERY_START = Pattern.compile("(?is)^\\s*(?:SELECT|WITH)\\b");

    private static final Pattern VALUES = Pattern.compile("(?is)^VALUES\\s*");

    private static final Pattern ROW_ALIAS = Pattern.compile("(?is)\\G\\s*AS\\s+(" + SqlPatterns.IDENT + ")(?:\\s*\\([^()]*\\))?\\s*$");

    private static final Pattern CONFLICT_TARGET = Pattern.compile("(?is)^\\s*ON\\s+CONSTRAINT\\s+(" + SqlPatterns.IDENT + ")");

    private static final Pattern DO_NOTHING = Pattern.compile("(?is)^\\s*DO\\s+NOTHING\\s*$");

    private static final Pattern DO_UPDATE = Pattern.compile("(?is)^\\s*DO\\s+UPDATE\\s+SET\\s+");

    public enum Kind {
        PLAIN,
        DUPLICATE_KEY,
        CONFLICT
    }

    private String statement;

    private boolean replace;

    private boolean ignore;

    /**
     * INSERT / REPLACE 关键字起止位置
     */
    private int verbStart;

    private int headEnd;

    private String table;

    private String tableAlias;

    private final List<String> columns = new ArrayList<>();

    private String body;

    private final List<List<String>> rows = new ArrayList<>();

    /**
     * MySQL 8 的 VALUES (...) AS new
     */
    private String rowAlias;

    private Kind kind = Kind.PLAIN;

    /**
     * 冲突子句起始位置（ON 之前的空白也算在内）
     */
    private int clauseStart;

    private int clauseEnd;

    private String assignments;

    private final List<String> conflictColumns = new ArrayList<>();

    private String conflictConstraint;

    private boolean doNothing;

    private String updateWhere;

    private String returning;

    static UpsertStatement parse(String stmt) {
        Matcher head = HEAD.matcher(stmt);
        if (!head.find()) {
            return null;
        }
        UpsertStatement u = new UpsertStatement();
        u.statement = stmt;
        u.replace = "REPLACE".equalsIgnoreCase(head.group(1));
        u.ignore = head.group(2) != null;
        u.verbStart = head.start(1);
        u.table = head.group(3);
        u.tableAlias = head.group(4);
        u.headEnd = head.end(u.tableAlias != null ? 4 : 3);
        int pos = head.end();
        if (pos < stmt.length() && stmt.charAt(pos) == '(') {
            int close = SqlTextUtils.findMatchingParen(stmt, pos);
            if (close < 0) {
                return null;
            }
            String inner = stmt.substring(pos + 1, close);
            if (!QUERY_START.matcher(inner).find()) {
                u.columns.addAll(SqlTextUtils.trimAll(SqlTextUtils.splitArguments(inner)));
                pos = close + 1;
            }
        }

        int returning = SqlTextUtils.findTopLevelKeyword(stmt, "RETURNING", pos);
        int end = returning >= 0 ? returning : stmt.length();
        if (returning >= 0) {
            u.returning = stmt.substring(returning + "RETURNING".length()).trim();
        }
        int duplicate = SqlTextUtils.findTopLevelKeyword(stmt, "ON DUPLICATE KEY UPDATE", pos);
        int conflict = SqlTextUtils.findTopLevelKeyword(stmt, "ON CONFLICT", pos);
        int clause = duplicate >= 0 ? duplicate : conflict;
        if (clause >= 0 && clause < end) {
            u.kind = duplicate >= 0 ? Kind.DUPLICATE_KEY : Kind.CONFLICT;
            u.clauseStart = clause;
            while (u.clauseStart > pos && Character.isWhitespace(stmt.charAt(u.clauseStart - 1))) {
                u.clauseStart--;
            }
            u.clauseEnd = end;
            if (u.kind == Kind.DUPLICATE_KEY) {
                u.assignments = stmt.substring(clause, end).replaceFirst("(?is)^ON\\s+DUPLICATE\\s+KEY\\s+UPDATE\\s+", "").trim();
            } else if (!parseConflict(u, stmt.substring(clause, end).replaceFirst("(?is)^ON\\s+CONFLICT", ""))) {
                return null;
            }
        } else {
            u.clauseStart = end;
            while (u.clauseStart > pos && Character.isWhitespace(stmt.charAt(u.clauseStart - 1))) {
                u.clauseStart--;
            }
            u.clauseEnd = end;
        }
        u.body = stmt.substring(pos, u.clauseStart).trim();
        parseRows(u);
        return u;
    }

    private static boolean parseConflict(UpsertStatement u, String clause) {
        String rest = clause;
        Matcher constraint = CONFLICT_TARGET.matcher(rest);
        if (constraint.find()) {
            u.conflictConstraint = constraint.group(1);
            rest = rest.substring(constraint.end());
        } else if (rest.trim().startsWith("(")) {
            int open = rest.indexOf('(');
            int close = SqlTextUtils.findMatchingParen(rest, open);
            if (close < 0) {
                return false;
            }
            u.conflictColumns.addAll(SqlTextUtils.trimAll(SqlTextUtils.splitArguments(rest.substring(open + 1, close))));
            rest = rest.substring(close + 1);
            int doAt = SqlTextUtils.findTopLevelKeyword(rest, "DO", 0);
            if (doAt < 0) {
                return false;
            }
            // ON CONFLICT (c) WHERE ... 的部分索引谓词
            rest = rest.substring(doAt);
        }
        if (DO_NOTHING.matcher(rest).find()) {
            u.doNothing = true;
            return true;
        }
        Matcher update = DO_UPDATE.matcher(rest);
        if (!update.find()) {
            return false;
        }
        String set = rest.substring(update.end());
        int where = SqlTextUtils.findTopLevelKeyword(set, "WHERE", 0);
        if (where >= 0) {
            u.updateWhere = set.substring(where + 5).trim();
            set = set.substring(0, where);
        }
        u.assignments = set.trim();
        return true;
    }

    private static void parseRows(UpsertStatement u) {
        Matcher values = VALUES.matcher(u.body);
        if (!values.find()) {
            return;
        }
        String text = u.body;
        int pos = values.end();
        while (pos < text.length() && text.charAt(pos) == '(') {
            int close = SqlTextUtils.findMatchingParen(text, pos);
            if (close < 0) {
                u.rows.clear();
                return;
            }
            u.rows.add(SqlTextUtils.trimAll(SqlTextUtils.splitArguments(text.substring(pos + 1, close))));
            pos = close + 1;
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
            if (pos < text.length() && text.charAt(pos) == ',') {
                pos++;
                while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                    pos++;
                }
            }
        }
        if (pos < text.length()) {
            Matcher alias = ROW_ALIAS.matcher(text);
            if (alias.find(pos)) {
                u.rowAlias = alias.group(1);
            } else {
                u.rows.clear();
            }
        }
    }

    boolean isValues() {
        return !rows.isEmpty();
    }

    boolean isUpsert() {
        return kind != Kind.PLAIN || ignore || replace;
    }

    /**
     * 去掉行别名后的 VALUES 部分
     */
    String valuesWithoutAlias() {
        if (rowAlias == null) {
            return body;
        }
        return body.replaceFirst("(?is)\\s*AS\\s+" + Pattern.quote(rowAlias) + "(?:\\s*\\([^()]*\\))?\\s*$", "");
    }
}
