package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 屏蔽文本上拆解出的 MERGE 语句结构，无法识别时 {@link #parse(String)} 返回 null
 *
 * @author afsun
 */
@Data
class MergeStatement {

    private static final Pattern HEAD = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "MERGE\\s+INTO\\s+(" + SqlPatterns.QUALIFIED_IDENT + ")"
                    + "(?:\\s+(?:AS\\s+)?(?!USING\\b)(" + SqlPatterns.IDENT + "))?\\s+USING\\s+");

    private static final Pattern SOURCE_TABLE = Pattern.compile("(?is)\\G(" + SqlPatterns.QUALIFIED_IDENT + ")");

    private static final Pattern ALIAS = Pattern.compile(
            "(?is)\\G\\s*(?:AS\\s+)?(?!ON\\b)(" + SqlPatterns.IDENT + ")");

    private static final Pattern ON = Pattern.compile("(?is)\\G\\s*ON\\b");

    private static final Pattern WHEN = Pattern.compile("(?i)\\bWHEN\\s+(NOT\\s+)?MATCHED\\b");

    private static final Pattern UPDATE_SET = Pattern.compile("(?is)^\\s*UPDATE\\s+SET\\s+");

    private static final Pattern DELETE = Pattern.compile("(?is)^\\s*DELETE\\s*$");

    private static final Pattern DO_NOTHING = Pattern.compile("(?is)^\\s*DO\\s+NOTHING\\s*$");

    private static final Pattern INSERT = Pattern.compile("(?is)^\\s*INSERT\\s*(\\()?");

    private static final Pattern VALUES = Pattern.compile("(?is)\\G\\s*VALUES\\s*\\(");

    private static final Pattern BY_TARGET = Pattern.compile("(?is)^\\s*BY\\s+(TARGET|SOURCE)\\b");

    private String target;

    private String targetAlias;

    /**
     * 表名或带括号的子查询
     */
    private String source;

    private String sourceAlias;

    private boolean sourceQuery;

    /**
     * 去掉外层括号的连接条件
     */
    private String on;

    private final List<Branch> branches = new ArrayList<>();

    public enum Action {
        UPDATE,
        DELETE,
        INSERT,
        NOTHING
    }

    @Data
    static class Branch {
        private boolean matched;
        /**
         * WHEN [NOT] MATCHED AND ... 中的附加条件
         */
        private String condition;
        private Action action;
        private String setClause;
        private String where;
        /**
         * Oracle UPDATE 分支后的 DELETE WHERE
         */
        private String deleteWhere;
        private List<String> insertColumns = new ArrayList<>();
        private List<String> insertValues = new ArrayList<>();
        private boolean notMatchedBySource;
    }

    static MergeStatement parse(String stmt) {
        Matcher head = HEAD.matcher(stmt);
        if (!head.find()) {
            return null;
        }
        MergeStatement merge = new MergeStatement();
        merge.target = head.group(1);
        merge.targetAlias = head.group(2);
        int pos = head.end();
        if (pos < stmt.length() && stmt.charAt(pos) == '(') {
            int close = SqlTextUtils.findMatchingParen(stmt, pos);
            if (close < 0) {
                return null;
            }
            merge.source = stmt.substring(pos, close + 1);
            merge.sourceQuery = true;
            pos = close + 1;
        } else {
            Matcher table = SOURCE_TABLE.matcher(stmt);
            if (!table.find(pos)) {
                return null;
            }
            merge.source = table.group(1);
            pos = table.end();
        }
        Matcher alias = ALIAS.matcher(stmt);
        if (alias.find(pos)) {
            merge.sourceAlias = alias.group(1);
            pos = alias.end();
        }
        Matcher on = ON.matcher(stmt);
        if (!on.find(pos)) {
            return null;
        }
        pos = on.end();

        List<int[]> whens = new ArrayList<>();
        Matcher when = WHEN.matcher(stmt);
        int search = pos;
        while (when.find(search)) {
            if (SqlTextUtils.depthAt(stmt, pos, when.start()) == 0) {
                whens.add(new int[]{when.start(), when.end(), when.group(1) == null ? 1 : 0});
            }
            search = when.end();
        }
        if (whens.isEmpty()) {
            return null;
        }
        merge.on = stripOuterParens(stmt.substring(pos, whens.get(0)[0]).trim());
        for (int i = 0; i < whens.size(); i++) {
            int[] w = whens.get(i);
            int end = i + 1 < whens.size() ? whens.get(i + 1)[0] : stmt.length();
            Branch branch = parseBranch(stmt.substring(w[1], end), w[2] == 1);
            if (branch == null) {
                return null;
            }
            merge.branches.add(branch);
        }
        return merge;
    }

    private static Branch parseBranch(String text, boolean matched) {
        Branch branch = new Branch();
        branch.matched = matched;
        String rest = text;
        Matcher by = BY_TARGET.matcher(rest);
        if (by.find()) {
            branch.notMatchedBySource = "SOURCE".equalsIgnoreCase(by.group(1));
            rest = rest.substring(by.end());
        }
        int then = SqlTextUtils.findTopLevelKeyword(rest, "THEN", 0);
        if (then < 0) {
            return null;
        }
        String condition = rest.substring(0, then).trim();
        if (condition.regionMatches(true, 0, "AND", 0, 3)) {
            branch.condition = condition.substring(3).trim();
        } else if (!condition.isEmpty()) {
            return null;
        }
        String action = rest.substring(then + 4);
        Matcher update = UPDATE_SET.matcher(action);
        if (update.find()) {
            branch.action = Action.UPDATE;
            String set = action.substring(update.end());
            int delete = SqlTextUtils.findTopLevelKeyword(set, "DELETE WHERE", 0);
            if (delete >= 0) {
                branch.deleteWhere = set.substring(delete).replaceFirst("(?is)^DELETE\\s+WHERE\\s+", "").trim();
                set = set.substring(0, delete);
            }
            int where = SqlTextUtils.findTopLevelKeyword(set, "WHERE", 0);
            if (where >= 0) {
                branch.where = set.substring(where + 5).trim();
                set = set.substring(0, where);
            }
            branch.setClause = set.trim();
            return branch;
        }
        if (DELETE.matcher(action).find()) {
            branch.action = Action.DELETE;
            return branch;
        }
        if (DO_NOTHING.matcher(action).find()) {
            branch.action = Action.NOTHING;
            return branch;
        }
        Matcher insert = INSERT.matcher(action);
        if (insert.find()) {
            branch.action = Action.INSERT;
            int pos = insert.end();
            if (insert.group(1) != null) {
                int close = SqlTextUtils.findMatchingParen(action, pos - 1);
                if (close < 0) {
                    return null;
                }
                branch.insertColumns.addAll(SqlTextUtils.trimAll(SqlTextUtils.splitArguments(action.substring(pos, close))));
                pos = close + 1;
            }
            Matcher values = VALUES.matcher(action);
            if (!values.find(pos)) {
                return null;
            }
            int close = SqlTextUtils.findMatchingParen(action, values.end() - 1);
            if (close < 0) {
                return null;
            }
            branch.insertValues.addAll(SqlTextUtils.trimAll(SqlTextUtils.splitArguments(action.substring(values.end(), close))));
            String tail = action.substring(close + 1).trim();
            if (tail.regionMatches(true, 0, "WHERE", 0, 5)) {
                branch.where = tail.substring(5).trim();
            } else if (!tail.isEmpty()) {
                return null;
            }
            return branch;
        }
        return null;
    }

    static String stripOuterParens(String s) {
        String t = s.trim();
        while (t.startsWith("(") && SqlTextUtils.findMatchingParen(t, 0) == t.length() - 1) {
            t = t.substring(1, t.length() - 1).trim();
        }
        return t;
    }

    /**
     * 源别名，没有别名时取源表名，子查询没有别名时为 src
     */
    String sourceName() {
        if (sourceAlias != null) {
            return sourceAlias;
        }
        return sourceQuery ? "src" : SqlTextUtils.unqualify(source);
    }

    String targetName() {
        return targetAlias != null ? targetAlias : SqlTextUtils.unqualify(target);
    }

    Branch branch(Action action) {
        for (Branch b : branches) {
            if (b.action == action) {
                return b;
            }
        }
        return null;
    }

    boolean hasDelete() {
        for (Branch b : branches) {
            if (b.action == Action.DELETE || b.deleteWhere != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * 源端引用，子查询没有别名时补 src
     */
    String sourceReference() {
        if (sourceQuery) {
            return source + " " + sourceName();
        }
        return sourceAlias == null ? source : source + " " + sourceAlias;
    }
}
