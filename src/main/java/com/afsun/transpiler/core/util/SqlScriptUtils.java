package com.afsun.transpiler.core.util;

/**
 * 原始SQL脚本（未屏蔽）的字符级扫描工具
 *
 * @author afsun
 * @date 2025-11-11日 10:42
 */
public class SqlScriptUtils {

    /**
     * 移除SQL中的注释（保留字符串字面量中的内容）
     * 支持：
     * - 单行注释：-- comment，MySQL 下还有 # comment
     * - 多行注释：/* comment *\/
     *
     * @param sql       原始SQL文本
     * @param hashComment 是否把 # 视为注释起始（MySQL）
     * @param keepHints 为 true 时保留 /*+ ... *\/ 优化器提示
     * @return 移除注释后的SQL
     */
    public static String stripComments(String sql, boolean hashComment, boolean keepHints) {
        return strip(sql, hashComment, keepHints, true);
    }

    /**
     * 只移除 /*+ ... *\/ 优化器提示
     */
    public static String stripHints(String sql) {
        return strip(sql, false, false, false);
    }

    private static String strip(String sql, boolean hashComment, boolean keepHints, boolean removeComments) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }
        StringBuilder result = new StringBuilder(sql.length());
        int len = sql.length();
        int i = 0;

        while (i < len) {
            char c = sql.charAt(i);

            // 1. 字符串字面量与引用标识符原样保留
            if (c == '\'' || c == '"' || c == '`') {
                int end = MaskedSql.endOfQuoted(sql, i, c, hashComment && c == '\'');
                result.append(sql, i, end);
                i = end;
                continue;
            }

            // 2. 多行注释 /* ... */，包括提示
            if (c == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
                boolean hint = i + 2 < len && sql.charAt(i + 2) == '+';
                int close = sql.indexOf("*/", i + 2);
                int end = close < 0 ? len : close + 2;
                boolean remove = hint ? !keepHints : removeComments;
                if (remove) {
                    // 用空格替代，避免前后两个词粘连
                    result.append(' ');
                } else {
                    result.append(sql, i, end);
                }
                i = end;
                continue;
            }

            // 3. 单行注释
            if (removeComments && ((c == '-' && i + 1 < len && sql.charAt(i + 1) == '-') || (hashComment && c == '#'))) {
                while (i < len && sql.charAt(i) != '\n' && sql.charAt(i) != '\r') {
                    i++;
                }
                continue;
            }

            result.append(c);
            i++;
        }
        return collapseBlankRuns(result.toString());
    }

    /**
     * 去掉行尾空白、压缩连续空行并首尾去空
     */
    public static String collapseBlankRuns(String sql) {
        if (sql == null) {
            return null;
        }
        String s = sql.replaceAll("[ \\t]+(\\r?\\n)", "$1");
        s = s.replaceAll("(\\r?\\n){3,}", "\n\n");
        return s.trim();
    }

    public static boolean containsComment(String sql, boolean hashComment) {
        return !stripComments(sql, hashComment, true).equals(collapseBlankRuns(sql));
    }

    public static boolean containsHint(String sql) {
        return !stripHints(sql).equals(collapseBlankRuns(sql));
    }
}
