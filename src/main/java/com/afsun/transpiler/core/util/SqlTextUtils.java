package com.afsun.transpiler.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 屏蔽后SQL文本的括号、参数、语句边界等基础操作。
 * 入参均应为 {@link MaskedSql#getText()} 的结果，不再考虑字符串和注释。
 *
 * @author afsun
 */
public final class SqlTextUtils {

    private static final int SHORT_SQL_LENGTH = 200;

    private SqlTextUtils() {
    }

    /**
     * 返回与 openIdx 处左括号匹配的右括号下标，找不到返回 -1
     */
    public static int findMatchingParen(String s, int openIdx) {
        int depth = 0;
        for (int i = openIdx; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * 按顶层分隔符切分，不去除各段空白
     */
    public static List<String> splitTopLevel(String s, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }

    public static List<String> splitArguments(String argumentText) {
        if (argumentText.trim().isEmpty()) {
            return new ArrayList<>();
        }
        return splitTopLevel(argumentText, ',');
    }

    public static List<String> trimAll(List<String> parts) {
        List<String> trimmed = new ArrayList<>(parts.size());
        for (String p : parts) {
            trimmed.add(p.trim());
        }
        return trimmed;
    }

    /**
     * 从 from 开始查找顶层分号，返回其下标；没有则返回文本长度
     */
    public static int statementEnd(String s, int from) {
        int depth = 0;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == ';' && depth == 0) {
                return i;
            }
        }
        return s.length();
    }

    /**
     * 对每条语句（不含分号）应用改写函数，保留分号和语句间的空白。
     * 改写函数返回 null 时删除该语句及其分号。
     */
    public static String mapStatements(String s, UnaryOperator<String> fn) {
        StringBuilder sb = new StringBuilder(s.length());
        int pos = 0;
        while (pos <= s.length()) {
            int end = statementEnd(s, pos);
            String stmt = s.substring(pos, end);
            String mapped = stmt.trim().isEmpty() ? stmt : fn.apply(stmt);
            if (mapped != null) {
                sb.append(mapped);
                if (end < s.length()) {
                    sb.append(';');
                }
            }
            pos = end + 1;
        }
        return sb.toString();
    }

    public static int countStatements(String s) {
        int count = 0;
        int pos = 0;
        while (pos <= s.length()) {
            int end = statementEnd(s, pos);
            if (!s.substring(pos, end).trim().isEmpty()) {
                count++;
            }
            pos = end + 1;
        }
        return count;
    }

    /**
     * 在括号深度为 0 处查找关键字（整词、忽略大小写），返回起始下标或 -1
     */
    public static int findTopLevelKeyword(String s, String keyword, int from) {
        Pattern p = Pattern.compile("(?i)\\b" + keyword.replace(" ", "\\s+") + "\\b");
        Matcher m = p.matcher(s);
        int searchFrom = from;
        while (searchFrom <= s.length() && m.find(searchFrom)) {
            if (depthAt(s, from, m.start()) == 0) {
                return m.start();
            }
            searchFrom = m.end();
        }
        return -1;
    }

    /**
     * from 到 index 之间未闭合的左括号数量
     */
    public static int depthAt(String s, int from, int index) {
        int depth = 0;
        for (int i = from; i < index && i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            }
        }
        return depth;
    }

    public static String firstKeyword(String stmt) {
        Matcher m = Pattern.compile("[A-Za-z_]+").matcher(stmt);
        return m.find() ? m.group().toUpperCase(Locale.ROOT) : "";
    }

    public static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    /**
     * 截取SQL前若干字符用于日志和告警
     */
    public static String shortSql(String sql) {
        if (sql == null) {
            return null;
        }
        String oneLine = sql.trim().replaceAll("\\s+", " ");
        return oneLine.length() > SHORT_SQL_LENGTH ? oneLine.substring(0, SHORT_SQL_LENGTH) + "..." : oneLine;
    }

    /**
     * 去掉 schema 或表别名前缀，如 e.emp_id -> emp_id
     */
    public static String unqualify(String column) {
        String c = column.trim();
        int dot = c.lastIndexOf('.');
        return dot >= 0 ? c.substring(dot + 1) : c;
    }

    /**
     * 下标在文本中的 "line x, column y" 位置描述
     */
    public static String lineColumn(String s, int index) {
        int line = 1;
        int col = 1;
        for (int i = 0; i < index && i < s.length(); i++) {
            if (s.charAt(i) == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
        }
        return "line " + line + ", column " + col;
    }
}
