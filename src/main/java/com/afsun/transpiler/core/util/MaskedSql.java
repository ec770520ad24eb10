package com.afsun.transpiler.core.util;

import com.afsun.transpiler.core.Dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 屏蔽了字符串字面量和注释的SQL文本。
 * <p>
 * 字符串字面量替换为 {@code '\u0001N\u0001'}（保留外层引号，正则仍把它当作一个字符串），
 * 注释替换为 {@code \u0002N\u0002}。转换器只在屏蔽后的文本上做匹配，
 * 结束后调用 {@link #restore(String)} 还原。
 *
 * @author afsun
 */
public final class MaskedSql {

    private static final char LITERAL_MARK = '\u0001';

    private static final char COMMENT_MARK = '\u0002';

    private static final Pattern PLACEHOLDER = Pattern.compile("'\\u0001(\\d+)\\u0001'|\\u0002(\\d+)\\u0002");

    private static final Pattern LITERAL_PLACEHOLDER = Pattern.compile("'\\u0001(\\d+)\\u0001'");

    private final String text;

    private final List<String> segments;

    private final Dialect sourceDialect;

    private MaskedSql(String text, List<String> segments, Dialect sourceDialect) {
        this.text = text;
        this.segments = segments;
        this.sourceDialect = sourceDialect;
    }

    public static MaskedSql mask(String sql, Dialect sourceDialect) {
        return mask(sql, sourceDialect, true);
    }

    /**
     * @param maskComments 为 false 时只屏蔽字符串字面量
     */
    public static MaskedSql mask(String sql, Dialect sourceDialect, boolean maskComments) {
        if (sql == null) {
            return new MaskedSql(null, new ArrayList<>(), sourceDialect);
        }
        boolean backslashEscapes = sourceDialect == Dialect.MYSQL;
        boolean hashComments = sourceDialect == Dialect.MYSQL;
        List<String> segments = new ArrayList<>();
        StringBuilder out = new StringBuilder(sql.length());
        int len = sql.length();
        int i = 0;
        while (i < len) {
            char c = sql.charAt(i);
            // Oracle q'[...]' 字面量
            if ((c == 'q' || c == 'Q') && i + 2 < len && sql.charAt(i + 1) == '\''
                    && (i == 0 || !Character.isLetterOrDigit(sql.charAt(i - 1)))) {
                int end = endOfQuoteLiteral(sql, i + 2);
                if (end > 0) {
                    out.append(literalPlaceholder(segments, sql.substring(i, end)));
                    i = end;
                    continue;
                }
            }
            if (c == '\'') {
                int end = endOfQuoted(sql, i, '\'', backslashEscapes);
                out.append(literalPlaceholder(segments, sql.substring(i, end)));
                i = end;
                continue;
            }
            if (c == '$') {
                int end = endOfDollarQuoted(sql, i);
                if (end > 0) {
                    out.append(literalPlaceholder(segments, sql.substring(i, end)));
                    i = end;
                    continue;
                }
            }
            if (c == '"' || c == '`') {
                // 引用标识符原样保留，但跳过其内容避免误判注释
                int end = endOfQuoted(sql, i, c, false);
                out.append(sql, i, end);
                i = end;
                continue;
            }
            if (maskComments && c == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                int end = close < 0 ? len : close + 2;
                out.append(commentPlaceholder(segments, sql.substring(i, end)));
                i = end;
                continue;
            }
            if (maskComments && ((c == '-' && i + 1 < len && sql.charAt(i + 1) == '-') || (hashComments && c == '#'))) {
                int end = i;
                while (end < len && sql.charAt(end) != '\n' && sql.charAt(end) != '\r') {
                    end++;
                }
                out.append(commentPlaceholder(segments, sql.substring(i, end)));
                i = end;
                continue;
            }
            out.append(c);
            i++;
        }
        return new MaskedSql(out.toString(), segments, sourceDialect);
    }

    /**
     * 文本是否以未闭合的字符串字面量结尾
     */
    public static boolean hasUnclosedLiteral(String sql, Dialect sourceDialect) {
        MaskedSql masked = mask(sql, sourceDialect, true);
        if (masked.segments.isEmpty()) {
            return false;
        }
        int last = masked.segments.size() - 1;
        String literal = masked.segments.get(last);
        if (literal.charAt(0) != '\'' || !masked.text.endsWith("'" + LITERAL_MARK + last + LITERAL_MARK + "'")) {
            return false;
        }
        // 补一个字符后仍扫描到末尾，说明没有找到闭合引号
        return endOfQuoted(literal + " ", 0, '\'', sourceDialect == Dialect.MYSQL) > literal.length();
    }

    /**
     * 把 Oracle q'[...]' 字面量改写为普通的 '...' 字面量，其余文本不变
     */
    public static String standardizeQuoteLiterals(String sql) {
        if (sql == null) {
            return null;
        }
        MaskedSql masked = mask(sql, Dialect.ORACLE);
        boolean changed = false;
        for (int i = 0; i < masked.segments.size(); i++) {
            String segment = masked.segments.get(i);
            if (LiteralEncoder.isQuoteLiteral(segment)) {
                masked.segments.set(i, LiteralEncoder.toStandard(segment));
                changed = true;
            }
        }
        return changed ? masked.restore(masked.text) : sql;
    }

    private static String literalPlaceholder(List<String> segments, String literal) {
        segments.add(literal);
        return "'" + LITERAL_MARK + (segments.size() - 1) + LITERAL_MARK + "'";
    }

    private static String commentPlaceholder(List<String> segments, String comment) {
        segments.add(comment);
        return "" + COMMENT_MARK + (segments.size() - 1) + COMMENT_MARK;
    }

    /**
     * 返回引用串结束位置（不含），未闭合时返回文本长度
     */
    static int endOfQuoted(String sql, int start, char quote, boolean backslashEscapes) {
        int len = sql.length();
        int i = start + 1;
        while (i < len) {
            char ch = sql.charAt(i);
            if (backslashEscapes && ch == '\\' && i + 1 < len) {
                i += 2;
                continue;
            }
            if (ch == quote) {
                if (i + 1 < len && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return len;
    }

    private static int endOfQuoteLiteral(String sql, int delimiterIndex) {
        char open = sql.charAt(delimiterIndex);
        char close;
        switch (open) {
            case '[':
                close = ']';
                break;
            case '{':
                close = '}';
                break;
            case '(':
                close = ')';
                break;
            case '<':
                close = '>';
                break;
            default:
                if (Character.isWhitespace(open)) {
                    return -1;
                }
                close = open;
        }
        int idx = sql.indexOf(close + "'", delimiterIndex + 1);
        return idx < 0 ? -1 : idx + 2;
    }

    private static int endOfDollarQuoted(String sql, int start) {
        int len = sql.length();
        int j = start + 1;
        while (j < len && (Character.isLetterOrDigit(sql.charAt(j)) || sql.charAt(j) == '_')) {
            j++;
        }
        if (j >= len || sql.charAt(j) != '$') {
            return -1;
        }
        // $1 之类的位置参数不是 dollar quote
        if (j > start + 1 && Character.isDigit(sql.charAt(start + 1))) {
            return -1;
        }
        String tag = sql.substring(start, j + 1);
        int close = sql.indexOf(tag, j + 1);
        return close < 0 ? -1 : close + tag.length();
    }

    public String getText() {
        return text;
    }

    /**
     * 把占位符还原为原始字面量和注释
     */
    public String restore(String masked) {
        if (masked == null || segments.isEmpty()) {
            return masked;
        }
        Matcher m = PLACEHOLDER.matcher(masked);
        StringBuffer sb = new StringBuffer(masked.length() + 64);
        while (m.find()) {
            String idx = m.group(1) != null ? m.group(1) : m.group(2);
            m.appendReplacement(sb, Matcher.quoteReplacement(segments.get(Integer.parseInt(idx))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * 还原占位符，字符串字面量按目标方言的转义规则重写
     *
     * @see LiteralEncoder#encode(String, Dialect, Dialect)
     */
    public String restore(String masked, Dialect targetDialect) {
        if (masked == null || segments.isEmpty()) {
            return masked;
        }
        Matcher m = PLACEHOLDER.matcher(masked);
        StringBuffer sb = new StringBuffer(masked.length() + 64);
        while (m.find()) {
            String segment;
            if (m.group(1) != null) {
                segment = LiteralEncoder.encode(segments.get(Integer.parseInt(m.group(1))), sourceDialect, targetDialect);
            } else {
                segment = segments.get(Integer.parseInt(m.group(2)));
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(segment));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * 屏蔽文本中无法按目标方言无损转写的字面量原文
     */
    public List<String> unportableLiterals(String masked, Dialect targetDialect) {
        List<String> result = new ArrayList<>();
        if (masked == null || targetDialect == sourceDialect) {
            return result;
        }
        Matcher m = LITERAL_PLACEHOLDER.matcher(masked);
        while (m.find()) {
            String literal = segments.get(Integer.parseInt(m.group(1)));
            if (LiteralEncoder.hasUnportableEscape(literal, sourceDialect)) {
                result.add(literal);
            }
        }
        return result;
    }

    public static boolean isLiteralPlaceholder(String token) {
        return token != null && LITERAL_PLACEHOLDER.matcher(token.trim()).matches();
    }

    /**
     * 返回字面量占位符对应的原文（含引号），非占位符时原样返回
     */
    public String literalText(String token) {
        if (token == null) {
            return null;
        }
        Matcher m = LITERAL_PLACEHOLDER.matcher(token.trim());
        if (!m.matches()) {
            return token;
        }
        return segments.get(Integer.parseInt(m.group(1)));
    }

    /**
     * 返回字面量占位符对应的字符串值（去掉引号并还原 '' 转义），非普通字面量时返回 null
     */
    public String literalValue(String token) {
        String literal = literalText(token);
        if (literal == null || literal.length() < 2 || literal.charAt(0) != '\''
                || literal.charAt(literal.length() - 1) != '\'') {
            return null;
        }
        return literal.substring(1, literal.length() - 1).replace("''", "'");
    }

    /**
     * 登记一个新的字符串字面量，返回可放入屏蔽文本的占位符
     */
    public String addLiteral(String value) {
        return literalPlaceholder(segments, "'" + value.replace("'", "''") + "'");
    }

    /**
     * 登记一段新注释（须为完整的 /* *\/ 或 -- 注释），返回可放入屏蔽文本的占位符
     */
    public String addComment(String comment) {
        return commentPlaceholder(segments, comment);
    }
}
