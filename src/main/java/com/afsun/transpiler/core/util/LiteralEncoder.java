package com.afsun.transpiler.core.util;

import com.afsun.transpiler.core.Dialect;

/**
 * 字符串字面量在方言之间的转写
 * <p>
 * MySQL 用反斜杠转义，Oracle 与 PostgreSQL 只认 '' 转义；Oracle 的 q'[...]' 只有 Oracle 认识。
 * 转写后的字面量在目标方言中与原字面量的值相同。
 *
 * @author afsun
 */
public final class LiteralEncoder {

    private LiteralEncoder() {
    }

    /**
     * 把源方言的字面量原文（含引号）改写为目标方言的写法，无需改写时原样返回
     */
    public static String encode(String literal, Dialect source, Dialect target) {
        if (literal == null || source == null || target == null || source == target) {
            return literal;
        }
        String value;
        if (source == Dialect.ORACLE && isQuoteLiteral(literal)) {
            value = quoteLiteralValue(literal);
        } else if (isPlainLiteral(literal)) {
            String body = literal.substring(1, literal.length() - 1);
            value = source == Dialect.MYSQL ? unescapeMySql(body) : body.replace("''", "'");
        } else {
            // $$...$$ 等其它写法不改
            return literal;
        }
        String body = value.replace("'", "''");
        if (target == Dialect.MYSQL) {
            body = body.replace("\\", "\\\\");
        }
        return "'" + body + "'";
    }

    /**
     * MySQL 字面量中是否有 \0、\b、\Z 这类在标准字面量里写不出来的转义
     */
    public static boolean hasUnportableEscape(String literal, Dialect source) {
        if (source != Dialect.MYSQL || !isPlainLiteral(literal)) {
            return false;
        }
        for (int i = 1; i < literal.length() - 2; i++) {
            if (literal.charAt(i) == '\\') {
                char next = literal.charAt(i + 1);
                if (next == '0' || next == 'b' || next == 'Z') {
                    return true;
                }
                i++;
            }
        }
        return false;
    }

    static boolean isQuoteLiteral(String literal) {
        return literal.length() >= 5 && (literal.charAt(0) == 'q' || literal.charAt(0) == 'Q')
                && literal.charAt(1) == '\'' && literal.endsWith("'");
    }

    /**
     * q'[...]' 改为等值的 '...' 写法
     */
    static String toStandard(String quoteLiteral) {
        return "'" + quoteLiteralValue(quoteLiteral).replace("'", "''") + "'";
    }

    private static String quoteLiteralValue(String quoteLiteral) {
        return quoteLiteral.substring(3, quoteLiteral.length() - 2);
    }

    private static boolean isPlainLiteral(String literal) {
        return literal.length() >= 2 && literal.charAt(0) == '\'' && literal.endsWith("'");
    }

    /**
     * 按 MySQL 规则还原反斜杠转义和 '' 转义。\% 与 \_ 保留反斜杠，\0 \b \Z 原样保留
     */
    static String unescapeMySql(String body) {
        StringBuilder sb = new StringBuilder(body.length());
        int len = body.length();
        int i = 0;
        while (i < len) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < len) {
                char next = body.charAt(i + 1);
                switch (next) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case '%':
                    case '_':
                    case '0':
                    case 'b':
                    case 'Z':
                        sb.append(c).append(next);
                        break;
                    default:
                        sb.append(next);
                }
                i += 2;
                continue;
            }
            if (c == '\'' && i + 1 < len && body.charAt(i + 1) == '\'') {
                sb.append('\'');
                i += 2;
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }
}
