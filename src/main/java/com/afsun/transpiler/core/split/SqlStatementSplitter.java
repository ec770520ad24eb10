package com.afsun.transpiler.core.split;

import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.util.MaskedSql;
import com.afsun.transpiler.core.util.SqlPatterns;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把SQL脚本拆成单条语句。
 * <p>
 * 分号只在字符串、引用标识符和注释之外生效。Oracle 的过程体（CREATE PROCEDURE/FUNCTION/PACKAGE/TRIGGER/TYPE BODY、
 * DECLARE/BEGIN 匿名块）整体保留到单独一行的 "/" 为止；没有 "/" 时，Oracle 下视为延续到脚本末尾，其他方言按分号拆分。
 * 返回的每条语句保留原文及其结束符。
 *
 * @author afsun
 */
public final class SqlStatementSplitter {

    private static final Pattern SLASH_LINE = Pattern.compile("(?m)^[ \\t]*/[ \\t]*$");

    private SqlStatementSplitter() {
    }

    public static List<String> split(String sql, Dialect dialect) {
        List<String> statements = new ArrayList<>();
        if (sql == null || sql.trim().isEmpty()) {
            return statements;
        }
        MaskedSql masked = MaskedSql.mask(sql, dialect);
        String text = masked.getText();
        int pos = 0;
        while (pos < text.length()) {
            int end = procedureEnd(text, pos, dialect);
            if (end < 0) {
                int semicolon = text.indexOf(';', pos);
                end = semicolon < 0 ? text.length() : semicolon + 1;
            }
            String statement = masked.restore(text.substring(pos, end)).trim();
            if (!statement.isEmpty() && !";".equals(statement)) {
                statements.add(statement);
            }
            pos = end;
        }
        return statements;
    }

    /**
     * 从 from 开始是过程体时返回其结束位置（含 "/" 行），否则返回 -1
     */
    private static int procedureEnd(String text, int from, Dialect dialect) {
        Matcher unit = SqlPatterns.PROCEDURAL_UNIT.matcher(text).region(from, text.length());
        if (!unit.lookingAt()) {
            return -1;
        }
        Matcher slash = SLASH_LINE.matcher(text);
        if (slash.find(unit.end())) {
            return slash.end();
        }
        return dialect == Dialect.ORACLE ? text.length() : -1;
    }
}
