package com.afsun.transpiler.core.recovery.strategy;

import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.afsun.transpiler.core.recovery.AbstractRecoveryStrategy;
import com.afsun.transpiler.core.recovery.RecoveryAttempt;
import com.afsun.transpiler.core.util.MaskedSql;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 修复未闭合的字符串字面量。
 * <p>
 * 非 MySQL 源中出现的 \' 先改为标准的 ''；仍未闭合时在末尾（分号之前）补一个单引号。
 *
 * @author afsun
 */
@Component
public class StringEscapeStrategy extends AbstractRecoveryStrategy {

    public StringEscapeStrategy() {
        super("string-escape repair", 0.70);
    }

    @Override
    public boolean canHandle(String sql, SqlParseException error) {
        String message = error == null || error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("unclosed") || message.contains("unterminated")
                || MaskedSql.hasUnclosedLiteral(sql, null) || MaskedSql.hasUnclosedLiteral(sql, Dialect.MYSQL);
    }

    @Override
    public RecoveryAttempt recover(String sql, SqlParseException error, Dialect dialect) {
        if (!MaskedSql.hasUnclosedLiteral(sql, dialect)) {
            return RecoveryAttempt.failure(sql, name());
        }
        String text = sql;
        String note = "字符串未闭合，已在末尾补齐单引号";
        if (dialect != Dialect.MYSQL && text.contains("\\'")) {
            text = text.replace("\\'", "''");
            note = "字符串中的 \\' 已改为标准转义 ''";
        }
        if (MaskedSql.hasUnclosedLiteral(text, dialect)) {
            text = closeLiteral(text);
        }
        return attempt(sql, text, ConversionWarning.of(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.WARNING,
                note, "请核对字符串内容是否符合预期"));
    }

    /**
     * 在末尾的分号和空白之前补一个单引号
     */
    private static String closeLiteral(String sql) {
        int end = sql.length();
        while (end > 0 && (Character.isWhitespace(sql.charAt(end - 1)) || sql.charAt(end - 1) == ';')) {
            end--;
        }
        return sql.substring(0, end) + "'" + sql.substring(end);
    }
}
