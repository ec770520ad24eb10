package com.afsun.transpiler.core.recovery.strategy;

import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.afsun.transpiler.core.recovery.AbstractRecoveryStrategy;
import com.afsun.transpiler.core.recovery.RecoveryAttempt;
import com.afsun.transpiler.core.util.MaskedSql;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 给用作列名的保留字加上标识符引用符。
 * <p>
 * 只处理两种位置：限定名中的列（t.order），以及建表语句中列定义的列名。
 *
 * @author afsun
 */
@Component
public class ReservedWordQuotingStrategy extends AbstractRecoveryStrategy {

    private static final String WORDS = "USER|DATE|TIME|TIMESTAMP|ORDER|GROUP|INDEX|KEY|VALUE|LEVEL|COMMENT|SIZE|DESC"
            + "|ASC|UID|RESOURCE|MODE|ROWS|NUMBER|FILE|ACCESS|OPTION|START|SESSION";

    private static final Pattern QUALIFIED = Pattern.compile(
            "(?i)(?<![\\w$#.])([A-Za-z_][\\w$#]*\\s*\\.\\s*)(" + WORDS + ")\\b(?![\\w$#]|\\s*\\()");

    /**
     * 列定义中的列名，INDEX、KEY 在 MySQL 建表语句里是索引定义，不处理
     */
    private static final Pattern COLUMN_DEFINITION = Pattern.compile(
            "(?i)([(,]\\s*)(USER|DATE|TIME|TIMESTAMP|ORDER|GROUP|VALUE|LEVEL|COMMENT|SIZE|DESC|ASC|UID|RESOURCE|MODE"
                    + "|ROWS|NUMBER|FILE|ACCESS|OPTION|START|SESSION)(?=\\s+[A-Za-z])");

    private static final Pattern KEYWORD_IN_ERROR = Pattern.compile("(?i)\\b(?:reserved|keyword|expect\\s+IDENTIFIER)\\b");

    public ReservedWordQuotingStrategy() {
        super("reserved-word quoting", 0.65);
    }

    @Override
    public boolean canHandle(String sql, SqlParseException error) {
        if (error != null && error.getMessage() != null && KEYWORD_IN_ERROR.matcher(error.getMessage()).find()) {
            return true;
        }
        String masked = MaskedSql.mask(sql, null).getText();
        return !quote(masked, Dialect.ORACLE).equals(masked);
    }

    @Override
    public RecoveryAttempt recover(String sql, SqlParseException error, Dialect dialect) {
        MaskedSql masked = MaskedSql.mask(sql, dialect);
        String quoted = masked.restore(quote(masked.getText(), dialect));
        return attempt(sql, quoted, ConversionWarning.of(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.INFO,
                "用作列名的保留字已加引用符", "引用后的标识符区分大小写，请核对列名"));
    }

    static String quote(String masked, Dialect dialect) {
        Dialect quoting = dialect == null ? Dialect.ORACLE : dialect;
        String text = replace(QUALIFIED, masked, quoting, false);
        return SqlTextUtils.mapStatements(text, stmt -> SqlPatterns.CREATE_TABLE.matcher(stmt).find()
                ? replace(COLUMN_DEFINITION, stmt, quoting, true)
                : stmt);
    }

    private static String replace(Pattern pattern, String text, Dialect dialect, boolean columnList) {
        Matcher m = pattern.matcher(text);
        StringBuffer sb = new StringBuffer(text.length() + 16);
        while (m.find()) {
            if (columnList && SqlTextUtils.depthAt(text, 0, m.start(2)) != 1) {
                // 只处理建表列清单这一层
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group()));
                continue;
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(m.group(1) + dialect.quote(caseFor(m.group(2), dialect))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Oracle 未加引号的标识符按大写存储，PostgreSQL 按小写存储
     */
    private static String caseFor(String word, Dialect dialect) {
        switch (dialect) {
            case ORACLE:
                return word.toUpperCase(Locale.ROOT);
            case POSTGRESQL:
                return word.toLowerCase(Locale.ROOT);
            default:
                return word;
        }
    }
}
