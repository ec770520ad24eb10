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

/**
 * 补齐缺失的右括号、删除多余的右括号。
 * <p>
 * 字符串和注释屏蔽后按分号逐段处理，缺失的右括号补在该段末尾。
 *
 * @author afsun
 */
@Component
public class ParenthesisBalanceStrategy extends AbstractRecoveryStrategy {

    public ParenthesisBalanceStrategy() {
        super("parenthesis-balance repair", 0.75);
    }

    @Override
    public boolean canHandle(String sql, SqlParseException error) {
        String masked = MaskedSql.mask(sql, null).getText();
        return !balance(masked).equals(masked);
    }

    @Override
    public RecoveryAttempt recover(String sql, SqlParseException error, Dialect dialect) {
        MaskedSql masked = MaskedSql.mask(sql, dialect);
        String balanced = balance(masked.getText());
        return attempt(sql, masked.restore(balanced), ConversionWarning.of(WarningType.SYNTAX_DIFFERENCE,
                WarningSeverity.WARNING, "括号不配对，已自动补齐或删除多余括号", "请核对修复后括号的位置"));
    }

    static String balance(String masked) {
        StringBuilder sb = new StringBuilder(masked.length() + 8);
        int segmentStart = 0;
        for (int i = 0; i <= masked.length(); i++) {
            if (i == masked.length() || masked.charAt(i) == ';') {
                sb.append(balanceSegment(masked.substring(segmentStart, i)));
                if (i < masked.length()) {
                    sb.append(';');
                }
                segmentStart = i + 1;
            }
        }
        return sb.toString();
    }

    private static String balanceSegment(String segment) {
        StringBuilder sb = new StringBuilder(segment.length() + 4);
        int depth = 0;
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    // 没有对应左括号
                    continue;
                }
                depth--;
            }
            sb.append(c);
        }
        if (depth == 0) {
            return sb.toString();
        }
        int end = sb.length();
        while (end > 0 && Character.isWhitespace(sb.charAt(end - 1))) {
            end--;
        }
        StringBuilder closing = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            closing.append(')');
        }
        sb.insert(end, closing);
        return sb.toString();
    }
}
