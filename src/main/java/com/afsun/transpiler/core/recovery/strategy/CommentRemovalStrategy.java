package com.afsun.transpiler.core.recovery.strategy;

import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.afsun.transpiler.core.recovery.AbstractRecoveryStrategy;
import com.afsun.transpiler.core.recovery.RecoveryAttempt;
import com.afsun.transpiler.core.util.SqlScriptUtils;
import org.springframework.stereotype.Component;

/**
 * 删除注释后重试，优化器提示留给 {@link HintRemovalStrategy}
 *
 * @author afsun
 */
@Component
public class CommentRemovalStrategy extends AbstractRecoveryStrategy {

    public CommentRemovalStrategy() {
        super("comment removal", 0.90);
    }

    @Override
    public boolean canHandle(String sql, SqlParseException error) {
        return SqlScriptUtils.containsComment(sql, false) || SqlScriptUtils.containsComment(sql, true);
    }

    @Override
    public RecoveryAttempt recover(String sql, SqlParseException error, Dialect dialect) {
        String cleaned = SqlScriptUtils.stripComments(sql, dialect == Dialect.MYSQL, true);
        return attempt(sql, cleaned, ConversionWarning.of(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.INFO,
                "解析失败，已删除注释后重试", "如需保留注释请在转换后手工补回"));
    }
}
