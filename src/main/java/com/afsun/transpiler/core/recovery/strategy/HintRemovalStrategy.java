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
 * 删除 /*+ ... *\/ 优化器提示后重试
 *
 * @author afsun
 */
@Component
public class HintRemovalStrategy extends AbstractRecoveryStrategy {

    public HintRemovalStrategy() {
        super("hint removal", 0.85);
    }

    @Override
    public boolean canHandle(String sql, SqlParseException error) {
        return SqlScriptUtils.containsHint(sql);
    }

    @Override
    public RecoveryAttempt recover(String sql, SqlParseException error, Dialect dialect) {
        String cleaned = SqlScriptUtils.stripHints(sql);
        return attempt(sql, cleaned, ConversionWarning.of(WarningType.UNSUPPORTED_FUNCTION, WarningSeverity.WARNING,
                "解析失败，已删除优化器提示", "请改用目标库的提示语法或索引优化"));
    }
}
