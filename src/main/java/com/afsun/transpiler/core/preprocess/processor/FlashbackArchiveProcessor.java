package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.util.SqlPatterns;

import java.util.regex.Pattern;

/**
 * 删除 FLASHBACK ARCHIVE 子句，目标库没有对应功能时告警
 */
public class FlashbackArchiveProcessor extends AbstractDdlProcessor {

    private static final Pattern NO_FLASHBACK = Pattern.compile("(?i)\\s*\\bNO\\s+FLASHBACK\\s+ARCHIVE\\b");

    private static final Pattern FLASHBACK = Pattern.compile(
            "(?i)\\s*\\bFLASHBACK\\s+ARCHIVE\\b(?:\\s+(?!ENABLE\\b|DISABLE\\b)" + SqlPatterns.IDENT + ")?");

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        String out = remove(NO_FLASHBACK, stmt, "DDL NO FLASHBACK ARCHIVE removed", acc);
        if (FLASHBACK.matcher(out).find()) {
            acc.warn(WarningType.UNSUPPORTED_FUNCTION, WarningSeverity.WARNING,
                    "FLASHBACK ARCHIVE 在 " + ctx.getTarget().getDisplayName() + " 中没有对应功能，已移除",
                    "如需历史版本可使用触发器维护审计表", ctx.snippet(out));
        }
        return remove(FLASHBACK, out, "DDL FLASHBACK ARCHIVE removed", acc);
    }
}
