package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.util.SqlPatterns;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 识别分区定义，只告警不改写
 *
 * @author afsun
 */
public class PartitionClauseProcessor extends AbstractDdlProcessor {

    private static final Pattern PARTITION_BY = Pattern.compile(
            "(?i)\\bPARTITION\\s+BY\\s+(RANGE|LIST|HASH|REFERENCE|SYSTEM)\\b");

    private static final Pattern INTERVAL = Pattern.compile("(?i)\\)\\s*INTERVAL\\s*\\(");

    @Override
    protected boolean appliesTo(String stmt) {
        return SqlPatterns.CREATE_TABLE.matcher(stmt).find() || SqlPatterns.ALTER_TABLE.matcher(stmt).find();
    }

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        Matcher m = PARTITION_BY.matcher(stmt);
        if (!m.find()) {
            return stmt;
        }
        String kind = m.group(1).toUpperCase(Locale.ROOT);
        acc.warn(WarningType.PARTIAL_SUPPORT, WarningSeverity.WARNING,
                "检测到 " + kind + " 分区定义，分区语法在 " + ctx.getTarget().getDisplayName() + " 中差异较大",
                "请按目标库的分区语法人工核对", ctx.snippet(stmt.substring(m.start())));
        if (INTERVAL.matcher(stmt).find()) {
            acc.warn(WarningType.UNSUPPORTED_FUNCTION, WarningSeverity.WARNING,
                    "INTERVAL 自动分区在 " + ctx.getTarget().getDisplayName() + " 中不受支持",
                    "需预先创建分区或使用定时任务维护", ctx.snippet(stmt.substring(m.start())));
        }
        return stmt;
    }
}
