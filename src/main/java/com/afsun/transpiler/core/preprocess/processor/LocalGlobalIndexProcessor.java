package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.util.SqlPatterns;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 去掉分区索引的 LOCAL / GLOBAL 限定及其分区列表
 */
public class LocalGlobalIndexProcessor extends AbstractDdlProcessor {

    private static final Pattern LOCAL_GLOBAL = Pattern.compile(
            "(?i)(?<=\\))\\s*\\b(?:LOCAL|GLOBAL)\\b(?:\\s*\\((?:[^()]|\\([^()]*\\))*\\))?");

    private static final Pattern GLOBAL_PARTITION = Pattern.compile(
            "(?i)\\s*\\bGLOBAL\\s+PARTITION\\s+BY\\s+\\w+\\s*\\([^()]*\\)\\s*\\((?:[^()]|\\((?:[^()]|\\([^()]*\\))*\\))*\\)");

    @Override
    protected boolean appliesTo(String stmt) {
        return SqlPatterns.CREATE_INDEX.matcher(stmt).find();
    }

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        String out = remove(GLOBAL_PARTITION, stmt, "Index GLOBAL PARTITION removed", acc);
        Matcher m = LOCAL_GLOBAL.matcher(out);
        if (m.find()) {
            acc.warn(WarningType.PARTIAL_SUPPORT, WarningSeverity.INFO,
                    "分区索引的 LOCAL/GLOBAL 限定已移除", "目标库的分区表索引需单独核对", ctx.snippet(out));
        }
        return remove(LOCAL_GLOBAL, out, "Index LOCAL/GLOBAL removed", acc);
    }
}
