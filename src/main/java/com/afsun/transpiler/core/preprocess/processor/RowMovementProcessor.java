package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;

import java.util.regex.Pattern;

/**
 * 删除 ENABLE/DISABLE ROW MOVEMENT，须先于约束状态处理器执行
 */
public class RowMovementProcessor extends AbstractDdlProcessor {

    private static final Pattern ROW_MOVEMENT = Pattern.compile("(?i)\\s*\\b(?:ENABLE|DISABLE)\\s+ROW\\s+MOVEMENT\\b");

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        return remove(ROW_MOVEMENT, stmt, "DDL ROW MOVEMENT removed", acc);
    }
}
