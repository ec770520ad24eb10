package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;

import java.util.regex.Pattern;

/**
 * 删除表压缩选项
 */
public class CompressProcessor extends AbstractDdlProcessor {

    private static final Pattern COMPRESS = Pattern.compile(
            "(?i)\\s*\\b(?:ROW\\s+STORE\\s+|COLUMN\\s+STORE\\s+)?(?:NOCOMPRESS\\b|COMPRESS\\b"
                    + "(?:\\s+FOR\\s+(?:OLTP|QUERY|ARCHIVE|ALL\\s+OPERATIONS|DIRECT_LOAD\\s+OPERATIONS)\\b(?:\\s+(?:LOW|HIGH)\\b)?"
                    + "|\\s+BASIC\\b|\\s+ADVANCED\\b(?:\\s+(?:LOW|HIGH)\\b)?|\\s+\\d+)?)");

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        return removeTopLevel(COMPRESS, stmt, "DDL COMPRESS removed", acc);
    }
}
