package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;

import java.util.regex.Pattern;

public class SegmentCreationProcessor extends AbstractDdlProcessor {

    private static final Pattern SEGMENT_CREATION = Pattern.compile(
            "(?i)\\s*\\bSEGMENT\\s+CREATION\\s+(?:IMMEDIATE|DEFERRED)\\b");

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        return remove(SEGMENT_CREATION, stmt, "DDL SEGMENT CREATION removed", acc);
    }
}
