package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.util.SqlPatterns;

import java.util.regex.Pattern;

/**
 * 删除 LOB 存储子句与 SECUREFILE / BASICFILE
 */
public class LobStorageProcessor extends AbstractDdlProcessor {

    private static final Pattern LOB_STORE_AS = Pattern.compile(
            "(?i)\\s*\\bLOB\\s*\\([^()]*\\)\\s*STORE\\s+AS\\s*(?:(?:SECUREFILE|BASICFILE)\\b\\s*)?"
                    + "(?:(?!(?:TABLESPACE|STORAGE|ENABLE|DISABLE|CACHE|NOCACHE|LOGGING|NOLOGGING|COMPRESS|NOCOMPRESS)\\b)"
                    + SqlPatterns.IDENT + "\\s*)?(?:\\((?:[^()]|\\((?:[^()]|\\([^()]*\\))*\\))*\\))?");

    private static final Pattern FILE_KIND = Pattern.compile("(?i)\\s*\\b(?:SECUREFILE|BASICFILE)\\b");

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        String out = remove(LOB_STORE_AS, stmt, "DDL LOB STORE AS removed", acc);
        return remove(FILE_KIND, out, "DDL SECUREFILE/BASICFILE removed", acc);
    }
}
