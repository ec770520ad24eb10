package com.afsun.transpiler.core.dialect;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * 目标为 PostgreSQL 的方言转换
 *
 * @author afsun
 */
@Component
public class PostgreSqlDialectConverter extends AbstractDialectConverter {

    private static final String ROW_COUNT = "(\\d+|[:?]\\w*)";

    private static final Pattern LIMIT_COMMA = Pattern.compile(
            "(?i)\\bLIMIT\\s+" + ROW_COUNT + "\\s*,\\s*" + ROW_COUNT);

    private static final Pattern REGEXP = Pattern.compile("(?i)\\s+(NOT\\s+)?(?:REGEXP|RLIKE)\\s+");

    private static final Pattern NULL_SAFE_EQUAL = Pattern.compile("\\s*<=>\\s*");

    public PostgreSqlDialectConverter(FunctionCallRewriter functionCallRewriter, DataTypeRewriter dataTypeRewriter) {
        super(functionCallRewriter, dataTypeRewriter);
    }

    @Override
    public Dialect target() {
        return Dialect.POSTGRESQL;
    }

    @Override
    protected String rewriteOperators(String text, ConversionContext ctx, ConversionAccumulator acc) {
        String out = text;
        if (ctx.getSource() != Dialect.MYSQL) {
            return out;
        }
        if (quotingEnabled(ctx)) {
            out = backticksToDoubleQuotes(out, acc);
        }
        out = acc.apply("Operator REGEXP -> ~", out, replaceAll(REGEXP, out,
                m -> m.group(1) == null ? " ~ " : " !~ "));
        out = acc.apply("Operator <=> -> IS NOT DISTINCT FROM", out,
                NULL_SAFE_EQUAL.matcher(out).replaceAll(" IS NOT DISTINCT FROM "));
        if (paginationEnabled(ctx)) {
            out = acc.apply("Pagination LIMIT m, n -> LIMIT n OFFSET m", out,
                    LIMIT_COMMA.matcher(out).replaceAll("LIMIT $2 OFFSET $1"));
        }
        return out;
    }
}
