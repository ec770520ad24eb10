package com.afsun.transpiler.core.dialect;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * 目标为 Oracle 的方言转换
 *
 * @author afsun
 */
@Component
public class OracleDialectConverter extends AbstractDialectConverter {

    private static final String ROW_COUNT = "(\\d+|[:?]\\w*)";

    /**
     * MySQL: LIMIT m, n
     */
    private static final Pattern LIMIT_COMMA = Pattern.compile(
            "(?i)\\bLIMIT\\s+" + ROW_COUNT + "\\s*,\\s*" + ROW_COUNT);

    private static final Pattern LIMIT_OFFSET = Pattern.compile(
            "(?i)\\bLIMIT\\s+" + ROW_COUNT + "\\s+OFFSET\\s+" + ROW_COUNT);

    private static final Pattern OFFSET_LIMIT = Pattern.compile(
            "(?i)\\bOFFSET\\s+" + ROW_COUNT + "\\s+LIMIT\\s+" + ROW_COUNT);

    private static final Pattern LIMIT_ONLY = Pattern.compile("(?i)\\bLIMIT\\s+" + ROW_COUNT);

    private static final Pattern LIMIT_ALL = Pattern.compile("(?i)\\s*\\bLIMIT\\s+ALL\\b");

    private static final Pattern ILIKE = Pattern.compile("(?i)" + OPERAND + "\\s+(NOT\\s+)?ILIKE\\s+" + OPERAND);

    private static final Pattern REGEXP = Pattern.compile("(?i)" + OPERAND + "\\s+(NOT\\s+)?(?:REGEXP|RLIKE)\\s+" + OPERAND);

    private static final Pattern NULL_SAFE_EQUAL = Pattern.compile("(?i)" + OPERAND + "\\s*<=>\\s*" + OPERAND);

    public OracleDialectConverter(FunctionCallRewriter functionCallRewriter, DataTypeRewriter dataTypeRewriter) {
        super(functionCallRewriter, dataTypeRewriter);
    }

    @Override
    public Dialect target() {
        return Dialect.ORACLE;
    }

    @Override
    protected String rewriteOperators(String text, ConversionContext ctx, ConversionAccumulator acc) {
        String out = text;
        if (ctx.getSource() == Dialect.MYSQL && quotingEnabled(ctx)) {
            out = backticksToDoubleQuotes(out, acc);
        }
        if (ctx.getSource() == Dialect.POSTGRESQL) {
            out = castOperatorToCast(out, ctx, acc);
            out = acc.apply("Operator ILIKE -> UPPER() LIKE UPPER()", out, replaceAll(ILIKE, out,
                    m -> "UPPER(" + m.group(1) + ") " + (m.group(2) == null ? "" : "NOT ") + "LIKE UPPER(" + m.group(3) + ")"));
        }
        if (ctx.getSource() == Dialect.MYSQL) {
            out = acc.apply("Operator REGEXP -> REGEXP_LIKE", out, replaceAll(REGEXP, out,
                    m -> (m.group(2) == null ? "" : "NOT ") + "REGEXP_LIKE(" + m.group(1) + ", " + m.group(3) + ")"));
            out = acc.apply("Operator <=> -> DECODE", out, replaceAll(NULL_SAFE_EQUAL, out,
                    m -> "DECODE(" + m.group(1) + ", " + m.group(2) + ", 1, 0) = 1"));
        }
        if (paginationEnabled(ctx)) {
            out = rewriteLimit(out, acc);
        }
        return out;
    }

    /**
     * LIMIT 改为 12c 的 OFFSET ... FETCH
     */
    private String rewriteLimit(String text, ConversionAccumulator acc) {
        String out = acc.apply("Pagination LIMIT ALL removed", text, LIMIT_ALL.matcher(text).replaceAll(""));
        out = acc.apply("Pagination LIMIT m, n -> OFFSET FETCH", out,
                LIMIT_COMMA.matcher(out).replaceAll("OFFSET $1 ROWS FETCH NEXT $2 ROWS ONLY"));
        out = acc.apply("Pagination LIMIT n OFFSET m -> OFFSET FETCH", out,
                LIMIT_OFFSET.matcher(out).replaceAll("OFFSET $2 ROWS FETCH NEXT $1 ROWS ONLY"));
        out = acc.apply("Pagination OFFSET m LIMIT n -> OFFSET FETCH", out,
                OFFSET_LIMIT.matcher(out).replaceAll("OFFSET $1 ROWS FETCH NEXT $2 ROWS ONLY"));
        String fetched = LIMIT_ONLY.matcher(out).replaceAll("FETCH FIRST $1 ROWS ONLY");
        if (!fetched.equals(out)) {
            acc.warn(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.INFO,
                    "LIMIT 已改为 FETCH FIRST，需要 Oracle 12c 及以上版本", "低版本可改用 ROWNUM 子查询");
        }
        return acc.apply("Pagination LIMIT n -> FETCH FIRST", out, fetched);
    }
}
