package com.afsun.transpiler.core.dialect;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 目标为 MySQL 的方言转换
 *
 * @author afsun
 */
@Component
public class MySqlDialectConverter extends AbstractDialectConverter {

    private static final String ROW_COUNT = "(\\d+|[:?]\\w*)";

    private static final Pattern OFFSET_FETCH = Pattern.compile(
            "(?i)\\bOFFSET\\s+" + ROW_COUNT + "\\s+ROWS?\\s+FETCH\\s+(?:FIRST|NEXT)\\s+" + ROW_COUNT + "\\s+ROWS?\\s+ONLY\\b");

    private static final Pattern FETCH_FIRST = Pattern.compile(
            "(?i)\\bFETCH\\s+(?:FIRST|NEXT)\\s+" + ROW_COUNT + "\\s+ROWS?\\s+ONLY\\b");

    private static final Pattern OFFSET_ROWS = Pattern.compile("(?i)\\bOFFSET\\s+" + ROW_COUNT + "\\s+ROWS?\\b");

    private static final Pattern ILIKE = Pattern.compile("(?i)\\b(NOT\\s+)?ILIKE\\b");

    private static final Pattern REGEX_MATCH = Pattern.compile("(!?)~(\\*?)(?=\\s)");

    private static final Pattern IS_DISTINCT = Pattern.compile(
            "(?i)" + OPERAND + "\\s+IS\\s+(NOT\\s+)?DISTINCT\\s+FROM\\s+" + OPERAND);

    /**
     * MySQL CAST 只接受有限的目标类型
     */
    private static final Pattern CAST_TYPE = Pattern.compile(
            "(?i)(\\bAS\\s+)(BIGINT|INT|INTEGER|SMALLINT|TINYINT|MEDIUMINT|VARCHAR|TEXT|LONGTEXT|NUMERIC|TIMESTAMP)\\b(\\s*\\([^()]*\\))?(?=\\s*\\))");

    public MySqlDialectConverter(FunctionCallRewriter functionCallRewriter, DataTypeRewriter dataTypeRewriter) {
        super(functionCallRewriter, dataTypeRewriter);
    }

    @Override
    public Dialect target() {
        return Dialect.MYSQL;
    }

    @Override
    protected String rewriteOperators(String text, ConversionContext ctx, ConversionAccumulator acc) {
        String out = text;
        if (quotingEnabled(ctx)) {
            out = doubleQuotesToBackticks(out, acc);
        }
        if (ctx.getSource() == Dialect.POSTGRESQL) {
            out = castOperatorToCast(out, ctx, acc);
            String liked = ILIKE.matcher(out).replaceAll("$1LIKE");
            if (!liked.equals(out)) {
                acc.warn(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.INFO,
                        "ILIKE 已改为 LIKE，大小写敏感性取决于列的排序规则", "如列使用 _bin 排序规则需配合 LOWER() 使用");
            }
            out = acc.apply("Operator ILIKE -> LIKE", out, liked);
            out = acc.apply("Operator ~ -> REGEXP", out, replaceAll(REGEX_MATCH, out,
                    m -> m.group(1).isEmpty() ? "REGEXP" : "NOT REGEXP"));
            out = acc.apply("Operator IS DISTINCT FROM -> <=>", out, replaceAll(IS_DISTINCT, out,
                    m -> (m.group(2) == null ? "NOT " : "") + "(" + m.group(1) + " <=> " + m.group(3) + ")"));
        }
        if (paginationEnabled(ctx)) {
            out = acc.apply("Pagination OFFSET FETCH -> LIMIT", out,
                    OFFSET_FETCH.matcher(out).replaceAll("LIMIT $2 OFFSET $1"));
            out = acc.apply("Pagination FETCH FIRST -> LIMIT", out, FETCH_FIRST.matcher(out).replaceAll("LIMIT $1"));
            if (OFFSET_ROWS.matcher(out).find()) {
                acc.warn(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.WARNING,
                        "MySQL 不支持单独的 OFFSET n ROWS", "请改为 LIMIT n, 18446744073709551615");
            }
        }
        return out;
    }

    @Override
    protected String afterTypes(String text, ConversionContext ctx, ConversionAccumulator acc) {
        if (!text.toUpperCase(Locale.ROOT).contains("CAST")) {
            return text;
        }
        String out = replaceAll(CAST_TYPE, text, m -> m.group(1) + castType(m.group(2), m.group(3)));
        return acc.apply("CAST target type adjusted for MySQL", text, out);
    }

    private static String castType(String type, String precision) {
        String upper = type.toUpperCase(Locale.ROOT);
        switch (upper) {
            case "VARCHAR":
                return "CHAR" + (precision == null ? "" : precision.trim());
            case "TEXT":
            case "LONGTEXT":
                return "CHAR";
            case "NUMERIC":
                return "DECIMAL" + (precision == null ? "" : precision.trim());
            case "TIMESTAMP":
                return "DATETIME" + (precision == null ? "" : precision.trim());
            default:
                return "SIGNED";
        }
    }
}
