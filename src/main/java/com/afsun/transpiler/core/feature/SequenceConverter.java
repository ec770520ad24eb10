package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 序列与自增列。
 * <ul>
 *     <li>CREATE / DROP SEQUENCE 选项在 Oracle 与 PostgreSQL 之间互转，MySQL 以自增表模拟</li>
 *     <li>seq.NEXTVAL / CURRVAL 与 nextval('seq') / currval('seq') 互转</li>
 *     <li>AUTO_INCREMENT、SERIAL、GENERATED ... AS IDENTITY 互转</li>
 * </ul>
 *
 * @author afsun
 */
@Component
public class SequenceConverter extends AbstractFeatureConverter {

    private static final Pattern CREATE_SEQUENCE = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "CREATE\\s+(?:TEMP(?:ORARY)?\\s+)?SEQUENCE\\s+(IF\\s+NOT\\s+EXISTS\\s+)?("
                    + SqlPatterns.QUALIFIED_IDENT + ")");

    private static final Pattern DROP_SEQUENCE = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "DROP\\s+SEQUENCE\\s+(IF\\s+EXISTS\\s+)?(" + SqlPatterns.QUALIFIED_IDENT
                    + ")(\\s+(?:CASCADE|RESTRICT))?\\s*$");

    private static final Pattern ALTER_SEQUENCE = Pattern.compile("(?is)" + SqlPatterns.LEAD + "ALTER\\s+SEQUENCE\\b");

    private static final Pattern START_WITH = Pattern.compile("(?i)\\bSTART\\s+(?:WITH\\s+)?(-?\\d+)");

    /**
     * Oracle 引用：seq.NEXTVAL、schema.seq.CURRVAL
     */
    private static final Pattern ORACLE_SEQ_REF = Pattern.compile(
            "(?i)(?<![\\w$#.\"`])(" + SqlPatterns.QUALIFIED_IDENT + ")\\s*\\.\\s*(NEXTVAL|CURRVAL)\\b");

    /**
     * PostgreSQL 引用：nextval('seq')、currval('seq'::regclass)
     */
    private static final Pattern PG_SEQ_REF = Pattern.compile(
            "(?i)(?<![\\w$.])(nextval|currval|setval)\\s*\\(\\s*(" + SqlPatterns.LITERAL + ")(?:\\s*::\\s*regclass)?\\s*([,)])");

    private static final Pattern AUTO_INCREMENT = Pattern.compile("(?i)\\s+AUTO_INCREMENT\\b");

    /**
     * 列定义中的 SERIAL 类型，列名本身可能叫 serial
     */
    private static final Pattern SERIAL = Pattern.compile(
            "(?i)((?:^|[(,]|\\bADD\\s+(?:COLUMN\\s+)?)\\s*" + SqlPatterns.IDENT + "\\s+)(SMALLSERIAL|BIGSERIAL|SERIAL[248]?)\\b");

    private static final Pattern IDENTITY = Pattern.compile(
            "(?i)\\bGENERATED\\s+(ALWAYS|BY\\s+DEFAULT)(\\s+ON\\s+NULL)?\\s+AS\\s+IDENTITY\\b(\\s*\\((?:[^()]|\\([^()]*\\))*\\))?");

    /**
     * 列名与数据类型，类型可带精度和 UNSIGNED
     */
    private static final Pattern COLUMN_HEAD = Pattern.compile(
            "(?is)^\\s*" + SqlPatterns.IDENT + "\\s+[A-Za-z_][\\w$]*(?:\\s+(?:PRECISION|VARYING))?(?:\\s*\\([^()]*\\))?"
                    + "(?:\\s+UNSIGNED)?(?:\\s+ZEROFILL)?");

    private static final Pattern KEYWORD = Pattern.compile(
            "(?i)\\bSEQUENCE\\b|\\bNEXTVAL\\b|\\bCURRVAL\\b|\\bAUTO_INCREMENT\\b|SERIAL[248]?\\b|\\bIDENTITY\\b");

    @Override
    public int order() {
        return 500;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getDdlRules().isConvertSequences();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return KEYWORD.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        String text = SqlTextUtils.mapStatements(maskedSql, stmt -> convertStatement(stmt, ctx, acc));
        text = convertReferences(text, ctx, acc);
        return text;
    }

    private String convertStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        Matcher create = CREATE_SEQUENCE.matcher(stmt);
        if (create.find()) {
            return convertCreate(stmt, create, ctx, acc);
        }
        Matcher drop = DROP_SEQUENCE.matcher(stmt);
        if (drop.find()) {
            if (to(ctx, Dialect.MYSQL)) {
                acc.addRule("DROP SEQUENCE -> DROP TABLE");
                return keepLead(stmt, "DROP TABLE IF EXISTS " + drop.group(2));
            }
            if (to(ctx, Dialect.ORACLE) && (drop.group(1) != null || drop.group(3) != null)) {
                acc.addRule("DROP SEQUENCE options -> Oracle");
                return keepLead(stmt, "DROP SEQUENCE " + drop.group(2));
            }
            return stmt;
        }
        if (ALTER_SEQUENCE.matcher(stmt).find() && to(ctx, Dialect.MYSQL)) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "MySQL 没有序列，ALTER SEQUENCE 无法转换",
                    "可通过 ALTER TABLE ... AUTO_INCREMENT = n 调整模拟表", ctx, stmt);
            return stmt;
        }
        if (SqlPatterns.CREATE_TABLE.matcher(stmt).find() || SqlPatterns.ALTER_TABLE.matcher(stmt).find()) {
            return convertIdentityColumns(stmt, ctx, acc);
        }
        return stmt;
    }

    private String convertCreate(String stmt, Matcher create, ConversionContext ctx, ConversionAccumulator acc) {
        String name = create.group(2);
        String options = stmt.substring(create.end());
        if (to(ctx, Dialect.MYSQL)) {
            Matcher start = START_WITH.matcher(options);
            String startValue = start.find() ? start.group(1) : "1";
            warn(acc, WarningType.PARTIAL_SUPPORT, "MySQL 没有序列，" + name + " 已改为自增表模拟",
                    "取值请执行 INSERT INTO " + name + " VALUES (NULL) 后调用 LAST_INSERT_ID()", ctx, stmt);
            acc.addRule("Sequence -> AUTO_INCREMENT table");
            String table = "CREATE TABLE " + name + " (id BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY)";
            if (!"1".equals(startValue)) {
                table += " AUTO_INCREMENT = " + startValue;
            }
            return keepLead(stmt, table);
        }
        String converted;
        if (to(ctx, Dialect.POSTGRESQL)) {
            converted = oracleOptionsToPostgres(options, stmt, ctx, acc);
        } else if (to(ctx, Dialect.ORACLE)) {
            converted = postgresOptionsToOracle(options, stmt, ctx, acc);
        } else {
            return stmt;
        }
        String head = "CREATE SEQUENCE " + (to(ctx, Dialect.POSTGRESQL) && create.group(1) != null ? "IF NOT EXISTS " : "")
                + name;
        String result = keepLead(stmt, head + converted);
        return acc.apply("Sequence options -> " + ctx.getTarget().getDisplayName(), stmt, result);
    }

    private static String oracleOptionsToPostgres(String options, String stmt, ConversionContext ctx,
                                                  ConversionAccumulator acc) {
        String out = options;
        out = out.replaceAll("(?i)\\bNOCYCLE\\b", "NO CYCLE");
        out = out.replaceAll("(?i)\\bNOMAXVALUE\\b", "NO MAXVALUE");
        out = out.replaceAll("(?i)\\bNOMINVALUE\\b", "NO MINVALUE");
        out = out.replaceAll("(?i)\\s*\\bNOCACHE\\b", "");
        out = out.replaceAll("(?i)\\s*\\b(?:NOORDER|ORDER|NOKEEP|KEEP|NOSCALE|SCALE|GLOBAL|SESSION)\\b", "");
        Matcher big = Pattern.compile("(?i)\\b(MAXVALUE|MINVALUE)\\s+(-?\\d{19,})").matcher(out);
        if (big.find()) {
            info(acc, WarningType.DATA_TYPE_MISMATCH, "序列边界超出 PostgreSQL BIGINT 范围，已改为默认边界", null, ctx, stmt);
            out = big.replaceAll("NO $1");
        }
        return out;
    }

    private static String postgresOptionsToOracle(String options, String stmt, ConversionContext ctx,
                                                  ConversionAccumulator acc) {
        String out = options;
        if (Pattern.compile("(?i)\\bOWNED\\s+BY\\b").matcher(out).find()) {
            info(acc, WarningType.SYNTAX_DIFFERENCE, "Oracle 序列不支持 OWNED BY，已移除", null, ctx, stmt);
            out = out.replaceAll("(?is)\\s*\\bOWNED\\s+BY\\s+\\S+", "");
        }
        out = out.replaceAll("(?i)\\s*\\bAS\\s+(?:SMALLINT|INTEGER|INT|BIGINT)\\b", "");
        out = out.replaceAll("(?i)\\bNO\\s+CYCLE\\b", "NOCYCLE");
        out = out.replaceAll("(?i)\\bNO\\s+MAXVALUE\\b", "NOMAXVALUE");
        out = out.replaceAll("(?i)\\bNO\\s+MINVALUE\\b", "NOMINVALUE");
        out = out.replaceAll("(?i)\\bSTART\\s+(?!WITH\\b)(-?\\d+)", "START WITH $1");
        out = out.replaceAll("(?i)\\bINCREMENT\\s+(?!BY\\b)(-?\\d+)", "INCREMENT BY $1");
        out = out.replaceAll("(?i)\\bCACHE\\s+1\\b", "NOCACHE");
        return out;
    }

    private String convertIdentityColumns(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        int open = stmt.indexOf('(');
        boolean createTable = SqlPatterns.CREATE_TABLE.matcher(stmt).find();
        if (!createTable || open < 0) {
            return convertIdentitySegment(stmt, ctx, acc, false);
        }
        int close = SqlTextUtils.findMatchingParen(stmt, open);
        if (close < 0) {
            return stmt;
        }
        List<String> columns = new ArrayList<>();
        for (String column : SqlTextUtils.splitTopLevel(stmt.substring(open + 1, close), ',')) {
            columns.add(convertIdentitySegment(column, ctx, acc, true));
        }
        return stmt.substring(0, open + 1) + String.join(",", columns) + stmt.substring(close);
    }

    private String convertIdentitySegment(String column, ConversionContext ctx, ConversionAccumulator acc,
                                          boolean columnDefinition) {
        String out = column;
        if (from(ctx, Dialect.MYSQL) && !to(ctx, Dialect.MYSQL) && AUTO_INCREMENT.matcher(out).find()) {
            String removed = AUTO_INCREMENT.matcher(out).replaceAll("");
            Matcher head = COLUMN_HEAD.matcher(removed);
            if (columnDefinition && head.find()) {
                out = removed.substring(0, head.end()) + " GENERATED BY DEFAULT AS IDENTITY" + removed.substring(head.end());
            } else {
                out = AUTO_INCREMENT.matcher(out).replaceAll(" GENERATED BY DEFAULT AS IDENTITY");
            }
            acc.addRule("AUTO_INCREMENT -> IDENTITY");
        }
        if (from(ctx, Dialect.POSTGRESQL) && !to(ctx, Dialect.POSTGRESQL)) {
            out = replaceAll(SERIAL, out, m -> m.group(1) + serialType(m.group(2), ctx, acc));
        }
        Matcher identity = IDENTITY.matcher(out);
        if (identity.find()) {
            if (to(ctx, Dialect.MYSQL)) {
                if (identity.group(3) != null) {
                    warn(acc, WarningType.PARTIAL_SUPPORT, "MySQL 自增列不支持逐列的起始值与步长，已忽略",
                            "可用表选项 AUTO_INCREMENT = n 或会话变量 auto_increment_increment", ctx, column);
                }
                out = out.substring(0, identity.start()) + "AUTO_INCREMENT" + out.substring(identity.end());
                acc.addRule("IDENTITY -> AUTO_INCREMENT");
            } else if (to(ctx, Dialect.POSTGRESQL) && identity.group(2) != null) {
                warn(acc, WarningType.SYNTAX_DIFFERENCE, "PostgreSQL 不支持 ON NULL 自增，插入 NULL 将报错",
                        "插入时请省略该列", ctx, column);
                out = out.substring(0, identity.start()) + "GENERATED " + identity.group(1).toUpperCase(Locale.ROOT)
                        + " AS IDENTITY" + (identity.group(3) == null ? "" : identity.group(3)) + out.substring(identity.end());
                acc.addRule("IDENTITY ON NULL removed");
            }
        }
        return out;
    }

    private static String serialType(String serial, ConversionContext ctx, ConversionAccumulator acc) {
        String upper = serial.toUpperCase(Locale.ROOT);
        String base;
        if ("SMALLSERIAL".equals(upper) || "SERIAL2".equals(upper)) {
            base = "SMALLINT";
        } else if ("BIGSERIAL".equals(upper) || "SERIAL8".equals(upper)) {
            base = "BIGINT";
        } else {
            base = "INTEGER";
        }
        acc.addRule("SERIAL -> " + (to(ctx, Dialect.MYSQL) ? "AUTO_INCREMENT" : "IDENTITY"));
        if (to(ctx, Dialect.MYSQL)) {
            return ("INTEGER".equals(base) ? "INT" : base) + " AUTO_INCREMENT";
        }
        return base + " GENERATED BY DEFAULT AS IDENTITY";
    }

    private String convertReferences(String text, ConversionContext ctx, ConversionAccumulator acc) {
        String out = text;
        if (from(ctx, Dialect.ORACLE) && !to(ctx, Dialect.ORACLE)) {
            out = replaceAll(ORACLE_SEQ_REF, out, m -> {
                String seq = m.group(1).replaceAll("\\s+", "");
                boolean next = "NEXTVAL".equalsIgnoreCase(m.group(2));
                if (to(ctx, Dialect.POSTGRESQL)) {
                    acc.addRule("Sequence " + (next ? "NEXTVAL -> nextval()" : "CURRVAL -> currval()"));
                    return (next ? "nextval(" : "currval(") + ctx.addLiteral(seq.replace("\"", "")) + ")";
                }
                return mysqlReference(seq, next, m.group(), ctx, acc);
            });
        }
        if (from(ctx, Dialect.POSTGRESQL) && !to(ctx, Dialect.POSTGRESQL)) {
            out = replaceAll(PG_SEQ_REF, out, m -> {
                String function = m.group(1).toLowerCase(Locale.ROOT);
                String seq = ctx.literalValue(m.group(2));
                if (seq == null || "setval".equals(function) || !")".equals(m.group(3))) {
                    warn(acc, WarningType.MANUAL_REVIEW_NEEDED, function + "() 无法自动转换", "请人工改写", ctx, m.group());
                    return null;
                }
                boolean next = "nextval".equals(function);
                if (to(ctx, Dialect.ORACLE)) {
                    acc.addRule("Sequence " + function + "() -> " + (next ? "NEXTVAL" : "CURRVAL"));
                    return seq + (next ? ".NEXTVAL" : ".CURRVAL");
                }
                return mysqlReference(seq, next, m.group(), ctx, acc);
            });
        }
        return out;
    }

    private static String mysqlReference(String seq, boolean next, String original, ConversionContext ctx,
                                         ConversionAccumulator acc) {
        if (next) {
            warn(acc, WarningType.UNSUPPORTED_FUNCTION, "MySQL 没有与 " + seq + " 取下一个值等价的表达式，引用未转换",
                    "请改用 AUTO_INCREMENT 列，或先 INSERT INTO " + seq + " VALUES (NULL) 再取 LAST_INSERT_ID()", ctx, original);
            return null;
        }
        warn(acc, WarningType.PARTIAL_SUPPORT, "序列当前值近似为 LAST_INSERT_ID()，仅对本会话最后一次自增有效", null, ctx, original);
        acc.addRule("Sequence CURRVAL -> LAST_INSERT_ID()");
        return "LAST_INSERT_ID()";
    }
}
