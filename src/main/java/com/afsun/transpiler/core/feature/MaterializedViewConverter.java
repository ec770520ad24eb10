package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 物化视图。
 * <ul>
 *     <li>Oracle -> PostgreSQL：原生物化视图，BUILD DEFERRED 对应 WITH NO DATA</li>
 *     <li>-> MySQL：基表 + 全量刷新存储过程</li>
 *     <li>PostgreSQL -> Oracle：BUILD IMMEDIATE|DEFERRED REFRESH COMPLETE ON DEMAND</li>
 * </ul>
 *
 * @author afsun
 */
@Component
public class MaterializedViewConverter extends AbstractFeatureConverter {

    private static final Pattern CREATE_MV = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "CREATE\\s+MATERIALIZED\\s+VIEW\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?("
                    + SqlPatterns.QUALIFIED_IDENT + ")(\\s*\\([^()]*\\))?");

    private static final Pattern REFRESH_MV = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "REFRESH\\s+MATERIALIZED\\s+VIEW\\s+(CONCURRENTLY\\s+)?("
                    + SqlPatterns.QUALIFIED_IDENT + ")(?:\\s+WITH\\s+(NO\\s+)?DATA)?\\s*$");

    private static final Pattern DROP_MV = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "DROP\\s+MATERIALIZED\\s+VIEW\\s+(IF\\s+EXISTS\\s+)?(" + SqlPatterns.QUALIFIED_IDENT
                    + ")(?:\\s+(?:CASCADE|RESTRICT|PRESERVE\\s+TABLE))?\\s*$");

    private static final Pattern ALTER_MV = Pattern.compile("(?is)" + SqlPatterns.LEAD + "ALTER\\s+MATERIALIZED\\s+VIEW\\b");

    private static final Pattern WITH_DATA = Pattern.compile("(?is)\\s*\\bWITH\\s+(NO\\s+)?DATA\\s*$");

    private static final Pattern BUILD_DEFERRED = Pattern.compile("(?i)\\bBUILD\\s+DEFERRED\\b");

    private static final Pattern ON_COMMIT = Pattern.compile("(?i)\\bON\\s+COMMIT\\b");

    private static final Pattern REFRESH_FAST = Pattern.compile("(?i)\\bREFRESH\\s+(?:FAST|FORCE)\\b");

    private static final Pattern QUERY_REWRITE = Pattern.compile("(?i)\\b(?:ENABLE|DISABLE)\\s+QUERY\\s+REWRITE\\b");

    private static final Pattern SCHEDULE = Pattern.compile("(?i)\\bSTART\\s+WITH\\b|\\bNEXT\\b");

    private static final Pattern KEYWORD = Pattern.compile("(?i)\\bMATERIALIZED\\s+VIEW\\b");

    @Override
    public int order() {
        return 300;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getDdlRules().isConvertMaterializedViews();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return KEYWORD.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        return SqlTextUtils.mapStatements(maskedSql, stmt -> convertStatement(stmt, ctx, acc));
    }

    private String convertStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        Matcher create = CREATE_MV.matcher(stmt);
        if (create.find()) {
            int as = SqlTextUtils.findTopLevelKeyword(stmt, "AS", create.end());
            if (as < 0) {
                warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "无法识别物化视图的查询部分", "请人工转换", ctx, stmt);
                return stmt;
            }
            String name = create.group(1);
            String columns = create.group(2) == null ? "" : create.group(2);
            String options = stmt.substring(create.end(), as);
            String query = stmt.substring(as + 2).trim();
            return keepLead(stmt, convertCreate(name, columns, options, query, stmt, ctx, acc));
        }
        Matcher refresh = REFRESH_MV.matcher(stmt);
        if (refresh.find()) {
            return keepLead(stmt, convertRefresh(refresh.group(2), stmt, ctx, acc));
        }
        Matcher drop = DROP_MV.matcher(stmt);
        if (drop.find()) {
            String name = drop.group(2);
            if (to(ctx, Dialect.MYSQL)) {
                acc.addRule("DROP MATERIALIZED VIEW -> DROP TABLE + DROP PROCEDURE");
                return keepLead(stmt, "DROP TABLE IF EXISTS " + name + ";\nDROP PROCEDURE IF EXISTS " + refreshProcedure(name));
            }
            if (to(ctx, Dialect.ORACLE) && drop.group(1) != null) {
                acc.addRule("DROP MATERIALIZED VIEW IF EXISTS -> DROP MATERIALIZED VIEW");
                return keepLead(stmt, "DROP MATERIALIZED VIEW " + name);
            }
            return stmt;
        }
        if (ALTER_MV.matcher(stmt).find()) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "ALTER MATERIALIZED VIEW 的选项在各库差异较大，未转换",
                    "请人工核对", ctx, stmt);
        }
        return stmt;
    }

    private String convertCreate(String name, String columns, String options, String query, String stmt,
                                 ConversionContext ctx, ConversionAccumulator acc) {
        Matcher withData = WITH_DATA.matcher(query);
        boolean noData = false;
        if (withData.find()) {
            noData = withData.group(1) != null;
            query = query.substring(0, withData.start());
        }
        if (BUILD_DEFERRED.matcher(options).find()) {
            noData = true;
        }
        if (to(ctx, Dialect.MYSQL)) {
            warn(acc, WarningType.PARTIAL_SUPPORT, "MySQL 没有物化视图，已改为基表加全量刷新存储过程 " + refreshProcedure(name),
                    "刷新调度需由外部任务或 EVENT 负责", ctx, stmt);
            acc.addRule("Materialized view -> table + refresh procedure");
            String table = "CREATE TABLE " + name + columns + " AS " + query + (noData ? " LIMIT 0" : "");
            return table + ";\nCREATE PROCEDURE " + refreshProcedure(name) + "() BEGIN TRUNCATE TABLE " + name
                    + "; INSERT INTO " + name + " " + query + "; END";
        }
        if (to(ctx, Dialect.POSTGRESQL)) {
            if (ON_COMMIT.matcher(options).find()) {
                warn(acc, WarningType.UNSUPPORTED_FUNCTION, "PostgreSQL 物化视图不支持 ON COMMIT 刷新",
                        "请在相关事务后执行 REFRESH MATERIALIZED VIEW 或使用触发器", ctx, stmt);
            }
            if (REFRESH_FAST.matcher(options).find()) {
                warn(acc, WarningType.PARTIAL_SUPPORT, "PostgreSQL 只支持全量刷新，REFRESH FAST 已忽略",
                        "如需并发刷新可建唯一索引后使用 REFRESH MATERIALIZED VIEW CONCURRENTLY", ctx, stmt);
            }
            if (QUERY_REWRITE.matcher(options).find()) {
                info(acc, WarningType.SYNTAX_DIFFERENCE, "PostgreSQL 不支持查询重写，QUERY REWRITE 选项已移除", null, ctx, stmt);
            }
            if (SCHEDULE.matcher(options).find()) {
                warn(acc, WarningType.PARTIAL_SUPPORT, "定时刷新 START WITH / NEXT 已移除", "请使用 pg_cron 等外部调度", ctx, stmt);
            }
            acc.addRule("Materialized view options -> PostgreSQL");
            return "CREATE MATERIALIZED VIEW " + name + columns + " AS " + query + (noData ? " WITH NO DATA" : " WITH DATA");
        }
        acc.addRule("Materialized view options -> Oracle");
        return "CREATE MATERIALIZED VIEW " + name + columns + (noData ? " BUILD DEFERRED" : " BUILD IMMEDIATE")
                + " REFRESH COMPLETE ON DEMAND AS " + query;
    }

    private String convertRefresh(String name, String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        if (to(ctx, Dialect.MYSQL)) {
            acc.addRule("REFRESH MATERIALIZED VIEW -> CALL refresh procedure");
            return "CALL " + refreshProcedure(name) + "()";
        }
        if (to(ctx, Dialect.ORACLE)) {
            acc.addRule("REFRESH MATERIALIZED VIEW -> DBMS_MVIEW.REFRESH");
            return "CALL DBMS_MVIEW.REFRESH(" + ctx.addLiteral(SqlTextUtils.unqualify(name).replace("\"", "")) + ", "
                    + ctx.addLiteral("C") + ")";
        }
        return stmt;
    }

    static String refreshProcedure(String name) {
        String plain = SqlTextUtils.unqualify(name).replace("\"", "").replace("`", "");
        return plain + "_refresh";
    }
}
