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
 * Oracle 数据库链接：建链语句改为目标库的外部数据访问模板注释，obj@link 引用打标记并告警
 *
 * @author afsun
 */
@Component
public class DatabaseLinkConverter extends AbstractFeatureConverter {

    private static final Pattern CREATE_LINK = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "CREATE\\s+(?:SHARED\\s+)?(?:PUBLIC\\s+)?DATABASE\\s+LINK\\s+(" + SqlPatterns.IDENT
                    + "(?:\\." + SqlPatterns.IDENT + ")*)(?:\\s+CONNECT\\s+TO\\s+(" + SqlPatterns.IDENT
                    + ")\\s+IDENTIFIED\\s+BY\\s+\\S+)?(?:\\s+USING\\s+(" + SqlPatterns.LITERAL + "))?");

    private static final Pattern DROP_LINK = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "DROP\\s+(?:PUBLIC\\s+)?DATABASE\\s+LINK\\b");

    private static final Pattern LINK_REFERENCE = Pattern.compile(
            "(" + SqlPatterns.QUALIFIED_IDENT + ")\\s*@\\s*(" + SqlPatterns.IDENT + "(?:\\." + SqlPatterns.IDENT + ")*)");

    private static final Pattern KEYWORD = Pattern.compile("(?i)\\bDATABASE\\s+LINK\\b|[\\w\"]\\s*@\\s*[A-Za-z\"]");

    @Override
    public int order() {
        return 200;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getDdlRules().isConvertDatabaseLinks();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return from(ctx, Dialect.ORACLE) && !to(ctx, Dialect.ORACLE) && KEYWORD.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        return SqlTextUtils.mapStatements(maskedSql, stmt -> convertStatement(stmt, ctx, acc));
    }

    private String convertStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        Matcher create = CREATE_LINK.matcher(stmt);
        if (create.find()) {
            String link = create.group(1);
            String user = create.group(2) == null ? "remote_user" : create.group(2);
            String tns = create.group(3) == null ? "remote_host" : ctx.literalValue(create.group(3));
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "数据库链接 " + link + " 已改为注释模板，需人工配置",
                    "请按模板补充连接参数与密码", ctx, stmt);
            acc.addRule("Database link -> " + (to(ctx, Dialect.POSTGRESQL) ? "postgres_fdw" : "FEDERATED") + " template");
            return keepLead(stmt, ctx.comment(template(link, user, tns, ctx.getTarget())));
        }
        if (DROP_LINK.matcher(stmt).find()) {
            acc.addRule("DROP DATABASE LINK commented out");
            return keepLead(stmt, ctx.comment(stmt.trim()));
        }
        return markReferences(stmt, ctx, acc);
    }

    private String markReferences(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        Matcher m = LINK_REFERENCE.matcher(stmt);
        StringBuffer sb = new StringBuffer(stmt.length());
        boolean found = false;
        while (m.find()) {
            found = true;
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED,
                    "对象 " + m.group(1) + " 通过数据库链接 " + m.group(2) + " 访问，目标库中需改为外部表",
                    to(ctx, Dialect.POSTGRESQL) ? "使用 postgres_fdw 的 IMPORT FOREIGN SCHEMA 导入远程表"
                            : "使用 FEDERATED 引擎建立本地映射表", ctx, m.group());
            String marked = m.group(1) + " " + ctx.comment("@" + m.group(2));
            m.appendReplacement(sb, Matcher.quoteReplacement(marked));
        }
        m.appendTail(sb);
        if (found) {
            acc.addRule("Database link reference marked");
        }
        return sb.toString();
    }

    private static String template(String link, String user, String tns, Dialect target) {
        String server = SqlTextUtils.unqualify(link).replace("\"", "");
        if (target == Dialect.POSTGRESQL) {
            return "postgres_fdw 模板:\n"
                    + "CREATE EXTENSION IF NOT EXISTS postgres_fdw;\n"
                    + "CREATE SERVER " + server + " FOREIGN DATA WRAPPER postgres_fdw OPTIONS (host '" + tns
                    + "', dbname 'remote_db');\n"
                    + "CREATE USER MAPPING FOR CURRENT_USER SERVER " + server + " OPTIONS (user '" + user
                    + "', password '******');\n"
                    + "IMPORT FOREIGN SCHEMA public FROM SERVER " + server + " INTO public;";
        }
        return "FEDERATED 引擎模板（需开启 federated 插件）:\n"
                + "CREATE SERVER " + server + " FOREIGN DATA WRAPPER mysql OPTIONS (HOST '" + tns + "', USER '" + user
                + "', PASSWORD '******', DATABASE 'remote_db');\n"
                + "CREATE TABLE local_table (...) ENGINE=FEDERATED CONNECTION='" + server + "/remote_table';";
    }
}
