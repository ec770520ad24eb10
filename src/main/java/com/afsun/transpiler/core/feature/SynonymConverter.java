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
 * Oracle 同义词：MySQL / PostgreSQL 以视图模拟
 *
 * @author afsun
 */
@Component
public class SynonymConverter extends AbstractFeatureConverter {

    private static final Pattern CREATE_SYNONYM = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "CREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:EDITIONABLE\\s+|NONEDITIONABLE\\s+)?(PUBLIC\\s+)?SYNONYM\\s+("
                    + SqlPatterns.QUALIFIED_IDENT + ")\\s+FOR\\s+(" + SqlPatterns.QUALIFIED_IDENT + ")(?:\\s*@\\s*("
                    + SqlPatterns.IDENT + "(?:\\." + SqlPatterns.IDENT + ")*))?\\s*$");

    private static final Pattern DROP_SYNONYM = Pattern.compile(
            "(?is)" + SqlPatterns.LEAD + "DROP\\s+(?:PUBLIC\\s+)?SYNONYM\\s+(" + SqlPatterns.QUALIFIED_IDENT + ")(?:\\s+FORCE)?\\s*$");

    private static final Pattern KEYWORD = Pattern.compile("(?i)\\bSYNONYM\\b");

    @Override
    public int order() {
        return 100;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getDdlRules().isConvertSynonyms();
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
        Matcher create = CREATE_SYNONYM.matcher(stmt);
        if (create.find()) {
            String synonym = create.group(2);
            String object = create.group(3);
            if (create.group(4) != null) {
                warn(acc, WarningType.MANUAL_REVIEW_NEEDED,
                        "同义词 " + synonym + " 指向数据库链接 " + create.group(4) + " 上的对象，无法自动迁移",
                        ctx.getTarget() == Dialect.POSTGRESQL ? "可用 postgres_fdw 外部表代替" : "可用 FEDERATED 表代替",
                        ctx, stmt);
                acc.addRule("Synonym over database link -> manual stub");
                return keepLead(stmt, ctx.comment("需人工迁移: " + stmt.trim()));
            }
            if (create.group(1) != null) {
                info(acc, WarningType.SYNTAX_DIFFERENCE, "PUBLIC 同义词改为当前 schema 下的视图", null, ctx, stmt);
            }
            info(acc, WarningType.PARTIAL_SUPPORT, "同义词 " + synonym + " 以视图模拟，仅适用于查询",
                    "如需对基表执行DML，请直接引用 " + object, ctx, stmt);
            acc.addRule("Synonym -> VIEW");
            return keepLead(stmt, "CREATE OR REPLACE VIEW " + synonym + " AS SELECT * FROM " + object);
        }
        Matcher drop = DROP_SYNONYM.matcher(stmt);
        if (drop.find()) {
            acc.addRule("DROP SYNONYM -> DROP VIEW");
            return keepLead(stmt, "DROP VIEW IF EXISTS " + drop.group(1));
        }
        return stmt;
    }
}
