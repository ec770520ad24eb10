package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.stereotype.Component;

/**
 * Oracle 层级查询 -> WITH RECURSIVE，LEVEL 改为生成的层级列
 *
 * @author afsun
 */
@Component
public class HierarchicalQueryConverter extends AbstractFeatureConverter {

    private final HierarchicalQueryRewriter rewriter;

    public HierarchicalQueryConverter(HierarchicalQueryRewriter rewriter) {
        this.rewriter = rewriter;
    }

    @Override
    public int order() {
        return 800;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getSyntaxRules().isConvertHierarchicalQuery();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return from(ctx, Dialect.ORACLE) && !to(ctx, Dialect.ORACLE) && rewriter.containsHierarchy(maskedSql);
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        return SqlTextUtils.mapStatements(maskedSql, stmt -> {
            if (!rewriter.containsHierarchy(stmt)) {
                return stmt;
            }
            HierarchicalQueryRewriter.Result result = rewriter.rewrite(stmt);
            if (!result.isRewritten()) {
                warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "层级查询无法自动改写: " + result.getReason(),
                        "请手工改写为 WITH RECURSIVE 递归查询", ctx, stmt);
                return stmt;
            }
            for (String note : result.getNotes()) {
                warn(acc, WarningType.PARTIAL_SUPPORT, note, null, ctx, stmt);
            }
            info(acc, WarningType.SYNTAX_DIFFERENCE, "CONNECT BY 已改写为 WITH RECURSIVE，LEVEL 对应列 "
                    + HierarchicalQueryRewriter.LEVEL_COLUMN, "请核对结果集顺序与列", ctx, stmt);
            return acc.apply("CONNECT BY -> WITH RECURSIVE", stmt, result.getSql());
        });
    }
}
