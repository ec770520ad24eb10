package com.afsun.transpiler.core.recovery.strategy;

import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.afsun.transpiler.core.feature.HierarchicalQueryRewriter;
import com.afsun.transpiler.core.recovery.AbstractRecoveryStrategy;
import com.afsun.transpiler.core.recovery.RecoveryAttempt;
import com.afsun.transpiler.core.util.MaskedSql;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 把 CONNECT BY 层级查询改写为 WITH RECURSIVE；无法改写的语句前加一段改写模板注释
 *
 * @author afsun
 */
@Component
public class HierarchicalRewriteStrategy extends AbstractRecoveryStrategy {

    static final String TEMPLATE = "/* CONNECT BY 需改写为递归 CTE:\n"
            + " * WITH RECURSIVE cte AS (\n"
            + " *     SELECT ... FROM t WHERE <START WITH 条件>\n"
            + " *     UNION ALL\n"
            + " *     SELECT ... FROM t JOIN cte ON <CONNECT BY 条件>\n"
            + " * )\n"
            + " * SELECT * FROM cte\n"
            + " */\n";

    private final HierarchicalQueryRewriter rewriter;

    public HierarchicalRewriteStrategy() {
        this(new HierarchicalQueryRewriter());
    }

    @Autowired
    public HierarchicalRewriteStrategy(HierarchicalQueryRewriter rewriter) {
        super("hierarchical rewrite", 0.50);
        this.rewriter = rewriter;
    }

    @Override
    public boolean canHandle(String sql, SqlParseException error) {
        return rewriter.containsHierarchy(MaskedSql.mask(sql, null).getText());
    }

    @Override
    public RecoveryAttempt recover(String sql, SqlParseException error, Dialect dialect) {
        MaskedSql masked = MaskedSql.mask(sql, dialect);
        List<String> reasons = new ArrayList<>();
        String text = SqlTextUtils.mapStatements(masked.getText(), stmt -> {
            if (!rewriter.containsHierarchy(stmt)) {
                return stmt;
            }
            HierarchicalQueryRewriter.Result result = rewriter.rewrite(stmt);
            if (result.isRewritten()) {
                return result.getSql();
            }
            reasons.add(result.getReason());
            int lead = 0;
            while (lead < stmt.length() && Character.isWhitespace(stmt.charAt(lead))) {
                lead++;
            }
            return stmt.substring(0, lead) + masked.addComment(TEMPLATE.trim()) + "\n" + stmt.substring(lead);
        });
        ConversionWarning warning = reasons.isEmpty()
                ? ConversionWarning.of(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.WARNING,
                "CONNECT BY 已改写为 WITH RECURSIVE", "请核对结果集顺序与层级列")
                : ConversionWarning.of(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.WARNING,
                "层级查询无法自动改写: " + String.join("; ", reasons), "已在语句前附上递归 CTE 改写模板，请手工改写");
        return attempt(sql, masked.restore(text), warning);
    }
}
