package com.afsun.transpiler.core.parser;

import com.afsun.transpiler.core.StatementComplexity;
import com.alibaba.druid.sql.ast.expr.SQLAggregateExpr;

/**
 * 复杂度计数，供各方言的 AST visitor 共用
 *
 * @author afsun
 */
class ComplexityCounter {

    private int joinCount;
    private int subqueryCount;
    private int functionCount;
    private int aggregateCount;
    private int windowFunctionCount;
    private int cteCount;

    boolean join() {
        joinCount++;
        return true;
    }

    boolean subquery() {
        subqueryCount++;
        return true;
    }

    boolean function() {
        functionCount++;
        return true;
    }

    /**
     * 带 OVER 子句的聚合计为窗口函数
     */
    boolean aggregate(SQLAggregateExpr x) {
        if (x.getOver() != null) {
            windowFunctionCount++;
        } else {
            aggregateCount++;
        }
        return true;
    }

    boolean cte() {
        cteCount++;
        return true;
    }

    StatementComplexity toComplexity(int statementCount) {
        return StatementComplexity.builder()
                .statementCount(statementCount)
                .joinCount(joinCount)
                .subqueryCount(subqueryCount)
                .functionCount(functionCount)
                .aggregateCount(aggregateCount)
                .windowFunctionCount(windowFunctionCount)
                .cteCount(cteCount)
                .build();
    }
}
