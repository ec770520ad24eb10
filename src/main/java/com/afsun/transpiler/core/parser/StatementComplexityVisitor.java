package com.afsun.transpiler.core.parser;

import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.StatementComplexity;
import com.alibaba.druid.sql.ast.expr.SQLAggregateExpr;
import com.alibaba.druid.sql.ast.expr.SQLExistsExpr;
import com.alibaba.druid.sql.ast.expr.SQLInSubQueryExpr;
import com.alibaba.druid.sql.ast.expr.SQLMethodInvokeExpr;
import com.alibaba.druid.sql.ast.expr.SQLQueryExpr;
import com.alibaba.druid.sql.ast.statement.SQLJoinTableSource;
import com.alibaba.druid.sql.ast.statement.SQLSubqueryTableSource;
import com.alibaba.druid.sql.ast.statement.SQLWithSubqueryClause;
import com.alibaba.druid.sql.visitor.SQLASTVisitor;
import com.alibaba.druid.sql.visitor.SQLASTVisitorAdapter;

/**
 * 遍历 Druid AST 统计连接、子查询、函数、聚合、窗口函数与 CTE 数量
 * <p>
 * Druid 的方言节点要求对应方言的 visitor，按方言用 {@link #forDialect} 取实例
 *
 * @author afsun
 */
public class StatementComplexityVisitor extends SQLASTVisitorAdapter implements ComplexityVisitor {

    private final ComplexityCounter counter = new ComplexityCounter();

    public static ComplexityVisitor forDialect(Dialect dialect) {
        switch (dialect) {
            case ORACLE:
                return new OracleComplexityVisitor();
            case MYSQL:
                return new MySqlComplexityVisitor();
            case POSTGRESQL:
                return new PGComplexityVisitor();
            default:
                return new StatementComplexityVisitor();
        }
    }

    @Override
    public boolean visit(SQLJoinTableSource x) {
        return counter.join();
    }

    @Override
    public boolean visit(SQLSubqueryTableSource x) {
        return counter.subquery();
    }

    @Override
    public boolean visit(SQLInSubQueryExpr x) {
        return counter.subquery();
    }

    @Override
    public boolean visit(SQLExistsExpr x) {
        return counter.subquery();
    }

    @Override
    public boolean visit(SQLQueryExpr x) {
        return counter.subquery();
    }

    @Override
    public boolean visit(SQLMethodInvokeExpr x) {
        return counter.function();
    }

    @Override
    public boolean visit(SQLAggregateExpr x) {
        return counter.aggregate(x);
    }

    @Override
    public boolean visit(SQLWithSubqueryClause.Entry x) {
        return counter.cte();
    }

    @Override
    public SQLASTVisitor asVisitor() {
        return this;
    }

    @Override
    public StatementComplexity toComplexity(int statementCount) {
        return counter.toComplexity(statementCount);
    }
}
