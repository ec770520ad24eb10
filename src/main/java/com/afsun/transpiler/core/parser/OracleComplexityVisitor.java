package com.afsun.transpiler.core.parser;

import com.afsun.transpiler.core.StatementComplexity;
import com.alibaba.druid.sql.ast.expr.SQLAggregateExpr;
import com.alibaba.druid.sql.ast.expr.SQLExistsExpr;
import com.alibaba.druid.sql.ast.expr.SQLInSubQueryExpr;
import com.alibaba.druid.sql.ast.expr.SQLMethodInvokeExpr;
import com.alibaba.druid.sql.ast.expr.SQLQueryExpr;
import com.alibaba.druid.sql.ast.statement.SQLJoinTableSource;
import com.alibaba.druid.sql.ast.statement.SQLSubqueryTableSource;
import com.alibaba.druid.sql.ast.statement.SQLWithSubqueryClause;
import com.alibaba.druid.sql.dialect.oracle.ast.clause.OracleWithSubqueryEntry;
import com.alibaba.druid.sql.dialect.oracle.ast.stmt.OracleSelectJoin;
import com.alibaba.druid.sql.dialect.oracle.ast.stmt.OracleSelectSubqueryTableSource;
import com.alibaba.druid.sql.dialect.oracle.visitor.OracleASTVisitorAdapter;
import com.alibaba.druid.sql.visitor.SQLASTVisitor;

/**
 * Oracle 方言节点的复杂度统计
 */
class OracleComplexityVisitor extends OracleASTVisitorAdapter implements ComplexityVisitor {

    private final ComplexityCounter counter = new ComplexityCounter();

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
    public boolean visit(OracleSelectJoin x) {
        return counter.join();
    }

    @Override
    public boolean visit(OracleSelectSubqueryTableSource x) {
        return counter.subquery();
    }

    @Override
    public boolean visit(OracleWithSubqueryEntry x) {
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
