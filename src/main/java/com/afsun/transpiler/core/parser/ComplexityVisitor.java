package com.afsun.transpiler.core.parser;

import com.afsun.transpiler.core.StatementComplexity;
import com.alibaba.druid.sql.visitor.SQLASTVisitor;

/**
 * 复杂度统计 visitor
 */
public interface ComplexityVisitor {

    SQLASTVisitor asVisitor();

    StatementComplexity toComplexity(int statementCount);
}
