package com.afsun.transpiler.core.parser;

import com.afsun.transpiler.core.StatementComplexity;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.alibaba.druid.sql.ast.SQLStatement;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 一次结构解析的结果
 *
 * @author afsun
 */
@Getter
public class ParseOutcome {

    private final List<SQLStatement> statements;

    /**
     * 复杂度统计失败时为 null
     */
    private final StatementComplexity complexity;

    private final SqlParseException error;

    private ParseOutcome(List<SQLStatement> statements, StatementComplexity complexity, SqlParseException error) {
        this.statements = statements;
        this.complexity = complexity;
        this.error = error;
    }

    public static ParseOutcome success(List<SQLStatement> statements, StatementComplexity complexity) {
        return new ParseOutcome(Collections.unmodifiableList(statements), complexity, null);
    }

    public static ParseOutcome failure(SqlParseException error) {
        return new ParseOutcome(Collections.<SQLStatement>emptyList(), null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public int getStatementCount() {
        return statements.size();
    }
}
