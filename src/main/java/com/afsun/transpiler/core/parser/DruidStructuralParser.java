package com.afsun.transpiler.core.parser;

import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.StatementComplexity;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.afsun.transpiler.core.util.SqlTextUtils;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.parser.ParserException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于 Druid 的结构解析器
 *
 * @author afsun
 */
@Slf4j
@Component
public class DruidStructuralParser implements StructuralParser {

    /**
     * Druid 异常信息中的位置，如 "pos 27, line 1, column 22"
     */
    private static final Pattern POSITION = Pattern.compile("line (\\d+), column (\\d+)");

    @Override
    public ParseOutcome parse(String sql, Dialect dialect) {
        List<SQLStatement> statements;
        try {
            statements = SQLUtils.parseStatements(sql, dialect.getDbType());
        } catch (ParserException e) {
            log.warn("SQL结构解析失败, dialect={}: {}", dialect, e.getMessage());
            return ParseOutcome.failure(toParseException(e.getMessage(), sql));
        } catch (RuntimeException e) {
            // Druid 对部分非法输入抛出非 ParserException 的运行时异常
            log.warn("SQL结构解析异常, dialect={}: {}", dialect, e.toString());
            return ParseOutcome.failure(toParseException(String.valueOf(e.getMessage()), sql));
        }
        return ParseOutcome.success(statements, complexityOf(statements, dialect));
    }

    private StatementComplexity complexityOf(List<SQLStatement> statements, Dialect dialect) {
        try {
            ComplexityVisitor visitor = StatementComplexityVisitor.forDialect(dialect);
            for (SQLStatement statement : statements) {
                statement.accept(visitor.asVisitor());
            }
            return visitor.toComplexity(statements.size());
        } catch (RuntimeException e) {
            log.warn("复杂度统计失败，忽略: {}", e.getMessage());
            return null;
        }
    }

    static SqlParseException toParseException(String message, String sql) {
        int line = -1;
        int column = -1;
        if (message != null) {
            Matcher m = POSITION.matcher(message);
            if (m.find()) {
                line = Integer.parseInt(m.group(1));
                column = Integer.parseInt(m.group(2));
            }
        }
        return new SqlParseException(message, line, column, fragmentAt(sql, line));
    }

    /**
     * 取出错行的文本作为SQL片段
     */
    private static String fragmentAt(String sql, int line) {
        if (sql == null) {
            return null;
        }
        if (line > 0) {
            String[] lines = sql.split("\\r?\\n", -1);
            if (line <= lines.length) {
                return SqlTextUtils.shortSql(lines[line - 1]);
            }
        }
        return SqlTextUtils.shortSql(sql);
    }
}
