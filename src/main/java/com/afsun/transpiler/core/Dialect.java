package com.afsun.transpiler.core;

import com.afsun.transpiler.core.exceptions.UnsupportedDialectException;
import com.alibaba.druid.DbType;
import lombok.Getter;

import java.util.Locale;

/**
 * 支持互转的三种SQL方言
 *
 * @author afsun
 */
@Getter
public enum Dialect {

    ORACLE("Oracle", DbType.oracle, '"'),

    MYSQL("MySQL", DbType.mysql, '`'),

    POSTGRESQL("PostgreSQL", DbType.postgresql, '"');

    private final String displayName;

    /**
     * 结构解析时交给Druid的方言
     */
    private final DbType dbType;

    /**
     * 标识符引用符
     */
    private final char identifierQuote;

    Dialect(String displayName, DbType dbType, char identifierQuote) {
        this.displayName = displayName;
        this.dbType = dbType;
        this.identifierQuote = identifierQuote;
    }

    /**
     * 用本方言的引用符包裹标识符
     */
    public String quote(String identifier) {
        return identifierQuote + identifier + identifierQuote;
    }

    public static Dialect fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new UnsupportedDialectException("方言名称不能为空");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "oracle":
                return ORACLE;
            case "mysql":
                return MYSQL;
            case "postgres":
            case "postgresql":
            case "pg":
                return POSTGRESQL;
            default:
                throw new UnsupportedDialectException("不支持的方言: {}", name);
        }
    }
}
