package com.afsun.transpiler.core.mapping;

import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.mapping.DataTypeMappingRule.PrecisionHandling;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.afsun.transpiler.core.Dialect.MYSQL;
import static com.afsun.transpiler.core.Dialect.ORACLE;
import static com.afsun.transpiler.core.Dialect.POSTGRESQL;
import static com.afsun.transpiler.core.mapping.DataTypeCategory.DATETIME;
import static com.afsun.transpiler.core.mapping.DataTypeCategory.LOB;
import static com.afsun.transpiler.core.mapping.DataTypeCategory.NUMERIC;
import static com.afsun.transpiler.core.mapping.DataTypeCategory.OTHER;
import static com.afsun.transpiler.core.mapping.DataTypeCategory.STRING;
import static com.afsun.transpiler.core.mapping.DataTypeMappingRule.PrecisionHandling.DROP;
import static com.afsun.transpiler.core.mapping.DataTypeMappingRule.PrecisionHandling.PRESERVE;

/**
 * 数据类型映射表。每个方言组合内按源类型单词数、长度降序排列，保证多词类型优先匹配。
 *
 * @author afsun
 */
@Component
public class DataTypeMappingRegistry {

    /**
     * 类型名后可选的精度部分，如 (10, 2)、(100 BYTE)、(*, 0)
     */
    private static final String PRECISION = "(?:\\s*\\(([^()]*)\\))?";

    private final Map<DialectPair, List<CompiledRule>> rules;

    public DataTypeMappingRegistry() {
        Map<DialectPair, List<DataTypeMappingRule>> all = new HashMap<>();
        registerOracleToMySql(all);
        registerOracleToPostgres(all);
        registerMySqlToOracle(all);
        registerMySqlToPostgres(all);
        registerPostgresToOracle(all);
        registerPostgresToMySql(all);
        Map<DialectPair, List<CompiledRule>> compiled = new HashMap<>();
        for (Map.Entry<DialectPair, List<DataTypeMappingRule>> e : all.entrySet()) {
            List<CompiledRule> list = new ArrayList<>();
            for (DataTypeMappingRule r : e.getValue()) {
                list.add(new CompiledRule(r, compile(r.getSourceType())));
            }
            list.sort(Comparator.comparingInt((CompiledRule c) -> c.rule.getSourceType().split(" ").length)
                    .thenComparingInt(c -> c.rule.getSourceType().length())
                    .reversed());
            compiled.put(e.getKey(), Collections.unmodifiableList(list));
        }
        this.rules = Collections.unmodifiableMap(compiled);
    }

    /**
     * 多词类型的精度可能出现在第一个单词之后，如 TIMESTAMP(6) WITH TIME ZONE
     */
    private static Pattern compile(String sourceType) {
        String[] words = sourceType.split(" ");
        StringBuilder regex = new StringBuilder("(?i)").append(words[0]).append("\\b").append(PRECISION);
        for (int i = 1; i < words.length; i++) {
            regex.append("\\s+").append(words[i]);
        }
        if (words.length > 1) {
            regex.append("\\b").append(PRECISION);
        }
        return Pattern.compile(regex.toString());
    }

    public List<CompiledRule> rulesFor(Dialect source, Dialect target) {
        List<CompiledRule> list = rules.get(DialectPair.of(source, target));
        return list == null ? Collections.<CompiledRule>emptyList() : list;
    }

    public DataTypeMappingRule find(Dialect source, Dialect target, String typeName) {
        for (CompiledRule c : rulesFor(source, target)) {
            if (c.rule.getSourceType().equalsIgnoreCase(typeName.trim().replaceAll("\\s+", " "))) {
                return c.rule;
            }
        }
        return null;
    }

    /**
     * 规则与其源类型正则
     */
    public static final class CompiledRule {
        private final DataTypeMappingRule rule;
        private final Pattern pattern;

        CompiledRule(DataTypeMappingRule rule, Pattern pattern) {
            this.rule = rule;
            this.pattern = pattern;
        }

        public DataTypeMappingRule getRule() {
            return rule;
        }

        public Pattern getPattern() {
            return pattern;
        }
    }

    private static void registerOracleToMySql(Map<DialectPair, List<DataTypeMappingRule>> all) {
        List<DataTypeMappingRule> t = table(all, ORACLE, MYSQL);
        t.add(type(ORACLE, MYSQL, "NUMBER", "DECIMAL", PRESERVE, NUMERIC));
        t.add(type(ORACLE, MYSQL, "BINARY_DOUBLE", "DOUBLE", DROP, NUMERIC));
        t.add(type(ORACLE, MYSQL, "BINARY_FLOAT", "FLOAT", DROP, NUMERIC));
        t.add(type(ORACLE, MYSQL, "FLOAT", "DOUBLE", DROP, NUMERIC));
        t.add(type(ORACLE, MYSQL, "VARCHAR2", "VARCHAR", PRESERVE, STRING));
        t.add(type(ORACLE, MYSQL, "NVARCHAR2", "VARCHAR", PRESERVE, STRING));
        t.add(type(ORACLE, MYSQL, "NCHAR", "CHAR", PRESERVE, STRING));
        t.add(type(ORACLE, MYSQL, "DATE", "DATETIME", DROP, DATETIME));
        t.add(type(ORACLE, MYSQL, "TIMESTAMP", "DATETIME", PRESERVE, DATETIME));
        t.add(warned(type(ORACLE, MYSQL, "TIMESTAMP WITH TIME ZONE", "DATETIME", PRESERVE, DATETIME),
                "MySQL DATETIME 不保存时区信息"));
        t.add(warned(type(ORACLE, MYSQL, "TIMESTAMP WITH LOCAL TIME ZONE", "TIMESTAMP", PRESERVE, DATETIME),
                "MySQL TIMESTAMP 按会话时区换算，取值范围为 1970-2038"));
        t.add(type(ORACLE, MYSQL, "CLOB", "LONGTEXT", DROP, LOB));
        t.add(type(ORACLE, MYSQL, "NCLOB", "LONGTEXT", DROP, LOB));
        t.add(type(ORACLE, MYSQL, "BLOB", "LONGBLOB", DROP, LOB));
        t.add(type(ORACLE, MYSQL, "LONG RAW", "LONGBLOB", DROP, LOB));
        t.add(type(ORACLE, MYSQL, "LONG", "LONGTEXT", DROP, LOB));
        t.add(type(ORACLE, MYSQL, "RAW", "VARBINARY", PRESERVE, OTHER));
        t.add(type(ORACLE, MYSQL, "XMLTYPE", "LONGTEXT", DROP, OTHER));
        t.add(warned(type(ORACLE, MYSQL, "BFILE", "VARCHAR(255)", DROP, OTHER),
                "BFILE 外部文件引用被降级为路径字符串"));
        t.add(type(ORACLE, MYSQL, "ROWID", "VARCHAR(18)", DROP, OTHER));
    }

    private static void registerOracleToPostgres(Map<DialectPair, List<DataTypeMappingRule>> all) {
        List<DataTypeMappingRule> t = table(all, ORACLE, POSTGRESQL);
        t.add(type(ORACLE, POSTGRESQL, "NUMBER", "NUMERIC", PRESERVE, NUMERIC));
        t.add(type(ORACLE, POSTGRESQL, "BINARY_DOUBLE", "DOUBLE PRECISION", DROP, NUMERIC));
        t.add(type(ORACLE, POSTGRESQL, "BINARY_FLOAT", "REAL", DROP, NUMERIC));
        t.add(type(ORACLE, POSTGRESQL, "FLOAT", "DOUBLE PRECISION", DROP, NUMERIC));
        t.add(type(ORACLE, POSTGRESQL, "VARCHAR2", "VARCHAR", PRESERVE, STRING));
        t.add(type(ORACLE, POSTGRESQL, "NVARCHAR2", "VARCHAR", PRESERVE, STRING));
        t.add(type(ORACLE, POSTGRESQL, "NCHAR", "CHAR", PRESERVE, STRING));
        t.add(type(ORACLE, POSTGRESQL, "DATE", "TIMESTAMP(0)", DROP, DATETIME));
        t.add(type(ORACLE, POSTGRESQL, "TIMESTAMP WITH TIME ZONE", "TIMESTAMPTZ", PRESERVE, DATETIME));
        t.add(type(ORACLE, POSTGRESQL, "TIMESTAMP WITH LOCAL TIME ZONE", "TIMESTAMPTZ", PRESERVE, DATETIME));
        t.add(type(ORACLE, POSTGRESQL, "CLOB", "TEXT", DROP, LOB));
        t.add(type(ORACLE, POSTGRESQL, "NCLOB", "TEXT", DROP, LOB));
        t.add(type(ORACLE, POSTGRESQL, "BLOB", "BYTEA", DROP, LOB));
        t.add(type(ORACLE, POSTGRESQL, "LONG RAW", "BYTEA", DROP, LOB));
        t.add(type(ORACLE, POSTGRESQL, "LONG", "TEXT", DROP, LOB));
        t.add(type(ORACLE, POSTGRESQL, "RAW", "BYTEA", DROP, OTHER));
        t.add(type(ORACLE, POSTGRESQL, "XMLTYPE", "XML", DROP, OTHER));
        t.add(warned(type(ORACLE, POSTGRESQL, "BFILE", "VARCHAR(255)", DROP, OTHER),
                "BFILE 外部文件引用被降级为路径字符串"));
        t.add(type(ORACLE, POSTGRESQL, "ROWID", "VARCHAR(18)", DROP, OTHER));
    }

    private static void registerMySqlToOracle(Map<DialectPair, List<DataTypeMappingRule>> all) {
        List<DataTypeMappingRule> t = table(all, MYSQL, ORACLE);
        t.add(type(MYSQL, ORACLE, "TINYINT", "NUMBER(3)", DROP, NUMERIC));
        t.add(type(MYSQL, ORACLE, "SMALLINT", "NUMBER(5)", DROP, NUMERIC));
        t.add(type(MYSQL, ORACLE, "MEDIUMINT", "NUMBER(7)", DROP, NUMERIC));
        t.add(type(MYSQL, ORACLE, "INT", "NUMBER(10)", DROP, NUMERIC));
        t.add(type(MYSQL, ORACLE, "INTEGER", "NUMBER(10)", DROP, NUMERIC));
        t.add(type(MYSQL, ORACLE, "BIGINT", "NUMBER(19)", DROP, NUMERIC));
        t.add(type(MYSQL, ORACLE, "DECIMAL", "NUMBER", PRESERVE, NUMERIC));
        t.add(type(MYSQL, ORACLE, "NUMERIC", "NUMBER", PRESERVE, NUMERIC));
        t.add(type(MYSQL, ORACLE, "DOUBLE", "BINARY_DOUBLE", DROP, NUMERIC));
        t.add(type(MYSQL, ORACLE, "FLOAT", "BINARY_FLOAT", DROP, NUMERIC));
        t.add(type(MYSQL, ORACLE, "BOOLEAN", "NUMBER(1)", DROP, NUMERIC));
        t.add(type(MYSQL, ORACLE, "BOOL", "NUMBER(1)", DROP, NUMERIC));
        t.add(type(MYSQL, ORACLE, "VARCHAR", "VARCHAR2", PRESERVE, STRING));
        t.add(type(MYSQL, ORACLE, "TINYTEXT", "VARCHAR2(255)", DROP, STRING));
        t.add(type(MYSQL, ORACLE, "TEXT", "CLOB", DROP, LOB));
        t.add(type(MYSQL, ORACLE, "MEDIUMTEXT", "CLOB", DROP, LOB));
        t.add(type(MYSQL, ORACLE, "LONGTEXT", "CLOB", DROP, LOB));
        t.add(type(MYSQL, ORACLE, "TINYBLOB", "BLOB", DROP, LOB));
        t.add(type(MYSQL, ORACLE, "MEDIUMBLOB", "BLOB", DROP, LOB));
        t.add(type(MYSQL, ORACLE, "LONGBLOB", "BLOB", DROP, LOB));
        t.add(type(MYSQL, ORACLE, "VARBINARY", "RAW", PRESERVE, OTHER));
        t.add(type(MYSQL, ORACLE, "DATETIME", "TIMESTAMP", PRESERVE, DATETIME));
        t.add(warned(type(MYSQL, ORACLE, "TIME", "VARCHAR2(8)", DROP, DATETIME),
                "Oracle 没有 TIME 类型，改为字符串保存"));
        t.add(type(MYSQL, ORACLE, "YEAR", "NUMBER(4)", DROP, DATETIME));
        t.add(warned(type(MYSQL, ORACLE, "JSON", "CLOB", DROP, OTHER),
                "JSON 列改为 CLOB，可加 IS JSON 检查约束"));
        t.add(warned(type(MYSQL, ORACLE, "ENUM", "VARCHAR2(255)", DROP, OTHER),
                "ENUM 取值约束丢失，请补充 CHECK 约束"));
        t.add(warned(type(MYSQL, ORACLE, "SET", "VARCHAR2(1000)", DROP, OTHER),
                "SET 取值约束丢失"));
    }

    private static void registerMySqlToPostgres(Map<DialectPair, List<DataTypeMappingRule>> all) {
        List<DataTypeMappingRule> t = table(all, MYSQL, POSTGRESQL);
        t.add(type(MYSQL, POSTGRESQL, "TINYINT", "SMALLINT", DROP, NUMERIC));
        t.add(type(MYSQL, POSTGRESQL, "SMALLINT", "SMALLINT", DROP, NUMERIC));
        t.add(type(MYSQL, POSTGRESQL, "MEDIUMINT", "INTEGER", DROP, NUMERIC));
        t.add(type(MYSQL, POSTGRESQL, "INT", "INTEGER", DROP, NUMERIC));
        t.add(type(MYSQL, POSTGRESQL, "INTEGER", "INTEGER", DROP, NUMERIC));
        t.add(type(MYSQL, POSTGRESQL, "BIGINT", "BIGINT", DROP, NUMERIC));
        t.add(type(MYSQL, POSTGRESQL, "DOUBLE", "DOUBLE PRECISION", DROP, NUMERIC));
        t.add(type(MYSQL, POSTGRESQL, "FLOAT", "REAL", DROP, NUMERIC));
        t.add(type(MYSQL, POSTGRESQL, "DATETIME", "TIMESTAMP", PRESERVE, DATETIME));
        t.add(type(MYSQL, POSTGRESQL, "YEAR", "SMALLINT", DROP, DATETIME));
        t.add(type(MYSQL, POSTGRESQL, "TINYTEXT", "TEXT", DROP, STRING));
        t.add(type(MYSQL, POSTGRESQL, "MEDIUMTEXT", "TEXT", DROP, LOB));
        t.add(type(MYSQL, POSTGRESQL, "LONGTEXT", "TEXT", DROP, LOB));
        t.add(type(MYSQL, POSTGRESQL, "TINYBLOB", "BYTEA", DROP, LOB));
        t.add(type(MYSQL, POSTGRESQL, "BLOB", "BYTEA", DROP, LOB));
        t.add(type(MYSQL, POSTGRESQL, "MEDIUMBLOB", "BYTEA", DROP, LOB));
        t.add(type(MYSQL, POSTGRESQL, "LONGBLOB", "BYTEA", DROP, LOB));
        t.add(type(MYSQL, POSTGRESQL, "BINARY", "BYTEA", DROP, OTHER));
        t.add(type(MYSQL, POSTGRESQL, "VARBINARY", "BYTEA", DROP, OTHER));
        t.add(type(MYSQL, POSTGRESQL, "JSON", "JSONB", DROP, OTHER));
        t.add(warned(type(MYSQL, POSTGRESQL, "ENUM", "VARCHAR(255)", DROP, OTHER),
                "ENUM 取值约束丢失，可改用 CREATE TYPE ... AS ENUM 或 CHECK 约束"));
        t.add(warned(type(MYSQL, POSTGRESQL, "SET", "TEXT[]", DROP, OTHER),
                "SET 改为文本数组，取值约束丢失"));
    }

    private static void registerPostgresToOracle(Map<DialectPair, List<DataTypeMappingRule>> all) {
        List<DataTypeMappingRule> t = table(all, POSTGRESQL, ORACLE);
        t.add(type(POSTGRESQL, ORACLE, "SMALLINT", "NUMBER(5)", DROP, NUMERIC));
        t.add(type(POSTGRESQL, ORACLE, "INTEGER", "NUMBER(10)", DROP, NUMERIC));
        t.add(type(POSTGRESQL, ORACLE, "INT", "NUMBER(10)", DROP, NUMERIC));
        t.add(type(POSTGRESQL, ORACLE, "BIGINT", "NUMBER(19)", DROP, NUMERIC));
        t.add(type(POSTGRESQL, ORACLE, "NUMERIC", "NUMBER", PRESERVE, NUMERIC));
        t.add(type(POSTGRESQL, ORACLE, "DECIMAL", "NUMBER", PRESERVE, NUMERIC));
        t.add(type(POSTGRESQL, ORACLE, "DOUBLE PRECISION", "BINARY_DOUBLE", DROP, NUMERIC));
        t.add(type(POSTGRESQL, ORACLE, "REAL", "BINARY_FLOAT", DROP, NUMERIC));
        t.add(type(POSTGRESQL, ORACLE, "BOOLEAN", "NUMBER(1)", DROP, NUMERIC));
        t.add(type(POSTGRESQL, ORACLE, "CHARACTER VARYING", "VARCHAR2", PRESERVE, STRING));
        t.add(type(POSTGRESQL, ORACLE, "VARCHAR", "VARCHAR2", PRESERVE, STRING));
        t.add(type(POSTGRESQL, ORACLE, "TEXT", "CLOB", DROP, LOB));
        t.add(type(POSTGRESQL, ORACLE, "BYTEA", "BLOB", DROP, LOB));
        t.add(type(POSTGRESQL, ORACLE, "TIMESTAMPTZ", "TIMESTAMP WITH TIME ZONE", DROP, DATETIME));
        t.add(type(POSTGRESQL, ORACLE, "TIMESTAMP WITH TIME ZONE", "TIMESTAMP WITH TIME ZONE", PRESERVE, DATETIME));
        t.add(type(POSTGRESQL, ORACLE, "TIMESTAMP WITHOUT TIME ZONE", "TIMESTAMP", PRESERVE, DATETIME));
        t.add(warned(type(POSTGRESQL, ORACLE, "TIME", "VARCHAR2(8)", DROP, DATETIME),
                "Oracle 没有 TIME 类型，改为字符串保存"));
        t.add(type(POSTGRESQL, ORACLE, "JSONB", "CLOB", DROP, OTHER));
        t.add(type(POSTGRESQL, ORACLE, "JSON", "CLOB", DROP, OTHER));
        t.add(type(POSTGRESQL, ORACLE, "UUID", "RAW(16)", DROP, OTHER));
        t.add(type(POSTGRESQL, ORACLE, "XML", "XMLTYPE", DROP, OTHER));
    }

    private static void registerPostgresToMySql(Map<DialectPair, List<DataTypeMappingRule>> all) {
        List<DataTypeMappingRule> t = table(all, POSTGRESQL, MYSQL);
        t.add(type(POSTGRESQL, MYSQL, "CHARACTER VARYING", "VARCHAR", PRESERVE, STRING));
        t.add(type(POSTGRESQL, MYSQL, "TEXT", "LONGTEXT", DROP, LOB));
        t.add(type(POSTGRESQL, MYSQL, "BYTEA", "LONGBLOB", DROP, LOB));
        t.add(type(POSTGRESQL, MYSQL, "BOOLEAN", "TINYINT(1)", DROP, NUMERIC));
        t.add(type(POSTGRESQL, MYSQL, "NUMERIC", "DECIMAL", PRESERVE, NUMERIC));
        t.add(type(POSTGRESQL, MYSQL, "DOUBLE PRECISION", "DOUBLE", DROP, NUMERIC));
        t.add(type(POSTGRESQL, MYSQL, "REAL", "FLOAT", DROP, NUMERIC));
        t.add(type(POSTGRESQL, MYSQL, "TIMESTAMP", "DATETIME", PRESERVE, DATETIME));
        t.add(type(POSTGRESQL, MYSQL, "TIMESTAMP WITHOUT TIME ZONE", "DATETIME", PRESERVE, DATETIME));
        t.add(warned(type(POSTGRESQL, MYSQL, "TIMESTAMPTZ", "DATETIME", PRESERVE, DATETIME),
                "MySQL DATETIME 不保存时区信息"));
        t.add(warned(type(POSTGRESQL, MYSQL, "TIMESTAMP WITH TIME ZONE", "DATETIME", PRESERVE, DATETIME),
                "MySQL DATETIME 不保存时区信息"));
        t.add(type(POSTGRESQL, MYSQL, "JSONB", "JSON", DROP, OTHER));
        t.add(type(POSTGRESQL, MYSQL, "UUID", "CHAR(36)", DROP, OTHER));
        t.add(type(POSTGRESQL, MYSQL, "XML", "LONGTEXT", DROP, OTHER));
        t.add(warned(type(POSTGRESQL, MYSQL, "INET", "VARCHAR(45)", DROP, OTHER),
                "网络地址类型降级为字符串"));
    }

    private static List<DataTypeMappingRule> table(Map<DialectPair, List<DataTypeMappingRule>> all,
                                                   Dialect source, Dialect target) {
        return all.computeIfAbsent(DialectPair.of(source, target), k -> new ArrayList<>());
    }

    private static DataTypeMappingRule type(Dialect source, Dialect target, String from, String to,
                                            PrecisionHandling precision, DataTypeCategory category) {
        return DataTypeMappingRule.builder()
                .source(source)
                .target(target)
                .sourceType(from)
                .targetType(to)
                .precision(precision)
                .category(category)
                .build();
    }

    private static DataTypeMappingRule warned(DataTypeMappingRule rule, String warning) {
        return DataTypeMappingRule.builder()
                .source(rule.getSource())
                .target(rule.getTarget())
                .sourceType(rule.getSourceType())
                .targetType(rule.getTargetType())
                .precision(rule.getPrecision())
                .category(rule.getCategory())
                .warningMessage(warning)
                .build();
    }
}
