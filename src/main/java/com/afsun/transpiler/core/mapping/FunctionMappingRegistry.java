package com.afsun.transpiler.core.mapping;

import com.afsun.transpiler.core.Dialect;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static com.afsun.transpiler.core.Dialect.MYSQL;
import static com.afsun.transpiler.core.Dialect.ORACLE;
import static com.afsun.transpiler.core.Dialect.POSTGRESQL;
import static com.afsun.transpiler.core.mapping.FunctionCategory.CONDITIONAL;
import static com.afsun.transpiler.core.mapping.FunctionCategory.DATE;
import static com.afsun.transpiler.core.mapping.FunctionCategory.NULL_HANDLING;
import static com.afsun.transpiler.core.mapping.FunctionCategory.NUMERIC;
import static com.afsun.transpiler.core.mapping.FunctionCategory.STRING;
import static com.afsun.transpiler.core.mapping.FunctionCategory.SYSTEM;
import static com.afsun.transpiler.core.mapping.ParameterTransform.CAST;
import static com.afsun.transpiler.core.mapping.ParameterTransform.DATE_FORMAT_CONVERT;
import static com.afsun.transpiler.core.mapping.ParameterTransform.DIRECT;
import static com.afsun.transpiler.core.mapping.ParameterTransform.SWAP_FIRST_TWO;
import static com.afsun.transpiler.core.mapping.ParameterTransform.TO_CASE_WHEN;

/**
 * 函数映射表，按 (源方言, 目标方言) 分组，构造完成后只读。
 * <p>
 * 聚合类的 LISTAGG / GROUP_CONCAT / STRING_AGG 以及日期运算函数由对应的特性转换器处理，不在此表中。
 *
 * @author afsun
 */
@Component
public class FunctionMappingRegistry {

    private final Map<DialectPair, Map<String, FunctionMappingRule>> rules;

    public FunctionMappingRegistry() {
        Map<DialectPair, Map<String, FunctionMappingRule>> all = new HashMap<>();
        registerOracleToMySql(all);
        registerOracleToPostgres(all);
        registerMySqlToOracle(all);
        registerMySqlToPostgres(all);
        registerPostgresToOracle(all);
        registerPostgresToMySql(all);
        Map<DialectPair, Map<String, FunctionMappingRule>> frozen = new HashMap<>();
        for (Map.Entry<DialectPair, Map<String, FunctionMappingRule>> e : all.entrySet()) {
            frozen.put(e.getKey(), Collections.unmodifiableMap(e.getValue()));
        }
        this.rules = Collections.unmodifiableMap(frozen);
    }

    public FunctionMappingRule find(Dialect source, Dialect target, String function) {
        Map<String, FunctionMappingRule> table = rules.get(DialectPair.of(source, target));
        if (table == null || function == null) {
            return null;
        }
        return table.get(function.toUpperCase(Locale.ROOT));
    }

    public Collection<FunctionMappingRule> rulesFor(Dialect source, Dialect target) {
        Map<String, FunctionMappingRule> table = rules.get(DialectPair.of(source, target));
        return table == null ? Collections.<FunctionMappingRule>emptyList() : table.values();
    }

    private static void registerOracleToMySql(Map<DialectPair, Map<String, FunctionMappingRule>> all) {
        Map<String, FunctionMappingRule> t = table(all, ORACLE, MYSQL);
        add(t, rule(ORACLE, MYSQL, "NVL", "IFNULL", DIRECT, NULL_HANDLING));
        add(t, rule(ORACLE, MYSQL, "NVL2", "CASE", TO_CASE_WHEN, NULL_HANDLING));
        add(t, rule(ORACLE, MYSQL, "DECODE", "CASE", TO_CASE_WHEN, CONDITIONAL));
        add(t, rule(ORACLE, MYSQL, "TO_CHAR", "DATE_FORMAT", DATE_FORMAT_CONVERT, DATE));
        add(t, rule(ORACLE, MYSQL, "TO_DATE", "STR_TO_DATE", DATE_FORMAT_CONVERT, DATE));
        add(t, rule(ORACLE, MYSQL, "TO_TIMESTAMP", "STR_TO_DATE", DATE_FORMAT_CONVERT, DATE));
        add(t, rule(ORACLE, MYSQL, "SUBSTR", "SUBSTRING", DIRECT, STRING));
        add(t, limited(rule(ORACLE, MYSQL, "INSTR", "LOCATE", SWAP_FIRST_TWO, STRING), 3));
        add(t, rule(ORACLE, MYSQL, "LENGTH", "CHAR_LENGTH", DIRECT, STRING));
        add(t, rule(ORACLE, MYSQL, "LENGTHB", "LENGTH", DIRECT, STRING));
        add(t, rule(ORACLE, MYSQL, "CHR", "CHAR", DIRECT, STRING));
        add(t, rule(ORACLE, MYSQL, "TO_NUMBER", "DECIMAL(38,10)", CAST, NUMERIC));
        add(t, rule(ORACLE, MYSQL, "SYS_GUID", "UUID", DIRECT, SYSTEM));
        add(t, unsupported(ORACLE, MYSQL, "INITCAP", STRING, "MySQL 没有 INITCAP，需要自定义函数实现首字母大写"));
        add(t, unsupported(ORACLE, MYSQL, "NLSSORT", STRING, "MySQL 没有 NLSSORT，请改用 COLLATE 子句"));
        add(t, unsupported(ORACLE, MYSQL, "NUMTODSINTERVAL", DATE, "MySQL 没有 INTERVAL 数据类型，请改写为 DATE_ADD"));
    }

    private static void registerOracleToPostgres(Map<DialectPair, Map<String, FunctionMappingRule>> all) {
        Map<String, FunctionMappingRule> t = table(all, ORACLE, POSTGRESQL);
        add(t, rule(ORACLE, POSTGRESQL, "NVL", "COALESCE", DIRECT, NULL_HANDLING));
        add(t, rule(ORACLE, POSTGRESQL, "NVL2", "CASE", TO_CASE_WHEN, NULL_HANDLING));
        add(t, rule(ORACLE, POSTGRESQL, "DECODE", "CASE", TO_CASE_WHEN, CONDITIONAL));
        add(t, rule(ORACLE, POSTGRESQL, "TO_DATE", "TO_TIMESTAMP", DIRECT, DATE));
        add(t, limited(rule(ORACLE, POSTGRESQL, "INSTR", "STRPOS", DIRECT, STRING), 2));
        add(t, rule(ORACLE, POSTGRESQL, "LENGTHB", "OCTET_LENGTH", DIRECT, STRING));
        add(t, rule(ORACLE, POSTGRESQL, "TO_NUMBER", "NUMERIC", CAST, NUMERIC));
        add(t, rule(ORACLE, POSTGRESQL, "SYS_GUID", "GEN_RANDOM_UUID", DIRECT, SYSTEM));
        add(t, unsupported(ORACLE, POSTGRESQL, "NLSSORT", STRING, "PostgreSQL 没有 NLSSORT，请改用 COLLATE 子句"));
    }

    private static void registerMySqlToOracle(Map<DialectPair, Map<String, FunctionMappingRule>> all) {
        Map<String, FunctionMappingRule> t = table(all, MYSQL, ORACLE);
        add(t, rule(MYSQL, ORACLE, "IFNULL", "NVL", DIRECT, NULL_HANDLING));
        add(t, rule(MYSQL, ORACLE, "IF", "CASE", TO_CASE_WHEN, CONDITIONAL));
        add(t, rule(MYSQL, ORACLE, "DATE_FORMAT", "TO_CHAR", DATE_FORMAT_CONVERT, DATE));
        add(t, rule(MYSQL, ORACLE, "STR_TO_DATE", "TO_DATE", DATE_FORMAT_CONVERT, DATE));
        add(t, rule(MYSQL, ORACLE, "SUBSTRING", "SUBSTR", DIRECT, STRING));
        add(t, rule(MYSQL, ORACLE, "LOCATE", "INSTR", SWAP_FIRST_TWO, STRING));
        add(t, rule(MYSQL, ORACLE, "CHAR_LENGTH", "LENGTH", DIRECT, STRING));
        add(t, rule(MYSQL, ORACLE, "CHARACTER_LENGTH", "LENGTH", DIRECT, STRING));
        add(t, rule(MYSQL, ORACLE, "LCASE", "LOWER", DIRECT, STRING));
        add(t, rule(MYSQL, ORACLE, "UCASE", "UPPER", DIRECT, STRING));
        add(t, rule(MYSQL, ORACLE, "TRUNCATE", "TRUNC", DIRECT, NUMERIC));
        add(t, rule(MYSQL, ORACLE, "CEILING", "CEIL", DIRECT, NUMERIC));
        add(t, limited(rule(MYSQL, ORACLE, "RAND", "DBMS_RANDOM.VALUE", DIRECT, NUMERIC), 0));
        add(t, rule(MYSQL, ORACLE, "UUID", "SYS_GUID", DIRECT, SYSTEM));
        add(t, unsupported(MYSQL, ORACLE, "FIND_IN_SET", STRING, "Oracle 没有 FIND_IN_SET，可改写为 INSTR(',' || list || ',', ',' || x || ',')"));
        add(t, unsupported(MYSQL, ORACLE, "LAST_INSERT_ID", SYSTEM, "Oracle 请改用序列的 CURRVAL 或 RETURNING INTO"));
    }

    private static void registerMySqlToPostgres(Map<DialectPair, Map<String, FunctionMappingRule>> all) {
        Map<String, FunctionMappingRule> t = table(all, MYSQL, POSTGRESQL);
        add(t, rule(MYSQL, POSTGRESQL, "IFNULL", "COALESCE", DIRECT, NULL_HANDLING));
        add(t, rule(MYSQL, POSTGRESQL, "IF", "CASE", TO_CASE_WHEN, CONDITIONAL));
        add(t, rule(MYSQL, POSTGRESQL, "DATE_FORMAT", "TO_CHAR", DATE_FORMAT_CONVERT, DATE));
        add(t, rule(MYSQL, POSTGRESQL, "STR_TO_DATE", "TO_TIMESTAMP", DATE_FORMAT_CONVERT, DATE));
        add(t, limited(rule(MYSQL, POSTGRESQL, "LOCATE", "STRPOS", SWAP_FIRST_TWO, STRING), 2));
        add(t, rule(MYSQL, POSTGRESQL, "INSTR", "STRPOS", DIRECT, STRING));
        add(t, rule(MYSQL, POSTGRESQL, "LCASE", "LOWER", DIRECT, STRING));
        add(t, rule(MYSQL, POSTGRESQL, "UCASE", "UPPER", DIRECT, STRING));
        add(t, rule(MYSQL, POSTGRESQL, "TRUNCATE", "TRUNC", DIRECT, NUMERIC));
        add(t, limited(rule(MYSQL, POSTGRESQL, "RAND", "RANDOM", DIRECT, NUMERIC), 0));
        add(t, rule(MYSQL, POSTGRESQL, "UUID", "GEN_RANDOM_UUID", DIRECT, SYSTEM));
        add(t, rule(MYSQL, POSTGRESQL, "DATABASE", "CURRENT_DATABASE", DIRECT, SYSTEM));
        add(t, rule(MYSQL, POSTGRESQL, "LAST_INSERT_ID", "LASTVAL", DIRECT, SYSTEM));
        add(t, unsupported(MYSQL, POSTGRESQL, "FIND_IN_SET", STRING, "PostgreSQL 可改写为 x = ANY(STRING_TO_ARRAY(list, ','))"));
    }

    private static void registerPostgresToOracle(Map<DialectPair, Map<String, FunctionMappingRule>> all) {
        Map<String, FunctionMappingRule> t = table(all, POSTGRESQL, ORACLE);
        add(t, rule(POSTGRESQL, ORACLE, "STRPOS", "INSTR", DIRECT, STRING));
        add(t, rule(POSTGRESQL, ORACLE, "CHAR_LENGTH", "LENGTH", DIRECT, STRING));
        add(t, rule(POSTGRESQL, ORACLE, "OCTET_LENGTH", "LENGTHB", DIRECT, STRING));
        add(t, rule(POSTGRESQL, ORACLE, "RANDOM", "DBMS_RANDOM.VALUE", DIRECT, NUMERIC));
        add(t, rule(POSTGRESQL, ORACLE, "GEN_RANDOM_UUID", "SYS_GUID", DIRECT, SYSTEM));
        add(t, unsupported(POSTGRESQL, ORACLE, "SPLIT_PART", STRING, "Oracle 可用 REGEXP_SUBSTR(s, '[^,]+', 1, n) 近似实现"));
        add(t, unsupported(POSTGRESQL, ORACLE, "LASTVAL", SYSTEM, "Oracle 请改用序列的 CURRVAL"));
    }

    private static void registerPostgresToMySql(Map<DialectPair, Map<String, FunctionMappingRule>> all) {
        Map<String, FunctionMappingRule> t = table(all, POSTGRESQL, MYSQL);
        add(t, rule(POSTGRESQL, MYSQL, "STRPOS", "LOCATE", SWAP_FIRST_TWO, STRING));
        add(t, rule(POSTGRESQL, MYSQL, "BTRIM", "TRIM", DIRECT, STRING));
        add(t, rule(POSTGRESQL, MYSQL, "TO_CHAR", "DATE_FORMAT", DATE_FORMAT_CONVERT, DATE));
        add(t, rule(POSTGRESQL, MYSQL, "TO_TIMESTAMP", "STR_TO_DATE", DATE_FORMAT_CONVERT, DATE));
        add(t, rule(POSTGRESQL, MYSQL, "TO_DATE", "STR_TO_DATE", DATE_FORMAT_CONVERT, DATE));
        add(t, rule(POSTGRESQL, MYSQL, "RANDOM", "RAND", DIRECT, NUMERIC));
        add(t, rule(POSTGRESQL, MYSQL, "GEN_RANDOM_UUID", "UUID", DIRECT, SYSTEM));
        add(t, rule(POSTGRESQL, MYSQL, "CURRENT_DATABASE", "DATABASE", DIRECT, SYSTEM));
        add(t, rule(POSTGRESQL, MYSQL, "LASTVAL", "LAST_INSERT_ID", DIRECT, SYSTEM));
        add(t, unsupported(POSTGRESQL, MYSQL, "SPLIT_PART", STRING, "MySQL 可用 SUBSTRING_INDEX(SUBSTRING_INDEX(s, ',', n), ',', -1) 近似实现"));
    }

    private static Map<String, FunctionMappingRule> table(Map<DialectPair, Map<String, FunctionMappingRule>> all,
                                                          Dialect source, Dialect target) {
        return all.computeIfAbsent(DialectPair.of(source, target), k -> new LinkedHashMap<>());
    }

    private static void add(Map<String, FunctionMappingRule> table, FunctionMappingRule rule) {
        table.put(rule.getSourceFunction().toUpperCase(Locale.ROOT), rule);
    }

    private static FunctionMappingRule rule(Dialect source, Dialect target, String from, String to,
                                            ParameterTransform transform, FunctionCategory category) {
        return FunctionMappingRule.builder()
                .source(source)
                .target(target)
                .sourceFunction(from)
                .targetFunction(to)
                .transform(transform)
                .category(category)
                .build();
    }

    private static FunctionMappingRule limited(FunctionMappingRule rule, int maxArguments) {
        return rule.toBuilder().maxArguments(maxArguments).build();
    }

    private static FunctionMappingRule unsupported(Dialect source, Dialect target, String from,
                                                   FunctionCategory category, String suggestion) {
        return FunctionMappingRule.builder()
                .source(source)
                .target(target)
                .sourceFunction(from)
                .category(category)
                .warningMessage("函数 " + from + " 在 " + target.getDisplayName() + " 中没有等价实现")
                .suggestion(suggestion)
                .build();
    }
}
