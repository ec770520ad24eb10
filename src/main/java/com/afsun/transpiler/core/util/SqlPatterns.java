package com.afsun.transpiler.core.util;

import java.util.regex.Pattern;

/**
 * 各转换组件共用的预编译正则，均作用于屏蔽后的文本
 *
 * @author afsun
 */
public final class SqlPatterns {

    private SqlPatterns() {
    }

    /**
     * 语句开头：空白或被屏蔽的注释
     */
    public static final String LEAD = "^(?:\\s|\\u0002\\d+\\u0002)*";

    /**
     * 普通或引用标识符
     */
    public static final String IDENT = "(?:\"[^\"]+\"|`[^`]+`|[A-Za-z_][\\w$#]*)";

    /**
     * 可带 schema/别名 前缀的标识符
     */
    public static final String QUALIFIED_IDENT = IDENT + "(?:\\s*\\.\\s*" + IDENT + ")*";

    /**
     * 屏蔽后的字符串字面量
     */
    public static final String LITERAL = "'\\u0001\\d+\\u0001'";

    public static final Pattern DDL_STATEMENT = Pattern.compile(
            "(?is)" + LEAD + "(?:CREATE|ALTER)\\b");

    public static final Pattern CREATE_TABLE = Pattern.compile(
            "(?is)" + LEAD + "CREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:(?:GLOBAL|LOCAL|PRIVATE)\\s+)?(?:TEMPORARY\\s+|UNLOGGED\\s+)?TABLE\\b");

    public static final Pattern ALTER_TABLE = Pattern.compile("(?is)" + LEAD + "ALTER\\s+TABLE\\b");

    public static final Pattern CREATE_INDEX = Pattern.compile(
            "(?is)" + LEAD + "CREATE\\s+(?:UNIQUE\\s+|BITMAP\\s+|FULLTEXT\\s+|SPATIAL\\s+)*INDEX\\b");

    public static final Pattern CREATE_TYPE = Pattern.compile(
            "(?is)" + LEAD + "CREATE\\s+(?:OR\\s+REPLACE\\s+)?TYPE\\b");

    public static final Pattern CREATE_MATERIALIZED_VIEW = Pattern.compile(
            "(?is)" + LEAD + "CREATE\\s+MATERIALIZED\\s+VIEW\\b");

    public static final Pattern CREATE_SEQUENCE = Pattern.compile(
            "(?is)" + LEAD + "CREATE\\s+SEQUENCE\\b");

    /**
     * 过程化单元（存储过程、函数、包、触发器、类型体、匿名块）
     */
    public static final Pattern PROCEDURAL_UNIT = Pattern.compile(
            "(?is)" + LEAD + "(?:CREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:EDITIONABLE\\s+|NONEDITIONABLE\\s+)?"
                    + "(?:PROCEDURE|FUNCTION|PACKAGE|TRIGGER|TYPE\\s+BODY)\\b|DECLARE\\b|BEGIN\\b)");

    public static boolean isDdl(String stmt) {
        return DDL_STATEMENT.matcher(stmt).find();
    }

    /**
     * 表结构类DDL：建表、改表、建索引、建物化视图
     */
    public static boolean isStorageDdl(String stmt) {
        return CREATE_TABLE.matcher(stmt).find()
                || ALTER_TABLE.matcher(stmt).find()
                || CREATE_INDEX.matcher(stmt).find()
                || CREATE_MATERIALIZED_VIEW.matcher(stmt).find();
    }
}
