package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.exceptions.FeatureConversionException;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 自定义类型。
 * <ul>
 *     <li>Oracle OBJECT 类型与 PostgreSQL 复合类型互转，MySQL 以 JSON 列代替</li>
 *     <li>TABLE OF / VARRAY 转为 PostgreSQL 数组域</li>
 *     <li>TYPE BODY、PostgreSQL ENUM 类型注释掉并告警</li>
 * </ul>
 *
 * @author afsun
 */
@Component
public class UserDefinedTypeConverter extends AbstractFeatureConverter {

    private static final String CREATE_TYPE_HEAD = "(?is)" + SqlPatterns.LEAD
            + "CREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:EDITIONABLE\\s+|NONEDITIONABLE\\s+)?TYPE\\s+(" + SqlPatterns.QUALIFIED_IDENT
            + ")\\s+(?:FORCE\\s+)?";

    private static final Pattern OBJECT_TYPE = Pattern.compile(CREATE_TYPE_HEAD + "(?:AS|IS)\\s+OBJECT\\s*\\(");

    private static final Pattern SUBTYPE = Pattern.compile(CREATE_TYPE_HEAD + "UNDER\\s+");

    private static final Pattern COLLECTION_TYPE = Pattern.compile(CREATE_TYPE_HEAD
            + "(?:AS|IS)\\s+(?:TABLE|VARRAY\\s*\\(\\s*\\d+\\s*\\)|VARYING\\s+ARRAY\\s*\\(\\s*\\d+\\s*\\))\\s+OF\\s+(.+?)"
            + "(?:\\s+NOT\\s+NULL)?(?:\\s+INDEX\\s+BY\\s+.+)?\\s*$");

    private static final Pattern ENUM_TYPE = Pattern.compile(CREATE_TYPE_HEAD + "AS\\s+ENUM\\s*\\(");

    /**
     * PostgreSQL 复合类型：CREATE TYPE t AS (a int, ...)
     */
    private static final Pattern COMPOSITE_TYPE = Pattern.compile(CREATE_TYPE_HEAD + "AS\\s*\\(");

    private static final Pattern TYPE_BODY = Pattern.compile(
            "(?is)\\bCREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:EDITIONABLE\\s+|NONEDITIONABLE\\s+)?TYPE\\s+BODY\\b");

    private static final Pattern SLASH_LINE = Pattern.compile("(?m)^[ \\t]*/[ \\t]*$");

    private static final Pattern METHOD = Pattern.compile(
            "(?is)^\\s*(?:(?:NOT\\s+)?(?:OVERRIDING|FINAL|INSTANTIABLE)\\s+)*(?:MEMBER|STATIC|MAP|ORDER|CONSTRUCTOR)\\b");

    private static final Pattern TYPE_MODIFIERS = Pattern.compile(
            "(?is)^(?:\\s*(?:NOT\\s+)?(?:FINAL|INSTANTIABLE|PERSISTABLE))*\\s*$");

    private static final Pattern ANCHORED_TYPE = Pattern.compile("(?i)%(?:ROW)?TYPE\\b");

    private static final Pattern KEYWORD = Pattern.compile("(?i)\\bTYPE\\b|%ROWTYPE\\b");

    @Override
    public int order() {
        return 400;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getDdlRules().isConvertUserDefinedTypes();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return KEYWORD.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        String text = maskedSql;
        if (!to(ctx, Dialect.ORACLE)) {
            text = commentOutTypeBodies(text, ctx, acc);
        }
        Set<String> objectTypes = new LinkedHashSet<>();
        text = SqlTextUtils.mapStatements(text, stmt -> convertStatement(stmt, objectTypes, ctx, acc));
        if (to(ctx, Dialect.MYSQL)) {
            for (String type : objectTypes) {
                text = jsonColumns(text, type, acc);
            }
            if (ANCHORED_TYPE.matcher(text).find()) {
                warn(acc, WarningType.UNSUPPORTED_FUNCTION, "MySQL 不支持 %TYPE / %ROWTYPE 锚定类型",
                        "请显式声明变量类型", ctx, null);
            }
        }
        return text;
    }

    /**
     * TYPE BODY 内部含多条以分号结尾的语句，整体截取到单独一行的 / 为止
     */
    private String commentOutTypeBodies(String text, ConversionContext ctx, ConversionAccumulator acc) {
        StringBuilder out = new StringBuilder(text.length());
        Matcher body = TYPE_BODY.matcher(text);
        int pos = 0;
        while (body.find(pos)) {
            Matcher slash = SLASH_LINE.matcher(text);
            int end = slash.find(body.end()) ? slash.end() : text.length();
            String unit = text.substring(body.start(), end);
            warn(acc, WarningType.UNSUPPORTED_FUNCTION,
                    ctx.getTarget().getDisplayName() + " 不支持对象类型的方法体 (TYPE BODY)，已注释",
                    "请将成员方法改写为普通函数", ctx, unit);
            acc.addRule("TYPE BODY -> comment");
            out.append(text, pos, body.start()).append(ctx.comment(unit.trim()));
            pos = end;
        }
        out.append(text.substring(pos));
        return out.toString();
    }

    private String convertStatement(String stmt, Set<String> objectTypes, ConversionContext ctx,
                                    ConversionAccumulator acc) {
        Matcher object = OBJECT_TYPE.matcher(stmt);
        if (object.find()) {
            return convertObjectType(stmt, object, objectTypes, ctx, acc);
        }
        if (SUBTYPE.matcher(stmt).find() && !to(ctx, Dialect.ORACLE)) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "对象类型继承 (UNDER) 无法自动转换", "请将父类型属性展开到子类型中",
                    ctx, stmt);
            return stmt;
        }
        Matcher collection = COLLECTION_TYPE.matcher(stmt);
        if (collection.find()) {
            return convertCollectionType(stmt, collection.group(1), collection.group(2).trim(), ctx, acc);
        }
        Matcher enumType = ENUM_TYPE.matcher(stmt);
        if (enumType.find() && !to(ctx, Dialect.POSTGRESQL)) {
            warn(acc, WarningType.UNSUPPORTED_FUNCTION, ctx.getTarget().getDisplayName() + " 没有独立的枚举类型，"
                            + enumType.group(1) + " 已注释",
                    to(ctx, Dialect.MYSQL) ? "请在列上直接使用 ENUM(...) 类型" : "请使用 VARCHAR2 加 CHECK 约束",
                    ctx, stmt);
            acc.addRule("ENUM type -> comment");
            return keepLead(stmt, ctx.comment(stmt.trim()));
        }
        Matcher composite = COMPOSITE_TYPE.matcher(stmt);
        if (composite.find() && from(ctx, Dialect.POSTGRESQL) && !to(ctx, Dialect.POSTGRESQL)) {
            int close = SqlTextUtils.findMatchingParen(stmt, composite.end() - 1);
            if (close < 0) {
                return stmt;
            }
            String attributes = stmt.substring(composite.end(), close);
            if (to(ctx, Dialect.MYSQL)) {
                objectTypes.add(composite.group(1));
                return jsonStub(stmt, composite.group(1), ctx, acc);
            }
            acc.addRule("Composite type -> OBJECT type");
            return keepLead(stmt, "CREATE OR REPLACE TYPE " + composite.group(1) + " AS OBJECT (" + attributes + ")"
                    + stmt.substring(close + 1));
        }
        return stmt;
    }

    private String convertObjectType(String stmt, Matcher object, Set<String> objectTypes, ConversionContext ctx,
                                     ConversionAccumulator acc) {
        if (to(ctx, Dialect.ORACLE)) {
            return stmt;
        }
        String name = object.group(1);
        int open = object.end() - 1;
        int close = SqlTextUtils.findMatchingParen(stmt, open);
        if (close < 0) {
            throw new FeatureConversionException("对象类型 " + name + " 的括号不完整，未转换", ctx.snippet(stmt));
        }
        if (to(ctx, Dialect.MYSQL)) {
            objectTypes.add(name);
            return jsonStub(stmt, name, ctx, acc);
        }
        List<String> attributes = new ArrayList<>();
        int methods = 0;
        for (String entry : SqlTextUtils.splitArguments(stmt.substring(open + 1, close))) {
            if (METHOD.matcher(entry).find()) {
                methods++;
            } else if (!entry.trim().isEmpty()) {
                attributes.add(entry.trim());
            }
        }
        if (methods > 0) {
            warn(acc, WarningType.PARTIAL_SUPPORT, "PostgreSQL 复合类型不支持成员方法，" + name + " 的 " + methods
                    + " 个方法声明已移除", "请将方法改写为以该类型为参数的函数", ctx, stmt);
        }
        String tail = stmt.substring(close + 1);
        if (!TYPE_MODIFIERS.matcher(tail).matches()) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "对象类型 " + name + " 的尾部选项无法识别，已忽略", null, ctx, tail);
        }
        acc.addRule("OBJECT type -> composite type");
        return keepLead(stmt, "CREATE TYPE " + name + " AS (" + String.join(", ", attributes) + ")");
    }

    private String convertCollectionType(String stmt, String name, String elementType, ConversionContext ctx,
                                         ConversionAccumulator acc) {
        if (to(ctx, Dialect.POSTGRESQL)) {
            if (ANCHORED_TYPE.matcher(elementType).find()) {
                warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "集合类型 " + name + " 的元素类型为锚定类型，无法建为数组域",
                        "请显式声明元素类型", ctx, stmt);
                return stmt;
            }
            info(acc, WarningType.SYNTAX_DIFFERENCE, "集合类型 " + name + " 已改为数组域", "注意 PostgreSQL 数组下标从 1 开始",
                    ctx, stmt);
            acc.addRule("Collection type -> array domain");
            return keepLead(stmt, "CREATE DOMAIN " + name + " AS " + elementType + "[]");
        }
        if (to(ctx, Dialect.MYSQL)) {
            warn(acc, WarningType.UNSUPPORTED_FUNCTION, "MySQL 没有集合类型，" + name + " 已注释",
                    "可使用 JSON 数组列或子表代替", ctx, stmt);
            acc.addRule("Collection type -> comment");
            return keepLead(stmt, ctx.comment(stmt.trim()));
        }
        return stmt;
    }

    private static String jsonStub(String stmt, String name, ConversionContext ctx, ConversionAccumulator acc) {
        warn(acc, WarningType.UNSUPPORTED_FUNCTION, "MySQL 没有自定义对象类型，" + name + " 已注释，使用该类型的列改为 JSON",
                "可用 JSON_OBJECT / JSON_EXTRACT 访问属性", ctx, stmt);
        acc.addRule("Object type -> JSON emulation");
        return keepLead(stmt, ctx.comment("JSON emulation of type " + stmt.trim()));
    }

    /**
     * 列定义中以对象类型声明的列改为 JSON
     */
    private static String jsonColumns(String text, String type, ConversionAccumulator acc) {
        Pattern column = Pattern.compile("(?i)([(,]\\s*" + SqlPatterns.IDENT + "\\s+)" + Pattern.quote(type)
                + "(?![\\w$#.(])");
        String out = SqlTextUtils.mapStatements(text, stmt -> {
            if (!SqlPatterns.CREATE_TABLE.matcher(stmt).find() && !SqlPatterns.ALTER_TABLE.matcher(stmt).find()) {
                return stmt;
            }
            return column.matcher(stmt).replaceAll("$1JSON");
        });
        return acc.apply("Object type column -> JSON", text, out);
    }
}
