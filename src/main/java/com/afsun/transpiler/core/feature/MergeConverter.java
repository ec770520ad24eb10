package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.feature.MergeStatement.Action;
import com.afsun.transpiler.core.feature.MergeStatement.Branch;
import com.afsun.transpiler.core.util.SqlPatterns;
import com.afsun.transpiler.core.util.SqlTextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MERGE 与各库 upsert 写法互转：
 * <ul>
 *     <li>MERGE -> MySQL INSERT ... ON DUPLICATE KEY UPDATE / 多表 UPDATE</li>
 *     <li>MERGE -> PostgreSQL INSERT ... ON CONFLICT / UPDATE ... FROM</li>
 *     <li>ON DUPLICATE KEY UPDATE、INSERT IGNORE、REPLACE INTO、ON CONFLICT 之间互转，到 Oracle 统一为 MERGE</li>
 * </ul>
 * DELETE 分支不做转换，只给出部分支持告警。
 *
 * @author afsun
 */
@Slf4j
@Component
public class MergeConverter extends AbstractFeatureConverter {

    private static final Pattern KEYWORD = Pattern.compile(
            "(?i)\\bMERGE\\s+INTO\\b|\\bON\\s+DUPLICATE\\s+KEY\\b|\\bON\\s+CONFLICT\\b|\\bINSERT\\s+IGNORE\\b|\\bREPLACE\\s+INTO\\b");

    private static final Pattern MERGE_START = Pattern.compile("(?is)" + SqlPatterns.LEAD + "MERGE\\s+INTO\\b");

    private static final Pattern VALUES_CALL = Pattern.compile("(?i)(?<![\\w$#.])VALUES\\s*\\(\\s*(" + SqlPatterns.IDENT + ")\\s*\\)");

    private static final Pattern EQUALITY = Pattern.compile(
            "(?is)^\\s*(" + SqlPatterns.QUALIFIED_IDENT + ")\\s*=\\s*(" + SqlPatterns.QUALIFIED_IDENT + ")\\s*$");

    private static final Pattern ASSIGNMENT = Pattern.compile("(?is)^\\s*(" + SqlPatterns.QUALIFIED_IDENT + ")\\s*=\\s*(.+)$");

    @Override
    public int order() {
        return 700;
    }

    @Override
    public boolean isEnabled(RuleConfig config) {
        return config.getSyntaxRules().isConvertMerge();
    }

    @Override
    public boolean isApplicable(String maskedSql, ConversionContext ctx) {
        return KEYWORD.matcher(maskedSql).find();
    }

    @Override
    public String convert(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        return SqlTextUtils.mapStatements(maskedSql, stmt -> {
            if (MERGE_START.matcher(stmt).find()) {
                return convertMerge(stmt, ctx, acc);
            }
            UpsertStatement upsert = UpsertStatement.parse(stmt);
            if (upsert != null && upsert.isUpsert()) {
                return convertUpsert(stmt, upsert, ctx, acc);
            }
            return stmt;
        });
    }

    // ---------------------------------------------------------------- MERGE

    private String convertMerge(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        MergeStatement merge = MergeStatement.parse(stmt);
        if (merge == null) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "无法识别的 MERGE 语句结构，未转换", "请人工改写", ctx, stmt);
            return stmt;
        }
        if (merge.hasDelete()) {
            warn(acc, WarningType.PARTIAL_SUPPORT, "MERGE 的 DELETE 分支未转换，匹配行将不会被删除",
                    "请在转换后的语句之后补充一条 DELETE 语句", ctx, stmt);
        }
        for (Branch b : merge.getBranches()) {
            if (b.isNotMatchedBySource()) {
                warn(acc, WarningType.PARTIAL_SUPPORT, "WHEN NOT MATCHED BY SOURCE 分支未转换", "请单独编写 UPDATE/DELETE", ctx, stmt);
            }
        }
        if (to(ctx, Dialect.ORACLE)) {
            return keepLead(stmt, mergeToOracle(merge, stmt, ctx, acc));
        }
        Branch update = merge.branch(Action.UPDATE);
        Branch insert = merge.branch(Action.INSERT);
        if (update == null && insert == null) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "MERGE 只有 DELETE 分支，无法转换", "请改写为 DELETE ... WHERE EXISTS", ctx, stmt);
            return stmt;
        }
        if (insert != null && insert.getInsertColumns().isEmpty()) {
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "MERGE 的 INSERT 分支没有列清单，无法转换", "请补充列清单", ctx, stmt);
            return stmt;
        }
        String converted;
        if (insert != null && update != null) {
            converted = to(ctx, Dialect.MYSQL) ? mergeToDuplicateKey(merge, update, insert, stmt, ctx, acc)
                    : mergeToOnConflict(merge, update, insert, stmt, ctx, acc);
        } else if (update != null) {
            converted = to(ctx, Dialect.MYSQL) ? mergeToUpdateJoin(merge, update, stmt, ctx, acc)
                    : mergeToUpdateFrom(merge, update, stmt, ctx, acc);
        } else {
            converted = mergeToInsertNotExists(merge, insert, stmt, ctx, acc);
        }
        if (converted == null) {
            return stmt;
        }
        return keepLead(stmt, converted);
    }

    private String mergeToDuplicateKey(MergeStatement merge, Branch update, Branch insert, String stmt,
                                       ConversionContext ctx, ConversionAccumulator acc) {
        warnConditions(update, insert, stmt, ctx, acc);
        info(acc, WarningType.SYNTAX_DIFFERENCE, "ON DUPLICATE KEY UPDATE 依赖唯一键，请确认 ON 条件中的列 ("
                + merge.getOn() + ") 上有主键或唯一索引", null, ctx, stmt);
        Map<String, String> sourceToColumn = sourceColumnMap(merge, insert);
        List<String> sets = new ArrayList<>();
        for (String assignment : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(update.getSetClause()))) {
            Matcher a = ASSIGNMENT.matcher(assignment);
            if (!a.find()) {
                return manual("无法识别的 UPDATE 赋值: " + assignment, stmt, ctx, acc);
            }
            String expr = replaceQualified(a.group(2).trim(), merge.sourceName(), col -> {
                String target = sourceToColumn.get(col.toUpperCase(Locale.ROOT));
                return "VALUES(" + (target == null ? col : target) + ")";
            });
            expr = replaceQualified(expr, merge.targetName(), col -> col);
            sets.add(SqlTextUtils.unqualify(a.group(1)) + " = " + expr);
        }
        acc.addRule("MERGE -> INSERT ... ON DUPLICATE KEY UPDATE");
        return "INSERT INTO " + merge.getTarget() + " (" + String.join(", ", unqualifyAll(insert.getInsertColumns()))
                + ") SELECT " + String.join(", ", insert.getInsertValues()) + " FROM " + merge.sourceReference()
                + " ON DUPLICATE KEY UPDATE " + String.join(", ", sets);
    }

    private String mergeToOnConflict(MergeStatement merge, Branch update, Branch insert, String stmt,
                                     ConversionContext ctx, ConversionAccumulator acc) {
        List<String> keys = conflictKeys(merge);
        if (keys.isEmpty()) {
            return manual("无法从 ON 条件推导冲突键: " + merge.getOn(), stmt, ctx, acc);
        }
        if (insert.getWhere() != null || insert.getCondition() != null) {
            warn(acc, WarningType.PARTIAL_SUPPORT, "INSERT 分支的附加条件已并入 SELECT 的 WHERE", null, ctx, stmt);
        }
        Map<String, String> sourceToColumn = sourceColumnMap(merge, insert);
        List<String> sets = new ArrayList<>();
        for (String assignment : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(update.getSetClause()))) {
            Matcher a = ASSIGNMENT.matcher(assignment);
            if (!a.find()) {
                return manual("无法识别的 UPDATE 赋值: " + assignment, stmt, ctx, acc);
            }
            sets.add(SqlTextUtils.unqualify(a.group(1)) + " = " + toExcluded(a.group(2).trim(), merge, sourceToColumn));
        }
        StringBuilder sb = new StringBuilder("INSERT INTO ").append(merge.getTarget());
        if (merge.getTargetAlias() != null) {
            sb.append(" AS ").append(merge.getTargetAlias());
        }
        sb.append(" (").append(String.join(", ", unqualifyAll(insert.getInsertColumns()))).append(") SELECT ")
                .append(String.join(", ", insert.getInsertValues())).append(" FROM ").append(merge.sourceReference());
        String insertFilter = join(insert.getCondition(), insert.getWhere());
        if (insertFilter != null) {
            sb.append(" WHERE ").append(insertFilter);
        }
        sb.append(" ON CONFLICT (").append(String.join(", ", keys)).append(") DO UPDATE SET ").append(String.join(", ", sets));
        String updateFilter = join(update.getCondition(), update.getWhere());
        if (updateFilter != null) {
            sb.append(" WHERE ").append(toExcluded(updateFilter, merge, sourceToColumn));
        }
        acc.addRule("MERGE -> INSERT ... ON CONFLICT DO UPDATE");
        return sb.toString();
    }

    private String mergeToUpdateJoin(MergeStatement merge, Branch update, String stmt, ConversionContext ctx,
                                     ConversionAccumulator acc) {
        StringBuilder sb = new StringBuilder("UPDATE ").append(merge.getTarget());
        if (merge.getTargetAlias() != null) {
            sb.append(' ').append(merge.getTargetAlias());
        }
        sb.append(" JOIN ").append(merge.sourceReference()).append(" ON ").append(merge.getOn())
                .append(" SET ").append(update.getSetClause());
        String filter = join(update.getCondition(), update.getWhere());
        if (filter != null) {
            sb.append(" WHERE ").append(filter);
        }
        acc.addRule("MERGE -> UPDATE ... JOIN");
        return sb.toString();
    }

    private String mergeToUpdateFrom(MergeStatement merge, Branch update, String stmt, ConversionContext ctx,
                                     ConversionAccumulator acc) {
        List<String> sets = new ArrayList<>();
        for (String assignment : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(update.getSetClause()))) {
            Matcher a = ASSIGNMENT.matcher(assignment);
            if (!a.find()) {
                return manual("无法识别的 UPDATE 赋值: " + assignment, stmt, ctx, acc);
            }
            sets.add(SqlTextUtils.unqualify(a.group(1)) + " = " + a.group(2).trim());
        }
        StringBuilder sb = new StringBuilder("UPDATE ").append(merge.getTarget());
        if (merge.getTargetAlias() != null) {
            sb.append(" AS ").append(merge.getTargetAlias());
        }
        sb.append(" SET ").append(String.join(", ", sets)).append(" FROM ").append(merge.sourceReference())
                .append(" WHERE ").append(merge.getOn());
        String filter = join(update.getCondition(), update.getWhere());
        if (filter != null) {
            sb.append(" AND (").append(filter).append(')');
        }
        acc.addRule("MERGE -> UPDATE ... FROM");
        return sb.toString();
    }

    private String mergeToInsertNotExists(MergeStatement merge, Branch insert, String stmt, ConversionContext ctx,
                                          ConversionAccumulator acc) {
        StringBuilder sb = new StringBuilder("INSERT INTO ").append(merge.getTarget()).append(" (")
                .append(String.join(", ", unqualifyAll(insert.getInsertColumns()))).append(") SELECT ")
                .append(String.join(", ", insert.getInsertValues())).append(" FROM ").append(merge.sourceReference())
                .append(" WHERE NOT EXISTS (SELECT 1 FROM ").append(merge.getTarget());
        if (merge.getTargetAlias() != null) {
            sb.append(' ').append(merge.getTargetAlias());
        }
        sb.append(" WHERE ").append(merge.getOn()).append(')');
        String filter = join(insert.getCondition(), insert.getWhere());
        if (filter != null) {
            sb.append(" AND (").append(filter).append(')');
        }
        acc.addRule("MERGE -> INSERT ... WHERE NOT EXISTS");
        return sb.toString();
    }

    /**
     * PostgreSQL MERGE -> Oracle：ON 条件加括号，去掉目标别名的 AS，改写 Oracle 不支持的分支
     */
    private String mergeToOracle(MergeStatement merge, String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        StringBuilder sb = new StringBuilder("MERGE INTO ").append(merge.getTarget());
        if (merge.getTargetAlias() != null) {
            sb.append(' ').append(merge.getTargetAlias());
        }
        sb.append(" USING ").append(merge.sourceReference()).append(" ON (").append(merge.getOn()).append(')');
        for (Branch b : merge.getBranches()) {
            if (b.getAction() == Action.NOTHING || b.getAction() == Action.DELETE || b.isNotMatchedBySource()) {
                continue;
            }
            if (b.getAction() == Action.UPDATE) {
                sb.append(" WHEN MATCHED THEN UPDATE SET ").append(b.getSetClause());
                String filter = join(b.getCondition(), b.getWhere());
                if (filter != null) {
                    sb.append(" WHERE ").append(filter);
                }
                if (b.getDeleteWhere() != null) {
                    sb.append(" DELETE WHERE ").append(b.getDeleteWhere());
                }
            } else {
                sb.append(" WHEN NOT MATCHED THEN INSERT");
                if (!b.getInsertColumns().isEmpty()) {
                    sb.append(" (").append(String.join(", ", b.getInsertColumns())).append(')');
                }
                sb.append(" VALUES (").append(String.join(", ", b.getInsertValues())).append(')');
                String filter = join(b.getCondition(), b.getWhere());
                if (filter != null) {
                    sb.append(" WHERE ").append(filter);
                }
            }
        }
        acc.addRule("MERGE -> Oracle MERGE");
        return sb.toString();
    }

    private static void warnConditions(Branch update, Branch insert, String stmt, ConversionContext ctx,
                                       ConversionAccumulator acc) {
        if (update.getCondition() != null || update.getWhere() != null
                || insert.getCondition() != null || insert.getWhere() != null) {
            warn(acc, WarningType.PARTIAL_SUPPORT, "ON DUPLICATE KEY UPDATE 无法表达 MERGE 分支上的附加条件，条件已忽略",
                    "可在 UPDATE 表达式中用 IF(条件, 新值, 原值) 模拟", ctx, stmt);
        }
    }

    /**
     * 源端列名 -> 插入目标列名，用于把 s.col 改写为 VALUES(目标列) / EXCLUDED.目标列
     */
    private static Map<String, String> sourceColumnMap(MergeStatement merge, Branch insert) {
        Map<String, String> map = new HashMap<>();
        Pattern ref = Pattern.compile("(?i)^" + Pattern.quote(merge.sourceName()) + "\\s*\\.\\s*(" + SqlPatterns.IDENT + ")$");
        for (int i = 0; i < insert.getInsertValues().size() && i < insert.getInsertColumns().size(); i++) {
            Matcher m = ref.matcher(insert.getInsertValues().get(i));
            if (m.find()) {
                map.put(m.group(1).toUpperCase(Locale.ROOT), SqlTextUtils.unqualify(insert.getInsertColumns().get(i)));
            }
        }
        return map;
    }

    private static String toExcluded(String expr, MergeStatement merge, Map<String, String> sourceToColumn) {
        return replaceQualified(expr, merge.sourceName(), col -> {
            String target = sourceToColumn.get(col.toUpperCase(Locale.ROOT));
            return "EXCLUDED." + (target == null ? col : target);
        });
    }

    /**
     * ON 条件中目标表一侧的列，作为冲突键
     */
    private static List<String> conflictKeys(MergeStatement merge) {
        List<String> keys = new ArrayList<>();
        String target = merge.targetName();
        for (String part : merge.getOn().split("(?i)\\s+AND\\s+")) {
            Matcher eq = EQUALITY.matcher(MergeStatement.stripOuterParens(part));
            if (!eq.find()) {
                return new ArrayList<>();
            }
            String left = eq.group(1).replaceAll("\\s+", "");
            String right = eq.group(2).replaceAll("\\s+", "");
            String chosen = qualifiedBy(right, target) && !qualifiedBy(left, target) ? right : left;
            keys.add(SqlTextUtils.unqualify(chosen));
        }
        return keys;
    }

    // ---------------------------------------------------------------- upsert

    private String convertUpsert(String stmt, UpsertStatement u, ConversionContext ctx, ConversionAccumulator acc) {
        if (u.getReturning() != null && !to(ctx, Dialect.POSTGRESQL)) {
            warn(acc, WarningType.UNSUPPORTED_FUNCTION, ctx.getTarget().getDisplayName() + " 的 INSERT 不支持 RETURNING，已去掉",
                    to(ctx, Dialect.MYSQL) ? "自增主键可用 LAST_INSERT_ID() 获取" : "PL/SQL 中可用 RETURNING ... INTO", ctx, stmt);
            acc.addRule("INSERT RETURNING removed");
            stmt = stmt.substring(0, SqlTextUtils.findTopLevelKeyword(stmt, "RETURNING", u.getHeadEnd())).replaceAll("\\s+$", "");
            u = UpsertStatement.parse(stmt);
            if (u == null) {
                return stmt;
            }
        }
        String converted = null;
        if (to(ctx, Dialect.ORACLE)) {
            converted = upsertToMerge(stmt, u, ctx, acc);
        } else if (to(ctx, Dialect.MYSQL) && u.getKind() == UpsertStatement.Kind.CONFLICT) {
            converted = conflictToMySql(stmt, u, ctx, acc);
        } else if (to(ctx, Dialect.POSTGRESQL) && from(ctx, Dialect.MYSQL)) {
            converted = mySqlToConflict(stmt, u, ctx, acc);
        }
        return converted == null ? stmt : converted;
    }

    /**
     * ON CONFLICT -> INSERT IGNORE / ON DUPLICATE KEY UPDATE
     */
    private String conflictToMySql(String stmt, UpsertStatement u, ConversionContext ctx, ConversionAccumulator acc) {
        String head = stmt.substring(0, u.getHeadEnd());
        String middle = stmt.substring(u.getHeadEnd(), u.getClauseStart());
        String alias = u.getTableAlias();
        if (alias != null) {
            head = head.replaceFirst("(?is)\\s+AS\\s+" + Pattern.quote(alias) + "$", "");
        }
        if (u.isDoNothing()) {
            acc.addRule("ON CONFLICT DO NOTHING -> INSERT IGNORE");
            if (!u.getConflictColumns().isEmpty() || u.getConflictConstraint() != null) {
                info(acc, WarningType.SYNTAX_DIFFERENCE, "INSERT IGNORE 会忽略任意唯一键冲突及部分数据错误，不限于指定的冲突列",
                        null, ctx, stmt);
            }
            head = head.substring(0, u.getVerbStart()) + "INSERT IGNORE" + head.substring(u.getVerbStart() + "INSERT".length());
            return head + middle + stmt.substring(u.getClauseEnd());
        }
        if (u.getUpdateWhere() != null) {
            warn(acc, WarningType.PARTIAL_SUPPORT, "ON DUPLICATE KEY UPDATE 不支持 WHERE 条件，条件已忽略",
                    "可在赋值表达式中用 IF(条件, 新值, 原值) 模拟", ctx, stmt);
        }
        List<String> sets = new ArrayList<>();
        for (String assignment : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(u.getAssignments()))) {
            Matcher a = ASSIGNMENT.matcher(assignment);
            if (!a.find()) {
                return manual("无法识别的 UPDATE 赋值: " + assignment, stmt, ctx, acc);
            }
            String expr = replaceQualified(a.group(2).trim(), "EXCLUDED", col -> "VALUES(" + col + ")");
            expr = replaceQualified(expr, alias != null ? alias : SqlTextUtils.unqualify(u.getTable()), col -> col);
            sets.add(SqlTextUtils.unqualify(a.group(1)) + " = " + expr);
        }
        acc.addRule("ON CONFLICT DO UPDATE -> ON DUPLICATE KEY UPDATE");
        return head + middle + " ON DUPLICATE KEY UPDATE " + String.join(", ", sets) + stmt.substring(u.getClauseEnd());
    }

    /**
     * MySQL upsert -> PostgreSQL ON CONFLICT
     */
    private String mySqlToConflict(String stmt, UpsertStatement u, ConversionContext ctx, ConversionAccumulator acc) {
        String head = stmt.substring(0, u.getVerbStart()) + "INSERT INTO " + u.getTable();
        String middle = " " + u.valuesWithoutAlias();
        if (!u.getColumns().isEmpty()) {
            middle = " (" + String.join(", ", u.getColumns()) + ")" + middle;
        }
        if (u.getKind() == UpsertStatement.Kind.PLAIN && u.isIgnore() && !u.isReplace()) {
            acc.addRule("INSERT IGNORE -> ON CONFLICT DO NOTHING");
            return head + middle + " ON CONFLICT DO NOTHING";
        }
        if (u.getColumns().isEmpty()) {
            return manual("缺少列清单，无法推导冲突键", stmt, ctx, acc);
        }
        String key = SqlTextUtils.unqualify(u.getColumns().get(0));
        warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "ON CONFLICT 需要显式冲突列，已假定第一列 " + key + " 为唯一键",
                "请按实际主键或唯一索引修改 ON CONFLICT (...)", ctx, stmt);
        List<String> sets = new ArrayList<>();
        if (u.isReplace()) {
            warn(acc, WarningType.SYNTAX_DIFFERENCE, "REPLACE INTO 为先删后插，改为 ON CONFLICT DO UPDATE 后不会触发删除",
                    null, ctx, stmt);
            for (String column : u.getColumns()) {
                String c = SqlTextUtils.unqualify(column);
                if (!c.equalsIgnoreCase(key)) {
                    sets.add(c + " = EXCLUDED." + c);
                }
            }
            acc.addRule("REPLACE INTO -> ON CONFLICT DO UPDATE");
        } else {
            for (String assignment : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(u.getAssignments()))) {
                Matcher a = ASSIGNMENT.matcher(assignment);
                if (!a.find()) {
                    return manual("无法识别的 UPDATE 赋值: " + assignment, stmt, ctx, acc);
                }
                String expr = replaceAll(VALUES_CALL, a.group(2).trim(), v -> "EXCLUDED." + v.group(1));
                if (u.getRowAlias() != null) {
                    expr = replaceQualified(expr, u.getRowAlias(), col -> "EXCLUDED." + col);
                }
                sets.add(SqlTextUtils.unqualify(a.group(1)) + " = " + expr);
            }
            acc.addRule("ON DUPLICATE KEY UPDATE -> ON CONFLICT DO UPDATE");
        }
        if (sets.isEmpty()) {
            return head + middle + " ON CONFLICT (" + key + ") DO NOTHING";
        }
        return head + middle + " ON CONFLICT (" + key + ") DO UPDATE SET " + String.join(", ", sets);
    }

    /**
     * 任意 upsert -> Oracle MERGE，仅支持 VALUES 形式
     */
    private String upsertToMerge(String stmt, UpsertStatement u, ConversionContext ctx, ConversionAccumulator acc) {
        if (u.getColumns().isEmpty() || !u.isValues()) {
            return manual("改写为 MERGE 需要列清单和 VALUES 子句", stmt, ctx, acc);
        }
        List<String> columns = unqualifyAll(u.getColumns());
        List<String> keys = new ArrayList<>();
        for (String c : u.getConflictColumns()) {
            keys.add(SqlTextUtils.unqualify(c));
        }
        if (keys.isEmpty()) {
            if (u.getConflictConstraint() != null) {
                return manual("ON CONFLICT ON CONSTRAINT 无法推导冲突列", stmt, ctx, acc);
            }
            keys.add(columns.get(0));
            warn(acc, WarningType.MANUAL_REVIEW_NEEDED, "MERGE 需要显式匹配条件，已假定第一列 " + columns.get(0) + " 为唯一键",
                    "请按实际主键修改 ON 条件", ctx, stmt);
        }
        String target = "t";
        String source = "s";
        List<String> selects = new ArrayList<>();
        for (List<String> row : u.getRows()) {
            if (row.size() != columns.size()) {
                return manual("VALUES 的值个数与列清单不一致", stmt, ctx, acc);
            }
            List<String> items = new ArrayList<>();
            for (int i = 0; i < row.size(); i++) {
                items.add(row.get(i) + " AS " + columns.get(i));
            }
            selects.add("SELECT " + String.join(", ", items) + " FROM DUAL");
        }
        List<String> on = new ArrayList<>();
        for (String k : keys) {
            on.add(target + "." + k + " = " + source + "." + k);
        }

        List<String> sets = new ArrayList<>();
        boolean update = u.isReplace() || (u.getKind() != UpsertStatement.Kind.PLAIN && !u.isDoNothing());
        if (u.isReplace()) {
            for (String c : columns) {
                if (!containsIgnoreCase(keys, c)) {
                    sets.add(target + "." + c + " = " + source + "." + c);
                }
            }
        } else if (update) {
            for (String assignment : SqlTextUtils.trimAll(SqlTextUtils.splitArguments(u.getAssignments()))) {
                Matcher a = ASSIGNMENT.matcher(assignment);
                if (!a.find()) {
                    return manual("无法识别的 UPDATE 赋值: " + assignment, stmt, ctx, acc);
                }
                String column = SqlTextUtils.unqualify(a.group(1));
                if (containsIgnoreCase(keys, column)) {
                    warn(acc, WarningType.PARTIAL_SUPPORT, "Oracle MERGE 不能更新 ON 条件中的列 " + column + "，该赋值已去掉",
                            null, ctx, stmt);
                    continue;
                }
                sets.add(target + "." + column + " = " + toMergeSource(a.group(2).trim(), u, columns, target, source));
            }
        }

        StringBuilder sb = new StringBuilder("MERGE INTO ").append(u.getTable()).append(' ').append(target)
                .append(" USING (").append(String.join(" UNION ALL ", selects)).append(") ").append(source)
                .append(" ON (").append(String.join(" AND ", on)).append(')');
        if (!sets.isEmpty()) {
            sb.append(" WHEN MATCHED THEN UPDATE SET ").append(String.join(", ", sets));
            if (u.getUpdateWhere() != null) {
                sb.append(" WHERE ").append(toMergeSource(u.getUpdateWhere(), u, columns, target, source));
            }
        }
        List<String> values = new ArrayList<>();
        for (String c : columns) {
            values.add(source + "." + c);
        }
        sb.append(" WHEN NOT MATCHED THEN INSERT (").append(String.join(", ", columns)).append(") VALUES (")
                .append(String.join(", ", values)).append(')');
        acc.addRule(describe(u) + " -> MERGE");
        return keepLead(stmt, sb.toString());
    }

    private static String describe(UpsertStatement u) {
        if (u.isReplace()) {
            return "REPLACE INTO";
        }
        if (u.getKind() == UpsertStatement.Kind.DUPLICATE_KEY) {
            return "ON DUPLICATE KEY UPDATE";
        }
        if (u.getKind() == UpsertStatement.Kind.CONFLICT) {
            return u.isDoNothing() ? "ON CONFLICT DO NOTHING" : "ON CONFLICT DO UPDATE";
        }
        return "INSERT IGNORE";
    }

    /**
     * 把新值引用（VALUES(c)、EXCLUDED.c、行别名 new.c）改为 s.c，目标列的裸引用补上 t.
     */
    private static String toMergeSource(String expr, UpsertStatement u, List<String> columns, String target, String source) {
        String out = replaceAll(VALUES_CALL, expr, v -> source + "." + v.group(1));
        out = replaceQualified(out, "EXCLUDED", col -> source + "." + col);
        if (u.getRowAlias() != null) {
            out = replaceQualified(out, u.getRowAlias(), col -> source + "." + col);
        }
        String table = u.getTableAlias() != null ? u.getTableAlias() : SqlTextUtils.unqualify(u.getTable());
        out = replaceQualified(out, table, col -> target + "." + col);
        for (String c : columns) {
            out = out.replaceAll("(?i)(?<![\\w$#.\"`])" + Pattern.quote(c) + "(?![\\w$#(])", target + "." + c);
        }
        return out;
    }

    // ---------------------------------------------------------------- helpers

    /**
     * 替换 alias.col 形式的引用，fn 接收列名
     */
    private static String replaceQualified(String expr, String alias, Function<String, String> fn) {
        if (alias == null) {
            return expr;
        }
        Pattern p = Pattern.compile("(?i)(?<![\\w$#.\"`])" + Pattern.quote(alias) + "\\s*\\.\\s*(" + SqlPatterns.IDENT + ")");
        return replaceAll(p, expr, m -> fn.apply(m.group(1)));
    }

    private static boolean qualifiedBy(String ref, String alias) {
        int dot = ref.lastIndexOf('.');
        return dot > 0 && SqlTextUtils.unqualify(ref.substring(0, dot)).equalsIgnoreCase(alias);
    }

    private static List<String> unqualifyAll(List<String> columns) {
        List<String> out = new ArrayList<>(columns.size());
        for (String c : columns) {
            out.add(SqlTextUtils.unqualify(c));
        }
        return out;
    }

    private static boolean containsIgnoreCase(List<String> list, String value) {
        for (String s : list) {
            if (s.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }

    private static String join(String a, String b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return "(" + a + ") AND (" + b + ")";
    }

    private static String manual(String message, String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        log.debug("MERGE/upsert 未转换: {}", message);
        warn(acc, WarningType.MANUAL_REVIEW_NEEDED, message + "，语句未转换", "请人工改写", ctx, stmt);
        return null;
    }
}
