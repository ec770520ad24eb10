package com.afsun.transpiler.core.config;

import lombok.Builder;
import lombok.Value;

/**
 * 转换规则配置快照。不可变，由调用方持有并随请求传入。
 *
 * @author afsun
 */
@Value
@Builder(toBuilder = true)
public class RuleConfig {

    @Builder.Default
    DataTypeRules dataTypeRules = DataTypeRules.builder().build();

    @Builder.Default
    FunctionRules functionRules = FunctionRules.builder().build();

    @Builder.Default
    DdlRules ddlRules = DdlRules.builder().build();

    @Builder.Default
    SyntaxRules syntaxRules = SyntaxRules.builder().build();

    @Builder.Default
    WarningSettings warningSettings = WarningSettings.builder().build();

    private static final RuleConfig DEFAULTS = RuleConfig.builder().build();

    /**
     * 全部规则开启
     */
    public static RuleConfig defaults() {
        return DEFAULTS;
    }

    /**
     * 只做类型、函数映射和物理属性清理，不做结构性改写
     */
    public static RuleConfig minimal() {
        return RuleConfig.builder()
                .ddlRules(DdlRules.builder()
                        .convertSequences(false)
                        .convertIndexes(false)
                        .convertMaterializedViews(false)
                        .convertSynonyms(false)
                        .convertUserDefinedTypes(false)
                        .convertDatabaseLinks(false)
                        .build())
                .syntaxRules(SyntaxRules.builder()
                        .convertMerge(false)
                        .convertHierarchicalQuery(false)
                        .convertRecursiveCte(false)
                        .convertPivot(false)
                        .convertWindowFunctions(false)
                        .convertPackageCalls(false)
                        .convertDateArithmetic(false)
                        .build())
                .warningSettings(WarningSettings.builder()
                        .warnSelectStar(false)
                        .warnLeadingWildcard(false)
                        .build())
                .build();
    }

    /**
     * 全部规则开启，性能告警阈值收紧
     */
    public static RuleConfig strict() {
        return RuleConfig.builder()
                .warningSettings(WarningSettings.builder()
                        .maxInClauseSize(50)
                        .maxSubqueryDepth(2)
                        .build())
                .build();
    }

    public static RuleConfig of(RuleProfile profile) {
        if (profile == null) {
            return defaults();
        }
        switch (profile) {
            case MINIMAL:
                return minimal();
            case STRICT:
                return strict();
            case DEFAULT:
            default:
                return defaults();
        }
    }

    @Value
    @Builder(toBuilder = true)
    public static class DataTypeRules {
        @Builder.Default
        boolean convertNumericTypes = true;
        @Builder.Default
        boolean convertStringTypes = true;
        @Builder.Default
        boolean convertDateTimeTypes = true;
        @Builder.Default
        boolean convertLobTypes = true;
        @Builder.Default
        boolean convertOtherTypes = true;
        /**
         * VARCHAR2(10 BYTE) 中的 BYTE/CHAR 长度语义
         */
        @Builder.Default
        boolean removeByteSuffix = true;
    }

    @Value
    @Builder(toBuilder = true)
    public static class FunctionRules {
        @Builder.Default
        boolean convertNullHandling = true;
        @Builder.Default
        boolean convertConditional = true;
        @Builder.Default
        boolean convertDateFunctions = true;
        @Builder.Default
        boolean convertStringFunctions = true;
        @Builder.Default
        boolean convertNumericFunctions = true;
        @Builder.Default
        boolean convertSystemFunctions = true;
    }

    @Value
    @Builder(toBuilder = true)
    public static class DdlRules {
        @Builder.Default
        boolean removeTablespace = true;
        @Builder.Default
        boolean removeStorageClause = true;
        @Builder.Default
        boolean removePhysicalAttributes = true;
        @Builder.Default
        boolean removeSchemaPrefix = true;
        @Builder.Default
        boolean convertComments = true;
        @Builder.Default
        boolean convertSequences = true;
        @Builder.Default
        boolean convertIndexes = true;
        @Builder.Default
        boolean convertMaterializedViews = true;
        @Builder.Default
        boolean convertSynonyms = true;
        @Builder.Default
        boolean convertUserDefinedTypes = true;
        @Builder.Default
        boolean convertDatabaseLinks = true;
    }

    @Value
    @Builder(toBuilder = true)
    public static class SyntaxRules {
        @Builder.Default
        boolean convertMerge = true;
        @Builder.Default
        boolean convertOuterJoins = true;
        @Builder.Default
        boolean convertHierarchicalQuery = true;
        @Builder.Default
        boolean convertRecursiveCte = true;
        @Builder.Default
        boolean convertPivot = true;
        @Builder.Default
        boolean convertWindowFunctions = true;
        @Builder.Default
        boolean convertPackageCalls = true;
        @Builder.Default
        boolean convertDateArithmetic = true;
        @Builder.Default
        boolean convertPseudoColumns = true;
        @Builder.Default
        boolean convertPagination = true;
        @Builder.Default
        boolean convertIdentifierQuoting = true;
    }

    @Value
    @Builder(toBuilder = true)
    public static class WarningSettings {
        @Builder.Default
        int maxInClauseSize = 100;
        @Builder.Default
        int maxSubqueryDepth = 3;
        @Builder.Default
        boolean warnLeadingWildcard = true;
        @Builder.Default
        boolean warnSelectStar = true;
        @Builder.Default
        boolean warnFunctionLoss = true;
        @Builder.Default
        double functionLossRatio = 0.5;
    }
}
