package com.afsun.transpiler.core;

import lombok.Builder;
import lombok.Value;

/**
 * 语句复杂度统计，仅用于展示，不参与流程控制
 */
@Value
@Builder
public class StatementComplexity {

    int statementCount;
    int joinCount;
    int subqueryCount;
    int functionCount;
    int aggregateCount;
    int windowFunctionCount;
    int cteCount;

    public enum Difficulty {
        SIMPLE,
        MODERATE,
        COMPLEX,
        VERY_COMPLEX
    }

    public int score() {
        return joinCount * 2 + subqueryCount * 3 + functionCount + aggregateCount * 2
                + windowFunctionCount * 3 + cteCount * 3;
    }

    public Difficulty getDifficulty() {
        int score = score();
        if (score <= 5) {
            return Difficulty.SIMPLE;
        }
        if (score <= 15) {
            return Difficulty.MODERATE;
        }
        if (score <= 35) {
            return Difficulty.COMPLEX;
        }
        return Difficulty.VERY_COMPLEX;
    }

    /**
     * 合并多个分块的统计
     */
    public StatementComplexity plus(StatementComplexity other) {
        if (other == null) {
            return this;
        }
        return StatementComplexity.builder()
                .statementCount(statementCount + other.statementCount)
                .joinCount(joinCount + other.joinCount)
                .subqueryCount(subqueryCount + other.subqueryCount)
                .functionCount(functionCount + other.functionCount)
                .aggregateCount(aggregateCount + other.aggregateCount)
                .windowFunctionCount(windowFunctionCount + other.windowFunctionCount)
                .cteCount(cteCount + other.cteCount)
                .build();
    }
}
