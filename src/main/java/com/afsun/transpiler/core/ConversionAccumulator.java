package com.afsun.transpiler.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个请求（或单个分块、单个转换器）内收集告警与已应用规则的容器。
 * 不在分块或转换器之间共享，由编排器在步骤结束后合并。
 *
 * @author afsun
 */
public class ConversionAccumulator {

    private final List<ConversionWarning> warnings = new ArrayList<>();

    private final List<String> appliedRules = new ArrayList<>();

    public void addWarning(ConversionWarning warning) {
        if (warning != null) {
            warnings.add(warning);
        }
    }

    public void warn(WarningType type, WarningSeverity severity, String message, String suggestion) {
        warnings.add(ConversionWarning.of(type, severity, message, suggestion));
    }

    public void warn(WarningType type, WarningSeverity severity, String message, String suggestion, String location) {
        warnings.add(ConversionWarning.of(type, severity, message, suggestion, location));
    }

    public void addRule(String rule) {
        appliedRules.add(rule);
    }

    /**
     * 文本确实发生变化时才记录规则，返回变化后的文本
     */
    public String apply(String rule, String before, String after) {
        if (after != null && !after.equals(before)) {
            appliedRules.add(rule);
            return after;
        }
        return before;
    }

    public void merge(ConversionAccumulator other) {
        if (other == null || other == this) {
            return;
        }
        warnings.addAll(other.warnings);
        appliedRules.addAll(other.appliedRules);
    }

    public List<ConversionWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<String> getAppliedRules() {
        return Collections.unmodifiableList(appliedRules);
    }

    public boolean hasErrors() {
        for (ConversionWarning w : warnings) {
            if (w.isError()) {
                return true;
            }
        }
        return false;
    }
}
