package com.afsun.transpiler.core;

import lombok.Data;

/**
 * 转换告警：有损、近似或需要人工处理的转换
 */
@Data
public class ConversionWarning {
    private final WarningType type;
    private final String message;
    private final WarningSeverity severity;
    private final String suggestion;
    private final String location;

    private ConversionWarning(WarningType type, String message, WarningSeverity severity, String suggestion, String location) {
        this.type = type;
        this.message = message;
        this.severity = severity;
        this.suggestion = suggestion;
        this.location = location;
    }

    public static ConversionWarning of(WarningType type, WarningSeverity severity, String message, String suggestion, String location) {
        return new ConversionWarning(type, message, severity, suggestion, location);
    }

    public static ConversionWarning of(WarningType type, WarningSeverity severity, String message, String suggestion) {
        return new ConversionWarning(type, message, severity, suggestion, null);
    }

    public static ConversionWarning of(WarningType type, WarningSeverity severity, String message) {
        return new ConversionWarning(type, message, severity, null, null);
    }

    public boolean isError() {
        return severity == WarningSeverity.ERROR;
    }
}
