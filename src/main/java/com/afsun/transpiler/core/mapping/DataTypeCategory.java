package com.afsun.transpiler.core.mapping;

import com.afsun.transpiler.core.config.RuleConfig;

public enum DataTypeCategory {
    NUMERIC,
    STRING,
    DATETIME,
    LOB,
    OTHER;

    public boolean isEnabled(RuleConfig.DataTypeRules rules) {
        switch (this) {
            case NUMERIC:
                return rules.isConvertNumericTypes();
            case STRING:
                return rules.isConvertStringTypes();
            case DATETIME:
                return rules.isConvertDateTimeTypes();
            case LOB:
                return rules.isConvertLobTypes();
            case OTHER:
            default:
                return rules.isConvertOtherTypes();
        }
    }
}
