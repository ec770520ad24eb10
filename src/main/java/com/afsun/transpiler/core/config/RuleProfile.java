package com.afsun.transpiler.core.config;

/**
 * 预置的规则档位
 */
public enum RuleProfile {
    DEFAULT,
    MINIMAL,
    STRICT
}
