package com.afsun.transpiler.core;

public enum WarningSeverity {
    INFO,
    WARNING,
    ERROR
}
