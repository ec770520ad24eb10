package com.afsun.transpiler.core;

/**
 * 结构解析的恢复状态
 */
public enum RecoveryState {

    /**
     * 首次解析即成功
     */
    NOT_NEEDED,

    RECOVERED,

    /**
     * 恢复后仍无法解析，走纯文本转换
     */
    UNRECOVERED;

    public RecoveryState worst(RecoveryState other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
