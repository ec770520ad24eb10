package com.afsun.transpiler.core.mapping;

/**
 * 函数改写时对参数的处理方式
 */
public enum ParameterTransform {

    /**
     * 仅改名，参数原样保留
     */
    DIRECT,

    /**
     * 交换前两个参数，如 INSTR(s, sub) -> LOCATE(sub, s)
     */
    SWAP_FIRST_TWO,

    /**
     * NVL2 / DECODE / IF 改写为 CASE WHEN
     */
    TO_CASE_WHEN,

    /**
     * 日期格式字面量按目标方言重写
     */
    DATE_FORMAT_CONVERT,

    /**
     * 单参数调用改写为 CAST(x AS 目标类型)，目标名即类型名
     */
    CAST
}
