package com.afsun.transpiler.core.parser;

import com.afsun.transpiler.core.Dialect;

/**
 * 结构解析器接口，只用于判断SQL是否合法并统计复杂度
 *
 * @author afsun
 */
public interface StructuralParser {

    /**
     * 按指定方言解析SQL文本
     *
     * @param sql     SQL脚本
     * @param dialect 解析所用方言
     * @return 解析结果；失败时 {@link ParseOutcome#getError()} 不为空
     */
    ParseOutcome parse(String sql, Dialect dialect);
}
