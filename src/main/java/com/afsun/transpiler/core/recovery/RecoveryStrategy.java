package com.afsun.transpiler.core.recovery;

import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.exceptions.SqlParseException;

/**
 * 解析失败后的文本修复策略
 *
 * @author afsun
 */
public interface RecoveryStrategy {

    String name();

    /**
     * 修复结果的可信度，取值 0~1，只用于排序和报告
     */
    double confidence();

    /**
     * 是否适用于当前文本和解析错误
     */
    boolean canHandle(String sql, SqlParseException error);

    /**
     * 修复文本
     *
     * @param sql     待修复的SQL
     * @param error   结构解析错误，可能为 null
     * @param dialect 源方言，修复后的文本按它重新解析
     */
    RecoveryAttempt recover(String sql, SqlParseException error, Dialect dialect);
}
