package com.afsun.transpiler.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 转换引擎运行参数，对应 application.yml 中的 sql.converter.*
 *
 * @author afsun
 */
@Data
@ConfigurationProperties(prefix = "sql.converter")
public class ConverterProperties {

    public static final int DEFAULT_LARGE_INPUT_THRESHOLD = 100_000;

    public static final int DEFAULT_CHUNK_STATEMENT_COUNT = 50;

    /**
     * 超过该字符数的输入按语句分块并行转换
     */
    private int largeInputThreshold = DEFAULT_LARGE_INPUT_THRESHOLD;

    /**
     * 每个分块包含的语句数
     */
    private int chunkStatementCount = DEFAULT_CHUNK_STATEMENT_COUNT;

    /**
     * 分块转换线程数，默认为CPU核数并限制在 2~8
     */
    private int workerThreads = Math.max(2, Math.min(8, Runtime.getRuntime().availableProcessors()));

    /**
     * 请求未携带规则配置时使用的档位
     */
    private RuleProfile defaultProfile = RuleProfile.DEFAULT;
}
