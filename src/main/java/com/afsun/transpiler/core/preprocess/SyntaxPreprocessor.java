package com.afsun.transpiler.core.preprocess;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.preprocess.processor.CommentOnProcessor;
import com.afsun.transpiler.core.preprocess.processor.CompressProcessor;
import com.afsun.transpiler.core.preprocess.processor.ConstraintStateProcessor;
import com.afsun.transpiler.core.preprocess.processor.DefaultSysdateProcessor;
import com.afsun.transpiler.core.preprocess.processor.FlashbackArchiveProcessor;
import com.afsun.transpiler.core.preprocess.processor.LobStorageProcessor;
import com.afsun.transpiler.core.preprocess.processor.LocalGlobalIndexProcessor;
import com.afsun.transpiler.core.preprocess.processor.LoggingProcessor;
import com.afsun.transpiler.core.preprocess.processor.MonitoringProcessor;
import com.afsun.transpiler.core.preprocess.processor.MySqlTableOptionsProcessor;
import com.afsun.transpiler.core.preprocess.processor.ParallelProcessor;
import com.afsun.transpiler.core.preprocess.processor.PartitionClauseProcessor;
import com.afsun.transpiler.core.preprocess.processor.PhysicalAttributesProcessor;
import com.afsun.transpiler.core.preprocess.processor.RowDependenciesProcessor;
import com.afsun.transpiler.core.preprocess.processor.RowMovementProcessor;
import com.afsun.transpiler.core.preprocess.processor.SchemaPrefixProcessor;
import com.afsun.transpiler.core.preprocess.processor.SegmentCreationProcessor;
import com.afsun.transpiler.core.preprocess.processor.StorageClauseProcessor;
import com.afsun.transpiler.core.preprocess.processor.TableCacheProcessor;
import com.afsun.transpiler.core.preprocess.processor.TablespaceProcessor;
import com.afsun.transpiler.core.util.MaskedSql;
import com.afsun.transpiler.core.util.SqlScriptUtils;
import com.afsun.transpiler.core.util.SqlTextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 预处理流水线：在解析前去掉目标库不认识的物理存储语法。
 * <p>
 * 处理器顺序固定，字符串和注释在匹配前屏蔽、结束后还原，最后统一整理空白。
 * 对同一输入重复执行结果不变。
 *
 * @author afsun
 */
@Slf4j
@Component
public class SyntaxPreprocessor {

    private final List<SyntaxProcessor> processors;

    public SyntaxPreprocessor() {
        this(Arrays.<SyntaxProcessor>asList(
                new PartitionClauseProcessor(),
                new RowMovementProcessor(),
                new LocalGlobalIndexProcessor(),
                new LobStorageProcessor(),
                new TablespaceProcessor(),
                new StorageClauseProcessor(),
                new PhysicalAttributesProcessor(),
                new SegmentCreationProcessor(),
                new LoggingProcessor(),
                new CompressProcessor(),
                new ParallelProcessor(),
                new TableCacheProcessor(),
                new RowDependenciesProcessor(),
                new MonitoringProcessor(),
                new FlashbackArchiveProcessor(),
                new ConstraintStateProcessor(),
                new DefaultSysdateProcessor(),
                new MySqlTableOptionsProcessor(),
                new CommentOnProcessor(),
                new SchemaPrefixProcessor()));
    }

    public SyntaxPreprocessor(List<SyntaxProcessor> processors) {
        this.processors = Collections.unmodifiableList(processors);
    }

    public List<SyntaxProcessor> getProcessors() {
        return processors;
    }

    /**
     * 使用默认规则预处理，告警丢弃
     */
    public String preprocess(String sql, Dialect targetDialect) {
        return preprocess(sql, targetDialect, RuleConfig.defaults(), new ConversionAccumulator());
    }

    /**
     * 源方言未知时按 ANSI 规则屏蔽字符串（不识别反斜杠转义和 # 注释）
     */
    public String preprocess(String sql, Dialect targetDialect, RuleConfig ruleConfig, ConversionAccumulator acc) {
        return preprocess(sql, null, targetDialect, ruleConfig, acc);
    }

    public String preprocess(String sql, Dialect sourceDialect, Dialect targetDialect, RuleConfig ruleConfig,
                             ConversionAccumulator acc) {
        if (sql == null || sql.trim().isEmpty()) {
            return sql == null ? null : "";
        }
        MaskedSql masked = MaskedSql.mask(sql, sourceDialect);
        ConversionContext ctx = new ConversionContext(sourceDialect, targetDialect, ruleConfig, masked);
        String text = masked.getText();
        for (SyntaxProcessor processor : processors) {
            if (!processor.isEnabled(ctx)) {
                continue;
            }
            try {
                text = processor.process(text, ctx, acc);
            } catch (RuntimeException e) {
                log.warn("预处理器 {} 执行失败，跳过: {}", processor.name(), e.getMessage());
                acc.warn(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.WARNING,
                        "预处理步骤 " + processor.name() + " 执行失败: " + e.getMessage(),
                        "请人工检查相关DDL", SqlTextUtils.shortSql(masked.restore(text)));
            }
        }
        return masked.restore(SqlScriptUtils.collapseBlankRuns(text));
    }
}
