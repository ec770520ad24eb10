package com.afsun.transpiler.core.recovery.strategy;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionWarning;
import com.afsun.transpiler.core.Dialect;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.afsun.transpiler.core.preprocess.SyntaxPreprocessor;
import com.afsun.transpiler.core.preprocess.SyntaxProcessor;
import com.afsun.transpiler.core.preprocess.processor.CompressProcessor;
import com.afsun.transpiler.core.preprocess.processor.LobStorageProcessor;
import com.afsun.transpiler.core.preprocess.processor.LoggingProcessor;
import com.afsun.transpiler.core.preprocess.processor.MonitoringProcessor;
import com.afsun.transpiler.core.preprocess.processor.ParallelProcessor;
import com.afsun.transpiler.core.preprocess.processor.PhysicalAttributesProcessor;
import com.afsun.transpiler.core.preprocess.processor.RowMovementProcessor;
import com.afsun.transpiler.core.preprocess.processor.SegmentCreationProcessor;
import com.afsun.transpiler.core.preprocess.processor.StorageClauseProcessor;
import com.afsun.transpiler.core.preprocess.processor.TablespaceProcessor;
import com.afsun.transpiler.core.recovery.AbstractRecoveryStrategy;
import com.afsun.transpiler.core.recovery.RecoveryAttempt;
import com.afsun.transpiler.core.util.MaskedSql;
import com.afsun.transpiler.core.util.SqlScriptUtils;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * 删除存储相关的物理属性后重试。复用预处理中的物理属性处理器。
 *
 * @author afsun
 */
@Component
public class PhysicalAttributeRemovalStrategy extends AbstractRecoveryStrategy {

    private static final Pattern PHYSICAL = Pattern.compile(
            "(?i)\\b(TABLESPACE|STORAGE\\s*\\(|PCTFREE|PCTUSED|INITRANS|MAXTRANS|(?:NO)?LOGGING|(?:NO)?COMPRESS"
                    + "|NOPARALLEL|PARALLEL\\s*(?:\\d|\\()|SEGMENT\\s+CREATION|(?:NO)?MONITORING|ROW\\s+MOVEMENT"
                    + "|SECUREFILE|BASICFILE)\\b");

    private final SyntaxPreprocessor physicalOnly;

    public PhysicalAttributeRemovalStrategy() {
        super("physical-attribute removal", 0.95);
        this.physicalOnly = new SyntaxPreprocessor(Arrays.<SyntaxProcessor>asList(
                new RowMovementProcessor(),
                new LobStorageProcessor(),
                new TablespaceProcessor(),
                new StorageClauseProcessor(),
                new PhysicalAttributesProcessor(),
                new SegmentCreationProcessor(),
                new LoggingProcessor(),
                new CompressProcessor(),
                new ParallelProcessor(),
                new MonitoringProcessor()));
    }

    @Override
    public boolean canHandle(String sql, SqlParseException error) {
        return PHYSICAL.matcher(MaskedSql.mask(sql, null).getText()).find();
    }

    @Override
    public RecoveryAttempt recover(String sql, SqlParseException error, Dialect dialect) {
        // 处理器在目标不是 Oracle 时才生效，这里固定按 PostgreSQL 执行，产出的规则记录丢弃
        String cleaned = physicalOnly.preprocess(sql, dialect, Dialect.POSTGRESQL, RuleConfig.defaults(),
                new ConversionAccumulator());
        if (cleaned.equals(SqlScriptUtils.collapseBlankRuns(sql))) {
            return RecoveryAttempt.failure(sql, name());
        }
        return attempt(sql, cleaned, ConversionWarning.of(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.INFO,
                "解析失败，已删除表空间、存储参数等物理属性后重试", "请在目标库单独规划存储参数"));
    }
}
