package com.afsun.transpiler.core;

import com.afsun.transpiler.core.config.ConverterProperties;
import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.dialect.DialectConverterRegistry;
import com.afsun.transpiler.core.exceptions.ConversionException;
import com.afsun.transpiler.core.exceptions.SqlParseException;
import com.afsun.transpiler.core.exceptions.UnsupportedDialectException;
import com.afsun.transpiler.core.feature.FeatureConverterChain;
import com.afsun.transpiler.core.parser.DruidStructuralParser;
import com.afsun.transpiler.core.parser.ParseOutcome;
import com.afsun.transpiler.core.parser.StructuralParser;
import com.afsun.transpiler.core.preprocess.SyntaxPreprocessor;
import com.afsun.transpiler.core.recovery.RecoveryOutcome;
import com.afsun.transpiler.core.recovery.RecoveryService;
import com.afsun.transpiler.core.split.LargeInputSplitter;
import com.afsun.transpiler.core.util.MaskedSql;
import com.afsun.transpiler.core.util.SqlTextUtils;
import com.afsun.transpiler.core.validation.SqlValidationService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * 转换编排：预处理、分块、结构解析与恢复、特性转换、方言转换、结果校验。
 * <p>
 * 每次转换（或每个分块）使用独立的收集器，组件内部的异常在各自边界转为告警，
 * 只有方言配置错误和未预期的异常会抛给调用方。
 *
 * @author afsun
 */
@Slf4j
@Component
public class DefaultSqlConverter implements SqlConverter {

    private final SyntaxPreprocessor preprocessor;

    private final StructuralParser parser;

    private final RecoveryService recoveryService;

    private final FeatureConverterChain featureChain;

    private final DialectConverterRegistry dialectRegistry;

    private final SqlValidationService validationService;

    private final LargeInputSplitter splitter;

    /**
     * 使用默认组件，供脱离 Spring 容器时使用
     */
    public DefaultSqlConverter() {
        this(new SyntaxPreprocessor(), new DruidStructuralParser(), RecoveryService.createDefault(),
                FeatureConverterChain.createDefault(), DialectConverterRegistry.createDefault(),
                new SqlValidationService(), new LargeInputSplitter(new ConverterProperties()));
    }

    @Autowired
    public DefaultSqlConverter(SyntaxPreprocessor preprocessor, StructuralParser parser, RecoveryService recoveryService,
                               FeatureConverterChain featureChain, DialectConverterRegistry dialectRegistry,
                               SqlValidationService validationService, LargeInputSplitter splitter) {
        this.preprocessor = preprocessor;
        this.parser = parser;
        this.recoveryService = recoveryService;
        this.featureChain = featureChain;
        this.dialectRegistry = dialectRegistry;
        this.validationService = validationService;
        this.splitter = splitter;
    }

    @Override
    public ConversionResult convert(String sql, Dialect sourceDialect, Dialect targetDialect, RuleConfig ruleConfig) {
        long startTime = System.currentTimeMillis();
        String traceId = "CV-" + System.currentTimeMillis();
        try {
            // 1. 校验方言
            if (sourceDialect == null || targetDialect == null) {
                throw new UnsupportedDialectException("源方言和目标方言不能为空, source={}, target={}",
                        sourceDialect, targetDialect);
            }
            RuleConfig rules = ruleConfig == null ? RuleConfig.defaults() : ruleConfig;
            ConversionResult result;
            if (StringUtils.isBlank(sql)) {
                result = emptyResult(sql, sourceDialect, targetDialect);
            } else if (sourceDialect == targetDialect) {
                // 2. 同方言直接返回原文
                result = sameDialectResult(sql, sourceDialect);
            } else if (splitter.isLarge(sql)) {
                // 3. 大输入分块并行转换
                result = splitter.convert(sql, sourceDialect, targetDialect,
                        chunk -> convertSingle(chunk, sourceDialect, targetDialect, rules));
            } else {
                result = convertSingle(sql, sourceDialect, targetDialect, rules);
            }
            return finish(traceId, startTime, result);
        } catch (UnsupportedDialectException e) {
            // 配置错误：直接抛给调用方
            log.warn("SQL转换配置异常: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("SQL转换发生未预期异常, traceId={}", traceId, e);
            throw new ConversionException("CONVERSION_ERROR", "SQL转换异常: " + e.getMessage() + ", traceId=" + traceId,
                    "请缩小SQL范围后重试，或联系维护人员", e);
        }
    }

    /**
     * 单段SQL的完整转换流程，分块转换时每个分块各执行一次
     */
    ConversionResult convertSingle(String sql, Dialect source, Dialect target, RuleConfig rules) {
        ConversionAccumulator acc = new ConversionAccumulator();

        // 1. 预处理，去掉目标库不认识的物理存储语法
        String text = preprocessor.preprocess(sql, source, target, rules, acc);
        if (source == Dialect.ORACLE && target != Dialect.ORACLE) {
            // Druid 不认识 q'[...]'，解析前改为普通字面量
            text = acc.apply("Oracle q-quote literal -> standard literal", text, MaskedSql.standardizeQuoteLiterals(text));
        }

        // 2. 结构解析，失败时修复后重试一次
        RecoveryState recoveryState = RecoveryState.NOT_NEEDED;
        ParseOutcome outcome = parser.parse(text, source);
        if (!outcome.isSuccess()) {
            SqlParseException error = outcome.getError();
            acc.warn(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.WARNING, "SQL结构解析失败: " + error.getMessage(),
                    "已尝试自动修复", error.hasPosition() ? error.position() : error.getSqlFragment());
            RecoveryOutcome recovery = SqlTextUtils.countStatements(MaskedSql.mask(text, source).getText()) > 1
                    ? recoveryService.recoverSequentially(text, error, source)
                    : recoveryService.recoverFirst(text, error, source);
            recovery.getWarnings().forEach(acc::addWarning);
            if (recovery.isSuccess()) {
                text = acc.apply("Parse recovery: " + recovery.getStrategyName(), text, recovery.getSql());
                outcome = parser.parse(text, source);
            }
            if (recovery.isSuccess() && outcome.isSuccess()) {
                recoveryState = RecoveryState.RECOVERED;
                log.debug("SQL修复后解析成功, strategy={}, confidence={}", recovery.getStrategyName(),
                        recovery.getConfidence());
            } else {
                recoveryState = RecoveryState.UNRECOVERED;
                acc.warn(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.ERROR,
                        "SQL无法解析，已按纯文本方式尽力转换: " + error.getMessage(), "请人工核对转换结果",
                        error.getSqlFragment());
            }
        }

        // 3. 屏蔽字符串和注释后依次执行特性转换与方言转换
        MaskedSql masked = MaskedSql.mask(text, source);
        ConversionContext ctx = new ConversionContext(source, target, rules, masked);
        String converted = featureChain.apply(masked.getText(), ctx, acc);
        converted = convertDialect(converted, ctx, acc);
        for (String literal : masked.unportableLiterals(converted, target)) {
            acc.warn(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.WARNING,
                    "字符串中的反斜杠转义在" + target.getDisplayName() + "中无对应写法，已原样保留",
                    "请改用目标库的字符函数（如 CHR）表示该字符", SqlTextUtils.shortSql(literal));
        }
        String restored = masked.restore(converted, target);
        if (!restored.equals(masked.restore(converted))) {
            acc.addRule("String literal quoting converted");
        }
        converted = restored;

        // 4. 校验转换结果
        List<ConversionWarning> issues = validationService.validate(text, converted, source, target, rules);
        issues.forEach(acc::addWarning);
        ValidationInfo validation = validationService.summarize(converted, target, issues);

        return ConversionResult.builder()
                .convertedSql(converted)
                .sourceDialect(source)
                .targetDialect(target)
                .warnings(acc.getWarnings())
                .appliedRules(acc.getAppliedRules())
                .validation(validation)
                .complexity(outcome.isSuccess() ? outcome.getComplexity() : null)
                .recoveryState(recoveryState)
                .build();
    }

    private String convertDialect(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        ConversionAccumulator local = new ConversionAccumulator();
        try {
            String converted = dialectRegistry.forTarget(ctx.getTarget())
                    .convertFunctionsAndTypes(maskedSql, ctx.getSource(), ctx, local);
            acc.merge(local);
            return converted;
        } catch (UnsupportedDialectException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("方言转换失败，保留特性转换结果: {}", e.getMessage());
            acc.warn(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.WARNING, "函数与数据类型转换失败: " + e.getMessage(),
                    "函数和数据类型未转换，请人工处理", SqlTextUtils.shortSql(ctx.restore(maskedSql)));
            return maskedSql;
        }
    }

    private ConversionResult emptyResult(String sql, Dialect source, Dialect target) {
        return ConversionResult.builder()
                .convertedSql(sql == null ? "" : sql.trim())
                .sourceDialect(source)
                .targetDialect(target)
                .validation(new ValidationInfo(true, 0, true, true))
                .build();
    }

    private ConversionResult sameDialectResult(String sql, Dialect dialect) {
        return ConversionResult.builder()
                .convertedSql(sql)
                .sourceDialect(dialect)
                .targetDialect(dialect)
                .warning(ConversionWarning.of(WarningType.SYNTAX_DIFFERENCE, WarningSeverity.INFO,
                        "源方言与目标方言相同，未做转换", null))
                .validation(validationService.summarize(sql, dialect, Collections.<ConversionWarning>emptyList()))
                .build();
    }

    /**
     * 补上耗时并输出汇总日志
     */
    private ConversionResult finish(String traceId, long startTime, ConversionResult result) {
        long elapsed = System.currentTimeMillis() - startTime;
        ConversionResult done = result.toBuilder().elapsedMillis(elapsed).build();
        log.info("SQL转换完成, traceId={}, {} -> {}, 告警={}, 规则={}, 分块={}, 恢复状态={}, 耗时={}ms",
                traceId, done.getSourceDialect(), done.getTargetDialect(), done.getWarnings().size(),
                done.getAppliedRules().size(), done.getChunkCount(), done.getRecoveryState(), elapsed);
        if (log.isDebugEnabled()) {
            for (String rule : done.getAppliedRules()) {
                log.debug("已应用规则: {}", rule);
            }
        }
        return done;
    }
}
