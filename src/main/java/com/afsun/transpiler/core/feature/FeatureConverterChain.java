package com.afsun.transpiler.core.feature;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.WarningSeverity;
import com.afsun.transpiler.core.WarningType;
import com.afsun.transpiler.core.exceptions.FeatureConversionException;
import com.afsun.transpiler.core.util.SqlTextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 按 order 顺序依次执行特性转换器。
 * <p>
 * 每个转换器使用独立的收集器，成功后再合并；转换器抛出异常时丢弃它的输出，
 * 记录一条需人工复核的告警，其余转换器照常执行。
 *
 * @author afsun
 */
@Slf4j
@Component
public class FeatureConverterChain {

    private final List<FeatureConverter> converters;

    @Autowired
    public FeatureConverterChain(List<FeatureConverter> converters) {
        List<FeatureConverter> sorted = new ArrayList<>(converters);
        sorted.sort(Comparator.comparingInt(FeatureConverter::order));
        this.converters = Collections.unmodifiableList(sorted);
    }

    /**
     * 默认的全部特性转换器
     */
    public static FeatureConverterChain createDefault() {
        HierarchicalQueryRewriter hierarchical = new HierarchicalQueryRewriter();
        return new FeatureConverterChain(Arrays.<FeatureConverter>asList(
                new SynonymConverter(),
                new DatabaseLinkConverter(),
                new MaterializedViewConverter(),
                new UserDefinedTypeConverter(),
                new SequenceConverter(),
                new IndexConverter(),
                new MergeConverter(),
                new OuterJoinConverter(),
                new HierarchicalQueryConverter(hierarchical),
                new CteConverter(),
                new PivotUnpivotConverter(),
                new WindowFunctionConverter(),
                new PackageCallConverter(),
                new DateArithmeticConverter(),
                new PseudoColumnConverter()));
    }

    public List<FeatureConverter> getConverters() {
        return converters;
    }

    public String apply(String maskedSql, ConversionContext ctx, ConversionAccumulator acc) {
        String text = maskedSql;
        for (FeatureConverter converter : converters) {
            if (!converter.isEnabled(ctx.getRuleConfig()) || !converter.isApplicable(text, ctx)) {
                continue;
            }
            ConversionAccumulator local = new ConversionAccumulator();
            try {
                String converted = converter.convert(text, ctx, local);
                acc.merge(local);
                text = converted;
            } catch (RuntimeException e) {
                log.warn("特性转换器 {} 执行失败，已跳过: {}", converter.name(), e.getMessage());
                log.debug("特性转换器异常详情", e);
                String location = e instanceof FeatureConversionException
                        ? ((FeatureConversionException) e).getSqlFragment()
                        : SqlTextUtils.shortSql(ctx.restore(text));
                acc.warn(WarningType.MANUAL_REVIEW_NEEDED, WarningSeverity.WARNING,
                        converter.name() + " 转换失败: " + e.getMessage(), "相关语法未转换，请人工处理", location);
            }
        }
        return text;
    }
}
