package com.afsun.transpiler.core.preprocess.processor;

import com.afsun.transpiler.core.ConversionAccumulator;
import com.afsun.transpiler.core.ConversionContext;
import com.afsun.transpiler.core.config.RuleConfig;

import java.util.regex.Pattern;

/**
 * 删除 PCTFREE、PCTUSED、INITRANS、MAXTRANS 等块参数
 */
public class PhysicalAttributesProcessor extends AbstractDdlProcessor {

    private static final Pattern BLOCK_PARAMS = Pattern.compile(
            "(?i)\\s*\\b(?:PCTFREE|PCTUSED|INITRANS|MAXTRANS|FREELISTS|FREELIST\\s+GROUPS|PCTINCREASE)\\s+\\d+");

    private static final Pattern ORGANIZATION_HEAP = Pattern.compile("(?i)\\s*\\bORGANIZATION\\s+HEAP\\b");

    /**
     * 属性删完后残留的 USING INDEX
     */
    private static final Pattern DANGLING_USING_INDEX = Pattern.compile(
            "(?i)\\s*\\bUSING\\s+INDEX\\b(?=\\s*(?:[,)]|$|ENABLE\\b|DISABLE\\b))");

    @Override
    protected boolean isEnabled(RuleConfig.DdlRules rules) {
        return rules.isRemovePhysicalAttributes();
    }

    @Override
    protected String processStatement(String stmt, ConversionContext ctx, ConversionAccumulator acc) {
        String out = remove(BLOCK_PARAMS, stmt, "DDL physical attributes removed", acc);
        out = remove(ORGANIZATION_HEAP, out, "DDL ORGANIZATION HEAP removed", acc);
        return remove(DANGLING_USING_INDEX, out, "DDL USING INDEX removed", acc);
    }
}
