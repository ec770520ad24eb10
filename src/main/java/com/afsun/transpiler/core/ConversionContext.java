package com.afsun.transpiler.core;

import com.afsun.transpiler.core.config.RuleConfig;
import com.afsun.transpiler.core.util.MaskedSql;
import com.afsun.transpiler.core.util.SqlTextUtils;
import lombok.Getter;

/**
 * 单次转换的只读上下文：方言、规则配置以及被屏蔽的字面量
 *
 * @author afsun
 */
@Getter
public class ConversionContext {

    private final Dialect source;

    private final Dialect target;

    private final RuleConfig ruleConfig;

    private final MaskedSql masked;

    public ConversionContext(Dialect source, Dialect target, RuleConfig ruleConfig, MaskedSql masked) {
        this.source = source;
        this.target = target;
        this.ruleConfig = ruleConfig == null ? RuleConfig.defaults() : ruleConfig;
        this.masked = masked;
    }

    public boolean is(Dialect from, Dialect to) {
        return source == from && target == to;
    }

    public String quote(String identifier) {
        return target.quote(identifier);
    }

    /**
     * 把屏蔽文本片段还原后截断，用于告警中的位置描述
     */
    public String snippet(String maskedFragment) {
        return SqlTextUtils.shortSql(masked == null ? maskedFragment : masked.restore(maskedFragment));
    }

    public String restore(String maskedText) {
        return masked == null ? maskedText : masked.restore(maskedText);
    }

    /**
     * 字面量占位符对应的字符串值，非字面量返回 null
     */
    public String literalValue(String token) {
        return masked == null ? null : masked.literalValue(token);
    }

    public String addLiteral(String value) {
        return masked == null ? "'" + value.replace("'", "''") + "'" : masked.addLiteral(value);
    }

    /**
     * 生成一段块注释占位符，注释内容为还原后的文本，后续转换器不会再匹配它
     */
    public String comment(String text) {
        String body = "/* " + restore(text).replace("*/", "* /") + " */";
        return masked == null ? body : masked.addComment(body);
    }
}
