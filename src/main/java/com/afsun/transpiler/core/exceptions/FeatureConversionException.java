package com.afsun.transpiler.core.exceptions;

/**
 * 特性转换器内部的不一致状态，在转换链边界被捕获并转为人工复核告警
 *
 * @author afsun
 */
public class FeatureConversionException extends ConversionException {

    public FeatureConversionException(String message, String sqlFragment) {
        super("FEATURE_CONVERSION_ERROR", message, "请人工复核该片段", sqlFragment);
    }
}
