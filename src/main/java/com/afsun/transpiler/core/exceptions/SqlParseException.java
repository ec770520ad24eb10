package com.afsun.transpiler.core.exceptions;

import lombok.Getter;

/**
 * 结构解析失败。只在引擎内部流转，由恢复子系统处理，最终以告警形式呈现
 *
 * @author afsun
 */
@Getter
public class SqlParseException extends ConversionException {

    /**
     * 出错行号，未知时为 -1
     */
    private final int line;

    /**
     * 出错列号，未知时为 -1
     */
    private final int column;

    public SqlParseException(String message, int line, int column, String sqlFragment) {
        super("SQL_PARSE_ERROR", message, "检查括号、引号是否配对，或移除目标方言不支持的物理属性", sqlFragment);
        this.line = line;
        this.column = column;
    }

    public boolean hasPosition() {
        return line > 0;
    }

    public String position() {
        return hasPosition() ? "line " + line + ", column " + column : null;
    }
}
