package com.fieldinsight.reporting.core.exception;

/**
 * 过滤值与操作符的形态不匹配（区间不是两个边界、IN 列表为空、正则无法解析等）
 */
public class FilterValueException extends InvalidReportConfigurationException {

    public FilterValueException(String message) {
        super(message);
    }

    public FilterValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
