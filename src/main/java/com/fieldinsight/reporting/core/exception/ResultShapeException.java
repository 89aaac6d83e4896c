package com.fieldinsight.reporting.core.exception;

/**
 * 结果行与声明的维度/指标不符，视为数据完整性问题
 */
public class ResultShapeException extends ReportEngineException {

    public ResultShapeException(String message) {
        super(FailureCategory.TRANSFORMATION, message);
    }
}
