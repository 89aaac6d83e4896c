package com.fieldinsight.reporting.core.exception;

/**
 * 查询执行失败（数据源不可达、SQL 被拒绝、超时）
 * 不自动重试，也不会写入缓存
 */
public class ReportExecutionException extends ReportEngineException {

    public ReportExecutionException(String message, Throwable cause) {
        super(FailureCategory.EXECUTION, message, cause);
    }
}
