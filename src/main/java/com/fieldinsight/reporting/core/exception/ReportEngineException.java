package com.fieldinsight.reporting.core.exception;

/**
 * 报表引擎异常基类
 */
public abstract class ReportEngineException extends RuntimeException {

    private final FailureCategory category;

    protected ReportEngineException(FailureCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected ReportEngineException(FailureCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public FailureCategory getCategory() {
        return category;
    }
}
