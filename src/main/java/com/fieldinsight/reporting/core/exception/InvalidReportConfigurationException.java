package com.fieldinsight.reporting.core.exception;

/**
 * 报表配置无效
 * 在构建/优化阶段抛出，此时尚未访问任何数据源
 */
public class InvalidReportConfigurationException extends ReportEngineException {

    public InvalidReportConfigurationException(String message) {
        super(FailureCategory.CONFIGURATION, message);
    }

    public InvalidReportConfigurationException(String message, Throwable cause) {
        super(FailureCategory.CONFIGURATION, message, cause);
    }
}
