package com.fieldinsight.reporting.core.exception;

public class UndeclaredDataSourceException extends InvalidReportConfigurationException {

    public UndeclaredDataSourceException(String owner, String dataSourceId) {
        super(String.format("%s references undeclared data source '%s'", owner, dataSourceId));
    }
}
