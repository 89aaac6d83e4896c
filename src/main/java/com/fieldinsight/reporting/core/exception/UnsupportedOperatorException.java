package com.fieldinsight.reporting.core.exception;

public class UnsupportedOperatorException extends InvalidReportConfigurationException {

    private final String operator;

    public UnsupportedOperatorException(String operator) {
        super("Unsupported filter operator: " + operator);
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
