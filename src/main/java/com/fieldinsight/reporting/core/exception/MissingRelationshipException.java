package com.fieldinsight.reporting.core.exception;

public class MissingRelationshipException extends InvalidReportConfigurationException {

    public MissingRelationshipException(String sourceTable, String targetTable) {
        super(String.format("No relationship path from '%s' to '%s'", sourceTable, targetTable));
    }
}
