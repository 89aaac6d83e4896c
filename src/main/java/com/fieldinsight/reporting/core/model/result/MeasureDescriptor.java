package com.fieldinsight.reporting.core.model.result;

public record MeasureDescriptor(String id, String name, String field, String aggregation, String formula) {
}
