package com.fieldinsight.reporting.core.model;

import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

/**
 * @param field    维度/指标的ID或展示名
 * @param priority 越小越先排序
 */
public record SortConfig(String field, SortDirection direction, int priority) {

    public SortConfig {
        if (field == null || field.isBlank()) {
            throw new InvalidReportConfigurationException("Sort configuration requires a field");
        }
        direction = direction != null ? direction : SortDirection.ASC;
    }
}
