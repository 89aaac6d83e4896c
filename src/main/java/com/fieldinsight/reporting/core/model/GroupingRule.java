package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

/**
 * 自定义分桶规则：满足条件的行归入 label 桶
 */
public record GroupingRule(String label, FilterOperator operator, FilterValue value) {

    public GroupingRule {
        if (label == null || label.isBlank()) {
            throw new InvalidReportConfigurationException("Grouping rule requires a label");
        }
        if (operator == null) {
            throw new InvalidReportConfigurationException("Grouping rule '" + label + "' has no operator");
        }
        value = value != null ? value : FilterValue.decode(operator, null);
    }

    @JsonCreator
    public static GroupingRule of(
            @JsonProperty("label") String label,
            @JsonProperty("operator") String operator,
            @JsonProperty("value") Object value) {
        FilterOperator op = FilterOperator.fromCode(operator);
        return new GroupingRule(label, op, FilterValue.decode(op, value));
    }

    /**
     * 以分桶维度字段为对象的等价过滤条件，交给过滤编译器生成谓词
     */
    public Filter asFilter(String field) {
        return new Filter(null, field, operator, value, null, FilterLogic.AND, null);
    }
}
