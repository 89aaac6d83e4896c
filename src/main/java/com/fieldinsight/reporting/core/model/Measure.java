package com.fieldinsight.reporting.core.model;

import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

/**
 * 聚合指标
 *
 * @param formula 派生公式，非空时忽略 field/aggregation，由被引用指标的聚合结果计算
 */
public record Measure(
        String id,
        String name,
        String field,
        String dataSource,
        AggregationType aggregation,
        DataType dataType,
        String formula,
        String displayName) {

    public Measure {
        if (id == null || id.isBlank()) {
            throw new InvalidReportConfigurationException("Measure requires an id");
        }
        dataType = dataType != null ? dataType : DataType.NUMBER;
        if (formula != null) {
            MeasureFormula.validate(formula, id);
            if (field != null) {
                SqlIdentifiers.require(field, "measure field");
            }
        } else {
            if (aggregation == null) {
                throw new InvalidReportConfigurationException("Measure '" + id + "' has no aggregation");
            }
            if (aggregation.requiresField()) {
                SqlIdentifiers.require(field, "measure field");
            } else if (field != null && !"*".equals(field)) {
                SqlIdentifiers.require(field, "measure field");
            }
        }
        SqlIdentifiers.requireDisplayName(displayName != null ? displayName : (name != null ? name : id),
                "measure " + id);
    }

    public static Measure of(String id, String field, AggregationType aggregation) {
        return new Measure(id, null, field, null, aggregation, DataType.NUMBER, null, null);
    }

    public boolean isDerived() {
        return formula != null;
    }

    public String label() {
        if (displayName != null) {
            return displayName;
        }
        return name != null ? name : id;
    }
}
