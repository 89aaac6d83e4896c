package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

import java.util.Locale;

/**
 * 聚合函数（封闭集合）
 */
public enum AggregationType {
    SUM("sum"),
    AVG("avg"),
    COUNT("count"),
    MIN("min"),
    MAX("max"),
    MEDIAN("median"),
    STDDEV("stddev");

    private final String code;

    AggregationType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * count 不读取字段，其余聚合都需要字段
     */
    public boolean requiresField() {
        return this != COUNT;
    }

    @JsonCreator
    public static AggregationType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (AggregationType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new InvalidReportConfigurationException("Unsupported aggregation function: " + code);
    }
}
