package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

import java.util.Locale;

/**
 * 时间维度粒度，对应 date_trunc 的截断单位
 */
public enum TimeGranularity {
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    QUARTER("quarter"),
    YEAR("year");

    private final String unit;

    TimeGranularity(String unit) {
        this.unit = unit;
    }

    @JsonValue
    public String unit() {
        return unit;
    }

    @JsonCreator
    public static TimeGranularity fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (TimeGranularity g : values()) {
            if (g.unit.equals(normalized)) {
                return g;
            }
        }
        throw new InvalidReportConfigurationException("Unknown time granularity: " + code);
    }
}
