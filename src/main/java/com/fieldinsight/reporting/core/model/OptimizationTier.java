package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 分区优化等级，按声明顺序递增
 */
public enum OptimizationTier {
    NONE("1x"),
    BASIC("10-50x"),
    GOOD("50-100x"),
    OPTIMAL("100-500x");

    private final String estimatedSpeedup;

    OptimizationTier(String estimatedSpeedup) {
        this.estimatedSpeedup = estimatedSpeedup;
    }

    public String estimatedSpeedup() {
        return estimatedSpeedup;
    }

    public boolean usesPartitions() {
        return this != NONE;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
