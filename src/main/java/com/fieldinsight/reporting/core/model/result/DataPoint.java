package com.fieldinsight.reporting.core.model.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一行结果，维度和指标都以展示名为键
 */
public record DataPoint(String id, Map<String, Object> dimensions, Map<String, MeasureValue> measures) {

    public DataPoint {
        dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        measures = Collections.unmodifiableMap(new LinkedHashMap<>(measures));
    }
}
