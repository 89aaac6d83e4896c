package com.fieldinsight.reporting.core.model.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 报表结果
 *
 * @param totalCount      分页前行数
 * @param filteredCount   分页后行数
 * @param executionTimeMs 仅统计查询执行耗时，不含结果转换
 * @param cacheHit        结果是否来自缓存
 */
public record AggregatedData(
        List<DataPoint> data,
        DataMetadata metadata,
        Map<String, MeasureSummary> aggregations,
        int totalCount,
        int filteredCount,
        long executionTimeMs,
        boolean cacheHit) {

    public AggregatedData {
        data = Collections.unmodifiableList(new ArrayList<>(data));
        aggregations = Collections.unmodifiableMap(new LinkedHashMap<>(aggregations));
    }

    public AggregatedData withCacheHit(boolean hit) {
        if (hit == cacheHit) {
            return this;
        }
        return new AggregatedData(data, metadata, aggregations, totalCount, filteredCount, executionTimeMs, hit);
    }
}
