package com.fieldinsight.reporting.core.model;

import com.fieldinsight.reporting.core.model.result.AggregatedData;

import java.time.Instant;

/**
 * 缓存记录，对应 report_cache 表的一行
 */
public record CacheEntry(
        String reportId,
        String cacheKey,
        String parametersHash,
        AggregatedData payload,
        Instant createdAt,
        Instant expiresAt,
        long hitCount) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public CacheEntry withHitCount(long count) {
        return new CacheEntry(reportId, cacheKey, parametersHash, payload, createdAt, expiresAt, count);
    }
}
