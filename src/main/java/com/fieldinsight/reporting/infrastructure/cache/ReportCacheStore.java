package com.fieldinsight.reporting.infrastructure.cache;

import com.fieldinsight.reporting.core.exception.CacheStoreException;
import com.fieldinsight.reporting.core.model.CacheEntry;

import java.time.Instant;
import java.util.Optional;

/**
 * 缓存存储
 * 实现方在存储不可用时抛出 {@link CacheStoreException}，过期判断由 ReportCacheManager 负责
 */
public interface ReportCacheStore {

    /**
     * 存储名称，用于日志和统计
     */
    String name();

    Optional<CacheEntry> find(String cacheKey);

    /**
     * 新增或覆盖（同一Key只保留一条）
     */
    void save(CacheEntry entry);

    void incrementHitCount(String cacheKey);

    /**
     * @return 删除的条目数
     */
    int purgeExpired(Instant now);

    /**
     * @return 删除的条目数
     */
    int invalidateReport(String reportId);
}
