package com.fieldinsight.reporting.infrastructure.cache.store;

import com.fieldinsight.reporting.core.model.CacheEntry;
import com.fieldinsight.reporting.infrastructure.cache.CacheConfig;
import com.fieldinsight.reporting.infrastructure.cache.CacheKey;
import com.fieldinsight.reporting.infrastructure.cache.ReportCacheStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * 进程内 Caffeine 缓存存储（默认）
 */
@ApplicationScoped
@Named("caffeine")
public class CaffeineReportCacheStore implements ReportCacheStore {

    private static final Logger log = LoggerFactory.getLogger(CaffeineReportCacheStore.class);

    @Inject
    CacheConfig config;

    private Cache<String, CacheEntry> cache;

    @PostConstruct
    void init() {
        cache = Caffeine.newBuilder()
                .maximumSize(config.getCaffeineMaxSize())
                .recordStats()
                .build();
        log.info("[Caffeine Store] Initialized with MaxSize={}", config.getCaffeineMaxSize());
    }

    @Override
    public String name() {
        return "caffeine";
    }

    @Override
    public Optional<CacheEntry> find(String cacheKey) {
        return Optional.ofNullable(cache.getIfPresent(cacheKey));
    }

    @Override
    public void save(CacheEntry entry) {
        cache.put(entry.cacheKey(), entry);
        log.debug("[Caffeine Store] Put: {}", entry.cacheKey());
    }

    @Override
    public void incrementHitCount(String cacheKey) {
        cache.asMap().computeIfPresent(cacheKey, (k, e) -> e.withHitCount(e.hitCount() + 1));
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = cache.asMap().size();
        cache.asMap().values().removeIf(e -> e.isExpired(now));
        return before - cache.asMap().size();
    }

    @Override
    public int invalidateReport(String reportId) {
        String prefix = CacheKey.reportPrefix(reportId);
        int before = cache.asMap().size();
        cache.asMap().keySet().removeIf(k -> k.startsWith(prefix));
        int removed = before - cache.asMap().size();
        if (removed > 0) {
            log.info("[Caffeine Store] Invalidated {} entries for report {}", removed, reportId);
        }
        return removed;
    }
}
