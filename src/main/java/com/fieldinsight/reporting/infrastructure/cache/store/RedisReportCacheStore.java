package com.fieldinsight.reporting.infrastructure.cache.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldinsight.reporting.core.exception.CacheStoreException;
import com.fieldinsight.reporting.core.model.CacheEntry;
import com.fieldinsight.reporting.infrastructure.cache.CacheKey;
import com.fieldinsight.reporting.infrastructure.cache.ReportCacheStore;
import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.keys.KeyCommands;
import io.quarkus.redis.datasource.value.ValueCommands;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Redis 缓存存储，多个节点共享结果
 * 条目以 JSON 保存并设置与 expiresAt 对齐的过期时间，命中次数单独计数
 */
@ApplicationScoped
@Named("redis")
public class RedisReportCacheStore implements ReportCacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisReportCacheStore.class);

    static final String HITS_SUFFIX = ":hits";

    @Inject
    RedisDataSource redis;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Clock clock;

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Optional<CacheEntry> find(String cacheKey) {
        try {
            ValueCommands<String, String> commands = redis.value(String.class);
            String json = commands.get(cacheKey);
            if (json == null) {
                return Optional.empty();
            }
            CacheEntry entry = objectMapper.readValue(json, CacheEntry.class);
            String hits = commands.get(cacheKey + HITS_SUFFIX);
            return Optional.of(hits != null ? entry.withHitCount(Long.parseLong(hits)) : entry);
        } catch (Exception e) {
            throw new CacheStoreException("Redis read failed for " + cacheKey, e);
        }
    }

    @Override
    public void save(CacheEntry entry) {
        long ttlSeconds = Math.max(1, Duration.between(clock.instant(), entry.expiresAt()).getSeconds());
        try {
            String json = objectMapper.writeValueAsString(entry.withHitCount(0));
            ValueCommands<String, String> commands = redis.value(String.class);
            commands.setex(entry.cacheKey(), ttlSeconds, json);
            redis.key().del(entry.cacheKey() + HITS_SUFFIX);
            log.debug("[Redis Store] Put: {} (ttl {}s)", entry.cacheKey(), ttlSeconds);
        } catch (Exception e) {
            throw new CacheStoreException("Redis write failed for " + entry.cacheKey(), e);
        }
    }

    @Override
    public void incrementHitCount(String cacheKey) {
        try {
            String hitsKey = cacheKey + HITS_SUFFIX;
            redis.value(String.class).incr(hitsKey);
            long ttl = redis.key().ttl(cacheKey);
            if (ttl > 0) {
                redis.key().expire(hitsKey, ttl);
            }
        } catch (Exception e) {
            throw new CacheStoreException("Redis hit count update failed for " + cacheKey, e);
        }
    }

    /**
     * Redis 按 TTL 自行过期
     */
    @Override
    public int purgeExpired(Instant now) {
        return 0;
    }

    @Override
    public int invalidateReport(String reportId) {
        try {
            KeyCommands<String> keyCommands = redis.key();
            List<String> keys = keyCommands.keys(CacheKey.reportPrefix(reportId) + "*");
            if (!keys.isEmpty()) {
                keyCommands.del(keys.toArray(new String[0]));
                log.info("[Redis Store] Invalidated {} keys for report {}", keys.size(), reportId);
            }
            return keys.size();
        } catch (Exception e) {
            throw new CacheStoreException("Redis invalidation failed for report " + reportId, e);
        }
    }
}
