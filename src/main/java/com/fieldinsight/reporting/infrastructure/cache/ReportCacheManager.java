package com.fieldinsight.reporting.infrastructure.cache;

import com.fieldinsight.reporting.core.exception.CacheStoreException;
import com.fieldinsight.reporting.core.model.CacheEntry;
import com.fieldinsight.reporting.core.model.ReportConfiguration;
import com.fieldinsight.reporting.core.model.result.AggregatedData;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.literal.NamedLiteral;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 报表结果缓存管理器
 * 同一Key的并发未命中只触发一次计算（single-flight），不同Key互不阻塞；
 * 计算失败会通知全部等待者且不写入缓存；存储异常降级为未命中
 */
@ApplicationScoped
public class ReportCacheManager {

    private static final Logger log = LoggerFactory.getLogger(ReportCacheManager.class);

    @Inject
    CacheConfig config;

    @Inject
    @Any
    Instance<ReportCacheStore> stores;

    @Inject
    Clock clock;

    @Inject
    MeterRegistry registry;

    ReportCacheStore store;

    private final ConcurrentHashMap<String, CompletableFuture<AggregatedData>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong coalesced = new AtomicLong();
    private final AtomicLong storeErrors = new AtomicLong();

    private Counter hitCounter;
    private Counter missCounter;

    // 命中计数异步更新，不占用请求线程
    private final ExecutorService hitExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "report-cache-hits");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        if (store == null) {
            Instance<ReportCacheStore> selected = stores.select(NamedLiteral.of(config.getStore()));
            if (!selected.isResolvable()) {
                throw new IllegalStateException("Unknown report cache store: " + config.getStore());
            }
            store = selected.get();
        }
        hitCounter = Counter.builder("report.cache.hit").tag("store", store.name()).register(registry);
        missCounter = Counter.builder("report.cache.miss").tag("store", store.name()).register(registry);
        log.info("[Cache] Using {} store", store.name());
    }

    @PreDestroy
    void destroy() {
        hitExecutor.shutdownNow();
    }

    /**
     * 报表自身的 TTL 优先，否则使用全局默认值
     */
    public Duration ttlFor(ReportConfiguration report) {
        long seconds = report.cacheTtlSeconds() != null ? report.cacheTtlSeconds() : config.getDefaultTtlSeconds();
        return Duration.ofSeconds(seconds);
    }

    /**
     * 仅在未过期时返回结果，并异步累加命中次数
     */
    public Optional<AggregatedData> get(CacheKey key) {
        Optional<CacheEntry> entry = lookup(key);
        if (entry.isEmpty()) {
            misses.incrementAndGet();
            missCounter.increment();
            log.debug("[Cache] Miss: {}", key);
            return Optional.empty();
        }
        hits.incrementAndGet();
        hitCounter.increment();
        log.debug("[Cache] Hit: {}", key);
        String storeKey = key.toStoreKey();
        hitExecutor.execute(() -> {
            try {
                store.incrementHitCount(storeKey);
            } catch (RuntimeException e) {
                log.warn("[Cache] Hit count update failed for {}: {}", storeKey, e.getMessage());
            }
        });
        return Optional.of(entry.get().payload());
    }

    /**
     * 新增或覆盖，命中次数清零；TTL 不大于 0 时不写入
     */
    public void put(CacheKey key, AggregatedData payload, Duration ttl) {
        if (!config.isEnabled() || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(key.getReportId(), key.toStoreKey(), key.getParametersHash(),
                payload.withCacheHit(false), now, now.plus(ttl), 0);
        try {
            store.save(entry);
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("[Cache] Put failed for key {}: {}", key, e.getMessage());
        }
    }

    /**
     * 读取缓存，未命中时执行 loader 并写入
     * 同一Key的并发调用共享同一次 loader 执行
     *
     * @return 命中时 cacheHit 为 true
     */
    public AggregatedData getOrCompute(CacheKey key, Duration ttl, Supplier<AggregatedData> loader) {
        Optional<AggregatedData> cached = get(key);
        if (cached.isPresent()) {
            return cached.get().withCacheHit(true);
        }

        String storeKey = key.toStoreKey();
        CompletableFuture<AggregatedData> mine = new CompletableFuture<>();
        CompletableFuture<AggregatedData> running = inFlight.putIfAbsent(storeKey, mine);
        if (running != null) {
            coalesced.incrementAndGet();
            log.debug("[Cache] Joining in-flight computation: {}", key);
            return await(running);
        }

        try {
            // 上一个计算者可能刚写入并退出
            Optional<CacheEntry> raced = lookup(key);
            if (raced.isPresent()) {
                AggregatedData data = raced.get().payload().withCacheHit(true);
                mine.complete(data);
                return data;
            }
            AggregatedData result = loader.get();
            put(key, result, ttl);
            mine.complete(result);
            return result;
        } catch (Throwable e) {
            // Error 同样需要通知等待者
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(storeKey, mine);
        }
    }

    /**
     * 失效失败计入存储错误并抛出
     *
     * @return 删除的条目数
     * @throws CacheStoreException 存储不可用
     */
    public int invalidateReport(String reportId) {
        try {
            int removed = store.invalidateReport(reportId);
            log.info("[Cache] Invalidated {} entries for report {}", removed, reportId);
            return removed;
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("[Cache] Invalidation failed for report {}: {}", reportId, e.getMessage());
            if (e instanceof CacheStoreException) {
                throw e;
            }
            throw new CacheStoreException("Cache invalidation failed for report " + reportId, e);
        }
    }

    public int purgeExpired() {
        try {
            return store.purgeExpired(clock.instant());
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("[Cache] Purge failed: {}", e.getMessage());
            return 0;
        }
    }

    public CacheStats stats() {
        return new CacheStats(store.name(), hits.get(), misses.get(), coalesced.get(), storeErrors.get(),
                inFlight.size());
    }

    private Optional<CacheEntry> lookup(CacheKey key) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }
        try {
            return store.find(key.toStoreKey()).filter(e -> !e.isExpired(clock.instant()));
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("[Cache] Get failed for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private static AggregatedData await(CompletableFuture<AggregatedData> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw e;
        }
    }
}
