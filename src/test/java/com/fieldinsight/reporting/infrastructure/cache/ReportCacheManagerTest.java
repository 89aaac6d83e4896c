package com.fieldinsight.reporting.infrastructure.cache;

import com.fieldinsight.reporting.ReportFixtures;
import com.fieldinsight.reporting.core.exception.CacheStoreException;
import com.fieldinsight.reporting.core.model.CacheEntry;
import com.fieldinsight.reporting.core.model.result.AggregatedData;
import com.fieldinsight.reporting.core.model.result.DataMetadata;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;

/**
 * ReportCacheManager 单元测试
 */
class ReportCacheManagerTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private MutableClock clock;
    private ReportCacheManager manager;
    private CacheKey key;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        CacheConfig config = Mockito.mock(CacheConfig.class);
        Mockito.when(config.isEnabled()).thenReturn(true);
        Mockito.when(config.getDefaultTtlSeconds()).thenReturn(300L);

        manager = newManager(config, new InMemoryStore());
        key = CacheKey.forReport(ReportFixtures.growthReport(List.of()), List.of());
    }

    @AfterEach
    void tearDown() {
        manager.destroy();
    }

    @Test
    void testPutThenGet() {
        manager.put(key, data(3), TTL);

        AggregatedData cached = manager.get(key).orElseThrow();
        assertEquals(3, cached.totalCount());
        assertEquals(1, manager.stats().hits());
    }

    @Test
    void testExpiredEntryIsMiss() {
        manager.put(key, data(3), TTL);
        clock.advance(TTL);

        assertTrue(manager.get(key).isEmpty());
        assertEquals(1, manager.stats().misses());
    }

    @Test
    void testZeroTtlNotStored() {
        manager.put(key, data(3), Duration.ZERO);

        assertTrue(manager.get(key).isEmpty());
    }

    @Test
    void testGetOrComputeMarksCacheHit() {
        AggregatedData computed = manager.getOrCompute(key, TTL, () -> data(2));
        AggregatedData cached = manager.getOrCompute(key, TTL, () -> fail("loader must not run on a hit"));

        assertFalse(computed.cacheHit());
        assertTrue(cached.cacheHit());
        assertEquals(computed.withCacheHit(true), cached);
    }

    @Test
    void testConcurrentMissesRunLoaderOnce() throws Exception {
        int callers = 8;
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch loaderStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<AggregatedData>> results = new ArrayList<>();
            results.add(pool.submit(() -> manager.getOrCompute(key, TTL, () -> {
                loads.incrementAndGet();
                loaderStarted.countDown();
                await(release);
                return data(4);
            })));
            assertTrue(loaderStarted.await(5, TimeUnit.SECONDS));

            for (int i = 1; i < callers; i++) {
                results.add(pool.submit(() -> manager.getOrCompute(key, TTL, () -> {
                    loads.incrementAndGet();
                    return data(4);
                })));
            }
            waitForCoalesced(callers - 1);
            release.countDown();

            for (Future<AggregatedData> result : results) {
                assertEquals(4, result.get(5, TimeUnit.SECONDS).totalCount());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, loads.get());
        assertEquals(callers - 1, manager.stats().coalesced());
        assertEquals(0, manager.stats().inFlight());
    }

    @Test
    void testLoaderFailureIsNotCached() {
        IllegalStateException boom = new IllegalStateException("database down");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> manager.getOrCompute(key, TTL, () -> {
                    throw boom;
                }));

        assertSame(boom, thrown);
        assertTrue(manager.get(key).isEmpty());
        assertEquals(2, manager.getOrCompute(key, TTL, () -> data(2)).totalCount());
    }

    @Test
    void testLoaderErrorReleasesWaiters() throws Exception {
        CountDownLatch loaderStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<AggregatedData> leader = pool.submit(() -> manager.getOrCompute(key, TTL, () -> {
                loaderStarted.countDown();
                await(release);
                throw new StackOverflowError("recursive formula");
            }));
            assertTrue(loaderStarted.await(5, TimeUnit.SECONDS));
            Future<AggregatedData> waiter = pool.submit(() -> manager.getOrCompute(key, TTL, () -> data(9)));
            waitForCoalesced(1);
            release.countDown();

            ExecutionException leaderFailure = assertThrows(ExecutionException.class,
                    () -> leader.get(5, TimeUnit.SECONDS));
            ExecutionException waiterFailure = assertThrows(ExecutionException.class,
                    () -> waiter.get(5, TimeUnit.SECONDS));
            assertInstanceOf(StackOverflowError.class, leaderFailure.getCause());
            assertInstanceOf(StackOverflowError.class, waiterFailure.getCause());
        } finally {
            pool.shutdownNow();
        }

        assertEquals(0, manager.stats().inFlight());
        assertTrue(manager.get(key).isEmpty());
    }

    @Test
    void testInvalidateFailureCountedAndReported() {
        CacheConfig config = Mockito.mock(CacheConfig.class);
        Mockito.when(config.isEnabled()).thenReturn(true);
        ReportCacheStore broken = Mockito.mock(ReportCacheStore.class);
        Mockito.when(broken.name()).thenReturn("broken");
        Mockito.when(broken.invalidateReport(anyString())).thenThrow(new IllegalStateException("pool closed"));

        ReportCacheManager degraded = newManager(config, broken);
        try {
            CacheStoreException thrown = assertThrows(CacheStoreException.class,
                    () -> degraded.invalidateReport("r-1"));

            assertInstanceOf(IllegalStateException.class, thrown.getCause());
            assertEquals(1, degraded.stats().storeErrors());
        } finally {
            degraded.destroy();
        }
    }

    @Test
    void testStoreFailureDegradesToMiss() {
        CacheConfig config = Mockito.mock(CacheConfig.class);
        Mockito.when(config.isEnabled()).thenReturn(true);
        ReportCacheStore broken = Mockito.mock(ReportCacheStore.class);
        Mockito.when(broken.name()).thenReturn("broken");
        Mockito.when(broken.find(anyString())).thenThrow(new CacheStoreException("connection refused", null));
        Mockito.doThrow(new CacheStoreException("connection refused", null)).when(broken).save(any());

        ReportCacheManager degraded = newManager(config, broken);
        try {
            AggregatedData result = degraded.getOrCompute(key, TTL, () -> data(1));

            assertEquals(1, result.totalCount());
            assertFalse(result.cacheHit());
            assertTrue(degraded.stats().storeErrors() >= 2);
        } finally {
            degraded.destroy();
        }
    }

    @Test
    void testDisabledCacheAlwaysComputes() {
        CacheConfig config = Mockito.mock(CacheConfig.class);
        Mockito.when(config.isEnabled()).thenReturn(false);
        ReportCacheStore store = Mockito.mock(ReportCacheStore.class);
        Mockito.when(store.name()).thenReturn("mock");

        ReportCacheManager disabled = newManager(config, store);
        try {
            AtomicInteger loads = new AtomicInteger();
            disabled.getOrCompute(key, TTL, () -> data(loads.incrementAndGet()));
            disabled.getOrCompute(key, TTL, () -> data(loads.incrementAndGet()));

            assertEquals(2, loads.get());
            Mockito.verify(store, Mockito.never()).save(any());
        } finally {
            disabled.destroy();
        }
    }

    @Test
    void testInvalidateReport() {
        manager.put(key, data(1), TTL);

        assertEquals(1, manager.invalidateReport(key.getReportId()));
        assertTrue(manager.get(key).isEmpty());
    }

    @Test
    void testPurgeExpired() {
        manager.put(key, data(1), Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(11));

        assertEquals(1, manager.purgeExpired());
    }

    @Test
    void testReportTtlOverridesDefault() {
        assertEquals(Duration.ofSeconds(300), manager.ttlFor(ReportFixtures.growthReport(List.of())));
    }

    private ReportCacheManager newManager(CacheConfig config, ReportCacheStore store) {
        ReportCacheManager m = new ReportCacheManager();
        m.config = config;
        m.store = store;
        m.clock = clock;
        m.registry = new SimpleMeterRegistry();
        m.init();
        return m;
    }

    private void waitForCoalesced(long expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (manager.stats().coalesced() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static AggregatedData data(int rows) {
        return new AggregatedData(List.of(), new DataMetadata(List.of(), List.of()), Map.of(), rows, 0, 5, false);
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    static final class InMemoryStore implements ReportCacheStore {

        private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

        @Override
        public String name() {
            return "memory";
        }

        @Override
        public Optional<CacheEntry> find(String cacheKey) {
            return Optional.ofNullable(entries.get(cacheKey));
        }

        @Override
        public void save(CacheEntry entry) {
            entries.put(entry.cacheKey(), entry);
        }

        @Override
        public void incrementHitCount(String cacheKey) {
            entries.computeIfPresent(cacheKey, (k, e) -> e.withHitCount(e.hitCount() + 1));
        }

        @Override
        public int purgeExpired(Instant now) {
            int before = entries.size();
            entries.values().removeIf(e -> e.isExpired(now));
            return before - entries.size();
        }

        @Override
        public int invalidateReport(String reportId) {
            int before = entries.size();
            entries.keySet().removeIf(k -> k.startsWith(CacheKey.reportPrefix(reportId)));
            return before - entries.size();
        }
    }
}
