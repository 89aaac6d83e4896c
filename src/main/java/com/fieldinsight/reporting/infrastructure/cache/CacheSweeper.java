package com.fieldinsight.reporting.infrastructure.cache;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 定期清理过期缓存
 * 读取时已按 expiresAt 判断，清理只回收空间
 */
@Startup
@ApplicationScoped
public class CacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    @Inject
    CacheConfig config;

    @Inject
    ReportCacheManager cacheManager;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "report-cache-sweeper");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        long interval = config.getSweepIntervalMinutes();
        if (interval <= 0) {
            log.info("[Cache Sweeper] Disabled");
            return;
        }
        scheduler.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.MINUTES);
    }

    @PreDestroy
    void destroy() {
        scheduler.shutdownNow();
    }

    void sweep() {
        int removed = cacheManager.purgeExpired();
        if (removed > 0) {
            log.info("[Cache Sweeper] Purged {} expired entries", removed);
        }
    }
}
