package com.fieldinsight.reporting.infrastructure.cache;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 结果缓存配置
 */
@ApplicationScoped
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @ConfigProperty(name = "report.cache.enabled", defaultValue = "true")
    boolean enabled;

    /**
     * caffeine | redis | jdbc
     */
    @ConfigProperty(name = "report.cache.store", defaultValue = "caffeine")
    String store;

    @ConfigProperty(name = "report.cache.default-ttl-seconds", defaultValue = "300")
    long defaultTtlSeconds;

    @ConfigProperty(name = "report.cache.caffeine.max-size", defaultValue = "1000")
    int caffeineMaxSize;

    @ConfigProperty(name = "report.cache.sweep-interval-minutes", defaultValue = "10")
    long sweepIntervalMinutes;

    @PostConstruct
    void init() {
        log.info("=== Report Cache Configuration ===");
        log.info("Cache:  {} (store: {}, default TTL: {}s)",
                enabled ? "ENABLED" : "DISABLED", store, defaultTtlSeconds);
        log.info("Caffeine max size: {}, sweep every {}min", caffeineMaxSize, sweepIntervalMinutes);
        log.info("==================================");
    }

    // Getters
    public boolean isEnabled() {
        return enabled;
    }

    public String getStore() {
        return store;
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public int getCaffeineMaxSize() {
        return caffeineMaxSize;
    }

    public long getSweepIntervalMinutes() {
        return sweepIntervalMinutes;
    }
}
