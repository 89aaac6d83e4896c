package com.fieldinsight.reporting.config;

import com.fieldinsight.reporting.core.optimizer.PartitionCatalog;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 报表引擎配置
 * 统一管理执行线程池、查询超时和分区目录
 */
@ApplicationScoped
public class ReportingConfig {

    private static final Logger log = LoggerFactory.getLogger(ReportingConfig.class);

    // 执行
    @ConfigProperty(name = "report.engine.worker-threads", defaultValue = "8")
    int workerThreads;

    @ConfigProperty(name = "report.datasource.query-timeout-seconds", defaultValue = "30")
    int queryTimeoutSeconds;

    // 实体名称缓存
    @ConfigProperty(name = "report.entity-names.cache-size", defaultValue = "10000")
    int entityNameCacheSize;

    @ConfigProperty(name = "report.entity-names.ttl-minutes", defaultValue = "30")
    long entityNameTtlMinutes;

    // 分区目录
    @ConfigProperty(name = "report.partition.tables")
    Optional<List<String>> partitionTables;

    @ConfigProperty(name = "report.partition.key-field", defaultValue = "program_id")
    String partitionKeyField;

    @ConfigProperty(name = "report.partition.sub-key-field", defaultValue = "site_id")
    String subPartitionKeyField;

    @ConfigProperty(name = "report.partition.range-fields", defaultValue = "created_at,date_range")
    List<String> rangeFields;

    @PostConstruct
    void init() {
        log.info("=== Reporting Configuration ===");
        log.info("Engine:     {} worker thread(s), query timeout {}s", workerThreads, queryTimeoutSeconds);
        log.info("Names:      cache size {}, TTL {}min", entityNameCacheSize, entityNameTtlMinutes);
        log.info("Partitions: {} (key: {}, sub-key: {}, range: {})",
                partitionTables.orElse(List.of()), partitionKeyField, subPartitionKeyField, rangeFields);
        log.info("===============================");
    }

    @Produces
    @Singleton
    PartitionCatalog partitionCatalog() {
        return PartitionCatalog.parse(partitionTables.orElse(List.of()), partitionKeyField,
                subPartitionKeyField, rangeFields);
    }

    // Getters
    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public int getEntityNameCacheSize() {
        return entityNameCacheSize;
    }

    public long getEntityNameTtlMinutes() {
        return entityNameTtlMinutes;
    }
}
