package com.fieldinsight.reporting.application.engine;

import com.fieldinsight.reporting.config.ReportingConfig;
import com.fieldinsight.reporting.core.exception.FailureCategory;
import com.fieldinsight.reporting.core.exception.ReportEngineException;
import com.fieldinsight.reporting.core.generator.QueryBuilder;
import com.fieldinsight.reporting.core.model.ExecutionContext;
import com.fieldinsight.reporting.core.model.Filter;
import com.fieldinsight.reporting.core.model.ReportConfiguration;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;
import com.fieldinsight.reporting.core.model.result.AggregatedData;
import com.fieldinsight.reporting.core.optimizer.FilterSuggester;
import com.fieldinsight.reporting.core.optimizer.ImplicitFilterInjector;
import com.fieldinsight.reporting.core.optimizer.OptimizationResult;
import com.fieldinsight.reporting.core.optimizer.PartitionOptimizer;
import com.fieldinsight.reporting.core.transformer.ResultTransformer;
import com.fieldinsight.reporting.infrastructure.cache.CacheKey;
import com.fieldinsight.reporting.infrastructure.cache.ReportCacheManager;
import com.fieldinsight.reporting.infrastructure.persistence.ReportDataStore;
import com.fieldinsight.reporting.infrastructure.persistence.SqlRenderer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 报表执行引擎
 * 流程: 隐式过滤 -> 构建计划 -> 分区优化 -> 缓存Key -> 缓存/执行 -> 结果转换
 * 所有引擎异常都转换为 {@link ReportOutcome.Failure}，不向调用方抛出
 */
@ApplicationScoped
public class ReportingEngine {

    private static final Logger log = LoggerFactory.getLogger(ReportingEngine.class);

    @Inject
    ImplicitFilterInjector implicitFilterInjector;

    @Inject
    FilterSuggester filterSuggester;

    @Inject
    QueryBuilder queryBuilder;

    @Inject
    PartitionOptimizer partitionOptimizer;

    @Inject
    ReportCacheManager cacheManager;

    @Inject
    ReportDataStore dataStore;

    @Inject
    ResultTransformer transformer;

    @Inject
    SqlRenderer sqlRenderer;

    @Inject
    ReportingConfig config;

    @Inject
    MeterRegistry registry;

    private ExecutorService workers;

    @PostConstruct
    void init() {
        AtomicInteger seq = new AtomicInteger();
        workers = Executors.newFixedThreadPool(config.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "report-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("[Engine] Started with {} worker thread(s)", config.getWorkerThreads());
    }

    @PreDestroy
    void destroy() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 同步执行报表
     */
    public ReportOutcome execute(ReportConfiguration report, ExecutionContext context) {
        Timer.Sample sample = Timer.start(registry);
        String status = "success";
        try {
            List<Filter> implicit = implicitFilterInjector.derive(report, context);
            QueryPlan plan = queryBuilder.build(report, implicit);
            OptimizationResult optimized = partitionOptimizer.optimize(plan, report, implicit);
            CacheKey key = CacheKey.forReport(report, implicit);

            AggregatedData data = cacheManager.getOrCompute(key, cacheManager.ttlFor(report),
                    () -> run(report, optimized.plan()));

            log.info("[Engine] Report {} done: rows={}, tier={}, cacheHit={}, queryTime={}ms",
                    report.id(), data.filteredCount(), optimized.metadata().tier().code(),
                    data.cacheHit(), data.executionTimeMs());
            return ReportOutcome.success(data, optimized.metadata()
                    .withSuggestedFilters(filterSuggester.suggest(report, implicit, context)));
        } catch (ReportEngineException e) {
            status = e.getCategory().name().toLowerCase(Locale.ROOT);
            if (e.getCategory() == FailureCategory.CONFIGURATION) {
                log.warn("[Engine] Report {} rejected: {}", report.id(), e.getMessage());
            } else {
                log.error("[Engine] Report {} failed ({}): {}", report.id(), e.getCategory(), e.getMessage(), e);
            }
            return ReportOutcome.failure(e.getCategory(), e.getMessage());
        } catch (RuntimeException e) {
            status = "error";
            log.error("[Engine] Report {} failed unexpectedly", report.id(), e);
            return ReportOutcome.failure(FailureCategory.EXECUTION,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            sample.stop(Timer.builder("report.engine.execute.time")
                    .tag("status", status)
                    .register(registry));
        }
    }

    /**
     * 在工作线程池中异步执行
     */
    public CompletableFuture<ReportOutcome> submit(ReportConfiguration report, ExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> execute(report, context), workers);
    }

    /**
     * 只构建和优化，不执行查询
     *
     * @throws ReportEngineException 配置不合法
     */
    public ReportPreview preview(ReportConfiguration report, ExecutionContext context) {
        List<Filter> implicit = implicitFilterInjector.derive(report, context);
        QueryPlan plan = queryBuilder.build(report, implicit);
        OptimizationResult optimized = partitionOptimizer.optimize(plan, report, implicit);
        return new ReportPreview(optimized.plan(), sqlRenderer.render(optimized.plan()),
                optimized.metadata().withSuggestedFilters(filterSuggester.suggest(report, implicit, context)),
                CacheKey.forReport(report, implicit).toStoreKey());
    }

    /**
     * 执行查询（不分页）并转换，耗时只统计查询部分
     */
    private AggregatedData run(ReportConfiguration report, QueryPlan plan) {
        long start = System.nanoTime();
        List<Map<String, Object>> rows = dataStore.fetch(plan.unpaged());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        return transformer.transform(rows, report, plan, elapsedMs);
    }
}
