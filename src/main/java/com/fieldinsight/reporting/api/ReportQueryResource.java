package com.fieldinsight.reporting.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldinsight.reporting.api.dto.ReportExecutionRequest;
import com.fieldinsight.reporting.api.dto.ReportQueryResult;
import com.fieldinsight.reporting.application.engine.ReportOutcome;
import com.fieldinsight.reporting.application.engine.ReportPreview;
import com.fieldinsight.reporting.application.engine.ReportingEngine;
import com.fieldinsight.reporting.core.exception.FailureCategory;
import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;
import com.fieldinsight.reporting.core.exception.ReportEngineException;
import com.fieldinsight.reporting.core.model.ExecutionContext;
import com.fieldinsight.reporting.core.model.ReportConfiguration;
import com.fieldinsight.reporting.infrastructure.cache.CacheStats;
import com.fieldinsight.reporting.infrastructure.cache.ReportCacheManager;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 报表查询REST API
 */
@ApplicationScoped
@Path("/api/v1/reports")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ReportQueryResource {

    private static final Logger log = LoggerFactory.getLogger(ReportQueryResource.class);

    @Inject
    ReportingEngine engine;

    @Inject
    ReportCacheManager cacheManager;

    @Inject
    ObjectMapper objectMapper;

    /**
     * 执行报表，在引擎工作线程池中运行
     */
    @POST
    @Path("/execute")
    public CompletionStage<ReportQueryResult> execute(ReportExecutionRequest request) {
        ReportConfiguration config;
        try {
            config = parse(request);
        } catch (ReportEngineException e) {
            return CompletableFuture.completedFuture(
                    ReportQueryResult.error(statusOf(e.getCategory()), e.getMessage()));
        }
        log.info("收到报表请求: {}", config.id());
        return engine.submit(config, contextOf(request)).thenApply(ReportQueryResource::toResult);
    }

    /**
     * 预览优化后的查询，不执行
     */
    @POST
    @Path("/preview")
    @Blocking
    public Response preview(ReportExecutionRequest request) {
        try {
            ReportPreview preview = engine.preview(parse(request), contextOf(request));
            return Response.ok(preview).build();
        } catch (ReportEngineException e) {
            return Response.ok(ReportQueryResult.error(statusOf(e.getCategory()), e.getMessage())).build();
        }
    }

    @DELETE
    @Path("/{reportId}/cache")
    @Blocking
    public Map<String, Object> invalidate(@PathParam("reportId") String reportId) {
        try {
            int removed = cacheManager.invalidateReport(reportId);
            return Map.of("status", ReportQueryResult.OK, "removed", removed);
        } catch (ReportEngineException e) {
            log.warn("缓存失效失败: {}", reportId, e);
            return Map.of("status", ReportQueryResult.DATA_UNAVAILABLE, "msg", e.getMessage());
        }
    }

    @GET
    @Path("/cache/stats")
    public CacheStats cacheStats() {
        return cacheManager.stats();
    }

    private ReportConfiguration parse(ReportExecutionRequest request) {
        if (request == null || request.configuration() == null || request.configuration().isNull()) {
            throw new InvalidReportConfigurationException("Request carries no report configuration");
        }
        try {
            return objectMapper.treeToValue(request.configuration(), ReportConfiguration.class);
        } catch (JsonProcessingException e) {
            // 配置记录的构造校验异常被 Jackson 包装
            Throwable cause = e.getCause();
            while (cause != null) {
                if (cause instanceof ReportEngineException) {
                    throw (ReportEngineException) cause;
                }
                cause = cause.getCause();
            }
            throw new InvalidReportConfigurationException("Malformed report configuration: " + e.getOriginalMessage());
        }
    }

    private static ExecutionContext contextOf(ReportExecutionRequest request) {
        return request.context() != null ? request.context() : ExecutionContext.unscoped();
    }

    private static ReportQueryResult toResult(ReportOutcome outcome) {
        if (outcome instanceof ReportOutcome.Success) {
            ReportOutcome.Success success = (ReportOutcome.Success) outcome;
            String msg = String.format("查询成功！返回 %d 条记录，耗时 %d ms%s",
                    success.data().filteredCount(), success.data().executionTimeMs(),
                    success.data().cacheHit() ? " [缓存]" : "");
            return ReportQueryResult.success(success.data(), success.optimization(), msg);
        }
        ReportOutcome.Failure failure = (ReportOutcome.Failure) outcome;
        return ReportQueryResult.error(statusOf(failure.category()), failure.message());
    }

    static String statusOf(FailureCategory category) {
        switch (category) {
            case CONFIGURATION:
                return ReportQueryResult.INVALID_CONFIGURATION;
            case TRANSFORMATION:
                return ReportQueryResult.DATA_INTEGRITY;
            default:
                return ReportQueryResult.DATA_UNAVAILABLE;
        }
    }
}
