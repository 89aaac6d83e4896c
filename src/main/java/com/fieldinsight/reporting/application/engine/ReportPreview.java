package com.fieldinsight.reporting.application.engine;

import com.fieldinsight.reporting.core.model.OptimizationMetadata;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;
import com.fieldinsight.reporting.infrastructure.persistence.SqlRequest;

/**
 * 不执行查询的预览：优化后的计划、将要发送的 SQL 和分区优化信息
 */
public record ReportPreview(QueryPlan plan, SqlRequest sql, OptimizationMetadata optimization, String cacheKey) {
}
