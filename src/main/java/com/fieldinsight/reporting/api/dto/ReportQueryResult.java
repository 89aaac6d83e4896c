package com.fieldinsight.reporting.api.dto;

import com.fieldinsight.reporting.core.model.OptimizationMetadata;
import com.fieldinsight.reporting.core.model.result.AggregatedData;
import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * 报表查询结果
 */
@RegisterForReflection
public record ReportQueryResult(
        AggregatedData data,
        OptimizationMetadata optimization,
        String status, // 业务状态码
        String msg
) {

    public static final String OK = "0000";
    public static final String INVALID_CONFIGURATION = "4001";
    public static final String DATA_UNAVAILABLE = "5001";
    public static final String DATA_INTEGRITY = "5002";

    public static ReportQueryResult success(AggregatedData data, OptimizationMetadata optimization, String msg) {
        return new ReportQueryResult(data, optimization, OK, msg);
    }

    public static ReportQueryResult error(String status, String errorMsg) {
        return new ReportQueryResult(null, null, status, errorMsg);
    }
}
