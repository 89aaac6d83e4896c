package com.fieldinsight.reporting.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fieldinsight.reporting.core.model.ExecutionContext;
import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * 报表执行请求
 * configuration 保持原始 JSON，由资源类解析，以便配置错误按业务状态码返回
 */
@RegisterForReflection
public record ReportExecutionRequest(
        JsonNode configuration,
        ExecutionContext context) {
}
