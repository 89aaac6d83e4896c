package com.fieldinsight.reporting.core.optimizer;

import com.fieldinsight.reporting.core.model.OptimizationMetadata;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;

public record OptimizationResult(QueryPlan plan, OptimizationMetadata metadata) {
}
