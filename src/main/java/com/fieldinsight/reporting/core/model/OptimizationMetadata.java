package com.fieldinsight.reporting.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param rewrittenTables  逻辑表 -> 实际使用的分区表
 * @param suggestedFilters 可直接加入报表的建议过滤（最近项目、最近30天）
 */
public record OptimizationMetadata(
        OptimizationTier tier,
        String estimatedSpeedup,
        List<String> suggestions,
        Map<String, String> rewrittenTables,
        List<Filter> suggestedFilters) {

    public OptimizationMetadata {
        suggestions = Collections.unmodifiableList(new ArrayList<>(suggestions));
        rewrittenTables = Collections.unmodifiableMap(new LinkedHashMap<>(rewrittenTables));
        suggestedFilters = suggestedFilters != null
                ? Collections.unmodifiableList(new ArrayList<>(suggestedFilters))
                : List.of();
    }

    public OptimizationMetadata(OptimizationTier tier, String estimatedSpeedup, List<String> suggestions,
                                Map<String, String> rewrittenTables) {
        this(tier, estimatedSpeedup, suggestions, rewrittenTables, List.of());
    }

    public static OptimizationMetadata none(List<String> suggestions) {
        return new OptimizationMetadata(OptimizationTier.NONE, OptimizationTier.NONE.estimatedSpeedup(),
                suggestions, Map.of());
    }

    public OptimizationMetadata withSuggestedFilters(List<Filter> filters) {
        return new OptimizationMetadata(tier, estimatedSpeedup, suggestions, rewrittenTables, filters);
    }

    public boolean isOptimized() {
        return !rewrittenTables.isEmpty();
    }
}
