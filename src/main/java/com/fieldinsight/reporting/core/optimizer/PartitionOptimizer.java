package com.fieldinsight.reporting.core.optimizer;

import com.fieldinsight.reporting.core.model.DataSource;
import com.fieldinsight.reporting.core.model.Filter;
import com.fieldinsight.reporting.core.model.FilterOperator;
import com.fieldinsight.reporting.core.model.OptimizationMetadata;
import com.fieldinsight.reporting.core.model.OptimizationTier;
import com.fieldinsight.reporting.core.model.ReportConfiguration;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;
import com.fieldinsight.reporting.core.model.plan.TableRef;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 分区优化器
 * 根据主实体上的过滤组合判定优化等级，等级不低于 BASIC 时把计划中的逻辑表改写为分区表
 */
@ApplicationScoped
public class PartitionOptimizer {

    private static final Logger log = LoggerFactory.getLogger(PartitionOptimizer.class);

    static final String SUGGEST_PROGRAM = "Add a program filter to enable partition optimization (10-50x faster)";
    static final String SUGGEST_SITE = "Add a site filter to further narrow the scanned partitions (2-5x faster)";
    static final String SUGGEST_DATE = "Add a date range filter, recent data queries are much faster (2-10x faster)";

    /**
     * 过滤条件对分区裁剪的贡献
     */
    enum FilterKind {
        PARTITION_KEY,
        SUB_PARTITION,
        RANGE
    }

    private static final Set<FilterOperator> RANGE_OPERATORS = EnumSet.of(
            FilterOperator.BETWEEN,
            FilterOperator.GREATER_THAN,
            FilterOperator.GREATER_THAN_OR_EQUAL,
            FilterOperator.LESS_THAN,
            FilterOperator.LESS_THAN_OR_EQUAL);

    @Inject
    PartitionCatalog catalog;

    /**
     * @param implicitFilters 执行上下文注入的隐式过滤
     */
    public OptimizationResult optimize(QueryPlan plan, ReportConfiguration config, List<Filter> implicitFilters) {
        boolean applicable = plan.tables().stream()
                .anyMatch(t -> catalog.partitionedTable(t.logicalTable()).isPresent());
        if (!applicable) {
            return new OptimizationResult(plan, OptimizationMetadata.none(List.of()));
        }

        Set<FilterKind> kinds = classify(config, implicitFilters);
        OptimizationTier tier = tierOf(kinds);
        List<String> suggestions = suggestionsFor(kinds);

        if (!tier.usesPartitions()) {
            log.debug("[Partition] Report {}: no partition key filter, tables left unchanged", config.id());
            return new OptimizationResult(plan, OptimizationMetadata.none(suggestions));
        }

        Map<String, String> rewritten = new LinkedHashMap<>();
        QueryPlan optimized = plan.mapTables(ref -> rewrite(ref, rewritten));
        log.info("[Partition] Report {}: tier={}, rewritten={}", config.id(), tier.code(), rewritten);
        return new OptimizationResult(optimized,
                new OptimizationMetadata(tier, tier.estimatedSpeedup(), suggestions, rewritten));
    }

    /**
     * 过滤种类集合 -> 等级，对集合单调
     */
    static OptimizationTier tierOf(Set<FilterKind> kinds) {
        if (!kinds.contains(FilterKind.PARTITION_KEY)) {
            return OptimizationTier.NONE;
        }
        int extra = (kinds.contains(FilterKind.SUB_PARTITION) ? 1 : 0) + (kinds.contains(FilterKind.RANGE) ? 1 : 0);
        switch (extra) {
            case 2:
                return OptimizationTier.OPTIMAL;
            case 1:
                return OptimizationTier.GOOD;
            default:
                return OptimizationTier.BASIC;
        }
    }

    Set<FilterKind> classify(ReportConfiguration config, List<Filter> implicitFilters) {
        DataSource primary = config.primaryDataSource();
        List<Filter> candidates = new ArrayList<>(primary.baseFilters());
        candidates.addAll(config.filters());
        candidates.addAll(implicitFilters);

        Set<FilterKind> kinds = EnumSet.noneOf(FilterKind.class);
        for (Filter filter : candidates) {
            if (!constrainsPrimary(filter, primary) || !filter.value().isPresent()) {
                continue;
            }
            String field = filter.field();
            FilterOperator op = filter.operator();
            if (op.isPointLookup() && field.equals(catalog.keyField())) {
                kinds.add(FilterKind.PARTITION_KEY);
            } else if (op.isPointLookup() && field.equals(catalog.subKeyField())) {
                kinds.add(FilterKind.SUB_PARTITION);
            } else if (RANGE_OPERATORS.contains(op) && catalog.rangeFields().contains(field)) {
                kinds.add(FilterKind.RANGE);
            }
        }
        return kinds;
    }

    private static boolean constrainsPrimary(Filter filter, DataSource primary) {
        if (filter.hasRelationshipPath()) {
            return false;
        }
        return filter.dataSource() == null || filter.dataSource().equals(primary.id());
    }

    private static List<String> suggestionsFor(Set<FilterKind> kinds) {
        List<String> suggestions = new ArrayList<>();
        if (!kinds.contains(FilterKind.PARTITION_KEY)) {
            suggestions.add(SUGGEST_PROGRAM);
            return suggestions;
        }
        if (!kinds.contains(FilterKind.SUB_PARTITION)) {
            suggestions.add(SUGGEST_SITE);
        }
        if (!kinds.contains(FilterKind.RANGE)) {
            suggestions.add(SUGGEST_DATE);
        }
        return suggestions;
    }

    private TableRef rewrite(TableRef ref, Map<String, String> rewritten) {
        return catalog.partitionedTable(ref.logicalTable())
                .map(physical -> {
                    rewritten.put(ref.logicalTable(), physical);
                    return ref.rewrittenTo(physical);
                })
                .orElse(ref);
    }
}
