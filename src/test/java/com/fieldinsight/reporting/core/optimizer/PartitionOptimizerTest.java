package com.fieldinsight.reporting.core.optimizer;

import com.fieldinsight.reporting.ReportFixtures;
import com.fieldinsight.reporting.core.model.DataSource;
import com.fieldinsight.reporting.core.model.Filter;
import com.fieldinsight.reporting.core.model.FilterOperator;
import com.fieldinsight.reporting.core.model.FilterValue;
import com.fieldinsight.reporting.core.model.JoinKind;
import com.fieldinsight.reporting.core.model.JoinStep;
import com.fieldinsight.reporting.core.model.OptimizationTier;
import com.fieldinsight.reporting.core.model.RelationshipPath;
import com.fieldinsight.reporting.core.model.ReportConfiguration;
import com.fieldinsight.reporting.core.model.plan.JoinClause;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;
import com.fieldinsight.reporting.core.model.plan.TableRef;
import com.fieldinsight.reporting.core.optimizer.PartitionOptimizer.FilterKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PartitionOptimizer 单元测试
 */
class PartitionOptimizerTest {

    private PartitionOptimizer optimizer;

    @BeforeEach
    void setUp() {
        optimizer = new PartitionOptimizer();
        optimizer.catalog = new PartitionCatalog(
                Map.of("petri_observations", "petri_observations_partitioned"),
                "program_id", "site_id", Set.of("created_at", "date_range"));
    }

    private OptimizationResult optimize(ReportConfiguration config) {
        QueryPlan plan = planFor(config);
        return optimizer.optimize(plan, config, List.of());
    }

    @Test
    void testOptimalTier() {
        ReportConfiguration config = ReportFixtures.growthReport(List.of(
                ReportFixtures.programIs("P"),
                ReportFixtures.siteIs("S"),
                ReportFixtures.createdBetween("2024-01-01", "2024-03-31")));

        OptimizationResult result = optimize(config);

        assertEquals(OptimizationTier.OPTIMAL, result.metadata().tier());
        assertEquals("100-500x", result.metadata().estimatedSpeedup());
        assertTrue(result.metadata().suggestions().isEmpty());
        assertEquals("petri_observations_partitioned", result.plan().base().table());
        assertEquals("petri", result.plan().base().alias());
        assertEquals("petri_observations", result.plan().base().originalTable());
        assertEquals(Map.of("petri_observations", "petri_observations_partitioned"),
                result.metadata().rewrittenTables());
    }

    @Test
    void testBasicTierWithTwoSuggestions() {
        OptimizationResult result = optimize(ReportFixtures.growthReport(List.of(ReportFixtures.programIs("P"))));

        assertEquals(OptimizationTier.BASIC, result.metadata().tier());
        assertEquals("10-50x", result.metadata().estimatedSpeedup());
        assertEquals(List.of(PartitionOptimizer.SUGGEST_SITE, PartitionOptimizer.SUGGEST_DATE),
                result.metadata().suggestions());
        assertTrue(result.plan().base().isRewritten());
    }

    @Test
    void testGoodTier() {
        OptimizationResult result = optimize(ReportFixtures.growthReport(List.of(
                ReportFixtures.programIs("P"),
                Filter.of("created_at", FilterOperator.GREATER_THAN, "2024-01-01"))));

        assertEquals(OptimizationTier.GOOD, result.metadata().tier());
        assertEquals(List.of(PartitionOptimizer.SUGGEST_SITE), result.metadata().suggestions());
    }

    @Test
    void testNoProgramFilterLeavesPlanUnchanged() {
        ReportConfiguration config = ReportFixtures.growthReport(List.of(ReportFixtures.siteIs("S")));
        QueryPlan plan = planFor(config);

        OptimizationResult result = optimizer.optimize(plan, config, List.of());

        assertEquals(OptimizationTier.NONE, result.metadata().tier());
        assertEquals(List.of(PartitionOptimizer.SUGGEST_PROGRAM), result.metadata().suggestions());
        assertSame(plan, result.plan());
        assertFalse(result.metadata().isOptimized());
    }

    @Test
    void testNoPartitionedTableMeansNoSuggestions() {
        optimizer.catalog = PartitionCatalog.empty();

        OptimizationResult result = optimize(ReportFixtures.growthReport(List.of()));

        assertEquals(OptimizationTier.NONE, result.metadata().tier());
        assertTrue(result.metadata().suggestions().isEmpty());
    }

    @Test
    void testProgramFilterOnRelatedEntityDoesNotCount() {
        RelationshipPath toPrograms = new RelationshipPath(List.of(
                JoinStep.inner("petri_observations", "pilot_programs", "program_id", "program_id")));
        Filter viaProgram = new Filter(null, "program_id", FilterOperator.EQUALS, new FilterValue.Single("P"),
                null, null, toPrograms);

        OptimizationResult result = optimize(ReportFixtures.growthReport(List.of(viaProgram)));

        assertEquals(OptimizationTier.NONE, result.metadata().tier());
    }

    @Test
    void testImplicitProgramFilterCounts() {
        ReportConfiguration config = ReportFixtures.growthReport(List.of());
        List<Filter> implicit = List.of(Filter.of("program_id", FilterOperator.IN, List.of("P1", "P2")));

        OptimizationResult result = optimizer.optimize(planFor(config), config, implicit);

        assertEquals(OptimizationTier.BASIC, result.metadata().tier());
    }

    @Test
    void testJoinedPartitionedTableRewrittenKeepingAlias() {
        optimizer.catalog = new PartitionCatalog(
                Map.of("petri_observations", "petri_observations_partitioned", "sites", "sites_by_program"),
                "program_id", "site_id", Set.of("created_at"));
        Filter siteName = Filter.of("name", FilterOperator.EQUALS, "North").onDataSource("site");
        ReportConfiguration config = new ReportConfiguration("r-join", null,
                List.of(ReportFixtures.petriSource(), ReportFixtures.sitesSource()),
                List.of(ReportFixtures.createdDate()), List.of(ReportFixtures.avgGrowth()),
                List.of(ReportFixtures.programIs("P"), siteName), List.of(), null, null, null);

        OptimizationResult result = optimize(config);

        assertEquals("sites_by_program", result.plan().joins().get(0).table().table());
        assertEquals("site", result.plan().joins().get(0).table().alias());
        assertEquals(2, result.metadata().rewrittenTables().size());
    }

    @Test
    void testTierIsMonotonic() {
        List<FilterKind> all = List.of(FilterKind.PARTITION_KEY, FilterKind.SUB_PARTITION, FilterKind.RANGE);
        for (int mask = 0; mask < 8; mask++) {
            Set<FilterKind> kinds = subset(all, mask);
            for (FilterKind extra : all) {
                Set<FilterKind> more = EnumSet.noneOf(FilterKind.class);
                more.addAll(kinds);
                more.add(extra);
                assertTrue(PartitionOptimizer.tierOf(more).compareTo(PartitionOptimizer.tierOf(kinds)) >= 0,
                        "adding " + extra + " to " + kinds + " lowered the tier");
            }
        }
    }

    @Test
    void testBaseFilterOnPrimaryCounts() {
        DataSource scoped = new DataSource("petri", null, "petri_observations", null, true,
                List.of(ReportFixtures.programIs("P")));
        ReportConfiguration config = new ReportConfiguration("r-base", null, List.of(scoped),
                List.of(ReportFixtures.createdDate()), List.of(), List.of(), List.of(), null, null, null);

        assertEquals(OptimizationTier.BASIC, optimize(config).metadata().tier());
    }

    @Test
    void testCatalogParsing() {
        PartitionCatalog catalog = PartitionCatalog.parse(
                List.of("petri_observations:petri_observations_partitioned", " "),
                "program_id", "site_id", List.of("created_at"));

        assertEquals("petri_observations_partitioned", catalog.partitionedTable("petri_observations").orElseThrow());
        assertTrue(catalog.partitionedTable("sites").isEmpty());
    }

    private static Set<FilterKind> subset(List<FilterKind> all, int mask) {
        Set<FilterKind> kinds = EnumSet.noneOf(FilterKind.class);
        for (int i = 0; i < all.size(); i++) {
            if ((mask & (1 << i)) != 0) {
                kinds.add(all.get(i));
            }
        }
        return kinds;
    }

    /**
     * 主表加上每个非主数据源的一次连接，足以覆盖优化器关心的表引用
     */
    private static QueryPlan planFor(ReportConfiguration config) {
        DataSource primary = config.primaryDataSource();
        List<JoinClause> joins = new ArrayList<>();
        for (DataSource ds : config.dataSources()) {
            if (!ds.id().equals(primary.id())) {
                joins.add(new JoinClause(JoinKind.INNER, TableRef.of(ds.table(), ds.effectiveAlias()),
                        primary.effectiveAlias(), "site_id", "site_id"));
            }
        }
        return new QueryPlan(TableRef.of(primary.table(), primary.effectiveAlias()), joins, List.of(), List.of(),
                List.of(), List.of(), config.limit(), config.offset());
    }
}
