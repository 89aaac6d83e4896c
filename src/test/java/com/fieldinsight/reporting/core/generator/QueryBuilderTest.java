package com.fieldinsight.reporting.core.generator;

import com.fieldinsight.reporting.ReportFixtures;
import com.fieldinsight.reporting.core.compiler.FilterPredicateCompiler;
import com.fieldinsight.reporting.core.exception.InvalidFilterRangeException;
import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;
import com.fieldinsight.reporting.core.model.AggregationType;
import com.fieldinsight.reporting.core.model.DataType;
import com.fieldinsight.reporting.core.model.Dimension;
import com.fieldinsight.reporting.core.model.Filter;
import com.fieldinsight.reporting.core.model.FilterLogic;
import com.fieldinsight.reporting.core.model.FilterOperator;
import com.fieldinsight.reporting.core.model.GroupingRule;
import com.fieldinsight.reporting.core.model.JoinKind;
import com.fieldinsight.reporting.core.model.Measure;
import com.fieldinsight.reporting.core.model.ReportConfiguration;
import com.fieldinsight.reporting.core.model.SortConfig;
import com.fieldinsight.reporting.core.model.SortDirection;
import com.fieldinsight.reporting.core.model.TimeGranularity;
import com.fieldinsight.reporting.core.model.plan.JoinClause;
import com.fieldinsight.reporting.core.model.plan.PredicateFragment;
import com.fieldinsight.reporting.core.model.plan.PredicateGroup;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;
import com.fieldinsight.reporting.core.model.plan.SelectItem;
import com.fieldinsight.reporting.core.relationship.RelationshipResolver;
import com.fieldinsight.reporting.infrastructure.persistence.SqlRenderer;
import com.fieldinsight.reporting.infrastructure.persistence.SqlRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryBuilder 单元测试
 */
class QueryBuilderTest {

    private QueryBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new QueryBuilder();
        builder.compiler = new FilterPredicateCompiler();
        builder.resolver = new RelationshipResolver();
    }

    @Test
    void testFungicideScenario() {
        ReportConfiguration config = ReportFixtures.growthReport(List.of(ReportFixtures.fungicideUsed()));

        QueryPlan plan = builder.build(config);

        assertEquals("petri_observations", plan.base().table());
        assertEquals("petri", plan.base().alias());

        SelectItem day = plan.select().get(0);
        assertEquals(SelectItem.Kind.TRUNCATED_DATE, day.kind());
        assertEquals(TimeGranularity.DAY, day.granularity());
        assertEquals("Created Date", day.alias());

        SelectItem avg = plan.select().get(1);
        assertEquals(SelectItem.Kind.AGGREGATE, avg.kind());
        assertEquals(AggregationType.AVG, avg.aggregation());
        assertEquals("growth_index", avg.field());

        List<PredicateFragment> predicates = plan.predicates();
        assertEquals(1, predicates.size());
        assertEquals("petri.fungicide_used = ?", predicates.get(0).sql());
        assertEquals(List.of("Yes"), predicates.get(0).parameters());

        assertEquals(List.of("Created Date"), plan.groupBy());
        assertTrue(plan.joins().isEmpty());
    }

    @Test
    void testFungicideScenarioRendersToSql() {
        QueryPlan plan = builder.build(ReportFixtures.growthReport(List.of(ReportFixtures.fungicideUsed())));

        SqlRequest request = new SqlRenderer().render(plan);

        assertEquals("SELECT date_trunc('day', petri.created_at) AS c1, "
                + "AVG(petri.growth_index) AS c2 FROM petri_observations AS petri "
                + "WHERE petri.fungicide_used = ? GROUP BY 1", request.sql());
        assertEquals(List.of("Yes"), request.params());
    }

    @Test
    void testBuildIsDeterministic() {
        ReportConfiguration config = ReportFixtures.growthReport(List.of(
                ReportFixtures.fungicideUsed(),
                ReportFixtures.programIs("P1"),
                ReportFixtures.createdBetween("2024-01-01", "2024-03-31")));

        assertEquals(builder.build(config), builder.build(config));
    }

    @Test
    void testReversedRangeProducesNoPlan() {
        Filter reversed = Filter.of("growth_index", FilterOperator.BETWEEN, List.of(20, 10));
        ReportConfiguration config = ReportFixtures.growthReport(List.of(reversed));

        assertThrows(InvalidFilterRangeException.class, () -> builder.build(config));
    }

    @Test
    void testDimensionOnRelatedSourceAddsJoin() {
        Dimension siteName = new Dimension("site_name", "Site", "name", "site", DataType.STRING,
                null, List.of(), List.of(), null);
        ReportConfiguration config = new ReportConfiguration("r-join", null,
                List.of(ReportFixtures.petriSource(), ReportFixtures.sitesSource()),
                List.of(siteName),
                List.of(ReportFixtures.avgGrowth()),
                List.of(Filter.of("name", FilterOperator.STARTS_WITH, "North").onDataSource("site")),
                List.of(), null, null, null);

        QueryPlan plan = builder.build(config);

        assertEquals(1, plan.joins().size(), "dimension and filter share one join");
        JoinClause join = plan.joins().get(0);
        assertEquals(JoinKind.INNER, join.kind());
        assertEquals("sites", join.table().table());
        assertEquals("site", join.table().alias());
        assertEquals("petri", join.leftAlias());
        assertEquals("site_id", join.leftField());
        assertEquals("site.name", plan.select().get(0).tableAlias() + "." + plan.select().get(0).field());
        assertEquals("site.name", plan.predicates().get(0).column());
    }

    @Test
    void testSameFieldOrFiltersAreGrouped() {
        Filter north = Filter.of("site_id", FilterOperator.EQUALS, "S1").withLogic(FilterLogic.OR);
        Filter south = Filter.of("site_id", FilterOperator.EQUALS, "S2").withLogic(FilterLogic.OR);
        ReportConfiguration config = ReportFixtures.growthReport(List.of(north, south, ReportFixtures.fungicideUsed()));

        QueryPlan plan = builder.build(config);

        assertEquals(2, plan.where().size());
        PredicateGroup sites = plan.where().get(0);
        assertEquals(FilterLogic.OR, sites.logic());
        assertEquals(2, sites.fragments().size());
        assertEquals(FilterLogic.AND, plan.where().get(1).logic());
    }

    @Test
    void testImplicitFiltersAppendedAfterExplicit() {
        ReportConfiguration config = ReportFixtures.growthReport(List.of(ReportFixtures.fungicideUsed()));

        QueryPlan plan = builder.build(config, List.of(Filter.of("company_id", FilterOperator.EQUALS, "C1")));

        assertEquals(2, plan.predicates().size());
        assertEquals("petri.company_id = ?", plan.predicates().get(1).sql());
    }

    @Test
    void testImplicitFilterKeepsExplicitOrGroup() {
        Filter programA = Filter.of("program_id", FilterOperator.EQUALS, "A").withLogic(FilterLogic.OR);
        Filter programB = Filter.of("program_id", FilterOperator.EQUALS, "B").withLogic(FilterLogic.OR);
        Filter allowed = Filter.of("program_id", FilterOperator.IN, List.of("A", "B", "C"));

        QueryPlan plan = builder.build(ReportFixtures.growthReport(List.of(programA, programB)), List.of(allowed));

        assertEquals(2, plan.where().size());
        assertEquals(FilterLogic.OR, plan.where().get(0).logic());
        assertEquals(2, plan.where().get(0).fragments().size());
        assertEquals("petri.program_id IN (?, ?, ?)", plan.where().get(1).fragments().get(0).sql());

        SqlRequest request = new SqlRenderer().render(plan);
        assertTrue(request.sql().contains(
                "WHERE (petri.program_id = ? OR petri.program_id = ?) AND petri.program_id IN (?, ?, ?)"));
    }

    @Test
    void testCustomGroupingAndEnumValues() {
        Dimension band = new Dimension("band", "Growth Band", "growth_stage", null, DataType.STRING, null,
                List.of("early", "late"),
                List.of(GroupingRule.of("Early", "equals", "early")),
                null);
        ReportConfiguration config = new ReportConfiguration("r-band", null,
                List.of(ReportFixtures.petriSource()), List.of(band), List.of(ReportFixtures.avgGrowth()),
                List.of(), List.of(), null, null, null);

        QueryPlan plan = builder.build(config);

        SelectItem item = plan.select().get(0);
        assertEquals(SelectItem.Kind.BUCKET, item.kind());
        assertEquals("Early", item.buckets().get(0).label());
        assertEquals("petri.growth_stage IN (?, ?)", plan.predicates().get(0).sql());
    }

    @Test
    void testSortResolvesMeasureByIdAndPagingCarried() {
        ReportConfiguration config = new ReportConfiguration("r-sort", null,
                List.of(ReportFixtures.petriSource()),
                List.of(ReportFixtures.createdDate()),
                List.of(ReportFixtures.avgGrowth(), Measure.of("obs_count", null, AggregationType.COUNT)),
                List.of(),
                List.of(new SortConfig("created_date", SortDirection.ASC, 2),
                        new SortConfig("avg_growth", SortDirection.DESC, 1)),
                50, 10, null);

        QueryPlan plan = builder.build(config);

        assertEquals("Avg Growth", plan.orderBy().get(0).alias());
        assertEquals(SortDirection.DESC, plan.orderBy().get(0).direction());
        assertEquals("Created Date", plan.orderBy().get(1).alias());
        assertNull(plan.select().get(2).field());
        assertEquals(50, plan.limit());
        assertEquals(10, plan.offset());
    }

    @Test
    void testUnknownSortFieldRejected() {
        ReportConfiguration config = new ReportConfiguration("r-sort", null,
                List.of(ReportFixtures.petriSource()),
                List.of(ReportFixtures.createdDate()), List.of(), List.of(),
                List.of(new SortConfig("nope", SortDirection.ASC, 0)), null, null, null);

        assertThrows(InvalidReportConfigurationException.class, () -> builder.build(config));
    }
}
