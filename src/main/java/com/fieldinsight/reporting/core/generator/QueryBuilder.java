package com.fieldinsight.reporting.core.generator;

import com.fieldinsight.reporting.core.compiler.FilterPredicateCompiler;
import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;
import com.fieldinsight.reporting.core.model.DataSource;
import com.fieldinsight.reporting.core.model.Dimension;
import com.fieldinsight.reporting.core.model.Filter;
import com.fieldinsight.reporting.core.model.FilterLogic;
import com.fieldinsight.reporting.core.model.FilterOperator;
import com.fieldinsight.reporting.core.model.GroupingRule;
import com.fieldinsight.reporting.core.model.JoinStep;
import com.fieldinsight.reporting.core.model.Measure;
import com.fieldinsight.reporting.core.model.RelationshipPath;
import com.fieldinsight.reporting.core.model.ReportConfiguration;
import com.fieldinsight.reporting.core.model.SortConfig;
import com.fieldinsight.reporting.core.model.plan.JoinClause;
import com.fieldinsight.reporting.core.model.plan.OrderItem;
import com.fieldinsight.reporting.core.model.plan.PredicateFragment;
import com.fieldinsight.reporting.core.model.plan.PredicateGroup;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;
import com.fieldinsight.reporting.core.model.plan.SelectItem;
import com.fieldinsight.reporting.core.model.plan.TableRef;
import com.fieldinsight.reporting.core.relationship.RelationshipResolver;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 查询计划构建器
 * 纯转换：ReportConfiguration -> QueryPlan，不访问任何数据源；相同输入总是得到结构相同的计划
 */
@ApplicationScoped
public class QueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(QueryBuilder.class);

    @Inject
    FilterPredicateCompiler compiler;

    @Inject
    RelationshipResolver resolver;

    public QueryPlan build(ReportConfiguration config) {
        return build(config, List.of());
    }

    /**
     * @param implicitFilters 由执行上下文注入的隐式过滤，与报表自身的过滤一并生效
     */
    public QueryPlan build(ReportConfiguration config, List<Filter> implicitFilters) {
        DataSource primary = config.primaryDataSource();
        JoinCollector joins = new JoinCollector(config, primary);

        // 1. 投影：维度在前，指标在后
        List<SelectItem> select = new ArrayList<>();
        List<String> groupBy = new ArrayList<>();
        List<PredicateGroup> enumPredicates = new ArrayList<>();

        for (Dimension dim : config.dimensions()) {
            String alias = joins.aliasFor(dim.dataSource());
            select.add(dimensionProjection(dim, alias));
            groupBy.add(dim.label());
            if (!dim.enumValues().isEmpty()) {
                Filter restriction = Filter.of(dim.field(), FilterOperator.IN, dim.enumValues());
                enumPredicates.add(PredicateGroup.single(compiler.compile(restriction, alias)));
            }
        }
        for (Measure measure : config.measures()) {
            if (measure.isDerived()) {
                select.add(SelectItem.formula(measure.label(), measure.id(), measure.formula()));
            } else {
                String alias = joins.aliasFor(measure.dataSource());
                String field = measure.aggregation().requiresField() ? measure.field() : null;
                select.add(SelectItem.aggregate(measure.label(), measure.id(), alias, field,
                        measure.aggregation()));
            }
        }

        // 2. 过滤：数据源静态过滤、报表过滤、隐式过滤各自按字段分组，组间始终 AND
        List<Filter> baseFilters = new ArrayList<>();
        for (DataSource ds : config.dataSources()) {
            for (Filter base : ds.baseFilters()) {
                baseFilters.add(base.dataSource() == null ? base.onDataSource(ds.id()) : base);
            }
        }
        List<PredicateGroup> where = new ArrayList<>();
        where.addAll(groupFilters(baseFilters, joins));
        where.addAll(groupFilters(config.filters(), joins));
        where.addAll(groupFilters(implicitFilters, joins));
        where.addAll(enumPredicates);

        // 3. 排序
        List<OrderItem> orderBy = new ArrayList<>();
        List<SortConfig> sorts = new ArrayList<>(config.sort());
        sorts.sort(Comparator.comparingInt(SortConfig::priority));
        for (SortConfig sort : sorts) {
            SelectItem target = select.stream()
                    .filter(item -> item.sourceId().equals(sort.field()) || item.alias().equals(sort.field()))
                    .findFirst()
                    .orElseThrow(() -> new InvalidReportConfigurationException(
                            "Sort field '" + sort.field() + "' is neither a dimension nor a measure"));
            orderBy.add(new OrderItem(target.alias(), sort.direction()));
        }

        QueryPlan plan = new QueryPlan(
                TableRef.of(primary.table(), primary.effectiveAlias()),
                joins.clauses(),
                select,
                where,
                groupBy,
                orderBy,
                config.limit(),
                config.offset());

        log.debug("[QueryBuilder] Report {}: {} projection(s), {} join(s), {} predicate group(s)",
                config.id(), select.size(), plan.joins().size(), where.size());
        return plan;
    }

    /**
     * 同一字段的过滤归为一组，组内全部声明 or 时 OR 组合，否则 AND
     */
    private List<PredicateGroup> groupFilters(List<Filter> filters, JoinCollector joins) {
        Map<String, List<PredicateFragment>> grouped = new LinkedHashMap<>();
        Map<String, Boolean> allOr = new LinkedHashMap<>();
        for (Filter filter : filters) {
            String alias = filter.hasRelationshipPath()
                    ? joins.aliasForPath(filter.relationshipPath(), filter.dataSource())
                    : joins.aliasFor(filter.dataSource());
            PredicateFragment fragment = compiler.compile(filter, alias);
            grouped.computeIfAbsent(fragment.column(), k -> new ArrayList<>()).add(fragment);
            allOr.merge(fragment.column(), filter.logic() == FilterLogic.OR, Boolean::logicalAnd);
        }
        List<PredicateGroup> groups = new ArrayList<>();
        grouped.forEach((column, fragments) -> {
            FilterLogic logic = fragments.size() > 1 && allOr.get(column) ? FilterLogic.OR : FilterLogic.AND;
            groups.add(new PredicateGroup(logic, fragments));
        });
        return groups;
    }

    private SelectItem dimensionProjection(Dimension dim, String alias) {
        if (dim.granularity() != null) {
            return SelectItem.truncatedDate(dim.label(), dim.id(), alias, dim.field(), dim.granularity());
        }
        if (!dim.customGrouping().isEmpty()) {
            List<SelectItem.Bucket> buckets = new ArrayList<>();
            for (GroupingRule rule : dim.customGrouping()) {
                buckets.add(new SelectItem.Bucket(rule.label(), compiler.compile(rule.asFilter(dim.field()), alias)));
            }
            return SelectItem.bucket(dim.label(), dim.id(), alias, dim.field(), buckets);
        }
        return SelectItem.column(dim.label(), dim.id(), alias, dim.field());
    }

    /**
     * 收集主数据源到其它数据源的连接，相同的连接只保留一份
     */
    private final class JoinCollector {

        private final ReportConfiguration config;
        private final DataSource primary;
        private final Map<String, JoinClause> byAlias = new LinkedHashMap<>();

        JoinCollector(ReportConfiguration config, DataSource primary) {
            this.config = config;
            this.primary = primary;
        }

        String aliasFor(String dataSourceId) {
            if (dataSourceId == null || dataSourceId.equals(primary.id())) {
                return primary.effectiveAlias();
            }
            DataSource target = config.resolveDataSource(dataSourceId);
            RelationshipPath path = resolver.require(primary.table(), target.table());
            merge(path, target);
            return target.effectiveAlias();
        }

        String aliasForPath(RelationshipPath path, String dataSourceId) {
            if (!path.sourceTable().equals(primary.table())) {
                throw new InvalidReportConfigurationException(String.format(
                        "Relationship path starts at '%s' but the primary table is '%s'",
                        path.sourceTable(), primary.table()));
            }
            DataSource target = dataSourceId != null ? config.resolveDataSource(dataSourceId) : null;
            if (target != null && !target.table().equals(path.targetTable())) {
                target = null;
            }
            merge(path, target);
            return target != null ? target.effectiveAlias() : aliasForTable(path.targetTable());
        }

        private void merge(RelationshipPath path, DataSource target) {
            String left = primary.effectiveAlias();
            List<JoinStep> steps = path.steps();
            for (int i = 0; i < steps.size(); i++) {
                JoinStep step = steps.get(i);
                boolean last = i == steps.size() - 1;
                String alias = last && target != null ? target.effectiveAlias() : aliasForTable(step.toTable());
                JoinClause clause = new JoinClause(step.kind(), TableRef.of(step.toTable(), alias), left,
                        step.joinField(), step.foreignField());
                JoinClause existing = byAlias.putIfAbsent(alias, clause);
                if (existing != null && !existing.equals(clause)) {
                    throw new InvalidReportConfigurationException(String.format(
                            "Conflicting joins for alias '%s': %s vs %s", alias, existing, clause));
                }
                left = alias;
            }
        }

        /**
         * 中间表：若报表声明了同表数据源则沿用其别名，否则用表名
         */
        private String aliasForTable(String table) {
            if (table.equals(primary.table())) {
                return primary.effectiveAlias();
            }
            return config.dataSources().stream()
                    .filter(ds -> ds.table().equals(table))
                    .map(DataSource::effectiveAlias)
                    .findFirst()
                    .orElse(table);
        }

        List<JoinClause> clauses() {
            return new ArrayList<>(byAlias.values());
        }
    }
}
