package com.fieldinsight.reporting.core.model;

import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;
import com.fieldinsight.reporting.core.exception.UndeclaredDataSourceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 报表配置
 * 由报表编辑层创建，引擎在一次执行内将其视为不可变输入
 *
 * @param cacheTtlSeconds 结果缓存时长，为空时使用全局默认值，0 表示不缓存
 */
public record ReportConfiguration(
        String id,
        String name,
        List<DataSource> dataSources,
        List<Dimension> dimensions,
        List<Measure> measures,
        List<Filter> filters,
        List<SortConfig> sort,
        Integer limit,
        Integer offset,
        Long cacheTtlSeconds) {

    public ReportConfiguration {
        if (id == null || id.isBlank()) {
            throw new InvalidReportConfigurationException("Report configuration requires an id");
        }
        dataSources = copy(dataSources);
        dimensions = copy(dimensions);
        measures = copy(measures);
        filters = copy(filters);
        sort = copy(sort);

        if (dataSources.isEmpty()) {
            throw new InvalidReportConfigurationException("Report '" + id + "' declares no data source");
        }
        if (dimensions.isEmpty() && measures.isEmpty()) {
            throw new InvalidReportConfigurationException("Report '" + id + "' declares no dimension or measure");
        }
        if (limit != null && limit < 1) {
            throw new InvalidReportConfigurationException("Limit must be positive, got " + limit);
        }
        if (offset != null && offset < 0) {
            throw new InvalidReportConfigurationException("Offset must not be negative, got " + offset);
        }
        if (cacheTtlSeconds != null && cacheTtlSeconds < 0) {
            throw new InvalidReportConfigurationException("Cache TTL must not be negative");
        }
        validateReferences(dataSources, dimensions, measures, filters);
    }

    public DataSource primaryDataSource() {
        return dataSources.stream()
                .filter(DataSource::primary)
                .findFirst()
                .orElse(dataSources.get(0));
    }

    public Optional<DataSource> dataSource(String dataSourceId) {
        return dataSources.stream().filter(ds -> ds.id().equals(dataSourceId)).findFirst();
    }

    /**
     * 为空的数据源引用指向主数据源
     */
    public DataSource resolveDataSource(String dataSourceId) {
        if (dataSourceId == null) {
            return primaryDataSource();
        }
        return dataSource(dataSourceId)
                .orElseThrow(() -> new UndeclaredDataSourceException("Reference", dataSourceId));
    }

    public Optional<Measure> measure(String measureId) {
        return measures.stream().filter(m -> m.id().equals(measureId)).findFirst();
    }

    private static void validateReferences(List<DataSource> dataSources, List<Dimension> dimensions,
                                           List<Measure> measures, List<Filter> filters) {
        Set<String> sourceIds = new HashSet<>();
        for (DataSource ds : dataSources) {
            if (!sourceIds.add(ds.id())) {
                throw new InvalidReportConfigurationException("Duplicate data source id: " + ds.id());
            }
        }
        Set<String> aliases = new HashSet<>();
        for (DataSource ds : dataSources) {
            if (!aliases.add(ds.effectiveAlias())) {
                throw new InvalidReportConfigurationException("Duplicate table alias: " + ds.effectiveAlias());
            }
            for (Filter f : ds.baseFilters()) {
                checkSource(sourceIds, "Base filter " + f.id(), f.dataSource());
            }
        }
        for (Dimension d : dimensions) {
            checkSource(sourceIds, "Dimension " + d.id(), d.dataSource());
        }
        for (Measure m : measures) {
            checkSource(sourceIds, "Measure " + m.id(), m.dataSource());
        }
        for (Filter f : filters) {
            checkSource(sourceIds, "Filter " + f.id(), f.dataSource());
        }

        Set<String> labels = new HashSet<>();
        for (Dimension d : dimensions) {
            if (!labels.add(d.label())) {
                throw new InvalidReportConfigurationException("Duplicate display name: " + d.label());
            }
        }
        for (Measure m : measures) {
            if (!labels.add(m.label())) {
                throw new InvalidReportConfigurationException("Duplicate display name: " + m.label());
            }
        }

        Map<String, Measure> byId = measures.stream()
                .collect(Collectors.toMap(Measure::id, Function.identity(), (a, b) -> {
                    throw new InvalidReportConfigurationException("Duplicate measure id: " + a.id());
                }));
        for (Measure m : measures) {
            if (!m.isDerived()) {
                continue;
            }
            for (String ref : MeasureFormula.references(m.formula())) {
                Measure target = byId.get(ref);
                if (target == null) {
                    throw new InvalidReportConfigurationException(String.format(
                            "Formula of measure '%s' references unknown measure '%s'", m.id(), ref));
                }
                if (target.isDerived()) {
                    throw new InvalidReportConfigurationException(String.format(
                            "Formula of measure '%s' references derived measure '%s'", m.id(), ref));
                }
            }
        }
    }

    private static void checkSource(Set<String> sourceIds, String owner, String dataSourceId) {
        if (dataSourceId != null && !sourceIds.contains(dataSourceId)) {
            throw new UndeclaredDataSourceException(owner, dataSourceId);
        }
    }

    private static <T> List<T> copy(List<T> list) {
        return list != null ? Collections.unmodifiableList(new ArrayList<>(list)) : List.of();
    }
}
