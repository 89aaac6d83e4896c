package com.fieldinsight.reporting.core.transformer;

import com.fieldinsight.reporting.core.exception.ResultShapeException;
import com.fieldinsight.reporting.core.model.Dimension;
import com.fieldinsight.reporting.core.model.Measure;
import com.fieldinsight.reporting.core.model.ReportConfiguration;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;
import com.fieldinsight.reporting.core.model.result.AggregatedData;
import com.fieldinsight.reporting.core.model.result.DataMetadata;
import com.fieldinsight.reporting.core.model.result.DataPoint;
import com.fieldinsight.reporting.core.model.result.DimensionDescriptor;
import com.fieldinsight.reporting.core.model.result.MeasureDescriptor;
import com.fieldinsight.reporting.core.model.result.MeasureSummary;
import com.fieldinsight.reporting.core.model.result.MeasureValue;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 结果转换器
 * 原始行 -> AggregatedData；统一空值策略：缺失、非数值、NaN、无穷大的指标都是 NoValue
 */
@ApplicationScoped
public class ResultTransformer {

    private static final Logger log = LoggerFactory.getLogger(ResultTransformer.class);

    @Inject
    EntityNameLookup entityNames = EntityNameLookup.NONE;

    /**
     * @param plan            用于分页的查询计划（数据源返回的是不分页的行）
     * @param executionTimeMs 查询执行耗时
     */
    public AggregatedData transform(List<Map<String, Object>> rows, ReportConfiguration config, QueryPlan plan,
                                    long executionTimeMs) {
        int total = rows.size();
        int from = Math.min(plan.offset() != null ? plan.offset() : 0, total);
        int to = plan.limit() != null ? (int) Math.min((long) from + plan.limit(), total) : total;
        List<Map<String, Object>> window = rows.subList(from, to);
        Map<String, Map<String, String>> names = entityNamesFor(window, config);

        List<DataPoint> points = new ArrayList<>(window.size());
        for (int i = 0; i < window.size(); i++) {
            Map<String, Object> row = window.get(i);
            Map<String, Object> dims = new LinkedHashMap<>();
            for (Dimension dim : config.dimensions()) {
                Object value = normalizeDimension(lookup(row, dim.label(), dim.field(), "dimension", dim.id()));
                dims.put(dim.label(), displayValue(value, names.get(dim.id())));
            }
            Map<String, MeasureValue> measures = new LinkedHashMap<>();
            for (Measure measure : config.measures()) {
                measures.put(measure.label(),
                        toMeasureValue(lookup(row, measure.label(), measure.field(), "measure", measure.id())));
            }
            points.add(new DataPoint("row-" + (from + i), dims, measures));
        }

        Map<String, MeasureSummary> summaries = new LinkedHashMap<>();
        for (Measure measure : config.measures()) {
            summaries.put(measure.label(), summarize(points, measure.label()));
        }

        log.debug("[Transform] Report {}: {} row(s), {} after paging", config.id(), total, points.size());
        return new AggregatedData(points, metadata(config, points), summaries, total, points.size(),
                executionTimeMs, false);
    }

    /**
     * 实体键维度（项目/站点/提交ID）的展示名，按维度ID分组；时间截断和自定义分桶的维度不解析
     */
    private Map<String, Map<String, String>> entityNamesFor(List<Map<String, Object>> window,
                                                            ReportConfiguration config) {
        Map<String, Map<String, String>> byDimension = new HashMap<>();
        for (Dimension dim : config.dimensions()) {
            if (dim.granularity() != null || !dim.customGrouping().isEmpty()) {
                continue;
            }
            Set<String> ids = new LinkedHashSet<>();
            for (Map<String, Object> row : window) {
                Object value = normalizeDimension(lookup(row, dim.label(), dim.field(), "dimension", dim.id()));
                if (value != null) {
                    ids.add(String.valueOf(value));
                }
            }
            if (ids.isEmpty()) {
                continue;
            }
            Map<String, String> resolved = entityNames.resolve(dim.field(), ids);
            if (!resolved.isEmpty()) {
                byDimension.put(dim.id(), resolved);
            }
        }
        return byDimension;
    }

    private static Object displayValue(Object value, Map<String, String> names) {
        if (value == null || names == null) {
            return value;
        }
        String name = names.get(String.valueOf(value));
        return name != null ? name : value;
    }

    private static Object lookup(Map<String, Object> row, String label, String field, String kind, String id) {
        if (row.containsKey(label)) {
            return row.get(label);
        }
        if (field != null && row.containsKey(field)) {
            return row.get(field);
        }
        throw new ResultShapeException(String.format(
                "Result row is missing %s '%s' (column '%s')", kind, id, label));
    }

    static Object normalizeDimension(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toInstant().toString();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().toString();
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant().toString();
        }
        if (value instanceof TemporalAccessor || value instanceof UUID) {
            return value.toString();
        }
        return value;
    }

    static MeasureValue toMeasureValue(Object raw) {
        if (raw instanceof MeasureValue) {
            return (MeasureValue) raw;
        }
        if (raw instanceof Number) {
            return MeasureValue.of(((Number) raw).doubleValue());
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim();
            if (text.isEmpty()) {
                return MeasureValue.NO_VALUE;
            }
            try {
                return MeasureValue.of(Double.parseDouble(text));
            } catch (NumberFormatException e) {
                // "-"、"N/A" 之类的占位符
                return MeasureValue.NO_VALUE;
            }
        }
        return MeasureValue.NO_VALUE;
    }

    private static MeasureSummary summarize(List<DataPoint> points, String label) {
        int valueCount = 0;
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (DataPoint point : points) {
            MeasureValue v = point.measures().get(label);
            if (v == null || !v.isPresent()) {
                continue;
            }
            double d = v.doubleValue();
            valueCount++;
            sum += d;
            min = Math.min(min, d);
            max = Math.max(max, d);
        }
        if (valueCount == 0) {
            return new MeasureSummary(points.size(), 0, MeasureValue.NO_VALUE, MeasureValue.NO_VALUE,
                    MeasureValue.NO_VALUE, MeasureValue.NO_VALUE);
        }
        return new MeasureSummary(points.size(), valueCount, MeasureValue.of(sum), MeasureValue.of(sum / valueCount),
                MeasureValue.of(min), MeasureValue.of(max));
    }

    private static DataMetadata metadata(ReportConfiguration config, List<DataPoint> points) {
        List<DimensionDescriptor> dims = new ArrayList<>();
        for (Dimension dim : config.dimensions()) {
            Set<Object> unique = new HashSet<>();
            points.forEach(p -> unique.add(p.dimensions().get(dim.label())));
            dims.add(new DimensionDescriptor(dim.id(), dim.label(), dim.field(), dim.dataType().code(),
                    dim.granularity() != null ? dim.granularity().unit() : null, unique.size()));
        }
        List<MeasureDescriptor> measures = new ArrayList<>();
        for (Measure m : config.measures()) {
            measures.add(new MeasureDescriptor(m.id(), m.label(), m.field(),
                    m.aggregation() != null ? m.aggregation().code() : null, m.formula()));
        }
        return new DataMetadata(dims, measures);
    }
}
