package com.fieldinsight.reporting.core.model;

import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 分组维度
 *
 * @param dataSource     所属数据源ID，为空表示主数据源
 * @param granularity    时间粒度，仅时间类型维度可用
 * @param enumValues     枚举取值，非空时只保留这些取值的分组
 * @param customGrouping 自定义分桶，未命中任何规则的行保留原值
 */
public record Dimension(
        String id,
        String name,
        String field,
        String dataSource,
        DataType dataType,
        TimeGranularity granularity,
        List<String> enumValues,
        List<GroupingRule> customGrouping,
        String displayName) {

    public Dimension {
        if (id == null || id.isBlank()) {
            throw new InvalidReportConfigurationException("Dimension requires an id");
        }
        SqlIdentifiers.require(field, "dimension field");
        dataType = dataType != null ? dataType : DataType.STRING;
        if (granularity != null && !dataType.isTemporal()) {
            throw new InvalidReportConfigurationException(String.format(
                    "Dimension '%s' declares granularity '%s' but is of type %s",
                    id, granularity.unit(), dataType.code()));
        }
        enumValues = enumValues != null ? Collections.unmodifiableList(new ArrayList<>(enumValues)) : List.of();
        customGrouping = customGrouping != null
                ? Collections.unmodifiableList(new ArrayList<>(customGrouping))
                : List.of();
        if (granularity != null && !customGrouping.isEmpty()) {
            throw new InvalidReportConfigurationException(
                    "Dimension '" + id + "' cannot combine time granularity with custom grouping");
        }
        SqlIdentifiers.requireDisplayName(displayName != null ? displayName : (name != null ? name : field),
                "dimension " + id);
    }

    public static Dimension of(String id, String field, DataType dataType) {
        return new Dimension(id, null, field, null, dataType, null, List.of(), List.of(), null);
    }

    /**
     * 结果中的键：展示名优先，其次名称，最后字段名
     */
    public String label() {
        if (displayName != null) {
            return displayName;
        }
        return name != null ? name : field;
    }
}
