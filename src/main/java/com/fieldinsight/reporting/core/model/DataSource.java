package com.fieldinsight.reporting.core.model;

import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 逻辑表引用
 * 分区优化只改写查询计划中的表引用，不会修改调用方持有的 DataSource
 *
 * @param baseFilters 静态过滤，每次执行都会作用在该数据源上
 */
public record DataSource(
        String id,
        String name,
        String table,
        String alias,
        boolean primary,
        List<Filter> baseFilters) {

    public DataSource {
        if (id == null || id.isBlank()) {
            throw new InvalidReportConfigurationException("Data source requires an id");
        }
        SqlIdentifiers.require(table, "table");
        if (alias != null) {
            SqlIdentifiers.require(alias, "table alias");
        }
        baseFilters = baseFilters != null
                ? Collections.unmodifiableList(new ArrayList<>(baseFilters))
                : List.of();
    }

    public static DataSource of(String id, String table) {
        return new DataSource(id, null, table, null, false, List.of());
    }

    /**
     * SQL 中使用的表别名：显式别名优先，其次ID（ID 不是合法标识符时退回表名）
     */
    public String effectiveAlias() {
        if (alias != null) {
            return alias;
        }
        return SqlIdentifiers.isValid(id) ? id : table;
    }
}
