package com.fieldinsight.reporting.infrastructure.persistence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @param columnLabels 按输出列顺序排列的展示名，为空时使用数据库返回的列名
 */
public record SqlRequest(String sql, List<Object> params, List<String> columnLabels) {

    public SqlRequest {
        params = Collections.unmodifiableList(new ArrayList<>(params));
        columnLabels = columnLabels != null ? List.copyOf(columnLabels) : List.of();
    }

    public SqlRequest(String sql, List<Object> params) {
        this(sql, params, List.of());
    }

    public SqlRequest(String sql) {
        this(sql, Collections.emptyList());
    }
}
