package com.fieldinsight.reporting.core.model.plan;

import com.fieldinsight.reporting.core.model.FilterOperator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 参数化谓词片段
 * sql 中只有经过校验的列名和 ? 占位符，取值全部在 parameters 中按顺序绑定
 *
 * @param column 带表别名的列，如 obs.site_id
 */
public record PredicateFragment(String column, FilterOperator operator, String sql, List<Object> parameters) {

    public PredicateFragment {
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }
}
