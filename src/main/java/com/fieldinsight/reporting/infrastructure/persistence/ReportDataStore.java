package com.fieldinsight.reporting.infrastructure.persistence;

import com.fieldinsight.reporting.core.exception.ReportExecutionException;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;

import java.util.List;
import java.util.Map;

/**
 * 报表数据源
 */
public interface ReportDataStore {

    /**
     * 执行查询计划，每行以输出列名为键
     *
     * @throws ReportExecutionException 数据源不可达、查询被拒绝或超时
     */
    List<Map<String, Object>> fetch(QueryPlan plan);
}
