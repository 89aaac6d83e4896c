package com.fieldinsight.reporting.core.model.plan;

import com.fieldinsight.reporting.core.model.AggregationType;
import com.fieldinsight.reporting.core.model.TimeGranularity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 投影项
 *
 * @param alias    输出列名（维度/指标的展示名）
 * @param sourceId 对应的维度/指标ID
 */
public record SelectItem(
        Kind kind,
        String alias,
        String sourceId,
        String tableAlias,
        String field,
        AggregationType aggregation,
        TimeGranularity granularity,
        List<Bucket> buckets,
        String formula) {

    public enum Kind {
        /** 原始列 */
        COLUMN,
        /** date_trunc 截断后的时间列 */
        TRUNCATED_DATE,
        /** CASE WHEN 分桶 */
        BUCKET,
        /** 聚合函数 */
        AGGREGATE,
        /** 由其它聚合项计算的派生指标 */
        FORMULA
    }

    /**
     * 分桶：满足 condition 的行输出 label
     */
    public record Bucket(String label, PredicateFragment condition) {
    }

    public SelectItem {
        buckets = buckets != null ? Collections.unmodifiableList(new ArrayList<>(buckets)) : List.of();
    }

    public static SelectItem column(String alias, String sourceId, String tableAlias, String field) {
        return new SelectItem(Kind.COLUMN, alias, sourceId, tableAlias, field, null, null, List.of(), null);
    }

    public static SelectItem truncatedDate(String alias, String sourceId, String tableAlias, String field,
                                           TimeGranularity granularity) {
        return new SelectItem(Kind.TRUNCATED_DATE, alias, sourceId, tableAlias, field, null, granularity,
                List.of(), null);
    }

    public static SelectItem bucket(String alias, String sourceId, String tableAlias, String field,
                                    List<Bucket> buckets) {
        return new SelectItem(Kind.BUCKET, alias, sourceId, tableAlias, field, null, null, buckets, null);
    }

    public static SelectItem aggregate(String alias, String sourceId, String tableAlias, String field,
                                       AggregationType aggregation) {
        return new SelectItem(Kind.AGGREGATE, alias, sourceId, tableAlias, field, aggregation, null,
                List.of(), null);
    }

    public static SelectItem formula(String alias, String sourceId, String formula) {
        return new SelectItem(Kind.FORMULA, alias, sourceId, null, null, null, null, List.of(), formula);
    }
}
