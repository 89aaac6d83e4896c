package com.fieldinsight.reporting.core.model.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 查询计划（结构化中间表示）
 * 构建器只产出该结构，SQL 文本仅在存储适配层生成
 *
 * @param groupBy 参与分组的投影项别名
 */
public record QueryPlan(
        TableRef base,
        List<JoinClause> joins,
        List<SelectItem> select,
        List<PredicateGroup> where,
        List<String> groupBy,
        List<OrderItem> orderBy,
        Integer limit,
        Integer offset) {

    public QueryPlan {
        joins = copy(joins);
        select = copy(select);
        where = copy(where);
        groupBy = copy(groupBy);
        orderBy = copy(orderBy);
    }

    /**
     * 计划中出现的全部表引用（主表在前）
     */
    public List<TableRef> tables() {
        List<TableRef> tables = new ArrayList<>();
        tables.add(base);
        joins.forEach(j -> tables.add(j.table()));
        return tables;
    }

    public QueryPlan mapTables(UnaryOperator<TableRef> mapper) {
        List<JoinClause> mappedJoins = new ArrayList<>(joins.size());
        for (JoinClause join : joins) {
            mappedJoins.add(join.withTable(mapper.apply(join.table())));
        }
        return new QueryPlan(mapper.apply(base), mappedJoins, select, where, groupBy, orderBy, limit, offset);
    }

    /**
     * 去掉分页，供数据源返回完整结果以便同时统计总行数和分页后行数
     */
    public QueryPlan unpaged() {
        return new QueryPlan(base, joins, select, where, groupBy, orderBy, null, null);
    }

    public List<PredicateFragment> predicates() {
        List<PredicateFragment> all = new ArrayList<>();
        where.forEach(g -> all.addAll(g.fragments()));
        return all;
    }

    private static <T> List<T> copy(List<T> list) {
        return list != null ? Collections.unmodifiableList(new ArrayList<>(list)) : List.of();
    }
}
