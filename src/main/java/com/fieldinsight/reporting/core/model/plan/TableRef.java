package com.fieldinsight.reporting.core.model.plan;

/**
 * 查询计划中的表引用
 *
 * @param originalTable 被分区优化改写前的逻辑表名，未改写时为空
 */
public record TableRef(String table, String alias, String originalTable) {

    public static TableRef of(String table, String alias) {
        return new TableRef(table, alias, null);
    }

    public TableRef rewrittenTo(String physicalTable) {
        return new TableRef(physicalTable, alias, logicalTable());
    }

    public String logicalTable() {
        return originalTable != null ? originalTable : table;
    }

    public boolean isRewritten() {
        return originalTable != null;
    }
}
