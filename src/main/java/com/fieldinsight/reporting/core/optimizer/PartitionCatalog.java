package com.fieldinsight.reporting.core.optimizer;

import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;
import com.fieldinsight.reporting.core.model.SqlIdentifiers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 分区目录：逻辑表 -> 按项目分区的物理表，以及分区相关字段
 */
public final class PartitionCatalog {

    private final Map<String, String> partitionedTables;
    private final String keyField;
    private final String subKeyField;
    private final Set<String> rangeFields;

    public PartitionCatalog(Map<String, String> partitionedTables, String keyField, String subKeyField,
                            Set<String> rangeFields) {
        Map<String, String> tables = new LinkedHashMap<>();
        partitionedTables.forEach((logical, physical) -> tables.put(
                SqlIdentifiers.require(logical, "partitioned logical table"),
                SqlIdentifiers.require(physical, "partitioned physical table")));
        this.partitionedTables = Collections.unmodifiableMap(tables);
        this.keyField = SqlIdentifiers.require(keyField, "partition key field");
        this.subKeyField = SqlIdentifiers.require(subKeyField, "sub-partition field");
        this.rangeFields = Collections.unmodifiableSet(new LinkedHashSet<>(rangeFields));
    }

    /**
     * 解析 "logical:physical" 形式的配置项
     */
    public static PartitionCatalog parse(List<String> entries, String keyField, String subKeyField,
                                         List<String> rangeFields) {
        Map<String, String> tables = new LinkedHashMap<>();
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            int idx = entry.indexOf(':');
            if (idx <= 0 || idx == entry.length() - 1) {
                throw new InvalidReportConfigurationException(
                        "Partition table entry must be 'logical:physical', got: " + entry);
            }
            tables.put(entry.substring(0, idx).trim(), entry.substring(idx + 1).trim());
        }
        return new PartitionCatalog(tables, keyField, subKeyField, new LinkedHashSet<>(rangeFields));
    }

    public static PartitionCatalog empty() {
        return new PartitionCatalog(Map.of(), "program_id", "site_id", Set.of("created_at", "date_range"));
    }

    public Optional<String> partitionedTable(String logicalTable) {
        return Optional.ofNullable(partitionedTables.get(logicalTable));
    }

    public Map<String, String> partitionedTables() {
        return partitionedTables;
    }

    public String keyField() {
        return keyField;
    }

    public String subKeyField() {
        return subKeyField;
    }

    public Set<String> rangeFields() {
        return rangeFields;
    }
}
