package com.fieldinsight.reporting.core.model.result;

/**
 * @param uniqueValues 结果中该维度的不同取值个数
 */
public record DimensionDescriptor(String id, String name, String field, String dataType, String granularity,
                                  int uniqueValues) {
}
