package com.fieldinsight.reporting.core.transformer;

import java.util.Collection;
import java.util.Map;

/**
 * 实体ID -> 展示名
 */
public interface EntityNameLookup {

    EntityNameLookup NONE = (field, ids) -> Map.of();

    /**
     * @param field 维度字段，如 program_id
     * @return 能解析的ID及其展示名；字段不是实体键时为空
     */
    Map<String, String> resolve(String field, Collection<String> ids);
}
