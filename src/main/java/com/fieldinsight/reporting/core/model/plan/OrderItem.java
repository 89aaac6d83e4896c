package com.fieldinsight.reporting.core.model.plan;

import com.fieldinsight.reporting.core.model.SortDirection;

/**
 * @param alias 排序所引用的投影项别名
 */
public record OrderItem(String alias, SortDirection direction) {
}
