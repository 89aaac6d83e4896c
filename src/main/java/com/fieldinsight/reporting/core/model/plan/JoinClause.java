package com.fieldinsight.reporting.core.model.plan;

import com.fieldinsight.reporting.core.model.JoinKind;

/**
 * leftAlias.leftField = table.alias.rightField
 */
public record JoinClause(JoinKind kind, TableRef table, String leftAlias, String leftField, String rightField) {

    public JoinClause withTable(TableRef newTable) {
        return new JoinClause(kind, newTable, leftAlias, leftField, rightField);
    }
}
