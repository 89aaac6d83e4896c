package com.fieldinsight.reporting.core.model;

/**
 * 关系路径中的一跳：fromTable.joinField = toTable.foreignField
 */
public record JoinStep(
        String fromTable,
        String toTable,
        String joinField,
        String foreignField,
        JoinKind kind) {

    public JoinStep {
        SqlIdentifiers.require(fromTable, "table");
        SqlIdentifiers.require(toTable, "table");
        SqlIdentifiers.require(joinField, "join field");
        SqlIdentifiers.require(foreignField, "foreign field");
        kind = kind != null ? kind : JoinKind.INNER;
    }

    public static JoinStep inner(String fromTable, String toTable, String joinField, String foreignField) {
        return new JoinStep(fromTable, toTable, joinField, foreignField, JoinKind.INNER);
    }

    public JoinStep reversed(JoinKind reverseKind) {
        return new JoinStep(toTable, fromTable, foreignField, joinField, reverseKind);
    }
}
