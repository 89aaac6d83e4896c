package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 有序连接链
 * 不变量：相邻两跳首尾相接，且不会重复经过同一张表
 */
public record RelationshipPath(List<JoinStep> steps) {

    public RelationshipPath {
        if (steps == null || steps.isEmpty()) {
            throw new InvalidReportConfigurationException("Relationship path must contain at least one step");
        }
        steps = Collections.unmodifiableList(new ArrayList<>(steps));

        Set<String> visited = new HashSet<>();
        visited.add(steps.get(0).fromTable());
        for (int i = 0; i < steps.size(); i++) {
            JoinStep step = steps.get(i);
            if (i > 0 && !steps.get(i - 1).toTable().equals(step.fromTable())) {
                throw new InvalidReportConfigurationException(String.format(
                        "Relationship path is not contiguous at step %d: %s -> %s",
                        i, steps.get(i - 1).toTable(), step.fromTable()));
            }
            if (!visited.add(step.toTable())) {
                throw new InvalidReportConfigurationException(
                        "Relationship path revisits table " + step.toTable());
            }
        }
    }

    @JsonCreator
    public static RelationshipPath of(List<JoinStep> steps) {
        return new RelationshipPath(steps);
    }

    @JsonValue
    public List<JoinStep> steps() {
        return steps;
    }

    public String sourceTable() {
        return steps.get(0).fromTable();
    }

    public String targetTable() {
        return steps.get(steps.size() - 1).toTable();
    }

    public int length() {
        return steps.size();
    }
}
