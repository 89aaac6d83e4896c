package com.fieldinsight.reporting.core.relationship;

import com.fieldinsight.reporting.core.model.JoinKind;
import com.fieldinsight.reporting.core.model.JoinStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 实体关系有向图
 * 每条边带优先级，等长路径按优先级（数值小者优先）取舍
 */
public final class EntityGraph {

    record Edge(JoinStep step, int priority) {
    }

    private final Map<String, List<Edge>> adjacency;

    private EntityGraph(Map<String, List<Edge>> adjacency) {
        this.adjacency = adjacency;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 按优先级排好序的出边
     */
    List<Edge> edgesFrom(String table) {
        return adjacency.getOrDefault(table, List.of());
    }

    public Set<String> tables() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    public boolean contains(String table) {
        return adjacency.containsKey(table);
    }

    public static final class Builder {

        private final Map<String, List<Edge>> adjacency = new LinkedHashMap<>();

        public Builder edge(JoinStep step, int priority) {
            adjacency.computeIfAbsent(step.fromTable(), k -> new ArrayList<>()).add(new Edge(step, priority));
            adjacency.computeIfAbsent(step.toTable(), k -> new ArrayList<>());
            return this;
        }

        /**
         * 同时登记正向（INNER）和反向边
         */
        public Builder relate(String fromTable, String toTable, String joinField, String foreignField,
                              JoinKind reverseKind, int priority) {
            JoinStep forward = JoinStep.inner(fromTable, toTable, joinField, foreignField);
            edge(forward, priority);
            edge(forward.reversed(reverseKind), priority);
            return this;
        }

        public EntityGraph build() {
            Map<String, List<Edge>> sorted = new LinkedHashMap<>();
            adjacency.forEach((table, edges) -> {
                List<Edge> copy = new ArrayList<>(edges);
                copy.sort(Comparator.comparingInt(Edge::priority));
                sorted.put(table, Collections.unmodifiableList(copy));
            });
            return new EntityGraph(Collections.unmodifiableMap(sorted));
        }
    }
}
