package com.fieldinsight.reporting.core.relationship;

import com.fieldinsight.reporting.core.exception.MissingRelationshipException;
import com.fieldinsight.reporting.core.model.JoinStep;
import com.fieldinsight.reporting.core.model.RelationshipPath;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 关系解析器
 * 在实体关系图上做广度优先搜索，返回最短连接链；出边按优先级遍历，因此等长路径取优先级高的那条
 */
@ApplicationScoped
public class RelationshipResolver {

    private static final Logger log = LoggerFactory.getLogger(RelationshipResolver.class);

    private final EntityGraph graph;

    // 图是静态的，解析结果可以一直复用
    private final Map<String, Optional<RelationshipPath>> resolved = new ConcurrentHashMap<>();

    public RelationshipResolver() {
        this(DomainEntityGraph.create());
    }

    public RelationshipResolver(EntityGraph graph) {
        this.graph = graph;
    }

    public Optional<RelationshipPath> resolve(String sourceTable, String targetTable) {
        if (sourceTable.equals(targetTable)) {
            return Optional.empty();
        }
        return resolved.computeIfAbsent(sourceTable + "->" + targetTable,
                k -> search(sourceTable, targetTable));
    }

    /**
     * 找不到路径时视为配置错误，在执行查询前抛出
     */
    public RelationshipPath require(String sourceTable, String targetTable) {
        return resolve(sourceTable, targetTable)
                .orElseThrow(() -> new MissingRelationshipException(sourceTable, targetTable));
    }

    private Optional<RelationshipPath> search(String sourceTable, String targetTable) {
        if (!graph.contains(sourceTable) || !graph.contains(targetTable)) {
            log.debug("[Relationship] Unknown table in lookup: {} -> {}", sourceTable, targetTable);
            return Optional.empty();
        }

        Map<String, JoinStep> cameFrom = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(sourceTable);
        cameFrom.put(sourceTable, null);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(targetTable)) {
                break;
            }
            for (EntityGraph.Edge edge : graph.edgesFrom(current)) {
                String next = edge.step().toTable();
                if (!cameFrom.containsKey(next)) {
                    cameFrom.put(next, edge.step());
                    queue.add(next);
                }
            }
        }

        if (!cameFrom.containsKey(targetTable)) {
            log.debug("[Relationship] No path: {} -> {}", sourceTable, targetTable);
            return Optional.empty();
        }

        List<JoinStep> steps = new ArrayList<>();
        for (String table = targetTable; !table.equals(sourceTable); ) {
            JoinStep step = cameFrom.get(table);
            steps.add(step);
            table = step.fromTable();
        }
        Collections.reverse(steps);
        log.debug("[Relationship] Resolved {} -> {} in {} step(s)", sourceTable, targetTable, steps.size());
        return Optional.of(new RelationshipPath(steps));
    }
}
