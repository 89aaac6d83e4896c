package com.fieldinsight.reporting.infrastructure.persistence;

import com.fieldinsight.reporting.config.ReportingConfig;
import com.fieldinsight.reporting.core.exception.ReportExecutionException;
import com.fieldinsight.reporting.core.model.FilterOperator;
import com.fieldinsight.reporting.core.model.plan.PredicateFragment;
import com.fieldinsight.reporting.core.model.plan.PredicateGroup;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;
import com.fieldinsight.reporting.core.model.plan.SelectItem;
import com.fieldinsight.reporting.core.model.plan.TableRef;
import com.fieldinsight.reporting.core.relationship.DomainEntityGraph;
import com.fieldinsight.reporting.core.transformer.EntityNameLookup;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 实体展示名解析
 * 项目/站点取 name，提交取 global_submission_id 并加 # 前缀；按 (表, ID) 缓存在 Caffeine 中
 * 查询失败时保留原始ID
 */
@ApplicationScoped
public class CachedEntityNameResolver implements EntityNameLookup {

    private static final Logger log = LoggerFactory.getLogger(CachedEntityNameResolver.class);

    static final String ID_COLUMN = "id";
    static final String NAME_COLUMN = "name";

    /**
     * 实体键字段对应的名称表
     */
    record EntityTable(String table, String keyColumn, String nameColumn, String prefix) {
    }

    static final Map<String, EntityTable> ENTITIES = Map.of(
            "program_id", new EntityTable(DomainEntityGraph.PROGRAMS, "program_id", "name", ""),
            "site_id", new EntityTable(DomainEntityGraph.SITES, "site_id", "name", ""),
            "submission_id", new EntityTable(DomainEntityGraph.SUBMISSIONS, "submission_id",
                    "global_submission_id", "#"));

    @Inject
    ReportDataStore dataStore;

    @Inject
    ReportingConfig config;

    private Cache<String, String> names;

    @PostConstruct
    void init() {
        names = Caffeine.newBuilder()
                .maximumSize(config.getEntityNameCacheSize())
                .expireAfterWrite(Duration.ofMinutes(config.getEntityNameTtlMinutes()))
                .build();
        log.info("[Names] Initialized with MaxSize={}, TTL={}min",
                config.getEntityNameCacheSize(), config.getEntityNameTtlMinutes());
    }

    @Override
    public Map<String, String> resolve(String field, Collection<String> ids) {
        EntityTable entity = ENTITIES.get(field);
        if (entity == null || ids.isEmpty()) {
            return Map.of();
        }
        Map<String, String> resolved = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            String name = names.getIfPresent(cacheKey(entity, id));
            if (name != null) {
                resolved.put(id, name);
            } else {
                missing.add(id);
            }
        }
        if (!missing.isEmpty()) {
            load(entity, missing).forEach((id, name) -> {
                names.put(cacheKey(entity, id), name);
                resolved.put(id, name);
            });
        }
        log.debug("[Names] {}: {} requested, {} resolved ({} loaded)",
                entity.table(), ids.size(), resolved.size(), missing.size());
        return resolved;
    }

    private Map<String, String> load(EntityTable entity, List<String> ids) {
        List<Map<String, Object>> rows;
        try {
            rows = dataStore.fetch(lookupPlan(entity, ids));
        } catch (ReportExecutionException e) {
            log.warn("[Names] Lookup on {} failed, keeping raw ids: {}", entity.table(), e.getMessage());
            return Map.of();
        }
        Map<String, String> loaded = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Object id = row.get(ID_COLUMN);
            Object name = row.get(NAME_COLUMN);
            if (id != null && name != null) {
                loaded.put(String.valueOf(id), entity.prefix() + name);
            }
        }
        return loaded;
    }

    static QueryPlan lookupPlan(EntityTable entity, List<String> ids) {
        String column = entity.table() + "." + entity.keyColumn();
        String sql = column + " IN (" + String.join(", ", Collections.nCopies(ids.size(), "?")) + ")";
        return new QueryPlan(
                TableRef.of(entity.table(), entity.table()),
                List.of(),
                List.of(SelectItem.column(ID_COLUMN, entity.keyColumn(), entity.table(), entity.keyColumn()),
                        SelectItem.column(NAME_COLUMN, entity.nameColumn(), entity.table(), entity.nameColumn())),
                List.of(PredicateGroup.single(
                        new PredicateFragment(column, FilterOperator.IN, sql, new ArrayList<>(ids)))),
                List.of(),
                List.of(),
                null,
                null);
    }

    private static String cacheKey(EntityTable entity, String id) {
        return entity.table() + ":" + id;
    }
}
