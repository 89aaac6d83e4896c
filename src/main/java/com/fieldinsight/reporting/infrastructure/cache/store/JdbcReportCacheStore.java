package com.fieldinsight.reporting.infrastructure.cache.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldinsight.reporting.core.exception.CacheStoreException;
import com.fieldinsight.reporting.core.model.CacheEntry;
import com.fieldinsight.reporting.core.model.result.AggregatedData;
import com.fieldinsight.reporting.infrastructure.cache.ReportCacheStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * report_cache 表存储
 * 唯一约束 (report_id, cache_key, parameters_hash)，写入使用 upsert
 */
@ApplicationScoped
@Named("jdbc")
public class JdbcReportCacheStore implements ReportCacheStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcReportCacheStore.class);

    private static final String SELECT_SQL = "SELECT report_id, cache_key, parameters_hash, result_data, "
            + "created_at, expires_at, hit_count FROM report_cache WHERE cache_key = ?";

    private static final String UPSERT_SQL = "INSERT INTO report_cache "
            + "(report_id, cache_key, parameters_hash, result_data, created_at, expires_at, hit_count) "
            + "VALUES (?, ?, ?, CAST(? AS jsonb), ?, ?, 0) "
            + "ON CONFLICT ON CONSTRAINT report_cache_unique_key DO UPDATE SET "
            + "result_data = EXCLUDED.result_data, created_at = EXCLUDED.created_at, "
            + "expires_at = EXCLUDED.expires_at, hit_count = 0";

    private static final String HIT_SQL = "UPDATE report_cache SET hit_count = hit_count + 1 WHERE cache_key = ?";

    private static final String PURGE_SQL = "DELETE FROM report_cache WHERE expires_at <= ?";

    private static final String INVALIDATE_SQL = "DELETE FROM report_cache WHERE report_id = ?";

    @Inject
    @Named("reporting")
    DataSource dataSource;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public String name() {
        return "jdbc";
    }

    @Override
    public Optional<CacheEntry> find(String cacheKey) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, cacheKey);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                AggregatedData payload = objectMapper.readValue(rs.getString("result_data"), AggregatedData.class);
                return Optional.of(new CacheEntry(
                        rs.getString("report_id"),
                        rs.getString("cache_key"),
                        rs.getString("parameters_hash"),
                        payload,
                        rs.getTimestamp("created_at").toInstant(),
                        rs.getTimestamp("expires_at").toInstant(),
                        rs.getLong("hit_count")));
            }
        } catch (Exception e) {
            log.error("[JDBC Store] Read failed for {}", cacheKey, e);
            throw new CacheStoreException("report_cache read failed for " + cacheKey, e);
        }
    }

    @Override
    public void save(CacheEntry entry) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setObject(1, entry.reportId());
            stmt.setString(2, entry.cacheKey());
            stmt.setString(3, entry.parametersHash());
            stmt.setString(4, objectMapper.writeValueAsString(entry.payload()));
            stmt.setTimestamp(5, Timestamp.from(entry.createdAt()));
            stmt.setTimestamp(6, Timestamp.from(entry.expiresAt()));
            stmt.executeUpdate();
            log.debug("[JDBC Store] Put: {}", entry.cacheKey());
        } catch (Exception e) {
            log.error("[JDBC Store] Write failed for {}", entry.cacheKey(), e);
            throw new CacheStoreException("report_cache write failed for " + entry.cacheKey(), e);
        }
    }

    @Override
    public void incrementHitCount(String cacheKey) {
        executeUpdate(HIT_SQL, cacheKey, "hit count update");
    }

    @Override
    public int purgeExpired(Instant now) {
        return executeUpdate(PURGE_SQL, Timestamp.from(now), "purge");
    }

    @Override
    public int invalidateReport(String reportId) {
        int removed = executeUpdate(INVALIDATE_SQL, reportId, "invalidation");
        log.info("[JDBC Store] Invalidated {} rows for report {}", removed, reportId);
        return removed;
    }

    private int executeUpdate(String sql, Object param, String what) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, param);
            return stmt.executeUpdate();
        } catch (Exception e) {
            log.error("[JDBC Store] {} failed", what, e);
            throw new CacheStoreException("report_cache " + what + " failed", e);
        }
    }
}
