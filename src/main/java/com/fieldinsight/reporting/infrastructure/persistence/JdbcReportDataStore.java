package com.fieldinsight.reporting.infrastructure.persistence;

import com.fieldinsight.reporting.config.ReportingConfig;
import com.fieldinsight.reporting.core.exception.ReportExecutionException;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL 数据源
 * 计划在此处渲染为 SQL，参数通过 PreparedStatement 绑定
 */
@ApplicationScoped
public class JdbcReportDataStore implements ReportDataStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcReportDataStore.class);

    @Inject
    @Named("reporting")
    DataSource dataSource;

    @Inject
    SqlRenderer renderer;

    @Inject
    ReportingConfig config;

    @Inject
    MeterRegistry registry;

    @Override
    public List<Map<String, Object>> fetch(QueryPlan plan) {
        SqlRequest request = renderer.render(plan);
        return Timer.builder("report.engine.query.time")
                .register(registry)
                .record(() -> execute(request));
    }

    private List<Map<String, Object>> execute(SqlRequest request) {
        log.debug("[JDBC] Executing: {} {}", request.sql(), request.params());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(request.sql())) {
            stmt.setQueryTimeout(config.getQueryTimeoutSeconds());
            List<Object> params = request.params();
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return resultSetToList(rs, request.columnLabels());
            }
        } catch (SQLTimeoutException e) {
            log.error("[JDBC] Query timed out after {}s: {}", config.getQueryTimeoutSeconds(), request.sql());
            throw new ReportExecutionException("Report query timed out", e);
        } catch (SQLException e) {
            log.error("[JDBC] Query failed: {}", request.sql(), e);
            throw new ReportExecutionException("Report query failed: " + e.getMessage(), e);
        }
    }

    /**
     * 行以展示名为键；位置别名按 labels 还原，未提供时使用数据库列名
     */
    static List<Map<String, Object>> resultSetToList(ResultSet rs, List<String> labels) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columns = md.getColumnCount();
        if (!labels.isEmpty() && labels.size() != columns) {
            throw new SQLException(String.format("Expected %d result columns, got %d", labels.size(), columns));
        }
        List<String> keys = new ArrayList<>(columns);
        for (int i = 1; i <= columns; ++i) {
            keys.add(labels.isEmpty() ? md.getColumnLabel(i) : labels.get(i - 1));
        }
        List<Map<String, Object>> list = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columns; ++i) {
                row.put(keys.get(i - 1), rs.getObject(i));
            }
            list.add(row);
        }
        return list;
    }
}
