package com.fieldinsight.reporting.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fieldinsight.reporting.core.model.Filter;
import com.fieldinsight.reporting.core.model.ReportConfiguration;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 报表结果缓存Key
 * 格式: reports:v1:result:{reportId}:{sha256(规范化参数)}
 * 参数按键排序后序列化，键的声明顺序不影响结果
 */
public final class CacheKey {

    static final String PREFIX = "reports:v1:result:";

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    private final String reportId;
    private final String parametersHash;

    private CacheKey(String reportId, String parametersHash) {
        this.reportId = reportId;
        this.parametersHash = parametersHash;
    }

    /**
     * 为一次报表执行创建Key
     *
     * @param implicitFilters 隐式过滤同样参与计算，不同权限范围的结果不会共享
     */
    public static CacheKey forReport(ReportConfiguration config, List<Filter> implicitFilters) {
        List<Filter> effective = new ArrayList<>(config.filters());
        effective.addAll(implicitFilters);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("dataSources", config.dataSources());
        parameters.put("dimensions", config.dimensions());
        parameters.put("measures", config.measures());
        parameters.put("filters", effective);
        parameters.put("sort", config.sort());
        parameters.put("limit", config.limit());
        parameters.put("offset", config.offset());
        return of(config.id(), parameters);
    }

    public static CacheKey of(String reportId, Object parameters) {
        try {
            byte[] canonical = CANONICAL.writeValueAsBytes(parameters);
            return new CacheKey(reportId, sha256(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize cache parameters for report " + reportId, e);
        }
    }

    public static String reportPrefix(String reportId) {
        return PREFIX + reportId + ":";
    }

    private static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String toStoreKey() {
        return reportPrefix(reportId) + parametersHash;
    }

    public String getReportId() {
        return reportId;
    }

    public String getParametersHash() {
        return parametersHash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        CacheKey other = (CacheKey) o;
        return Objects.equals(reportId, other.reportId) && Objects.equals(parametersHash, other.parametersHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reportId, parametersHash);
    }

    @Override
    public String toString() {
        return toStoreKey();
    }
}
