package com.fieldinsight.reporting.infrastructure.cache.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fieldinsight.reporting.core.model.CacheEntry;
import com.fieldinsight.reporting.core.model.result.AggregatedData;
import com.fieldinsight.reporting.core.model.result.DataMetadata;
import com.fieldinsight.reporting.core.model.result.DataPoint;
import com.fieldinsight.reporting.core.model.result.DimensionDescriptor;
import com.fieldinsight.reporting.core.model.result.MeasureDescriptor;
import com.fieldinsight.reporting.core.model.result.MeasureSummary;
import com.fieldinsight.reporting.core.model.result.MeasureValue;
import com.fieldinsight.reporting.infrastructure.cache.CacheKey;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 缓存条目 JSON 序列化测试（Redis / report_cache 共用同一格式）
 */
class CacheEntryJsonTest {

    static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper mapper = mapper();

    static ObjectMapper mapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Test
    void testEntryRoundTripKeepsNoValue() throws Exception {
        CacheEntry entry = sampleEntry();

        CacheEntry restored = mapper.readValue(mapper.writeValueAsString(entry), CacheEntry.class);

        assertEquals(entry, restored);
        DataPoint row = restored.payload().data().get(0);
        assertSame(MeasureValue.NO_VALUE, row.measures().get("Avg Growth"));
        assertEquals(MeasureValue.of(3), row.measures().get("Observations"));
        assertFalse(restored.payload().aggregations().get("Avg Growth").avg().isPresent());
    }

    @Test
    void testNoValueWrittenAsNull() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(sampleEntry().payload()));

        JsonNode measures = json.get("data").get(0).get("measures");
        assertTrue(measures.get("Avg Growth").isNull());
        assertEquals(3.0, measures.get("Observations").asDouble());
    }

    static CacheEntry sampleEntry() {
        return sampleEntry("growth-report", "abc123", CREATED.plusSeconds(300));
    }

    static CacheEntry sampleEntry(String reportId, String hash, Instant expiresAt) {
        Map<String, Object> dims = new LinkedHashMap<>();
        dims.put("Created Date", "2024-04-30T00:00:00Z");
        dims.put("Site", "North Field");
        Map<String, MeasureValue> measures = new LinkedHashMap<>();
        measures.put("Avg Growth", MeasureValue.NO_VALUE);
        measures.put("Observations", MeasureValue.of(3));

        Map<String, MeasureSummary> summaries = new LinkedHashMap<>();
        summaries.put("Avg Growth", new MeasureSummary(1, 0, MeasureValue.NO_VALUE, MeasureValue.NO_VALUE,
                MeasureValue.NO_VALUE, MeasureValue.NO_VALUE));
        summaries.put("Observations", new MeasureSummary(1, 1, MeasureValue.of(3), MeasureValue.of(3),
                MeasureValue.of(3), MeasureValue.of(3)));

        AggregatedData payload = new AggregatedData(
                List.of(new DataPoint("row-0", dims, measures)),
                new DataMetadata(
                        List.of(new DimensionDescriptor("created_date", "Created Date", "created_at", "date",
                                "day", 1)),
                        List.of(new MeasureDescriptor("avg_growth", "Avg Growth", "growth_index", "avg", null))),
                summaries,
                1,
                1,
                42,
                false);
        return new CacheEntry(reportId, CacheKey.reportPrefix(reportId) + hash, hash, payload, CREATED, expiresAt, 0);
    }
}
