package com.fieldinsight.reporting.infrastructure.cache;

import com.fieldinsight.reporting.ReportFixtures;
import com.fieldinsight.reporting.core.model.Filter;
import com.fieldinsight.reporting.core.model.FilterOperator;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CacheKey 单元测试
 */
class CacheKeyTest {

    @Test
    void testSameConfigurationSameKey() {
        CacheKey first = CacheKey.forReport(ReportFixtures.growthReport(List.of(ReportFixtures.fungicideUsed())),
                List.of());
        CacheKey second = CacheKey.forReport(ReportFixtures.growthReport(List.of(ReportFixtures.fungicideUsed())),
                List.of());

        assertEquals(first, second);
        assertEquals(first.toStoreKey(), second.toStoreKey());
    }

    @Test
    void testKeyFormat() {
        CacheKey key = CacheKey.forReport(ReportFixtures.growthReport("r-42", List.of()), List.of());

        assertTrue(key.toStoreKey().startsWith("reports:v1:result:r-42:"));
        assertEquals(64, key.getParametersHash().length());
        assertEquals("r-42", key.getReportId());
    }

    @Test
    void testFiltersChangeKey() {
        CacheKey plain = CacheKey.forReport(ReportFixtures.growthReport(List.of()), List.of());
        CacheKey filtered = CacheKey.forReport(ReportFixtures.growthReport(List.of(ReportFixtures.fungicideUsed())),
                List.of());

        assertNotEquals(plain, filtered);
    }

    @Test
    void testImplicitFiltersChangeKey() {
        List<Filter> companyA = List.of(Filter.of("company_id", FilterOperator.EQUALS, "A"));
        List<Filter> companyB = List.of(Filter.of("company_id", FilterOperator.EQUALS, "B"));

        CacheKey a = CacheKey.forReport(ReportFixtures.growthReport(List.of()), companyA);
        CacheKey b = CacheKey.forReport(ReportFixtures.growthReport(List.of()), companyB);

        assertNotEquals(a, b);
    }

    @Test
    void testMapOrderDoesNotMatter() {
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", 2);
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", 2);
        ba.put("a", 1);

        assertEquals(CacheKey.of("r", ab), CacheKey.of("r", ba));
    }

    @Test
    void testReportPrefixScopesInvalidation() {
        CacheKey key = CacheKey.forReport(ReportFixtures.growthReport("r-1", List.of()), List.of());

        assertTrue(key.toStoreKey().startsWith(CacheKey.reportPrefix("r-1")));
        assertFalse(key.toStoreKey().startsWith(CacheKey.reportPrefix("r-")));
    }
}
