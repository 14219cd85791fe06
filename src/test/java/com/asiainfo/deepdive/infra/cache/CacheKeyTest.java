package com.asiainfo.deepdive.infra.cache;

import com.asiainfo.deepdive.core.filter.FilterClause;
import com.asiainfo.deepdive.core.filter.FilterField;
import com.asiainfo.deepdive.core.filter.FilterOperator;
import com.asiainfo.deepdive.core.filter.SimplifiedFilter;
import com.asiainfo.deepdive.core.model.DeepDiveFilters;
import com.asiainfo.deepdive.core.model.Perspective;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.asiainfo.deepdive.support.Fixtures.OCTOBER;
import static com.asiainfo.deepdive.support.Fixtures.SEPTEMBER;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CacheKey 单元测试
 */
class CacheKeyTest {

    @Test
    void testCacheKeyFormat() {
        CacheKey key = CacheKey.of(Perspective.PID,
                DeepDiveFilters.of(Map.of(Perspective.TEAM, List.of("APAC"))), SEPTEMBER, OCTOBER);

        assertEquals("pid_{\"team\":[\"APAC\"]}_2025-09-01_2025-09-30_2025-10-01_2025-10-31", key.value());
    }

    @Test
    void testEmptyFilters() {
        CacheKey key = CacheKey.of(Perspective.TEAM, DeepDiveFilters.none(), SEPTEMBER, OCTOBER);

        assertEquals("team_{}_2025-09-01_2025-09-30_2025-10-01_2025-10-31", key.value());
    }

    @Test
    void testCacheKeySorting() {
        // 插入顺序、多选值顺序不同，应该生成相同的 key
        Map<Perspective, List<String>> m1 = new LinkedHashMap<>();
        m1.put(Perspective.TEAM, List.of("APAC"));
        m1.put(Perspective.PIC, List.of("bob", "alice"));
        Map<Perspective, List<String>> m2 = new LinkedHashMap<>();
        m2.put(Perspective.PIC, List.of("alice", "bob"));
        m2.put(Perspective.TEAM, List.of("APAC"));

        CacheKey key1 = CacheKey.of(Perspective.PID, DeepDiveFilters.of(m1), SEPTEMBER, OCTOBER);
        CacheKey key2 = CacheKey.of(Perspective.PID, DeepDiveFilters.of(m2), SEPTEMBER, OCTOBER);

        assertEquals(key1, key2, "Keys should be same regardless of input order");
        assertEquals(key1.hashCode(), key2.hashCode());
        assertTrue(key1.value().contains("{\"pic\":[\"alice\",\"bob\"],\"team\":[\"APAC\"]}"), key1.value());
    }

    @Test
    void testDifferentInputsDiffer() {
        DeepDiveFilters filters = DeepDiveFilters.of(Map.of(Perspective.TEAM, List.of("APAC")));

        CacheKey base = CacheKey.of(Perspective.PID, filters, SEPTEMBER, OCTOBER);
        assertNotEquals(base, CacheKey.of(Perspective.PIC, filters, SEPTEMBER, OCTOBER));
        assertNotEquals(base, CacheKey.of(Perspective.PID, DeepDiveFilters.none(), SEPTEMBER, OCTOBER));
        assertNotEquals(base, CacheKey.of(Perspective.PID, filters, OCTOBER, SEPTEMBER));
    }

    @Test
    void testSimplifiedFilterIsPartOfKey() {
        SimplifiedFilter sf = SimplifiedFilter.include(SimplifiedFilter.Logic.AND,
                FilterClause.of(FilterField.PRODUCT, FilterOperator.EQUALS, "video"));

        CacheKey plain = CacheKey.of(Perspective.PID, DeepDiveFilters.none(), SEPTEMBER, OCTOBER);
        CacheKey filtered = CacheKey.of(Perspective.PID, new DeepDiveFilters(Map.of(), sf), SEPTEMBER, OCTOBER);

        assertNotEquals(plain, filtered);
        assertTrue(filtered.value().contains("\"simplifiedFilter\""), filtered.value());
        assertEquals(filtered, CacheKey.of(Perspective.PID, new DeepDiveFilters(Map.of(), sf), SEPTEMBER, OCTOBER));
    }
}
