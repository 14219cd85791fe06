package com.asiainfo.deepdive.infra.cache;

import com.asiainfo.deepdive.core.model.DeepDiveFilters;
import com.asiainfo.deepdive.core.model.PeriodRange;
import com.asiainfo.deepdive.core.model.Perspective;
import com.asiainfo.deepdive.shared.DeepDiveConstants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 对比结果缓存 Key
 * 格式: {perspective}_{JSON(过滤条件, 键排序)}_{p1.start}_{p1.end}_{p2.start}_{p2.end}
 * 例: pid_{"team":["APAC"]}_2025-09-01_2025-09-30_2025-10-01_2025-10-31
 */
public final class CacheKey {

    private static final ObjectMapper KEY_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private static final String SIMPLIFIED_FILTER_FIELD = "simplifiedFilter";

    private final String value;

    private CacheKey(String value) {
        this.value = value;
    }

    public static CacheKey of(Perspective perspective, DeepDiveFilters filters,
            PeriodRange period1, PeriodRange period2) {
        String sep = DeepDiveConstants.CACHE_KEY_SEPARATOR;
        String value = perspective.id() + sep
                + serializeFilters(filters) + sep
                + period1.start() + sep + period1.end() + sep
                + period2.start() + sep + period2.end();
        return new CacheKey(value);
    }

    /**
     * 过滤条件序列化：键与多选值都排序，插入顺序不影响结果
     */
    static String serializeFilters(DeepDiveFilters filters) {
        Map<String, Object> sorted = new TreeMap<>();
        if (filters != null) {
            for (Map.Entry<Perspective, List<String>> entry : filters.dimensions().entrySet()) {
                List<String> values = new ArrayList<>(entry.getValue());
                Collections.sort(values);
                sorted.put(entry.getKey().groupingKey(), values);
            }
            if (!filters.simplifiedFilter().isEmpty()) {
                sorted.put(SIMPLIFIED_FILTER_FIELD, filters.simplifiedFilter());
            }
        }
        try {
            return KEY_MAPPER.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Filters are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return Objects.equals(value, ((CacheKey) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
