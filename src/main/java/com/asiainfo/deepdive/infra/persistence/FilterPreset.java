package com.asiainfo.deepdive.infra.persistence;

import com.asiainfo.deepdive.core.filter.SimplifiedFilter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 保存的过滤预设
 * filters 的键为视角 id 或分组键，值为选中的实体 id
 */
public record FilterPreset(
    String id,
    String name,
    String description,
    String page,        // 如 deep-dive、daily-ops
    String perspective,
    Map<String, List<String>> filters,
    SimplifiedFilter simplifiedFilter,
    @JsonProperty("isDefault") boolean isDefault,
    Instant createdAt
) {
    public FilterPreset {
        filters = filters == null ? Map.of() : Map.copyOf(filters);
        simplifiedFilter = simplifiedFilter == null ? SimplifiedFilter.none() : simplifiedFilter;
    }

    public FilterPreset withIdentity(String newId, Instant newCreatedAt) {
        return new FilterPreset(newId, name, description, page, perspective, filters, simplifiedFilter,
                isDefault, newCreatedAt);
    }
}
