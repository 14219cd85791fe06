package com.asiainfo.deepdive.core.model;

import com.asiainfo.deepdive.core.filter.SimplifiedFilter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 查询过滤条件
 * dimensions：按视角分组键选中的实体 id（下钻范围与用户多选都在这里）
 * simplifiedFilter：字段/操作符/值 组成的结构化条件
 */
public record DeepDiveFilters(
    Map<Perspective, List<String>> dimensions,
    SimplifiedFilter simplifiedFilter
) {
    private static final DeepDiveFilters NONE = new DeepDiveFilters(Map.of(), SimplifiedFilter.none());

    public DeepDiveFilters {
        EnumMap<Perspective, List<String>> copy = new EnumMap<>(Perspective.class);
        if (dimensions != null) {
            dimensions.forEach((k, v) -> {
                if (v != null && !v.isEmpty()) {
                    copy.put(k, List.copyOf(v));
                }
            });
        }
        dimensions = Collections.unmodifiableMap(copy);
        simplifiedFilter = simplifiedFilter == null ? SimplifiedFilter.none() : simplifiedFilter;
    }

    public static DeepDiveFilters none() {
        return NONE;
    }

    public static DeepDiveFilters of(Map<Perspective, List<String>> dimensions) {
        return new DeepDiveFilters(dimensions, SimplifiedFilter.none());
    }

    public List<String> valuesFor(Perspective perspective) {
        return dimensions.getOrDefault(perspective, List.of());
    }

    public DeepDiveFilters with(Perspective perspective, List<String> values) {
        EnumMap<Perspective, List<String>> copy = new EnumMap<>(Perspective.class);
        copy.putAll(dimensions);
        copy.put(perspective, values);
        return new DeepDiveFilters(copy, simplifiedFilter);
    }

    public DeepDiveFilters without(Perspective perspective) {
        EnumMap<Perspective, List<String>> copy = new EnumMap<>(Perspective.class);
        copy.putAll(dimensions);
        copy.remove(perspective);
        return new DeepDiveFilters(copy, simplifiedFilter);
    }

    /**
     * 叠加下钻范围，范围中的键覆盖原有的选中值
     */
    public DeepDiveFilters withScope(Map<Perspective, String> scope) {
        EnumMap<Perspective, List<String>> copy = new EnumMap<>(Perspective.class);
        copy.putAll(dimensions);
        scope.forEach((k, v) -> copy.put(k, List.of(v)));
        return new DeepDiveFilters(copy, simplifiedFilter);
    }

    /**
     * 只保留对 perspective 合法的维度键（自身及上级视角）
     */
    public DeepDiveFilters retainValidFor(Perspective perspective) {
        EnumMap<Perspective, List<String>> copy = new EnumMap<>(Perspective.class);
        dimensions.forEach((k, v) -> {
            if (k == perspective || k.isAncestorOf(perspective)) {
                copy.put(k, v);
            }
        });
        return new DeepDiveFilters(copy, simplifiedFilter);
    }
}
