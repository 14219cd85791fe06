package com.asiainfo.deepdive.core.model;

import java.util.Set;

/**
 * 一次两期对比的完整参数
 */
public record DeepDiveQuery(
    Perspective perspective,
    PeriodRange period1, // 基期
    PeriodRange period2, // 当期
    DeepDiveFilters filters,
    Set<DisplayTier> tierFilter // 为空表示不过滤
) {
    public DeepDiveQuery {
        filters = filters == null ? DeepDiveFilters.none() : filters;
        tierFilter = tierFilter == null ? Set.of() : Set.copyOf(tierFilter);
    }

    public DeepDiveQuery(Perspective perspective, PeriodRange period1, PeriodRange period2,
            DeepDiveFilters filters) {
        this(perspective, period1, period2, filters, Set.of());
    }

    public DeepDiveQuery withFilters(DeepDiveFilters newFilters) {
        return new DeepDiveQuery(perspective, period1, period2, newFilters, tierFilter);
    }
}
