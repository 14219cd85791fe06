package com.asiainfo.deepdive.infra.persistence;

import com.asiainfo.deepdive.core.filter.WherePredicate;
import com.asiainfo.deepdive.core.model.PeriodRange;
import com.asiainfo.deepdive.core.model.Perspective;

/**
 * 单周期聚合查询：按 perspective.groupingKey 分组
 */
public record AggregateQuery(
    String table,
    Perspective perspective,
    PeriodRange range,
    WherePredicate predicate
) {
}
