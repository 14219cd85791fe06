package com.asiainfo.deepdive.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 两期合并后的实体记录
 * period1 为 null 时状态必为 new，period2 为 null 时必为 lost
 */
public record ComparisonRecord(
    String entityId,
    String displayName,
    EntityAggregate period1,
    EntityAggregate period2,
    LifecycleStatus lifecycleStatus,
    MetricDeltas deltas,
    Tier tier,                 // 分层前为 null
    Double cumulativeSharePct, // 所在排名组内的累计收入占比
    ActionableWarning warning
) {
    public ComparisonRecord {
        if (lifecycleStatus != LifecycleStatus.of(period1, period2)) {
            throw new IllegalArgumentException(String.format(
                    "Lifecycle %s inconsistent with periods for entity %s", lifecycleStatus, entityId));
        }
    }

    public static ComparisonRecord of(String entityId, String displayName,
            EntityAggregate period1, EntityAggregate period2) {
        return new ComparisonRecord(entityId, displayName, period1, period2,
                LifecycleStatus.of(period1, period2),
                MetricDeltas.between(period1, period2),
                null, null, null);
    }

    public double revenueP1() {
        return period1 != null ? period1.revenue() : 0;
    }

    public double revenueP2() {
        return period2 != null ? period2.revenue() : 0;
    }

    /**
     * 排名口径：lost 用基期收入，其它用当期收入
     */
    public double rankingRevenue() {
        return lifecycleStatus == LifecycleStatus.LOST ? revenueP1() : revenueP2();
    }

    @JsonProperty("displayTier")
    public DisplayTier displayTier() {
        return tier != null ? tier.displayTier() : null;
    }

    public ComparisonRecord withTier(Tier newTier, double sharePct) {
        return new ComparisonRecord(entityId, displayName, period1, period2, lifecycleStatus,
                deltas, newTier, sharePct, warning);
    }

    public ComparisonRecord withWarning(ActionableWarning newWarning) {
        return new ComparisonRecord(entityId, displayName, period1, period2, lifecycleStatus,
                deltas, tier, cumulativeSharePct, newWarning);
    }
}
