package com.asiainfo.deepdive.core.model;

import java.util.Map;

/**
 * 对比结果汇总
 * 变化百分比遵循 MetricDeltas 的口径，基期为 0 时为 null
 */
public record DeepDiveSummary(
    int totalItems,
    double totalRevenueP1,
    double totalRevenueP2,
    Double revenueChangePct,
    long totalRequestsP1,
    long totalRequestsP2,
    Double requestsChangePct,
    double totalEcpmP1,
    double totalEcpmP2,
    Double ecpmChangePct,
    Map<DisplayTier, Integer> tierCounts,
    Map<DisplayTier, Double> tierRevenue
) {
    public DeepDiveSummary {
        tierCounts = Map.copyOf(tierCounts);
        tierRevenue = Map.copyOf(tierRevenue);
    }
}
