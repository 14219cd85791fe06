package com.asiainfo.deepdive.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 两期变化百分比
 * 值为 null 表示基期为 0 而当期大于 0（new-spike），不会出现 Infinity/NaN
 */
public record MetricDeltas(
    Double revenuePct,
    Double requestsPct,
    Double cpmPct,
    Double fillRatePct
) {
    public static final Double NEW_SPIKE = null;

    public static MetricDeltas between(EntityAggregate period1, EntityAggregate period2) {
        double rev1 = period1 != null ? period1.revenue() : 0;
        double rev2 = period2 != null ? period2.revenue() : 0;
        double req1 = period1 != null ? period1.requests() : 0;
        double req2 = period2 != null ? period2.requests() : 0;
        double cpm1 = period1 != null ? period1.avgCpm() : 0;
        double cpm2 = period2 != null ? period2.avgCpm() : 0;
        double fill1 = period1 != null ? period1.fillRate() : 0;
        double fill2 = period2 != null ? period2.fillRate() : 0;

        return new MetricDeltas(
                percentChange(rev1, rev2),
                percentChange(req1, req2),
                percentChange(cpm1, cpm2),
                percentChange(fill1, fill2));
    }

    /**
     * (v2 - v1) / v1 * 100；v1 为 0 时：v2 也为 0 返回 0，否则返回 new-spike
     */
    public static Double percentChange(double v1, double v2) {
        if (v1 == 0) {
            if (v2 == 0) {
                return 0.0;
            }
            return NEW_SPIKE;
        }
        return (v2 - v1) / v1 * 100;
    }

    @JsonIgnore
    public boolean isRevenueNewSpike() {
        return revenuePct == null;
    }
}
