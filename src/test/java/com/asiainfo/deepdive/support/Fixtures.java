package com.asiainfo.deepdive.support;

import com.asiainfo.deepdive.core.model.ComparisonRecord;
import com.asiainfo.deepdive.core.model.EntityAggregate;
import com.asiainfo.deepdive.core.model.PeriodRange;

/**
 * 测试数据构造
 */
public final class Fixtures {

    public static final PeriodRange SEPTEMBER = PeriodRange.of("2025-09-01", "2025-09-30");
    public static final PeriodRange OCTOBER = PeriodRange.of("2025-10-01", "2025-10-31");

    private Fixtures() {
    }

    public static EntityAggregate agg(String id, double revenue) {
        return new EntityAggregate(id, "name-" + id, 1000, 800, revenue, 1.5, 0);
    }

    public static EntityAggregate agg(String id, long requests, long paid, double revenue) {
        return new EntityAggregate(id, "name-" + id, requests, paid, revenue, 1.0, 0);
    }

    public static ComparisonRecord existing(String id, double revP1, double revP2) {
        return ComparisonRecord.of(id, id, agg(id, revP1), agg(id, revP2));
    }

    public static ComparisonRecord newEntity(String id, double revP2) {
        return ComparisonRecord.of(id, id, null, agg(id, revP2));
    }

    public static ComparisonRecord lost(String id, double revP1) {
        return ComparisonRecord.of(id, id, agg(id, revP1), null);
    }
}
