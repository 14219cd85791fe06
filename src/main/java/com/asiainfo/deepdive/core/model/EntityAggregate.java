package com.asiainfo.deepdive.core.model;

/**
 * 单个实体在单个周期内的聚合值
 * requests/paid/revenue 为求和，avgCpm 为逐行 CPM 的算术平均
 */
public record EntityAggregate(
    String entityId,
    String displayName,
    long requests,
    long paid,
    double revenue,
    double avgCpm,
    int childCount // 下级实体数（pic 数、publisher 数...），叶子视角为 0
) {
    /**
     * 填充率 paid / requests * 100，requests 为 0 时记为 0
     */
    public double fillRate() {
        return requests > 0 ? (double) paid / requests * 100 : 0;
    }

    /**
     * eCPM = revenue / requests * 1000
     */
    public double ecpm() {
        return requests > 0 ? revenue / requests * 1000 : 0;
    }
}
