package com.asiainfo.deepdive.infra.persistence;

/**
 * 数据仓库返回的一行聚合结果，数值列可能为 null
 */
public record WarehouseRow(
    String groupingKey,
    String displayName,
    Long requests,
    Long paid,
    Double revenue,
    Double cpm,
    Integer childCount
) {
}
