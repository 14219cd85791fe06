package com.asiainfo.deepdive.core.drilldown;

import com.asiainfo.deepdive.core.model.DeepDiveResult;

import java.time.Instant;

/**
 * 分段视图中的一段：单个选中实体的对比结果
 */
public record Segment(
    String entityId,
    DeepDiveResult result,
    boolean servedFromCache,
    Instant fetchedAt
) {
}
