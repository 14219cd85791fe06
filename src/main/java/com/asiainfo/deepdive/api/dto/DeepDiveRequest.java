package com.asiainfo.deepdive.api.dto;

import com.asiainfo.deepdive.core.filter.SimplifiedFilter;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;
import java.util.Map;

/**
 * 两期对比请求，也用于创建下钻会话
 * filters 的键为视角 id 或分组键，值为单个 id 或 id 数组
 */
@RegisterForReflection
public record DeepDiveRequest(
    String perspective,
    PeriodDto period1,
    PeriodDto period2,
    Map<String, Object> filters,
    SimplifiedFilter simplifiedFilter,
    List<String> tierFilter // A / B / C / NEW / LOST
) {
}
