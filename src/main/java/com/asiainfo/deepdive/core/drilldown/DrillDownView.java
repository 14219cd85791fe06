package com.asiainfo.deepdive.core.drilldown;

import com.asiainfo.deepdive.core.model.DeepDiveResult;
import com.asiainfo.deepdive.core.model.PeriodRange;
import com.asiainfo.deepdive.core.model.Perspective;

import java.time.Instant;
import java.util.List;

/**
 * 会话当前展示的内容
 * UNIFIED 时 result 非空、segments 为空；SEGMENTED 时相反
 */
public record DrillDownView(
    long generation,
    Perspective perspective,
    PeriodRange period1,
    PeriodRange period2,
    ViewMode mode,
    DeepDiveResult result,
    List<Segment> segments,
    List<BreadcrumbEntry> breadcrumbs,
    boolean servedFromCache, // 全部内容来自缓存
    boolean superseded,      // 完成时已有更新的请求，未替换当前视图
    Instant fetchedAt
) {
    public DrillDownView {
        segments = segments == null ? List.of() : List.copyOf(segments);
        breadcrumbs = List.copyOf(breadcrumbs);
    }

    public DrillDownView asSuperseded() {
        return new DrillDownView(generation, perspective, period1, period2, mode, result, segments,
                breadcrumbs, servedFromCache, true, fetchedAt);
    }
}
