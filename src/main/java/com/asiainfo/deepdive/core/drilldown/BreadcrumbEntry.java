package com.asiainfo.deepdive.core.drilldown;

import com.asiainfo.deepdive.core.model.Perspective;

/**
 * 面包屑：在 perspective 视角下选中了 entityId 并下钻
 */
public record BreadcrumbEntry(
    Perspective perspective,
    String entityId,
    String displayName
) {
}
