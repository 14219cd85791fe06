package com.asiainfo.deepdive.core.drilldown;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * UNIFIED：一次对比；SEGMENTED：当前视角多选时每个选中实体单独对比
 */
public enum ViewMode {
    UNIFIED,
    SEGMENTED;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
