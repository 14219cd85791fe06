package com.asiainfo.deepdive.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 实体在两个周期间的生命周期状态
 */
public enum LifecycleStatus {
    EXISTING("existing"), // 两个周期都存在
    NEW("new"),           // 只在当期出现
    LOST("lost");         // 只在基期出现

    private final String code;

    LifecycleStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static LifecycleStatus of(EntityAggregate period1, EntityAggregate period2) {
        if (period1 == null && period2 == null) {
            throw new IllegalArgumentException("At least one period aggregate is required");
        }
        if (period1 == null) {
            return NEW;
        }
        if (period2 == null) {
            return LOST;
        }
        return EXISTING;
    }
}
