package com.asiainfo.deepdive.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WarningSeverity {
    HEALTHY, INFO, WARNING, CRITICAL;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
