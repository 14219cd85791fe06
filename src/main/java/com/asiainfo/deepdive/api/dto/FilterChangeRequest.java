package com.asiainfo.deepdive.api.dto;

import com.asiainfo.deepdive.core.filter.SimplifiedFilter;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Map;

@RegisterForReflection
public record FilterChangeRequest(
    Map<String, Object> filters,
    SimplifiedFilter simplifiedFilter
) {
}
