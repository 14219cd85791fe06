package com.asiainfo.deepdive.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * 下钻请求；childPerspective 缺省时取当前视角的下级
 */
@RegisterForReflection
public record DrillDownRequest(
    String entityId,
    String displayName,
    String childPerspective
) {
}
