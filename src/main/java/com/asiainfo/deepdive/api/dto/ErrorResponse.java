package com.asiainfo.deepdive.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * 统一错误响应，retryable 表示重试同一请求可能成功
 */
@RegisterForReflection
public record ErrorResponse(
    String status,
    String error,
    boolean retryable
) {
    public static ErrorResponse of(String error, boolean retryable) {
        return new ErrorResponse("error", error, retryable);
    }
}
