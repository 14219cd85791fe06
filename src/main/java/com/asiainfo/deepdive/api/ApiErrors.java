package com.asiainfo.deepdive.api;

import com.asiainfo.deepdive.api.dto.ErrorResponse;
import com.asiainfo.deepdive.core.drilldown.SessionNotFoundException;
import com.asiainfo.deepdive.infra.persistence.DataSourceException;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;

/**
 * 异常 -> HTTP 响应
 * 参数或状态非法 400，会话不存在 404，数据仓库失败 502（可重试），其它 500
 */
final class ApiErrors {

    private ApiErrors() {
    }

    static Response toResponse(Exception e, Logger log, String context) {
        if (e instanceof SessionNotFoundException) {
            return error(Response.Status.NOT_FOUND, e.getMessage(), false);
        }
        if (e instanceof IllegalStateException || e instanceof IllegalArgumentException) {
            log.warn("[{}] Rejected: {}", context, e.getMessage());
            return error(Response.Status.BAD_REQUEST, e.getMessage(), false);
        }
        if (e instanceof DataSourceException) {
            log.error("[{}] Data source failure: {}", context, e.getMessage());
            return error(Response.Status.BAD_GATEWAY, e.getMessage(), true);
        }
        log.error("[{}] Unexpected failure", context, e);
        return error(Response.Status.INTERNAL_SERVER_ERROR, "Internal error: " + e.getMessage(), false);
    }

    private static Response error(Response.Status status, String message, boolean retryable) {
        return Response.status(status).entity(ErrorResponse.of(message, retryable)).build();
    }
}
