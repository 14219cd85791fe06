package com.asiainfo.deepdive.api;

import com.asiainfo.deepdive.api.dto.DeepDiveRequest;
import com.asiainfo.deepdive.api.dto.DeepDiveResponse;
import com.asiainfo.deepdive.core.engine.DeepDiveEngine;
import com.asiainfo.deepdive.core.model.DeepDiveQuery;
import com.asiainfo.deepdive.core.model.DeepDiveResult;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deep Dive 两期对比 REST API（无状态）
 */
@Path("/api/v2/deep-dive")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DeepDiveResource {

    private static final Logger log = LoggerFactory.getLogger(DeepDiveResource.class);

    @Inject
    DeepDiveEngine engine;

    /**
     * 按视角对比两个周期，返回分层后的实体列表和汇总
     */
    @POST
    @Path("/analyze")
    public Response analyze(DeepDiveRequest request) {
        try {
            DeepDiveQuery query = RequestMapper.toQuery(request);
            DeepDiveResult result = engine.analyze(query);
            return Response.ok(DeepDiveResponse.success(result)).build();
        } catch (Exception e) {
            return ApiErrors.toResponse(e, log, "Deep Dive");
        }
    }
}
