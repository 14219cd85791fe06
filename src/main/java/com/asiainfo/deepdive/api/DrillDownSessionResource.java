package com.asiainfo.deepdive.api;

import com.asiainfo.deepdive.api.dto.DeepDiveRequest;
import com.asiainfo.deepdive.api.dto.DrillDownRequest;
import com.asiainfo.deepdive.api.dto.FilterChangeRequest;
import com.asiainfo.deepdive.api.dto.PeriodChangeRequest;
import com.asiainfo.deepdive.api.dto.PerspectiveChangeRequest;
import com.asiainfo.deepdive.api.dto.SessionResponse;
import com.asiainfo.deepdive.core.drilldown.DrillDownSession;
import com.asiainfo.deepdive.core.drilldown.DrillDownSessionManager;
import com.asiainfo.deepdive.core.drilldown.DrillDownView;
import com.asiainfo.deepdive.core.model.DeepDiveQuery;
import com.asiainfo.deepdive.shared.InvariantViolationException;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * 下钻会话 REST API
 * 每个接口对应一个界面事件，返回事件完成后的会话视图
 */
@Path("/api/v2/deep-dive/sessions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DrillDownSessionResource {

    private static final Logger log = LoggerFactory.getLogger(DrillDownSessionResource.class);

    @Inject
    DrillDownSessionManager sessionManager;

    /**
     * 创建会话并完成首次加载；首次加载失败时会话一并关闭
     */
    @POST
    public Response create(DeepDiveRequest request) {
        DrillDownSession session = null;
        try {
            DeepDiveQuery query = RequestMapper.toQuery(request);
            session = sessionManager.create(query.perspective(), query.period1(), query.period2(), query.filters());
            DrillDownView view = session.refresh();
            return Response.status(Response.Status.CREATED).entity(SessionResponse.of(session, view)).build();
        } catch (Exception e) {
            if (session != null) {
                sessionManager.remove(session.getId());
            }
            return ApiErrors.toResponse(e, log, "Drill Down");
        }
    }

    @GET
    @Path("/{id}")
    public Response get(@PathParam("id") String id) {
        return handle(id, DrillDownSession::getCurrentView);
    }

    @DELETE
    @Path("/{id}")
    public Response close(@PathParam("id") String id) {
        try {
            sessionManager.remove(id);
            return Response.noContent().build();
        } catch (Exception e) {
            return ApiErrors.toResponse(e, log, "Drill Down");
        }
    }

    @POST
    @Path("/{id}/drill-down")
    public Response drillDown(@PathParam("id") String id, DrillDownRequest request) {
        return handle(id, s -> {
            if (request == null) {
                throw new InvariantViolationException("Request body is required");
            }
            if (request.childPerspective() != null && !request.childPerspective().isBlank()) {
                return s.descend(RequestMapper.perspective(request.childPerspective()),
                        request.entityId(), request.displayName());
            }
            return s.onDrillDown(request.entityId(), request.displayName());
        });
    }

    /**
     * 返回上一级；带 depth 时回到指定面包屑深度
     */
    @POST
    @Path("/{id}/back")
    public Response back(@PathParam("id") String id, @QueryParam("depth") Integer depth) {
        return handle(id, s -> depth != null ? s.onBreadcrumb(depth) : s.onBack());
    }

    @POST
    @Path("/{id}/perspective")
    public Response changePerspective(@PathParam("id") String id, PerspectiveChangeRequest request) {
        return handle(id, s -> s.onPerspectiveChange(
                RequestMapper.perspective(request != null ? request.perspective() : null)));
    }

    @POST
    @Path("/{id}/periods")
    public Response changePeriods(@PathParam("id") String id, PeriodChangeRequest request) {
        return handle(id, s -> {
            if (request == null || request.period1() == null || request.period2() == null) {
                throw new InvariantViolationException("period1 and period2 are required");
            }
            return s.onPeriodChange(request.period1().toRange("period1"), request.period2().toRange("period2"));
        });
    }

    @POST
    @Path("/{id}/filters")
    public Response changeFilters(@PathParam("id") String id, FilterChangeRequest request) {
        return handle(id, s -> s.onFilterChange(request == null ? null
                : RequestMapper.toFilters(request.filters(), request.simplifiedFilter())));
    }

    /**
     * 按当前状态重新查询（Analyze / 失败重试）
     */
    @POST
    @Path("/{id}/refresh")
    public Response refresh(@PathParam("id") String id) {
        return handle(id, DrillDownSession::refresh);
    }

    private Response handle(String id, Function<DrillDownSession, DrillDownView> event) {
        try {
            DrillDownSession session = sessionManager.get(id);
            DrillDownView view = event.apply(session);
            return Response.ok(SessionResponse.of(session, view)).build();
        } catch (Exception e) {
            return ApiErrors.toResponse(e, log, "Drill Down");
        }
    }
}
