package com.asiainfo.deepdive.api;

import com.asiainfo.deepdive.api.dto.ErrorResponse;
import com.asiainfo.deepdive.infra.persistence.FilterPreset;
import com.asiainfo.deepdive.infra.persistence.FilterPresetRepository;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
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

/**
 * 过滤预设 REST API
 */
@Path("/api/v2/filter-presets")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class FilterPresetResource {

    private static final Logger log = LoggerFactory.getLogger(FilterPresetResource.class);

    @Inject
    FilterPresetRepository repository;

    @GET
    public Response list(@QueryParam("page") @DefaultValue("deep-dive") String page) {
        try {
            return Response.ok(repository.findByPage(page)).build();
        } catch (Exception e) {
            return ApiErrors.toResponse(e, log, "Filter Preset");
        }
    }

    @GET
    @Path("/{id}")
    public Response get(@PathParam("id") String id) {
        try {
            return repository.findById(id)
                    .map(p -> Response.ok(p).build())
                    .orElseGet(() -> notFound(id));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, log, "Filter Preset");
        }
    }

    @POST
    public Response save(FilterPreset preset) {
        try {
            if (preset == null) {
                throw new IllegalArgumentException("Request body is required");
            }
            FilterPreset saved = repository.save(preset);
            return Response.status(Response.Status.CREATED).entity(saved).build();
        } catch (Exception e) {
            return ApiErrors.toResponse(e, log, "Filter Preset");
        }
    }

    @DELETE
    @Path("/{id}")
    public Response delete(@PathParam("id") String id) {
        try {
            return repository.delete(id) ? Response.noContent().build() : notFound(id);
        } catch (Exception e) {
            return ApiErrors.toResponse(e, log, "Filter Preset");
        }
    }

    private static Response notFound(String id) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(ErrorResponse.of("Filter preset not found: " + id, false))
                .build();
    }
}
