package com.worker.lookup.rest;

import com.worker.lookup.api.SearchOrchestrator;
import com.worker.lookup.cache.CacheStats;
import com.worker.lookup.core.model.Worker;
import com.worker.lookup.health.HealthCheckRegistry;
import com.worker.lookup.health.HealthStatus;
import com.worker.lookup.metrics.PerformanceMetric;
import com.worker.lookup.metrics.PerformanceSnapshot;
import com.worker.lookup.rest.dto.ErrorResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Admin views over search performance, the search cache and health.
 *
 * <p>Endpoints:</p>
 * <ul>
 *   <li>{@code GET /api/admin/performance}: rolling statistics</li>
 *   <li>{@code GET /api/admin/performance/errors}: recent failures</li>
 *   <li>{@code GET|DELETE /api/admin/search-cache}: cache stats and invalidation</li>
 *   <li>{@code GET /api/admin/health}: aggregate health</li>
 * </ul>
 */
@Path("/api/admin")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Lookup Admin", description = "Search performance, cache and health")
public class AdminPerformanceResource {
    private static final Logger log = LoggerFactory.getLogger(AdminPerformanceResource.class);

    static final int MAX_WINDOW_MINUTES = 24 * 60;
    static final int MAX_ERROR_LIMIT = 100;

    private final SearchOrchestrator<Worker> orchestrator;
    private final HealthCheckRegistry healthChecks;

    @Inject
    public AdminPerformanceResource(SearchOrchestrator<Worker> orchestrator, HealthCheckRegistry healthChecks) {
        this.orchestrator = orchestrator;
        this.healthChecks = healthChecks;
    }

    @GET
    @Path("/performance")
    @Operation(summary = "Search performance statistics",
            description = "Request count, success and error rates, average latency and the slowest operations.")
    @APIResponse(responseCode = "200", description = "Statistics for the window")
    @APIResponse(responseCode = "400", description = "Window out of range")
    public Response performance(
            @Parameter(description = "Window in minutes (1-1440)")
            @QueryParam("windowMinutes") @DefaultValue("60") int windowMinutes) {
        String path = "/api/admin/performance";
        if (windowMinutes < 1 || windowMinutes > MAX_WINDOW_MINUTES) {
            return badRequest("windowMinutes must be between 1 and " + MAX_WINDOW_MINUTES, path);
        }
        try {
            PerformanceSnapshot stats = orchestrator.getStats(windowMinutes);
            return Response.ok(stats).build();
        } catch (Exception e) {
            return internalError("performance", e, path);
        }
    }

    @GET
    @Path("/performance/errors")
    @Operation(summary = "Recent failed operations", description = "Most recent first.")
    @APIResponse(responseCode = "200", description = "Failed operations")
    @APIResponse(responseCode = "400", description = "Limit out of range")
    public Response recentErrors(
            @Parameter(description = "Maximum entries (1-100)")
            @QueryParam("limit") @DefaultValue("10") int limit) {
        String path = "/api/admin/performance/errors";
        if (limit < 1 || limit > MAX_ERROR_LIMIT) {
            return badRequest("limit must be between 1 and " + MAX_ERROR_LIMIT, path);
        }
        try {
            List<PerformanceMetric> errors = orchestrator.getMonitor().recentErrors(limit);
            return Response.ok(errors).build();
        } catch (Exception e) {
            return internalError("recentErrors", e, path);
        }
    }

    @GET
    @Path("/search-cache")
    @Operation(summary = "Search cache statistics")
    @APIResponse(responseCode = "200", description = "Hit/miss counts, size and capacity")
    public Response cacheStats() {
        try {
            CacheStats stats = orchestrator.getCacheStats();
            return Response.ok(stats).build();
        } catch (Exception e) {
            return internalError("cacheStats", e, "/api/admin/search-cache");
        }
    }

    @DELETE
    @Path("/search-cache")
    @Operation(summary = "Clear cached searches")
    @APIResponse(responseCode = "200", description = "Number of entries removed")
    public Response clearCache() {
        try {
            int removed = orchestrator.invalidateCachedSearches();
            return Response.ok(Map.of("removed", removed)).build();
        } catch (Exception e) {
            return internalError("clearCache", e, "/api/admin/search-cache");
        }
    }

    @GET
    @Path("/health")
    @Operation(summary = "Lookup subsystem health")
    @APIResponse(responseCode = "200", description = "UP or DEGRADED")
    @APIResponse(responseCode = "503", description = "DOWN")
    public Response health() {
        HealthStatus status = healthChecks.checkAll();
        Response.Status code = status.status().servesTraffic() ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE;
        return Response.status(code).entity(status).build();
    }

    private static Response badRequest(String message, String path) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest(message, path))
                .build();
    }

    private static Response internalError(String operation, Exception e, String path) {
        log.error("admin.{}.failed error={}", operation, e.getMessage(), e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError(path))
                .build();
    }
}
