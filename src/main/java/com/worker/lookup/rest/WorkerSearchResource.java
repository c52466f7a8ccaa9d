package com.worker.lookup.rest;

import com.worker.lookup.rest.dto.ErrorResponse;
import com.worker.lookup.rest.dto.WorkerSearchResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
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

/**
 * Typeahead worker search used by the check-in screens.
 */
@Path("/api/workers")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Worker Search", description = "Real-time worker lookup by name, email or phone")
public class WorkerSearchResource {
    private static final Logger log = LoggerFactory.getLogger(WorkerSearchResource.class);
    private static final String SEARCH_PATH = "/api/workers/search";

    private final WorkerSearchHandler handler;

    @Inject
    public WorkerSearchResource(WorkerSearchHandler handler) {
        this.handler = handler;
    }

    /**
     * GET /api/workers/search?q=john
     */
    @GET
    @Path("/search")
    @Operation(summary = "Search workers",
            description = "Ranks workers by exact, prefix, substring and fuzzy match. Queries shorter than "
                    + "three characters return an empty result.")
    @APIResponse(responseCode = "200", description = "Ranked results, possibly empty")
    @APIResponse(responseCode = "500", description = "Unexpected server error")
    public Response search(
            @Parameter(description = "Search text (name, email or phone)")
            @QueryParam("q") String query) {
        try {
            WorkerSearchResponse response = handler.handleSearch(query);
            return Response.ok(response).build();
        } catch (Exception e) {
            log.error("workerSearch.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(SEARCH_PATH))
                    .build();
        }
    }
}
