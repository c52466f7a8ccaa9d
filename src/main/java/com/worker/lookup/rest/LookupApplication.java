package com.worker.lookup.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;

/**
 * Jakarta RS application with OpenAPI metadata for the worker lookup endpoints.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Worker Lookup API",
                version = "1.0.0",
                description = "Real-time worker search for check-in: ranked typeahead results, "
                        + "search cache administration and performance statistics."
        )
)
public class LookupApplication extends Application {
}
