package com.worker.lookup.rest;

import com.worker.lookup.api.SearchOrchestrator;
import com.worker.lookup.core.model.Worker;
import com.worker.lookup.rest.dto.WorkerSearchResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Map;

/**
 * Request-level search handling shared by the REST resource and other callers
 * (kiosk sockets, batch jobs). Never throws for bad input: an invalid query yields
 * an empty response.
 */
@ApplicationScoped
public class WorkerSearchHandler {

    private final SearchOrchestrator<Worker> orchestrator;

    @Inject
    public WorkerSearchHandler(SearchOrchestrator<Worker> orchestrator) {
        this.orchestrator = orchestrator;
    }

    public WorkerSearchResponse handleSearch(String rawQuery) {
        return WorkerSearchResponse.from(orchestrator.search(rawQuery));
    }

    public WorkerSearchResponse handleSearch(String rawQuery, Map<String, String> filters) {
        return WorkerSearchResponse.from(orchestrator.search(rawQuery, filters));
    }

    /**
     * Drops cached searches after a worker was created, changed or deleted.
     */
    public int workersChanged() {
        return orchestrator.invalidateCachedSearches();
    }
}
