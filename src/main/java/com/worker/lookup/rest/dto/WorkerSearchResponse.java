package com.worker.lookup.rest.dto;

import com.worker.lookup.api.SearchResponse;
import com.worker.lookup.core.model.Worker;

import java.util.List;

/**
 * Body of {@code GET /api/workers/search}.
 */
public record WorkerSearchResponse(
        List<WorkerResultDto> results,
        int totalCount,
        String searchTerm,
        boolean cached,
        long executionTimeMs,
        List<String> suggestions
) {
    public WorkerSearchResponse {
        results = results != null ? List.copyOf(results) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public static WorkerSearchResponse from(SearchResponse<Worker> response) {
        List<WorkerResultDto> results = response.results().stream()
                .map(WorkerResultDto::from)
                .toList();
        return new WorkerSearchResponse(
                results,
                response.totalCount(),
                response.searchTerm(),
                response.cached(),
                response.executionTimeMs(),
                response.suggestions()
        );
    }
}
