package com.worker.lookup.api;

import com.worker.lookup.core.model.RankedResult;

import java.util.List;

/**
 * Answer to one search request.
 *
 * @param results         ranked results, best first
 * @param totalCount      number of results
 * @param searchTerm      the trimmed query as received
 * @param executionTimeMs time spent answering
 * @param cached          whether the results came from the cache
 * @param suggestions     hints about what the query looks like (email, phone, full name)
 * @param <C>             candidate type
 */
public record SearchResponse<C>(
        List<RankedResult<C>> results,
        int totalCount,
        String searchTerm,
        long executionTimeMs,
        boolean cached,
        List<String> suggestions
) {
    public SearchResponse {
        results = results != null ? List.copyOf(results) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
        searchTerm = searchTerm != null ? searchTerm : "";
    }

    static <C> SearchResponse<C> empty(String searchTerm, long executionTimeMs, List<String> suggestions) {
        return new SearchResponse<>(List.of(), 0, searchTerm, executionTimeMs, false, suggestions);
    }

    static <C> SearchResponse<C> of(List<RankedResult<C>> results, String searchTerm, long executionTimeMs,
                                    boolean cached, List<String> suggestions) {
        return new SearchResponse<>(results, results.size(), searchTerm, executionTimeMs, cached, suggestions);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
