package com.worker.lookup.store;

import java.util.List;
import java.util.Map;

/**
 * Source of search candidates, typically backed by the workers table.
 *
 * <p>Implementations do their own case-insensitive substring matching over the
 * fields they index and return at most {@code limit} rows. No ordering is
 * required; results are re-ranked by the caller.</p>
 *
 * @param <C> candidate type
 */
public interface RecordStore<C> {

    /**
     * Finds candidates whose indexed fields contain the term.
     *
     * @param term  normalized search term
     * @param limit maximum number of rows to return
     * @return matching rows, never {@code null}
     * @throws StoreUnavailableException if the store cannot be reached or the query fails
     */
    List<C> search(String term, int limit);

    /**
     * Filtered variant used by admin screens (city, state, ...). Stores that cannot
     * filter ignore the filters.
     */
    default List<C> search(String term, int limit, Map<String, String> filters) {
        return search(term, limit);
    }

    /**
     * Returns a short name for log lines and health details.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
