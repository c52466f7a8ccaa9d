package com.worker.lookup.metrics;

/**
 * How a search request was answered. Used as a metric tag and in metric names.
 */
public enum SearchOutcome {
    /** Rejected at validation; empty result without touching cache or store. */
    INVALID,
    /** Served from the cache. */
    CACHED,
    /** Fetched from the record store and ranked. */
    FETCHED,
    /** The store failed, timed out or the request was cancelled; empty result. */
    FAILED,
    /** Superseded or cancelled by the caller before the store answered; not an error. */
    CANCELLED;

    public String tag() {
        return name().toLowerCase();
    }
}
