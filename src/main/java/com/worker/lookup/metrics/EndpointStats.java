package com.worker.lookup.metrics;

/**
 * Average latency of one named operation within a stats window.
 */
public record EndpointStats(String name, long avgDuration, long count) {
}
