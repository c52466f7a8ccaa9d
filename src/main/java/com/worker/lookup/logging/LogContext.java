package com.worker.lookup.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around SLF4J MDC so search log lines carry a correlation id.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSearch(correlationId, cacheKey)) {
 *     log.info("search.completed results={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one search request.
     */
    public static LogContext forSearch(String correlationId, String searchKey) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("searchKey", searchKey);
        ctx.put("operation", "search");
        return ctx;
    }

    /**
     * Context for a cache maintenance operation such as invalidation.
     */
    public static LogContext forCacheMaintenance(String reason) {
        LogContext ctx = new LogContext();
        ctx.put("operation", "cache-maintenance");
        ctx.put("reason", reason);
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another key-value pair, removed again on close.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
