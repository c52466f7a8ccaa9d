package com.worker.lookup.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered checks and folds them into one status: the worst one wins.
 * A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.of(HealthStatus.Status.UP, "No health checks registered");
        }

        HealthStatus.Status worst = HealthStatus.Status.UP;
        String worstMessage = "OK";
        Map<String, Object> perCheck = new LinkedHashMap<>();

        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", result.status().name());
            entry.put("message", result.message());
            entry.put("details", result.details());
            perCheck.put(check.getName(), entry);

            if (result.status().isWorseThan(worst)) {
                worst = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, worstMessage, perCheck);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.check.failed check={} error={}", check.getName(), e.getMessage(), e);
            return HealthStatus.of(HealthStatus.Status.DOWN, "Check failed: " + e.getClass().getSimpleName());
        }
    }
}
