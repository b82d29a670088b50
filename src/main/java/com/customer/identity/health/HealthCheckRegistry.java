package com.customer.identity.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every registered check and reports the worst status among them.
 * The result's details hold each check's own status, message and details under its name.
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
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> perCheck = new LinkedHashMap<>();
        HealthStatus worst = HealthStatus.up();
        String worstName = null;

        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", result.status().name());
            entry.put("message", result.message());
            entry.put("details", result.details());
            perCheck.put(check.getName(), entry);
            HealthStatus previous = worst;
            worst = worst.worse(result);
            if (worst != previous) {
                worstName = check.getName();
            }
        }

        String message = worstName == null ? "OK" : worstName + ": " + worst.message();
        return new HealthStatus(worst.status(), message, perCheck);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.check_failed check={} error={}", check.getName(), e.getMessage());
            return HealthStatus.down("Health check threw: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
