package com.speaker.standardization.health;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the registered checks before a unification run.
 * The aggregate is DOWN as soon as one check is DOWN; its message names every failing check.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new ArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    /**
     * Runs every registered check and combines the results.
     * Each check's own status is exposed as a detail under the check name.
     */
    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> perCheck = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();

        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            perCheck.put(check.getName(), result);
            if (!result.isUp()) {
                failures.add(check.getName() + ": " + result.message());
            }
        }

        HealthStatus aggregate = failures.isEmpty()
                ? HealthStatus.up()
                : HealthStatus.down(String.join("; ", failures));
        for (Map.Entry<String, Object> entry : perCheck.entrySet()) {
            aggregate = aggregate.withDetail(entry.getKey(), entry.getValue());
        }
        return aggregate;
    }

    public int size() {
        return checks.size();
    }
}
