package com.silentrisk.common.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates dependency probes into one health status:
 * UP when every probe passes, DEGRADED when some fail, DOWN when all fail.
 */
public class DependencyHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Some dependencies are unavailable");

    private final String component;
    private final List<DependencyProbe> probes;

    public DependencyHealthIndicator(String component, List<DependencyProbe> probes) {
        this.component = component;
        this.probes = List.copyOf(probes);
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        int up = 0;
        for (DependencyProbe probe : probes) {
            boolean probeUp = probe.isUp();
            details.put(probe.name(), probeUp ? Status.UP.getCode() : Status.DOWN.getCode());
            if (probeUp) {
                up++;
            }
        }
        details.put("component", component);
        details.put("timestamp", Instant.now().toString());
        contributeDetails(details);

        Status status;
        if (up == probes.size()) {
            status = Status.UP;
        } else if (up == 0) {
            status = Status.DOWN;
        } else {
            status = DEGRADED;
        }
        return Health.status(status).withDetails(details).build();
    }

    /**
     * Hook for service-specific details such as connection counts.
     */
    protected void contributeDetails(Map<String, Object> details) {
    }
}
