package com.comiccomp.collector.resilience;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports the collector under {@code /actuator/health/collector}.
 * <p>
 * DOWN once the recent error rate reaches the degradation threshold; the details
 * carry the health score, the latest errors and every breaker's state.
 * </p>
 */
@RequiredArgsConstructor
public class CollectorHealthIndicator implements HealthIndicator {

    private static final int LAST_ERRORS = 5;

    private final ErrorTracker errorTracker;

    private final SourceCircuitBreaker circuitBreaker;

    @Override
    public Health health() {
        ErrorHealth errors = errorTracker.health();

        Map<String, CircuitSnapshot> circuits = new LinkedHashMap<>();
        List<String> openCircuits = new ArrayList<>();
        circuitBreaker.snapshot().forEach((marketplace, snapshot) -> {
            circuits.put(marketplace.id(), snapshot);
            if (snapshot.state() == CircuitState.OPEN) {
                openCircuits.add(marketplace.id());
            }
        });

        List<String> lastErrors = errorTracker.recentErrors(LAST_ERRORS).stream()
                .map(e -> e.timestamp() + " " + e.source() + " [" + e.category().id() + "] " + e.message())
                .toList();

        Health.Builder builder = errors.healthy() ? Health.up() : Health.down().withDetail("degraded", true);
        return builder
                .withDetail("healthScore", errors.healthScore())
                .withDetail("errorRate", errors.errorRate())
                .withDetail("recentErrors", errors.recentErrors())
                .withDetail("recentOperations", errors.recentOperations())
                .withDetail("lastErrors", lastErrors)
                .withDetail("openCircuits", openCircuits)
                .withDetail("circuits", circuits)
                .build();
    }
}
