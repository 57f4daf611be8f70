package com.comiccomp.collector.resilience;

import java.time.Instant;

/**
 * Read-only copy of a source's breaker state, as reported by the status endpoint.
 *
 * @param state             current state
 * @param failureCount      failures counted towards the threshold
 * @param lastFailureTime   time of the latest failure, or {@code null}
 * @param nextAttemptTime   when an open breaker lets a probe through, or {@code null}
 * @param halfOpenCallCount probes let through since entering half-open
 */
public record CircuitSnapshot(CircuitState state,
                              int failureCount,
                              Instant lastFailureTime,
                              Instant nextAttemptTime,
                              int halfOpenCallCount) {

    public static final CircuitSnapshot CLOSED = new CircuitSnapshot(CircuitState.CLOSED, 0, null, null, 0);
}
