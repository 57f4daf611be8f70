package com.comiccomp.collector.resilience;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Mutable breaker bookkeeping for one source.
 * <p>
 * Instances are only touched while holding their own monitor, so two sources
 * never contend on the same lock.
 * </p>
 */
@Getter
@Setter(AccessLevel.PACKAGE)
final class CircuitBreakerState {

    private CircuitState state = CircuitState.CLOSED;

    private int failureCount;

    private Instant lastFailureTime;

    private Instant nextAttemptTime;

    private int halfOpenCallCount;

    CircuitSnapshot snapshot() {
        return new CircuitSnapshot(state, failureCount, lastFailureTime, nextAttemptTime, halfOpenCallCount);
    }
}
