package com.comiccomp.collector.resilience;

import com.comiccomp.collector.config.CollectionProperties;
import com.comiccomp.collector.event.CollectionEventPublisher;
import com.comiccomp.collector.event.CollectionEventType;
import com.comiccomp.collector.model.Marketplace;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-source three-state circuit breaker.
 * <p>
 * A source's state is created on its first failure and lives for the life of the
 * process. {@link #isOpen(Marketplace)} performs the lazy OPEN to HALF_OPEN move once
 * the recovery time has passed. Critical and authentication failures open the
 * breaker without waiting for the threshold; authentication failures also double
 * the recovery time, which disables the marketplace for longer.
 * </p>
 */
@Slf4j
public class SourceCircuitBreaker {

    private final ConcurrentMap<Marketplace, CircuitBreakerState> states = new ConcurrentHashMap<>();

    private final CollectionProperties.CircuitBreaker config;

    private final CollectionEventPublisher events;

    private final Clock clock;

    public SourceCircuitBreaker(final CollectionProperties.CircuitBreaker config,
                                final CollectionEventPublisher events,
                                final Clock clock) {
        this.config = config;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Reports whether calls to the source are currently rejected.
     * <p>
     * Moves an OPEN breaker whose recovery time has passed to HALF_OPEN, and a
     * HALF_OPEN breaker whose probes are used up back to OPEN.
     * </p>
     *
     * @param source the marketplace
     * @return {@code true} if no call may be attempted
     */
    public boolean isOpen(final Marketplace source) {
        CircuitBreakerState state = states.get(source);
        if (state == null) {
            return false;
        }
        CircuitState before;
        boolean open;
        CircuitSnapshot after;
        synchronized (state) {
            before = state.getState();
            open = evaluate(state);
            after = state.snapshot();
        }
        announce(source, before, after, null);
        return open;
    }

    /**
     * Gate for one call attempt: like {@link #isOpen(Marketplace)}, but a permitted
     * call made while HALF_OPEN is counted as a probe.
     *
     * @param source the marketplace
     * @return {@code true} if the call may go ahead
     */
    public boolean tryAcquirePermission(final Marketplace source) {
        CircuitBreakerState state = states.get(source);
        if (state == null) {
            return true;
        }
        CircuitState before;
        boolean open;
        CircuitSnapshot after;
        synchronized (state) {
            before = state.getState();
            open = evaluate(state);
            if (!open && state.getState() == CircuitState.HALF_OPEN) {
                state.setHalfOpenCallCount(state.getHalfOpenCallCount() + 1);
            }
            after = state.snapshot();
        }
        announce(source, before, after, null);
        return !open;
    }

    /**
     * Counts a failed call.
     *
     * @param source         the marketplace
     * @param classification how the failure was classified
     */
    public void recordFailure(final Marketplace source, final ErrorClassification classification) {
        CircuitBreakerState state = states.computeIfAbsent(source, s -> new CircuitBreakerState());
        Instant now = clock.instant();
        CircuitState before;
        CircuitSnapshot after;
        synchronized (state) {
            before = state.getState();
            state.setFailureCount(state.getFailureCount() + 1);
            state.setLastFailureTime(now);

            if (classification.tripsImmediately()) {
                state.setFailureCount(Math.max(state.getFailureCount(), config.getFailureThreshold()));
                Duration timeout = classification.category() == ErrorCategory.AUTHENTICATION
                        ? config.getRecoveryTimeout().multipliedBy(2)
                        : config.getRecoveryTimeout();
                open(state, now, timeout);
            } else if (before == CircuitState.HALF_OPEN) {
                open(state, now, config.getRecoveryTimeout());
            } else if (before == CircuitState.CLOSED
                    && state.getFailureCount() >= config.getFailureThreshold()) {
                open(state, now, config.getRecoveryTimeout());
            }
            after = state.snapshot();
        }
        announce(source, before, after, classification);
    }

    /**
     * Counts a successful call. Closes a HALF_OPEN breaker; in CLOSED, lets one
     * earlier failure decay.
     *
     * @param source the marketplace
     */
    public void recordSuccess(final Marketplace source) {
        CircuitBreakerState state = states.get(source);
        if (state == null) {
            return;
        }
        CircuitState before;
        CircuitSnapshot after;
        synchronized (state) {
            before = state.getState();
            if (before == CircuitState.HALF_OPEN) {
                state.setState(CircuitState.CLOSED);
                state.setFailureCount(0);
                state.setHalfOpenCallCount(0);
                state.setNextAttemptTime(null);
            } else if (before == CircuitState.CLOSED) {
                state.setFailureCount(Math.max(0, state.getFailureCount() - 1));
            }
            after = state.snapshot();
        }
        announce(source, before, after, null);
    }

    /**
     * @param source the marketplace
     * @return the current state, without triggering any transition
     */
    public CircuitSnapshot stateOf(final Marketplace source) {
        CircuitBreakerState state = states.get(source);
        if (state == null) {
            return CircuitSnapshot.CLOSED;
        }
        synchronized (state) {
            return state.snapshot();
        }
    }

    /**
     * @return the state of every source that has failed at least once
     */
    public Map<Marketplace, CircuitSnapshot> snapshot() {
        Map<Marketplace, CircuitSnapshot> copy = new EnumMap<>(Marketplace.class);
        states.forEach((source, state) -> {
            synchronized (state) {
                copy.put(source, state.snapshot());
            }
        });
        return copy;
    }

    private boolean evaluate(final CircuitBreakerState state) {
        Instant now = clock.instant();
        switch (state.getState()) {
            case CLOSED:
                return false;
            case OPEN:
                if (state.getNextAttemptTime() != null && !now.isBefore(state.getNextAttemptTime())) {
                    state.setState(CircuitState.HALF_OPEN);
                    state.setHalfOpenCallCount(0);
                    return false;
                }
                return true;
            case HALF_OPEN:
                if (state.getHalfOpenCallCount() >= config.getHalfOpenMaxCalls()) {
                    open(state, now, config.getRecoveryTimeout());
                    return true;
                }
                return false;
            default:
                throw new IllegalStateException("Unexpected circuit state " + state.getState());
        }
    }

    private static void open(final CircuitBreakerState state, final Instant now, final Duration timeout) {
        state.setState(CircuitState.OPEN);
        state.setHalfOpenCallCount(0);
        state.setNextAttemptTime(now.plus(timeout));
    }

    private void announce(final Marketplace source,
                          final CircuitState before,
                          final CircuitSnapshot after,
                          final ErrorClassification cause) {
        if (before == after.state()) {
            return;
        }
        CollectionEventType type;
        switch (after.state()) {
            case OPEN:
                type = CollectionEventType.CIRCUIT_OPENED;
                log.warn("Circuit for {} opened after {} failure(s); next attempt at {}",
                        source, after.failureCount(), after.nextAttemptTime());
                break;
            case HALF_OPEN:
                type = CollectionEventType.CIRCUIT_HALF_OPENED;
                log.info("Circuit for {} half-open, probing", source);
                break;
            default:
                type = CollectionEventType.CIRCUIT_CLOSED;
                log.info("Circuit for {} closed", source);
                break;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", before.name());
        payload.put("to", after.state().name());
        payload.put("failureCount", after.failureCount());
        payload.put("nextAttemptTime", after.nextAttemptTime());
        if (cause != null) {
            payload.put("category", cause.category().id());
            payload.put("severity", cause.severity().id());
        }
        events.publish(type, source.id(), payload);
    }
}
