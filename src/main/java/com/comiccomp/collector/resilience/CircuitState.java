package com.comiccomp.collector.resilience;

/**
 * Position of a source in the circuit breaker state machine.
 */
public enum CircuitState {

    /** Calls pass. */
    CLOSED,

    /** Calls are rejected until the recovery time elapses. */
    OPEN,

    /** A bounded number of probe calls are let through. */
    HALF_OPEN
}
