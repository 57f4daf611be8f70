package com.comiccomp.collector.resilience;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a classified error. {@link #CRITICAL} trips the circuit breaker at once.
 */
public enum ErrorSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
