package com.comiccomp.collector.resilience;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Failure categories a source error is classified into.
 */
public enum ErrorCategory {
    NETWORK,
    RATE_LIMIT,
    AUTHENTICATION,
    SERVER,
    PARSING,
    VALIDATION,
    UNKNOWN;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
