package com.comiccomp.collector.resilience;

import java.time.Instant;
import java.util.Map;

/**
 * One classified failure of a source operation, kept in the rolling error log.
 *
 * @param timestamp when the failure was observed
 * @param category  classified category
 * @param severity  classified severity
 * @param retryable whether the failure is eligible for retry
 * @param source    marketplace id
 * @param operation logical operation, e.g. {@code "search"}
 * @param attempt   1-based attempt number that failed
 * @param message   original error message
 * @param metadata  HTTP status, error code, exception type when known
 */
public record ErrorRecord(Instant timestamp,
                          ErrorCategory category,
                          ErrorSeverity severity,
                          boolean retryable,
                          String source,
                          String operation,
                          int attempt,
                          String message,
                          Map<String, Object> metadata) {

    public ErrorClassification classification() {
        return new ErrorClassification(category, severity, retryable);
    }
}
