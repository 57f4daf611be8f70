package com.comiccomp.collector.resilience;

/**
 * Outcome of {@link ErrorClassifier#classify(Throwable)}.
 *
 * @param category  failure family
 * @param severity  how bad it is
 * @param retryable whether backing off and trying again can help
 */
public record ErrorClassification(ErrorCategory category, ErrorSeverity severity, boolean retryable) {

    public static final ErrorClassification UNKNOWN =
            new ErrorClassification(ErrorCategory.UNKNOWN, ErrorSeverity.MEDIUM, false);

    /**
     * @return {@code true} for errors that open the breaker regardless of the failure count
     */
    public boolean tripsImmediately() {
        return severity == ErrorSeverity.CRITICAL || category == ErrorCategory.AUTHENTICATION;
    }
}
