package com.comiccomp.collector.resilience;

import com.comiccomp.collector.source.ListingSourceException;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Maps raw source failures onto {@link ErrorClassification}s.
 * <p>
 * A {@link ListingSourceException} carrying a recognised HTTP status (400, 401,
 * 403, 429, 5xx) is classified by that status alone; the message may quote a
 * response body and is not trusted over the status. Otherwise pattern groups are
 * tried in a fixed order (network, rate limit, authentication, server, parsing,
 * validation) against every message in the cause chain and the source's error
 * code and status. The first matching group wins; nothing matching yields
 * {@link ErrorClassification#UNKNOWN}.
 * </p>
 */
public class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 5;

    private static final ErrorClassification NETWORK =
            new ErrorClassification(ErrorCategory.NETWORK, ErrorSeverity.MEDIUM, true);

    private static final ErrorClassification PARSING =
            new ErrorClassification(ErrorCategory.PARSING, ErrorSeverity.MEDIUM, false);

    private static final ErrorClassification RATE_LIMIT =
            new ErrorClassification(ErrorCategory.RATE_LIMIT, ErrorSeverity.MEDIUM, true);

    private static final ErrorClassification AUTHENTICATION =
            new ErrorClassification(ErrorCategory.AUTHENTICATION, ErrorSeverity.CRITICAL, false);

    private static final ErrorClassification SERVER =
            new ErrorClassification(ErrorCategory.SERVER, ErrorSeverity.HIGH, true);

    private static final ErrorClassification VALIDATION =
            new ErrorClassification(ErrorCategory.VALIDATION, ErrorSeverity.LOW, false);

    private static final List<PatternGroup> GROUPS = List.of(
            new PatternGroup(NETWORK,
                    "ECONNRESET", "ECONNREFUSED", "ETIMEDOUT", "ENOTFOUND", "ENETUNREACH", "EHOSTUNREACH",
                    "(?i)connection (reset|refused|closed)", "(?i)timed? ?out", "(?i)unknown host",
                    "(?i)\\bdns\\b"),
            new PatternGroup(RATE_LIMIT,
                    "(?i)rate limit", "(?i)too many requests", "(?i)quota", "(?i)throttled", "\\b429\\b"),
            new PatternGroup(AUTHENTICATION,
                    "(?i)unauthori[sz]ed", "(?i)authentication failed", "(?i)invalid credentials",
                    "(?i)forbidden", "\\b401\\b", "\\b403\\b"),
            new PatternGroup(SERVER,
                    "(?i)internal server error", "(?i)service unavailable", "(?i)bad gateway", "\\b5\\d{2}\\b"),
            new PatternGroup(PARSING,
                    "(?i)parse error", "(?i)invalid json", "(?i)malformed", "(?i)unexpected (token|character)"),
            new PatternGroup(VALIDATION,
                    "(?i)validation failed", "(?i)invalid input", "(?i)bad request", "\\b400\\b")
    );

    /**
     * Classifies a failure.
     *
     * @param error the failure, possibly wrapped in a {@link CompletionException}
     * @return its classification; never {@code null}
     */
    public ErrorClassification classify(final Throwable error) {
        if (error == null) {
            return ErrorClassification.UNKNOWN;
        }
        Throwable root = unwrap(error);

        List<String> candidates = new ArrayList<>();
        Throwable current = root;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (isNetworkType(current)) {
                return NETWORK;
            }
            if (current instanceof JsonProcessingException) {
                return PARSING;
            }
            if (current.getMessage() != null) {
                candidates.add(current.getMessage());
            }
            if (current instanceof ListingSourceException lse) {
                ErrorClassification byStatus = forStatus(lse.getStatusCode());
                if (byStatus != null) {
                    return byStatus;
                }
                if (lse.getErrorCode() != null) {
                    candidates.add(lse.getErrorCode());
                }
                if (lse.getStatusCode() != null) {
                    candidates.add(String.valueOf(lse.getStatusCode()));
                }
            }
            current = current.getCause();
        }
        return match(candidates);
    }

    /**
     * Classifies a failure known only by its message and code.
     *
     * @param message error message, may be {@code null}
     * @param code    error code, may be {@code null}
     * @return its classification; never {@code null}
     */
    public ErrorClassification classify(final String message, final String code) {
        List<String> candidates = new ArrayList<>(2);
        if (message != null) {
            candidates.add(message);
        }
        if (code != null) {
            candidates.add(code);
        }
        return match(candidates);
    }

    /**
     * Strips the executor wrappers that hide the actual failure.
     *
     * @param error a possibly wrapped failure
     * @return the innermost meaningful failure
     */
    public static Throwable unwrap(final Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * @param status HTTP status of a failed call, may be {@code null}
     * @return the classification the status implies, or {@code null} when it implies none
     */
    static ErrorClassification forStatus(final Integer status) {
        if (status == null) {
            return null;
        }
        if (status == 401 || status == 403) {
            return AUTHENTICATION;
        }
        if (status == 429) {
            return RATE_LIMIT;
        }
        if (status >= 500 && status <= 599) {
            return SERVER;
        }
        if (status == 400) {
            return VALIDATION;
        }
        return null;
    }

    private static ErrorClassification match(final List<String> candidates) {
        for (PatternGroup group : GROUPS) {
            if (group.matchesAny(candidates)) {
                return group.classification();
            }
        }
        return ErrorClassification.UNKNOWN;
    }

    private static boolean isNetworkType(final Throwable t) {
        return t instanceof TimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof NoRouteToHostException;
    }

    private record PatternGroup(ErrorClassification classification, List<Pattern> patterns) {

        PatternGroup(final ErrorClassification classification, final String... regexes) {
            this(classification, java.util.Arrays.stream(regexes).map(Pattern::compile).toList());
        }

        boolean matchesAny(final List<String> candidates) {
            for (Pattern pattern : patterns) {
                for (String candidate : candidates) {
                    if (pattern.matcher(candidate).find()) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
