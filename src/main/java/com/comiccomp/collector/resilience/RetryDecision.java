package com.comiccomp.collector.resilience;

import java.util.concurrent.CompletableFuture;

/**
 * Answer of {@link RetryScheduler#scheduleRetry}: either a queued retry with the
 * future that completes when it is due, or a terminal failure with the reason.
 *
 * @param scheduled   whether a retry was queued
 * @param delayMillis backoff applied, 0 when terminal
 * @param ready       completes when the retry is due; {@code null} when terminal
 * @param reason      why no retry was queued; {@code null} when scheduled
 */
public record RetryDecision(boolean scheduled, long delayMillis, CompletableFuture<Void> ready, String reason) {

    public static RetryDecision terminal(final String reason) {
        return new RetryDecision(false, 0L, null, reason);
    }

    public static RetryDecision scheduled(final long delayMillis, final CompletableFuture<Void> ready) {
        return new RetryDecision(true, delayMillis, ready, null);
    }
}
