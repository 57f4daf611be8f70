package com.comiccomp.collector.collection;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cancellation signal threaded through one search: the per-source tasks, their
 * rate-limit waits, their fetches and their queued retries all observe it.
 * <p>
 * Cancelling is idempotent; the first reason wins. Callbacks registered with
 * {@link #onCancel(Runnable)} run on the cancelling thread, or immediately if the
 * token is already cancelled.
 * </p>
 */
public final class CancellationToken {

    private final CompletableFuture<String> signal = new CompletableFuture<>();

    /**
     * @return a token that is only ever cancelled explicitly
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Creates a token that cancels itself once the deadline passes.
     *
     * @param timeout   time until the token cancels
     * @param scheduler timer used to fire the deadline
     * @return the new token
     */
    public static CancellationToken withDeadline(final Duration timeout, final ScheduledExecutorService scheduler) {
        CancellationToken token = new CancellationToken();
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> token.cancel("search deadline of " + timeout.toMillis() + " ms exceeded"),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        token.onCancel(() -> timer.cancel(false));
        return token;
    }

    /**
     * Cancels the token.
     *
     * @param reason why; reported in cancelled outcomes
     */
    public void cancel(final String reason) {
        signal.complete(reason == null ? "cancelled" : reason);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /**
     * @return the cancellation reason, or {@code null} while not cancelled
     */
    public String reason() {
        return signal.getNow(null);
    }

    /**
     * @throws CancellationException if the token has been cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(reason());
        }
    }

    /**
     * Registers a callback to run on cancellation.
     *
     * @param callback the action
     */
    public void onCancel(final Runnable callback) {
        signal.thenRun(callback);
    }

    /**
     * Waits up to {@code timeout} for the token to be cancelled.
     *
     * @param timeout the longest wait
     * @return {@code true} if the token was cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(final Duration timeout) throws InterruptedException {
        if (isCancelled()) {
            return true;
        }
        if (timeout.isNegative() || timeout.isZero()) {
            return false;
        }
        try {
            signal.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException ex) {
            return false;
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Cancellation signal failed", ex.getCause());
        }
    }
}
