package com.comiccomp.collector.collection;

import com.comiccomp.collector.config.MarketplaceCfg;
import com.comiccomp.collector.model.Marketplace;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Client-side politeness gate per marketplace.
 * <p>
 * Grants are spaced at least {@code 1000 ms / requestsPerSecond} apart, and no more
 * than {@code requestsPerMinute} grants fall into any trailing 60 seconds. Callers
 * for the same marketplace queue on its lock; other marketplaces are unaffected.
 * Waiting ends early only when the caller's search is cancelled.
 * </p>
 */
@Slf4j
public class RateLimiter {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    private static final long LOCK_POLL_MILLIS = 50;

    /**
     * Suspends the calling thread.
     */
    @FunctionalInterface
    public interface Sleeper {

        /**
         * @param duration how long to wait
         * @param token    cancellation of the waiting search
         * @throws InterruptedException  if the thread is interrupted
         * @throws CancellationException if the token is cancelled while waiting
         */
        void sleep(Duration duration, CancellationToken token) throws InterruptedException;
    }

    /** Waits on the token, so cancelling it wakes the sleeper at once. */
    public static final Sleeper TOKEN_AWARE = (duration, token) -> {
        if (token.await(duration)) {
            throw new CancellationException(token.reason());
        }
    };

    private final Map<Marketplace, MarketplaceCfg.RateLimit> limits;

    private final Clock clock;

    private final Sleeper sleeper;

    private final CollectionMetrics metrics;

    private final ConcurrentMap<Marketplace, SourceWindow> windows = new ConcurrentHashMap<>();

    public RateLimiter(final Map<Marketplace, MarketplaceCfg.RateLimit> limits,
                       final Clock clock,
                       final Sleeper sleeper,
                       final CollectionMetrics metrics) {
        this.limits = limits.isEmpty() ? new EnumMap<>(Marketplace.class) : new EnumMap<>(limits);
        this.clock = clock;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * Blocks until a request to the marketplace is within its limits, then records it.
     *
     * @param source the marketplace
     * @param token  cancellation of the calling search
     * @throws CancellationException if the search is cancelled or the thread interrupted while waiting
     */
    public void acquire(final Marketplace source, final CancellationToken token) {
        token.throwIfCancelled();
        MarketplaceCfg.RateLimit limit = limitFor(source);
        SourceWindow window = windows.computeIfAbsent(source, s -> new SourceWindow());
        try {
            lock(window, token);
            try {
                spaceOut(window, limit, token);
                respectMinuteCeiling(source, window, limit, token);
                Instant granted = clock.instant();
                if (limit.getRequestsPerMinute() > 0) {
                    window.granted.addLast(granted);
                }
                window.lastGrant = granted;
            } finally {
                window.lock.unlock();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for " + source + " rate limit");
        }
    }

    /**
     * @param source the marketplace
     * @return its configured limits, or the defaults when it has none
     */
    public MarketplaceCfg.RateLimit limitFor(final Marketplace source) {
        return limits.getOrDefault(source, new MarketplaceCfg.RateLimit());
    }

    /**
     * @return grants currently held for the marketplace's minute window
     */
    int windowSize(final Marketplace source) {
        SourceWindow window = windows.get(source);
        if (window == null) {
            return 0;
        }
        window.lock.lock();
        try {
            return window.granted.size();
        } finally {
            window.lock.unlock();
        }
    }

    private void spaceOut(final SourceWindow window,
                          final MarketplaceCfg.RateLimit limit,
                          final CancellationToken token) throws InterruptedException {
        if (window.lastGrant == null || limit.getRequestsPerSecond() <= 0) {
            return;
        }
        Duration minInterval = Duration.ofNanos(TimeUnit.SECONDS.toNanos(1) / limit.getRequestsPerSecond());
        Duration sinceLast = Duration.between(window.lastGrant, clock.instant());
        if (sinceLast.compareTo(minInterval) < 0) {
            sleeper.sleep(minInterval.minus(sinceLast), token);
        }
    }

    private void respectMinuteCeiling(final Marketplace source,
                                      final SourceWindow window,
                                      final MarketplaceCfg.RateLimit limit,
                                      final CancellationToken token) throws InterruptedException {
        if (limit.getRequestsPerMinute() <= 0) {
            return;
        }
        boolean counted = false;
        while (true) {
            Instant now = clock.instant();
            Instant horizon = now.minus(WINDOW);
            while (!window.granted.isEmpty() && !window.granted.peekFirst().isAfter(horizon)) {
                window.granted.removeFirst();
            }
            if (window.granted.size() < limit.getRequestsPerMinute()) {
                return;
            }
            if (!counted) {
                counted = true;
                metrics.rateLimitHit(source);
            }
            Duration wait = Duration.between(now, window.granted.peekFirst().plus(WINDOW));
            log.debug("{} at {} requests/min, waiting {} ms", source, limit.getRequestsPerMinute(), wait.toMillis());
            sleeper.sleep(wait.isNegative() ? Duration.ZERO : wait, token);
        }
    }

    private static void lock(final SourceWindow window, final CancellationToken token) throws InterruptedException {
        while (!window.lock.tryLock(LOCK_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            token.throwIfCancelled();
        }
    }

    private static final class SourceWindow {

        private final ReentrantLock lock = new ReentrantLock(true);

        private final Deque<Instant> granted = new ArrayDeque<>();

        private Instant lastGrant;
    }
}
