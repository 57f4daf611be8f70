package com.comiccomp.collector.resilience;

import com.comiccomp.collector.collection.CancellationToken;
import com.comiccomp.collector.config.CollectionProperties;
import com.comiccomp.collector.event.CollectionEventPublisher;
import com.comiccomp.collector.event.CollectionEventType;
import com.comiccomp.collector.model.Marketplace;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter for failed source operations.
 * <p>
 * Pending retries are kept in one min-heap per source, ordered by wake time. A
 * single timer per source is armed for the earliest item; when it fires every
 * item that is due is released by completing its ready future, and the timer is
 * re-armed for whatever remains.
 * </p>
 */
@Slf4j
public class RetryScheduler {

    private final CollectionProperties.Retry config;

    private final SourceCircuitBreaker circuitBreaker;

    private final ScheduledExecutorService timer;

    private final CollectionEventPublisher events;

    private final Clock clock;

    private final DoubleSupplier random;

    private final ConcurrentMap<Marketplace, SourceQueue> queues = new ConcurrentHashMap<>();

    private final AtomicLong sequence = new AtomicLong();

    public RetryScheduler(final CollectionProperties.Retry config,
                          final SourceCircuitBreaker circuitBreaker,
                          final ScheduledExecutorService timer,
                          final CollectionEventPublisher events,
                          final Clock clock,
                          final DoubleSupplier random) {
        this.config = config;
        this.circuitBreaker = circuitBreaker;
        this.timer = timer;
        this.events = events;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Backoff without jitter: {@code base * 2^(attempt-1) * multiplier}, capped at the max delay.
     *
     * @param category category of the failure
     * @param attempt  1-based number of the attempt that failed
     * @return delay in milliseconds
     */
    public long baseDelayMillis(final ErrorCategory category, final int attempt) {
        double raw = config.getBaseDelay().toMillis()
                * Math.pow(2, Math.max(0, attempt - 1))
                * config.multiplierFor(category);
        return (long) Math.min(raw, config.getMaxDelay().toMillis());
    }

    /**
     * Full backoff including jitter, capped at the max delay.
     *
     * @param category     category of the failure
     * @param attempt      1-based number of the attempt that failed
     * @param jitterSample a value in [0, 1)
     * @return delay in milliseconds
     */
    public long delayMillis(final ErrorCategory category, final int attempt, final double jitterSample) {
        double raw = config.getBaseDelay().toMillis()
                * Math.pow(2, Math.max(0, attempt - 1))
                * config.multiplierFor(category)
                * (1 + config.getJitterFactor() * jitterSample);
        return (long) Math.min(raw, config.getMaxDelay().toMillis());
    }

    /**
     * Queues a retry of a failed operation, or refuses.
     * <p>
     * Refuses when the failure is not retryable, when {@code attempt} has reached
     * the maximum, when the source's breaker is open, or when the search is
     * already cancelled.
     * </p>
     *
     * @param source         the marketplace
     * @param operation      logical operation name
     * @param attempt        1-based number of the attempt that failed
     * @param classification classification of the failure
     * @param error          the failure
     * @param token          cancellation of the owning search
     * @return the decision
     */
    public RetryDecision scheduleRetry(final Marketplace source,
                                       final String operation,
                                       final int attempt,
                                       final ErrorClassification classification,
                                       final Throwable error,
                                       final CancellationToken token) {
        if (!classification.retryable()) {
            return RetryDecision.terminal("non-retryable " + classification.category().id() + " error");
        }
        if (attempt >= config.getMaxAttempts()) {
            return RetryDecision.terminal("retries exhausted after " + attempt + " attempt(s)");
        }
        if (circuitBreaker.isOpen(source)) {
            return RetryDecision.terminal("circuit open");
        }
        if (token.isCancelled()) {
            return RetryDecision.terminal(token.reason());
        }

        long delay = delayMillis(classification.category(), attempt, random.getAsDouble());
        RetryQueueItem item = new RetryQueueItem(source, operation, attempt + 1,
                clock.instant().plusMillis(delay), error, token,
                sequence.incrementAndGet(), new CompletableFuture<>());

        SourceQueue queue = queues.computeIfAbsent(source, SourceQueue::new);
        queue.add(item);
        token.onCancel(() -> queue.drop(item));

        log.debug("Retry {} of {} for {} in {} ms ({})",
                item.attempt(), operation, source, delay, classification.category().id());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", operation);
        payload.put("attempt", item.attempt());
        payload.put("delayMs", delay);
        payload.put("category", classification.category().id());
        payload.put("error", String.valueOf(error == null ? null : error.getMessage()));
        events.publish(CollectionEventType.RETRY_SCHEDULED, source.id(), payload);

        return RetryDecision.scheduled(delay, item.ready());
    }

    /**
     * @return number of retries waiting per source
     */
    public Map<Marketplace, Integer> queueSizes() {
        Map<Marketplace, Integer> sizes = new EnumMap<>(Marketplace.class);
        queues.forEach((source, queue) -> sizes.put(source, queue.size()));
        return sizes;
    }

    private final class SourceQueue {

        private final Marketplace source;

        private final PriorityQueue<RetryQueueItem> heap = new PriorityQueue<>();

        private ScheduledFuture<?> armed;

        private Instant armedFor;

        SourceQueue(final Marketplace source) {
            this.source = source;
        }

        synchronized int size() {
            return heap.size();
        }

        void add(final RetryQueueItem item) {
            synchronized (this) {
                heap.add(item);
                rearm();
            }
        }

        void drop(final RetryQueueItem item) {
            boolean removed;
            synchronized (this) {
                removed = heap.remove(item);
                if (removed) {
                    rearm();
                }
            }
            if (removed) {
                log.debug("Dropped pending retry {} for {}: {}", item.attempt(), source, item.token().reason());
                item.ready().completeExceptionally(new CancellationException(item.token().reason()));
            }
        }

        private void fire() {
            List<RetryQueueItem> due = new ArrayList<>();
            synchronized (this) {
                armed = null;
                armedFor = null;
                Instant now = clock.instant();
                while (!heap.isEmpty() && !heap.peek().wakeAt().isAfter(now)) {
                    due.add(heap.poll());
                }
                rearm();
            }
            for (RetryQueueItem item : due) {
                if (item.token().isCancelled()) {
                    item.ready().completeExceptionally(new CancellationException(item.token().reason()));
                } else {
                    item.ready().complete(null);
                }
            }
        }

        /** Must hold the monitor. */
        private void rearm() {
            RetryQueueItem head = heap.peek();
            if (head == null) {
                if (armed != null) {
                    armed.cancel(false);
                    armed = null;
                    armedFor = null;
                }
                return;
            }
            if (armed != null && head.wakeAt().equals(armedFor)) {
                return;
            }
            if (armed != null) {
                armed.cancel(false);
            }
            long wait = Math.max(0L, Duration.between(clock.instant(), head.wakeAt()).toMillis());
            try {
                armed = timer.schedule(this::fire, wait, TimeUnit.MILLISECONDS);
                armedFor = head.wakeAt();
            } catch (RejectedExecutionException ex) {
                log.warn("Retry timer for {} rejected, releasing {} pending retr(ies)", source, heap.size());
                armed = null;
                armedFor = null;
                while (!heap.isEmpty()) {
                    heap.poll().ready().completeExceptionally(ex);
                }
            }
        }
    }
}
