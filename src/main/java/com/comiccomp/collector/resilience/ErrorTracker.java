package com.comiccomp.collector.resilience;

import com.comiccomp.collector.config.CollectionProperties;
import com.comiccomp.collector.event.CollectionEventPublisher;
import com.comiccomp.collector.event.CollectionEventType;
import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.source.ListingSourceException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Keeps error statistics, the rolling error log and the alerting thresholds.
 * <p>
 * Every recorded failure is logged at a level matching its severity. An alert is
 * raised when the failure is critical, when too many failures occur in a row, or
 * when the critical count crosses its threshold; alerts for one source are spaced
 * by the configured cooldown.
 * </p>
 * <p>
 * Failures and successes are also counted in hourly buckets, kept for the
 * configured retention; {@link #health()} derives the recent error rate and a
 * health score from the buckets overlapping the error window.
 * </p>
 */
@Slf4j
public class ErrorTracker {

    private final CollectionProperties.Alerting config;

    private final CollectionEventPublisher events;

    private final Clock clock;

    private final Deque<ErrorRecord> errorLog = new ArrayDeque<>();

    private final AtomicLong totalErrors = new AtomicLong();

    private final AtomicLong criticalErrors = new AtomicLong();

    private final AtomicInteger consecutiveErrors = new AtomicInteger();

    private final AtomicLong recoveredErrors = new AtomicLong();

    private final ConcurrentMap<ErrorCategory, LongAdder> byCategory = new ConcurrentHashMap<>();

    private final ConcurrentMap<Marketplace, LongAdder> bySource = new ConcurrentHashMap<>();

    private final ConcurrentMap<Marketplace, Boolean> lastCallFailed = new ConcurrentHashMap<>();

    private final ConcurrentMap<Marketplace, Instant> lastAlert = new ConcurrentHashMap<>();

    private final ConcurrentNavigableMap<Instant, LongAdder> errorsByHour = new ConcurrentSkipListMap<>();

    private final ConcurrentNavigableMap<Instant, LongAdder> successesByHour = new ConcurrentSkipListMap<>();

    public ErrorTracker(final CollectionProperties.Alerting config,
                        final CollectionEventPublisher events,
                        final Clock clock) {
        this.config = config;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Records a classified failure.
     *
     * @param source         the marketplace
     * @param operation      logical operation, e.g. {@code "search"}
     * @param attempt        1-based attempt number that failed
     * @param error          the failure
     * @param classification its classification
     * @return the appended log record
     */
    public ErrorRecord record(final Marketplace source,
                              final String operation,
                              final int attempt,
                              final Throwable error,
                              final ErrorClassification classification) {
        Throwable root = ErrorClassifier.unwrap(error);
        ErrorRecord entry = new ErrorRecord(clock.instant(),
                classification.category(), classification.severity(), classification.retryable(),
                source.id(), operation, attempt, messageOf(root), metadataOf(root));

        synchronized (errorLog) {
            errorLog.addLast(entry);
            while (errorLog.size() > config.getErrorLogSize()) {
                errorLog.removeFirst();
            }
        }

        totalErrors.incrementAndGet();
        byCategory.computeIfAbsent(classification.category(), c -> new LongAdder()).increment();
        bySource.computeIfAbsent(source, s -> new LongAdder()).increment();
        long critical = classification.severity() == ErrorSeverity.CRITICAL
                ? criticalErrors.incrementAndGet()
                : criticalErrors.get();
        int consecutive = consecutiveErrors.incrementAndGet();
        lastCallFailed.put(source, Boolean.TRUE);
        countHourly(errorsByHour, entry.timestamp());

        logBySeverity(entry);
        checkAlert(source, entry, consecutive, critical);
        return entry;
    }

    /**
     * Records a successful call, resetting the consecutive-failure count.
     *
     * @param source the marketplace
     */
    public void recordSuccess(final Marketplace source) {
        countHourly(successesByHour, clock.instant());
        consecutiveErrors.set(0);
        if (lastCallFailed.remove(source) != null) {
            recoveredErrors.incrementAndGet();
        }
    }

    public ErrorSummary summary() {
        Map<String, Long> categories = new TreeMap<>();
        byCategory.forEach((c, n) -> categories.put(c.id(), n.sum()));
        Map<String, Long> sources = new TreeMap<>();
        bySource.forEach((s, n) -> sources.put(s.id(), n.sum()));
        return new ErrorSummary(totalErrors.get(), criticalErrors.get(), consecutiveErrors.get(),
                recoveredErrors.get(), categories, sources);
    }

    /**
     * Error rate and health score over the error window.
     * <p>
     * The error rate is failures divided by all recorded calls in the hourly buckets
     * overlapping the window; the health score is one minus that rate. With no calls
     * recorded the score is 1.
     * </p>
     *
     * @return the current health view
     */
    public ErrorHealth health() {
        Instant now = clock.instant();
        prune(errorsByHour, now);
        prune(successesByHour, now);
        Instant from = now.minus(config.getErrorWindow()).truncatedTo(ChronoUnit.HOURS);
        long errors = sum(errorsByHour.tailMap(from, true));
        long operations = errors + sum(successesByHour.tailMap(from, true));
        double errorRate = operations == 0 ? 0.0 : errors / (double) operations;
        double score = Math.max(0.0, 1.0 - errorRate);

        Map<Instant, Long> hourly = new TreeMap<>();
        errorsByHour.forEach((hour, n) -> hourly.put(hour, n.sum()));
        return new ErrorHealth(score, errorRate, errors, operations,
                score > 1.0 - config.getDegradationThreshold(), hourly);
    }

    /**
     * @param limit maximum number of records
     * @return the most recent records, newest first
     */
    public List<ErrorRecord> recentErrors(final int limit) {
        List<ErrorRecord> recent = new ArrayList<>(Math.max(0, limit));
        synchronized (errorLog) {
            Iterator<ErrorRecord> it = errorLog.descendingIterator();
            while (it.hasNext() && recent.size() < limit) {
                recent.add(it.next());
            }
        }
        return recent;
    }

    private void checkAlert(final Marketplace source,
                            final ErrorRecord entry,
                            final int consecutive,
                            final long critical) {
        List<String> reasons = new ArrayList<>();
        if (entry.severity() == ErrorSeverity.CRITICAL) {
            reasons.add("critical " + entry.category().id() + " error");
        }
        if (consecutive >= config.getConsecutiveErrors()) {
            reasons.add(consecutive + " consecutive errors");
        }
        if (critical >= config.getCriticalErrors()) {
            reasons.add(critical + " critical errors");
        }
        if (reasons.isEmpty()) {
            return;
        }

        Instant now = entry.timestamp();
        boolean[] due = new boolean[1];
        lastAlert.compute(source, (s, previous) -> {
            if (previous == null || !now.isBefore(previous.plus(config.getCooldown()))) {
                due[0] = true;
                return now;
            }
            return previous;
        });
        if (!due[0]) {
            log.debug("Alert for {} suppressed by cooldown: {}", source, reasons);
            return;
        }

        log.error("ALERT {}: {} ({})", source, String.join(", ", reasons), entry.message());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reasons", List.copyOf(reasons));
        payload.put("category", entry.category().id());
        payload.put("severity", entry.severity().id());
        payload.put("message", entry.message());
        payload.put("consecutiveErrors", consecutive);
        payload.put("criticalErrors", critical);
        events.publish(CollectionEventType.ALERT, source.id(), payload);
    }

    private void countHourly(final ConcurrentNavigableMap<Instant, LongAdder> buckets, final Instant at) {
        buckets.computeIfAbsent(at.truncatedTo(ChronoUnit.HOURS), h -> new LongAdder()).increment();
        prune(buckets, at);
    }

    private void prune(final ConcurrentNavigableMap<Instant, LongAdder> buckets, final Instant now) {
        buckets.headMap(now.minus(config.getMetricsRetention()).truncatedTo(ChronoUnit.HOURS)).clear();
    }

    private static long sum(final Map<Instant, LongAdder> buckets) {
        return buckets.values().stream().mapToLong(LongAdder::sum).sum();
    }

    private static void logBySeverity(final ErrorRecord entry) {
        String format = "{} {} attempt {} failed [{}/{}]: {}";
        Object[] args = {entry.source(), entry.operation(), entry.attempt(),
                entry.category().id(), entry.severity().id(), entry.message()};
        switch (entry.severity()) {
            case CRITICAL:
            case HIGH:
                log.error(format, args);
                break;
            case MEDIUM:
                log.warn(format, args);
                break;
            default:
                log.info(format, args);
                break;
        }
    }

    private static String messageOf(final Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static Map<String, Object> metadataOf(final Throwable error) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (error == null) {
            return metadata;
        }
        metadata.put("exceptionType", error.getClass().getName());
        if (error instanceof ListingSourceException lse) {
            if (lse.getStatusCode() != null) {
                metadata.put("statusCode", lse.getStatusCode());
            }
            if (lse.getErrorCode() != null) {
                metadata.put("errorCode", lse.getErrorCode());
            }
        }
        return metadata;
    }
}
