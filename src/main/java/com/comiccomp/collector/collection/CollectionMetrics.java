package com.comiccomp.collector.collection;

import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.resilience.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters of the collection pipeline.
 * <p>
 * Source meters are tagged with the marketplace id; failures also carry the error
 * category.
 * </p>
 */
public class CollectionMetrics {

    static final String ATTEMPTS = "collector.source.attempts";
    static final String SUCCESSES = "collector.source.successes";
    static final String FAILURES = "collector.source.failures";
    static final String RATE_LIMIT_HITS = "collector.source.rate_limit_hits";
    static final String LATENCY = "collector.source.latency";
    static final String BLOCKED = "collector.listings.blocked";
    static final String INVALID = "collector.listings.invalid";
    static final String STORED = "collector.listings.stored";
    static final String SEARCHES = "collector.searches";

    private static final String MARKETPLACE = "marketplace";

    private final MeterRegistry registry;

    public CollectionMetrics(final MeterRegistry registry) {
        this.registry = registry;
    }

    public void attempt(final Marketplace source) {
        counter(ATTEMPTS, source).increment();
    }

    public void success(final Marketplace source, final Duration latency) {
        counter(SUCCESSES, source).increment();
        latency(source).record(latency);
    }

    public void failure(final Marketplace source, final ErrorCategory category, final Duration latency) {
        Counter.builder(FAILURES)
                .tag(MARKETPLACE, source.id())
                .tag("category", category.id())
                .register(registry)
                .increment();
        latency(source).record(latency);
    }

    public void rateLimitHit(final Marketplace source) {
        counter(RATE_LIMIT_HITS, source).increment();
    }

    public void listingsBlocked(final Marketplace source, final int count) {
        counter(BLOCKED, source).increment(count);
    }

    public void listingsInvalid(final Marketplace source, final int count) {
        counter(INVALID, source).increment(count);
    }

    public void listingsStored(final int count) {
        registry.counter(STORED).increment(count);
    }

    /**
     * @param outcome {@code completed}, {@code cached}, {@code no_sources} or {@code failed}
     */
    public void search(final String outcome) {
        registry.counter(SEARCHES, "outcome", outcome).increment();
    }

    /**
     * @return per-marketplace totals for every marketplace that was called at least once
     */
    public Map<Marketplace, SourceMetrics> snapshot() {
        Map<Marketplace, SourceMetrics> out = new EnumMap<>(Marketplace.class);
        for (Marketplace m : Marketplace.values()) {
            double attempts = sum(ATTEMPTS, m);
            if (attempts == 0) {
                continue;
            }
            Timer timer = registry.find(LATENCY).tag(MARKETPLACE, m.id()).timer();
            double avgLatency = timer == null ? 0.0 : timer.mean(TimeUnit.MILLISECONDS);
            out.put(m, new SourceMetrics((long) attempts, (long) sum(SUCCESSES, m), (long) sum(FAILURES, m),
                    (long) sum(RATE_LIMIT_HITS, m), avgLatency));
        }
        return out;
    }

    private double sum(final String name, final Marketplace source) {
        return registry.find(name).tag(MARKETPLACE, source.id()).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    private Counter counter(final String name, final Marketplace source) {
        return registry.counter(name, MARKETPLACE, source.id());
    }

    private Timer latency(final Marketplace source) {
        return Timer.builder(LATENCY).tag(MARKETPLACE, source.id()).register(registry);
    }

    /**
     * Totals for one marketplace.
     *
     * @param attempts          calls started
     * @param successes         calls that returned listings
     * @param failures          calls that failed
     * @param rateLimitHits     acquisitions that had to wait on the per-minute ceiling
     * @param averageLatencyMs  mean call duration
     */
    public record SourceMetrics(long attempts, long successes, long failures, long rateLimitHits,
                                double averageLatencyMs) {
    }
}
