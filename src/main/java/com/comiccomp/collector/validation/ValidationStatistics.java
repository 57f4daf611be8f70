package com.comiccomp.collector.validation;

import com.comiccomp.collector.model.Marketplace;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running counters over every validation performed since start-up.
 */
public class ValidationStatistics {

    private static final int TIMING_WINDOW = 1000;

    private final LongAdder total = new LongAdder();

    private final LongAdder passed = new LongAdder();

    private final LongAdder failed = new LongAdder();

    private final LongAdder blocked = new LongAdder();

    private final LongAdder anomalies = new LongAdder();

    private final DoubleAdder confidenceSum = new DoubleAdder();

    private final ConcurrentMap<Marketplace, Counters> byMarketplace = new ConcurrentHashMap<>();

    private final Deque<Long> timings = new ArrayDeque<>();

    /**
     * @param result    a finished validation
     * @param anomalous whether it crossed the anomaly warning threshold
     */
    public void record(final ValidationResult result, final boolean anomalous) {
        total.increment();
        Marketplace marketplace = result.getMetadata() == null ? null : result.getMetadata().marketplace();
        Counters counters = marketplace == null ? null : byMarketplace.computeIfAbsent(marketplace, m -> new Counters());
        if (result.isValid()) {
            passed.increment();
            confidenceSum.add(result.getConfidenceScore());
        } else {
            failed.increment();
        }
        if (result.isBlocked()) {
            blocked.increment();
        }
        if (anomalous) {
            anomalies.increment();
        }
        if (counters != null) {
            counters.record(result);
        }
        if (result.getMetadata() != null) {
            synchronized (timings) {
                timings.addLast(result.getMetadata().validationMillis());
                while (timings.size() > TIMING_WINDOW) {
                    timings.removeFirst();
                }
            }
        }
    }

    public Snapshot snapshot() {
        long passedCount = passed.sum();
        long totalCount = total.sum();
        double avgTime;
        synchronized (timings) {
            avgTime = timings.stream().mapToLong(Long::longValue).average().orElse(0.0);
        }
        Map<Marketplace, MarketplaceSnapshot> marketplaces = new EnumMap<>(Marketplace.class);
        byMarketplace.forEach((m, c) -> marketplaces.put(m, c.snapshot()));
        return new Snapshot(totalCount, passedCount, failed.sum(), blocked.sum(), anomalies.sum(),
                totalCount == 0 ? 0.0 : passedCount / (double) totalCount,
                passedCount == 0 ? 0.0 : confidenceSum.sum() / passedCount,
                avgTime, marketplaces);
    }

    /**
     * Point-in-time view of the counters.
     *
     * @param total                 validations performed
     * @param passed                valid results
     * @param failed                invalid results
     * @param blocked               results blocked by a suspicious pattern
     * @param anomalies             results over the anomaly warning threshold
     * @param successRate           passed / total
     * @param averageConfidence     mean confidence of valid results
     * @param averageValidationMillis mean duration of the last 1000 validations
     * @param byMarketplace         per-marketplace breakdown
     */
    public record Snapshot(long total,
                           long passed,
                           long failed,
                           long blocked,
                           long anomalies,
                           double successRate,
                           double averageConfidence,
                           double averageValidationMillis,
                           Map<Marketplace, MarketplaceSnapshot> byMarketplace) {
    }

    public record MarketplaceSnapshot(long total, long passed, long failed, double averageConfidence) {
    }

    private static final class Counters {

        private long total;

        private long passed;

        private long failed;

        private double confidenceSum;

        synchronized void record(final ValidationResult result) {
            total++;
            if (result.isValid()) {
                passed++;
                confidenceSum += result.getConfidenceScore();
            } else {
                failed++;
            }
        }

        synchronized MarketplaceSnapshot snapshot() {
            return new MarketplaceSnapshot(total, passed, failed, passed == 0 ? 0.0 : confidenceSum / passed);
        }
    }
}
