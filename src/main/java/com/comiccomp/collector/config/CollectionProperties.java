package com.comiccomp.collector.config;

import com.comiccomp.collector.resilience.ErrorCategory;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Binds the orchestration settings found under the <code>collection</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * collection:
 *   search-timeout: 120s
 *   cache-ttl: 30m
 *   retry:
 *     max-attempts: 5
 *     base-delay: 1s
 *   circuit-breaker:
 *     failure-threshold: 5
 *     recovery-timeout: 30s
 * }</pre>
 */
@ConfigurationProperties(prefix = "collection")
@Getter
@Setter
public class CollectionProperties {

    /**
     * Deadline for a whole search, across every source and retry.
     */
    private Duration searchTimeout = Duration.ofSeconds(120);

    /**
     * How long an aggregate search result stays in the cache.
     */
    private Duration cacheTtl = Duration.ofSeconds(1800);

    /**
     * Threads running per-source collection tasks.
     */
    private int maxConcurrency = 8;

    /**
     * Threads running the actual fetch calls so a timed-out fetch can be interrupted.
     */
    private int fetchConcurrency = 16;

    /**
     * Listings validated concurrently per chunk.
     */
    private int validationBatchSize = 10;

    /**
     * Default upper bound on listings requested per source when the search does not name one.
     */
    private int maxResults = 200;

    private Retry retry = new Retry();

    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    private Alerting alerting = new Alerting();

    private Http http = new Http();

    @Data
    public static class Retry {

        /** Attempts per source operation, first call included */
        private int maxAttempts = 5;

        private Duration baseDelay = Duration.ofMillis(1000);

        private Duration maxDelay = Duration.ofMillis(30_000);

        /** Upper bound of the random extra delay, as a fraction of the computed delay */
        private double jitterFactor = 0.1;

        /** Backoff multiplier per error category; missing categories use 1.0 */
        private Map<ErrorCategory, Double> multipliers = defaultMultipliers();

        public double multiplierFor(final ErrorCategory category) {
            return multipliers.getOrDefault(category, 1.0);
        }

        private static Map<ErrorCategory, Double> defaultMultipliers() {
            Map<ErrorCategory, Double> m = new EnumMap<>(ErrorCategory.class);
            m.put(ErrorCategory.RATE_LIMIT, 2.0);
            m.put(ErrorCategory.NETWORK, 1.5);
            m.put(ErrorCategory.SERVER, 1.2);
            return m;
        }
    }

    @Data
    public static class CircuitBreaker {

        private int failureThreshold = 5;

        private Duration recoveryTimeout = Duration.ofSeconds(30);

        /** Probe calls let through while half-open */
        private int halfOpenMaxCalls = 3;
    }

    @Data
    public static class Http {

        private Duration connectTimeout = Duration.ofSeconds(10);

        /** Pooled connections shared by every marketplace feed */
        private int maxConnections = 50;

        private Duration pendingAcquireTimeout = Duration.ofSeconds(2);

        /** Largest feed body buffered in memory */
        private DataSize maxInMemorySize = DataSize.ofMegabytes(8);

        /** Log request and response bytes at DEBUG */
        private boolean wiretap = false;
    }

    @Data
    public static class Alerting {

        /** Consecutive failures, any source, that raise an alert */
        private int consecutiveErrors = 10;

        /** Critical failures, any source, that raise an alert */
        private int criticalErrors = 3;

        /** Minimum spacing of alerts for one source */
        private Duration cooldown = Duration.ofMinutes(5);

        /** Capacity of the rolling error log */
        private int errorLogSize = 500;

        /** Span of the hourly buckets counted by the health check */
        private Duration errorWindow = Duration.ofHours(1);

        /** How long hourly error buckets are kept */
        private Duration metricsRetention = Duration.ofHours(24);

        /** Health is degraded once the recent error rate reaches this share of calls */
        private double degradationThreshold = 0.2;
    }
}
