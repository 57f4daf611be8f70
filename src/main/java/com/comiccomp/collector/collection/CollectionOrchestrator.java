package com.comiccomp.collector.collection;

import com.comiccomp.collector.config.CollectionProperties;
import com.comiccomp.collector.config.MarketplaceCfg;
import com.comiccomp.collector.config.MarketplaceConfigFactory;
import com.comiccomp.collector.event.CollectionEventPublisher;
import com.comiccomp.collector.event.CollectionEventType;
import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.NormalizedListing;
import com.comiccomp.collector.model.RawListing;
import com.comiccomp.collector.resilience.ErrorClassification;
import com.comiccomp.collector.resilience.ErrorClassifier;
import com.comiccomp.collector.resilience.ErrorTracker;
import com.comiccomp.collector.resilience.RetryDecision;
import com.comiccomp.collector.resilience.RetryScheduler;
import com.comiccomp.collector.resilience.SourceCircuitBreaker;
import com.comiccomp.collector.source.ListingSource;
import com.comiccomp.collector.source.ListingSourceRegistry;
import com.comiccomp.collector.source.SourceQuery;
import com.comiccomp.collector.store.ListingStore;
import com.comiccomp.collector.store.SearchCache;
import com.comiccomp.collector.validation.ValidationEngine;
import com.comiccomp.collector.validation.ValidationResult;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;

/**
 * <h2>CollectionOrchestrator</h2>
 *
 * <p>Runs one search across every configured marketplace:</p>
 * <ol>
 *   <li>answers from the search cache when an identical search is cached;</li>
 *   <li>skips marketplaces whose circuit is open and fans out one task per remaining
 *       marketplace, each going rate limiter, breaker permission, time-limited fetch,
 *       and on failure classification, breaker and error bookkeeping and a scheduled retry;</li>
 *   <li>waits for every task to settle or for the search deadline;</li>
 *   <li>validates the collected listings, stores the valid ones and caches the aggregate.</li>
 * </ol>
 *
 * <p>A failing marketplace never fails the search. {@link InvalidQueryException} is the
 * only exception {@link #search} throws.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class CollectionOrchestrator {

    static final String OPERATION = "search";

    static final String NO_SOURCES = "No operational sources: all circuits open";

    private static final int MIN_QUERY_LENGTH = 2;

    private static final int MAX_QUERY_LENGTH = 200;

    private static final int RECENT_ERRORS = 10;

    private final ListingSourceRegistry sources;

    private final MarketplaceConfigFactory marketplaceConfigs;

    private final CollectionProperties properties;

    private final RateLimiter rateLimiter;

    private final SourceCircuitBreaker circuitBreaker;

    private final ErrorClassifier errorClassifier;

    private final ErrorTracker errorTracker;

    private final RetryScheduler retryScheduler;

    private final TimeLimiterRegistry timeLimiters;

    private final ValidationEngine validationEngine;

    private final ListingStore listingStore;

    private final SearchCache searchCache;

    private final CollectionEventPublisher events;

    private final CollectionMetrics metrics;

    private final ExecutorService collectionExecutor;

    private final ExecutorService fetchExecutor;

    private final ScheduledExecutorService scheduler;

    private final Clock clock;

    /**
     * Searches every operational marketplace.
     *
     * @param query   search text, 2 to 200 characters after trimming
     * @param options caller options; {@code null} means defaults
     * @return the aggregate result
     * @throws InvalidQueryException if the query is unusable
     */
    public SearchResult search(final String query, final SearchOptions options) {
        String q = query == null ? "" : query.trim();
        if (q.length() < MIN_QUERY_LENGTH || q.length() > MAX_QUERY_LENGTH) {
            throw new InvalidQueryException("Query must be between " + MIN_QUERY_LENGTH + " and "
                    + MAX_QUERY_LENGTH + " characters, got " + q.length());
        }
        SearchOptions opts = options == null ? SearchOptions.defaults() : options;
        int maxResults = opts.maxResults() != null && opts.maxResults() > 0
                ? opts.maxResults()
                : properties.getMaxResults();
        String cacheKey = cacheKey(q, maxResults, opts.includeSoldListings());

        Optional<SearchResult> cached = readCache(cacheKey);
        if (cached.isPresent()) {
            log.info("Search '{}' answered from cache", q);
            metrics.search("cached");
            return cached.get().toBuilder().fromCache(true).build();
        }

        long started = System.nanoTime();
        Map<String, Object> startPayload = new LinkedHashMap<>();
        startPayload.put("query", q);
        startPayload.put("maxResults", maxResults);
        startPayload.put("includeSoldListings", opts.includeSoldListings());
        events.publish(CollectionEventType.SEARCH_STARTED, null, startPayload);

        Map<Marketplace, SourceOutcome> outcomes = new EnumMap<>(Marketplace.class);
        List<ListingSource> operational = new ArrayList<>();
        for (ListingSource source : configuredSources()) {
            if (circuitBreaker.isOpen(source.marketplace())) {
                log.info("Skipping {}: circuit open", source.marketplace());
                outcomes.put(source.marketplace(), SourceOutcome.skipped(source.marketplace()));
            } else {
                operational.add(source);
            }
        }

        if (operational.isEmpty()) {
            log.warn("Search '{}' not run: {}", q, NO_SOURCES);
            metrics.search("no_sources");
            events.publish(CollectionEventType.SEARCH_FAILED, null, Map.of("query", q, "reason", NO_SOURCES));
            return SearchResult.builder()
                    .query(q)
                    .outcomes(outcomes)
                    .elapsedMillis(millisSince(started))
                    .completedAt(clock.instant())
                    .error(NO_SOURCES)
                    .build();
        }

        Duration deadline = opts.timeout() != null ? opts.timeout() : properties.getSearchTimeout();
        CancellationToken token = CancellationToken.withDeadline(deadline, scheduler);
        Map<Marketplace, SourceCollection> collected = new EnumMap<>(Marketplace.class);
        try {
            Map<Marketplace, CompletableFuture<SourceCollection>> tasks = new EnumMap<>(Marketplace.class);
            for (ListingSource source : operational) {
                tasks.put(source.marketplace(), collect(source, q, maxResults, opts.includeSoldListings(), token));
            }
            CompletableFuture.allOf(tasks.values().toArray(new CompletableFuture[0])).join();
            tasks.forEach((m, task) -> collected.put(m, task.join()));
        } finally {
            token.cancel("search finished");
        }

        return finish(q, cacheKey, started, outcomes, collected);
    }

    /**
     * @return health view of sources, breakers, retries, errors and validation
     */
    public CollectionStatus status() {
        return new CollectionStatus(metrics.snapshot(), circuitBreaker.snapshot(), retryScheduler.queueSizes(),
                errorTracker.summary(), errorTracker.recentErrors(RECENT_ERRORS), validationEngine.statistics());
    }

    static String cacheKey(final String query, final int maxResults, final boolean includeSold) {
        return "search:" + query + ":" + maxResults + ":" + includeSold;
    }

    private SearchResult finish(final String query,
                                final String cacheKey,
                                final long started,
                                final Map<Marketplace, SourceOutcome> outcomes,
                                final Map<Marketplace, SourceCollection> collected) {
        Map<String, NormalizedListing> merged = new LinkedHashMap<>();
        Map<Marketplace, Integer> keptPerSource = new EnumMap<>(Marketplace.class);
        int invalid = 0;
        int blocked = 0;
        for (Map.Entry<Marketplace, SourceCollection> e : collected.entrySet()) {
            Marketplace m = e.getKey();
            outcomes.put(m, e.getValue().outcome());
            List<RawListing> raw = e.getValue().listings();
            if (raw.isEmpty()) {
                continue;
            }
            int sourceInvalid = 0;
            int sourceBlocked = 0;
            int kept = 0;
            for (ValidationResult result : validationEngine.batchValidate(raw, m, properties.getValidationBatchSize())) {
                if (result.isValid()) {
                    merged.put(result.getNormalized().storageKey(), result.getNormalized());
                    kept++;
                } else {
                    sourceInvalid++;
                    if (result.isBlocked()) {
                        sourceBlocked++;
                    }
                    log.debug("Dropped {} listing {}: {}", m, result.getExternalId(), result.getErrors());
                }
            }
            keptPerSource.put(m, kept);
            invalid += sourceInvalid;
            blocked += sourceBlocked;
            metrics.listingsInvalid(m, sourceInvalid);
            metrics.listingsBlocked(m, sourceBlocked);
        }

        List<NormalizedListing> listings = new ArrayList<>(merged.values());
        String error = null;
        int stored = 0;
        try {
            if (!listings.isEmpty()) {
                stored = listingStore.upsert(listings);
                metrics.listingsStored(stored);
            }
        } catch (RuntimeException ex) {
            log.error("Storing {} listing(s) for '{}' failed", listings.size(), query, ex);
            error = "Storage failed: " + ex.getMessage();
        }
        for (SourceOutcome outcome : outcomes.values()) {
            try {
                listingStore.recordCollectionRun(query, outcome.marketplace(), outcome.status().name(),
                        keptPerSource.getOrDefault(outcome.marketplace(), 0), outcome.latencyMillis());
            } catch (RuntimeException ex) {
                log.error("Recording the {} collection run for '{}' failed", outcome.marketplace(), query, ex);
                if (error == null) {
                    error = "Storage failed: " + ex.getMessage();
                }
            }
        }

        SearchResult result = SearchResult.builder()
                .query(query)
                .totalListings(listings.size())
                .listings(listings)
                .outcomes(outcomes)
                .invalidListings(invalid)
                .blockedListings(blocked)
                .storedListings(stored)
                .elapsedMillis(millisSince(started))
                .completedAt(clock.instant())
                .error(error)
                .build();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("totalListings", result.getTotalListings());
        payload.put("successfulSources", result.successfulSources());
        payload.put("failedSources", result.failedSources());
        payload.put("invalidListings", invalid);
        payload.put("blockedListings", blocked);
        payload.put("elapsedMs", result.getElapsedMillis());
        if (result.successfulSources() > 0) {
            writeCache(cacheKey, result);
            metrics.search("completed");
            events.publish(CollectionEventType.SEARCH_COMPLETED, null, payload);
            log.info("Search '{}' done: {} listing(s) from {}/{} source(s), {} invalid, {} blocked in {} ms",
                    query, result.getTotalListings(), result.successfulSources(), outcomes.size(),
                    invalid, blocked, result.getElapsedMillis());
        } else {
            metrics.search("failed");
            payload.put("reason", "no source succeeded");
            events.publish(CollectionEventType.SEARCH_FAILED, null, payload);
            log.warn("Search '{}' got no answer from any of {} source(s) in {} ms",
                    query, outcomes.size(), result.getElapsedMillis());
        }
        return result;
    }

    private List<ListingSource> configuredSources() {
        List<ListingSource> configured = new ArrayList<>();
        for (ListingSource source : sources.all()) {
            boolean enabled = marketplaceConfigs.find(source.marketplace())
                    .map(MarketplaceCfg::isEnabled)
                    .orElse(true);
            if (enabled) {
                configured.add(source);
            }
        }
        return configured;
    }

    private CompletableFuture<SourceCollection> collect(final ListingSource source,
                                                        final String query,
                                                        final int maxResults,
                                                        final boolean includeSold,
                                                        final CancellationToken token) {
        MarketplaceCfg cfg = marketplaceConfigs.find(source.marketplace()).orElseGet(MarketplaceCfg::new);
        SourceQuery sourceQuery = new SourceQuery(query, Math.min(maxResults, cfg.getMaxResults()),
                includeSold, cfg.getTimeout());
        TimeLimiter limiter = timeLimiters.timeLimiter(source.marketplace().id(), TimeLimiterConfig.custom()
                .timeoutDuration(cfg.getTimeout())
                .cancelRunningFuture(true)
                .build());
        SourceRun run = new SourceRun(source, sourceQuery, limiter, token);
        token.onCancel(run::cancel);
        try {
            collectionExecutor.execute(() -> run.attempt(1));
        } catch (RejectedExecutionException ex) {
            run.fail(errorClassifier.classify(ex), ex, "collection executor rejected the task");
        }
        return run.result;
    }

    private Optional<SearchResult> readCache(final String key) {
        try {
            return searchCache.get(key);
        } catch (RuntimeException ex) {
            log.warn("Search cache read for '{}' failed, collecting directly: {}", key, ex.toString());
            return Optional.empty();
        }
    }

    private void writeCache(final String key, final SearchResult result) {
        try {
            searchCache.set(key, result, properties.getCacheTtl().toSeconds());
        } catch (RuntimeException ex) {
            log.warn("Search cache write for '{}' failed: {}", key, ex.toString());
        }
    }

    private static long millisSince(final long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    private static String messageOf(final Throwable error) {
        Throwable root = ErrorClassifier.unwrap(error);
        if (root == null) {
            return "unknown error";
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    /**
     * What one marketplace contributed to a search.
     */
    record SourceCollection(SourceOutcome outcome, List<RawListing> listings) {
    }

    /**
     * One marketplace's attempts within one search. Attempts run one after another;
     * the result completes exactly once, with success, terminal failure or cancellation.
     */
    private final class SourceRun {

        private final ListingSource source;

        private final Marketplace marketplace;

        private final SourceQuery query;

        private final TimeLimiter limiter;

        private final CancellationToken token;

        private final long started = System.nanoTime();

        private final CompletableFuture<SourceCollection> result = new CompletableFuture<>();

        private volatile int attempts;

        private volatile Future<List<RawListing>> inFlight;

        private volatile ErrorClassification lastFailure;

        SourceRun(final ListingSource source,
                  final SourceQuery query,
                  final TimeLimiter limiter,
                  final CancellationToken token) {
            this.source = source;
            this.marketplace = source.marketplace();
            this.query = query;
            this.limiter = limiter;
            this.token = token;
        }

        void attempt(final int attempt) {
            if (result.isDone()) {
                return;
            }
            long callStarted = System.nanoTime();
            try {
                rateLimiter.acquire(marketplace, token);
                if (!circuitBreaker.tryAcquirePermission(marketplace)) {
                    refused(attempt);
                    return;
                }
                attempts = attempt;
                metrics.attempt(marketplace);
                callStarted = System.nanoTime();
                List<RawListing> listings = limiter.executeFutureSupplier(() -> {
                    Future<List<RawListing>> future = fetchExecutor.submit(() -> source.search(query));
                    inFlight = future;
                    return future;
                });
                inFlight = null;
                succeeded(listings == null ? List.of() : listings, Duration.ofNanos(System.nanoTime() - callStarted));
            } catch (CancellationException ex) {
                inFlight = null;
                cancel();
            } catch (InterruptedException ex) {
                inFlight = null;
                Thread.currentThread().interrupt();
                cancel();
            } catch (Exception ex) {
                inFlight = null;
                if (token.isCancelled()) {
                    cancel();
                } else {
                    failed(attempt, ex, Duration.ofNanos(System.nanoTime() - callStarted));
                }
            }
        }

        void cancel() {
            Future<List<RawListing>> future = inFlight;
            if (future != null) {
                future.cancel(true);
            }
            String reason = token.reason() != null ? token.reason() : "cancelled";
            SourceOutcome outcome = new SourceOutcome(marketplace, SourceStatus.CANCELLED, attempts, 0,
                    millisSince(started), null, reason);
            if (result.complete(new SourceCollection(outcome, List.of()))) {
                log.info("{} cancelled after {} attempt(s): {}", marketplace, attempts, reason);
            }
        }

        void fail(final ErrorClassification classification, final Throwable error, final String reason) {
            String message = messageOf(error);
            SourceOutcome outcome = new SourceOutcome(marketplace, SourceStatus.FAILED, attempts, 0,
                    millisSince(started), classification.category(), message);
            if (!result.complete(new SourceCollection(outcome, List.of()))) {
                return;
            }
            log.warn("{} failed after {} attempt(s) ({}): {}", marketplace, attempts, reason, message);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("query", query.query());
            payload.put("attempts", attempts);
            payload.put("category", classification.category().id());
            payload.put("error", message);
            payload.put("reason", reason);
            events.publish(CollectionEventType.SOURCE_FAILED, marketplace.id(), payload);
        }

        private void succeeded(final List<RawListing> listings, final Duration latency) {
            circuitBreaker.recordSuccess(marketplace);
            errorTracker.recordSuccess(marketplace);
            metrics.success(marketplace, latency);
            SourceOutcome outcome = new SourceOutcome(marketplace, SourceStatus.SUCCESS, attempts,
                    listings.size(), millisSince(started), null, null);
            if (!result.complete(new SourceCollection(outcome, List.copyOf(listings)))) {
                return;
            }
            log.debug("{} returned {} listing(s) on attempt {}", marketplace, listings.size(), attempts);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("query", query.query());
            payload.put("attempts", attempts);
            payload.put("listings", listings.size());
            payload.put("latencyMs", latency.toMillis());
            events.publish(CollectionEventType.SOURCE_SUCCEEDED, marketplace.id(), payload);
        }

        private void failed(final int attempt, final Exception error, final Duration latency) {
            ErrorClassification classification = errorClassifier.classify(error);
            lastFailure = classification;
            metrics.failure(marketplace, classification.category(), latency);
            circuitBreaker.recordFailure(marketplace, classification);
            errorTracker.record(marketplace, OPERATION, attempt, error, classification);

            RetryDecision decision = retryScheduler.scheduleRetry(marketplace, OPERATION, attempt,
                    classification, error, token);
            if (!decision.scheduled()) {
                if (token.isCancelled()) {
                    cancel();
                } else {
                    fail(classification, error, decision.reason());
                }
                return;
            }
            decision.ready()
                    .whenCompleteAsync((ignored, waitError) -> {
                        if (waitError == null) {
                            attempt(attempt + 1);
                        } else if (token.isCancelled()
                                || ErrorClassifier.unwrap(waitError) instanceof CancellationException) {
                            cancel();
                        } else {
                            fail(classification, error, "retry could not be dispatched: " + waitError);
                        }
                    }, collectionExecutor)
                    .exceptionally(dispatchError -> {
                        fail(classification, error, "retry could not be dispatched: " + dispatchError);
                        return null;
                    });
        }

        private void refused(final int attempt) {
            if (attempt == 1) {
                if (result.complete(new SourceCollection(SourceOutcome.skipped(marketplace), List.of()))) {
                    log.info("Skipping {}: circuit opened before the first call", marketplace);
                }
                return;
            }
            ErrorClassification last = lastFailure;
            SourceOutcome outcome = new SourceOutcome(marketplace, SourceStatus.FAILED, attempts, 0,
                    millisSince(started), last == null ? null : last.category(), "circuit open");
            if (result.complete(new SourceCollection(outcome, List.of()))) {
                log.warn("{} retry {} refused: circuit open", marketplace, attempt);
                events.publish(CollectionEventType.SOURCE_FAILED, marketplace.id(),
                        Map.of("query", query.query(), "attempts", attempts, "reason", "circuit open"));
            }
        }
    }
}
