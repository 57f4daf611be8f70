package com.comiccomp.collector.config;

import com.comiccomp.collector.collection.CollectionMetrics;
import com.comiccomp.collector.collection.CollectionOrchestrator;
import com.comiccomp.collector.collection.RateLimiter;
import com.comiccomp.collector.event.CollectionEventListener;
import com.comiccomp.collector.event.CollectionEventPublisher;
import com.comiccomp.collector.event.LoggingEventListener;
import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.resilience.CollectorHealthIndicator;
import com.comiccomp.collector.resilience.ErrorClassifier;
import com.comiccomp.collector.resilience.ErrorTracker;
import com.comiccomp.collector.resilience.RetryScheduler;
import com.comiccomp.collector.resilience.SourceCircuitBreaker;
import com.comiccomp.collector.source.HttpListingSource;
import com.comiccomp.collector.source.ListingSource;
import com.comiccomp.collector.source.ListingSourceRegistry;
import com.comiccomp.collector.store.InMemoryListingStore;
import com.comiccomp.collector.store.InMemorySearchCache;
import com.comiccomp.collector.store.ListingStore;
import com.comiccomp.collector.store.SearchCache;
import com.comiccomp.collector.validation.BaselineStatistics;
import com.comiccomp.collector.validation.ValidationEngine;
import com.comiccomp.collector.validation.ValidationStatistics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Wires the collection pipeline.
 * <p>
 * All shared state (breakers, rate windows, baselines, retry queues, stores) lives in
 * the singletons created here. Storage and cache default to the in-memory
 * implementations; declaring another {@link ListingStore} or {@link SearchCache} bean
 * replaces them. Any {@link ListingSource} bean takes precedence over the generic
 * HTTP source for its marketplace.
 * </p>
 */
@Configuration
@Slf4j
@EnableConfigurationProperties({
        MarketplaceProperties.class,
        CollectionProperties.class,
        ValidationProperties.class
})
public class CollectorConfiguration {

    private static final int EVENT_QUEUE_CAPACITY = 1000;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /* ------------------------------------------------------------------ */
    /* Executors                                                          */
    /* ------------------------------------------------------------------ */

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService collectionExecutor(final CollectionProperties props) {
        return fixedPool(props.getMaxConcurrency(), "collector-");
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(final CollectionProperties props) {
        return fixedPool(props.getFetchConcurrency(), "collector-fetch-");
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService validationExecutor(final CollectionProperties props) {
        return fixedPool(Math.max(1, props.getValidationBatchSize()), "collector-validate-");
    }

    /**
     * A single thread delivering events; a full queue drops events rather than
     * blocking the publisher.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService eventExecutor() {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(EVENT_QUEUE_CAPACITY),
                threadFactory("collector-events-", true),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /** Drives retry timers and search deadlines. */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService collectorScheduler() {
        ScheduledThreadPoolExecutor scheduler =
                new ScheduledThreadPoolExecutor(1, threadFactory("collector-timer-", true));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /* ------------------------------------------------------------------ */
    /* Events and metrics                                                 */
    /* ------------------------------------------------------------------ */

    @Bean
    public LoggingEventListener loggingEventListener() {
        return new LoggingEventListener();
    }

    @Bean
    public CollectionEventPublisher collectionEventPublisher(final List<CollectionEventListener> listeners,
                                                             @Qualifier("eventExecutor") final ExecutorService executor,
                                                             final Clock clock) {
        return new CollectionEventPublisher(listeners, executor, clock);
    }

    @Bean
    public CollectionMetrics collectionMetrics(final MeterRegistry registry) {
        return new CollectionMetrics(registry);
    }

    /* ------------------------------------------------------------------ */
    /* Resilience                                                         */
    /* ------------------------------------------------------------------ */

    @Bean
    public MarketplaceConfigFactory marketplaceConfigFactory(final MarketplaceProperties props) {
        return new MarketplaceConfigFactory(props);
    }

    @Bean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    public SourceCircuitBreaker sourceCircuitBreaker(final CollectionProperties props,
                                                     final CollectionEventPublisher events,
                                                     final Clock clock) {
        return new SourceCircuitBreaker(props.getCircuitBreaker(), events, clock);
    }

    @Bean
    public RetryScheduler retryScheduler(final CollectionProperties props,
                                         final SourceCircuitBreaker circuitBreaker,
                                         @Qualifier("collectorScheduler") final ScheduledExecutorService scheduler,
                                         final CollectionEventPublisher events,
                                         final Clock clock) {
        return new RetryScheduler(props.getRetry(), circuitBreaker, scheduler, events, clock,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    @Bean
    public ErrorTracker errorTracker(final CollectionProperties props,
                                     final CollectionEventPublisher events,
                                     final Clock clock) {
        return new ErrorTracker(props.getAlerting(), events, clock);
    }

    /** Contributes {@code collector} to the actuator health endpoint. */
    @Bean
    public CollectorHealthIndicator collectorHealthIndicator(final ErrorTracker errorTracker,
                                                             final SourceCircuitBreaker circuitBreaker) {
        return new CollectorHealthIndicator(errorTracker, circuitBreaker);
    }

    @Bean
    public RateLimiter rateLimiter(final MarketplaceProperties props,
                                   final Clock clock,
                                   final CollectionMetrics metrics) {
        return new RateLimiter(props.rateLimits(), clock, RateLimiter.TOKEN_AWARE, metrics);
    }

    /* ------------------------------------------------------------------ */
    /* Validation                                                         */
    /* ------------------------------------------------------------------ */

    @Bean
    public BaselineStatistics baselineStatistics(final ValidationProperties props) {
        return new BaselineStatistics(props.getBaselineWindowSize());
    }

    @Bean
    public ValidationStatistics validationStatistics() {
        return new ValidationStatistics();
    }

    @Bean
    public ValidationEngine validationEngine(final ValidationProperties props,
                                             final BaselineStatistics baselines,
                                             final ValidationStatistics statistics,
                                             final CollectionEventPublisher events,
                                             @Qualifier("validationExecutor") final ExecutorService executor,
                                             final Clock clock) {
        return new ValidationEngine(props, baselines, statistics, events, executor, clock);
    }

    /* ------------------------------------------------------------------ */
    /* Sources, storage and orchestration                                 */
    /* ------------------------------------------------------------------ */

    /**
     * Registers every {@link ListingSource} bean, then adds a generic
     * {@link HttpListingSource} for each enabled marketplace that has a
     * {@code base-url} and no dedicated source.
     */
    @Bean
    public ListingSourceRegistry listingSourceRegistry(final ObjectProvider<ListingSource> customSources,
                                                       final MarketplaceProperties props,
                                                       final WebClient.Builder webClientBuilder,
                                                       @Qualifier("collectorObjectMapper") final ObjectMapper mapper) {
        List<ListingSource> all = new ArrayList<>(customSources.orderedStream().toList());
        Set<Marketplace> covered = EnumSet.noneOf(Marketplace.class);
        all.forEach(s -> covered.add(s.marketplace()));

        props.getConfigs().forEach((id, cfg) -> {
            Marketplace marketplace = Marketplace.fromId(id).orElse(null);
            if (marketplace == null) {
                log.warn("Ignoring configuration for unknown marketplace '{}'", id);
                return;
            }
            if (covered.contains(marketplace) || !cfg.isEnabled() || StringUtils.isBlank(cfg.getBaseUrl())) {
                return;
            }
            all.add(new HttpListingSource(marketplace, cfg, webClientBuilder, mapper));
        });
        return new ListingSourceRegistry(all);
    }

    @Bean
    @ConditionalOnMissingBean
    public ListingStore listingStore(final Clock clock) {
        return new InMemoryListingStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchCache searchCache(final Clock clock) {
        return new InMemorySearchCache(clock);
    }

    @Bean
    public CollectionOrchestrator collectionOrchestrator(
            final ListingSourceRegistry sources,
            final MarketplaceConfigFactory marketplaceConfigs,
            final CollectionProperties props,
            final RateLimiter rateLimiter,
            final SourceCircuitBreaker circuitBreaker,
            final ErrorClassifier errorClassifier,
            final ErrorTracker errorTracker,
            final RetryScheduler retryScheduler,
            final TimeLimiterRegistry timeLimiters,
            final ValidationEngine validationEngine,
            final ListingStore listingStore,
            final SearchCache searchCache,
            final CollectionEventPublisher events,
            final CollectionMetrics metrics,
            @Qualifier("collectionExecutor") final ExecutorService collectionExecutor,
            @Qualifier("fetchExecutor") final ExecutorService fetchExecutor,
            @Qualifier("collectorScheduler") final ScheduledExecutorService scheduler,
            final Clock clock) {
        return new CollectionOrchestrator(sources, marketplaceConfigs, props, rateLimiter, circuitBreaker,
                errorClassifier, errorTracker, retryScheduler, timeLimiters, validationEngine, listingStore,
                searchCache, events, metrics, collectionExecutor, fetchExecutor, scheduler, clock);
    }

    private static ExecutorService fixedPool(final int threads, final String prefix) {
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), threadFactory(prefix, false));
    }

    private static CustomizableThreadFactory threadFactory(final String prefix, final boolean daemon) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(daemon);
        return factory;
    }
}
