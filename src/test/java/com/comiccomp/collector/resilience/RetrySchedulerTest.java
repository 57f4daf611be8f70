package com.comiccomp.collector.resilience;

import com.comiccomp.collector.RecordingListener;
import com.comiccomp.collector.collection.CancellationToken;
import com.comiccomp.collector.config.CollectionProperties;
import com.comiccomp.collector.event.CollectionEvent;
import com.comiccomp.collector.event.CollectionEventPublisher;
import com.comiccomp.collector.event.CollectionEventType;
import com.comiccomp.collector.model.Marketplace;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrySchedulerTest {

    private static final ErrorClassification SERVER =
            new ErrorClassification(ErrorCategory.SERVER, ErrorSeverity.HIGH, true);

    private static final ErrorClassification RATE_LIMIT =
            new ErrorClassification(ErrorCategory.RATE_LIMIT, ErrorSeverity.MEDIUM, true);

    private final RecordingListener listener = new RecordingListener();

    private ScheduledExecutorService timer;

    private CollectionProperties.Retry config;

    private SourceCircuitBreaker breaker;

    private RetryScheduler scheduler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        timer = Executors.newSingleThreadScheduledExecutor();
        CollectionEventPublisher events = new CollectionEventPublisher(List.of(listener), Runnable::run, clock);
        config = new CollectionProperties.Retry();
        breaker = new SourceCircuitBreaker(new CollectionProperties.CircuitBreaker(), events, clock);
        scheduler = new RetryScheduler(config, breaker, timer, events, clock, () -> 0.5);
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    void backoffDoublesPerAttemptAndScalesByCategory() {
        assertThat(scheduler.baseDelayMillis(ErrorCategory.UNKNOWN, 1)).isEqualTo(1000);
        assertThat(scheduler.baseDelayMillis(ErrorCategory.SERVER, 3)).isEqualTo(4800);
        assertThat(scheduler.baseDelayMillis(ErrorCategory.NETWORK, 2)).isEqualTo(3000);
        assertThat(scheduler.delayMillis(ErrorCategory.RATE_LIMIT, 1, 0.5)).isEqualTo(2100);
    }

    @Test
    void backoffIsCappedAtTheMaxDelay() {
        assertThat(scheduler.baseDelayMillis(ErrorCategory.RATE_LIMIT, 6)).isEqualTo(30_000);
        assertThat(scheduler.delayMillis(ErrorCategory.SERVER, 10, 0.99)).isEqualTo(30_000);
    }

    @Test
    void refusesNonRetryableErrors() {
        RetryDecision d = scheduler.scheduleRetry(Marketplace.EBAY, "search", 1,
                new ErrorClassification(ErrorCategory.PARSING, ErrorSeverity.MEDIUM, false),
                new IllegalStateException("malformed"), CancellationToken.create());

        assertThat(d.scheduled()).isFalse();
        assertThat(d.reason()).isEqualTo("non-retryable parsing error");
        assertThat(scheduler.queueSizes()).isEmpty();
    }

    @Test
    void refusesOnceAttemptsAreExhausted() {
        RetryDecision d = scheduler.scheduleRetry(Marketplace.EBAY, "search", 5, SERVER,
                new IllegalStateException("503"), CancellationToken.create());

        assertThat(d.scheduled()).isFalse();
        assertThat(d.reason()).isEqualTo("retries exhausted after 5 attempt(s)");
    }

    @Test
    void refusesWhileTheCircuitIsOpen() {
        breaker.recordFailure(Marketplace.AMAZON,
                new ErrorClassification(ErrorCategory.AUTHENTICATION, ErrorSeverity.CRITICAL, false));

        RetryDecision d = scheduler.scheduleRetry(Marketplace.AMAZON, "search", 1, SERVER,
                new IllegalStateException("503"), CancellationToken.create());

        assertThat(d.scheduled()).isFalse();
        assertThat(d.reason()).isEqualTo("circuit open");
    }

    @Test
    void refusesForACancelledSearch() {
        CancellationToken token = CancellationToken.create();
        token.cancel("search finished");

        RetryDecision d = scheduler.scheduleRetry(Marketplace.EBAY, "search", 1, SERVER,
                new IllegalStateException("503"), token);

        assertThat(d.reason()).isEqualTo("search finished");
    }

    @Test
    void releasesTheRetryOnceItsDelayElapses() throws Exception {
        config.setBaseDelay(Duration.ofMillis(20));

        RetryDecision d = scheduler.scheduleRetry(Marketplace.WHATNOT, "search", 1, RATE_LIMIT,
                new IllegalStateException("429"), CancellationToken.create());

        assertThat(d.scheduled()).isTrue();
        assertThat(d.delayMillis()).isEqualTo(42);
        d.ready().get(5, TimeUnit.SECONDS);
        assertThat(scheduler.queueSizes()).containsEntry(Marketplace.WHATNOT, 0);

        CollectionEvent event = listener.ofType(CollectionEventType.RETRY_SCHEDULED).get(0);
        assertThat(event.source()).isEqualTo("whatnot");
        assertThat(event.payload())
                .containsEntry("attempt", 2)
                .containsEntry("delayMs", 42L)
                .containsEntry("category", "rate_limit")
                .containsEntry("error", "429");
    }

    @Test
    void releasesRetriesInWakeOrder() throws Exception {
        config.setBaseDelay(Duration.ofMillis(10));
        CancellationToken token = CancellationToken.create();

        CompletableFuture<Void> later = scheduler.scheduleRetry(Marketplace.EBAY, "search", 3, SERVER,
                new IllegalStateException("503"), token).ready();
        CompletableFuture<Void> sooner = scheduler.scheduleRetry(Marketplace.EBAY, "search", 1, SERVER,
                new IllegalStateException("503"), token).ready();

        sooner.get(5, TimeUnit.SECONDS);
        later.get(5, TimeUnit.SECONDS);
        assertThat(scheduler.queueSizes()).containsEntry(Marketplace.EBAY, 0);
    }

    @Test
    void cancellingTheSearchDropsPendingRetries() {
        config.setBaseDelay(Duration.ofSeconds(10));
        CancellationToken token = CancellationToken.create();

        RetryDecision d = scheduler.scheduleRetry(Marketplace.HERITAGE, "search", 1, SERVER,
                new IllegalStateException("503"), token);
        assertThat(scheduler.queueSizes()).containsEntry(Marketplace.HERITAGE, 1);

        token.cancel("search deadline of 120000 ms exceeded");

        assertThat(scheduler.queueSizes()).containsEntry(Marketplace.HERITAGE, 0);
        assertThatThrownBy(() -> d.ready().get(1, TimeUnit.SECONDS))
                .isInstanceOf(CancellationException.class);
    }
}
