package com.comiccomp.collector.resilience;

import com.comiccomp.collector.MutableClock;
import com.comiccomp.collector.RecordingListener;
import com.comiccomp.collector.config.CollectionProperties;
import com.comiccomp.collector.event.CollectionEventPublisher;
import com.comiccomp.collector.event.CollectionEventType;
import com.comiccomp.collector.model.Marketplace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceCircuitBreakerTest {

    private static final ErrorClassification SERVER =
            new ErrorClassification(ErrorCategory.SERVER, ErrorSeverity.HIGH, true);

    private static final ErrorClassification AUTH =
            new ErrorClassification(ErrorCategory.AUTHENTICATION, ErrorSeverity.CRITICAL, false);

    private MutableClock clock;

    private RecordingListener listener;

    private SourceCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        listener = new RecordingListener();
        CollectionEventPublisher events = new CollectionEventPublisher(List.of(listener), Runnable::run, clock);
        breaker = new SourceCircuitBreaker(new CollectionProperties.CircuitBreaker(), events, clock);
    }

    @Test
    void unknownSourceIsClosed() {
        assertThat(breaker.isOpen(Marketplace.EBAY)).isFalse();
        assertThat(breaker.tryAcquirePermission(Marketplace.EBAY)).isTrue();
        assertThat(breaker.stateOf(Marketplace.EBAY)).isEqualTo(CircuitSnapshot.CLOSED);
    }

    @Test
    void opensAtTheFailureThreshold() {
        for (int i = 0; i < 4; i++) {
            breaker.recordFailure(Marketplace.EBAY, SERVER);
        }
        assertThat(breaker.isOpen(Marketplace.EBAY)).isFalse();

        breaker.recordFailure(Marketplace.EBAY, SERVER);

        CircuitSnapshot s = breaker.stateOf(Marketplace.EBAY);
        assertThat(s.state()).isEqualTo(CircuitState.OPEN);
        assertThat(s.failureCount()).isEqualTo(5);
        assertThat(s.nextAttemptTime()).isEqualTo(Instant.parse("2024-03-01T12:00:30Z"));
        assertThat(breaker.isOpen(Marketplace.EBAY)).isTrue();
        assertThat(breaker.tryAcquirePermission(Marketplace.EBAY)).isFalse();
        assertThat(listener.ofType(CollectionEventType.CIRCUIT_OPENED)).hasSize(1);
    }

    @Test
    void otherSourcesAreUnaffected() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure(Marketplace.EBAY, SERVER);
        }

        assertThat(breaker.isOpen(Marketplace.HERITAGE)).isFalse();
    }

    @Test
    void halfOpensAfterRecoveryAndClosesOnSuccess() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure(Marketplace.EBAY, SERVER);
        }
        clock.advance(Duration.ofSeconds(29));
        assertThat(breaker.isOpen(Marketplace.EBAY)).isTrue();

        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.isOpen(Marketplace.EBAY)).isFalse();
        assertThat(breaker.stateOf(Marketplace.EBAY).state()).isEqualTo(CircuitState.HALF_OPEN);

        assertThat(breaker.tryAcquirePermission(Marketplace.EBAY)).isTrue();
        breaker.recordSuccess(Marketplace.EBAY);

        CircuitSnapshot s = breaker.stateOf(Marketplace.EBAY);
        assertThat(s.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(s.failureCount()).isZero();
        assertThat(listener.events()).extracting(e -> e.type()).containsExactly(
                CollectionEventType.CIRCUIT_OPENED,
                CollectionEventType.CIRCUIT_HALF_OPENED,
                CollectionEventType.CIRCUIT_CLOSED);
    }

    @Test
    void failedProbeReopens() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure(Marketplace.EBAY, SERVER);
        }
        clock.advance(Duration.ofSeconds(30));
        assertThat(breaker.tryAcquirePermission(Marketplace.EBAY)).isTrue();

        breaker.recordFailure(Marketplace.EBAY, SERVER);

        assertThat(breaker.stateOf(Marketplace.EBAY).state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.stateOf(Marketplace.EBAY).nextAttemptTime())
                .isEqualTo(Instant.parse("2024-03-01T12:01:00Z"));
    }

    @Test
    void halfOpenLetsOnlyTheConfiguredProbesThrough() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure(Marketplace.EBAY, SERVER);
        }
        clock.advance(Duration.ofSeconds(30));

        assertThat(breaker.tryAcquirePermission(Marketplace.EBAY)).isTrue();
        assertThat(breaker.tryAcquirePermission(Marketplace.EBAY)).isTrue();
        assertThat(breaker.tryAcquirePermission(Marketplace.EBAY)).isTrue();
        assertThat(breaker.tryAcquirePermission(Marketplace.EBAY)).isFalse();
        assertThat(breaker.stateOf(Marketplace.EBAY).state()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void authenticationFailureOpensAtOnceWithDoubleRecovery() {
        breaker.recordFailure(Marketplace.AMAZON, AUTH);

        CircuitSnapshot s = breaker.stateOf(Marketplace.AMAZON);
        assertThat(s.state()).isEqualTo(CircuitState.OPEN);
        assertThat(s.failureCount()).isEqualTo(5);
        assertThat(s.nextAttemptTime()).isEqualTo(Instant.parse("2024-03-01T12:01:00Z"));
        assertThat(listener.ofType(CollectionEventType.CIRCUIT_OPENED).get(0).payload())
                .containsEntry("category", "authentication")
                .containsEntry("severity", "critical");
    }

    @Test
    void successInClosedLetsOneFailureDecay() {
        breaker.recordFailure(Marketplace.WHATNOT, SERVER);
        breaker.recordFailure(Marketplace.WHATNOT, SERVER);

        breaker.recordSuccess(Marketplace.WHATNOT);
        breaker.recordSuccess(Marketplace.WHATNOT);
        breaker.recordSuccess(Marketplace.WHATNOT);

        assertThat(breaker.stateOf(Marketplace.WHATNOT).failureCount()).isZero();
    }

    @Test
    void successWhileOpenIsIgnored() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure(Marketplace.EBAY, SERVER);
        }

        breaker.recordSuccess(Marketplace.EBAY);

        assertThat(breaker.stateOf(Marketplace.EBAY).state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.snapshot()).containsOnlyKeys(Marketplace.EBAY);
    }
}
