package com.comiccomp.collector.resilience;

import com.comiccomp.collector.MutableClock;
import com.comiccomp.collector.config.CollectionProperties;
import com.comiccomp.collector.event.CollectionEventPublisher;
import com.comiccomp.collector.model.Marketplace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CollectorHealthIndicatorTest {

    private static final ErrorClassification AUTH =
            new ErrorClassification(ErrorCategory.AUTHENTICATION, ErrorSeverity.CRITICAL, false);

    private ErrorTracker tracker;

    private SourceCircuitBreaker breaker;

    private CollectorHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        CollectionEventPublisher events = new CollectionEventPublisher(List.of(), Runnable::run, clock);
        tracker = new ErrorTracker(new CollectionProperties.Alerting(), events, clock);
        breaker = new SourceCircuitBreaker(new CollectionProperties.CircuitBreaker(), events, clock);
        indicator = new CollectorHealthIndicator(tracker, breaker);
    }

    @Test
    void upWhileCallsSucceed() {
        tracker.recordSuccess(Marketplace.EBAY);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("healthScore", 1.0)
                .containsEntry("recentOperations", 1L)
                .containsEntry("openCircuits", List.of())
                .doesNotContainKey("degraded");
    }

    @Test
    void downWithOpenCircuitsListedWhenErrorsDominate() {
        tracker.record(Marketplace.EBAY, "search", 1, new IllegalStateException("HTTP 401 from ebay"), AUTH);
        breaker.recordFailure(Marketplace.EBAY, AUTH);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
                .containsEntry("degraded", true)
                .containsEntry("healthScore", 0.0)
                .containsEntry("recentErrors", 1L)
                .containsEntry("openCircuits", List.of("ebay"));
        assertThat((Map<String, ?>) health.getDetails().get("circuits")).containsKey("ebay");
        assertThat((List<?>) health.getDetails().get("lastErrors")).singleElement()
                .asString().contains("ebay [authentication] HTTP 401 from ebay");
    }
}
