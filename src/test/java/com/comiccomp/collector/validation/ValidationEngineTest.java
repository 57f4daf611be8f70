package com.comiccomp.collector.validation;

import com.comiccomp.collector.Listings;
import com.comiccomp.collector.MutableClock;
import com.comiccomp.collector.RecordingListener;
import com.comiccomp.collector.config.ValidationProperties;
import com.comiccomp.collector.event.CollectionEventPublisher;
import com.comiccomp.collector.event.CollectionEventType;
import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.RawListing;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ValidationEngineTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T12:00:00Z");

    private final RecordingListener listener = new RecordingListener();

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    private BaselineStatistics baselines;

    private ValidationEngine engine;

    @BeforeEach
    void setUp() {
        baselines = new BaselineStatistics(1000);
        engine = new ValidationEngine(new ValidationProperties(), baselines, new ValidationStatistics(),
                new CollectionEventPublisher(List.of(listener), Runnable::run, clock), executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void acceptsAndNormalizesAWellFormedListing() {
        ValidationResult result = engine.validate(Listings.ebay("e-1", "$1,250.00").build(), Marketplace.EBAY);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();
        assertThat(result.getAnomalyScore()).isZero();
        assertThat(result.getConfidenceScore()).isCloseTo(0.67625, within(1e-9));
        assertThat(result.getNormalized().getPrice()).isEqualTo(new BigDecimal("1250.00"));
        assertThat(result.getNormalized().getConfidenceScore()).isEqualTo(result.getConfidenceScore());
        assertThat(result.getMetadata().marketplace()).isEqualTo(Marketplace.EBAY);
        assertThat(result.getMetadata().validatedAt()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(result.getMetadata().validatorVersion()).isEqualTo("1.0.0");
        assertThat(baselines.sampleCount(Marketplace.EBAY, BaselineMetric.PRICE)).isEqualTo(1);
    }

    @Test
    void reportsEveryStructuralProblemAtOnce() {
        RawListing listing = Listings.ebay("e-1", null)
                .title(null)
                .sourceUrl("ftp://files.example.com/e-1")
                .saleDate("last tuesday")
                .viewCount("lots")
                .build();

        ValidationResult result = engine.validate(listing, Marketplace.EBAY);

        assertThat(result.isValid()).isFalse();
        assertThat(result.isBlocked()).isFalse();
        assertThat(result.getNormalized()).isNull();
        assertThat(result.getConfidenceScore()).isZero();
        assertThat(result.getErrors()).containsExactly(
                "Missing required field: title",
                "Missing required field: price",
                "Invalid URL format: ftp://files.example.com/e-1",
                "Invalid date format for sale_date: last tuesday");
        assertThat(result.getWarnings()).contains("Invalid numeric value for view_count: lots");
        assertThat(listener.ofType(CollectionEventType.VALIDATION_FAILED)).singleElement()
                .satisfies(e -> assertThat(e.source()).isEqualTo("ebay"));
        assertThat(baselines.sampleCount(Marketplace.EBAY, BaselineMetric.PRICE)).isZero();
    }

    @Test
    void priceOutsideTheMarketplaceRangeIsAnError() {
        ValidationResult result = engine.validate(Listings.ebay("e-1", "$0.50").build(), Marketplace.EBAY);

        assertThat(result.getErrors()).containsExactly("Price out of range: 0.50 (min: 0.99, max: 999999)");
    }

    @Test
    void titleLengthIsBoundedPerMarketplace() {
        String title = "Amazing Spider-Man #300 ".repeat(4).trim();

        ValidationResult result = engine.validate(Listings.ebay("e-1", "$40").title(title).build(), Marketplace.EBAY);

        assertThat(result.getErrors()).containsExactly("Title too long: " + title.length() + " characters (max: 80)");
    }

    @Test
    void suspiciousPriceBlocksTheListing() {
        ValidationResult result = engine.validate(Listings.ebay("e-1", "$99999").build(), Marketplace.EBAY);

        assertThat(result.isValid()).isFalse();
        assertThat(result.isBlocked()).isTrue();
        assertThat(result.getErrors()).containsExactly("Suspicious price pattern detected: $99999");
        assertThat(engine.statistics().blocked()).isEqualTo(1);
    }

    @Test
    void softProblemsOnlyWarn() {
        RawListing listing = Listings.ebay("e-1", "$40")
                .condition("Mint")
                .saleType("Buy It Now")
                .bidCount("3")
                .clearListingPhotos()
                .build();

        ValidationResult result = engine.validate(listing, Marketplace.EBAY);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).containsExactlyInAnyOrder(
                "Empty array for field: listing_photos",
                "Unusual condition for ebay: Mint",
                "Fixed-price listing has bid count > 0");
    }

    @Test
    void farOffPriceIsFlaggedAndDiscounted() {
        for (int i = 0; i < 6; i++) {
            baselines.record(Marketplace.EBAY, BaselineMetric.PRICE, 90);
            baselines.record(Marketplace.EBAY, BaselineMetric.PRICE, 110);
        }

        ValidationResult result = engine.validate(Listings.ebay("e-1", "$500").build(), Marketplace.EBAY);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getAnomalyScore()).isEqualTo(1.0);
        assertThat(result.getWarnings()).containsExactly("Unusual price detected", "High anomaly score detected");
        assertThat(result.getConfidence().priceReasonableness()).isEqualTo(0.3);
        assertThat(result.getConfidenceScore())
                .isCloseTo(result.getConfidence().weightedScore() * 0.5, within(1e-12));
        assertThat(listener.ofType(CollectionEventType.ANOMALY_DETECTED)).singleElement()
                .satisfies(e -> assertThat(e.payload()).containsEntry("price", 1.0));
        assertThat(engine.statistics().anomalies()).isEqualTo(1);
        assertThat(baselines.sampleCount(Marketplace.EBAY, BaselineMetric.PRICE)).isEqualTo(13);
    }

    @Test
    void internalFailureBecomesAnInvalidResult() {
        ValidationResult result = engine.validate(null, Marketplace.EBAY);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getAnomalyScore()).isEqualTo(1.0);
        assertThat(result.getErrors()).singleElement().asString().startsWith("Validation failed: ");
    }

    @Test
    void batchKeepsInputOrderAndIsolatesFailures() {
        List<RawListing> listings = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            listings.add(Listings.heritage("h-" + i, "$" + (1000 + i * 10)).build());
        }
        List<RawListing> withBroken = new ArrayList<>(listings);
        withBroken.add(2, null);

        List<ValidationResult> results = engine.batchValidate(withBroken, Marketplace.HERITAGE, 2);

        assertThat(results).extracting(ValidationResult::getExternalId)
                .containsExactly("h-1", "h-2", null, "h-3", "h-4", "h-5");
        assertThat(results).extracting(ValidationResult::isValid)
                .containsExactly(true, true, false, true, true, true);
        assertThat(results.get(2).getErrors()).singleElement().asString().startsWith("Validation failed: ");

        ValidationStatistics.Snapshot stats = engine.statistics();
        assertThat(stats.total()).isEqualTo(6);
        assertThat(stats.passed()).isEqualTo(5);
        assertThat(stats.byMarketplace().get(Marketplace.HERITAGE).failed()).isEqualTo(1);
    }

    @Test
    void everyMarketplaceHasRules() {
        assertThat(Arrays.stream(Marketplace.values()).map(engine::rulesFor)).doesNotContainNull();
    }
}
