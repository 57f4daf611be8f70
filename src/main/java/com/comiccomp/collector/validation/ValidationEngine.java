package com.comiccomp.collector.validation;

import com.comiccomp.collector.config.ValidationProperties;
import com.comiccomp.collector.event.CollectionEventPublisher;
import com.comiccomp.collector.event.CollectionEventType;
import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.NormalizedListing;
import com.comiccomp.collector.model.RawListing;
import com.comiccomp.collector.model.SaleType;
import com.comiccomp.collector.model.SellerInfo;
import com.comiccomp.collector.model.ValidationMetadata;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Validates, scores and normalizes raw listings.
 * <p>
 * Structural checks (required fields, formats, business rules, suspicious
 * patterns) always run in full so every problem is reported at once. Anomaly and
 * confidence scoring, normalization and the baseline update only happen for
 * listings without hard errors. Validation never throws: any internal failure
 * becomes an invalid result.
 * </p>
 */
@Slf4j
public class ValidationEngine {

    private static final double METRIC_WARNING_THRESHOLD = 0.7;

    private final ValidationProperties properties;

    private final SuspiciousPatternDetector suspiciousPatterns;

    private final AnomalyDetector anomalyDetector;

    private final ConfidenceScorer confidenceScorer;

    private final ValidationStatistics statistics;

    private final CollectionEventPublisher events;

    private final Executor executor;

    private final Clock clock;

    private final Map<Marketplace, ValidationRules> rules = new EnumMap<>(Marketplace.class);

    public ValidationEngine(final ValidationProperties properties,
                            final BaselineStatistics baselines,
                            final ValidationStatistics statistics,
                            final CollectionEventPublisher events,
                            final Executor executor,
                            final Clock clock) {
        this.properties = properties;
        this.suspiciousPatterns = new SuspiciousPatternDetector(properties.getSuspiciousPatterns());
        this.anomalyDetector = new AnomalyDetector(properties.getAnomaly(), baselines);
        this.confidenceScorer = new ConfidenceScorer(properties, baselines);
        this.statistics = statistics;
        this.events = events;
        this.executor = executor;
        this.clock = clock;
        for (Marketplace marketplace : Marketplace.values()) {
            rules.put(marketplace, ValidationRules.resolve(properties, marketplace));
        }
    }

    /**
     * Validates one listing.
     *
     * @param listing     the raw listing
     * @param marketplace marketplace whose rules apply
     * @return the verdict; never {@code null}
     */
    public ValidationResult validate(final RawListing listing, final Marketplace marketplace) {
        long started = System.nanoTime();
        try {
            return evaluate(listing, marketplace);
        } catch (RuntimeException ex) {
            log.warn("Validation of {} listing {} failed: {}", marketplace,
                    listing == null ? null : listing.getExternalId(), ex.toString());
            ValidationResult failure = ValidationResult.failure(
                    listing == null ? null : listing.getExternalId(), String.valueOf(ex.getMessage()),
                    metadata(marketplace, started));
            statistics.record(failure, false);
            return failure;
        }
    }

    /**
     * Validates listings in chunks of {@code batchSize}, each chunk concurrently.
     * Results keep the order of the input.
     *
     * @param listings    raw listings
     * @param marketplace marketplace whose rules apply
     * @param batchSize   listings validated concurrently
     * @return one result per listing
     */
    public List<ValidationResult> batchValidate(final List<RawListing> listings,
                                                final Marketplace marketplace,
                                                final int batchSize) {
        int chunk = Math.max(1, batchSize);
        List<ValidationResult> results = new ArrayList<>(listings.size());
        for (int from = 0; from < listings.size(); from += chunk) {
            List<RawListing> batch = listings.subList(from, Math.min(from + chunk, listings.size()));
            List<CompletableFuture<ValidationResult>> futures = new ArrayList<>(batch.size());
            for (RawListing listing : batch) {
                long started = System.nanoTime();
                futures.add(CompletableFuture
                        .supplyAsync(() -> evaluate(listing, marketplace), executor)
                        .exceptionally(ex -> batchFailure(listing, marketplace, ex, started)));
            }
            futures.forEach(f -> results.add(f.join()));
        }
        return results;
    }

    /**
     * @param marketplace a marketplace
     * @return its effective rules
     */
    public ValidationRules rulesFor(final Marketplace marketplace) {
        return rules.get(marketplace);
    }

    public ValidationStatistics.Snapshot statistics() {
        return statistics.snapshot();
    }

    ValidationResult evaluate(final RawListing listing, final Marketplace marketplace) {
        long started = System.nanoTime();
        ValidationRules rule = rules.get(marketplace);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        checkFields(listing, marketplace, rule, errors, warnings);
        checkFormats(listing, rule, errors, warnings);
        checkBusinessRules(listing, marketplace, rule, errors, warnings);
        SuspiciousPatternDetector.Findings findings = suspiciousPatterns.scan(listing);
        errors.addAll(findings.errors());
        warnings.addAll(findings.warnings());

        if (!errors.isEmpty()) {
            ValidationResult rejected = ValidationResult.builder()
                    .externalId(listing.getExternalId())
                    .valid(false)
                    .errors(errors)
                    .warnings(warnings)
                    .blocked(findings.blocked())
                    .confidence(ConfidenceBreakdown.NONE)
                    .anomaly(AnomalyAssessment.NONE)
                    .metadata(metadata(marketplace, started))
                    .build();
            statistics.record(rejected, false);
            log.debug("{} listing {} rejected: {}", marketplace, listing.getExternalId(), errors);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("externalId", listing.getExternalId());
            payload.put("errors", List.copyOf(errors));
            payload.put("blocked", findings.blocked());
            events.publish(CollectionEventType.VALIDATION_FAILED, marketplace.id(), payload);
            return rejected;
        }

        NormalizedListing normalized = ListingNormalizer.normalize(listing, marketplace);
        AnomalyAssessment anomaly = anomalyDetector.assess(normalized);
        anomaly.metricScores().forEach((metric, score) -> {
            if (score > METRIC_WARNING_THRESHOLD) {
                warnings.add("Unusual " + metric.id().replace('_', ' ') + " detected");
            }
        });
        boolean anomalous = anomaly.score() > properties.getAnomaly().getWarningThreshold();
        if (anomalous) {
            warnings.add("High anomaly score detected");
        }

        ConfidenceBreakdown confidence = confidenceScorer.score(listing, normalized, rule, anomaly.score());
        ValidationMetadata metadata = metadata(marketplace, started);
        normalized = normalized.toBuilder()
                .confidenceScore(confidence.score())
                .anomalyScore(anomaly.score())
                .validationMetadata(metadata)
                .build();
        anomalyDetector.learn(normalized);

        ValidationResult accepted = ValidationResult.builder()
                .externalId(listing.getExternalId())
                .valid(true)
                .warnings(warnings)
                .confidenceScore(confidence.score())
                .anomalyScore(anomaly.score())
                .normalized(normalized)
                .confidence(confidence)
                .anomaly(anomaly)
                .metadata(metadata)
                .build();
        statistics.record(accepted, anomalous);
        if (anomalous) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("externalId", listing.getExternalId());
            payload.put("anomalyScore", anomaly.score());
            anomaly.metricScores().forEach((metric, score) -> payload.put(metric.id(), score));
            events.publish(CollectionEventType.ANOMALY_DETECTED, marketplace.id(), payload);
        }
        return accepted;
    }

    private static void checkFields(final RawListing listing,
                                    final Marketplace marketplace,
                                    final ValidationRules rule,
                                    final List<String> errors,
                                    final List<String> warnings) {
        for (ListingField field : rule.requiredFields()) {
            if (!field.isPresent(listing)) {
                errors.add("Missing required field: " + field.id());
            }
        }
        if (listing.getSellerInfo() != null && listing.getSellerInfo().isEmpty()) {
            warnings.add("Empty object for field: seller_info");
        }
        if (listing.getListingPhotos() == null || listing.getListingPhotos().isEmpty()) {
            warnings.add("Empty array for field: listing_photos");
        }
        if (listing.getMarketplace() != null && listing.getMarketplace() != marketplace) {
            warnings.add("Listing reports marketplace " + listing.getMarketplace()
                    + " but is validated as " + marketplace);
        }
    }

    private static void checkFormats(final RawListing listing,
                                     final ValidationRules rule,
                                     final List<String> errors,
                                     final List<String> warnings) {
        if (StringUtils.isNotBlank(listing.getPrice())) {
            Optional<BigDecimal> price = ListingNormalizer.parsePrice(listing.getPrice());
            if (price.isEmpty()) {
                errors.add("Invalid price format: " + listing.getPrice());
            } else if (price.get().compareTo(rule.minPrice()) < 0 || price.get().compareTo(rule.maxPrice()) > 0) {
                errors.add("Price out of range: " + price.get().toPlainString()
                        + " (min: " + rule.minPrice().toPlainString()
                        + ", max: " + rule.maxPrice().toPlainString() + ")");
            }
        }

        checkCount("view_count", listing.getViewCount(), warnings);
        checkCount("watcher_count", listing.getWatcherCount(), warnings);
        checkCount("bid_count", listing.getBidCount(), warnings);
        if (StringUtils.isNotBlank(listing.getShippingCost())
                && ListingNormalizer.parseAmount(listing.getShippingCost()).filter(v -> v.signum() >= 0).isEmpty()) {
            warnings.add("Invalid numeric value for shipping_cost: " + listing.getShippingCost());
        }

        if (StringUtils.isNotBlank(listing.getSourceUrl()) && !isHttpUrl(listing.getSourceUrl().trim())) {
            errors.add("Invalid URL format: " + listing.getSourceUrl());
        }

        checkDate("sale_date", listing.getSaleDate(), errors);
        checkDate("end_date", listing.getEndDate(), errors);
    }

    private static void checkBusinessRules(final RawListing listing,
                                           final Marketplace marketplace,
                                           final ValidationRules rule,
                                           final List<String> errors,
                                           final List<String> warnings) {
        String title = ListingNormalizer.normalizeTitle(listing.getTitle());
        if (StringUtils.isNotEmpty(title)) {
            if (title.length() > rule.maxTitleLength()) {
                errors.add("Title too long: " + title.length() + " characters (max: " + rule.maxTitleLength() + ")");
            }
            if (title.length() < rule.minTitleLength()) {
                errors.add("Title too short: " + title.length() + " characters (min: " + rule.minTitleLength() + ")");
            }
        }

        if (StringUtils.isNotBlank(listing.getCondition()) && !rule.allowedConditions().isEmpty()
                && !containsIgnoreCase(rule.allowedConditions(), listing.getCondition())) {
            warnings.add("Unusual condition for " + marketplace + ": " + listing.getCondition());
        }
        if (StringUtils.isNotBlank(listing.getSaleType()) && !rule.allowedSaleTypes().isEmpty()
                && !containsIgnoreCase(rule.allowedSaleTypes(), listing.getSaleType())) {
            warnings.add("Unusual sale type for " + marketplace + ": " + listing.getSaleType());
        }

        SellerInfo seller = listing.getSellerInfo();
        if (seller != null) {
            if (StringUtils.isNotBlank(seller.getFeedbackScore())
                    && ListingNormalizer.parseCount(seller.getFeedbackScore()).isEmpty()) {
                warnings.add("Invalid seller feedback score: " + seller.getFeedbackScore());
            }
            if (StringUtils.isNotBlank(seller.getFeedbackPercentage())
                    && ListingNormalizer.parsePercentage(seller.getFeedbackPercentage()).isEmpty()) {
                warnings.add("Invalid seller feedback percentage: " + seller.getFeedbackPercentage());
            }
        }

        if (SaleType.parse(listing.getSaleType()) == SaleType.FIXED_PRICE
                && ListingNormalizer.parseCount(listing.getBidCount()).orElse(0L) > 0) {
            warnings.add("Fixed-price listing has bid count > 0");
        }
    }

    private static void checkCount(final String field, final String value, final List<String> warnings) {
        if (StringUtils.isNotBlank(value) && ListingNormalizer.parseCount(value).isEmpty()) {
            warnings.add("Invalid numeric value for " + field + ": " + value);
        }
    }

    private static void checkDate(final String field, final String value, final List<String> errors) {
        if (StringUtils.isNotBlank(value) && ListingNormalizer.parseDate(value).isEmpty()) {
            errors.add("Invalid date format for " + field + ": " + value);
        }
    }

    private static boolean isHttpUrl(final String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            return (scheme.equals("http") || scheme.equals("https")) && StringUtils.isNotBlank(uri.getHost());
        } catch (URISyntaxException ex) {
            return false;
        }
    }

    private static boolean containsIgnoreCase(final List<String> values, final String candidate) {
        String trimmed = candidate.trim();
        return values.stream().anyMatch(v -> v.equalsIgnoreCase(trimmed));
    }

    private ValidationResult batchFailure(final RawListing listing,
                                          final Marketplace marketplace,
                                          final Throwable error,
                                          final long started) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        log.warn("Validation of {} listing {} failed: {}", marketplace,
                listing == null ? null : listing.getExternalId(), cause.toString());
        ValidationResult failure = ValidationResult.failure(
                Optional.ofNullable(listing).map(RawListing::getExternalId).orElse(null),
                String.valueOf(cause.getMessage()), metadata(marketplace, started));
        statistics.record(failure, false);
        return failure;
    }

    private ValidationMetadata metadata(final Marketplace marketplace, final long startedNanos) {
        return new ValidationMetadata(marketplace,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos),
                clock.instant(), properties.getValidatorVersion());
    }
}
