package com.comiccomp.collector.validation;

import com.comiccomp.collector.config.ValidationProperties;
import com.comiccomp.collector.model.NormalizedListing;
import com.comiccomp.collector.model.RawListing;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Weighted trust estimate of a structurally valid listing.
 */
public class ConfidenceScorer {

    private static final List<Pattern> COMIC_TITLE_PATTERNS = List.of(
            Pattern.compile("^(.+?)\\s*#(\\d+(?:\\.\\d+)?)\\s*(?:\\((\\d{4})\\))?"),
            Pattern.compile("^(.+?)\\s*Vol\\.?\\s*(\\d+)\\s*#(\\d+(?:\\.\\d+)?)"),
            Pattern.compile("^(.+?)\\s*(\\d+(?:\\.\\d+)?)\\s*(?:\\((\\d{4})\\))?"));

    private final ValidationProperties properties;

    private final BaselineStatistics baselines;

    private final List<ListingField> optionalFields;

    public ConfidenceScorer(final ValidationProperties properties, final BaselineStatistics baselines) {
        this.properties = properties;
        this.baselines = baselines;
        this.optionalFields = ListingField.fromIds(properties.getOptionalFields());
    }

    /**
     * Scores a listing.
     *
     * @param raw          the listing as reported
     * @param normalized   its normalized form
     * @param rules        rules of its marketplace
     * @param anomalyScore overall anomaly score in [0, 1]
     * @return the factors and the final score
     */
    public ConfidenceBreakdown score(final RawListing raw,
                                     final NormalizedListing normalized,
                                     final ValidationRules rules,
                                     final double anomalyScore) {
        ValidationProperties.Weights w = properties.getWeights();
        double price = priceReasonableness(normalized);
        double seller = sellerReliability(raw, normalized);
        double quality = listingQuality(normalized);
        double completeness = dataCompleteness(raw, rules);
        double source = properties.getSourceReliability()
                .getOrDefault(normalized.getMarketplace().id(), properties.getDefaultSourceReliability());

        double weighted = price * w.getPriceReasonableness()
                + seller * w.getSellerReliability()
                + quality * w.getListingQuality()
                + completeness * w.getDataCompleteness()
                + source * w.getSourceReliability();
        double discounted = weighted * (1 - anomalyScore * properties.getAnomaly().getConfidencePenalty());
        return new ConfidenceBreakdown(price, seller, quality, completeness, source, weighted, clamp(discounted));
    }

    double priceReasonableness(final NormalizedListing listing) {
        if (listing.getPrice() == null) {
            return 0.0;
        }
        Optional<BaselineSnapshot> baseline = baselines.snapshot(listing.getMarketplace(), BaselineMetric.PRICE);
        if (baseline.isEmpty() || baseline.get().count() < properties.getAnomaly().getMinBaselineSamples()) {
            return 0.5;
        }
        double price = listing.getPrice().doubleValue();
        double q1 = baseline.get().q1();
        double q3 = baseline.get().q3();
        if (price >= q1 && price <= q3) {
            return 1.0;
        }
        if (price < q1) {
            return q1 <= 0 ? 0.3 : Math.max(0.3, 1.0 - (q1 - price) / q1);
        }
        return q3 <= 0 ? 0.3 : Math.max(0.3, 1.0 - (price - q3) / q3);
    }

    static double sellerReliability(final RawListing raw, final NormalizedListing normalized) {
        if (raw.getSellerInfo() == null || raw.getSellerInfo().isEmpty()) {
            return 0.3;
        }
        double score = 0.5;
        Long feedback = normalized.getSellerFeedbackScore();
        if (feedback != null && feedback > 0) {
            score += Math.min(0.3, feedback / 1000.0 * 0.3);
        }
        Double percentage = normalized.getSellerFeedbackPercentage();
        if (percentage != null) {
            score += percentage / 100.0 * 0.2;
        }
        return Math.min(1.0, score);
    }

    static double listingQuality(final NormalizedListing listing) {
        double score = 0.5;
        String title = listing.getTitle();
        if (title != null) {
            if (title.length() >= 20 && title.length() <= 100) {
                score += 0.2;
            }
            if (COMIC_TITLE_PATTERNS.stream().anyMatch(p -> p.matcher(title).find())) {
                score += 0.1;
            }
        }
        String description = listing.getDescription();
        if (description != null && description.length() >= 50 && description.length() <= 1000) {
            score += 0.15;
        }
        if (!listing.getListingPhotos().isEmpty()) {
            score += 0.15;
        }
        return Math.min(1.0, score);
    }

    double dataCompleteness(final RawListing raw, final ValidationRules rules) {
        List<ListingField> required = rules.requiredFields();
        double requiredScore = required.isEmpty()
                ? 1.0
                : required.stream().filter(f -> f.isPresent(raw)).count() / (double) required.size();
        double optionalScore = optionalFields.isEmpty()
                ? 0.0
                : optionalFields.stream().filter(f -> f.isPresent(raw)).count() / (double) optionalFields.size();
        return requiredScore * 0.7 + optionalScore * 0.3;
    }

    private static double clamp(final double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
