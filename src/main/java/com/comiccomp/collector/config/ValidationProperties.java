package com.comiccomp.collector.config;

import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the listing validation rules found under the <code>validation</code> prefix.
 * <p>
 * {@link #defaults} applies to every marketplace; an entry in {@link #marketplaces}
 * overrides individual rules for one marketplace, any rule it leaves unset falls
 * back to the default. All values have built-in defaults so the engine works with
 * no YAML at all.
 * </p>
 */
@ConfigurationProperties(prefix = "validation")
@Getter
@Setter
public class ValidationProperties {

    /**
     * Version stamped into every validation result.
     */
    private String validatorVersion = "1.0.0";

    private Rules defaults = Rules.defaults();

    /**
     * Per-marketplace overrides keyed by marketplace id.
     */
    private Map<String, Rules> marketplaces = defaultMarketplaceRules();

    /**
     * Fields counted by the data-completeness factor besides the required ones.
     */
    private List<String> optionalFields = new ArrayList<>(List.of(
            "description", "seller_info", "listing_photos", "shipping_cost",
            "view_count", "watcher_count", "bid_count", "grade"));

    private Weights weights = new Weights();

    private Anomaly anomaly = new Anomaly();

    /**
     * Fixed trust prior per marketplace id.
     */
    private Map<String, Double> sourceReliability = defaultSourceReliability();

    /**
     * Prior for marketplaces missing from {@link #sourceReliability}.
     */
    private double defaultSourceReliability = 0.5;

    private SuspiciousPatterns suspiciousPatterns = new SuspiciousPatterns();

    /**
     * Samples kept per (marketplace, metric) baseline.
     */
    private int baselineWindowSize = 1000;

    @Data
    public static class Rules {

        private List<String> requiredFields;

        private BigDecimal minPrice;

        private BigDecimal maxPrice;

        private Integer minTitleLength;

        private Integer maxTitleLength;

        /** Expected condition wording; anything else is a warning */
        private List<String> allowedConditions;

        /** Expected sale-type wording; anything else is a warning */
        private List<String> allowedSaleTypes;

        static Rules defaults() {
            Rules r = new Rules();
            r.setRequiredFields(new ArrayList<>(List.of(
                    "id", "title", "price", "marketplace", "source_url", "condition", "sale_type")));
            r.setMinPrice(new BigDecimal("0.01"));
            r.setMaxPrice(new BigDecimal("1000000"));
            r.setMinTitleLength(5);
            r.setMaxTitleLength(500);
            return r;
        }

        static Rules of(final List<String> required, final String min, final String max,
                        final int maxTitle, final List<String> conditions, final List<String> saleTypes) {
            Rules r = new Rules();
            r.setRequiredFields(new ArrayList<>(required));
            r.setMinPrice(new BigDecimal(min));
            r.setMaxPrice(new BigDecimal(max));
            r.setMaxTitleLength(maxTitle);
            r.setAllowedConditions(conditions == null ? null : new ArrayList<>(conditions));
            r.setAllowedSaleTypes(saleTypes == null ? null : new ArrayList<>(saleTypes));
            return r;
        }
    }

    @Data
    public static class Weights {

        private double priceReasonableness = 0.25;

        private double sellerReliability = 0.25;

        private double listingQuality = 0.20;

        private double dataCompleteness = 0.15;

        private double sourceReliability = 0.15;
    }

    @Data
    public static class Anomaly {

        private boolean enabled = true;

        /** Baselines smaller than this are ignored by anomaly and price scoring */
        private int minBaselineSamples = 10;

        /** Standard deviations at which a price scores 1.0 */
        private double priceThreshold = 3.0;

        /** Standard deviations at which a view, watcher or bid count scores 1.0 */
        private double volumeThreshold = 5.0;

        /** Standard deviations at which a seller feedback score scores 1.0 */
        private double sellerThreshold = 2.5;

        /** Overall scores above this add a warning and an event */
        private double warningThreshold = 0.8;

        /** Share of the anomaly score taken off the confidence score */
        private double confidencePenalty = 0.5;
    }

    @Data
    public static class SuspiciousPatterns {

        /** Matched against the price text; a match blocks the listing */
        private List<String> price = new ArrayList<>(List.of(
                "\\$[\\d,]+\\.99999",
                "\\$0\\.01",
                "\\$9999",
                "\\$99999"));

        /** Matched against the title; a match blocks the listing */
        private List<String> title = new ArrayList<>(List.of(
                "(?i)\\b(fake|replica|copy|reproduction)\\b",
                "(?i)\\b(shill|scam|fraud|stolen)\\b",
                "(?i)\\b(adult|xxx|porn)\\b",
                "(?i)\\b(casino|gambling|lottery)\\b",
                "(?i)\\b(viagra|cialis|prescription)\\b",
                "(?i)<script|javascript:|on\\w+\\s*="));

        /** Matched against the description; a match is a warning */
        private List<String> description = new ArrayList<>(List.of(
                "(?i)\\b(money back guaranteed|100% authentic|no returns)\\b",
                "(?i)\\b(limited time|act now|urgent)\\b",
                "(?i)\\b(investment|profit|roi)\\b",
                "(?i)contact.*outside.*ebay",
                "(?i)paypal.*friends.*family"));

        /** Matched against the flattened seller block; a match is a warning */
        private List<String> seller = new ArrayList<>(List.of(
                "(?i)\\b(new seller|0 feedback|private listing)\\b",
                "(?i)\\b(feedback score: 0|rating: 0)\\b",
                "(?i)\\b(account created today|new account)\\b"));
    }

    private static Map<String, Rules> defaultMarketplaceRules() {
        Map<String, Rules> rules = new LinkedHashMap<>();
        rules.put("ebay", Rules.of(List.of("id", "title", "price", "condition", "seller_info"),
                "0.99", "999999", 80,
                List.of("New", "Like New", "Very Good", "Good", "Acceptable"), null));
        rules.put("whatnot", Rules.of(List.of("id", "title", "price", "sale_type"),
                "1.00", "50000", 100,
                null, List.of("auction", "buy_now", "live_auction")));
        rules.put("comicconnect", Rules.of(List.of("id", "title", "price", "condition", "grade"),
                "1.00", "1000000", 200,
                List.of("Mint", "Near Mint", "Very Fine", "Fine", "Very Good", "Good", "Fair", "Poor"), null));
        rules.put("heritage", Rules.of(List.of("id", "title", "price", "condition", "lot_number"),
                "10.00", "5000000", 300,
                List.of("CGC", "CBCS", "Raw"), null));
        rules.put("mycomicshop", Rules.of(List.of("id", "title", "price", "condition", "grade"),
                "0.50", "100000", 150,
                List.of("M", "NM", "VF", "F", "VG", "G", "FA", "PR"), null));
        return rules;
    }

    private static Map<String, Double> defaultSourceReliability() {
        Map<String, Double> priors = new LinkedHashMap<>();
        priors.put("ebay", 0.80);
        priors.put("whatnot", 0.70);
        priors.put("comicconnect", 0.90);
        priors.put("heritage", 0.95);
        priors.put("mycomicshop", 0.85);
        priors.put("amazon", 0.60);
        return priors;
    }
}
