package com.comiccomp.collector.validation;

import com.comiccomp.collector.config.ValidationProperties;
import com.comiccomp.collector.model.NormalizedListing;

import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Numeric listing values tracked in rolling baselines, with the anomaly threshold
 * that applies to each.
 */
public enum BaselineMetric {

    PRICE("price", l -> toDouble(l.getPrice())),
    VIEW_COUNT("view_count", l -> toDouble(l.getViewCount())),
    WATCHER_COUNT("watcher_count", l -> toDouble(l.getWatcherCount())),
    BID_COUNT("bid_count", l -> toDouble(l.getBidCount())),
    FEEDBACK_SCORE("feedback_score", l -> toDouble(l.getSellerFeedbackScore()));

    private final String id;

    private final Function<NormalizedListing, Double> extractor;

    BaselineMetric(final String id, final Function<NormalizedListing, Double> extractor) {
        this.id = id;
        this.extractor = extractor;
    }

    public String id() {
        return id;
    }

    /**
     * @param listing a normalized listing
     * @return the metric's value, or {@code null} if the listing lacks it
     */
    public Double valueOf(final NormalizedListing listing) {
        return extractor.apply(listing);
    }

    /**
     * @param config anomaly settings
     * @return standard deviations at which this metric scores 1.0
     */
    public double threshold(final ValidationProperties.Anomaly config) {
        switch (this) {
            case PRICE:
                return config.getPriceThreshold();
            case FEEDBACK_SCORE:
                return config.getSellerThreshold();
            default:
                return config.getVolumeThreshold();
        }
    }

    private static Double toDouble(final BigDecimal value) {
        return value == null ? null : value.doubleValue();
    }

    private static Double toDouble(final Long value) {
        return value == null ? null : value.doubleValue();
    }
}
