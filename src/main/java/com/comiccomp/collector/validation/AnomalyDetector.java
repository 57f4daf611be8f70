package com.comiccomp.collector.validation;

import com.comiccomp.collector.config.ValidationProperties;
import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.NormalizedListing;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scores how far a listing's numbers sit from their marketplace baselines.
 * <p>
 * Each metric scores {@code min(|z| / threshold, 1)}. Metrics the listing lacks, or
 * whose baseline holds fewer than the minimum samples, are left out of the mean.
 * </p>
 */
public class AnomalyDetector {

    private static final double EPSILON = 1e-9;

    private final ValidationProperties.Anomaly config;

    private final BaselineStatistics baselines;

    public AnomalyDetector(final ValidationProperties.Anomaly config, final BaselineStatistics baselines) {
        this.config = config;
        this.baselines = baselines;
    }

    public AnomalyAssessment assess(final NormalizedListing listing) {
        if (!config.isEnabled()) {
            return AnomalyAssessment.NONE;
        }
        Map<BaselineMetric, Double> scores = new EnumMap<>(BaselineMetric.class);
        for (BaselineMetric metric : BaselineMetric.values()) {
            Double value = metric.valueOf(listing);
            if (value == null) {
                continue;
            }
            Optional<BaselineSnapshot> baseline = baselines.snapshot(listing.getMarketplace(), metric);
            if (baseline.isEmpty() || baseline.get().count() < config.getMinBaselineSamples()) {
                continue;
            }
            scores.put(metric, metricScore(value, baseline.get(), metric.threshold(config)));
        }
        if (scores.isEmpty()) {
            return AnomalyAssessment.NONE;
        }
        double mean = scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new AnomalyAssessment(mean, Map.copyOf(scores));
    }

    /**
     * Adds the listing's values to the baselines.
     *
     * @param listing a listing that passed validation
     */
    public void learn(final NormalizedListing listing) {
        Marketplace marketplace = listing.getMarketplace();
        for (BaselineMetric metric : BaselineMetric.values()) {
            Double value = metric.valueOf(listing);
            if (value != null) {
                baselines.record(marketplace, metric, value);
            }
        }
    }

    static double metricScore(final double value, final BaselineSnapshot baseline, final double threshold) {
        double distance = Math.abs(value - baseline.mean());
        if (baseline.stdDev() < EPSILON) {
            return distance < EPSILON ? 0.0 : 1.0;
        }
        return Math.min(distance / baseline.stdDev() / threshold, 1.0);
    }
}
