package com.comiccomp.collector.validation;

import java.util.Map;

/**
 * Outcome of anomaly scoring for one listing.
 *
 * @param score        mean of the per-metric scores that could be computed; 0 if none
 * @param metricScores per-metric scores in [0, 1], only for metrics with enough baseline
 */
public record AnomalyAssessment(double score, Map<BaselineMetric, Double> metricScores) {

    public static final AnomalyAssessment NONE = new AnomalyAssessment(0.0, Map.of());
}
