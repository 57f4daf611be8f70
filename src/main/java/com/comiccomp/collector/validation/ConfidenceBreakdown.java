package com.comiccomp.collector.validation;

/**
 * The factors behind a confidence score, each in [0, 1].
 *
 * @param priceReasonableness closeness to the marketplace's interquartile price range
 * @param sellerReliability   seller feedback
 * @param listingQuality      title, description and photo heuristics
 * @param dataCompleteness    share of required and optional fields present
 * @param sourceReliability   fixed prior of the marketplace
 * @param weightedScore       weighted sum before the anomaly discount
 * @param score               final score after the anomaly discount, clamped
 */
public record ConfidenceBreakdown(double priceReasonableness,
                                  double sellerReliability,
                                  double listingQuality,
                                  double dataCompleteness,
                                  double sourceReliability,
                                  double weightedScore,
                                  double score) {

    public static final ConfidenceBreakdown NONE = new ConfidenceBreakdown(0, 0, 0, 0, 0, 0, 0);
}
