package com.comiccomp.collector.validation;

import com.comiccomp.collector.model.NormalizedListing;
import com.comiccomp.collector.model.ValidationMetadata;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Verdict of the validation engine for one listing.
 * <p>
 * A result with any error is invalid, carries no normalized listing and has zero
 * confidence and anomaly scores.
 * </p>
 */
@Value
@Builder
public class ValidationResult {

    /** External id of the validated listing, when it had one. */
    String externalId;

    boolean valid;

    @Singular
    List<String> errors;

    @Singular
    List<String> warnings;

    double confidenceScore;

    double anomalyScore;

    /** Present iff {@link #valid}. */
    NormalizedListing normalized;

    ValidationMetadata metadata;

    ConfidenceBreakdown confidence;

    AnomalyAssessment anomaly;

    /** Set when a suspicious-pattern hard error was raised. */
    boolean blocked;

    /**
     * Builds the result for a listing whose validation itself failed.
     *
     * @param externalId listing id, may be {@code null}
     * @param message    what went wrong
     * @param metadata   validation metadata
     * @return an invalid result with anomaly score 1
     */
    public static ValidationResult failure(final String externalId,
                                           final String message,
                                           final ValidationMetadata metadata) {
        return ValidationResult.builder()
                .externalId(externalId)
                .valid(false)
                .error("Validation failed: " + message)
                .confidenceScore(0.0)
                .anomalyScore(1.0)
                .confidence(ConfidenceBreakdown.NONE)
                .anomaly(AnomalyAssessment.NONE)
                .metadata(metadata)
                .build();
    }
}
