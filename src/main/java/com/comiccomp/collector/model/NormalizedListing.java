package com.comiccomp.collector.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A listing that passed validation, with every field parsed into its canonical form.
 * <p>
 * {@code (marketplace, externalId)} is the storage key; upserting the same pair twice
 * replaces the earlier row.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class NormalizedListing {

    String externalId;

    Marketplace marketplace;

    String title;

    /** Fixed-point USD amount, scale 2. */
    BigDecimal price;

    String sourceUrl;

    /** Canonical condition, e.g. {@code "Near Mint"}. */
    String condition;

    GradeInfo grade;

    SaleType saleType;

    String description;

    String sellerName;

    Long sellerFeedbackScore;

    Double sellerFeedbackPercentage;

    @Singular
    List<String> listingPhotos;

    BigDecimal shippingCost;

    Instant saleDate;

    Instant endDate;

    Long viewCount;

    Long watcherCount;

    Long bidCount;

    String lotNumber;

    double confidenceScore;

    double anomalyScore;

    ValidationMetadata validationMetadata;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    /**
     * @return the idempotent storage key, {@code marketplace:externalId}
     */
    public String storageKey() {
        return marketplace.id() + ":" + externalId;
    }
}
