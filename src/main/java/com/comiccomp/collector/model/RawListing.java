package com.comiccomp.collector.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * An unvalidated listing exactly as a source reported it.
 * <p>
 * Every value the marketplace renders as text (price, dates, counters) stays
 * text here; nothing is trusted until the {@code ValidationEngine} has parsed it.
 * Instances live only in memory between a source call and validation.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class RawListing {

    String externalId;

    String title;

    /** Price as rendered, e.g. {@code "$1,250.00"} or {@code "39.99"}. USD is implied. */
    String price;

    Marketplace marketplace;

    String sourceUrl;

    /** Marketplace vocabulary, e.g. {@code "NM"}, {@code "Very Fine"}, {@code "CGC"}. */
    String condition;

    String grade;

    /** Raw sale type, e.g. {@code "auction"}, {@code "buy_it_now"}, {@code "live_auction"}. */
    String saleType;

    String description;

    SellerInfo sellerInfo;

    @Singular
    List<String> listingPhotos;

    String shippingCost;

    String saleDate;

    String endDate;

    String viewCount;

    String watcherCount;

    String bidCount;

    /** Auction lot number; Heritage requires it. */
    String lotNumber;

    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
