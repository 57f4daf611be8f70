package com.comiccomp.collector.store;

import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.NormalizedListing;

import java.util.List;

/**
 * Persistence of validated listings and of collection run history.
 * Implementations may throw any {@link RuntimeException}; callers treat storage as best effort.
 */
public interface ListingStore {

    /**
     * Inserts or replaces listings keyed by {@code (marketplace, externalId)}.
     *
     * @param listings validated listings
     * @return number of rows written
     */
    int upsert(List<NormalizedListing> listings);

    /**
     * Appends one run record for a source.
     *
     * @param query       the search text
     * @param marketplace the source
     * @param status      outcome status name
     * @param resultCount valid listings kept from the source
     * @param durationMs  time the source took
     */
    void recordCollectionRun(String query, Marketplace marketplace, String status, int resultCount, long durationMs);
}
