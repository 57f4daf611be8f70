package com.comiccomp.collector.source;

import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.RawListing;

import java.util.List;

/**
 * A marketplace listing provider.
 * <p>
 * Implementations are called from collection worker threads, possibly for several
 * searches at once, and must be thread-safe. Failures are reported as
 * {@link ListingSourceException} carrying the HTTP status or error code when known.
 * </p>
 */
public interface ListingSource {

    /**
     * @return the marketplace this source serves
     */
    Marketplace marketplace();

    /**
     * Runs one search call.
     *
     * @param query what to search for
     * @return raw listings, possibly empty
     * @throws ListingSourceException when the call fails
     */
    List<RawListing> search(SourceQuery query);
}
