package com.comiccomp.collector.collection;

import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.NormalizedListing;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate outcome of one search across every source.
 * <p>
 * {@link #outcomes} always has an entry per configured source, so callers can tell
 * "nothing matched" apart from "every source failed".
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class SearchResult {

    String query;

    int totalListings;

    @Singular
    List<NormalizedListing> listings;

    @Singular
    Map<Marketplace, SourceOutcome> outcomes;

    /** Raw listings rejected by validation, blocked ones included. */
    int invalidListings;

    /** Raw listings rejected as suspicious. */
    int blockedListings;

    /** Listings written by the store. */
    int storedListings;

    long elapsedMillis;

    Instant completedAt;

    boolean fromCache;

    /** Search-level problem, e.g. no operational sources or a storage failure. */
    String error;

    public long successfulSources() {
        return outcomes.values().stream().filter(SourceOutcome::succeeded).count();
    }

    public long failedSources() {
        return outcomes.values().stream().filter(o -> o.status() == SourceStatus.FAILED).count();
    }
}
