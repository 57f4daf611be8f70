package com.comiccomp.collector.collection;

import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.resilience.ErrorCategory;

/**
 * Per-source entry of a search result.
 *
 * @param marketplace   the source
 * @param status        how it ended
 * @param attempts      calls made, retries included
 * @param listingCount  raw listings returned by the successful call
 * @param latencyMillis time from the first attempt until the source settled
 * @param errorCategory category of the final error, {@code null} unless failed
 * @param errorMessage  original message of the final error, or the skip or cancel reason
 */
public record SourceOutcome(Marketplace marketplace,
                            SourceStatus status,
                            int attempts,
                            int listingCount,
                            long latencyMillis,
                            ErrorCategory errorCategory,
                            String errorMessage) {

    static SourceOutcome skipped(final Marketplace marketplace) {
        return new SourceOutcome(marketplace, SourceStatus.SKIPPED_CIRCUIT_OPEN, 0, 0, 0L, null, "circuit open");
    }

    public boolean succeeded() {
        return status == SourceStatus.SUCCESS;
    }
}
