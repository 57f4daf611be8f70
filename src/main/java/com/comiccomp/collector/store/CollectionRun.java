package com.comiccomp.collector.store;

import com.comiccomp.collector.model.Marketplace;

import java.time.Instant;

/**
 * One source's part of one search, as kept in the run history.
 */
public record CollectionRun(String query,
                            Marketplace marketplace,
                            String status,
                            int resultCount,
                            long durationMs,
                            Instant recordedAt) {
}
