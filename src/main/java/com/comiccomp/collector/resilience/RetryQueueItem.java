package com.comiccomp.collector.resilience;

import com.comiccomp.collector.collection.CancellationToken;
import com.comiccomp.collector.model.Marketplace;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A failed source operation waiting for its backoff to elapse.
 *
 * @param source    the marketplace
 * @param operation logical operation, e.g. {@code "search"}
 * @param attempt   attempt number the retry will run as
 * @param wakeAt    earliest time the retry may run
 * @param error     the failure that caused the retry
 * @param token     cancellation of the owning search
 * @param sequence  tie-breaker keeping equal wake times in scheduling order
 * @param ready     completed when the item is dispatched, cancelled when dropped
 */
public record RetryQueueItem(Marketplace source,
                             String operation,
                             int attempt,
                             Instant wakeAt,
                             Throwable error,
                             CancellationToken token,
                             long sequence,
                             CompletableFuture<Void> ready) implements Comparable<RetryQueueItem> {

    @Override
    public int compareTo(final RetryQueueItem other) {
        int byTime = wakeAt.compareTo(other.wakeAt);
        return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
    }
}
