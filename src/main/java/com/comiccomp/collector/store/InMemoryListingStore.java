package com.comiccomp.collector.store;

import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.NormalizedListing;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local {@link ListingStore}. Listings are keyed by
 * {@link NormalizedListing#storageKey()}, so writing a listing again replaces it.
 */
@Slf4j
public class InMemoryListingStore implements ListingStore {

    private final ConcurrentMap<String, NormalizedListing> listings = new ConcurrentHashMap<>();

    private final List<CollectionRun> runs = new CopyOnWriteArrayList<>();

    private final Clock clock;

    public InMemoryListingStore(final Clock clock) {
        this.clock = clock;
    }

    @Override
    public int upsert(final List<NormalizedListing> batch) {
        for (NormalizedListing listing : batch) {
            listings.put(listing.storageKey(), listing);
        }
        log.debug("Upserted {} listing(s), {} stored", batch.size(), listings.size());
        return batch.size();
    }

    @Override
    public void recordCollectionRun(final String query,
                                    final Marketplace marketplace,
                                    final String status,
                                    final int resultCount,
                                    final long durationMs) {
        runs.add(new CollectionRun(query, marketplace, status, resultCount, durationMs, clock.instant()));
    }

    public Optional<NormalizedListing> find(final Marketplace marketplace, final String externalId) {
        return Optional.ofNullable(listings.get(marketplace.id() + ":" + externalId));
    }

    public int size() {
        return listings.size();
    }

    public List<CollectionRun> runs() {
        return new ArrayList<>(runs);
    }
}
