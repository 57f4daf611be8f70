package com.comiccomp.collector.store;

import com.comiccomp.collector.MutableClock;
import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.NormalizedListing;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryListingStoreTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T12:00:00Z");

    private final InMemoryListingStore store = new InMemoryListingStore(clock);

    @Test
    void upsertReplacesListingsWithTheSameKey() {
        store.upsert(List.of(listing(Marketplace.EBAY, "1", "10.00"), listing(Marketplace.WHATNOT, "1", "12.00")));

        int written = store.upsert(List.of(listing(Marketplace.EBAY, "1", "11.00")));

        assertThat(written).isEqualTo(1);
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.find(Marketplace.EBAY, "1")).get()
                .extracting(NormalizedListing::getPrice).isEqualTo(new BigDecimal("11.00"));
        assertThat(store.find(Marketplace.HERITAGE, "1")).isEmpty();
    }

    @Test
    void runsAreStampedAndKeptInOrder() {
        store.recordCollectionRun("saga 1", Marketplace.EBAY, "SUCCESS", 4, 120);
        store.recordCollectionRun("saga 1", Marketplace.AMAZON, "SKIPPED_CIRCUIT_OPEN", 0, 0);

        assertThat(store.runs()).containsExactly(
                new CollectionRun("saga 1", Marketplace.EBAY, "SUCCESS", 4, 120, Instant.parse("2024-03-01T12:00:00Z")),
                new CollectionRun("saga 1", Marketplace.AMAZON, "SKIPPED_CIRCUIT_OPEN", 0, 0,
                        Instant.parse("2024-03-01T12:00:00Z")));
    }

    private static NormalizedListing listing(final Marketplace marketplace, final String id, final String price) {
        return NormalizedListing.builder()
                .marketplace(marketplace)
                .externalId(id)
                .title("Saga #1")
                .price(new BigDecimal(price))
                .build();
    }
}
