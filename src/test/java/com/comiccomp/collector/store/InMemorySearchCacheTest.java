package com.comiccomp.collector.store;

import com.comiccomp.collector.MutableClock;
import com.comiccomp.collector.collection.SearchResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySearchCacheTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T12:00:00Z");

    private final InMemorySearchCache cache = new InMemorySearchCache(clock);

    private final SearchResult result = SearchResult.builder().query("saga 1").totalListings(3).build();

    @Test
    void entriesLiveForTheirTtl() {
        cache.set("search:saga 1:200:true", result, 1800);

        clock.advance(Duration.ofSeconds(1799));
        assertThat(cache.get("search:saga 1:200:true")).contains(result);

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("search:saga 1:200:true")).isEmpty();
    }

    @Test
    void nonPositiveTtlIsNotCached() {
        cache.set("k", result, 0);

        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.get("missing")).isEmpty();
    }
}
