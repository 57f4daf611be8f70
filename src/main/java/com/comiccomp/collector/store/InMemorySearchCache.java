package com.comiccomp.collector.store;

import com.comiccomp.collector.collection.SearchResult;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link SearchCache} backed by a concurrent map; expired entries are evicted on read.
 */
public class InMemorySearchCache implements SearchCache {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    private final Clock clock;

    public InMemorySearchCache(final Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<SearchResult> get(final String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(final String key, final SearchResult value, final long ttlSeconds) {
        if (ttlSeconds <= 0) {
            return;
        }
        entries.put(key, new Entry(value, clock.instant().plusSeconds(ttlSeconds)));
    }

    private record Entry(SearchResult value, Instant expiresAt) {
    }
}
