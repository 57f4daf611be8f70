package com.comiccomp.collector.store;

import com.comiccomp.collector.collection.SearchResult;

import java.util.Optional;

/**
 * Read-through cache of aggregate search results.
 */
public interface SearchCache {

    Optional<SearchResult> get(String key);

    /**
     * @param key        cache key
     * @param value      the result
     * @param ttlSeconds seconds until the entry expires
     */
    void set(String key, SearchResult value, long ttlSeconds);
}
