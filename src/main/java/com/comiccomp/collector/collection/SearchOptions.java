package com.comiccomp.collector.collection;

import java.time.Duration;

/**
 * Caller options of a search.
 *
 * @param maxResults          listings requested per source; {@code null} uses the configured default
 * @param includeSoldListings whether completed sales are included
 * @param timeout             overall deadline; {@code null} uses the configured default
 */
public record SearchOptions(Integer maxResults, boolean includeSoldListings, Duration timeout) {

    public static SearchOptions defaults() {
        return new SearchOptions(null, true, null);
    }
}
