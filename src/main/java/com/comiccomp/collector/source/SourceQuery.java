package com.comiccomp.collector.source;

import java.time.Duration;

/**
 * What the orchestrator asks one source for.
 *
 * @param query               trimmed search text
 * @param maxResults          listings wanted at most
 * @param includeSoldListings whether completed sales are wanted
 * @param timeout             time the source has for this attempt
 */
public record SourceQuery(String query, int maxResults, boolean includeSoldListings, Duration timeout) {
}
