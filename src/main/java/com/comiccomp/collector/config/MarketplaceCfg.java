package com.comiccomp.collector.config;

import lombok.Data;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * Holds the collection settings for one marketplace.
 * <p>
 * Each instance describes where the marketplace's listing feed lives, how long a
 * single search call may take and how politely it must be called.
 * </p>
 */
@Getter
@Setter
public class MarketplaceCfg {

    /**
     * Whether the marketplace takes part in searches.
     */
    private boolean enabled = true;

    /**
     * The base URL to which {@link #searchPath} is relative.
     * <p>For example, "https://feeds.example-marketplace.com". When blank no HTTP
     * source is created and the marketplace must be backed by another
     * {@code ListingSource} bean.</p>
     */
    private String baseUrl;

    /**
     * The path (relative to {@link #baseUrl}) of the JSON listing search endpoint.
     * <p>For example, "/api/listings/search".</p>
     */
    private String searchPath;

    /**
     * Hard timeout for one search attempt against this marketplace.
     */
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * Upper bound on listings requested per search.
     */
    private int maxResults = 200;

    /**
     * Client-side rate limiting.
     */
    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class RateLimit {

        /** Allowed number of requests per second */
        private int requestsPerSecond = 1;

        /** Allowed number of requests in any trailing 60 seconds */
        private int requestsPerMinute = 30;

        /** Burst allowance reported with the limits */
        private int burst = 5;
    }
}
