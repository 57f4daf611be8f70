package com.comiccomp.collector.dto;

import com.comiccomp.collector.collection.SearchOptions;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.Duration;

/**
 * Request payload of a collection search.
 *
 * @param query               the search text, 2 to 200 characters
 * @param maxResults          listings wanted per marketplace; omitted means the configured default
 * @param includeSoldListings whether completed sales are included; omitted means {@code true}
 * @param timeoutMs           overall deadline in milliseconds; omitted means the configured default
 */
public record CollectionSearchRequest(
        @NotBlank @Size(min = 2, max = 200) String query,
        @Min(1) @Max(1000) Integer maxResults,
        Boolean includeSoldListings,
        @Positive Long timeoutMs
) {

    public SearchOptions toOptions() {
        return new SearchOptions(maxResults,
                includeSoldListings == null || includeSoldListings,
                timeoutMs == null ? null : Duration.ofMillis(timeoutMs));
    }
}
