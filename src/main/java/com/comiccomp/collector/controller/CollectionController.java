package com.comiccomp.collector.controller;

import com.comiccomp.collector.collection.CollectionOrchestrator;
import com.comiccomp.collector.collection.CollectionStatus;
import com.comiccomp.collector.collection.SearchResult;
import com.comiccomp.collector.dto.CollectionSearchRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller running listing collection searches across every configured marketplace.
 * <p>
 * Endpoints:<br>
 * <code>POST /api/collect/search</code> runs a search and returns the aggregate result.<br>
 * <code>GET /api/collect/status</code> returns source, breaker, retry, error and validation figures.
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/collect/search
 * Content-Type: application/json
 *
 * {
 *   "query": "amazing spider-man 300",
 *   "maxResults": 50,
 *   "includeSoldListings": true
 * }
 * }</pre>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * {
 *   "query": "amazing spider-man 300",
 *   "totalListings": 42,
 *   "listings": [ ... ],
 *   "outcomes": {
 *     "ebay":     { "status": "SUCCESS", "attempts": 1, "listingCount": 30, ... },
 *     "heritage": { "status": "FAILED", "attempts": 5, "errorCategory": "server", ... }
 *   },
 *   "invalidListings": 3,
 *   "blockedListings": 1,
 *   "elapsedMillis": 2140,
 *   "fromCache": false
 * }
 * }</pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/collect")
@RequiredArgsConstructor
public class CollectionController {

    private final CollectionOrchestrator orchestrator;

    /**
     * Runs a search.
     *
     * @param request the validated {@link CollectionSearchRequest}
     * @return the aggregate {@link SearchResult}
     */
    @PostMapping(path = "/search",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public SearchResult search(@RequestBody @Validated final CollectionSearchRequest request) {
        log.debug("Search request: {}", request);
        return orchestrator.search(request.query(), request.toOptions());
    }

    @GetMapping(path = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public CollectionStatus status() {
        return orchestrator.status();
    }
}
