package com.comiccomp.collector.source;

import com.comiccomp.collector.config.MarketplaceCfg;
import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.RawListing;
import com.comiccomp.collector.model.SellerInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * <h2>HttpListingSource</h2>
 *
 * <p>Generic source for marketplaces that expose a JSON listing feed. One
 * instance is created per marketplace with a configured {@code base-url} and
 * {@code search-path}; it issues</p>
 *
 * <pre>{@code GET {base-url}{search-path}?q=..&limit=..&sold=..}</pre>
 *
 * <p>and accepts either a bare JSON array of listings or an object with a
 * {@code listings} array. Both camelCase and snake_case field names are read.
 * Non-2xx answers surface as {@link ListingSourceException} carrying the status,
 * so the error classifier sees 429, 401 and 5xx for what they are.</p>
 */
@Slf4j
@Getter
public class HttpListingSource implements ListingSource {

    private static final int MAX_ERROR_BODY = 200;

    private final Marketplace marketplace;

    private final MarketplaceCfg cfg;

    private final WebClient webClient;

    private final ObjectMapper mapper;

    public HttpListingSource(final Marketplace marketplace,
                             final MarketplaceCfg cfg,
                             final WebClient.Builder builder,
                             final ObjectMapper mapper) {
        this.marketplace = marketplace;
        this.cfg = cfg;
        this.mapper = mapper;
        this.webClient = builder.clone()
                .baseUrl(cfg.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, "Mozilla/5.0 (compatible; ComicListingCollector/1.0)")
                .build();
    }

    @Override
    public Marketplace marketplace() {
        return marketplace;
    }

    @Override
    public List<RawListing> search(final SourceQuery query) {
        URI uri = UriComponentsBuilder.fromHttpUrl(cfg.getBaseUrl())
                .path(cfg.getSearchPath())
                .queryParam("q", query.query())
                .queryParam("limit", query.maxResults())
                .queryParam("sold", query.includeSoldListings())
                .encode()
                .build()
                .toUri();
        String body;
        try {
            body = webClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, rsp -> rsp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(text -> new ListingSourceException(marketplace, rsp.statusCode().value(),
                                    "HTTP " + rsp.statusCode().value() + " from " + marketplace + ": "
                                            + StringUtils.abbreviate(text, MAX_ERROR_BODY))))
                    .bodyToMono(String.class)
                    .timeout(query.timeout())
                    .block();
        } catch (ListingSourceException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("GET {} failed: {}", uri, ex.toString());
            throw new ListingSourceException(marketplace, null, null,
                    "Search on " + marketplace + " failed: " + ex.getMessage(), ex);
        }
        List<RawListing> listings = parse(body);
        log.debug("{} returned {} listing(s) for '{}'", marketplace, listings.size(), query.query());
        return listings;
    }

    /**
     * Maps a feed body onto raw listings.
     *
     * @param body JSON text
     * @return the listings
     * @throws ListingSourceException if the body is not a listing feed
     */
    List<RawListing> parse(final String body) {
        if (StringUtils.isBlank(body)) {
            return List.of();
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new ListingSourceException(marketplace, null, null,
                    "Invalid JSON from " + marketplace + ": " + ex.getOriginalMessage(), ex);
        }
        JsonNode items = root.isArray() ? root : root.path("listings");
        if (!items.isArray()) {
            throw new ListingSourceException(marketplace, "Malformed response from " + marketplace
                    + ": no listings array");
        }
        List<RawListing> out = new ArrayList<>(items.size());
        for (JsonNode node : items) {
            out.add(toListing(node));
        }
        return out;
    }

    private RawListing toListing(final JsonNode node) {
        RawListing.RawListingBuilder b = RawListing.builder()
                .marketplace(marketplace)
                .externalId(text(node, "id", "externalId", "external_id"))
                .title(text(node, "title"))
                .price(text(node, "price"))
                .sourceUrl(text(node, "sourceUrl", "source_url", "url"))
                .condition(text(node, "condition"))
                .grade(text(node, "grade"))
                .saleType(text(node, "saleType", "sale_type"))
                .description(text(node, "description"))
                .shippingCost(text(node, "shippingCost", "shipping_cost"))
                .saleDate(text(node, "saleDate", "sale_date"))
                .endDate(text(node, "endDate", "end_date"))
                .viewCount(text(node, "viewCount", "view_count"))
                .watcherCount(text(node, "watcherCount", "watcher_count"))
                .bidCount(text(node, "bidCount", "bid_count"))
                .lotNumber(text(node, "lotNumber", "lot_number"));

        JsonNode seller = first(node, "seller", "sellerInfo", "seller_info");
        if (seller != null && seller.isObject()) {
            SellerInfo.SellerInfoBuilder sb = SellerInfo.builder()
                    .name(text(seller, "name", "username"))
                    .feedbackScore(text(seller, "feedbackScore", "feedback_score"))
                    .feedbackPercentage(text(seller, "feedbackPercentage", "feedback_percentage"));
            Iterator<Map.Entry<String, JsonNode>> fields = seller.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                if (f.getValue().isValueNode() && !f.getValue().isNull()) {
                    sb.attribute(f.getKey(), f.getValue().asText());
                }
            }
            b.sellerInfo(sb.build());
        }

        JsonNode photos = first(node, "photos", "listingPhotos", "listing_photos");
        if (photos != null && photos.isArray()) {
            photos.forEach(p -> {
                if (p.isTextual() && StringUtils.isNotBlank(p.asText())) {
                    b.listingPhoto(p.asText());
                }
            });
        }
        return b.build();
    }

    private static JsonNode first(final JsonNode node, final String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String text(final JsonNode node, final String... names) {
        JsonNode value = first(node, names);
        return value == null || !value.isValueNode() ? null : value.asText();
    }
}
