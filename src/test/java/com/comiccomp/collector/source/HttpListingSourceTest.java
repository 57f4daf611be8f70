package com.comiccomp.collector.source;

import com.comiccomp.collector.config.MarketplaceCfg;
import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.RawListing;
import com.comiccomp.collector.resilience.ErrorCategory;
import com.comiccomp.collector.resilience.ErrorClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpListingSourceTest {

    private static final String FEED = """
            {"listings": [
              {"id": "it-1", "title": "Saga #1 (2012) first print", "price": "$120.00",
               "source_url": "https://feeds.test/it-1", "condition": "NM", "sale_type": "buy_it_now",
               "view_count": 58, "seller": {"username": "keycomics", "feedback_score": 1532,
               "feedback_percentage": "99.8", "location": "Ohio"},
               "photos": ["https://img.test/1.jpg", ""]},
              {"externalId": "it-2", "title": "Saga #2", "price": 35, "sourceUrl": "https://feeds.test/it-2"}
            ]}
            """;

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void readsBothFieldSpellings() {
        List<RawListing> listings = source(HttpStatus.OK, FEED).parse(FEED);

        assertThat(listings).hasSize(2);
        RawListing first = listings.get(0);
        assertThat(first.getMarketplace()).isEqualTo(Marketplace.MYCOMICSHOP);
        assertThat(first.getExternalId()).isEqualTo("it-1");
        assertThat(first.getSourceUrl()).isEqualTo("https://feeds.test/it-1");
        assertThat(first.getSaleType()).isEqualTo("buy_it_now");
        assertThat(first.getViewCount()).isEqualTo("58");
        assertThat(first.getSellerInfo().getName()).isEqualTo("keycomics");
        assertThat(first.getSellerInfo().getFeedbackScore()).isEqualTo("1532");
        assertThat(first.getSellerInfo().getAttributes()).containsEntry("location", "Ohio");
        assertThat(first.getListingPhotos()).containsExactly("https://img.test/1.jpg");

        RawListing second = listings.get(1);
        assertThat(second.getExternalId()).isEqualTo("it-2");
        assertThat(second.getPrice()).isEqualTo("35");
        assertThat(second.getSellerInfo()).isNull();
        assertThat(second.getListingPhotos()).isEmpty();
    }

    @Test
    void acceptsABareArrayAndAnEmptyBody() {
        HttpListingSource source = source(HttpStatus.OK, "");

        assertThat(source.parse("[{\"id\": \"a\"}]")).extracting(RawListing::getExternalId).containsExactly("a");
        assertThat(source.parse("  ")).isEmpty();
    }

    @Test
    void rejectsBodiesThatAreNotFeeds() {
        HttpListingSource source = source(HttpStatus.OK, "");
        ErrorClassifier classifier = new ErrorClassifier();

        assertThatThrownBy(() -> source.parse("{\"items\": []}"))
                .isInstanceOf(ListingSourceException.class)
                .hasMessage("Malformed response from mycomicshop: no listings array")
                .satisfies(ex -> assertThat(classifier.classify(ex).category()).isEqualTo(ErrorCategory.PARSING));
        assertThatThrownBy(() -> source.parse("<html>oops</html>"))
                .isInstanceOf(ListingSourceException.class)
                .hasMessageStartingWith("Invalid JSON from mycomicshop")
                .satisfies(ex -> assertThat(classifier.classify(ex).category()).isEqualTo(ErrorCategory.PARSING));
    }

    @Test
    void searchSendsTheQueryAndParsesTheAnswer() {
        List<RawListing> listings = source(HttpStatus.OK, FEED)
                .search(new SourceQuery("saga 1", 50, true, Duration.ofSeconds(5)));

        assertThat(listings).hasSize(2);
        assertThat(lastRequest.get().url().toString())
                .isEqualTo("http://feeds.test/listings/search?q=saga%201&limit=50&sold=true");
        assertThat(lastRequest.get().headers().getFirst(HttpHeaders.USER_AGENT)).contains("ComicListingCollector");
    }

    @Test
    void errorStatusCarriesTheCode() {
        HttpListingSource source = source(HttpStatus.TOO_MANY_REQUESTS, "slow down");

        assertThatThrownBy(() -> source.search(new SourceQuery("saga 1", 50, false, Duration.ofSeconds(5))))
                .isInstanceOfSatisfying(ListingSourceException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(429);
                    assertThat(ex.getMarketplace()).isEqualTo(Marketplace.MYCOMICSHOP);
                    assertThat(ex.getMessage()).isEqualTo("HTTP 429 from mycomicshop: slow down");
                });
    }

    private HttpListingSource source(final HttpStatus status, final String body) {
        MarketplaceCfg cfg = new MarketplaceCfg();
        cfg.setBaseUrl("http://feeds.test");
        cfg.setSearchPath("/listings/search");
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new HttpListingSource(Marketplace.MYCOMICSHOP, cfg, builder, new ObjectMapper());
    }
}
