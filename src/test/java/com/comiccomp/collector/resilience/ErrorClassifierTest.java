package com.comiccomp.collector.resilience;

import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.source.ListingSourceException;
import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void httpStatusDrivesTheCategory() {
        assertThat(classifier.classify(new ListingSourceException(Marketplace.EBAY, 429, "HTTP 429 from ebay: slow down")))
                .isEqualTo(new ErrorClassification(ErrorCategory.RATE_LIMIT, ErrorSeverity.MEDIUM, true));
        assertThat(classifier.classify(new ListingSourceException(Marketplace.EBAY, 401, "HTTP 401 from ebay: ")))
                .isEqualTo(new ErrorClassification(ErrorCategory.AUTHENTICATION, ErrorSeverity.CRITICAL, false));
        assertThat(classifier.classify(new ListingSourceException(Marketplace.EBAY, 503, "HTTP 503 from ebay: ")))
                .isEqualTo(new ErrorClassification(ErrorCategory.SERVER, ErrorSeverity.HIGH, true));
        assertThat(classifier.classify(new ListingSourceException(Marketplace.EBAY, 400, "HTTP 400 from ebay: ")))
                .isEqualTo(new ErrorClassification(ErrorCategory.VALIDATION, ErrorSeverity.LOW, false));
    }

    @Test
    void statusCodeAloneIsEnough() {
        ListingSourceException ex = new ListingSourceException(Marketplace.HERITAGE, 502, null, "upstream said no", null);

        assertThat(classifier.classify(ex).category()).isEqualTo(ErrorCategory.SERVER);
    }

    @Test
    void statusOutranksWordsQuotedFromTheResponseBody() {
        ListingSourceException expired = new ListingSourceException(Marketplace.EBAY, 401,
                "HTTP 401 from ebay: {\"error\":\"session timed out, sign in again\"}");
        ListingSourceException blocked = new ListingSourceException(Marketplace.AMAZON, 403,
                "HTTP 403 from amazon: connection closed by policy");
        ListingSourceException busy = new ListingSourceException(Marketplace.WHATNOT, 503,
                "HTTP 503 from whatnot: invalid json in upstream reply");

        assertThat(classifier.classify(expired))
                .isEqualTo(new ErrorClassification(ErrorCategory.AUTHENTICATION, ErrorSeverity.CRITICAL, false));
        assertThat(classifier.classify(new CompletionException(blocked)).category())
                .isEqualTo(ErrorCategory.AUTHENTICATION);
        assertThat(classifier.classify(busy).category()).isEqualTo(ErrorCategory.SERVER);
    }

    @Test
    void unrecognisedStatusFallsBackToTheMessage() {
        ListingSourceException notFound = new ListingSourceException(Marketplace.MYCOMICSHOP, 404,
                "HTTP 404 from mycomicshop: gateway timed out");

        assertThat(classifier.classify(notFound).category()).isEqualTo(ErrorCategory.NETWORK);
    }

    @Test
    void timeoutsAndConnectFailuresAreNetworkEvenWhenWrapped() {
        assertThat(classifier.classify(new CompletionException(new TimeoutException())).category())
                .isEqualTo(ErrorCategory.NETWORK);
        ListingSourceException wrapped = new ListingSourceException(Marketplace.WHATNOT, null, null,
                "Search on whatnot failed", new ConnectException("nope"));
        assertThat(classifier.classify(wrapped))
                .isEqualTo(new ErrorClassification(ErrorCategory.NETWORK, ErrorSeverity.MEDIUM, true));
    }

    @Test
    void jsonFailuresAreParsing() {
        assertThat(classifier.classify(new JsonParseException(null, "boom")).category())
                .isEqualTo(ErrorCategory.PARSING);
        assertThat(classifier.classify(new IllegalStateException("Unexpected token < in JSON at position 0")))
                .isEqualTo(new ErrorClassification(ErrorCategory.PARSING, ErrorSeverity.MEDIUM, false));
    }

    @Test
    void firstMatchingGroupWins() {
        ErrorClassification c = classifier.classify("rate limit check timed out", null);

        assertThat(c.category()).isEqualTo(ErrorCategory.NETWORK);
    }

    @Test
    void codeIsMatchedLikeTheMessage() {
        assertThat(classifier.classify("socket hang up", "ECONNRESET").category()).isEqualTo(ErrorCategory.NETWORK);
    }

    @Test
    void numbersInsideOtherNumbersAreNotStatusCodes() {
        assertThat(classifier.classify("order 15012 not found", null)).isEqualTo(ErrorClassification.UNKNOWN);
    }

    @Test
    void unknownFailuresAreNotRetried() {
        ErrorClassification c = classifier.classify(new IllegalArgumentException("something odd"));

        assertThat(c.category()).isEqualTo(ErrorCategory.UNKNOWN);
        assertThat(c.retryable()).isFalse();
        assertThat(classifier.classify((Throwable) null)).isEqualTo(ErrorClassification.UNKNOWN);
    }
}
