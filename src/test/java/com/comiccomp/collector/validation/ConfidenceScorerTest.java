package com.comiccomp.collector.validation;

import com.comiccomp.collector.Listings;
import com.comiccomp.collector.config.ValidationProperties;
import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.NormalizedListing;
import com.comiccomp.collector.model.RawListing;
import com.comiccomp.collector.model.SellerInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {

    private final ValidationProperties properties = new ValidationProperties();

    private BaselineStatistics baselines;

    private ConfidenceScorer scorer;

    @BeforeEach
    void setUp() {
        baselines = new BaselineStatistics(1000);
        scorer = new ConfidenceScorer(properties, baselines);
    }

    @Test
    void priceIsNeutralWithoutABaseline() {
        assertThat(scorer.priceReasonableness(normalize(Listings.ebay("e-1", "$100").build()))).isEqualTo(0.5);
    }

    @Test
    void priceScoresAgainstTheInterquartileRange() {
        for (int i = 0; i < 6; i++) {
            baselines.record(Marketplace.EBAY, BaselineMetric.PRICE, 90);
            baselines.record(Marketplace.EBAY, BaselineMetric.PRICE, 110);
        }

        assertThat(scorer.priceReasonableness(normalize(Listings.ebay("e-1", "$100").build()))).isEqualTo(1.0);
        assertThat(scorer.priceReasonableness(normalize(Listings.ebay("e-2", "$45").build()))).isEqualTo(0.5);
        assertThat(scorer.priceReasonableness(normalize(Listings.ebay("e-3", "$330").build()))).isEqualTo(0.3);
    }

    @Test
    void sellerFeedbackRaisesReliability() {
        RawListing anonymous = Listings.whatnot("w-1", "$20").build();
        RawListing trusted = Listings.ebay("e-1", "$20")
                .sellerInfo(SellerInfo.builder().name("keycomics").feedbackScore("500").feedbackPercentage("100").build())
                .build();

        assertThat(ConfidenceScorer.sellerReliability(anonymous, normalize(anonymous))).isEqualTo(0.3);
        assertThat(ConfidenceScorer.sellerReliability(trusted, normalize(trusted))).isCloseTo(0.85, within(1e-9));
    }

    @Test
    void qualityRewardsComicTitlesAndPhotos() {
        NormalizedListing ebay = normalize(Listings.ebay("e-1", "$20").build());
        NormalizedListing bare = normalize(Listings.whatnot("w-1", "$20").title("Lot").build());

        assertThat(ConfidenceScorer.listingQuality(ebay)).isCloseTo(0.95, within(1e-9));
        assertThat(ConfidenceScorer.listingQuality(bare)).isEqualTo(0.5);
    }

    @Test
    void completenessWeighsRequiredOverOptionalFields() {
        RawListing raw = Listings.ebay("e-1", "$20").build();

        double completeness = scorer.dataCompleteness(raw, ValidationRules.resolve(properties, Marketplace.EBAY));

        assertThat(completeness).isCloseTo(0.7 + 0.3 * 2 / 8.0, within(1e-9));
    }

    @Test
    void anomalyDiscountsTheWeightedScore() {
        RawListing raw = Listings.ebay("e-1", "$20").build();
        NormalizedListing normalized = normalize(raw);
        ValidationRules rules = ValidationRules.resolve(properties, Marketplace.EBAY);

        ConfidenceBreakdown clean = scorer.score(raw, normalized, rules, 0.0);
        ConfidenceBreakdown anomalous = scorer.score(raw, normalized, rules, 1.0);

        assertThat(clean.sourceReliability()).isEqualTo(0.8);
        assertThat(clean.score()).isCloseTo(0.67625, within(1e-9));
        assertThat(anomalous.weightedScore()).isEqualTo(clean.weightedScore());
        assertThat(anomalous.score()).isCloseTo(clean.weightedScore() * 0.5, within(1e-12));
    }

    private static NormalizedListing normalize(final RawListing raw) {
        return ListingNormalizer.normalize(raw, raw.getMarketplace());
    }
}
