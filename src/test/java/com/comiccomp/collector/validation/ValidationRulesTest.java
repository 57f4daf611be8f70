package com.comiccomp.collector.validation;

import com.comiccomp.collector.config.ValidationProperties;
import com.comiccomp.collector.model.Marketplace;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationRulesTest {

    private final ValidationProperties properties = new ValidationProperties();

    @Test
    void marketplaceOverridesMergeOverDefaults() {
        ValidationRules ebay = ValidationRules.resolve(properties, Marketplace.EBAY);

        assertThat(ebay.requiredFields()).containsExactly(
                ListingField.ID, ListingField.TITLE, ListingField.PRICE, ListingField.CONDITION,
                ListingField.SELLER_INFO);
        assertThat(ebay.minPrice()).isEqualByComparingTo("0.99");
        assertThat(ebay.maxPrice()).isEqualByComparingTo("999999");
        assertThat(ebay.minTitleLength()).isEqualTo(5);
        assertThat(ebay.maxTitleLength()).isEqualTo(80);
        assertThat(ebay.allowedConditions()).contains("Very Good");
        assertThat(ebay.allowedSaleTypes()).isEmpty();
    }

    @Test
    void marketplaceWithoutOverridesUsesDefaults() {
        ValidationRules amazon = ValidationRules.resolve(properties, Marketplace.AMAZON);

        assertThat(amazon.requiredFields()).containsExactly(
                ListingField.ID, ListingField.TITLE, ListingField.PRICE, ListingField.MARKETPLACE,
                ListingField.SOURCE_URL, ListingField.CONDITION, ListingField.SALE_TYPE);
        assertThat(amazon.minPrice()).isEqualByComparingTo(new BigDecimal("0.01"));
        assertThat(amazon.maxTitleLength()).isEqualTo(500);
        assertThat(amazon.allowedConditions()).isEmpty();
    }

    @Test
    void fieldNamesAcceptSeveralSpellings() {
        assertThat(ListingField.fromIds(List.of("sourceUrl", "lot-number", " bid_count ")))
                .containsExactly(ListingField.SOURCE_URL, ListingField.LOT_NUMBER, ListingField.BID_COUNT);
        assertThatThrownBy(() -> ListingField.fromId("colour"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("colour");
    }
}
