package com.comiccomp.collector.validation;

import com.comiccomp.collector.config.ValidationProperties;
import com.comiccomp.collector.model.Marketplace;

import java.math.BigDecimal;
import java.util.List;

/**
 * The effective rule set for one marketplace: its overrides merged over the defaults.
 *
 * @param requiredFields    fields that must be present
 * @param minPrice          lowest accepted price
 * @param maxPrice          highest accepted price
 * @param minTitleLength    shortest accepted title
 * @param maxTitleLength    longest accepted title
 * @param allowedConditions expected condition wording, empty when unchecked
 * @param allowedSaleTypes  expected sale-type wording, empty when unchecked
 */
public record ValidationRules(List<ListingField> requiredFields,
                              BigDecimal minPrice,
                              BigDecimal maxPrice,
                              int minTitleLength,
                              int maxTitleLength,
                              List<String> allowedConditions,
                              List<String> allowedSaleTypes) {

    /**
     * Resolves the rules for a marketplace.
     *
     * @param properties  bound validation settings
     * @param marketplace the marketplace
     * @return merged rules
     */
    public static ValidationRules resolve(final ValidationProperties properties, final Marketplace marketplace) {
        ValidationProperties.Rules defaults = properties.getDefaults();
        ValidationProperties.Rules own = properties.getMarketplaces().get(marketplace.id());
        if (own == null) {
            own = new ValidationProperties.Rules();
        }
        List<String> required = pick(own.getRequiredFields(), defaults.getRequiredFields());
        return new ValidationRules(
                ListingField.fromIds(required == null ? List.of() : required),
                pick(own.getMinPrice(), defaults.getMinPrice()),
                pick(own.getMaxPrice(), defaults.getMaxPrice()),
                pick(own.getMinTitleLength(), defaults.getMinTitleLength()),
                pick(own.getMaxTitleLength(), defaults.getMaxTitleLength()),
                orEmpty(pick(own.getAllowedConditions(), defaults.getAllowedConditions())),
                orEmpty(pick(own.getAllowedSaleTypes(), defaults.getAllowedSaleTypes())));
    }

    private static <T> T pick(final T own, final T fallback) {
        return own != null ? own : fallback;
    }

    private static List<String> orEmpty(final List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
