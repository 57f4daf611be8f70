package com.comiccomp.collector.model;

import java.util.Locale;
import java.util.Map;

/**
 * Canonical sale formats across marketplaces.
 */
public enum SaleType {

    AUCTION,
    FIXED_PRICE,
    LIVE_AUCTION,
    UNKNOWN;

    private static final Map<String, SaleType> ALIASES = Map.ofEntries(
            Map.entry("auction", AUCTION),
            Map.entry("timed_auction", AUCTION),
            Map.entry("fixed", FIXED_PRICE),
            Map.entry("fixed_price", FIXED_PRICE),
            Map.entry("buy_it_now", FIXED_PRICE),
            Map.entry("buy_now", FIXED_PRICE),
            Map.entry("bin", FIXED_PRICE),
            Map.entry("live", LIVE_AUCTION),
            Map.entry("live_auction", LIVE_AUCTION)
    );

    /**
     * Maps a marketplace's sale-type wording onto the canonical set.
     *
     * @param raw raw value, e.g. {@code "Buy It Now"} or {@code "live_auction"}
     * @return the canonical type, {@link #UNKNOWN} if the wording is not recognised
     */
    public static SaleType parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        return ALIASES.getOrDefault(key, UNKNOWN);
    }
}
