package com.comiccomp.collector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The third-party venues listings are collected from.
 * <p>
 * Each constant carries the lowercase identifier used as the key under
 * <code>marketplaces.*</code> and <code>validation.marketplaces.*</code> in
 * <code>application.yml</code>, in cache keys and in published events.
 * </p>
 */
public enum Marketplace {

    EBAY("ebay"),
    WHATNOT("whatnot"),
    COMICCONNECT("comicconnect"),
    HERITAGE("heritage"),
    MYCOMICSHOP("mycomicshop"),
    AMAZON("amazon");

    private final String id;

    Marketplace(final String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolves a marketplace from its identifier, ignoring case and surrounding blanks.
     *
     * @param value identifier such as {@code "ebay"} or {@code "HERITAGE"}
     * @return the matching marketplace, or empty if the value is unknown
     */
    public static Optional<Marketplace> fromId(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.id.equals(key))
                .findFirst();
    }

    @JsonCreator
    static Marketplace forJson(final String value) {
        return fromId(value).orElseThrow(
                () -> new IllegalArgumentException("Unknown marketplace " + value));
    }

    @Override
    public String toString() {
        return id;
    }
}
