package com.comiccomp.collector.validation;

import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.NormalizedListing;
import com.comiccomp.collector.model.RawListing;
import com.comiccomp.collector.model.SaleType;
import com.comiccomp.collector.model.SellerInfo;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns the text fields of a {@link RawListing} into typed, canonical values.
 * <p>
 * Every field normalizer is idempotent: feeding its output back in yields the
 * same value.
 * </p>
 */
public final class ListingNormalizer {

    private static final Pattern DECIMAL = Pattern.compile("-?\\d+(\\.\\d+)?");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final DateTimeFormatter ISO_FLEXIBLE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final Map<String, String> CONDITIONS = Map.ofEntries(
            Map.entry("mint", "Mint"),
            Map.entry("m", "Mint"),
            Map.entry("near mint", "Near Mint"),
            Map.entry("nm", "Near Mint"),
            Map.entry("very fine", "Very Fine"),
            Map.entry("vf", "Very Fine"),
            Map.entry("fine", "Fine"),
            Map.entry("f", "Fine"),
            Map.entry("very good", "Very Good"),
            Map.entry("vg", "Very Good"),
            Map.entry("good", "Good"),
            Map.entry("g", "Good"),
            Map.entry("fair", "Fair"),
            Map.entry("fa", "Fair"),
            Map.entry("poor", "Poor"),
            Map.entry("pr", "Poor"),
            Map.entry("p", "Poor")
    );

    private ListingNormalizer() {
    }

    /**
     * Builds the normalized form of a listing that passed structural validation.
     * Scores and validation metadata are left for the caller to fill in.
     *
     * @param raw         the raw listing
     * @param marketplace marketplace it was validated against
     * @return the normalized listing
     */
    public static NormalizedListing normalize(final RawListing raw, final Marketplace marketplace) {
        SellerInfo seller = raw.getSellerInfo();
        NormalizedListing.NormalizedListingBuilder b = NormalizedListing.builder()
                .externalId(StringUtils.trim(raw.getExternalId()))
                .marketplace(marketplace)
                .title(normalizeTitle(raw.getTitle()))
                .price(parsePrice(raw.getPrice()).map(ListingNormalizer::normalizePrice).orElse(null))
                .sourceUrl(StringUtils.trimToNull(raw.getSourceUrl()))
                .condition(normalizeCondition(raw.getCondition()))
                .grade(GradeParser.parse(raw.getGrade(), raw.getTitle()).orElse(null))
                .saleType(SaleType.parse(raw.getSaleType()))
                .description(cleanDescription(raw.getDescription()))
                .shippingCost(parseAmount(raw.getShippingCost())
                        .filter(v -> v.signum() >= 0)
                        .map(ListingNormalizer::normalizePrice)
                        .orElse(null))
                .saleDate(parseDate(raw.getSaleDate()).orElse(null))
                .endDate(parseDate(raw.getEndDate()).orElse(null))
                .viewCount(parseCount(raw.getViewCount()).orElse(null))
                .watcherCount(parseCount(raw.getWatcherCount()).orElse(null))
                .bidCount(parseCount(raw.getBidCount()).orElse(null))
                .lotNumber(StringUtils.trimToNull(raw.getLotNumber()));

        if (seller != null) {
            b.sellerName(StringUtils.trimToNull(seller.getName()))
                    .sellerFeedbackScore(parseCount(seller.getFeedbackScore()).orElse(null))
                    .sellerFeedbackPercentage(parsePercentage(seller.getFeedbackPercentage()).orElse(null));
        }
        if (raw.getListingPhotos() != null) {
            raw.getListingPhotos().stream()
                    .filter(StringUtils::isNotBlank)
                    .map(String::trim)
                    .forEach(b::listingPhoto);
        }
        if (raw.getMetadata() != null) {
            b.metadata(raw.getMetadata());
        }
        return b.build();
    }

    /**
     * Parses a rendered price such as {@code "$1,250.00"}, {@code "USD 39.99"} or {@code "12"}.
     *
     * @param text price text
     * @return the amount, or empty if the text is not a number
     */
    public static Optional<BigDecimal> parsePrice(final String text) {
        return parseAmount(text);
    }

    /**
     * @param price a parsed price
     * @return the price at scale 2, rounded half up
     */
    public static BigDecimal normalizePrice(final BigDecimal price) {
        return price.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Maps condition abbreviations and spellings onto the canonical vocabulary.
     * Unrecognised wording is returned trimmed.
     *
     * @param condition raw condition
     * @return canonical condition, {@code "Unknown"} when blank
     */
    public static String normalizeCondition(final String condition) {
        if (StringUtils.isBlank(condition)) {
            return "Unknown";
        }
        String trimmed = condition.trim();
        return CONDITIONS.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }

    /**
     * @param title raw title
     * @return the title trimmed with inner whitespace runs collapsed to one blank
     */
    public static String normalizeTitle(final String title) {
        if (title == null) {
            return null;
        }
        return WHITESPACE.matcher(title.trim()).replaceAll(" ");
    }

    /**
     * @param description raw description, possibly carrying HTML
     * @return plain text, or {@code null} when nothing is left
     */
    public static String cleanDescription(final String description) {
        if (StringUtils.isBlank(description)) {
            return null;
        }
        return StringUtils.trimToNull(Jsoup.parse(description).text());
    }

    /**
     * Parses a non-negative whole count such as {@code "1,532"}.
     *
     * @param text count text
     * @return the count, or empty when blank, non-numeric or negative
     */
    public static Optional<Long> parseCount(final String text) {
        return parseAmount(text)
                .filter(v -> v.signum() >= 0)
                .map(v -> v.setScale(0, RoundingMode.DOWN).longValue());
    }

    /**
     * Parses a feedback percentage such as {@code "99.8"} or {@code "99.8%"}.
     *
     * @param text percentage text
     * @return the value, or empty when not a number in [0, 100]
     */
    public static Optional<Double> parsePercentage(final String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        return parseAmount(StringUtils.removeEnd(text.trim(), "%"))
                .map(BigDecimal::doubleValue)
                .filter(v -> v >= 0 && v <= 100);
    }

    /**
     * Parses an ISO-8601 instant, offset date-time, local date-time (taken as UTC)
     * or date (start of day UTC).
     *
     * @param text date text
     * @return the instant, or empty when blank or unparseable
     */
    public static Optional<Instant> parseDate(final String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = ISO_FLEXIBLE.parseBest(text.trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime odt) {
                return Optional.of(odt.toInstant());
            }
            if (parsed instanceof LocalDateTime ldt) {
                return Optional.of(ldt.toInstant(ZoneOffset.UTC));
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    static Optional<BigDecimal> parseAmount(final String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        String cleaned = StringUtils.removeStartIgnoreCase(text.trim(), "USD")
                .replace("$", "")
                .replace(",", "")
                .trim();
        if (!DECIMAL.matcher(cleaned).matches()) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(cleaned));
    }
}
