package com.comiccomp.collector.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Seller block as reported by a source. Numeric fields are kept as the raw text
 * the marketplace returned; the validation engine parses and coerces them.
 */
@Value
@Builder(toBuilder = true)
public class SellerInfo {

    String name;

    /** Feedback count, e.g. {@code "1532"}. */
    String feedbackScore;

    /** Positive feedback percentage, e.g. {@code "99.8"}. */
    String feedbackPercentage;

    @Singular("attribute")
    Map<String, String> attributes;

    /**
     * @return {@code true} when no field carries a value
     */
    public boolean isEmpty() {
        return isBlank(name) && isBlank(feedbackScore) && isBlank(feedbackPercentage)
                && (attributes == null || attributes.isEmpty());
    }

    /**
     * Flattens the seller block into one searchable string, used by the
     * suspicious-pattern scan.
     *
     * @return all populated fields joined with blanks
     */
    public String asSearchableText() {
        StringBuilder sb = new StringBuilder();
        append(sb, "name", name);
        append(sb, "feedback score", feedbackScore);
        append(sb, "feedback percentage", feedbackPercentage);
        if (attributes != null) {
            attributes.forEach((k, v) -> append(sb, k, v));
        }
        return sb.toString().trim();
    }

    private static void append(final StringBuilder sb, final String key, final String value) {
        if (!isBlank(value)) {
            sb.append(key).append(": ").append(value).append(' ');
        }
    }

    private static boolean isBlank(final String s) {
        return s == null || s.isBlank();
    }
}
