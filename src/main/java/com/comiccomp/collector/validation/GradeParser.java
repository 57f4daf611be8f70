package com.comiccomp.collector.validation;

import com.comiccomp.collector.model.GradeInfo;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the grading company and grade from a listing's grade field or title.
 */
public final class GradeParser {

    private static final Pattern SLABBED =
            Pattern.compile("(?i)\\b(CGC|CBCS|PGX)\\s*(\\d{1,2}(?:\\.\\d)?)\\b");

    private static final Pattern RAW =
            Pattern.compile("(?i)\\b(RAW|UNGRADED|NO GRADE)\\b");

    private GradeParser() {
    }

    /**
     * Parses the grade, preferring the dedicated grade field over the title.
     *
     * @param grade raw grade field, may be {@code null}
     * @param title listing title, may be {@code null}
     * @return the grade, or empty if neither text names one
     */
    public static Optional<GradeInfo> parse(final String grade, final String title) {
        Optional<GradeInfo> fromGrade = parse(grade);
        return fromGrade.isPresent() ? fromGrade : parse(title);
    }

    static Optional<GradeInfo> parse(final String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = SLABBED.matcher(text);
        if (m.find()) {
            BigDecimal value = new BigDecimal(m.group(2));
            if (value.compareTo(BigDecimal.TEN) <= 0) {
                return Optional.of(new GradeInfo(m.group(1).toUpperCase(Locale.ROOT), value));
            }
        }
        if (RAW.matcher(text).find()) {
            return Optional.of(GradeInfo.raw());
        }
        return Optional.empty();
    }
}
