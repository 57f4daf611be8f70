package com.comiccomp.collector.model;

import java.math.BigDecimal;

/**
 * Grading service and numeric grade extracted from a listing, e.g. {@code CGC 9.8}.
 *
 * @param company grading company ({@code CGC}, {@code CBCS}, {@code PGX}) or {@code RAW}
 * @param grade   numeric grade on the 0.5–10 scale; {@code null} for raw copies
 */
public record GradeInfo(String company, BigDecimal grade) {

    public static final String RAW = "RAW";

    public static GradeInfo raw() {
        return new GradeInfo(RAW, null);
    }

    public boolean isSlabbed() {
        return !RAW.equals(company);
    }
}
