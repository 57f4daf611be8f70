package com.comiccomp.collector.validation;

import com.comiccomp.collector.model.GradeInfo;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class GradeParserTest {

    @Test
    void readsSlabGrades() {
        assertThat(GradeParser.parse("CGC 9.8", null)).contains(new GradeInfo("CGC", new BigDecimal("9.8")));
        assertThat(GradeParser.parse("pgx9.6", null)).contains(new GradeInfo("PGX", new BigDecimal("9.6")));
    }

    @Test
    void fallsBackToTheTitle() {
        assertThat(GradeParser.parse(null, "Incredible Hulk #181 cbcs 9.0 white pages"))
                .contains(new GradeInfo("CBCS", new BigDecimal("9.0")));
    }

    @Test
    void gradeFieldWinsOverTitle() {
        assertThat(GradeParser.parse("CGC 8.5", "Hulk #181 CGC 9.4"))
                .contains(new GradeInfo("CGC", new BigDecimal("8.5")));
    }

    @Test
    void rawCopies() {
        GradeInfo raw = GradeParser.parse("Ungraded", null).orElseThrow();

        assertThat(raw).isEqualTo(GradeInfo.raw());
        assertThat(raw.isSlabbed()).isFalse();
    }

    @Test
    void gradesAboveTenAreIgnored() {
        assertThat(GradeParser.parse("CGC 12", "Saga #1")).isEmpty();
        assertThat(GradeParser.parse("  ", null)).isEmpty();
    }
}
