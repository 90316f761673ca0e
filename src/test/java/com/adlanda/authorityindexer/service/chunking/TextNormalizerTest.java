package com.adlanda.authorityindexer.service.chunking;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void normalize_nullOrBlank_returnsEmpty() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("   \n\n  ")).isEmpty();
    }

    @Test
    void normalize_blankLineRuns_collapseToParagraphBreak() {
        assertThat(normalizer.normalize("First.\n\n\n\nSecond."))
                .isEqualTo("First.\n\nSecond.");
    }

    @Test
    void normalize_singleNewline_kept() {
        assertThat(normalizer.normalize("line one\nline two")).isEqualTo("line one\nline two");
    }

    @Test
    void normalize_spaceRuns_collapseAndTrim() {
        assertThat(normalizer.normalize("  Sec.   195.   Start-up   expenditures  "))
                .isEqualTo("Sec. 195. Start-up expenditures");
    }

    @Test
    void normalize_appliedTwice_sameResult() {
        String raw = "  (a) General rule.\n\n\n\n   Except as otherwise   provided\n\n(b) Election.  ";
        String once = normalizer.normalize(raw);

        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }
}
