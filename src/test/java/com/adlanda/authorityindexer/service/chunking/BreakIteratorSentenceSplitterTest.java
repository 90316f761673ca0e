package com.adlanda.authorityindexer.service.chunking;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class BreakIteratorSentenceSplitterTest {

    private final BreakIteratorSentenceSplitter splitter = new BreakIteratorSentenceSplitter(Locale.US);

    @Test
    void split_simpleSentences_returnsEachTrimmed() {
        assertThat(splitter.split("The deduction is allowed. The election is irrevocable."))
                .containsExactly("The deduction is allowed.", "The election is irrevocable.");
    }

    @Test
    void split_questionAndExclamation() {
        assertThat(splitter.split("Who may elect? Any taxpayer!"))
                .containsExactly("Who may elect?", "Any taxpayer!");
    }

    @Test
    void split_blank_returnsEmpty() {
        assertThat(splitter.split("")).isEmpty();
        assertThat(splitter.split(null)).isEmpty();
    }

    @Test
    void split_anyText_keepsAllNonWhitespace() {
        String text = "See Treas. Reg. § 1.195-1(b). Amounts are amortized over 180 months. Done";

        List<String> sentences = splitter.split(text);

        assertThat(String.join("", sentences).replaceAll("\\s", ""))
                .isEqualTo(text.replaceAll("\\s", ""));
    }
}
