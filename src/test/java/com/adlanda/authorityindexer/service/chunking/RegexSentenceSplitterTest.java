package com.adlanda.authorityindexer.service.chunking;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RegexSentenceSplitterTest {

    private final RegexSentenceSplitter splitter = new RegexSentenceSplitter();

    @Test
    void split_terminatedSentences_splitsAfterPunctuation() {
        assertThat(splitter.split("Is it allowed? Yes! It is allowed."))
                .containsExactly("Is it allowed?", "Yes!", "It is allowed.");
    }

    @Test
    void split_textAfterLastTerminator_kept() {
        assertThat(splitter.split("First sentence. trailing words without period"))
                .containsExactly("First sentence.", "trailing words without period");
    }

    @Test
    void split_blank_returnsEmpty() {
        assertThat(splitter.split("  ")).isEmpty();
        assertThat(splitter.split(null)).isEmpty();
    }

    @Test
    void split_joinedWithSpaces_losesNoCharacters() {
        String text = "The taxpayer may elect. See 26 U.S.C. § 195(b). The election is irrevocable.";

        List<String> sentences = splitter.split(text);

        assertThat(String.join(" ", sentences)).isEqualTo(text);
    }
}
