package com.adlanda.authorityindexer.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkTest {

    private static final ChunkMetadata METADATA =
            ChunkMetadata.of(DocumentMetadata.of(SourceType.STATUTE, "26 U.S.C. § 195"), 0, 1);

    // U+1F600 is stored as a surrogate pair at indices 2 and 3
    private static final String WITH_EMOJI = "ab😀cd";

    @Test
    void truncate_cutInsideSurrogatePair_backsOffOneChar() {
        Chunk chunk = new Chunk(WITH_EMOJI, METADATA, "id-0");

        Chunk truncated = chunk.truncate(3);

        assertThat(truncated.text()).isEqualTo("ab");
        assertThat(truncated.text().chars()).noneMatch(c -> Character.isSurrogate((char) (int) c));
        assertThat(truncated.stringId()).isEqualTo("id-0");
    }

    @Test
    void truncate_cutAfterSurrogatePair_keepsWholeCodePoint() {
        Chunk chunk = new Chunk(WITH_EMOJI, METADATA, "id-0");

        assertThat(chunk.truncate(4).text()).isEqualTo("ab😀");
    }

    @Test
    void truncate_alreadyFits_returnsSameInstance() {
        Chunk chunk = new Chunk("Start-up expenditures", METADATA, "id-0");

        assertThat(chunk.truncate(21)).isSameAs(chunk);
        assertThat(chunk.truncate(10).text()).isEqualTo("Start-up e");
        assertThat(chunk.text()).isEqualTo("Start-up expenditures");
    }

    @Test
    void constructor_blankText_throws() {
        assertThatThrownBy(() -> new Chunk("  ", METADATA, "id-0"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
