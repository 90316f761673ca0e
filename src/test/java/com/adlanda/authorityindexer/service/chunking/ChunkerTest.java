package com.adlanda.authorityindexer.service.chunking;

import com.adlanda.authorityindexer.config.ChunkingProperties;
import com.adlanda.authorityindexer.model.AuthorityDocument;
import com.adlanda.authorityindexer.model.Chunk;
import com.adlanda.authorityindexer.model.DocumentMetadata;
import com.adlanda.authorityindexer.model.SourceType;
import com.adlanda.authorityindexer.service.ChunkIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkerTest {

    private static final DocumentMetadata STATUTE = DocumentMetadata.of(SourceType.STATUTE, "26 U.S.C. § 195");

    private static final String P1 = "Alpha beta gamma.";
    private static final String P2 = "Delta epsilon zeta.";
    private static final String P3 = "Eta theta iota kappa.";

    private ChunkingProperties properties;
    private Chunker chunker;

    @BeforeEach
    void setUp() {
        properties = new ChunkingProperties();
        chunker = new Chunker(new TextNormalizer(), new RegexSentenceSplitter(), new ChunkIdGenerator(), properties);
    }

    @Test
    void chunk_shortDocument_returnsSingleChunk() {
        List<Chunk> chunks = chunker.chunk("  Start-up expenditures   may be deducted.  ", STATUTE);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).text()).isEqualTo("Start-up expenditures may be deducted.");
        assertThat(chunks.get(0).stringId()).isEqualTo("usc-26-U-S-C--§-195-chunk-0");
        assertThat(chunks.get(0).metadata().chunkIndex()).isZero();
        assertThat(chunks.get(0).metadata().totalChunks()).isEqualTo(1);
    }

    @Test
    void chunk_emptyOrBlankText_returnsEmptyList() {
        assertThat(chunker.chunk("", STATUTE)).isEmpty();
        assertThat(chunker.chunk(" \n\n \n ", STATUTE)).isEmpty();
        assertThat(chunker.chunk(null, STATUTE)).isEmpty();
    }

    @Test
    void chunk_invalidSizes_throws() {
        assertThatThrownBy(() -> chunker.chunk("text", STATUTE, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.chunk("text", STATUTE, 100, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void chunk_paragraphs_packedGreedily() {
        String text = P1 + "\n\n" + P2 + "\n\n" + P3;

        List<Chunk> chunks = chunker.chunk(text, STATUTE, 50, 0);

        assertThat(chunks).extracting(Chunk::text)
                .containsExactly(P1 + "\n\n" + P2, P3);
    }

    @Test
    void chunk_withOverlap_nextChunkStartsWithWholeWordTail() {
        String text = P1 + "\n\n" + P2 + "\n\n" + P3;

        List<Chunk> chunks = chunker.chunk(text, STATUTE, 50, 10);

        assertThat(chunks).extracting(Chunk::text)
                .containsExactly(P1 + "\n\n" + P2, "zeta. " + P3);
    }

    @Test
    void chunk_overlapWindowWithoutWhitespace_dropsOverlap() {
        String text = P1 + "\n\n" + P2 + "\n\n" + P3;

        List<Chunk> chunks = chunker.chunk(text, STATUTE, 50, 4);

        assertThat(chunks.get(1).text()).isEqualTo(P3);
    }

    @Test
    void chunk_largeParagraph_packedBySentence() {
        String paragraph = "First sentence here. Second sentence here. Third sentence here.";

        List<Chunk> chunks = chunker.chunk(paragraph, STATUTE, 40, 0);

        assertThat(chunks).extracting(Chunk::text)
                .containsExactly("First sentence here.", "Second sentence here.", "Third sentence here.");
    }

    @Test
    void chunk_sentencesAfterShortParagraph_firstJoinedAsParagraph() {
        String text = "Intro.\n\nFirst sentence here. Second sentence here. Third sentence here.";

        List<Chunk> chunks = chunker.chunk(text, STATUTE, 40, 0);

        assertThat(chunks.get(0).text()).isEqualTo("Intro.\n\nFirst sentence here.");
        assertThat(chunks).hasSize(3);
    }

    @Test
    void chunk_largeParagraphWithOverlap_seedsEachChunkWithWholeWordTail() {
        String paragraph = "Alpha one two. Beta three four. Gamma five six. Delta seven eight.";

        List<Chunk> chunks = chunker.chunk(paragraph, STATUTE, 35, 12);

        assertThat(chunks).extracting(Chunk::text).containsExactly(
                "Alpha one two. Beta three four.",
                "three four. Gamma five six.",
                "five six. Delta seven eight.");
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(35 + 12));
    }

    @Test
    void chunk_longSentencePackedParagraph_overlapIsWordAlignedAndBounded() {
        String paragraph = IntStream.range(0, 80)
                .mapToObj(i -> "Sentence " + i + " covers deduction item " + i + ".")
                .collect(Collectors.joining(" "));
        Chunker linguistic = new Chunker(new TextNormalizer(),
                new BreakIteratorSentenceSplitter(Locale.US), new ChunkIdGenerator(), properties);

        for (Chunker candidate : List.of(chunker, linguistic)) {
            List<Chunk> chunks = candidate.chunk(paragraph, STATUTE, 120, 40);

            assertThat(chunks).hasSizeGreaterThan(5);
            for (int i = 0; i < chunks.size(); i++) {
                assertThat(chunks.get(i).length()).isLessThanOrEqualTo(120 + 40);
                if (i > 0) {
                    assertThat(overlapLength(chunks.get(i - 1).text(), chunks.get(i).text()))
                            .isBetween(1, 39);
                }
            }
        }
    }

    @Test
    void chunk_flushedChunkShorterThanOverlap_repeatedWhole() {
        List<Chunk> chunks = chunker.chunk("aa bb\n\ncc dd", STATUTE, 8, 6);

        assertThat(chunks).extracting(Chunk::text).containsExactly("aa bb", "aa bb cc dd");
    }

    @Test
    void chunk_flushedChunkExactlyOverlapSize_dropsLeadingWord() {
        List<Chunk> chunks = chunker.chunk("aa bb\n\ncc dd", STATUTE, 8, 5);

        assertThat(chunks).extracting(Chunk::text).containsExactly("aa bb", "bb cc dd");
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(8 + 5));
    }

    @Test
    void chunk_oversizedSentence_keptWhole() {
        String sentence = IntStream.range(0, 20).mapToObj(i -> "word" + i).collect(Collectors.joining(" "));

        List<Chunk> chunks = chunker.chunk(sentence, STATUTE, 40, 10);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).text()).isEqualTo(sentence);
    }

    @Test
    void chunk_longDocument_respectsSizeBoundAndIndices() {
        String text = IntStream.range(0, 60)
                .mapToObj(i -> "Paragraph " + i + " explains rule " + i + ". It applies to taxable year " + (2000 + i) + ".")
                .collect(Collectors.joining("\n\n"));

        List<Chunk> chunks = chunker.chunk(text, STATUTE, 300, 60);

        assertThat(chunks).hasSizeGreaterThan(1);
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            assertThat(chunk.length()).isLessThanOrEqualTo(300 + 60);
            assertThat(chunk.metadata().chunkIndex()).isEqualTo(i);
            assertThat(chunk.metadata().totalChunks()).isEqualTo(chunks.size());
            assertThat(chunk.stringId()).isEqualTo("usc-26-U-S-C--§-195-chunk-" + i);
        }
        String joined = chunks.stream().map(Chunk::text).collect(Collectors.joining(" "));
        assertThat(joined).contains("Paragraph 0 explains").contains("taxable year 2059.");
    }

    @Test
    void chunk_usesConfiguredSizes() {
        properties.setMaxChunkSize(50);
        properties.setOverlapSize(0);

        List<Chunk> chunks = chunker.chunk(P1 + "\n\n" + P2 + "\n\n" + P3, STATUTE);

        assertThat(chunks).hasSize(2);
    }

    @Test
    void chunk_copiesDocumentMetadata() {
        DocumentMetadata metadata = new DocumentMetadata(SourceType.REGULATION, "26 CFR § 1.195-1",
                "Start-up expenditures", "1.195-1", "https://www.ecfr.gov/", "2024-01-01",
                Map.of("part", "1"));

        Chunk chunk = chunker.chunk("Short regulation text.", metadata).get(0);

        assertThat(chunk.metadata().sourceType()).isEqualTo(SourceType.REGULATION);
        assertThat(chunk.metadata().title()).isEqualTo("Start-up expenditures");
        assertThat(chunk.metadata().url()).isEqualTo("https://www.ecfr.gov/");
        assertThat(chunk.metadata().extraFields()).containsEntry("part", "1");
        assertThat(chunk.stringId()).isEqualTo("cfr-26-CFR-§-1-195-1-chunk-0");
    }

    @Test
    void chunkAll_multipleDocuments_keepsDocumentOrder() {
        List<AuthorityDocument> documents = List.of(
                new AuthorityDocument("Statute text.", STATUTE),
                new AuthorityDocument("", DocumentMetadata.of(SourceType.BULLETIN, "Rev. Rul. 2025-01")),
                new AuthorityDocument("Regulation text.", DocumentMetadata.of(SourceType.REGULATION, "26 CFR § 1.195-1"))
        );

        List<Chunk> chunks = chunker.chunkAll(documents);

        assertThat(chunks).extracting(Chunk::stringId)
                .containsExactly("usc-26-U-S-C--§-195-chunk-0", "cfr-26-CFR-§-1-195-1-chunk-0");
    }

    @Test
    void chunk_linguisticSplitter_packsSentences() {
        Chunker linguistic = new Chunker(new TextNormalizer(),
                new BreakIteratorSentenceSplitter(Locale.US), new ChunkIdGenerator(), properties);

        List<Chunk> chunks = linguistic.chunk(
                "First sentence here. Second sentence here. Third sentence here.", STATUTE, 45, 0);

        assertThat(chunks).extracting(Chunk::text)
                .containsExactly("First sentence here. Second sentence here.", "Third sentence here.");
    }

    /**
     * Length of the longest tail of {@code previous} that starts {@code next} and begins
     * right after a whitespace in {@code previous}, or 0 when there is none.
     */
    private static int overlapLength(String previous, String next) {
        for (int length = Math.min(previous.length() - 1, next.length()); length > 0; length--) {
            int start = previous.length() - length;
            if (Character.isWhitespace(previous.charAt(start - 1))
                    && next.startsWith(previous.substring(start) + " ")) {
                return length;
            }
        }
        return 0;
    }
}
