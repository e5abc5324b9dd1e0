package com.docsum.core.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.docsum.core.model.TextChunk;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("RecursiveTextChunker Tests")
class RecursiveTextChunkerTest {

    private final RecursiveTextChunker chunker = new RecursiveTextChunker();

    /** Twelve paragraphs of eight unique sentences, roughly 8,500 characters. */
    private static String longDocument() {
        StringBuilder text = new StringBuilder();
        for (int p = 0; p < 12; p++) {
            for (int s = 0; s < 8; s++) {
                text.append("Paragraph ")
                        .append(p)
                        .append(" sentence ")
                        .append(s)
                        .append(" explains detail number ")
                        .append(p * 10 + s)
                        .append(", with some extra words to pad it out. ");
            }
            text.append("\n\n");
        }
        return text.toString();
    }

    /**
      * Chunks appear in document order, the first starts at the beginning and the last ends at
      * the end, consecutive chunks share at most {@code overlap} characters, and anything between
      * two chunks is whitespace.
      */
    private static void assertCoversInOrder(String text, List<TextChunk> chunks, int overlap) {
        String trimmed = text.strip();
        int previousStart = -1;
        int previousEnd = 0;
        for (TextChunk chunk : chunks) {
            int start = trimmed.indexOf(chunk.getContent(), previousStart + 1);
            assertThat(start).as("position of chunk %d", chunk.getIndex()).isGreaterThanOrEqualTo(0);
            if (chunk.getIndex() == 0) {
                assertThat(start).isZero();
            } else if (start >= previousEnd) {
                assertThat(trimmed.substring(previousEnd, start)).isBlank();
            } else {
                assertThat(previousEnd - start)
                        .as("overlap between chunks %d and %d", chunk.getIndex() - 1, chunk.getIndex())
                        .isLessThanOrEqualTo(overlap);
            }
            previousStart = start;
            previousEnd = start + chunk.getLength();
        }
        assertThat(previousEnd).isEqualTo(trimmed.length());
    }

    /** Longest suffix of {@code previous} that is also a prefix of {@code next}. */
    private static int sharedBoundaryLength(String previous, String next) {
        for (int length = Math.min(previous.length(), next.length()); length > 0; length--) {
            if (previous.endsWith(next.substring(0, length))) {
                return length;
            }
        }
        return 0;
    }

    @Nested
    @DisplayName("short documents")
    class ShortDocuments {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\n\n\t "})
        @DisplayName("should return no chunks for null or blank text")
        void shouldReturnEmpty_whenBlank(String text) {
            assertThat(chunker.split(text, 100, 10)).isEmpty();
        }

        @Test
        @DisplayName("should return a single trimmed chunk when text fits")
        void shouldReturnSingleChunk_whenTextFits() {
            List<TextChunk> chunks = chunker.split("  \n A short note about nothing much.\n\n ", 100, 10);

            assertThat(chunks).containsExactly(TextChunk.of(0, "A short note about nothing much."));
        }

        @Test
        @DisplayName("should keep text of exactly chunkSize characters in one chunk")
        void shouldReturnSingleChunk_whenTextIsExactlyChunkSize() {
            String text = "x".repeat(100);

            assertThat(chunker.split(text, 100, 10)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("long documents")
    class LongDocuments {

        @ParameterizedTest
        @CsvSource({"500, 50", "300, 0", "1000, 200", "120, 30", "4000, 200"})
        @DisplayName("should produce bounded, ordered chunks covering the whole text")
        void shouldProduceBoundedOrderedChunks(int chunkSize, int overlap) {
            String text = longDocument();

            List<TextChunk> chunks = chunker.split(text, chunkSize, overlap);

            assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
            for (int i = 0; i < chunks.size(); i++) {
                TextChunk chunk = chunks.get(i);
                assertThat(chunk.getIndex()).isEqualTo(i);
                assertThat(chunk.getLength()).isEqualTo(chunk.getContent().length());
                assertThat(chunk.getLength()).isBetween(1, chunkSize);
                assertThat(chunk.getContent()).isEqualTo(chunk.getContent().strip());
            }
            assertCoversInOrder(text, chunks, overlap);
        }

        @Test
        @DisplayName("should carry a non-empty tail of the previous chunk into the next one")
        void shouldOverlapConsecutiveChunks_whenSentencesAreShorterThanOverlap() {
            String text =
                    IntStream.range(0, 30)
                            .mapToObj(i -> String.format("Sentence number %02d is about topic %02d.", i, i))
                            .collect(Collectors.joining(" "));

            List<TextChunk> chunks = chunker.split(text, 200, 60);

            assertThat(chunks).hasSizeGreaterThanOrEqualTo(3);
            for (int i = 1; i < chunks.size(); i++) {
                String previous = chunks.get(i - 1).getContent();
                String next = chunks.get(i).getContent();
                assertThat(sharedBoundaryLength(previous, next))
                        .as("overlap between chunks %d and %d", i - 1, i)
                        .isBetween(1, 60);
            }
            assertCoversInOrder(text, chunks, 60);
        }

        @Test
        @DisplayName("should be deterministic")
        void shouldBeDeterministic() {
            String text = longDocument();

            assertThat(chunker.split(text, 500, 50)).isEqualTo(chunker.split(text, 500, 50));
        }

        @Test
        @DisplayName("should prefer paragraph boundaries")
        void shouldSplitOnParagraphs_whenParagraphsFit() {
            String first = "First paragraph. " + "alpha ".repeat(10);
            String second = "Second paragraph. " + "beta ".repeat(10);

            List<TextChunk> chunks = chunker.split(first + "\n\n" + second, 90, 20);

            assertThat(chunks)
                    .extracting(TextChunk::getContent)
                    .containsExactly(first.strip(), second.strip());
        }

        @Test
        @DisplayName("should hard-split a run of text with no separators")
        void shouldHardSplit_whenNoSeparators() {
            String digits = IntStream.range(0, 200).mapToObj(Integer::toString).collect(Collectors.joining());

            List<TextChunk> chunks = chunker.split(digits, 100, 10);

            assertThat(chunks).hasSizeGreaterThan(4);
            assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.getLength()).isLessThanOrEqualTo(100));
            assertCoversInOrder(digits, chunks, 10);
        }
    }

    @Test
    @DisplayName("should keep the separator at the start of the following piece")
    void shouldKeepSeparatorWithFollowingPiece() {
        assertThat(RecursiveTextChunker.splitKeepingSeparator("a. b. c", ". "))
                .containsExactly("a", ". b", ". c");
        assertThat(RecursiveTextChunker.splitKeepingSeparator("abc", "")).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("should reject a non-positive chunk size or an overlap outside [0, chunkSize)")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> chunker.split("text", 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.split("text", 100, 100))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.split("text", 100, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
