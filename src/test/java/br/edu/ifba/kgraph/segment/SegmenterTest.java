package br.edu.ifba.kgraph.segment;

import br.edu.ifba.kgraph.IngestionFixtures;
import br.edu.ifba.kgraph.exception.EmptyInputException;
import br.edu.ifba.kgraph.exception.ErrorCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Segmenter.
 */
class SegmenterTest {

    private final Segmenter segmenter = new Segmenter(IngestionFixtures.config());

    @Test
    @DisplayName("Should split on Latin and CJK sentence-final punctuation")
    void testMixedPunctuation() {
        SegmentationResult result = segmenter.segment("One. Two? Three! 四。五．六！七？");

        assertEquals(List.of("One", "Two", "Three", "四", "五", "六", "七"), result.sentences());
        assertEquals(2, result.segmentCount());
        assertEquals(List.of(0, 1, 2, 3, 4), result.segments().get(0));
        assertEquals(List.of(5, 6), result.segments().get(1));
    }

    @Test
    @DisplayName("Text without punctuation should be a single sentence")
    void testNoPunctuation() {
        SegmentationResult result = segmenter.segment("吾輩は猫である名前はまだ無い");

        assertEquals(List.of("吾輩は猫である名前はまだ無い"), result.sentences());
        assertEquals(1, result.segmentCount());
    }

    @Test
    @DisplayName("Line breaks should be treated as spaces")
    void testLineBreaksNormalized() {
        SegmentationResult result = segmenter.segment("first line\r\nsecond line. third\nline");

        assertEquals(List.of("first line  second line", "third line"), result.sentences());
    }

    @Test
    @DisplayName("Runs of punctuation should not produce empty sentences")
    void testPunctuationRuns() {
        SegmentationResult result = segmenter.segment("Really?!... Yes。。");

        assertEquals(List.of("Really", "Yes"), result.sentences());
    }

    @Test
    @DisplayName("Should reject empty, blank and punctuation-only text")
    void testEmptyInput() {
        assertThrows(EmptyInputException.class, () -> segmenter.segment(null));
        assertThrows(EmptyInputException.class, () -> segmenter.segment(""));
        assertThrows(EmptyInputException.class, () -> segmenter.segment("  \n\t "));
        EmptyInputException e = assertThrows(EmptyInputException.class, () -> segmenter.segment("。。。"));
        assertEquals(ErrorCategory.INPUT, e.getCategory());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 4, 5, 6, 10, 12})
    @DisplayName("Segments should partition sentences contiguously in order")
    void testSegmentsPartitionSentences(int sentenceCount) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < sentenceCount; i++) {
            text.append("Sentence ").append(i).append(". ");
        }

        SegmentationResult result = segmenter.segment(text.toString());

        assertEquals(sentenceCount, result.sentenceCount());
        assertEquals((sentenceCount + 4) / 5, result.segmentCount());
        List<Integer> flattened = new ArrayList<>();
        for (List<Integer> segment : result.segments()) {
            assertFalse(segment.isEmpty());
            assertTrue(segment.size() <= 5);
            flattened.addAll(segment);
        }
        for (int i = 0; i < sentenceCount; i++) {
            assertEquals(i, flattened.get(i));
        }
        assertEquals(sentenceCount, flattened.size());
    }

    @Test
    @DisplayName("Twelve sentences with a window of five should give 5, 5 and 2")
    void testTrailingShortSegment() {
        Segmenter small = new Segmenter("[。．.!?！？]+", 5);

        SegmentationResult result = small.segment("a。b。c。d。e。f。g。h。i。j。k。l。");

        assertEquals(List.of(5, 5, 2), result.segments().stream().map(List::size).toList());
        assertEquals(List.of("k", "l"), result.sentencesOf(2));
    }

    @Test
    @DisplayName("Should reject a non-positive window")
    void testInvalidWindow() {
        assertThrows(IllegalArgumentException.class, () -> new Segmenter("[.]+", 0));
    }
}
