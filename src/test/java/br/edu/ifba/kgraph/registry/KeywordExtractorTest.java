package br.edu.ifba.kgraph.registry;

import br.edu.ifba.kgraph.IngestionFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeywordExtractor.
 */
class KeywordExtractorTest {

    private final KeywordExtractor extractor = new KeywordExtractor(List.of("the", "and", "with"), 3, 1);

    @Test
    @DisplayName("Should rank by frequency and break ties by first occurrence")
    void testFrequencyRanking() {
        List<String> terms = extractor.extract("the cat and the cat sat on the mat with a cat", 2);

        assertEquals(List.of("cat", "sat"), terms);
    }

    @Test
    @DisplayName("Should skip stopwords and short alphanumeric runs")
    void testStopwordsAndShortTerms() {
        List<String> terms = extractor.extract("The and WITH on at it dog", 10);

        assertEquals(List.of("dog"), terms);
    }

    @Test
    @DisplayName("Single ideographs are terms, Hiragana never is")
    void testHanAndHiragana() {
        List<String> terms = extractor.extract("猫が猫を見た", 10);

        assertEquals(List.of("猫", "見"), terms);
    }

    @Test
    @DisplayName("Katakana below the minimum length should be skipped")
    void testShortKatakana() {
        List<String> terms = extractor.extract("ネコとコーヒー", 10);

        assertEquals(List.of("コーヒー"), terms);
    }

    @Test
    @DisplayName("Counting should be case-insensitive")
    void testCaseFolding() {
        List<String> terms = extractor.extract("Apple banana apple APPLE banana cherry", 3);

        assertEquals(List.of("apple", "banana", "cherry"), terms);
    }

    @Test
    @DisplayName("Non-positive limit should give no terms")
    void testZeroLimit() {
        assertTrue(extractor.extract("cat cat cat", 0).isEmpty());
    }

    @Test
    @DisplayName("Configured stopwords should apply")
    void testConfiguredStopwords() {
        KeywordExtractor configured = new KeywordExtractor(IngestionFixtures.config());

        assertEquals(List.of("river"), configured.extract("There the river which flows", 1));
    }
}
