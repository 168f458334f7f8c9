package br.edu.ifba.kgraph.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConceptWeightsTest {

    private static final double EPSILON = 1e-9;

    @Test
    @DisplayName("Uniform distribution should weight all nineteen keys equally")
    void testUniform() {
        ConceptWeights uniform = ConceptWeights.uniform();

        assertEquals(19, uniform.keys().size());
        assertEquals(1.0, uniform.sum(), EPSILON);
        for (ConceptKey key : ConceptKey.values()) {
            assertEquals(1.0 / 19, uniform.get(key), EPSILON);
        }
        assertTrue(uniform.isUniform());
        assertEquals(ConceptKey.TEMPORAL, uniform.dominantKey());
    }

    @Test
    @DisplayName("Normalize should scale contributions to sum to one")
    void testNormalize() {
        Map<ConceptKey, Double> raw = new EnumMap<>(ConceptKey.class);
        raw.put(ConceptKey.ACTION, 3.0);
        raw.put(ConceptKey.EMOTION, 1.0);

        ConceptWeights weights = ConceptWeights.normalize(raw);

        assertEquals(0.75, weights.get(ConceptKey.ACTION), EPSILON);
        assertEquals(0.25, weights.get(ConceptKey.EMOTION), EPSILON);
        assertEquals(0.0, weights.get(ConceptKey.TEMPORAL), EPSILON);
        assertEquals(1.0, weights.sum(), EPSILON);
        assertEquals(ConceptKey.ACTION, weights.dominantKey());
        assertFalse(weights.isUniform());
    }

    @Test
    @DisplayName("Ties should go to the earliest declared key")
    void testDominantTie() {
        ConceptWeights weights = ConceptWeights.normalize(Map.of(ConceptKey.ACTION, 2.0, ConceptKey.EMOTION, 2.0));

        assertEquals(ConceptKey.EMOTION, weights.dominantKey());
    }

    @Test
    @DisplayName("A zero total should fall back to uniform")
    void testZeroTotal() {
        assertTrue(ConceptWeights.normalize(Map.of()).isUniform());
        assertTrue(ConceptWeights.normalize(Map.of(ConceptKey.SPATIAL, 0.0)).isUniform());
    }

    @Test
    @DisplayName("Should reject negative and non-finite contributions")
    void testInvalidContributions() {
        assertThrows(IllegalArgumentException.class,
            () -> ConceptWeights.normalize(Map.of(ConceptKey.SPATIAL, -0.1)));
        assertThrows(IllegalArgumentException.class,
            () -> ConceptWeights.normalize(Map.of(ConceptKey.SPATIAL, Double.NaN)));
    }

    @Test
    @DisplayName("Keys and values should be parallel in declaration order")
    void testKeysAndValues() {
        ConceptWeights weights = ConceptWeights.normalize(Map.of(ConceptKey.LOAD_EMOTIONS, 1.0));

        assertEquals("temporal", weights.keys().get(0));
        assertEquals("load_emotions", weights.keys().get(18));
        assertEquals(1.0, weights.values().get(18), EPSILON);
        assertEquals(ConceptKey.LOAD_EMOTIONS, ConceptKey.fromKey("load_emotions"));
    }

    @Test
    @DisplayName("Should serialize as an ordered map of wire names")
    void testJsonShape() throws Exception {
        String json = new ObjectMapper().writeValueAsString(ConceptWeights.normalize(Map.of(ConceptKey.SPATIAL, 1.0)));

        assertTrue(json.startsWith("{\"temporal\":0.0,\"spatial\":1.0,"), json);
        assertTrue(json.contains("\"load_emotions\":0.0}"), json);
    }
}
