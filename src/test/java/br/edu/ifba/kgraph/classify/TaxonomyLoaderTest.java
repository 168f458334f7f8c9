package br.edu.ifba.kgraph.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaxonomyLoaderTest {

    private final TaxonomyLoader loader = new TaxonomyLoader(new ObjectMapper());

    @Test
    @DisplayName("Should load the NDC table in declaration order")
    void testLoadNdc() {
        Taxonomy ndc = loader.load("taxonomies/ndc.json");

        assertEquals("NDC", ndc.name());
        assertEquals(10, ndc.size());
        assertEquals("000", ndc.categories().get(0).code());
        assertEquals("900", ndc.categories().get(9).code());
        assertTrue(ndc.categories().get(9).keywords().contains("猫"));
    }

    @Test
    @DisplayName("Keywords should be case-folded on load")
    void testKeywordsFolded() {
        Taxonomy kindle = loader.load("taxonomies/kindle.json");

        TaxonomyCategory scienceFiction = kindle.categories().stream()
            .filter(c -> c.code().equals("science-fiction"))
            .findFirst()
            .orElseThrow();
        assertTrue(scienceFiction.keywords().contains("sf"));
        assertFalse(scienceFiction.keywords().contains("SF"));
    }

    @Test
    @DisplayName("Missing resource should fail fast")
    void testMissingResource() {
        assertThrows(IllegalStateException.class, () -> loader.load("taxonomies/missing.json"));
    }

    @Test
    @DisplayName("Should reject unknown concept keys and duplicate codes")
    void testInvalidTables() {
        assertThrows(IllegalArgumentException.class,
            () -> new TaxonomyCategory("x", "X", List.of("a"), Map.of("no_such_key", 1.0)));
        TaxonomyCategory category = new TaxonomyCategory("x", "X", List.of("a"), Map.of());
        assertThrows(IllegalArgumentException.class,
            () -> new Taxonomy("T", List.of(category, category)));
        assertThrows(IllegalArgumentException.class, () -> new Taxonomy("T", List.of()));
    }
}
