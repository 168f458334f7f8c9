package br.edu.ifba.kgraph.export;

import br.edu.ifba.kgraph.IngestionFixtures;
import br.edu.ifba.kgraph.classify.ConceptKey;
import br.edu.ifba.kgraph.classify.ConceptWeights;
import br.edu.ifba.kgraph.core.DocumentInfo;
import br.edu.ifba.kgraph.core.Entity;
import br.edu.ifba.kgraph.core.Mention;
import br.edu.ifba.kgraph.core.Segment;
import br.edu.ifba.kgraph.core.Sentence;
import br.edu.ifba.kgraph.exception.ErrorCategory;
import br.edu.ifba.kgraph.exception.ReferentialIntegrityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphArtifactBuilder validation and creation script layout.
 */
class GraphArtifactBuilderTest {

    private final GraphArtifactBuilder builder = new GraphArtifactBuilder(true);
    private final DocumentInfo document = IngestionFixtures.sampleDocument("D", "sample");

    private static Sentence sentence(String id, int order, String segmentId) {
        return new Sentence(id, order, segmentId, ConceptWeights.uniform(), null);
    }

    private static Entity entity(String id, String label) {
        return new Entity(id, label, "concept", ConceptWeights.uniform(), null);
    }

    private static Mention mention(String sentenceId, String entityId) {
        return new Mention(sentenceId, entityId, "cat", ConceptKey.TEMPORAL, 1.0);
    }

    @Nested
    @DisplayName("Script layout")
    class ScriptLayout {

        @Test
        @DisplayName("Constraints, nodes and relationships should appear in that order")
        void testSectionOrder() {
            GraphArtifact artifact = IngestionFixtures.sampleArtifact("D", "sample");
            List<ScriptStatement> statements = artifact.script().getStatements();

            assertEquals(5, artifact.script().statementsOf(StatementKind.CONSTRAINT).size());
            assertEquals(7, artifact.script().statementsOf(StatementKind.NODE).size());
            assertEquals(6, artifact.script().statementsOf(StatementKind.RELATIONSHIP).size());
            for (int i = 1; i < statements.size(); i++) {
                assertTrue(statements.get(i - 1).kind().compareTo(statements.get(i).kind()) <= 0,
                    "statement " + i + " is out of section order");
            }
        }

        @Test
        @DisplayName("Every relationship endpoint should be created as a node first")
        void testEndpointsCreatedFirst() {
            GraphArtifact artifact = IngestionFixtures.sampleArtifact("D", "sample");

            Set<Object> nodeIds = new HashSet<>();
            for (ScriptStatement statement : artifact.script().getStatements()) {
                if (statement.kind() == StatementKind.NODE) {
                    nodeIds.add(statement.parameters().get("id"));
                } else if (statement.kind() == StatementKind.RELATIONSHIP) {
                    assertTrue(nodeIds.contains(statement.parameters().get("from")), statement.cypher());
                    assertTrue(nodeIds.contains(statement.parameters().get("to")), statement.cypher());
                }
            }
        }

        @Test
        @DisplayName("Statements should be idempotent merges keyed on baseId")
        void testMergeStatements() {
            GraphArtifact artifact = IngestionFixtures.sampleArtifact("D", "sample");

            ScriptStatement work = artifact.script().statementsOf(StatementKind.NODE).get(0);
            assertEquals("MERGE (n:Work {baseId: $id}) SET n += $props", work.cypher());
            assertEquals("D", work.parameters().get("id"));
            for (ScriptStatement statement : artifact.script().statementsOf(StatementKind.RELATIONSHIP)) {
                assertTrue(statement.cypher().startsWith("MATCH "));
                assertTrue(statement.cypher().contains(" MERGE (a)-[r:"));
            }
        }

        @Test
        @DisplayName("Mentions should merge on their surface form")
        @SuppressWarnings("unchecked")
        void testMentionKeyedOnSurface() {
            GraphArtifact artifact = IngestionFixtures.sampleArtifact("D", "sample");

            ScriptStatement mention = artifact.script().statementsOf(StatementKind.RELATIONSHIP).stream()
                .filter(s -> s.cypher().contains(":MENTIONS"))
                .findFirst()
                .orElseThrow();
            assertEquals("MATCH (a:Sentence {baseId: $from}), (b:Entity {baseId: $to}) "
                + "MERGE (a)-[r:MENTIONS {surface: $surface}]->(b) SET r += $props", mention.cypher());
            assertEquals("Cat", mention.parameters().get("surface"));
            assertFalse(((Map<String, Object>) mention.parameters().get("props")).containsKey("surface"));
        }

        @Test
        @DisplayName("Classification should link to shared tag catalog nodes")
        void testClassifiedAs() {
            GraphArtifact artifact = IngestionFixtures.sampleArtifact("D", "sample");

            ScriptStatement tag = artifact.script().statementsOf(StatementKind.NODE).get(1);
            assertEquals("tag_ndc_900", tag.parameters().get("id"));
            ScriptStatement classified = artifact.script().statementsOf(StatementKind.RELATIONSHIP).get(0);
            assertTrue(classified.cypher().contains("CLASSIFIED_AS"));
            assertEquals("tag_ndc_900", classified.parameters().get("to"));
            assertEquals("tag_kindle_literature-fiction", GraphArtifactBuilder.tagId("Kindle", "literature-fiction"));
        }

        @Test
        @DisplayName("Concept weights should be written as parallel key and weight lists")
        @SuppressWarnings("unchecked")
        void testConceptWeightProperties() {
            GraphArtifact artifact = IngestionFixtures.sampleArtifact("D", "sample");

            ScriptStatement sentence = artifact.script().statementsOf(StatementKind.NODE).stream()
                .filter(s -> "T0".equals(s.parameters().get("id")))
                .findFirst()
                .orElseThrow();
            Map<String, Object> props = (Map<String, Object>) sentence.parameters().get("props");
            assertEquals(19, ((List<String>) props.get("ontoKeys")).size());
            assertEquals(19, ((List<Double>) props.get("ontoWeights")).size());
            assertEquals("temporal", props.get("dominantConcept"));
        }

        @Test
        @DisplayName("Constraints can be turned off")
        void testWithoutConstraints() {
            GraphArtifact artifact = new GraphArtifactBuilder(false).build(document,
                List.of(new Segment("S0", 0, List.of(), List.of("T0"))),
                List.of(sentence("T0", 0, "S0")), List.of(), List.of());

            assertTrue(artifact.script().statementsOf(StatementKind.CONSTRAINT).isEmpty());
            assertEquals(StatementKind.NODE, artifact.script().getStatements().get(0).kind());
        }
    }

    @Nested
    @DisplayName("Integrity checks")
    class IntegrityChecks {

        @Test
        @DisplayName("Sentence missing from its segment should be rejected")
        void testOrphanSentence() {
            ReferentialIntegrityException e = assertThrows(ReferentialIntegrityException.class, () -> builder.build(
                document,
                List.of(new Segment("S0", 0, List.of(), List.of("T0"))),
                List.of(sentence("T0", 0, "S0"), sentence("T1", 1, "S0")),
                List.of(), List.of()));

            assertEquals(ErrorCategory.INTEGRITY, e.getCategory());
            assertTrue(e.getViolations().contains("Sentence T1 belongs to 0 segments"));
            assertTrue(e.getViolations().contains("Sentence T1 is not listed by its segment S0"));
        }

        @Test
        @DisplayName("Segment ordinals should be contiguous from zero")
        void testSegmentOrdinalGap() {
            ReferentialIntegrityException e = assertThrows(ReferentialIntegrityException.class, () -> builder.build(
                document,
                List.of(new Segment("S0", 0, List.of(), List.of("T0")), new Segment("S1", 2, List.of(), List.of("T1"))),
                List.of(sentence("T0", 0, "S0"), sentence("T1", 1, "S1")),
                List.of(), List.of()));

            assertEquals(List.of("Segment S1 has ordinal 2, expected 1"), e.getViolations());
        }

        @Test
        @DisplayName("Sentence ordinals should be strictly increasing")
        void testSentenceOrdinals() {
            List<String> violations = builder.validate(document,
                List.of(new Segment("S0", 0, List.of(), List.of("T0", "T1"))),
                List.of(sentence("T0", 1, "S0"), sentence("T1", 1, "S0")),
                List.of(), List.of());

            assertEquals(List.of("Sentence T1 has ordinal 1, not after 1"), violations);
        }

        @Test
        @DisplayName("Segments should list sentences in document order")
        void testListingOrder() {
            List<String> violations = builder.validate(document,
                List.of(new Segment("S0", 0, List.of(), List.of("T1", "T0"))),
                List.of(sentence("T0", 0, "S0"), sentence("T1", 1, "S0")),
                List.of(), List.of());

            assertEquals(List.of("Segments do not list sentences in document order"), violations);
        }

        @Test
        @DisplayName("Mentions should reference existing sentences and entities")
        void testDanglingMentions() {
            List<String> violations = builder.validate(document,
                List.of(new Segment("S0", 0, List.of(), List.of("T0"))),
                List.of(sentence("T0", 0, "S0")),
                List.of(entity("E0", "cat")),
                List.of(mention("T9", "E0"), mention("T0", "E9")));

            assertEquals(List.of(
                "Mention of E0 references unknown sentence T9",
                "Mention in T0 references unknown entity E9"
            ), violations);
        }

        @Test
        @DisplayName("A repeated mention of the same surface should be rejected")
        void testDuplicateMention() {
            List<String> violations = builder.validate(document,
                List.of(new Segment("S0", 0, List.of(), List.of("T0"))),
                List.of(sentence("T0", 0, "S0")),
                List.of(entity("E0", "cat")),
                List.of(mention("T0", "E0"), mention("T0", "E0")));

            assertEquals(List.of("Mention 'cat' of E0 in T0 is emitted twice"), violations);
        }

        @Test
        @DisplayName("An identifier used twice should be rejected")
        void testDuplicateIdentifier() {
            List<String> violations = builder.validate(document,
                List.of(new Segment("S0", 0, List.of(), List.of("T0"))),
                List.of(sentence("T0", 0, "S0")),
                List.of(entity("T0", "cat")),
                List.of());

            assertEquals(List.of("Identifier T0 (entity) is emitted twice"), violations);
        }

        @Test
        @DisplayName("All violations should be reported together")
        void testCollectsAllViolations() {
            ReferentialIntegrityException e = assertThrows(ReferentialIntegrityException.class, () -> builder.build(
                document,
                List.of(new Segment("S0", 1, List.of(), List.of("T0", "T7"))),
                List.of(sentence("T0", 0, "S0")),
                List.of(),
                List.of(mention("T0", "E1"))));

            assertEquals(3, e.getViolations().size());
            assertTrue(e.getMessage().contains("D"));
        }
    }
}
