package br.edu.ifba.kgraph.export;

import br.edu.ifba.kgraph.classify.CategoryScore;
import br.edu.ifba.kgraph.classify.ConceptWeights;
import br.edu.ifba.kgraph.core.DocumentInfo;
import br.edu.ifba.kgraph.core.Entity;
import br.edu.ifba.kgraph.core.IngestionConfig;
import br.edu.ifba.kgraph.core.Mention;
import br.edu.ifba.kgraph.core.Segment;
import br.edu.ifba.kgraph.core.Sentence;
import br.edu.ifba.kgraph.embedding.EmbeddingRef;
import br.edu.ifba.kgraph.exception.ReferentialIntegrityException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Validates a document's model and assembles its graph artifact.
 *
 * <h2>Checks</h2>
 * <ul>
 *   <li>No identifier is used twice</li>
 *   <li>Segment ordinals are contiguous from 0</li>
 *   <li>Sentence ordinals are strictly increasing</li>
 *   <li>Every sentence belongs to exactly one segment, and that segment lists it</li>
 *   <li>Segments list their sentences in document order</li>
 *   <li>Every mention points at an existing sentence and entity</li>
 * </ul>
 * All violations are collected before failing, and nothing is emitted for an invalid model.
 *
 * <h2>Script layout</h2>
 * <pre>
 * CONSTRAINT  one uniqueness constraint on baseId per label (optional)
 * NODE        Work, TagCatalog, Segment, Sentence, Entity
 * RELATIONSHIP CLASSIFIED_AS, HAS_SEGMENT, HAS_SENTENCE, MENTIONS
 * </pre>
 */
@ApplicationScoped
public class GraphArtifactBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GraphArtifactBuilder.class);

    static final String WORK = "Work";
    static final String TAG_CATALOG = "TagCatalog";
    static final String SEGMENT = "Segment";
    static final String SENTENCE = "Sentence";
    static final String ENTITY = "Entity";

    static final List<String> LABELS = List.of(WORK, TAG_CATALOG, SEGMENT, SENTENCE, ENTITY);

    private final boolean emitConstraints;

    @Inject
    public GraphArtifactBuilder(IngestionConfig config) {
        this(config.artifact().emitConstraints());
    }

    public GraphArtifactBuilder(boolean emitConstraints) {
        this.emitConstraints = emitConstraints;
    }

    /**
     * Validates the model and builds the artifact.
     *
     * @throws ReferentialIntegrityException if the model is inconsistent
     */
    @NotNull
    public GraphArtifact build(
            @NotNull DocumentInfo document,
            @NotNull List<Segment> segments,
            @NotNull List<Sentence> sentences,
            @NotNull List<Entity> entities,
            @NotNull List<Mention> mentions) {

        List<String> violations = validate(document, segments, sentences, entities, mentions);
        if (!violations.isEmpty()) {
            logger.error("Refusing to emit artifact for {}: {} integrity violation(s), first: {}",
                document.getDocumentId(), violations.size(), violations.get(0));
            throw new ReferentialIntegrityException(document.getDocumentId(), violations);
        }

        DocumentRecord record = new DocumentRecord(
            DocumentRecord.SCHEMA_VERSION, document, segments, sentences, entities, mentions);
        CreationScript script = new CreationScript(statements(document, segments, sentences, entities, mentions));

        logger.debug("Built artifact for {}: {}", document.getDocumentId(), script);
        return new GraphArtifact(record, script);
    }

    /**
     * Collects every integrity violation of the model.
     *
     * @return violation descriptions in detection order, empty if the model is consistent
     */
    @NotNull
    List<String> validate(
            DocumentInfo document,
            List<Segment> segments,
            List<Sentence> sentences,
            List<Entity> entities,
            List<Mention> mentions) {

        List<String> violations = new ArrayList<>();

        Set<String> ids = new HashSet<>();
        claim(ids, document.getDocumentId(), "document", violations);
        for (Segment segment : segments) {
            claim(ids, segment.getSegmentId(), "segment", violations);
        }
        for (Sentence sentence : sentences) {
            claim(ids, sentence.getSentenceId(), "sentence", violations);
        }
        Set<String> entityIds = new HashSet<>();
        for (Entity entity : entities) {
            claim(ids, entity.getEntityId(), "entity", violations);
            entityIds.add(entity.getEntityId());
        }

        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).getOrder() != i) {
                violations.add(String.format("Segment %s has ordinal %d, expected %d",
                    segments.get(i).getSegmentId(), segments.get(i).getOrder(), i));
            }
        }

        Map<String, Sentence> sentencesById = new HashMap<>();
        for (int i = 0; i < sentences.size(); i++) {
            Sentence sentence = sentences.get(i);
            sentencesById.put(sentence.getSentenceId(), sentence);
            if (i > 0 && sentence.getOrder() <= sentences.get(i - 1).getOrder()) {
                violations.add(String.format("Sentence %s has ordinal %d, not after %d",
                    sentence.getSentenceId(), sentence.getOrder(), sentences.get(i - 1).getOrder()));
            }
        }

        Map<String, Integer> membership = new HashMap<>();
        Map<String, Segment> segmentsById = new HashMap<>();
        List<String> listedOrder = new ArrayList<>();
        for (Segment segment : segments) {
            segmentsById.put(segment.getSegmentId(), segment);
            for (String sentenceId : segment.getSentenceIds()) {
                membership.merge(sentenceId, 1, Integer::sum);
                listedOrder.add(sentenceId);
                if (!sentencesById.containsKey(sentenceId)) {
                    violations.add(String.format("Segment %s lists unknown sentence %s", segment.getSegmentId(), sentenceId));
                }
            }
        }

        List<String> documentOrder = new ArrayList<>();
        for (Sentence sentence : sentences) {
            documentOrder.add(sentence.getSentenceId());
            int count = membership.getOrDefault(sentence.getSentenceId(), 0);
            if (count != 1) {
                violations.add(String.format("Sentence %s belongs to %d segments", sentence.getSentenceId(), count));
            }
            Segment parent = segmentsById.get(sentence.getSegmentId());
            if (parent == null) {
                violations.add(String.format("Sentence %s references unknown segment %s",
                    sentence.getSentenceId(), sentence.getSegmentId()));
            } else if (!parent.getSentenceIds().contains(sentence.getSentenceId())) {
                violations.add(String.format("Sentence %s is not listed by its segment %s",
                    sentence.getSentenceId(), sentence.getSegmentId()));
            }
        }
        if (violations.isEmpty() && !listedOrder.equals(documentOrder)) {
            violations.add("Segments do not list sentences in document order");
        }

        Set<String> mentionKeys = new HashSet<>();
        for (Mention mention : mentions) {
            if (!mentionKeys.add(mention.sentenceId() + "\u0000" + mention.entityId() + "\u0000" + mention.surface())) {
                violations.add(String.format("Mention '%s' of %s in %s is emitted twice",
                    mention.surface(), mention.entityId(), mention.sentenceId()));
            }
            if (!sentencesById.containsKey(mention.sentenceId())) {
                violations.add(String.format("Mention of %s references unknown sentence %s",
                    mention.entityId(), mention.sentenceId()));
            }
            if (!entityIds.contains(mention.entityId())) {
                violations.add(String.format("Mention in %s references unknown entity %s",
                    mention.sentenceId(), mention.entityId()));
            }
        }

        return violations;
    }

    private static void claim(Set<String> ids, String id, String kind, List<String> violations) {
        if (!ids.add(id)) {
            violations.add(String.format("Identifier %s (%s) is emitted twice", id, kind));
        }
    }

    private List<ScriptStatement> statements(
            DocumentInfo document,
            List<Segment> segments,
            List<Sentence> sentences,
            List<Entity> entities,
            List<Mention> mentions) {

        List<ScriptStatement> statements = new ArrayList<>();

        if (emitConstraints) {
            for (String label : LABELS) {
                statements.add(new ScriptStatement(StatementKind.CONSTRAINT, String.format(
                    "CREATE CONSTRAINT %s_baseId_unique IF NOT EXISTS FOR (n:%s) REQUIRE n.baseId IS UNIQUE",
                    label.toLowerCase(Locale.ROOT), label), Map.of()));
            }
        }

        // Nodes
        Map<String, Object> work = new LinkedHashMap<>();
        work.put("title", document.getTitle());
        putIfPresent(work, "sourcePath", document.getSourcePath());
        work.put("sourceType", document.getSourceType());
        work.put("fingerprint", document.getFingerprint());
        work.put("ingestedAt", document.getIngestedAt());
        work.put("language", document.getLanguage());
        work.put("tokenCountHint", document.getTokenCountHint());
        putConceptWeights(work, document.getConceptWeights());
        statements.add(node(WORK, document.getDocumentId(), work));

        Map<String, CategoryScore> tags = new LinkedHashMap<>();
        Map<String, String> tagTaxonomy = new HashMap<>();
        collectTags(tags, tagTaxonomy, "NDC", document.getNdc());
        collectTags(tags, tagTaxonomy, "Kindle", document.getKindle());
        for (Map.Entry<String, CategoryScore> tag : tags.entrySet()) {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("taxonomy", tagTaxonomy.get(tag.getKey()));
            props.put("code", tag.getValue().code());
            props.put("name", tag.getValue().name());
            statements.add(node(TAG_CATALOG, tag.getKey(), props));
        }

        for (Segment segment : segments) {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("workId", document.getDocumentId());
            props.put("order", segment.getOrder());
            props.put("timecodeMs", segment.getTimecodeMs());
            props.put("keyTerms", segment.getKeyTerms());
            props.put("lengthHint", segment.getLengthHint());
            statements.add(node(SEGMENT, segment.getSegmentId(), props));
        }

        for (Sentence sentence : sentences) {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("segmentId", sentence.getSegmentId());
            props.put("order", sentence.getOrder());
            putConceptWeights(props, sentence.getConceptWeights());
            if (sentence.getEmbeddingRef() != null) {
                props.put("embeddingRef", sentence.getEmbeddingRef().toReference());
            }
            statements.add(node(SENTENCE, sentence.getSentenceId(), props));
        }

        for (Entity entity : entities) {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("label", entity.getLabel());
            props.put("type", entity.getType());
            putConceptWeights(props, entity.getConceptWeights());
            List<String> refs = new ArrayList<>();
            for (EmbeddingRef ref : entity.getEmbeddings()) {
                refs.add(ref.toReference());
            }
            props.put("embeddingRefs", refs);
            statements.add(node(ENTITY, entity.getEntityId(), props));
        }

        // Relationships
        int rank = 0;
        for (CategoryScore score : document.getNdc()) {
            statements.add(classifiedAs(document.getDocumentId(), "NDC", score, rank++));
        }
        rank = 0;
        for (CategoryScore score : document.getKindle()) {
            statements.add(classifiedAs(document.getDocumentId(), "Kindle", score, rank++));
        }

        for (Segment segment : segments) {
            statements.add(relationship(WORK, "HAS_SEGMENT", SEGMENT,
                document.getDocumentId(), segment.getSegmentId(), Map.of("order", segment.getOrder())));
        }

        for (Sentence sentence : sentences) {
            statements.add(relationship(SEGMENT, "HAS_SENTENCE", SENTENCE,
                sentence.getSegmentId(), sentence.getSentenceId(), Map.of("order", sentence.getOrder())));
        }

        for (Mention mention : mentions) {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("conceptKey", mention.conceptKey().getKey());
            props.put("weight", mention.weight());
            statements.add(relationship(SENTENCE, "MENTIONS", ENTITY, mention.sentenceId(), mention.entityId(),
                Map.of("surface", mention.surface()), props));
        }

        return statements;
    }

    /**
     * Stable identifier of a taxonomy category node, shared by every document.
     */
    @NotNull
    static String tagId(@NotNull String taxonomy, @NotNull String code) {
        return "tag_" + taxonomy.toLowerCase(Locale.ROOT) + "_" + code;
    }

    private static void collectTags(
            Map<String, CategoryScore> tags, Map<String, String> tagTaxonomy, String taxonomy, List<CategoryScore> scores) {
        for (CategoryScore score : scores) {
            String id = tagId(taxonomy, score.code());
            tags.putIfAbsent(id, score);
            tagTaxonomy.putIfAbsent(id, taxonomy);
        }
    }

    private static ScriptStatement classifiedAs(String documentId, String taxonomy, CategoryScore score, int rank) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("taxonomy", taxonomy);
        props.put("rank", rank);
        props.put("score", score.score());
        return relationship(WORK, "CLASSIFIED_AS", TAG_CATALOG, documentId, tagId(taxonomy, score.code()), props);
    }

    private static ScriptStatement node(String label, String id, Map<String, Object> props) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("id", id);
        parameters.put("props", props);
        return new ScriptStatement(StatementKind.NODE,
            "MERGE (n:" + label + " {baseId: $id}) SET n += $props", parameters);
    }

    private static ScriptStatement relationship(
            String fromLabel, String type, String toLabel, String from, String to, Map<String, Object> props) {
        return relationship(fromLabel, type, toLabel, from, to, Map.of(), props);
    }

    /**
     * Relationship merge. Non-empty {@code keys} become part of the merge pattern, so
     * two relationships of the same type between the same nodes stay distinct.
     */
    private static ScriptStatement relationship(String fromLabel, String type, String toLabel,
            String from, String to, Map<String, Object> keys, Map<String, Object> props) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("from", from);
        parameters.put("to", to);
        StringJoiner pattern = new StringJoiner(", ", " {", "}").setEmptyValue("");
        for (Map.Entry<String, Object> key : new TreeMap<>(keys).entrySet()) {
            parameters.put(key.getKey(), key.getValue());
            pattern.add(key.getKey() + ": $" + key.getKey());
        }
        parameters.put("props", props);
        return new ScriptStatement(StatementKind.RELATIONSHIP,
            "MATCH (a:" + fromLabel + " {baseId: $from}), (b:" + toLabel + " {baseId: $to}) "
                + "MERGE (a)-[r:" + type + pattern + "]->(b) SET r += $props",
            parameters);
    }

    // Graph properties cannot hold maps, so weights travel as two parallel lists
    private static void putConceptWeights(Map<String, Object> props, ConceptWeights weights) {
        props.put("ontoKeys", weights.keys());
        props.put("ontoWeights", weights.values());
        props.put("dominantConcept", weights.dominantKey().getKey());
    }

    private static void putIfPresent(Map<String, Object> props, String key, Object value) {
        if (value != null) {
            props.put(key, value);
        }
    }
}
