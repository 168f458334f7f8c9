package br.edu.ifba.kgraph.registry;

import br.edu.ifba.kgraph.classify.ClassificationScope;
import br.edu.ifba.kgraph.classify.ClassifierFusion;
import br.edu.ifba.kgraph.classify.ConceptWeights;
import br.edu.ifba.kgraph.core.Entity;
import br.edu.ifba.kgraph.core.Mention;
import br.edu.ifba.kgraph.embedding.EmbeddingRef;
import br.edu.ifba.kgraph.id.IdAllocator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Deduplicates the entities of one document and records their mentions.
 *
 * <p>The case-folded label is the identity of an entity: the first surface form
 * seen creates the entity, later ones reuse it. Every call records a mention.
 * Not thread-safe; a document's sentences are registered strictly in order.</p>
 */
public class EntityRegistry {

    private static final Logger logger = LoggerFactory.getLogger(EntityRegistry.class);

    private final IdAllocator allocator;
    private final ClassifierFusion classifier;
    private final TermEnricher enricher;
    private final Map<String, List<EmbeddingRef>> embeddingsByLabel;
    private final double mentionWeight;

    private final Map<String, Entity> entitiesByLabel = new LinkedHashMap<>();
    private final List<Mention> mentions = new ArrayList<>();

    /**
     * @param allocator         identifier allocator of the current document
     * @param classifier        computes entity concept weights
     * @param enricher          assigns entity types
     * @param embeddingsByLabel precomputed embedding handles keyed by case-folded label
     * @param mentionWeight     weight recorded on every mention
     */
    public EntityRegistry(
            @NotNull IdAllocator allocator,
            @NotNull ClassifierFusion classifier,
            @NotNull TermEnricher enricher,
            @Nullable Map<String, List<EmbeddingRef>> embeddingsByLabel,
            double mentionWeight) {
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.enricher = Objects.requireNonNull(enricher, "enricher must not be null");
        this.embeddingsByLabel = embeddingsByLabel != null ? embeddingsByLabel : Collections.emptyMap();
        this.mentionWeight = mentionWeight;
    }

    /**
     * Registers an occurrence of a term in a sentence.
     *
     * @param sentenceId  sentence the term was extracted from
     * @param surfaceTerm term as it appeared
     * @return identifier of the new or existing entity
     */
    @NotNull
    public String register(@NotNull String sentenceId, @NotNull String surfaceTerm) {
        Objects.requireNonNull(sentenceId, "sentenceId must not be null");
        Objects.requireNonNull(surfaceTerm, "surfaceTerm must not be null");
        String label = surfaceTerm.strip().toLowerCase(Locale.ROOT);
        if (label.isEmpty()) {
            throw new IllegalArgumentException("surfaceTerm must not be blank");
        }

        Entity entity = entitiesByLabel.get(label);
        if (entity == null) {
            entity = create(sentenceId, label);
            entitiesByLabel.put(label, entity);
        }

        ConceptWeights weights = entity.getConceptWeights();
        mentions.add(new Mention(sentenceId, entity.getEntityId(), surfaceTerm, weights.dominantKey(), mentionWeight));
        return entity.getEntityId();
    }

    private Entity create(String sentenceId, String label) {
        String type = enricher.typeOf(label);
        if (type == null || type.isBlank()) {
            logger.warn("Term enricher returned no type for '{}', using '{}'", label, ConceptTermEnricher.CONCEPT);
            type = ConceptTermEnricher.CONCEPT;
        }
        String entityId = allocator.entityId(sentenceId, type, entitiesByLabel.size());
        ConceptWeights weights = classifier.conceptWeights(label, ClassificationScope.ENTITY);
        List<EmbeddingRef> embeddings = embeddingsByLabel.getOrDefault(label, Collections.emptyList());

        logger.debug("Registered entity {} '{}' (type={}, dominant={})", entityId, label, type, weights.dominantKey());
        return new Entity(entityId, label, type, weights, embeddings);
    }

    @NotNull
    public Optional<Entity> find(@NotNull String surfaceTerm) {
        return Optional.ofNullable(entitiesByLabel.get(surfaceTerm.strip().toLowerCase(Locale.ROOT)));
    }

    /**
     * Entities in creation order.
     */
    @NotNull
    public List<Entity> entities() {
        return List.copyOf(entitiesByLabel.values());
    }

    /**
     * Mentions in registration order.
     */
    @NotNull
    public List<Mention> mentions() {
        return List.copyOf(mentions);
    }

    @NotNull
    public List<Mention> mentionsOf(@NotNull String entityId) {
        List<Mention> result = new ArrayList<>();
        for (Mention mention : mentions) {
            if (mention.entityId().equals(entityId)) {
                result.add(mention);
            }
        }
        return result;
    }

    public int size() {
        return entitiesByLabel.size();
    }
}
