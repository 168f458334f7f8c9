package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.classify.ConceptWeights;
import br.edu.ifba.kgraph.embedding.EmbeddingRef;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A salient term of a document, deduplicated by its case-folded label.
 */
public final class Entity {

    @JsonProperty("entityId")
    @NotNull
    private final String entityId;

    @JsonProperty("label")
    @NotNull
    private final String label;

    @JsonProperty("type")
    @NotNull
    private final String type;

    @JsonProperty("conceptWeights")
    @NotNull
    private final ConceptWeights conceptWeights;

    @JsonProperty("embeddings")
    @NotNull
    private final List<EmbeddingRef> embeddings;

    /**
     * Constructs a new Entity.
     *
     * @param entityId       allocated identifier (required)
     * @param label          case-folded canonical label (required)
     * @param type           entity type from the term enricher (required)
     * @param conceptWeights fused concept distribution of the label (required)
     * @param embeddings     handles of precomputed label vectors (optional)
     */
    public Entity(
            @NotNull String entityId,
            @NotNull String label,
            @NotNull String type,
            @NotNull ConceptWeights conceptWeights,
            @Nullable List<EmbeddingRef> embeddings) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.conceptWeights = Objects.requireNonNull(conceptWeights, "conceptWeights must not be null");
        this.embeddings = embeddings != null ? List.copyOf(embeddings) : Collections.emptyList();
    }

    @NotNull
    public String getEntityId() {
        return entityId;
    }

    @NotNull
    public String getLabel() {
        return label;
    }

    @NotNull
    public String getType() {
        return type;
    }

    @NotNull
    public ConceptWeights getConceptWeights() {
        return conceptWeights;
    }

    /**
     * @return unmodifiable list of embedding handles, possibly empty
     */
    @NotNull
    public List<EmbeddingRef> getEmbeddings() {
        return embeddings;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Entity entity = (Entity) obj;
        return Objects.equals(entityId, entity.entityId) &&
               Objects.equals(label, entity.label) &&
               Objects.equals(type, entity.type) &&
               Objects.equals(conceptWeights, entity.conceptWeights) &&
               Objects.equals(embeddings, entity.embeddings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, label, type, conceptWeights, embeddings);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "entityId='" + entityId + '\'' +
                ", label='" + label + '\'' +
                ", type='" + type + '\'' +
                ", embeddings=" + embeddings.size() +
                '}';
    }
}
