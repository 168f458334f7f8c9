package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.classify.ConceptWeights;
import br.edu.ifba.kgraph.embedding.EmbeddingRef;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A sentence of a document. The text itself is not persisted; only its position,
 * parent segment and concept weights are.
 */
public final class Sentence {

    @JsonProperty("sentenceId")
    @NotNull
    private final String sentenceId;

    @JsonProperty("order")
    private final int order;

    @JsonProperty("segmentId")
    @NotNull
    private final String segmentId;

    @JsonProperty("conceptWeights")
    @NotNull
    private final ConceptWeights conceptWeights;

    @JsonProperty("embeddingRef")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Nullable
    private final EmbeddingRef embeddingRef;

    /**
     * @param sentenceId     allocated identifier (required)
     * @param order          document-global ordinal, from 0
     * @param segmentId      identifier of the owning segment (required)
     * @param conceptWeights fused concept distribution of the sentence text (required)
     * @param embeddingRef   handle of a precomputed sentence vector (optional)
     */
    public Sentence(
            @NotNull String sentenceId,
            int order,
            @NotNull String segmentId,
            @NotNull ConceptWeights conceptWeights,
            @Nullable EmbeddingRef embeddingRef) {
        this.sentenceId = Objects.requireNonNull(sentenceId, "sentenceId must not be null");
        if (order < 0) {
            throw new IllegalArgumentException("order must be non-negative, got: " + order);
        }
        this.order = order;
        this.segmentId = Objects.requireNonNull(segmentId, "segmentId must not be null");
        this.conceptWeights = Objects.requireNonNull(conceptWeights, "conceptWeights must not be null");
        this.embeddingRef = embeddingRef;
    }

    @NotNull
    public String getSentenceId() {
        return sentenceId;
    }

    public int getOrder() {
        return order;
    }

    @NotNull
    public String getSegmentId() {
        return segmentId;
    }

    @NotNull
    public ConceptWeights getConceptWeights() {
        return conceptWeights;
    }

    @Nullable
    public EmbeddingRef getEmbeddingRef() {
        return embeddingRef;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Sentence sentence = (Sentence) obj;
        return order == sentence.order &&
               Objects.equals(sentenceId, sentence.sentenceId) &&
               Objects.equals(segmentId, sentence.segmentId) &&
               Objects.equals(conceptWeights, sentence.conceptWeights) &&
               Objects.equals(embeddingRef, sentence.embeddingRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sentenceId, order, segmentId, conceptWeights, embeddingRef);
    }

    @Override
    public String toString() {
        return "Sentence{" +
                "sentenceId='" + sentenceId + '\'' +
                ", order=" + order +
                ", segmentId='" + segmentId + '\'' +
                ", dominant=" + conceptWeights.dominantKey() +
                '}';
    }
}
