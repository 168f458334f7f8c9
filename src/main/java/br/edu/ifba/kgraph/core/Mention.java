package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.classify.ConceptKey;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Occurrence of an entity in a sentence.
 *
 * @param sentenceId sentence containing the occurrence
 * @param entityId   entity referred to
 * @param surface    term as extracted from the sentence
 * @param conceptKey dominant concept key of the entity when the mention was recorded
 * @param weight     relevance weight
 */
public record Mention(
    @JsonProperty("sentenceId") @NotNull String sentenceId,
    @JsonProperty("entityId") @NotNull String entityId,
    @JsonProperty("surface") @NotNull String surface,
    @JsonProperty("conceptKey") @NotNull ConceptKey conceptKey,
    @JsonProperty("weight") double weight
) {

    public Mention {
        Objects.requireNonNull(sentenceId, "sentenceId must not be null");
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(surface, "surface must not be null");
        Objects.requireNonNull(conceptKey, "conceptKey must not be null");
        if (weight < 0.0 || !Double.isFinite(weight)) {
            throw new IllegalArgumentException("weight must be finite and non-negative, got: " + weight);
        }
    }
}
