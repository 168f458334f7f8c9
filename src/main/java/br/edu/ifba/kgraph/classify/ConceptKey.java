package br.edu.ifba.kgraph.classify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

/**
 * The fixed concept-key vocabulary. Declaration order is significant: it is the
 * serialization order of every concept-weight map and breaks ties when picking
 * a dominant key.
 */
public enum ConceptKey {
    TEMPORAL("temporal"),
    SPATIAL("spatial"),
    EMOTION("emotion"),
    SENSATION("sensation"),
    NATURAL("natural"),
    RELATIONSHIP("relationship"),
    CAUSALITY("causality"),
    ACTION("action"),
    NARRATIVE_STRUCTURE("narrative_structure"),
    CHARACTER_FUNCTION("character_function"),
    DISCOURSE_STRUCTURE("discourse_structure"),
    STORY_CLASSIFICATION("story_classification"),
    FOOD_CULTURE("food_culture"),
    INDIRECT_EMOTION("indirect_emotion"),
    META_GRAPH("meta_graph"),
    EMOTION_NODES("emotion_nodes"),
    EMOTION_RELATIONSHIPS("emotion_relationships"),
    EMOTION_QUERIES("emotion_queries"),
    LOAD_EMOTIONS("load_emotions");

    private final String key;

    ConceptKey(String key) {
        this.key = key;
    }

    @JsonValue
    @NotNull
    public String getKey() {
        return key;
    }

    /**
     * Resolves a wire name such as {@code narrative_structure}.
     *
     * @throws IllegalArgumentException if the name is not a concept key
     */
    @JsonCreator
    @NotNull
    public static ConceptKey fromKey(@NotNull String key) {
        for (ConceptKey value : values()) {
            if (value.key.equals(key)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown concept key: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
