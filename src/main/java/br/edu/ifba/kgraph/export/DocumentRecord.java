package br.edu.ifba.kgraph.export;

import br.edu.ifba.kgraph.core.DocumentInfo;
import br.edu.ifba.kgraph.core.Entity;
import br.edu.ifba.kgraph.core.Mention;
import br.edu.ifba.kgraph.core.Segment;
import br.edu.ifba.kgraph.core.Sentence;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * The structured JSON half of a graph artifact.
 *
 * @param schemaVersion record layout version
 * @param document      document-level record
 * @param segments      segments in order
 * @param sentences     sentences in order
 * @param entities      entities in creation order
 * @param mentions      mentions in registration order
 */
@JsonPropertyOrder({"schemaVersion", "document", "segments", "sentences", "entities", "mentions"})
public record DocumentRecord(
    @JsonProperty("schemaVersion") @NotNull String schemaVersion,
    @JsonProperty("document") @NotNull DocumentInfo document,
    @JsonProperty("segments") @NotNull List<Segment> segments,
    @JsonProperty("sentences") @NotNull List<Sentence> sentences,
    @JsonProperty("entities") @NotNull List<Entity> entities,
    @JsonProperty("mentions") @NotNull List<Mention> mentions
) {

    public static final String SCHEMA_VERSION = "1";

    public DocumentRecord {
        Objects.requireNonNull(schemaVersion, "schemaVersion must not be null");
        Objects.requireNonNull(document, "document must not be null");
        segments = List.copyOf(segments);
        sentences = List.copyOf(sentences);
        entities = List.copyOf(entities);
        mentions = List.copyOf(mentions);
    }
}
