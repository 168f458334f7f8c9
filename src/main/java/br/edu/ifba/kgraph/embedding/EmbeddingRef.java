package br.edu.ifba.kgraph.embedding;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Opaque handle to a vector computed outside this pipeline.
 *
 * <p>Vectors are never computed or stored here. The handle is copied verbatim into
 * the graph artifact so the consumer can resolve it against its vector store.</p>
 *
 * @param model      name of the embedding model that produced the vector
 * @param handle     store-specific reference, e.g. a row key or URI
 * @param dimensions vector dimension
 */
public record EmbeddingRef(
    @JsonProperty("model") @NotNull String model,
    @JsonProperty("handle") @NotNull String handle,
    @JsonProperty("dimensions") int dimensions
) {

    public EmbeddingRef {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(handle, "handle must not be null");
        if (handle.isBlank()) {
            throw new IllegalArgumentException("handle must not be blank");
        }
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive, got: " + dimensions);
        }
    }

    /**
     * Single-string form used as a graph property: {@code model:dimensions:handle}.
     */
    @NotNull
    public String toReference() {
        return model + ":" + dimensions + ":" + handle;
    }
}
