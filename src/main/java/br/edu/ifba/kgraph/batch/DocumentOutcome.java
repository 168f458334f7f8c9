package br.edu.ifba.kgraph.batch;

import br.edu.ifba.kgraph.exception.ErrorCategory;
import br.edu.ifba.kgraph.export.WrittenArtifact;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Result of one document in a batch.
 *
 * @param source        title or path identifying the input
 * @param documentId    allocated document identifier, null if ingestion failed before the artifact was built
 * @param written       files written, null on failure before writing
 * @param applied       whether a graph applier accepted the artifact
 * @param errorCategory failure class, null on success or for unexpected errors
 * @param errorMessage  failure description, null on success
 */
public record DocumentOutcome(
    @NotNull String source,
    @Nullable String documentId,
    @Nullable WrittenArtifact written,
    boolean applied,
    @Nullable ErrorCategory errorCategory,
    @Nullable String errorMessage
) {

    public DocumentOutcome {
        Objects.requireNonNull(source, "source must not be null");
    }

    public static DocumentOutcome success(@NotNull String source, @NotNull WrittenArtifact written, boolean applied) {
        return new DocumentOutcome(source, written.artifact().documentId(), written, applied, null, null);
    }

    public static DocumentOutcome failure(
            @NotNull String source,
            @Nullable WrittenArtifact written,
            @Nullable ErrorCategory category,
            @NotNull String message) {
        String documentId = written != null ? written.artifact().documentId() : null;
        return new DocumentOutcome(source, documentId, written, false, category, message);
    }

    public boolean succeeded() {
        return errorMessage == null;
    }
}
