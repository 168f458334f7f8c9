package br.edu.ifba.kgraph.export;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Validated output of one ingestion: the document record and its creation script.
 *
 * @param record structured record, written as JSON
 * @param script creation script, written as Cypher
 */
public record GraphArtifact(@NotNull DocumentRecord record, @NotNull CreationScript script) {

    public GraphArtifact {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(script, "script must not be null");
    }

    @NotNull
    public String documentId() {
        return record.document().getDocumentId();
    }
}
