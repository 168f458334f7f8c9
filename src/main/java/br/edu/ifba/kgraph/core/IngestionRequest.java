package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.embedding.EmbeddingRef;
import br.edu.ifba.kgraph.exception.UnreadableSourceException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A document to ingest, with optional precomputed embedding handles.
 *
 * <p>Sentence handles are keyed by the document-global sentence ordinal, entity
 * handles by case-folded label.</p>
 */
public final class IngestionRequest {

    @NotNull
    private final String title;

    @Nullable
    private final String sourcePath;

    @NotNull
    private final String text;

    @NotNull
    private final Map<Integer, EmbeddingRef> sentenceEmbeddings;

    @NotNull
    private final Map<String, List<EmbeddingRef>> entityEmbeddings;

    private IngestionRequest(Builder builder) {
        this.title = Objects.requireNonNull(builder.title, "title must not be null");
        this.sourcePath = builder.sourcePath;
        this.text = Objects.requireNonNull(builder.text, "text must not be null");
        this.sentenceEmbeddings = Collections.unmodifiableMap(new HashMap<>(builder.sentenceEmbeddings));
        Map<String, List<EmbeddingRef>> byLabel = new HashMap<>();
        builder.entityEmbeddings.forEach((label, refs) ->
            byLabel.computeIfAbsent(label.strip().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).addAll(refs));
        Map<String, List<EmbeddingRef>> frozen = new HashMap<>();
        byLabel.forEach((label, refs) -> frozen.put(label, List.copyOf(refs)));
        this.entityEmbeddings = Collections.unmodifiableMap(frozen);
    }

    /**
     * Reads a UTF-8 text file. Malformed byte sequences are replaced, not rejected.
     * The title is the file name without its extension.
     *
     * @param path file to read
     * @return request with the file's text
     * @throws UnreadableSourceException if the file cannot be read
     */
    @NotNull
    public static IngestionRequest fromFile(@NotNull Path path) {
        Objects.requireNonNull(path, "path must not be null");
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UnreadableSourceException("Cannot read source file " + path, e);
        }

        String text = new String(bytes, StandardCharsets.UTF_8);

        String fileName = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        int dot = fileName.lastIndexOf('.');
        String title = dot > 0 ? fileName.substring(0, dot) : fileName;
        return builder().title(title).sourcePath(path.toString()).text(text).build();
    }

    @NotNull
    public String getTitle() {
        return title;
    }

    @Nullable
    public String getSourcePath() {
        return sourcePath;
    }

    @NotNull
    public String getText() {
        return text;
    }

    @Nullable
    public EmbeddingRef sentenceEmbedding(int order) {
        return sentenceEmbeddings.get(order);
    }

    /**
     * Entity embedding handles keyed by case-folded label.
     */
    @NotNull
    public Map<String, List<EmbeddingRef>> getEntityEmbeddings() {
        return entityEmbeddings;
    }

    @Override
    public String toString() {
        return "IngestionRequest{" +
                "title='" + title + '\'' +
                ", sourcePath='" + sourcePath + '\'' +
                ", textLength=" + text.length() +
                ", sentenceEmbeddings=" + sentenceEmbeddings.size() +
                ", entityEmbeddings=" + entityEmbeddings.size() +
                '}';
    }

    /**
     * Builder for IngestionRequest instances.
     */
    public static class Builder {
        private String title;
        private String sourcePath;
        private String text;
        private final Map<Integer, EmbeddingRef> sentenceEmbeddings = new HashMap<>();
        private final Map<String, List<EmbeddingRef>> entityEmbeddings = new HashMap<>();

        public Builder title(@NotNull String title) {
            this.title = title;
            return this;
        }

        public Builder sourcePath(@Nullable String sourcePath) {
            this.sourcePath = sourcePath;
            return this;
        }

        public Builder text(@NotNull String text) {
            this.text = text;
            return this;
        }

        public Builder sentenceEmbedding(int order, @NotNull EmbeddingRef ref) {
            this.sentenceEmbeddings.put(order, Objects.requireNonNull(ref, "ref must not be null"));
            return this;
        }

        public Builder entityEmbedding(@NotNull String label, @NotNull EmbeddingRef ref) {
            this.entityEmbeddings.computeIfAbsent(label, k -> new ArrayList<>())
                .add(Objects.requireNonNull(ref, "ref must not be null"));
            return this;
        }

        public IngestionRequest build() {
            return new IngestionRequest(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
