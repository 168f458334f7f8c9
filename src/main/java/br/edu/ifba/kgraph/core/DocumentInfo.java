package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.classify.CategoryScore;
import br.edu.ifba.kgraph.classify.ConceptWeights;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Document-level record of an ingestion run: provenance, fingerprint and classification.
 * The raw text is never kept; the fingerprint identifies it.
 */
public final class DocumentInfo {

    @JsonProperty("documentId")
    @NotNull
    private final String documentId;

    @JsonProperty("title")
    @NotNull
    private final String title;

    @JsonProperty("sourcePath")
    @Nullable
    private final String sourcePath;

    @JsonProperty("sourceType")
    @NotNull
    private final String sourceType;

    @JsonProperty("fingerprint")
    @NotNull
    private final String fingerprint;

    @JsonProperty("ingestedAt")
    private final long ingestedAt;

    @JsonProperty("language")
    @NotNull
    private final String language;

    @JsonProperty("tokenCountHint")
    private final int tokenCountHint;

    @JsonProperty("ndc")
    @NotNull
    private final List<CategoryScore> ndc;

    @JsonProperty("kindle")
    @NotNull
    private final List<CategoryScore> kindle;

    @JsonProperty("conceptWeights")
    @NotNull
    private final ConceptWeights conceptWeights;

    private DocumentInfo(Builder builder) {
        this.documentId = Objects.requireNonNull(builder.documentId, "documentId must not be null");
        this.title = Objects.requireNonNull(builder.title, "title must not be null");
        this.sourcePath = builder.sourcePath;
        this.sourceType = builder.sourceType != null ? builder.sourceType : "local";
        this.fingerprint = Objects.requireNonNull(builder.fingerprint, "fingerprint must not be null");
        this.ingestedAt = builder.ingestedAt;
        this.language = builder.language != null ? builder.language : "und";
        this.tokenCountHint = builder.tokenCountHint;
        this.ndc = builder.ndc != null ? List.copyOf(builder.ndc) : Collections.emptyList();
        this.kindle = builder.kindle != null ? List.copyOf(builder.kindle) : Collections.emptyList();
        this.conceptWeights = Objects.requireNonNull(builder.conceptWeights, "conceptWeights must not be null");
    }

    @NotNull
    public String getDocumentId() {
        return documentId;
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
    public String getSourceType() {
        return sourceType;
    }

    /**
     * SHA-256 hex digest of the UTF-8 source text.
     */
    @NotNull
    public String getFingerprint() {
        return fingerprint;
    }

    /**
     * Epoch milliseconds at which ingestion started.
     */
    public long getIngestedAt() {
        return ingestedAt;
    }

    /**
     * Script-majority language hint: {@code ja}, {@code en} or {@code und}.
     */
    @NotNull
    public String getLanguage() {
        return language;
    }

    public int getTokenCountHint() {
        return tokenCountHint;
    }

    @NotNull
    public List<CategoryScore> getNdc() {
        return ndc;
    }

    @NotNull
    public List<CategoryScore> getKindle() {
        return kindle;
    }

    @NotNull
    public ConceptWeights getConceptWeights() {
        return conceptWeights;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        DocumentInfo that = (DocumentInfo) obj;
        return ingestedAt == that.ingestedAt &&
               tokenCountHint == that.tokenCountHint &&
               Objects.equals(documentId, that.documentId) &&
               Objects.equals(title, that.title) &&
               Objects.equals(sourcePath, that.sourcePath) &&
               Objects.equals(sourceType, that.sourceType) &&
               Objects.equals(fingerprint, that.fingerprint) &&
               Objects.equals(language, that.language) &&
               Objects.equals(ndc, that.ndc) &&
               Objects.equals(kindle, that.kindle) &&
               Objects.equals(conceptWeights, that.conceptWeights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, title, sourcePath, sourceType, fingerprint, ingestedAt,
            language, tokenCountHint, ndc, kindle, conceptWeights);
    }

    @Override
    public String toString() {
        return "DocumentInfo{" +
                "documentId='" + documentId + '\'' +
                ", title='" + title + '\'' +
                ", sourcePath='" + sourcePath + '\'' +
                ", language='" + language + '\'' +
                ", tokenCountHint=" + tokenCountHint +
                '}';
    }

    /**
     * Builder for DocumentInfo instances.
     */
    public static class Builder {
        private String documentId;
        private String title;
        private String sourcePath;
        private String sourceType;
        private String fingerprint;
        private long ingestedAt;
        private String language;
        private int tokenCountHint;
        private List<CategoryScore> ndc;
        private List<CategoryScore> kindle;
        private ConceptWeights conceptWeights;

        public Builder documentId(@NotNull String documentId) {
            this.documentId = documentId;
            return this;
        }

        public Builder title(@NotNull String title) {
            this.title = title;
            return this;
        }

        public Builder sourcePath(@Nullable String sourcePath) {
            this.sourcePath = sourcePath;
            return this;
        }

        public Builder sourceType(@Nullable String sourceType) {
            this.sourceType = sourceType;
            return this;
        }

        public Builder fingerprint(@NotNull String fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public Builder ingestedAt(long ingestedAt) {
            this.ingestedAt = ingestedAt;
            return this;
        }

        public Builder language(@Nullable String language) {
            this.language = language;
            return this;
        }

        public Builder tokenCountHint(int tokenCountHint) {
            this.tokenCountHint = tokenCountHint;
            return this;
        }

        public Builder ndc(@NotNull List<CategoryScore> ndc) {
            this.ndc = ndc;
            return this;
        }

        public Builder kindle(@NotNull List<CategoryScore> kindle) {
            this.kindle = kindle;
            return this;
        }

        public Builder conceptWeights(@NotNull ConceptWeights conceptWeights) {
            this.conceptWeights = conceptWeights;
            return this;
        }

        public DocumentInfo build() {
            return new DocumentInfo(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
