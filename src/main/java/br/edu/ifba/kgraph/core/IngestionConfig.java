package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.id.AllocationMode;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Configuration for the ingestion pipeline.
 *
 * <p>All properties are read from application.properties with the prefix "kgraph".</p>
 *
 * <h2>Configuration Groups:</h2>
 * <ul>
 *   <li><b>segment</b> - sentence boundaries and segment window size</li>
 *   <li><b>id</b> - identifier allocation mode and limits</li>
 *   <li><b>extraction</b> - salient term extraction</li>
 *   <li><b>classification</b> - taxonomy tables and top-k</li>
 *   <li><b>artifact</b> - output directory and mention weight</li>
 *   <li><b>batch</b> - parallelism across documents</li>
 * </ul>
 *
 * <h2>Example Configuration:</h2>
 * <pre>{@code
 * kgraph.segment.sentences-per-segment=5
 * kgraph.id.mode=deterministic
 * kgraph.id.seed=0
 * kgraph.artifact.output-dir=./out
 * }</pre>
 */
@ConfigMapping(prefix = "kgraph")
public interface IngestionConfig {

    Segment segment();

    Id id();

    Extraction extraction();

    Classification classification();

    Artifact artifact();

    Batch batch();

    /**
     * Validates configuration at startup.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        if (segment().sentencesPerSegment() < 1) {
            throw new IllegalArgumentException(
                String.format("Sentences per segment must be positive, got %d", segment().sentencesPerSegment())
            );
        }
        try {
            Pattern.compile(segment().boundaryPattern());
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException(
                String.format("Invalid sentence boundary pattern '%s': %s", segment().boundaryPattern(), e.getDescription())
            );
        }
        if (id().prefixLength() < 4 || id().prefixLength() > 32) {
            throw new IllegalArgumentException(
                String.format("Identifier prefix length must be in [4, 32], got %d", id().prefixLength())
            );
        }
        if (id().maxPerMillisecond() < 1) {
            throw new IllegalArgumentException(
                String.format("Max identifiers per millisecond must be positive, got %d", id().maxPerMillisecond())
            );
        }
        if (id().seed() < 0) {
            throw new IllegalArgumentException(
                String.format("Deterministic seed must be non-negative, got %d", id().seed())
            );
        }
        if (extraction().termsPerSentence() < 1 || extraction().keyTermsPerSegment() < 1) {
            throw new IllegalArgumentException("Term extraction limits must be positive");
        }
        if (classification().topK() < 1) {
            throw new IllegalArgumentException(
                String.format("Classification top-k must be positive, got %d", classification().topK())
            );
        }
        if (artifact().mentionWeight() < 0.0) {
            throw new IllegalArgumentException(
                String.format("Mention weight must be non-negative, got %.3f", artifact().mentionWeight())
            );
        }
        if (batch().parallelism() < 1) {
            throw new IllegalArgumentException(
                String.format("Batch parallelism must be positive, got %d", batch().parallelism())
            );
        }
    }

    /**
     * Segmentation configuration.
     */
    interface Segment {
        /**
         * Number of consecutive sentences grouped into one segment.
         * Default: 5
         */
        @WithName("sentences-per-segment")
        @WithDefault("5")
        @Min(1)
        int sentencesPerSegment();

        /**
         * Regular expression matching sentence-final punctuation, Latin and CJK.
         */
        @WithName("boundary-pattern")
        @WithDefault("[。．.!?！？]+")
        String boundaryPattern();
    }

    /**
     * Identifier allocation configuration.
     */
    interface Id {
        /**
         * wall-clock: unique per run. deterministic: same input and seed give the same identifiers.
         * Default: wall-clock
         */
        @WithDefault("wall-clock")
        AllocationMode mode();

        /**
         * Value used in place of the timestamp in deterministic mode.
         * Default: 0
         */
        @WithDefault("0")
        long seed();

        /**
         * Width of the context-derived prefix.
         * Default: 12
         */
        @WithName("prefix-length")
        @WithDefault("12")
        @Min(4)
        @Max(32)
        int prefixLength();

        /**
         * Identifiers that may be issued within a single millisecond in wall-clock mode.
         * Default: 999999
         */
        @WithName("max-per-millisecond")
        @WithDefault("999999")
        @Min(1)
        @Max(999999)
        int maxPerMillisecond();
    }

    /**
     * Salient term extraction configuration.
     */
    interface Extraction {
        @WithName("terms-per-sentence")
        @WithDefault("3")
        @Min(1)
        int termsPerSentence();

        @WithName("key-terms-per-segment")
        @WithDefault("5")
        @Min(1)
        int keyTermsPerSegment();

        /**
         * Minimum length of alphanumeric and Katakana terms.
         */
        @WithName("min-term-length")
        @WithDefault("3")
        @Min(1)
        int minTermLength();

        /**
         * Minimum length of Han (ideograph) terms. A single ideograph is a word.
         */
        @WithName("min-cjk-term-length")
        @WithDefault("1")
        @Min(1)
        int minCjkTermLength();

        /**
         * Terms never extracted, compared case-folded.
         */
        @WithDefault("the,and,for,are,with,that,this,from,have,has,were,was,been,their,which,such,into,there,here,also,these,some,when,than,then,over,under,while,each,other,they,them,our,your,what,where,who,will,shall,would,could,should")
        List<String> stopwords();
    }

    /**
     * Taxonomy configuration.
     */
    interface Classification {
        @WithName("top-k")
        @WithDefault("3")
        @Min(1)
        int topK();

        /**
         * Classpath resource holding the NDC table.
         */
        @WithName("ndc-resource")
        @WithDefault("taxonomies/ndc.json")
        String ndcResource();

        /**
         * Classpath resource holding the Kindle genre table.
         */
        @WithName("kindle-resource")
        @WithDefault("taxonomies/kindle.json")
        String kindleResource();
    }

    /**
     * Artifact output configuration.
     */
    interface Artifact {
        @WithName("output-dir")
        @WithDefault("./out")
        String outputDir();

        @WithName("source-type")
        @WithDefault("local")
        String sourceType();

        /**
         * Fixed relevance weight of every mention.
         */
        @WithName("mention-weight")
        @WithDefault("1.0")
        double mentionWeight();

        /**
         * Hand written artifacts to a GraphScriptApplier when one is deployed.
         */
        @WithDefault("false")
        boolean apply();

        /**
         * Prepend uniqueness constraints on baseId for every node label.
         */
        @WithName("emit-constraints")
        @WithDefault("true")
        boolean emitConstraints();
    }

    /**
     * Batch configuration.
     */
    interface Batch {
        /**
         * Documents processed concurrently.
         * Default: 1
         */
        @WithDefault("1")
        @Min(1)
        int parallelism();
    }
}
