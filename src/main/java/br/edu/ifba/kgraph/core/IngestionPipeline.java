package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.classify.ClassificationResult;
import br.edu.ifba.kgraph.classify.ClassificationScope;
import br.edu.ifba.kgraph.classify.ClassifierFusion;
import br.edu.ifba.kgraph.classify.ConceptWeights;
import br.edu.ifba.kgraph.export.GraphArtifact;
import br.edu.ifba.kgraph.export.GraphArtifactBuilder;
import br.edu.ifba.kgraph.id.IdAllocator;
import br.edu.ifba.kgraph.id.IdAllocatorFactory;
import br.edu.ifba.kgraph.registry.EntityRegistry;
import br.edu.ifba.kgraph.registry.KeywordExtractor;
import br.edu.ifba.kgraph.registry.TermEnricher;
import br.edu.ifba.kgraph.segment.SegmentationResult;
import br.edu.ifba.kgraph.segment.Segmenter;
import br.edu.ifba.kgraph.utils.HashUtil;
import br.edu.ifba.kgraph.utils.TokenUtil;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one document through every stage and returns its validated graph artifact.
 *
 * <h2>Stages</h2>
 * <ol>
 *   <li>Segmentation into sentences and fixed-size segments</li>
 *   <li>Document classification and fingerprinting</li>
 *   <li>Per segment: identifier, key terms; per sentence: identifier, concept weights, entity registration</li>
 *   <li>Artifact assembly with referential-integrity validation</li>
 * </ol>
 *
 * <p>Sentences are processed strictly in document order. Nothing is written here;
 * see {@link br.edu.ifba.kgraph.export.ArtifactWriter}.</p>
 */
@ApplicationScoped
public class IngestionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(IngestionPipeline.class);

    private final Segmenter segmenter;
    private final KeywordExtractor keywordExtractor;
    private final ClassifierFusion classifier;
    private final TermEnricher termEnricher;
    private final LanguageDetector languageDetector;
    private final GraphArtifactBuilder artifactBuilder;
    private final IdAllocatorFactory allocatorFactory;
    private final IngestionConfig config;
    private final Clock clock;

    @Inject
    public IngestionPipeline(
            Segmenter segmenter,
            KeywordExtractor keywordExtractor,
            ClassifierFusion classifier,
            TermEnricher termEnricher,
            LanguageDetector languageDetector,
            GraphArtifactBuilder artifactBuilder,
            IdAllocatorFactory allocatorFactory,
            IngestionConfig config,
            Clock clock) {
        this.segmenter = segmenter;
        this.keywordExtractor = keywordExtractor;
        this.classifier = classifier;
        this.termEnricher = termEnricher;
        this.languageDetector = languageDetector;
        this.artifactBuilder = artifactBuilder;
        this.allocatorFactory = allocatorFactory;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Ingests a document with a fresh allocator.
     */
    @NotNull
    public GraphArtifact ingest(@NotNull IngestionRequest request) {
        return ingest(request, allocatorFactory.newAllocator());
    }

    /**
     * Ingests a document with the given allocator.
     *
     * @param request   document and optional embedding handles
     * @param allocator allocator scoped to the current batch or document
     * @return validated artifact
     * @throws br.edu.ifba.kgraph.exception.EmptyInputException if the text has no sentences
     * @throws br.edu.ifba.kgraph.exception.AllocatorExhaustedException if identifiers run out
     * @throws br.edu.ifba.kgraph.exception.ReferentialIntegrityException if the model is inconsistent
     */
    @NotNull
    public GraphArtifact ingest(@NotNull IngestionRequest request, @NotNull IdAllocator allocator) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(allocator, "allocator must not be null");
        long startedAt = clock.millis();
        String text = request.getText();

        SegmentationResult segmentation = segmenter.segment(text);

        String fingerprint = HashUtil.sha256Hex(text);
        ClassificationResult documentClass = classifier.classify(text, ClassificationScope.DOCUMENT);
        String documentId = allocator.documentId(request.getTitle(), request.getSourcePath(), fingerprint);

        EntityRegistry registry = new EntityRegistry(
            allocator, classifier, termEnricher, request.getEntityEmbeddings(), config.artifact().mentionWeight());

        List<Segment> segments = new ArrayList<>(segmentation.segmentCount());
        List<Sentence> sentences = new ArrayList<>(segmentation.sentenceCount());

        for (int segmentIndex = 0; segmentIndex < segmentation.segmentCount(); segmentIndex++) {
            String segmentId = allocator.segmentId(documentId, segmentIndex);
            List<String> texts = segmentation.sentencesOf(segmentIndex);
            List<Integer> ordinals = segmentation.segments().get(segmentIndex);

            List<String> keyTerms = keywordExtractor.extract(
                String.join(" ", texts), config.extraction().keyTermsPerSegment());

            List<String> sentenceIds = new ArrayList<>(texts.size());
            for (int local = 0; local < texts.size(); local++) {
                String sentenceText = texts.get(local);
                int order = ordinals.get(local);
                String sentenceId = allocator.sentenceId(segmentId, local);
                sentenceIds.add(sentenceId);

                ConceptWeights weights = classifier.conceptWeights(sentenceText, ClassificationScope.SENTENCE);
                sentences.add(new Sentence(sentenceId, order, segmentId, weights, request.sentenceEmbedding(order)));

                for (String term : keywordExtractor.extract(sentenceText, config.extraction().termsPerSentence())) {
                    registry.register(sentenceId, term);
                }
            }
            segments.add(new Segment(segmentId, segmentIndex, keyTerms, sentenceIds));
        }

        DocumentInfo document = DocumentInfo.builder()
            .documentId(documentId)
            .title(request.getTitle())
            .sourcePath(request.getSourcePath())
            .sourceType(config.artifact().sourceType())
            .fingerprint(fingerprint)
            .ingestedAt(startedAt)
            .language(languageDetector.detect(text).language())
            .tokenCountHint(TokenUtil.estimateTokens(text))
            .ndc(documentClass.ndc())
            .kindle(documentClass.kindle())
            .conceptWeights(documentClass.conceptWeights())
            .build();

        GraphArtifact artifact = artifactBuilder.build(
            document, segments, sentences, registry.entities(), registry.mentions());

        logger.info("Ingested '{}' as {}: {} segments, {} sentences, {} entities, {} mentions",
            request.getTitle(), documentId, segments.size(), sentences.size(), registry.size(),
            registry.mentions().size());
        return artifact;
    }
}
