package br.edu.ifba.kgraph.batch;

import br.edu.ifba.kgraph.core.IngestionConfig;
import br.edu.ifba.kgraph.core.IngestionPipeline;
import br.edu.ifba.kgraph.core.IngestionRequest;
import br.edu.ifba.kgraph.exception.IngestionException;
import br.edu.ifba.kgraph.export.ArtifactWriter;
import br.edu.ifba.kgraph.export.GraphArtifact;
import br.edu.ifba.kgraph.export.WrittenArtifact;
import br.edu.ifba.kgraph.graph.GraphScriptApplier;
import br.edu.ifba.kgraph.id.IdAllocator;
import br.edu.ifba.kgraph.id.IdAllocatorFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Ingests many documents, writing one artifact per document.
 *
 * <p>Failures are isolated: a document that fails is recorded in the report and
 * the batch continues. Documents run on a fixed pool of
 * {@code kgraph.batch.parallelism} threads; each document's sentences are still
 * processed in order on a single thread.</p>
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li>{@code kgraph.document} - title or path of the document being processed</li>
 * </ul>
 */
@ApplicationScoped
public class BatchIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(BatchIngestionService.class);

    static final String MDC_DOCUMENT = "kgraph.document";

    private final IngestionPipeline pipeline;
    private final ArtifactWriter writer;
    private final IdAllocatorFactory allocatorFactory;
    private final GraphScriptApplier applier;
    private final int parallelism;
    private final Clock clock;

    @Inject
    public BatchIngestionService(
            IngestionPipeline pipeline,
            ArtifactWriter writer,
            IdAllocatorFactory allocatorFactory,
            Instance<GraphScriptApplier> appliers,
            IngestionConfig config,
            Clock clock) {
        this(pipeline, writer, allocatorFactory, resolveApplier(appliers, config), config.batch().parallelism(), clock);
    }

    public BatchIngestionService(
            @NotNull IngestionPipeline pipeline,
            @NotNull ArtifactWriter writer,
            @NotNull IdAllocatorFactory allocatorFactory,
            @Nullable GraphScriptApplier applier,
            int parallelism,
            @NotNull Clock clock) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive, got: " + parallelism);
        }
        this.pipeline = pipeline;
        this.writer = writer;
        this.allocatorFactory = allocatorFactory;
        this.applier = applier;
        this.parallelism = parallelism;
        this.clock = clock;
    }

    private static GraphScriptApplier resolveApplier(Instance<GraphScriptApplier> appliers, IngestionConfig config) {
        if (!config.artifact().apply()) {
            return null;
        }
        if (appliers.isUnsatisfied()) {
            logger.warn("kgraph.artifact.apply is enabled but no GraphScriptApplier is deployed; artifacts will only be written");
            return null;
        }
        if (appliers.isAmbiguous()) {
            throw new IllegalStateException("Multiple GraphScriptApplier implementations found; deploy exactly one");
        }
        return appliers.get();
    }

    /**
     * Ingests in-memory documents.
     *
     * @param requests documents in the order they should be reported
     * @return one outcome per request, in input order
     */
    @NotNull
    public BatchIngestionReport ingestAll(@NotNull List<IngestionRequest> requests) {
        List<Source> sources = new ArrayList<>(requests.size());
        for (IngestionRequest request : requests) {
            sources.add(new Source(request.getTitle(), () -> request));
        }
        return run(sources);
    }

    /**
     * Ingests UTF-8 text files. A file that cannot be read fails on its own.
     *
     * @param paths files in the order they should be reported
     * @return one outcome per file, in input order
     */
    @NotNull
    public BatchIngestionReport ingestFiles(@NotNull List<Path> paths) {
        List<Source> sources = new ArrayList<>(paths.size());
        for (Path path : paths) {
            sources.add(new Source(path.toString(), () -> IngestionRequest.fromFile(path)));
        }
        return run(sources);
    }

    private BatchIngestionReport run(List<Source> sources) {
        long startedAt = clock.millis();
        logger.info("Starting batch of {} documents (parallelism={})", sources.size(), parallelism);

        Supplier<IdAllocator> scope = allocatorFactory.batchScope();
        List<DocumentOutcome> outcomes = new ArrayList<>(sources.size());

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(1, sources.size())));
        try {
            List<CompletableFuture<DocumentOutcome>> futures = new ArrayList<>(sources.size());
            for (Source source : sources) {
                futures.add(CompletableFuture.supplyAsync(() -> process(source, scope), executor));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<DocumentOutcome> future : futures) {
                outcomes.add(future.join());
            }
        } finally {
            executor.shutdown();
        }

        BatchIngestionReport report = new BatchIngestionReport(outcomes, clock.millis() - startedAt);
        logger.info("Batch finished: {} succeeded, {} failed in {} ms",
            report.successCount(), report.failureCount(), report.elapsedMs());
        return report;
    }

    private DocumentOutcome process(Source source, Supplier<IdAllocator> scope) {
        MDC.put(MDC_DOCUMENT, source.label());
        WrittenArtifact written = null;
        try {
            IngestionRequest request = source.request().get();
            GraphArtifact artifact = pipeline.ingest(request, scope.get());
            written = writer.write(artifact);

            boolean applied = false;
            if (applier != null) {
                applier.apply(written);
                applied = true;
                logger.info("Applied artifact {} to graph store", artifact.documentId());
            }
            return DocumentOutcome.success(source.label(), written, applied);
        } catch (IngestionException e) {
            logger.warn("Document '{}' failed ({}): {}", source.label(), e.getCategory(), e.getMessage());
            return DocumentOutcome.failure(source.label(), written, e.getCategory(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Document '{}' failed unexpectedly", source.label(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            return DocumentOutcome.failure(source.label(), written, null, message);
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }

    private record Source(String label, Supplier<IngestionRequest> request) {}
}
