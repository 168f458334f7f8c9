package br.edu.ifba.kgraph.export;

import br.edu.ifba.kgraph.core.IngestionConfig;
import br.edu.ifba.kgraph.exception.ArtifactWriteException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Writes artifacts to {@code <outputDir>/<documentId>.<extension>}, one file per exporter.
 *
 * <p>An artifact is committed as a unit. Every format is first exported to a temporary
 * file in the target directory. Only when all exports succeed are the temporary files
 * moved over the previous artifact. If any export or move fails, files already moved
 * by the call are rolled back to their previous version (or removed when there was
 * none) and every temporary file is deleted.</p>
 */
@ApplicationScoped
public class ArtifactWriter {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactWriter.class);

    private final List<GraphArtifactExporter> exporters;
    private final Path outputDir;

    @Inject
    public ArtifactWriter(Instance<GraphArtifactExporter> exporterInstances, IngestionConfig config) {
        this(collect(exporterInstances), Paths.get(config.artifact().outputDir()));
    }

    public ArtifactWriter(@NotNull List<GraphArtifactExporter> exporters, @NotNull Path outputDir) {
        if (exporters.isEmpty()) {
            throw new IllegalArgumentException("At least one exporter is required");
        }
        List<GraphArtifactExporter> sorted = new ArrayList<>(exporters);
        sorted.sort(Comparator.comparing(GraphArtifactExporter::getFormat));
        this.exporters = List.copyOf(sorted);
        this.outputDir = outputDir;
    }

    private static List<GraphArtifactExporter> collect(Instance<GraphArtifactExporter> instances) {
        List<GraphArtifactExporter> list = new ArrayList<>();
        for (GraphArtifactExporter exporter : instances) {
            list.add(exporter);
        }
        return list;
    }

    @NotNull
    public Path getOutputDir() {
        return outputDir;
    }

    /**
     * Writes an artifact to the configured output directory.
     *
     * @throws ArtifactWriteException if any file cannot be written
     */
    @NotNull
    public WrittenArtifact write(@NotNull GraphArtifact artifact) {
        return write(artifact, outputDir);
    }

    /**
     * Writes an artifact to the given directory, creating it if needed.
     *
     * @throws ArtifactWriteException if any file cannot be written
     */
    @NotNull
    public WrittenArtifact write(@NotNull GraphArtifact artifact, @NotNull Path directory) {
        String documentId = artifact.documentId();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ArtifactWriteException("Cannot create output directory " + directory, e);
        }

        List<StagedFile> staged = new ArrayList<>(exporters.size());
        boolean committed = false;
        try {
            for (GraphArtifactExporter exporter : exporters) {
                staged.add(stage(exporter, artifact, directory.resolve(documentId + "." + exporter.getFileExtension())));
            }
            for (StagedFile file : staged) {
                commit(file);
            }
            committed = true;
        } catch (IOException e) {
            throw new ArtifactWriteException("Failed to write artifact " + documentId + " to " + directory, e);
        } finally {
            if (!committed) {
                rollback(documentId, staged);
            }
            for (StagedFile file : staged) {
                if (file.temp != null) {
                    discard(file.temp);
                }
                if (committed && file.backup != null) {
                    discard(file.backup);
                }
            }
        }

        Map<ArtifactFormat, Path> files = new EnumMap<>(ArtifactFormat.class);
        for (StagedFile file : staged) {
            files.put(file.format, file.target);
        }
        logger.info("Wrote artifact {} to {} ({} files)", documentId, directory, files.size());
        return new WrittenArtifact(artifact, files);
    }

    private StagedFile stage(GraphArtifactExporter exporter, GraphArtifact artifact, Path target) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        boolean exported = false;
        try {
            try (OutputStream os = Files.newOutputStream(temp)) {
                exporter.export(artifact, os);
            }
            exported = true;
        } finally {
            if (!exported) {
                discard(temp);
            }
        }
        return new StagedFile(exporter.getFormat(), target, temp);
    }

    private void commit(StagedFile file) throws IOException {
        if (Files.exists(file.target)) {
            Path backup = Files.createTempFile(file.target.getParent(), "." + file.target.getFileName(), ".bak");
            try {
                move(file.target, backup);
            } catch (IOException e) {
                discard(backup);
                throw e;
            }
            file.backup = backup;
        }
        move(file.temp, file.target);
        file.temp = null;
        file.committed = true;
        logger.debug("Replaced {}", file.target);
    }

    private void rollback(String documentId, List<StagedFile> staged) {
        for (StagedFile file : staged) {
            try {
                if (file.committed) {
                    Files.deleteIfExists(file.target);
                }
                if (file.backup != null) {
                    move(file.backup, file.target);
                    file.backup = null;
                }
            } catch (IOException e) {
                logger.warn("Could not roll back {} for artifact {}: {}", file.target, documentId, e.getMessage());
            }
        }
    }

    private static void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warn("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * One exported format waiting to be moved into place.
     */
    private static final class StagedFile {

        private final ArtifactFormat format;
        private final Path target;
        private Path temp;
        private Path backup;
        private boolean committed;

        StagedFile(ArtifactFormat format, Path target, Path temp) {
            this.format = format;
            this.target = target;
            this.temp = temp;
        }
    }
}
