package br.edu.ifba.kgraph.export;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Files produced for one artifact.
 *
 * @param artifact the artifact that was written
 * @param files    final path per format
 */
public record WrittenArtifact(@NotNull GraphArtifact artifact, @NotNull Map<ArtifactFormat, Path> files) {

    public WrittenArtifact {
        files = Collections.unmodifiableMap(files.isEmpty() ? Map.of() : new EnumMap<>(files));
    }

    public Path pathOf(@NotNull ArtifactFormat format) {
        return files.get(format);
    }
}
