package br.edu.ifba.kgraph.export;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Serializes a graph artifact to one file format.
 *
 * <h2>Contract:</h2>
 * <ul>
 *   <li>MUST write the whole artifact or throw</li>
 *   <li>MUST NOT close the output stream (caller responsibility)</li>
 *   <li>MUST be deterministic: the same artifact yields the same bytes</li>
 * </ul>
 *
 * @see ArtifactWriter
 */
public interface GraphArtifactExporter {

    /**
     * Writes the artifact to the stream.
     *
     * @param artifact     validated artifact
     * @param outputStream destination, left open
     * @throws IOException if writing fails
     */
    void export(@NotNull GraphArtifact artifact, @NotNull OutputStream outputStream) throws IOException;

    /**
     * Gets the format this exporter produces.
     */
    @NotNull
    ArtifactFormat getFormat();

    /**
     * Gets the file extension, without dot.
     */
    default String getFileExtension() {
        return getFormat().getExtension();
    }
}
