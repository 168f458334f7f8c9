package br.edu.ifba.kgraph.graph;

import br.edu.ifba.kgraph.export.WrittenArtifact;
import org.jetbrains.annotations.NotNull;

/**
 * Loads a written artifact into a graph store.
 *
 * <p>No implementation ships with the pipeline: the store and its driver live
 * outside it. When a bean of this type is deployed and {@code kgraph.artifact.apply}
 * is true, the batch driver hands it every artifact it has written.</p>
 *
 * <h2>Contract:</h2>
 * <ul>
 *   <li>MUST be safe to call again with the same artifact (scripts only MERGE)</li>
 *   <li>MUST signal failure with {@link GraphApplyException}</li>
 *   <li>MAY be called concurrently for different documents</li>
 * </ul>
 */
public interface GraphScriptApplier {

    /**
     * Applies the artifact's creation script to the store.
     *
     * @param artifact files of the artifact, including the Cypher script
     * @throws GraphApplyException if the store rejects the script
     */
    void apply(@NotNull WrittenArtifact artifact);
}
