package br.edu.ifba.kgraph.graph;

import br.edu.ifba.kgraph.exception.ErrorCategory;
import br.edu.ifba.kgraph.exception.IngestionException;

/**
 * Thrown by a {@link GraphScriptApplier} when the store rejects an artifact.
 * The artifact files remain on disk and can be applied again.
 */
public class GraphApplyException extends IngestionException {

    private static final long serialVersionUID = 1L;

    public GraphApplyException(String message, Throwable cause) {
        super(ErrorCategory.OUTPUT, message, cause);
    }

    public GraphApplyException(String message) {
        super(ErrorCategory.OUTPUT, message);
    }
}
