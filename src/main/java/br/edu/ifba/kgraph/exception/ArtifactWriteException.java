package br.edu.ifba.kgraph.exception;

/**
 * Thrown when a graph artifact cannot be written.
 */
public class ArtifactWriteException extends IngestionException {

    private static final long serialVersionUID = 1L;

    public ArtifactWriteException(String message, Throwable cause) {
        super(ErrorCategory.OUTPUT, message, cause);
    }
}
