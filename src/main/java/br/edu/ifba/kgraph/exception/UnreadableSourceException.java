package br.edu.ifba.kgraph.exception;

/**
 * Thrown when the source of a document cannot be read.
 */
public class UnreadableSourceException extends IngestionException {

    private static final long serialVersionUID = 1L;

    public UnreadableSourceException(String message, Throwable cause) {
        super(ErrorCategory.INPUT, message, cause);
    }
}
