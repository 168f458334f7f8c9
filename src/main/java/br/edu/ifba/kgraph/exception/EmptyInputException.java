package br.edu.ifba.kgraph.exception;

/**
 * Thrown when a document contains no sentences after segmentation.
 */
public class EmptyInputException extends IngestionException {

    private static final long serialVersionUID = 1L;

    public EmptyInputException(String message) {
        super(ErrorCategory.INPUT, message);
    }
}
