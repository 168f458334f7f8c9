package br.edu.ifba.kgraph.exception;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Base class for all ingestion failures.
 */
public abstract class IngestionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCategory category;

    protected IngestionException(@NotNull ErrorCategory category, String message) {
        super(message);
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    protected IngestionException(@NotNull ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    @NotNull
    public ErrorCategory getCategory() {
        return category;
    }
}
