package br.edu.ifba.kgraph.exception;

/**
 * Failure classes of the ingestion pipeline.
 *
 * <p>Every category is local to one document: a batch run records the failure
 * and moves on to the next document.</p>
 */
public enum ErrorCategory {

    /** Empty, malformed or unreadable input. Nothing is written. */
    INPUT,

    /** Identifier space exhausted; uniqueness can no longer be guaranteed. */
    ALLOCATOR,

    /** The in-memory model violates referential integrity. Always a bug. */
    INTEGRITY,

    /** The artifact could not be written to disk. */
    OUTPUT
}
