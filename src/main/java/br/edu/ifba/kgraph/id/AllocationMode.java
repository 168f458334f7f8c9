package br.edu.ifba.kgraph.id;

/**
 * How the time component of an identifier is produced.
 */
public enum AllocationMode {

    /**
     * Millisecond wall clock. Re-ingesting a document yields a fresh identifier set.
     */
    WALL_CLOCK,

    /**
     * Configured seed in place of the clock, counter restarted per document.
     * Byte-identical input yields byte-identical identifiers.
     */
    DETERMINISTIC
}
