package br.edu.ifba.kgraph.export;

/**
 * Section of a creation script. Sections are emitted in declaration order.
 */
public enum StatementKind {
    CONSTRAINT,
    NODE,
    RELATIONSHIP
}
