package br.edu.ifba.kgraph.classify;

/**
 * Granularity of a classification run. Decides how loudly fallbacks are reported.
 */
public enum ClassificationScope {
    DOCUMENT,
    SENTENCE,
    ENTITY
}
