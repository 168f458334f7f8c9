package br.edu.ifba.kgraph.registry;

import org.jetbrains.annotations.NotNull;

/**
 * Assigns a type to a newly registered entity.
 *
 * <p>Deploy a bean implementing this interface to replace the default
 * {@link ConceptTermEnricher}, e.g. with a gazetteer or an NER model.</p>
 */
public interface TermEnricher {

    /**
     * Returns the entity type for a label.
     *
     * @param label case-folded entity label
     * @return non-blank type name such as {@code concept} or {@code person}
     */
    @NotNull
    String typeOf(@NotNull String label);
}
