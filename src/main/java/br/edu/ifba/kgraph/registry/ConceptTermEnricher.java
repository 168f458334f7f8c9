package br.edu.ifba.kgraph.registry;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

/**
 * Types every entity as a {@code concept}.
 */
@ApplicationScoped
@DefaultBean
public class ConceptTermEnricher implements TermEnricher {

    public static final String CONCEPT = "concept";

    @Override
    @NotNull
    public String typeOf(@NotNull String label) {
        return CONCEPT;
    }
}
