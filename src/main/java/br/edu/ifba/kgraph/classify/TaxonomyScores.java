package br.edu.ifba.kgraph.classify;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Scores of every category of one taxonomy.
 *
 * @param taxonomy taxonomy name
 * @param ranked   all categories, best first, declaration order on ties
 * @param uniform  true when nothing matched and every category got {@code 1/n}
 */
public record TaxonomyScores(
    @NotNull String taxonomy,
    @NotNull List<CategoryScore> ranked,
    boolean uniform
) {

    public TaxonomyScores {
        Objects.requireNonNull(taxonomy, "taxonomy must not be null");
        ranked = List.copyOf(ranked);
        if (ranked.isEmpty()) {
            throw new IllegalArgumentException("ranked must not be empty");
        }
    }

    @NotNull
    public CategoryScore top() {
        return ranked.get(0);
    }

    /**
     * The best {@code k} categories.
     */
    @NotNull
    public List<CategoryScore> topK(int k) {
        return ranked.subList(0, Math.min(k, ranked.size()));
    }
}
