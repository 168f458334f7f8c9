package br.edu.ifba.kgraph.classify;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A static classification table. Category order is the declaration order used to
 * break score ties.
 *
 * @param name       taxonomy name, used as the tag catalog label in the graph
 * @param categories categories in declaration order
 */
public record Taxonomy(
    @JsonProperty("name") @NotNull String name,
    @JsonProperty("categories") @NotNull List<TaxonomyCategory> categories
) {

    public Taxonomy {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(categories, "categories must not be null");
        if (categories.isEmpty()) {
            throw new IllegalArgumentException("Taxonomy '" + name + "' has no categories");
        }
        Set<String> codes = new HashSet<>();
        for (TaxonomyCategory category : categories) {
            if (!codes.add(category.code())) {
                throw new IllegalArgumentException(
                    String.format("Taxonomy '%s' declares category '%s' twice", name, category.code())
                );
            }
        }
        categories = List.copyOf(categories);
    }

    public int size() {
        return categories.size();
    }
}
