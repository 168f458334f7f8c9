package br.edu.ifba.kgraph.classify;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One category of a classification taxonomy: its keywords and the concept
 * sub-distribution it contributes when it is the top category of a document.
 *
 * @param code     stable category code, unique within its taxonomy
 * @param name     display name
 * @param keywords case-folded keywords, duplicates removed, declaration order kept
 * @param concepts sub-distribution by concept wire name; need not sum to 1
 */
public record TaxonomyCategory(
    @JsonProperty("code") @NotNull String code,
    @JsonProperty("name") @NotNull String name,
    @JsonProperty("keywords") @NotNull List<String> keywords,
    @JsonProperty("concepts") @NotNull Map<String, Double> concepts
) {

    public TaxonomyCategory {
        Objects.requireNonNull(code, "code must not be null");
        if (code.isBlank()) {
            throw new IllegalArgumentException("code must not be blank");
        }
        name = name != null ? name : code;

        Set<String> folded = new LinkedHashSet<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    folded.add(keyword.strip().toLowerCase(Locale.ROOT));
                }
            }
        }
        keywords = Collections.unmodifiableList(new ArrayList<>(folded));

        Map<String, Double> checked = new LinkedHashMap<>();
        if (concepts != null) {
            for (Map.Entry<String, Double> entry : concepts.entrySet()) {
                ConceptKey.fromKey(entry.getKey());
                double weight = entry.getValue() != null ? entry.getValue() : 0.0;
                if (weight < 0.0 || !Double.isFinite(weight)) {
                    throw new IllegalArgumentException(
                        String.format("Category '%s' has invalid weight %f for '%s'", code, weight, entry.getKey())
                    );
                }
                checked.put(entry.getKey(), weight);
            }
        }
        concepts = Collections.unmodifiableMap(checked);
    }

    /**
     * Number of this category's keywords contained in the token set.
     *
     * @param tokens case-folded token set of the classified text
     */
    public int countMatches(@NotNull Set<String> tokens) {
        int matches = 0;
        for (String keyword : keywords) {
            if (tokens.contains(keyword)) {
                matches++;
            }
        }
        return matches;
    }

    /**
     * Concept sub-distribution keyed by {@link ConceptKey}.
     */
    @NotNull
    public Map<ConceptKey, Double> conceptContribution() {
        Map<ConceptKey, Double> contribution = new EnumMap<>(ConceptKey.class);
        for (Map.Entry<String, Double> entry : concepts.entrySet()) {
            contribution.put(ConceptKey.fromKey(entry.getKey()), entry.getValue());
        }
        return contribution;
    }
}
