package br.edu.ifba.kgraph.classify;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Normalized score of one taxonomy category.
 *
 * @param code    category code
 * @param name    category display name
 * @param score   share of the taxonomy's keyword matches, in [0, 1]
 * @param matches raw keyword match count
 */
public record CategoryScore(
    @JsonProperty("code") @NotNull String code,
    @JsonProperty("name") @NotNull String name,
    @JsonProperty("score") double score,
    @JsonProperty("matches") int matches
) {

    public CategoryScore {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (score < 0.0 || score > 1.0 + 1e-9) {
            throw new IllegalArgumentException("score must be in [0, 1], got: " + score);
        }
        if (matches < 0) {
            throw new IllegalArgumentException("matches must be non-negative, got: " + matches);
        }
    }
}
