package br.edu.ifba.kgraph.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One parameterized Cypher statement.
 *
 * @param kind       script section
 * @param cypher     statement text referencing parameters as {@code $name}
 * @param parameters parameter values in rendering order
 */
public record ScriptStatement(
    @JsonProperty("kind") @NotNull StatementKind kind,
    @JsonProperty("cypher") @NotNull String cypher,
    @JsonProperty("parameters") @NotNull Map<String, Object> parameters
) {

    public ScriptStatement {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(cypher, "cypher must not be null");
        parameters = parameters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
            : Collections.emptyMap();
    }
}
