package br.edu.ifba.kgraph.export;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered statements that recreate a document's graph: constraints, then nodes,
 * then relationships. Every statement uses {@code MERGE}, so replaying a script
 * leaves the graph unchanged.
 */
public final class CreationScript {

    private final List<ScriptStatement> statements;

    public CreationScript(@NotNull List<ScriptStatement> statements) {
        this.statements = List.copyOf(Objects.requireNonNull(statements, "statements must not be null"));
    }

    @NotNull
    public List<ScriptStatement> getStatements() {
        return statements;
    }

    @NotNull
    public List<ScriptStatement> statementsOf(@NotNull StatementKind kind) {
        return statements.stream().filter(s -> s.kind() == kind).collect(Collectors.toList());
    }

    public int size() {
        return statements.size();
    }

    @Override
    public String toString() {
        return "CreationScript{" +
                "constraints=" + statementsOf(StatementKind.CONSTRAINT).size() +
                ", nodes=" + statementsOf(StatementKind.NODE).size() +
                ", relationships=" + statementsOf(StatementKind.RELATIONSHIP).size() +
                '}';
    }
}
