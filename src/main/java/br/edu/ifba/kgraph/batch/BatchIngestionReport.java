package br.edu.ifba.kgraph.batch;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-document outcomes of a batch run, in input order.
 *
 * @param outcomes  one outcome per input
 * @param elapsedMs wall-clock duration of the batch
 */
public record BatchIngestionReport(@NotNull List<DocumentOutcome> outcomes, long elapsedMs) {

    public BatchIngestionReport {
        outcomes = List.copyOf(outcomes);
    }

    @NotNull
    public List<DocumentOutcome> succeeded() {
        return outcomes.stream().filter(DocumentOutcome::succeeded).collect(Collectors.toList());
    }

    @NotNull
    public List<DocumentOutcome> failed() {
        return outcomes.stream().filter(o -> !o.succeeded()).collect(Collectors.toList());
    }

    public int successCount() {
        return (int) outcomes.stream().filter(DocumentOutcome::succeeded).count();
    }

    public int failureCount() {
        return outcomes.size() - successCount();
    }

    public boolean allSucceeded() {
        return failureCount() == 0;
    }
}
