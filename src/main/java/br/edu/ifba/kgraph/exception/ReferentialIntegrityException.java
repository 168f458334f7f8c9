package br.edu.ifba.kgraph.exception;

import java.util.List;

/**
 * Thrown by the artifact builder when the in-memory model is internally inconsistent.
 *
 * <p>Common causes include:</p>
 * <ul>
 *   <li>A sentence that belongs to no segment, or to more than one</li>
 *   <li>A mention that references an unknown sentence or entity</li>
 *   <li>An identifier that would be created twice</li>
 *   <li>Non-contiguous segment ordinals</li>
 * </ul>
 */
public final class ReferentialIntegrityException extends IngestionException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public ReferentialIntegrityException(String documentId, List<String> violations) {
        super(ErrorCategory.INTEGRITY, buildMessage(documentId, violations));
        this.violations = List.copyOf(violations);
    }

    private static String buildMessage(String documentId, List<String> violations) {
        String first = violations.isEmpty() ? "unknown" : violations.get(0);
        if (violations.size() <= 1) {
            return String.format("Referential integrity violated for document '%s': %s", documentId, first);
        }
        return String.format(
            "Referential integrity violated for document '%s': %s (and %d more)",
            documentId, first, violations.size() - 1
        );
    }

    /**
     * Returns every violation found, in detection order.
     *
     * @return unmodifiable list of violation descriptions
     */
    public List<String> getViolations() {
        return violations;
    }
}
