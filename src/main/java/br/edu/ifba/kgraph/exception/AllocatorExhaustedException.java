package br.edu.ifba.kgraph.exception;

/**
 * Thrown when an identifier allocator cannot issue another unique identifier.
 *
 * <p>Not recoverable within the current document: continuing would silently
 * reuse a (timestamp, counter) pair.</p>
 */
public class AllocatorExhaustedException extends IngestionException {

    private static final long serialVersionUID = 1L;

    private final long timestamp;
    private final long counter;

    public AllocatorExhaustedException(long timestamp, long counter) {
        super(ErrorCategory.ALLOCATOR,
            String.format("Identifier allocator exhausted at timestamp %d (counter %d)", timestamp, counter));
        this.timestamp = timestamp;
        this.counter = counter;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public long getCounter() {
        return counter;
    }
}
