package br.edu.ifba.kgraph.id;

import br.edu.ifba.kgraph.exception.AllocatorExhaustedException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Issues hierarchical, context-scoped identifiers for documents, segments, sentences and entities.
 *
 * <p>An allocator is an explicitly scoped object: one instance per batch in
 * {@link AllocationMode#WALL_CLOCK} mode, one per document in
 * {@link AllocationMode#DETERMINISTIC} mode (see {@link IdAllocatorFactory}).
 * The (timestamp, counter) pair never repeats within one instance. All allocation
 * goes through a single lock, so one instance can be shared by concurrent documents.</p>
 *
 * <h2>Parent contexts:</h2>
 * <ul>
 *   <li>document: {@code work_<title>_<sourcePath>} (plus the fingerprint in deterministic mode)</li>
 *   <li>segment: {@code segment_<documentId>_<n>}</li>
 *   <li>sentence: {@code sentence_<segmentId>_<n>}</li>
 *   <li>entity: {@code entity_<sentenceId>_<type>_<n>}</li>
 * </ul>
 */
public final class IdAllocator {

    private static final Logger logger = LoggerFactory.getLogger(IdAllocator.class);

    /** Largest value representable in the six-digit counter field. */
    static final long MAX_COUNTER = 999_999L;

    private final AllocationMode mode;
    private final Clock clock;
    private final long seed;
    private final int prefixLength;
    private final long maxPerMillisecond;

    private final ReentrantLock lock = new ReentrantLock();
    private long lastTimestamp = -1L;
    private long counter = -1L;
    private long issued;

    private IdAllocator(
            @NotNull AllocationMode mode,
            @Nullable Clock clock,
            long seed,
            int prefixLength,
            long maxPerMillisecond) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.clock = clock;
        this.seed = seed;
        this.prefixLength = prefixLength;
        this.maxPerMillisecond = maxPerMillisecond;
    }

    /**
     * Creates an allocator stamping identifiers with the given clock.
     *
     * @param clock source of millisecond timestamps
     * @param prefixLength width of the context prefix
     * @param maxPerMillisecond identifiers allowed within one millisecond
     * @return new allocator
     */
    public static IdAllocator wallClock(@NotNull Clock clock, int prefixLength, int maxPerMillisecond) {
        Objects.requireNonNull(clock, "clock must not be null");
        if (maxPerMillisecond < 1 || maxPerMillisecond > MAX_COUNTER) {
            throw new IllegalArgumentException("maxPerMillisecond must be in [1, " + MAX_COUNTER + "], got: " + maxPerMillisecond);
        }
        return new IdAllocator(AllocationMode.WALL_CLOCK, clock, 0L, prefixLength, maxPerMillisecond);
    }

    /**
     * Creates an allocator that reproduces the same identifiers for the same input.
     *
     * @param seed value written in place of the timestamp
     * @param prefixLength width of the context prefix
     * @return new allocator
     */
    public static IdAllocator deterministic(long seed, int prefixLength) {
        if (seed < 0) {
            throw new IllegalArgumentException("seed must be non-negative, got: " + seed);
        }
        return new IdAllocator(AllocationMode.DETERMINISTIC, null, seed, prefixLength, MAX_COUNTER + 1);
    }

    @NotNull
    public AllocationMode getMode() {
        return mode;
    }

    /**
     * Number of identifiers issued so far.
     */
    public long issued() {
        lock.lock();
        try {
            return issued;
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    public String documentId(@NotNull String title, @Nullable String sourcePath, @NotNull String fingerprint) {
        String context = "work_" + title + "_" + (sourcePath != null ? sourcePath : "");
        if (mode == AllocationMode.DETERMINISTIC) {
            context = context + "_" + fingerprint;
        }
        return allocate(context, IdKind.DOCUMENT, 0, null);
    }

    @NotNull
    public String segmentId(@NotNull String documentId, int segmentIndex) {
        return allocate("segment_" + documentId + "_" + segmentIndex, IdKind.SEGMENT, segmentIndex, null);
    }

    @NotNull
    public String sentenceId(@NotNull String segmentId, int sentenceIndex) {
        return allocate("sentence_" + segmentId + "_" + sentenceIndex, IdKind.SENTENCE, sentenceIndex, null);
    }

    @NotNull
    public String entityId(@NotNull String sentenceId, @NotNull String entityType, int entityIndex) {
        String context = "entity_" + sentenceId + "_" + entityType + "_" + entityIndex;
        return allocate(context, IdKind.ENTITY, entityIndex, typeTag(entityType));
    }

    /**
     * Allocates an identifier for an arbitrary parent context.
     *
     * @param parentContext short string uniquely describing the logical parent
     * @param kind hierarchy level of the new identifier
     * @param localIndex index within the parent
     * @param typeTag entity type tag, required for entities and forbidden otherwise
     * @return the identifier string
     * @throws AllocatorExhaustedException if no unique (timestamp, counter) pair is left
     */
    @NotNull
    public String allocate(@NotNull String parentContext, @NotNull IdKind kind, int localIndex, @Nullable String typeTag) {
        Objects.requireNonNull(parentContext, "parentContext must not be null");
        String prefix = ContextPrefix.of(parentContext, prefixLength);

        long timestamp;
        long sequence;
        lock.lock();
        try {
            if (mode == AllocationMode.WALL_CLOCK) {
                long now = clock.millis();
                if (now > lastTimestamp) {
                    lastTimestamp = now;
                    counter = 0;
                } else {
                    // Same millisecond, or a clock that moved backwards: stay on the last timestamp
                    if (counter + 1 >= maxPerMillisecond) {
                        logger.error("Identifier allocator exhausted: {} ids within millisecond {}", counter + 1, lastTimestamp);
                        throw new AllocatorExhaustedException(lastTimestamp, counter + 1);
                    }
                    counter++;
                }
            } else {
                if (counter + 1 > MAX_COUNTER) {
                    logger.error("Deterministic identifier allocator exhausted after {} ids (seed={})", issued, seed);
                    throw new AllocatorExhaustedException(seed, counter + 1);
                }
                lastTimestamp = seed;
                counter++;
            }
            timestamp = lastTimestamp;
            sequence = counter;
            issued++;
        } finally {
            lock.unlock();
        }

        return new ParsedId(prefix, timestamp, sequence, kind, localIndex, typeTag).format();
    }

    /**
     * Short, separator-free tag derived from an entity type: its first three letters or digits, lower-cased.
     */
    @NotNull
    static String typeTag(@NotNull String entityType) {
        String cleaned = entityType.toLowerCase(Locale.ROOT).replaceAll("[^\\p{Alnum}]", "");
        if (cleaned.isEmpty()) {
            return "unk";
        }
        return cleaned.length() > 3 ? cleaned.substring(0, 3) : cleaned;
    }
}
