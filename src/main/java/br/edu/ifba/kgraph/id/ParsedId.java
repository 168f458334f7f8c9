package br.edu.ifba.kgraph.id;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Comparator;

/**
 * Components of an allocated identifier.
 *
 * <p>Layout: {@code <prefix>_<timestamp>_<counter>_<kind><local>[_<typeTag>]}, for example
 * {@code A1b2C3d4E5f6_1723862400123_000042_ent0003_con}.</p>
 *
 * @param prefix context-derived hash prefix
 * @param timestamp millisecond timestamp, or the seed in deterministic mode
 * @param counter allocator counter breaking ties within one timestamp
 * @param kind hierarchy level
 * @param localIndex index of the item within its parent
 * @param typeTag short entity type tag, null for non-entity identifiers
 */
public record ParsedId(
    @NotNull String prefix,
    long timestamp,
    long counter,
    @NotNull IdKind kind,
    int localIndex,
    @Nullable String typeTag
) {

    static final String SEPARATOR = "_";

    /**
     * Orders identifiers by the moment their allocator issued them.
     */
    public static final Comparator<ParsedId> CREATION_ORDER =
        Comparator.comparingLong(ParsedId::timestamp).thenComparingLong(ParsedId::counter);

    public ParsedId {
        if (prefix == null || prefix.isEmpty() || prefix.contains(SEPARATOR)) {
            throw new IllegalArgumentException("prefix must be non-empty and free of '_': " + prefix);
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (timestamp < 0 || counter < 0 || localIndex < 0) {
            throw new IllegalArgumentException("timestamp, counter and localIndex must be non-negative");
        }
        if (kind == IdKind.ENTITY && (typeTag == null || typeTag.isEmpty())) {
            throw new IllegalArgumentException("entity identifiers require a type tag");
        }
        if (kind != IdKind.ENTITY && typeTag != null) {
            throw new IllegalArgumentException("only entity identifiers carry a type tag");
        }
    }

    /**
     * Parses an identifier string.
     *
     * @param id identifier produced by {@link IdAllocator}
     * @return parsed components
     * @throws IllegalArgumentException if the string is not a well-formed identifier
     */
    @NotNull
    public static ParsedId parse(@NotNull String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        String[] parts = id.split(SEPARATOR, -1);
        if (parts.length != 4 && parts.length != 5) {
            throw new IllegalArgumentException("Malformed identifier (expected 4 or 5 parts): " + id);
        }
        if (parts[3].length() < 4) {
            throw new IllegalArgumentException("Malformed identifier kind segment: " + id);
        }
        try {
            IdKind kind = IdKind.fromCode(parts[3].substring(0, 3));
            int local = Integer.parseInt(parts[3].substring(3));
            String tag = parts.length == 5 ? parts[4] : null;
            return new ParsedId(parts[0], Long.parseLong(parts[1]), Long.parseLong(parts[2]), kind, local, tag);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed identifier numbers: " + id, e);
        }
    }

    /**
     * Renders the identifier back to its string form.
     */
    @NotNull
    public String format() {
        String base = String.format("%s_%013d_%06d_%s%04d", prefix, timestamp, counter, kind.getCode(), localIndex);
        return typeTag == null ? base : base + SEPARATOR + typeTag;
    }

    @Override
    public String toString() {
        return format();
    }
}
