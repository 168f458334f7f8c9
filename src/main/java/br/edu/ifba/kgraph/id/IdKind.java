package br.edu.ifba.kgraph.id;

import org.jetbrains.annotations.NotNull;

/**
 * Hierarchy levels addressable by an identifier, with their wire codes.
 */
public enum IdKind {
    DOCUMENT("wrk", 0),
    SEGMENT("seg", 1),
    SENTENCE("sen", 2),
    ENTITY("ent", 3);

    private final String code;
    private final int level;

    IdKind(String code, int level) {
        this.code = code;
        this.level = level;
    }

    public String getCode() {
        return code;
    }

    /**
     * Nesting depth: document 0, segment 1, sentence 2, entity 3.
     */
    public int getLevel() {
        return level;
    }

    /**
     * Resolves a kind from its three-letter code.
     *
     * @param code the wire code, e.g. "sen"
     * @return matching kind
     * @throws IllegalArgumentException if no kind uses the code
     */
    @NotNull
    public static IdKind fromCode(@NotNull String code) {
        for (IdKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown identifier kind code: '" + code + "'");
    }
}
