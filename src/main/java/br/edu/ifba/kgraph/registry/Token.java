package br.edu.ifba.kgraph.registry;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A maximal run of characters of one script.
 *
 * @param text   the run, lower-cased for {@link Script#ALPHANUMERIC}
 * @param script writing system of the run
 */
public record Token(@NotNull String text, @NotNull Script script) {

    public Token {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(script, "script must not be null");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
    }

    /**
     * Length in code points.
     */
    public int length() {
        return text.codePointCount(0, text.length());
    }
}
