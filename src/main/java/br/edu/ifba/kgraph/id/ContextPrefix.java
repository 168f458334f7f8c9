package br.edu.ifba.kgraph.id;

import br.edu.ifba.kgraph.utils.HashUtil;
import org.jetbrains.annotations.NotNull;

/**
 * Derives the fixed-width identifier prefix from a parent context string.
 *
 * <p>The prefix is the leading hex digits of the MD5 of the context with letters
 * alternately upper- and lower-cased by position, e.g. {@code A1b2C3d4E5f6}.
 * Identical contexts always yield identical prefixes, so siblings are visually traceable.</p>
 */
public final class ContextPrefix {

    private ContextPrefix() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static String of(@NotNull String context, int length) {
        if (length < 1 || length > 32) {
            throw new IllegalArgumentException("prefix length must be in [1, 32], got: " + length);
        }
        String hex = HashUtil.md5Hex(context).substring(0, length);
        StringBuilder prefix = new StringBuilder(length);
        for (int i = 0; i < hex.length(); i++) {
            char c = hex.charAt(i);
            if (Character.isDigit(c)) {
                prefix.append(c);
            } else if (i % 2 == 0) {
                prefix.append(Character.toUpperCase(c));
            } else {
                prefix.append(c);
            }
        }
        return prefix.toString();
    }
}
