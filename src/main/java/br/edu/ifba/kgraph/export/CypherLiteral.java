package br.edu.ifba.kgraph.export;

import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders Java values as Cypher literals, for {@code :param} lines of cypher-shell scripts.
 *
 * <p>Supported values: null, strings, numbers, booleans, enums, collections and
 * maps with string keys, nested arbitrarily.</p>
 */
public final class CypherLiteral {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private CypherLiteral() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Renders a value.
     *
     * @throws IllegalArgumentException for non-finite numbers and unsupported types
     */
    public static String render(@Nullable Object value) {
        StringBuilder out = new StringBuilder();
        append(out, value);
        return out.toString();
    }

    private static void append(StringBuilder out, Object value) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof String) {
            appendString(out, (String) value);
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                throw new IllegalArgumentException("Cypher has no literal for " + d);
            }
            out.append(Double.toString(d));
        } else if (value instanceof Number || value instanceof Boolean) {
            out.append(value);
        } else if (value instanceof Enum<?>) {
            appendString(out, value.toString());
        } else if (value instanceof Collection<?>) {
            out.append('[');
            Iterator<?> it = ((Collection<?>) value).iterator();
            while (it.hasNext()) {
                append(out, it.next());
                if (it.hasNext()) {
                    out.append(", ");
                }
            }
            out.append(']');
        } else if (value instanceof Map<?, ?>) {
            out.append('{');
            Iterator<? extends Map.Entry<?, ?>> it = ((Map<?, ?>) value).entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> entry = it.next();
                out.append(key(String.valueOf(entry.getKey()))).append(": ");
                append(out, entry.getValue());
                if (it.hasNext()) {
                    out.append(", ");
                }
            }
            out.append('}');
        } else {
            throw new IllegalArgumentException("Unsupported Cypher parameter type: " + value.getClass().getName());
        }
    }

    /**
     * Map key, backtick-quoted unless it is a plain identifier.
     */
    static String key(String key) {
        if (PLAIN_IDENTIFIER.matcher(key).matches()) {
            return key;
        }
        return "`" + key.replace("`", "``") + "`";
    }

    private static void appendString(StringBuilder out, String value) {
        out.append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\'' -> out.append("\\'");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        out.append('\'');
    }
}
