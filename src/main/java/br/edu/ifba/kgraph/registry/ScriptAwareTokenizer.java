package br.edu.ifba.kgraph.registry;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into runs of a single script.
 *
 * <p>Japanese text has no spaces, so word boundaries are approximated by script
 * changes: {@code 猫が座った} becomes {@code 猫 | が | 座 | った}. Latin and other
 * alphabetic text is split on anything that is not a letter or digit.</p>
 */
public final class ScriptAwareTokenizer {

    private static final Pattern RUNS = Pattern.compile(
        "(\\p{IsHan}+)"
            + "|([\\p{IsKatakana}ー]+)"
            + "|(\\p{IsHiragana}+)"
            + "|([\\p{L}\\p{N}&&[^\\p{IsHan}\\p{IsHiragana}\\p{IsKatakana}ー]]+)"
    );

    private ScriptAwareTokenizer() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Tokenizes text into script runs, in order of appearance.
     */
    @NotNull
    public static List<Token> tokenize(@NotNull String text) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = RUNS.matcher(text);
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                tokens.add(new Token(matcher.group(1), Script.HAN));
            } else if (matcher.group(2) != null) {
                tokens.add(new Token(matcher.group(2), Script.KATAKANA));
            } else if (matcher.group(3) != null) {
                tokens.add(new Token(matcher.group(3), Script.HIRAGANA));
            } else {
                tokens.add(new Token(matcher.group(4).toLowerCase(Locale.ROOT), Script.ALPHANUMERIC));
            }
        }
        return tokens;
    }

    /**
     * Distinct token texts, used for keyword lookups.
     */
    @NotNull
    public static Set<String> tokenSet(@NotNull String text) {
        Set<String> set = new LinkedHashSet<>();
        for (Token token : tokenize(text)) {
            set.add(token.text());
        }
        return set;
    }
}
