package br.edu.ifba.kgraph.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

/**
 * Guesses the language of a document from the scripts its letters are written in.
 */
@ApplicationScoped
public class LanguageDetector {

    public static final String JAPANESE = "ja";
    public static final String ENGLISH = "en";
    public static final String UNDETERMINED = "und";

    /**
     * Result of language detection with confidence level.
     */
    public record DetectionResult(
        String language,
        double confidence  // share of letters in the winning script group
    ) {}

    /**
     * Detects the language by script majority: Han and kana count as Japanese,
     * Latin letters as English. Text without letters is undetermined.
     */
    @NotNull
    public DetectionResult detect(@NotNull String text) {
        long japanese = 0;
        long latin = 0;
        long otherLetters = 0;

        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (!Character.isLetter(cp)) {
                continue;
            }
            Character.UnicodeScript script = Character.UnicodeScript.of(cp);
            switch (script) {
                case HAN, HIRAGANA, KATAKANA -> japanese++;
                case LATIN -> latin++;
                default -> otherLetters++;
            }
        }

        long letters = japanese + latin + otherLetters;
        if (letters == 0) {
            return new DetectionResult(UNDETERMINED, 0.0);
        }
        if (japanese >= latin && japanese > otherLetters) {
            return new DetectionResult(JAPANESE, (double) japanese / letters);
        }
        if (latin > otherLetters) {
            return new DetectionResult(ENGLISH, (double) latin / letters);
        }
        return new DetectionResult(UNDETERMINED, (double) otherLetters / letters);
    }
}
