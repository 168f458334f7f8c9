package br.edu.ifba.kgraph.registry;

import br.edu.ifba.kgraph.core.IngestionConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Frequency-based salient term extraction.
 *
 * <p>Terms are script runs from {@link ScriptAwareTokenizer}. Hiragana runs are
 * never terms. Han runs need {@code min-cjk-term-length} characters; every other
 * run needs {@code min-term-length} characters and must not be a stopword.
 * Terms are ranked by frequency, ties by first occurrence.</p>
 */
@ApplicationScoped
public class KeywordExtractor {

    private final Set<String> stopwords;
    private final int minTermLength;
    private final int minCjkTermLength;

    @Inject
    public KeywordExtractor(IngestionConfig config) {
        this(config.extraction().stopwords(), config.extraction().minTermLength(), config.extraction().minCjkTermLength());
    }

    public KeywordExtractor(@NotNull Collection<String> stopwords, int minTermLength, int minCjkTermLength) {
        if (minTermLength < 1 || minCjkTermLength < 1) {
            throw new IllegalArgumentException("Minimum term lengths must be positive");
        }
        Set<String> folded = new HashSet<>();
        for (String stopword : stopwords) {
            folded.add(stopword.strip().toLowerCase(Locale.ROOT));
        }
        this.stopwords = Set.copyOf(folded);
        this.minTermLength = minTermLength;
        this.minCjkTermLength = minCjkTermLength;
    }

    /**
     * Extracts the most frequent salient terms.
     *
     * @param text  text to analyze
     * @param limit maximum number of terms
     * @return distinct terms, most frequent first
     */
    @NotNull
    public List<String> extract(@NotNull String text, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        // Insertion order doubles as first-occurrence order for tie breaking
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Token token : ScriptAwareTokenizer.tokenize(text)) {
            if (isSalient(token)) {
                counts.merge(token.text(), 1, Integer::sum);
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));

        List<String> terms = new ArrayList<>(Math.min(limit, ranked.size()));
        for (Map.Entry<String, Integer> entry : ranked) {
            if (terms.size() == limit) {
                break;
            }
            terms.add(entry.getKey());
        }
        return terms;
    }

    boolean isSalient(@NotNull Token token) {
        return switch (token.script()) {
            case HIRAGANA -> false;
            case HAN -> token.length() >= minCjkTermLength;
            default -> token.length() >= minTermLength && !stopwords.contains(token.text());
        };
    }
}
