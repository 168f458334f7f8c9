package br.edu.ifba.kgraph.classify;

import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Marker-word density features computed directly from raw text.
 *
 * <p>Density is the number of distinct marker words present in the text,
 * divided by the text length in characters.</p>
 */
public final class LexicalFeatureAnalyzer {

    private static final Map<ConceptKey, List<String>> MARKERS = new EnumMap<>(ConceptKey.class);

    static {
        MARKERS.put(ConceptKey.TEMPORAL, List.of(
            "時", "日", "年", "今", "昔", "未来", "過去", "時間", "when", "time", "yesterday", "tomorrow"));
        MARKERS.put(ConceptKey.SPATIAL, List.of(
            "場所", "ここ", "そこ", "上", "下", "中", "外", "where", "place", "location", "here", "there"));
        MARKERS.put(ConceptKey.EMOTION, List.of(
            "嬉しい", "悲しい", "怒り", "喜び", "心", "感情", "happy", "sad", "angry", "joy", "emotion"));
    }

    private LexicalFeatureAnalyzer() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Computes marker densities.
     *
     * @param text raw text
     * @return density per concept key that has markers; all zero for empty text
     */
    @NotNull
    public static Map<ConceptKey, Double> densities(@NotNull String text) {
        Map<ConceptKey, Double> features = new EnumMap<>(ConceptKey.class);
        String lower = text.toLowerCase(Locale.ROOT);
        int length = lower.length();
        for (Map.Entry<ConceptKey, List<String>> entry : MARKERS.entrySet()) {
            if (length == 0) {
                features.put(entry.getKey(), 0.0);
                continue;
            }
            long present = entry.getValue().stream().filter(lower::contains).count();
            features.put(entry.getKey(), (double) present / length);
        }
        return features;
    }
}
