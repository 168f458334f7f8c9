package br.edu.ifba.kgraph.classify;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable probability distribution over {@link ConceptKey}, in declaration order.
 *
 * <p>Weights are non-negative and sum to 1. Instances are only created through
 * {@link #normalize(Map)} and {@link #uniform()}, which enforce that.</p>
 */
public final class ConceptWeights {

    private static final int SIZE = ConceptKey.values().length;
    private static final ConceptWeights UNIFORM;

    static {
        double[] values = new double[SIZE];
        Arrays.fill(values, 1.0 / SIZE);
        UNIFORM = new ConceptWeights(values);
    }

    private final double[] weights;

    private ConceptWeights(double[] weights) {
        this.weights = weights;
    }

    /**
     * Every concept key weighted {@code 1/19}.
     */
    @NotNull
    public static ConceptWeights uniform() {
        return UNIFORM;
    }

    /**
     * Scales raw, non-negative contributions so they sum to 1.
     * Keys absent from the map count as zero. A zero total yields {@link #uniform()}.
     *
     * @param raw raw contribution per key
     * @return normalized distribution
     * @throws IllegalArgumentException on a negative or non-finite contribution
     */
    @NotNull
    public static ConceptWeights normalize(@NotNull Map<ConceptKey, Double> raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        double[] values = new double[SIZE];
        double total = 0.0;
        for (Map.Entry<ConceptKey, Double> entry : raw.entrySet()) {
            double value = entry.getValue() != null ? entry.getValue() : 0.0;
            if (value < 0.0 || !Double.isFinite(value)) {
                throw new IllegalArgumentException(
                    String.format("Contribution for '%s' must be finite and non-negative, got %f", entry.getKey(), value)
                );
            }
            values[entry.getKey().ordinal()] += value;
            total += value;
        }
        if (total <= 0.0) {
            return UNIFORM;
        }
        for (int i = 0; i < SIZE; i++) {
            values[i] = values[i] / total;
        }
        return new ConceptWeights(values);
    }

    public double get(@NotNull ConceptKey key) {
        return weights[key.ordinal()];
    }

    /**
     * Key with the highest weight; ties go to the earliest declared key.
     */
    @NotNull
    public ConceptKey dominantKey() {
        ConceptKey[] keys = ConceptKey.values();
        int best = 0;
        for (int i = 1; i < SIZE; i++) {
            if (weights[i] > weights[best]) {
                best = i;
            }
        }
        return keys[best];
    }

    public boolean isUniform() {
        return Arrays.equals(weights, UNIFORM.weights);
    }

    public double sum() {
        double total = 0.0;
        for (double w : weights) {
            total += w;
        }
        return total;
    }

    /**
     * Wire names in declaration order, parallel to {@link #values()}.
     */
    @NotNull
    public List<String> keys() {
        List<String> keys = new ArrayList<>(SIZE);
        for (ConceptKey key : ConceptKey.values()) {
            keys.add(key.getKey());
        }
        return keys;
    }

    /**
     * Weights in declaration order, parallel to {@link #keys()}.
     */
    @NotNull
    public List<Double> values() {
        List<Double> values = new ArrayList<>(SIZE);
        for (double w : weights) {
            values.add(w);
        }
        return values;
    }

    @NotNull
    public Map<ConceptKey, Double> asMap() {
        Map<ConceptKey, Double> map = new EnumMap<>(ConceptKey.class);
        for (ConceptKey key : ConceptKey.values()) {
            map.put(key, weights[key.ordinal()]);
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Ordered map keyed by wire name, as written to the document record.
     */
    @JsonValue
    @NotNull
    public Map<String, Double> toWireMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (ConceptKey key : ConceptKey.values()) {
            map.put(key.getKey(), weights[key.ordinal()]);
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(weights, ((ConceptWeights) o).weights);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return "ConceptWeights{dominant=" + dominantKey() + ", weights=" + toWireMap() + '}';
    }
}
