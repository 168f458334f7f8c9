package br.edu.ifba.kgraph.classify;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Output of classifier fusion for one piece of text.
 *
 * <p>Fallbacks are not failures. The flags let callers count them as a
 * quality signal.</p>
 *
 * @param ndc                  top NDC categories, best first
 * @param kindle               top Kindle genres, best first
 * @param conceptWeights       fused concept distribution
 * @param ndcUniform           no NDC keyword matched
 * @param kindleUniform        no Kindle keyword matched
 * @param conceptWeightsUniform every concept contribution was zero
 */
public record ClassificationResult(
    @NotNull List<CategoryScore> ndc,
    @NotNull List<CategoryScore> kindle,
    @NotNull ConceptWeights conceptWeights,
    boolean ndcUniform,
    boolean kindleUniform,
    boolean conceptWeightsUniform
) {

    public ClassificationResult {
        ndc = List.copyOf(ndc);
        kindle = List.copyOf(kindle);
        Objects.requireNonNull(conceptWeights, "conceptWeights must not be null");
    }

    public boolean hasFallback() {
        return ndcUniform || kindleUniform || conceptWeightsUniform;
    }
}
