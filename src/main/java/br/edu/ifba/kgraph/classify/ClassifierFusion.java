package br.edu.ifba.kgraph.classify;

import br.edu.ifba.kgraph.core.IngestionConfig;
import br.edu.ifba.kgraph.registry.ScriptAwareTokenizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fuses the NDC and Kindle taxonomies and lexical features into one classification.
 *
 * <h2>Per taxonomy</h2>
 * <ol>
 *   <li>Count, per category, how many of its keywords occur in the text's token set</li>
 *   <li>Divide each count by the total; if the total is zero every category gets {@code 1/n}</li>
 *   <li>Rank by score, keeping declaration order on ties</li>
 * </ol>
 *
 * <h2>Concept weights</h2>
 * <p>The top category of each taxonomy adds its concept sub-distribution scaled by
 * its score. After a uniform fallback that is the first declared category at {@code 1/n}.
 * Marker-word densities from {@link LexicalFeatureAnalyzer} are added on top, and the
 * sum is normalized. An all-zero sum yields the uniform distribution.</p>
 *
 * <p>Fallbacks are logged at WARN for whole documents and at DEBUG for sentences
 * and entities, where short texts make them routine.</p>
 */
@ApplicationScoped
public class ClassifierFusion {

    private static final Logger logger = LoggerFactory.getLogger(ClassifierFusion.class);

    private final Taxonomy ndc;
    private final Taxonomy kindle;
    private final int topK;

    @Inject
    public ClassifierFusion(TaxonomyLoader loader, IngestionConfig config) {
        this(
            loader.load(config.classification().ndcResource()),
            loader.load(config.classification().kindleResource()),
            config.classification().topK()
        );
    }

    public ClassifierFusion(@NotNull Taxonomy ndc, @NotNull Taxonomy kindle, int topK) {
        this.ndc = Objects.requireNonNull(ndc, "ndc must not be null");
        this.kindle = Objects.requireNonNull(kindle, "kindle must not be null");
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive, got: " + topK);
        }
        this.topK = topK;
    }

    @NotNull
    public Taxonomy getNdc() {
        return ndc;
    }

    @NotNull
    public Taxonomy getKindle() {
        return kindle;
    }

    /**
     * Classifies a piece of text.
     *
     * @param text  raw text of a document, sentence or entity label
     * @param scope granularity, controls fallback log level
     * @return top categories of both taxonomies and fused concept weights
     */
    @NotNull
    public ClassificationResult classify(@NotNull String text, @NotNull ClassificationScope scope) {
        Set<String> tokens = ScriptAwareTokenizer.tokenSet(text);

        TaxonomyScores ndcScores = score(ndc, tokens);
        TaxonomyScores kindleScores = score(kindle, tokens);

        Map<ConceptKey, Double> raw = new EnumMap<>(ConceptKey.class);
        addTopCategory(raw, ndc, ndcScores);
        addTopCategory(raw, kindle, kindleScores);
        LexicalFeatureAnalyzer.densities(text).forEach((key, value) -> raw.merge(key, value, Double::sum));

        boolean zeroSum = raw.values().stream().mapToDouble(Double::doubleValue).sum() <= 0.0;
        ConceptWeights weights = ConceptWeights.normalize(raw);

        ClassificationResult result = new ClassificationResult(
            ndcScores.topK(topK),
            kindleScores.topK(topK),
            weights,
            ndcScores.uniform(),
            kindleScores.uniform(),
            zeroSum
        );
        reportFallbacks(result, scope, text.length());
        return result;
    }

    /**
     * Concept weights only. Used for sentences and entity labels.
     */
    @NotNull
    public ConceptWeights conceptWeights(@NotNull String text, @NotNull ClassificationScope scope) {
        return classify(text, scope).conceptWeights();
    }

    /**
     * Scores every category of a taxonomy against a token set.
     *
     * @param taxonomy table to score
     * @param tokens   case-folded token set
     * @return all categories ranked best first
     */
    @NotNull
    public TaxonomyScores score(@NotNull Taxonomy taxonomy, @NotNull Set<String> tokens) {
        List<TaxonomyCategory> categories = taxonomy.categories();
        int[] counts = new int[categories.size()];
        int total = 0;
        for (int i = 0; i < categories.size(); i++) {
            counts[i] = categories.get(i).countMatches(tokens);
            total += counts[i];
        }

        boolean uniform = total == 0;
        List<CategoryScore> scores = new ArrayList<>(categories.size());
        for (int i = 0; i < categories.size(); i++) {
            TaxonomyCategory category = categories.get(i);
            double score = uniform ? 1.0 / categories.size() : (double) counts[i] / total;
            scores.add(new CategoryScore(category.code(), category.name(), score, counts[i]));
        }

        // List.sort is stable: equal scores stay in declaration order
        scores.sort(Comparator.comparingDouble(CategoryScore::score).reversed());
        return new TaxonomyScores(taxonomy.name(), scores, uniform);
    }

    private void addTopCategory(Map<ConceptKey, Double> raw, Taxonomy taxonomy, TaxonomyScores scores) {
        CategoryScore top = scores.top();
        for (TaxonomyCategory category : taxonomy.categories()) {
            if (category.code().equals(top.code())) {
                category.conceptContribution()
                    .forEach((key, weight) -> raw.merge(key, weight * top.score(), Double::sum));
                return;
            }
        }
    }

    private void reportFallbacks(ClassificationResult result, ClassificationScope scope, int textLength) {
        if (!result.hasFallback()) {
            return;
        }
        if (scope == ClassificationScope.DOCUMENT) {
            logger.warn("Classification fallback for document text ({} chars): ndcUniform={}, kindleUniform={}, conceptWeightsUniform={}",
                textLength, result.ndcUniform(), result.kindleUniform(), result.conceptWeightsUniform());
        } else if (logger.isDebugEnabled()) {
            logger.debug("Classification fallback for {} text ({} chars): ndcUniform={}, kindleUniform={}, conceptWeightsUniform={}",
                scope.name().toLowerCase(), textLength, result.ndcUniform(), result.kindleUniform(), result.conceptWeightsUniform());
        }
    }
}
