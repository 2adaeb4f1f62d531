package fun.fengwk.mph.core.service.matching;

/**
 * Components of a pairwise similarity score, each in [0, 1].
 *
 * @author fengwk
 */
public record SimilarityBreakdown(
    double fuzzy,
    double brand,
    double model,
    double storage,
    double color,
    double queryRelevance
) {

    static final double FUZZY_WEIGHT = 0.30;
    static final double BRAND_WEIGHT = 0.25;
    static final double MODEL_WEIGHT = 0.20;
    static final double STORAGE_WEIGHT = 0.10;
    static final double COLOR_WEIGHT = 0.05;
    static final double QUERY_RELEVANCE_WEIGHT = 0.10;

    /**
     * Weighted sum, weights add up to 1.
     */
    public double score() {
        double score = fuzzy * FUZZY_WEIGHT
            + brand * BRAND_WEIGHT
            + model * MODEL_WEIGHT
            + storage * STORAGE_WEIGHT
            + color * COLOR_WEIGHT
            + queryRelevance * QUERY_RELEVANCE_WEIGHT;
        return Math.max(0.0, Math.min(1.0, score));
    }

}
