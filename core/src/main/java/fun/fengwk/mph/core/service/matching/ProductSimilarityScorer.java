package fun.fengwk.mph.core.service.matching;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.xdrop.fuzzywuzzy.FuzzySearch;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Scores how alike two product names are, and how relevant a name is to the query.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductSimilarityScorer {

    private static final double UNKNOWN_BRAND = 0.5;
    private static final double UNKNOWN_MODEL = 0.5;
    private static final double UNKNOWN_STORAGE = 0.5;
    private static final double DIFFERENT_STORAGE = 0.3;
    private static final double UNKNOWN_COLOR = 0.8;
    private static final double DIFFERENT_COLOR = 0.6;
    private static final double NO_QUERY_RELEVANCE = 0.5;

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final FeatureExtractor featureExtractor;
    private final MatchingProperties matchingProperties;

    /**
     * Weighted similarity of two product names in the context of the query, in [0, 1].
     */
    public double similarity(String name1, String name2, String query) {
        SimilarityBreakdown breakdown = breakdown(name1, name2, query);
        double score = breakdown.score();
        log.debug("similarity scored, name1={}, name2={}, breakdown={}, score={}", name1, name2, breakdown, score);
        return score;
    }

    public SimilarityBreakdown breakdown(String name1, String name2, String query) {
        String product1 = name1 == null ? "" : name1;
        String product2 = name2 == null ? "" : name2;
        FeatureSet features1 = featureExtractor.extract(product1, query);
        FeatureSet features2 = featureExtractor.extract(product2, query);

        return new SimilarityBreakdown(
            ratio(FuzzySearch.tokenSortRatio(lower(product1), lower(product2))),
            compareBrands(features1.getBrand(), features2.getBrand()),
            compareModels(features1.getModel(), features2.getModel()),
            compareStorage(features1.getStorage(), features2.getStorage()),
            compareColors(features1.getColor(), features2.getColor()),
            queryRelevance(product1, product2, query)
        );
    }

    /**
     * Relevance of one product name to the query, in [0, 1].
     */
    public double relevance(String productName, String query) {
        if (StringUtils.isBlank(productName) || StringUtils.isBlank(query)) {
            return 0.0;
        }
        String product = clean(productName);
        String cleanQuery = clean(query);
        if (product.isEmpty() || cleanQuery.isEmpty()) {
            return 0.0;
        }
        double score = FuzzySearch.tokenSortRatio(product, cleanQuery) * 0.4
            + FuzzySearch.tokenSetRatio(product, cleanQuery) * 0.4
            + FuzzySearch.partialRatio(product, cleanQuery) * 0.2;
        return clamp(score / 100.0);
    }

    /**
     * Whether two offers describe the same product.
     *
     * <p>The name similarity threshold is raised when prices differ by more than the variance threshold, and the
     * prices themselves must stay within that variance.
     */
    public boolean isDuplicate(String name1, double price1, String name2, double price2, String query) {
        double gap = priceGap(price1, price2);
        double threshold = matchingProperties.getDuplicateThreshold();
        if (gap > matchingProperties.getPriceVarianceThreshold()) {
            threshold += matchingProperties.getThresholdPenalty();
        }
        if (1.0 - gap <= 1.0 - matchingProperties.getPriceVarianceThreshold()) {
            return false;
        }
        return similarity(name1, name2, query) >= threshold;
    }

    /**
     * {@code |a - b| / max(a, b)}, 0 when both are 0.
     */
    public static double priceGap(double price1, double price2) {
        double max = Math.max(price1, price2);
        if (max <= 0) {
            return 0.0;
        }
        return Math.abs(price1 - price2) / max;
    }

    private double compareBrands(String brand1, String brand2) {
        if (brand1 == null || brand2 == null) {
            return UNKNOWN_BRAND;
        }
        return brand1.equals(brand2) ? 1.0 : 0.0;
    }

    private double compareModels(String model1, String model2) {
        if (model1 == null || model2 == null) {
            return UNKNOWN_MODEL;
        }
        return ratio(FuzzySearch.ratio(lower(model1), lower(model2)));
    }

    private double compareStorage(String storage1, String storage2) {
        if (storage1 == null || storage2 == null) {
            return UNKNOWN_STORAGE;
        }
        return storage1.equals(storage2) ? 1.0 : DIFFERENT_STORAGE;
    }

    private double compareColors(String color1, String color2) {
        if (color1 == null || color2 == null) {
            return UNKNOWN_COLOR;
        }
        return Objects.equals(color1, color2) ? 1.0 : DIFFERENT_COLOR;
    }

    private double queryRelevance(String product1, String product2, String query) {
        if (StringUtils.isBlank(query)) {
            return NO_QUERY_RELEVANCE;
        }
        String lowerQuery = lower(query);
        return (partialRatio(lowerQuery, lower(product1)) + partialRatio(lowerQuery, lower(product2))) / 2.0;
    }

    private static double partialRatio(String text1, String text2) {
        // partialRatio has no defined value for empty input.
        if (StringUtils.isBlank(text1) || StringUtils.isBlank(text2)) {
            return 0.0;
        }
        return ratio(FuzzySearch.partialRatio(text1, text2));
    }

    private static String clean(String text) {
        String stripped = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    private static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    private static double ratio(int percent) {
        return clamp(percent / 100.0);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

}
